package com.osman.pdfmerger.core.assemble;

import com.osman.pdfmerger.core.model.DocumentSource;

import java.util.List;
import java.util.Objects;

/**
 * Result of the counting pass: the frozen total printed on every footer and the contribution each
 * input is expected to make. Immutable once built.
 */
public record AssemblyPlan(int totalPages, List<PlannedDocument> documents) {

    public enum Role {
        MAIN,
        TRIAL
    }

    /**
     * @param countedPages pages reported by the counter (0 when unreadable)
     * @param coverPages   1 for trials, 0 for the main report
     */
    public record PlannedDocument(DocumentSource source, Role role, int countedPages, int coverPages) {
        public PlannedDocument {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(role, "role");
        }

        public int expectedContribution() {
            return countedPages + coverPages;
        }
    }

    public AssemblyPlan {
        documents = List.copyOf(documents);
        int sum = documents.stream().mapToInt(PlannedDocument::expectedContribution).sum();
        if (sum != totalPages) {
            throw new IllegalArgumentException("totalPages " + totalPages + " does not match contributions " + sum);
        }
    }

    public PlannedDocument main() {
        return documents.get(0);
    }

    public List<PlannedDocument> trials() {
        return documents.subList(1, documents.size());
    }
}
