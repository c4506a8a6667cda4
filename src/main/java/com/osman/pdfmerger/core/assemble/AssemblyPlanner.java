package com.osman.pdfmerger.core.assemble;

import com.osman.pdfmerger.core.assemble.AssemblyPlan.PlannedDocument;
import com.osman.pdfmerger.core.assemble.AssemblyPlan.Role;
import com.osman.pdfmerger.core.model.DocumentSource;
import com.osman.pdfmerger.core.pdf.PageCounter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * First pass of a run: counts every input and fixes the output total before anything is emitted.
 * Each trial contributes its own pages plus one cover page.
 */
public class AssemblyPlanner {

    private final PageCounter counter;
    private final int countThreads;

    public AssemblyPlanner(PageCounter counter, int countThreads) {
        this.counter = Objects.requireNonNull(counter, "counter");
        this.countThreads = Math.max(1, countThreads);
    }

    public AssemblyPlan plan(DocumentSource main, List<DocumentSource> trials) {
        List<DocumentSource> all = new ArrayList<>(trials.size() + 1);
        all.add(main);
        all.addAll(trials);

        List<Integer> counts = counter.countAll(all, countThreads);

        List<PlannedDocument> planned = new ArrayList<>(all.size());
        int total = counts.get(0);
        planned.add(new PlannedDocument(main, Role.MAIN, counts.get(0), 0));
        for (int i = 0; i < trials.size(); i++) {
            int pages = counts.get(i + 1);
            planned.add(new PlannedDocument(trials.get(i), Role.TRIAL, pages, 1));
            total += pages + 1;
        }
        return new AssemblyPlan(total, planned);
    }
}
