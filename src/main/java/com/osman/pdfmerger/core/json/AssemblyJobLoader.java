package com.osman.pdfmerger.core.json;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a merge job description:
 * <pre>
 * {
 *   "main": "report.pdf",
 *   "trials": ["trial-a.pdf", "trial-b.pdf"],
 *   "reportTitle": "Study 42",
 *   "output": "report_WithCovers.pdf"
 * }
 * </pre>
 * Relative paths are resolved against the job file's directory.
 */
public final class AssemblyJobLoader {
    private AssemblyJobLoader() {
    }

    public static AssemblyJob load(Path jobFile) throws IOException {
        if (jobFile == null || !Files.isRegularFile(jobFile)) {
            throw new IOException("Job file not found: " + jobFile);
        }
        Path baseDir = jobFile.toAbsolutePath().getParent();
        try {
            return parse(new JSONObject(Files.readString(jobFile)), baseDir);
        } catch (JSONException ex) {
            throw new IOException("Malformed job file " + jobFile + ": " + ex.getMessage(), ex);
        }
    }

    static AssemblyJob parse(JSONObject root, Path baseDir) throws IOException {
        String main = root.optString("main");
        if (main.isBlank()) {
            throw new IOException("Job is missing 'main' field.");
        }

        List<Path> trials = new ArrayList<>();
        JSONArray array = root.optJSONArray("trials");
        if (array != null) {
            for (int i = 0; i < array.length(); i++) {
                String trial = array.optString(i, "");
                if (trial.isBlank()) {
                    throw new IOException("Job has an empty entry at trials[" + i + "].");
                }
                trials.add(resolve(baseDir, trial));
            }
        }

        String reportTitle = root.optString("reportTitle", null);
        String output = root.optString("output", null);
        return new AssemblyJob(
            resolve(baseDir, main),
            trials,
            reportTitle,
            output == null || output.isBlank() ? null : resolve(baseDir, output)
        );
    }

    private static Path resolve(Path baseDir, String value) {
        Path path = Path.of(value.trim());
        return path.isAbsolute() || baseDir == null ? path : baseDir.resolve(path).normalize();
    }
}
