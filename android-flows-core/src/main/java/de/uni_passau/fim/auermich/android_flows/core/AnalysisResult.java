package de.uni_passau.fim.auermich.android_flows.core;

import de.uni_passau.fim.auermich.android_flows.core.errors.Diagnostic;

import java.util.List;

/**
 * The results of an analysis together with the non-fatal problems met while computing them.
 *
 * @param <T> The result type.
 */
public class AnalysisResult<T> {

    private final List<T> results;
    private final List<Diagnostic> diagnostics;

    public AnalysisResult(List<T> results, List<Diagnostic> diagnostics) {
        this.results = List.copyOf(results);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<T> getResults() {
        return results;
    }

    /**
     * Returns the problems that didn't stop the analysis, e.g. methods whose bytecode couldn't be decoded.
     * These methods are missing from the call graph, thus flows through them may be missing as well.
     *
     * @return Returns an unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    @Override
    public String toString() {
        return "AnalysisResult{" + results.size() + " results, " + diagnostics.size() + " diagnostics}";
    }
}
