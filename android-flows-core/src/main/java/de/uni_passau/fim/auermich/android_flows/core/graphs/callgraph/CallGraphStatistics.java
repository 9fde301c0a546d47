package de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters maintained while a {@link CallGraph} is built.
 */
public class CallGraphStatistics {

    private final int totalMethods;
    private final int totalEdges;
    private final int internalMethods;
    private final int processedMethods;
    private final boolean filtered;

    public CallGraphStatistics(int totalMethods, int totalEdges, int internalMethods, int processedMethods,
                               boolean filtered) {
        this.totalMethods = totalMethods;
        this.totalEdges = totalEdges;
        this.internalMethods = internalMethods;
        this.processedMethods = processedMethods;
        this.filtered = filtered;
    }

    public int getTotalMethods() {
        return totalMethods;
    }

    public int getTotalEdges() {
        return totalEdges;
    }

    /**
     * Returns the number of vertices whose class is defined in the APK.
     *
     * @return Returns the number of internal methods.
     */
    public int getInternalMethods() {
        return internalMethods;
    }

    /**
     * Returns the number of vertices that are framework or library methods not contained in the APK.
     *
     * @return Returns the number of external methods.
     */
    public int getExternalMethods() {
        return totalMethods - internalMethods;
    }

    /**
     * Returns the number of methods whose bytecode was scanned for invocations.
     *
     * @return Returns the number of processed methods.
     */
    public int getProcessedMethods() {
        return processedMethods;
    }

    public boolean isFiltered() {
        return filtered;
    }

    public Map<String, Integer> toMap() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("totalMethods", totalMethods);
        map.put("totalEdges", totalEdges);
        map.put("internalMethods", internalMethods);
        map.put("externalMethods", getExternalMethods());
        map.put("processedMethods", processedMethods);
        return map;
    }

    @Override
    public String toString() {
        return "CallGraphStatistics" + toMap() + (filtered ? " (filtered)" : "");
    }
}
