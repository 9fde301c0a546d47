package de.uni_passau.fim.auermich.android_flows.core.flows;

import de.uni_passau.fim.auermich.android_flows.core.dex.MethodReference;
import de.uni_passau.fim.auermich.android_flows.core.entrypoints.EntryPoint;
import de.uni_passau.fim.auermich.android_flows.core.errors.Diagnostic;
import de.uni_passau.fim.auermich.android_flows.core.entrypoints.EntryPointAnalyzer;
import de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph.CallGraph;
import de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph.CallPath;
import de.uni_passau.fim.auermich.android_flows.core.resources.ResourceResolver;
import de.uni_passau.fim.auermich.android_flows.core.utility.CancellationToken;
import de.uni_passau.fim.auermich.android_flows.core.utility.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Finds call paths from the entry points of an APK to sink methods and estimates for each of them whether
 * Intent data reaches the sink.
 */
public class DataFlowAnalyzer {

    private static final Logger LOGGER = LogManager.getLogger(DataFlowAnalyzer.class);

    private final EntryPointAnalyzer entryPointAnalyzer;
    private final CallGraph callGraph;
    private final Properties properties;

    /**
     * Optional, without a resolver string resources passed to a sink are not recognized as constants.
     */
    private final ResourceResolver resourceResolver;

    /**
     * The decoding problems met by the taint analysis, duplicates of the call graph's diagnostics included.
     */
    private final Set<Diagnostic> taintDiagnostics = new LinkedHashSet<>();

    public DataFlowAnalyzer(EntryPointAnalyzer entryPointAnalyzer, CallGraph callGraph) {
        this(entryPointAnalyzer, callGraph, Properties.defaults(), null);
    }

    public DataFlowAnalyzer(EntryPointAnalyzer entryPointAnalyzer, CallGraph callGraph, Properties properties,
                            ResourceResolver resourceResolver) {
        this.entryPointAnalyzer = entryPointAnalyzer;
        this.callGraph = callGraph;
        this.properties = properties;
        this.resourceResolver = resourceResolver;
    }

    /**
     * Returns the methods of the call graph whose qualified name contains any of the given patterns.
     *
     * @param sinkPatterns The sink patterns, e.g. {@code WebView.loadUrl}.
     * @return Returns the distinct sink methods sorted by signature.
     */
    public List<MethodReference> findSinkMethods(List<String> sinkPatterns) {
        Set<MethodReference> sinks = new TreeSet<>();
        for (String pattern : sinkPatterns) {
            sinks.addAll(callGraph.findMethodsByQualifiedName(pattern));
        }
        return new ArrayList<>(sinks);
    }

    public List<Flow> findFlowsTo(List<String> sinkPatterns, int maxDepth) {
        return findFlowsTo(sinkPatterns, maxDepth, CancellationToken.NONE);
    }

    /**
     * Searches for each entry point whose class is part of the APK the call paths from its lifecycle methods to
     * the methods matching the sink patterns.
     *
     * @param sinkPatterns The sink patterns.
     * @param maxDepth The maximal number of edges of a path.
     * @param cancellation Polled before each (entry point, sink) search and within the path search.
     * @return Returns one flow per (entry point, sink) pair with at least one path, ordered by entry point
     *         declaration and sink signature.
     */
    public List<Flow> findFlowsTo(List<String> sinkPatterns, int maxDepth, CancellationToken cancellation) {

        List<Flow> flows = new ArrayList<>();
        List<MethodReference> sinks = findSinkMethods(sinkPatterns);

        if (sinks.isEmpty()) {
            LOGGER.debug("No sink method matches " + sinkPatterns);
            return flows;
        }

        for (EntryPoint entryPoint : entryPointAnalyzer.analyze()) {

            if (!entryPoint.isClassFound()) {
                continue;
            }

            List<MethodReference> lifecycleMethods = LifecycleMethods.resolve(entryPoint.getComponentType(),
                    entryPoint.getClassName(), entryPointAnalyzer.getClassTable(), callGraph,
                    properties.resolveInheritedLifecycleMethods);

            if (lifecycleMethods.isEmpty()) {
                LOGGER.debug("No lifecycle method of " + entryPoint.getClassName() + " in the call graph.");
                continue;
            }

            for (MethodReference sink : sinks) {

                cancellation.throwIfCancelled("Flow search");

                Set<CallPath> paths = new TreeSet<>();
                for (MethodReference lifecycleMethod : lifecycleMethods) {
                    paths.addAll(callGraph.findPaths(lifecycleMethod, sink, maxDepth, cancellation));
                }

                if (!paths.isEmpty()) {
                    flows.add(new Flow(entryPoint, lifecycleMethods, sink, new ArrayList<>(paths)));
                }
            }
        }

        LOGGER.info("Found " + flows.size() + " flows to " + sinks.size() + " sink methods.");
        return flows;
    }

    public List<Flow> findFlows(SinkCategory category, int maxDepth) {
        return findFlowsTo(category.getPatterns(), maxDepth);
    }

    public List<Flow> findWebviewFlows(int maxDepth) {
        return findFlows(SinkCategory.WEBVIEW, maxDepth);
    }

    public List<Flow> findFileFlows(int maxDepth) {
        return findFlows(SinkCategory.FILE, maxDepth);
    }

    public List<Flow> findNetworkFlows(int maxDepth) {
        return findFlows(SinkCategory.NETWORK, maxDepth);
    }

    public List<Flow> findSqlFlows(int maxDepth) {
        return findFlows(SinkCategory.SQL, maxDepth);
    }

    /**
     * Finds the flows that start at a deeplink handler.
     *
     * @param sinkPatterns The sink patterns.
     * @param maxDepth The maximal number of edges of a path.
     * @return Returns the flows of deeplink handlers.
     */
    public List<Flow> findDeeplinkFlows(List<String> sinkPatterns, int maxDepth) {
        return findFlowsTo(sinkPatterns, maxDepth).stream()
                .filter(Flow::isDeeplinkHandler)
                .collect(Collectors.toList());
    }

    /**
     * Runs the Intent taint analysis on every path of the given flows and scores the paths. For each flow, the
     * path with the highest confidence is reported; among equally scored paths the first one (i.e. the shortest)
     * is taken. The result only depends on the flows, thus it is identical across runs.
     *
     * @param flows The flows to be analysed.
     * @return Returns one data flow per flow, in the order of the flows.
     */
    public List<DataFlow> analyzeDataFlows(List<Flow> flows) {

        IntentTaintAnalysis taintAnalysis = new IntentTaintAnalysis(entryPointAnalyzer.getClassTable(),
                resourceResolver);
        List<DataFlow> dataFlows = new ArrayList<>(flows.size());

        for (Flow flow : flows) {

            DataFlow best = null;

            for (CallPath path : flow.getPaths()) {

                IntentTaintAnalysis.Result result = taintAnalysis.analyze(path);
                double confidence = ConfidenceScorer.score(result.getEvidence(), path.getLength(),
                        flow.isDeeplinkHandler(), result.isConstantSinkArgument());

                if (best == null || confidence > best.getConfidence()) {
                    best = new DataFlow(flow, path, result.getSource().orElse(null), result.getEvidence(),
                            result.isConstantSinkArgument(), confidence);
                }
            }

            LOGGER.debug(best);
            dataFlows.add(best);
        }

        taintDiagnostics.addAll(taintAnalysis.getDiagnostics());

        LOGGER.info("Analysed " + dataFlows.size() + " flows, "
                + dataFlows.stream().filter(f -> f.getConfidenceLevel() == ConfidenceLevel.HIGH).count()
                + " with high confidence.");
        return dataFlows;
    }

    /**
     * Summarises the entry points and the call graph the analysis works on.
     *
     * @return Returns counters keyed by name, in a stable order.
     */
    public Map<String, Integer> getStatistics() {
        Map<String, Integer> statistics = new LinkedHashMap<>();
        Map<String, Integer> entryPoints = entryPointAnalyzer.getStatistics();
        statistics.put("entryPoints", entryPoints.get("entryPoints"));
        statistics.put("deeplinkHandlers", entryPoints.get("deeplinkHandlers"));
        statistics.put("classesFound", entryPoints.get("classesFound"));
        statistics.put("methods", callGraph.getStatistics().getTotalMethods());
        statistics.put("edges", callGraph.getStatistics().getTotalEdges());
        return statistics;
    }

    /**
     * Returns the non-fatal problems of all stages the analysis builds on: class extraction, call graph
     * construction and the taint analyses run so far. A problem reported by several stages is listed once.
     *
     * @return Returns the diagnostics in stage order.
     */
    public List<Diagnostic> getDiagnostics() {
        Set<Diagnostic> diagnostics = new LinkedHashSet<>(entryPointAnalyzer.getClassTable().getDiagnostics());
        diagnostics.addAll(callGraph.getDiagnostics());
        diagnostics.addAll(taintDiagnostics);
        return new ArrayList<>(diagnostics);
    }

    public CallGraph getCallGraph() {
        return callGraph;
    }

    public EntryPointAnalyzer getEntryPointAnalyzer() {
        return entryPointAnalyzer;
    }
}
