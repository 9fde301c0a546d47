package de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimap;
import de.uni_passau.fim.auermich.android_flows.core.dex.MethodReference;
import de.uni_passau.fim.auermich.android_flows.core.errors.Diagnostic;
import de.uni_passau.fim.auermich.android_flows.core.utility.CancellationToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jgrapht.Graph;
import org.jgrapht.GraphPath;
import org.jgrapht.alg.shortestpath.BFSShortestPath;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.EdgeReversedGraph;
import org.jgrapht.nio.AttributeType;
import org.jgrapht.nio.DefaultAttribute;
import org.jgrapht.nio.dot.DOTExporter;
import org.jgrapht.traverse.BreadthFirstIterator;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A call graph consists of vertices that represent methods and edges that describe method invocations. Methods
 * not defined in the APK appear as leaves. A call graph is immutable once built, concurrent queries need no
 * synchronisation. Recursion shows up as cycles, every search tracks the methods on its current path instead.
 */
public class CallGraph {

    private static final Logger LOGGER = LogManager.getLogger(CallGraph.class);

    private final Graph<MethodReference, CallEdge> graph;

    /**
     * All vertices sorted by their full signature, scanned by the substring searches.
     */
    private final List<MethodReference> searchIndex;

    private final Multimap<String, MethodReference> methodsByName;

    /**
     * The package prefixes of the callers that were processed, empty if the whole APK was processed.
     */
    private final List<String> packageFilter;

    private final List<Diagnostic> diagnostics;
    private final CallGraphStatistics statistics;

    CallGraph(Graph<MethodReference, CallEdge> graph, List<String> packageFilter, List<Diagnostic> diagnostics,
              int internalMethods, int processedMethods) {

        this.graph = new AsUnmodifiableGraph<>(graph);
        this.packageFilter = List.copyOf(packageFilter);
        this.diagnostics = List.copyOf(diagnostics);

        this.searchIndex = graph.vertexSet().stream().sorted().collect(Collectors.toUnmodifiableList());

        ImmutableListMultimap.Builder<String, MethodReference> byName = ImmutableListMultimap.builder();
        searchIndex.forEach(method -> byName.put(method.getMethodName(), method));
        this.methodsByName = byName.build();

        this.statistics = new CallGraphStatistics(graph.vertexSet().size(), graph.edgeSet().size(),
                internalMethods, processedMethods, !packageFilter.isEmpty());
    }

    /**
     * Returns a read-only view on the underlying graph.
     *
     * @return Returns the graph.
     */
    public Graph<MethodReference, CallEdge> getGraph() {
        return graph;
    }

    public Set<MethodReference> getMethods() {
        return graph.vertexSet();
    }

    public boolean containsMethod(MethodReference method) {
        return graph.containsVertex(method);
    }

    public Set<CallEdge> getOutgoingEdges(MethodReference method) {
        return graph.containsVertex(method) ? graph.outgoingEdgesOf(method) : Set.of();
    }

    public Set<CallEdge> getIncomingEdges(MethodReference method) {
        return graph.containsVertex(method) ? graph.incomingEdgesOf(method) : Set.of();
    }

    /**
     * Returns the methods invoked by the given method.
     *
     * @param method The calling method.
     * @return Returns the callees sorted by signature.
     */
    public List<MethodReference> getCallees(MethodReference method) {
        return getOutgoingEdges(method).stream().map(CallEdge::getTarget).sorted().collect(Collectors.toList());
    }

    /**
     * Returns the methods invoking the given method.
     *
     * @param method The called method.
     * @return Returns the callers sorted by signature.
     */
    public List<MethodReference> getCallers(MethodReference method) {
        return getIncomingEdges(method).stream().map(CallEdge::getSource).sorted().collect(Collectors.toList());
    }

    /**
     * Returns the methods whose full signature contains the given substring.
     *
     * @param substring The substring, e.g. {@code WebView.loadUrl(java.lang.String)}.
     * @return Returns the matching methods sorted by signature.
     */
    public List<MethodReference> findMethods(String substring) {
        return searchIndex.stream()
                .filter(method -> method.getFullSignature().contains(substring))
                .collect(Collectors.toList());
    }

    /**
     * Returns the methods whose qualified name ({@code class.method}) contains the given pattern.
     *
     * @param pattern The pattern, e.g. {@code WebView.loadUrl}.
     * @return Returns the matching methods sorted by signature.
     */
    public List<MethodReference> findMethodsByQualifiedName(String pattern) {
        return searchIndex.stream()
                .filter(method -> method.getQualifiedName().contains(pattern))
                .collect(Collectors.toList());
    }

    /**
     * Returns the methods with exactly the given name.
     *
     * @param methodName The method name.
     * @return Returns the matching methods sorted by signature.
     */
    public List<MethodReference> findMethodsByName(String methodName) {
        return List.copyOf(methodsByName.get(methodName));
    }

    public List<CallPath> findPaths(MethodReference source, MethodReference target, int maxDepth) {
        return findPaths(source, target, maxDepth, CancellationToken.NONE);
    }

    /**
     * Computes all simple paths (no method is visited twice) from the source to the target that consist of at
     * most {@code maxDepth} edges. The search only descends into methods from which the target is still
     * reachable within the remaining depth, thus it never drops a valid path.
     *
     * @param source The first method of each path.
     * @param target The last method of each path.
     * @param maxDepth The maximal number of edges of a path.
     * @param cancellation Polled once per expanded method.
     * @return Returns the paths sorted by length and then lexicographically by signature. The result is
     *         empty if no path exists within the depth bound.
     */
    public List<CallPath> findPaths(MethodReference source, MethodReference target, int maxDepth,
                                    CancellationToken cancellation) {

        if (maxDepth < 0 || !graph.containsVertex(source) || !graph.containsVertex(target)) {
            return new ArrayList<>();
        }

        if (source.equals(target)) {
            return new ArrayList<>(List.of(new CallPath(List.of(source))));
        }

        Map<MethodReference, Integer> distanceToTarget = distancesTo(target, maxDepth);

        if (!distanceToTarget.containsKey(source)) {
            return new ArrayList<>();
        }

        List<CallPath> paths = new ArrayList<>();
        LinkedHashSet<MethodReference> currentPath = new LinkedHashSet<>();
        currentPath.add(source);
        collectPaths(source, target, maxDepth, distanceToTarget, currentPath, paths, cancellation);

        Collections.sort(paths);
        return paths;
    }

    private void collectPaths(MethodReference current, MethodReference target, int maxDepth,
                              Map<MethodReference, Integer> distanceToTarget,
                              LinkedHashSet<MethodReference> currentPath, List<CallPath> paths,
                              CancellationToken cancellation) {

        cancellation.throwIfCancelled("Path search");

        if (current.equals(target)) {
            paths.add(new CallPath(new ArrayList<>(currentPath)));
            return;
        }

        // number of edges after stepping to a successor
        int length = currentPath.size();

        for (CallEdge edge : graph.outgoingEdgesOf(current)) {
            MethodReference next = edge.getTarget();
            Integer distance = distanceToTarget.get(next);
            if (distance == null || length + distance > maxDepth || currentPath.contains(next)) {
                continue;
            }
            currentPath.add(next);
            collectPaths(next, target, maxDepth, distanceToTarget, currentPath, paths, cancellation);
            currentPath.remove(next);
        }
    }

    /**
     * Computes the length of the shortest path from every method to the target, as long as it is at most
     * {@code maxDepth}, by a breadth first search over the reversed edges.
     */
    private Map<MethodReference, Integer> distancesTo(MethodReference target, int maxDepth) {

        Map<MethodReference, Integer> distances = new HashMap<>();
        var iterator = new BreadthFirstIterator<>(new EdgeReversedGraph<>(graph), target);

        while (iterator.hasNext()) {
            MethodReference method = iterator.next();
            int depth = iterator.getDepth(method);
            if (depth > maxDepth) {
                // breadth first order, all remaining methods are even further away
                break;
            }
            distances.put(method, depth);
        }
        return distances;
    }

    /**
     * Retrieves the shortest path between the given source and target method.
     *
     * @param source The source method.
     * @param target The target method.
     * @return Returns the shortest path between the given source and target method if such path exists.
     */
    public Optional<CallPath> getShortestPath(MethodReference source, MethodReference target) {

        if (!graph.containsVertex(source) || !graph.containsVertex(target)) {
            return Optional.empty();
        }

        GraphPath<MethodReference, CallEdge> path = BFSShortestPath.findPathBetween(graph, source, target);
        return Optional.ofNullable(path).map(p -> new CallPath(p.getVertexList()));
    }

    public CallGraphStatistics getStatistics() {
        return statistics;
    }

    public List<String> getPackageFilter() {
        return packageFilter;
    }

    public boolean isFiltered() {
        return !packageFilter.isEmpty();
    }

    /**
     * Returns the problems recorded while the graph was built, e.g. methods that couldn't be decoded.
     *
     * @return Returns an unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public void toDot(File output) {
        toDot(output, Set.of());
    }

    /**
     * Exports the call graph in the DOT format.
     *
     * @param output The output file.
     * @param methodsToHighlight The methods to be filled with a color.
     */
    public void toDot(File output, Set<MethodReference> methodsToHighlight) {

        LOGGER.debug("Exporting call graph with " + statistics.getTotalMethods() + " methods to " + output);

        DOTExporter<MethodReference, CallEdge> exporter =
                new DOTExporter<>(v -> '"' + v.getFullSignature().replace("\"", "\\\"") + '"');

        exporter.setVertexAttributeProvider(v -> {
            if (!methodsToHighlight.contains(v)) {
                return Map.of();
            } else {
                return Map.of(
                        "style", new DefaultAttribute<>("filled", AttributeType.STRING),
                        "fillcolor", new DefaultAttribute<>("red", AttributeType.STRING)
                );
            }
        });

        exporter.exportGraph(graph, output);
    }
}
