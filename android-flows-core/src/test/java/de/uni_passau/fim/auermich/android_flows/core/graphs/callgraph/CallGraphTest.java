package de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph;

import de.uni_passau.fim.auermich.android_flows.core.dex.MethodReference;
import de.uni_passau.fim.auermich.android_flows.core.utility.CancellationToken;
import org.jgrapht.Graph;
import org.jgrapht.graph.builder.GraphTypeBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

public class CallGraphTest {

    private static final MethodReference A = method("a");
    private static final MethodReference B = method("b");
    private static final MethodReference C = method("c");
    private static final MethodReference D = method("d");
    private static final MethodReference E = method("e");

    private CallGraph callGraph;

    private static MethodReference method(String name) {
        return new MethodReference("com.t.C", name, List.of(), "void");
    }

    /**
     * a -> a, a -> b, a -> c, b -> c, b -> d, c -> d, d -> b; e is isolated.
     */
    @BeforeEach
    void setUp() {
        Graph<MethodReference, CallEdge> graph = GraphTypeBuilder.<MethodReference, CallEdge>directed()
                .allowingSelfLoops(true)
                .allowingMultipleEdges(false)
                .buildGraph();

        List.of(A, B, C, D, E).forEach(graph::addVertex);
        graph.addEdge(A, A, new CallEdge(List.of(0)));
        graph.addEdge(A, B, new CallEdge(List.of(3)));
        graph.addEdge(A, C, new CallEdge(List.of(6, 9)));
        graph.addEdge(B, C, new CallEdge(List.of(0)));
        graph.addEdge(B, D, new CallEdge(List.of(3)));
        graph.addEdge(C, D, new CallEdge(List.of(0)));
        graph.addEdge(D, B, new CallEdge(List.of(0)));

        callGraph = new CallGraph(graph, List.of(), List.of(), 5, 5);
    }

    private static void assertSimpleAndBounded(List<CallPath> paths, MethodReference source, MethodReference target,
                                               int maxDepth) {
        for (CallPath path : paths) {
            assertEquals(source, path.getSource());
            assertEquals(target, path.getTarget());
            assertTrue(path.getLength() <= maxDepth);
            assertEquals(path.getMethods().size(), new HashSet<>(path.getMethods()).size(), path.toString());
        }
    }

    @DisplayName("Testing path enumeration.")
    @Test
    void testFindPaths() {
        List<CallPath> paths = callGraph.findPaths(A, D, 3);
        assertEquals(List.of(
                new CallPath(List.of(A, B, D)),
                new CallPath(List.of(A, C, D)),
                new CallPath(List.of(A, B, C, D))), paths);
        assertSimpleAndBounded(paths, A, D, 3);
    }

    @DisplayName("Testing that the paths are monotone in the depth bound.")
    @Test
    void testPathsMonotoneInDepth() {
        assertTrue(callGraph.findPaths(A, D, 1).isEmpty());
        for (int depth = 0; depth < 6; depth++) {
            List<CallPath> paths = callGraph.findPaths(A, D, depth);
            List<CallPath> deeperPaths = callGraph.findPaths(A, D, depth + 1);
            assertTrue(deeperPaths.containsAll(paths), "depth " + depth);
            assertSimpleAndBounded(deeperPaths, A, D, depth + 1);
        }
        assertEquals(2, callGraph.findPaths(A, D, 2).size());
    }

    @DisplayName("Testing that the result of the path search is stable.")
    @Test
    void testFindPathsIsStable() {
        List<CallPath> first = callGraph.findPaths(A, D, 5);
        for (int i = 0; i < 5; i++) {
            assertEquals(first, callGraph.findPaths(A, D, 5));
        }
    }

    @DisplayName("Testing path search through cycles.")
    @Test
    void testFindPathsWithCycle() {
        List<CallPath> paths = callGraph.findPaths(D, C, 10);
        assertEquals(List.of(new CallPath(List.of(D, B, C))), paths);
    }

    @DisplayName("Testing degenerate path searches.")
    @Test
    void testDegenerateSearches() {
        assertEquals(List.of(new CallPath(List.of(A))), callGraph.findPaths(A, A, 3));
        assertEquals(0, callGraph.findPaths(A, A, 3).get(0).getLength());
        assertTrue(callGraph.findPaths(A, D, -1).isEmpty());
        assertTrue(callGraph.findPaths(A, E, 10).isEmpty());
        assertTrue(callGraph.findPaths(A, method("unknown"), 10).isEmpty());
    }

    @DisplayName("Testing that a cancelled path search aborts.")
    @Test
    void testCancellation() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        assertThrows(CancellationException.class, () -> callGraph.findPaths(A, D, 3, token));
        assertThrows(UnsupportedOperationException.class, CancellationToken.NONE::cancel);
    }

    @DisplayName("Testing the shortest path.")
    @Test
    void testShortestPath() {
        Optional<CallPath> shortest = callGraph.getShortestPath(A, D);
        assertTrue(shortest.isPresent());
        assertEquals(2, shortest.get().getLength());
        assertTrue(callGraph.getShortestPath(D, A).isEmpty());
        assertTrue(callGraph.getShortestPath(A, method("unknown")).isEmpty());
    }

    @DisplayName("Testing callers and callees.")
    @Test
    void testCallersAndCallees() {
        assertEquals(List.of(A, B, C), callGraph.getCallees(A));
        assertEquals(List.of(B, C), callGraph.getCallers(D));
        assertEquals(List.of(), callGraph.getCallers(method("unknown")));
        assertEquals(List.of(6, 9), callGraph.getGraph().getEdge(A, C).getCallSites());
    }

    @DisplayName("Testing method search.")
    @Test
    void testFindMethods() {
        assertEquals(List.of(B), callGraph.findMethods("com.t.C.b()"));
        assertEquals(5, callGraph.findMethods("com.t.C").size());
        assertEquals(List.of(C), callGraph.findMethodsByName("c"));
        assertEquals(List.of(D), callGraph.findMethodsByQualifiedName("C.d"));
        assertTrue(callGraph.findMethodsByName("x").isEmpty());
    }

    @DisplayName("Testing the statistics.")
    @Test
    void testStatistics() {
        CallGraphStatistics statistics = callGraph.getStatistics();
        assertEquals(5, statistics.getTotalMethods());
        assertEquals(7, statistics.getTotalEdges());
        assertEquals(0, statistics.getExternalMethods());
        assertFalse(statistics.isFiltered());

        int outDegrees = callGraph.getMethods().stream().mapToInt(m -> callGraph.getOutgoingEdges(m).size()).sum();
        assertEquals(statistics.getTotalEdges(), outDegrees);
    }

    @DisplayName("Testing that the graph can't be modified.")
    @Test
    void testImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> callGraph.getGraph().addVertex(method("f")));
    }

    @DisplayName("Testing the DOT export.")
    @Test
    void testToDot(@TempDir Path tempDir) throws IOException {
        File output = tempDir.resolve("callgraph.dot").toFile();
        callGraph.toDot(output, Set.of(D));
        String dot = Files.readString(output.toPath(), StandardCharsets.UTF_8);
        assertTrue(dot.contains("digraph"));
        assertTrue(dot.contains("com.t.C.d(): void"));
        assertTrue(dot.contains("fillcolor"));
    }
}
