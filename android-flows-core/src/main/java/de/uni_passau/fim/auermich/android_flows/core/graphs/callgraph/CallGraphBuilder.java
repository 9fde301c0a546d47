package de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph;

import de.uni_passau.fim.auermich.android_flows.core.dex.ClassTable;
import de.uni_passau.fim.auermich.android_flows.core.dex.DexClass;
import de.uni_passau.fim.auermich.android_flows.core.dex.DexMethod;
import de.uni_passau.fim.auermich.android_flows.core.dex.MethodReference;
import de.uni_passau.fim.auermich.android_flows.core.dex.ReferenceTable;
import de.uni_passau.fim.auermich.android_flows.core.dex.instructions.Instruction;
import de.uni_passau.fim.auermich.android_flows.core.dex.instructions.InstructionDecoder;
import de.uni_passau.fim.auermich.android_flows.core.dex.instructions.MalformedBytecodeException;
import de.uni_passau.fim.auermich.android_flows.core.dex.instructions.ReferenceKind;
import de.uni_passau.fim.auermich.android_flows.core.errors.Diagnostic;
import de.uni_passau.fim.auermich.android_flows.core.errors.DiagnosticKind;
import de.uni_passau.fim.auermich.android_flows.core.utility.DexUtils;
import de.uni_passau.fim.auermich.android_flows.core.utility.Properties;
import de.uni_passau.fim.auermich.android_flows.core.utility.Tuple;
import de.uni_passau.fim.auermich.android_flows.core.utility.Utility;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jgrapht.Graph;
import org.jgrapht.graph.builder.GraphTypeBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the {@link CallGraph} of an APK from the invoke instructions of its methods.
 * <p>
 * With a package filter, only methods declared by classes within one of the packages are scanned for
 * invocations. Methods they invoke outside the filter still become (leaf) vertices. This bounds the cost by
 * the size of the app's own code instead of app plus libraries, at the price of missing paths that run
 * through filtered out code.
 */
public class CallGraphBuilder {

    private static final Logger LOGGER = LogManager.getLogger(CallGraphBuilder.class);

    private final ClassTable classTable;
    private final CallTargetResolver resolver;
    private final InstructionDecoder decoder = new InstructionDecoder();
    private List<String> packageFilter = List.of();
    private Properties properties = Properties.defaults();

    public CallGraphBuilder(ClassTable classTable) {
        this.classTable = classTable;
        this.resolver = new CallTargetResolver(classTable);
    }

    /**
     * Restricts the processed callers to the given package prefixes. An empty list processes every class.
     *
     * @param packageFilter The package prefixes, e.g. {@code com.example.app}.
     * @return Returns the builder.
     */
    public CallGraphBuilder withPackageFilter(List<String> packageFilter) {
        this.packageFilter = List.copyOf(packageFilter);
        return this;
    }

    public CallGraphBuilder withProperties(Properties properties) {
        this.properties = properties;
        return this;
    }

    /**
     * Builds the call graph sequentially.
     *
     * @return Returns the call graph.
     */
    public CallGraph build() {
        List<Tuple<Integer, DexMethod>> candidates = collectCandidates();
        LOGGER.info("Building call graph from " + candidates.size() + " methods.");
        return assemble(candidates, List.of(scan(candidates)));
    }

    /**
     * Builds the call graph on a worker pool. The candidate methods are split into contiguous chunks; each
     * worker scans its chunk into a private result, and the results are merged in chunk order once all workers
     * completed. The graph equals the one of {@link #build()}.
     *
     * @return Returns the call graph.
     */
    public CallGraph buildParallel() {
        List<Tuple<Integer, DexMethod>> candidates = collectCandidates();
        LOGGER.info("Building call graph from " + candidates.size() + " methods using "
                + properties.parallelism + " threads.");
        return assemble(candidates, Utility.processInPartitions(candidates, properties.partitions,
                properties.parallelism, this::scan));
    }

    /**
     * Collects the methods with bytecode whose class passes the package filter, paired with the index of the
     * dex file defining them.
     */
    private List<Tuple<Integer, DexMethod>> collectCandidates() {
        List<Tuple<Integer, DexMethod>> candidates = new ArrayList<>();
        for (DexClass dexClass : classTable.getClasses()) {
            if (!matchesFilter(dexClass.getClassName())) {
                continue;
            }
            for (DexMethod method : dexClass.getMethods()) {
                if (method.hasBytecode()) {
                    candidates.add(new Tuple<>(dexClass.getDexIndex(), method));
                }
            }
        }
        return candidates;
    }

    private boolean matchesFilter(String className) {
        return packageFilter.isEmpty()
                || packageFilter.stream().anyMatch(prefix -> DexUtils.matchesPackagePrefix(className, prefix));
    }

    /**
     * Scans the given methods for invocations. Writes only to the returned result.
     */
    private ScanResult scan(List<Tuple<Integer, DexMethod>> methods) {

        ScanResult result = new ScanResult();

        for (Tuple<Integer, DexMethod> candidate : methods) {

            DexMethod method = candidate.getY();
            MethodReference caller = method.toMethodReference();
            String location = caller.getFullSignature();
            ReferenceTable referenceTable = classTable.getReferenceTable(candidate.getX());

            List<Instruction> instructions;
            try {
                instructions = decoder.decode(method.getBytecode().orElseThrow(), location, result.diagnostics);
            } catch (MalformedBytecodeException e) {
                LOGGER.debug("Skipping method " + location + ": " + e.getMessage());
                result.diagnostics.add(new Diagnostic(DiagnosticKind.MALFORMED_METHOD, location, e.getMessage()));
                continue;
            }

            Map<MethodReference, List<Integer>> callees = new LinkedHashMap<>();

            for (Instruction instruction : instructions) {

                if (!instruction.isInvoke() || instruction.getReferenceKind() != ReferenceKind.METHOD) {
                    continue;
                }

                int methodIndex = instruction.getReferenceIndex().getAsInt();
                Optional<MethodReference> callee = referenceTable.findMethod(methodIndex);

                if (callee.isEmpty()) {
                    result.diagnostics.add(new Diagnostic(DiagnosticKind.UNRESOLVED_METHOD, location,
                            "Method index " + methodIndex + " out of range at code unit " + instruction.getAddress()));
                    continue;
                }

                callees.computeIfAbsent(resolver.normalize(callee.get()), c -> new ArrayList<>())
                        .add(instruction.getAddress());
            }

            result.calls.add(new Tuple<>(caller, callees));
        }

        return result;
    }

    /**
     * Merges the scan results into the graph. The results are visited in candidate order, hence vertices and
     * edges are inserted in the same order regardless of how the candidates were partitioned.
     */
    private CallGraph assemble(List<Tuple<Integer, DexMethod>> candidates, List<ScanResult> results) {

        Graph<MethodReference, CallEdge> graph = GraphTypeBuilder
                .<MethodReference, CallEdge>directed()
                .allowingSelfLoops(true)
                .allowingMultipleEdges(false)
                .buildGraph();

        List<Diagnostic> diagnostics = new ArrayList<>();

        for (ScanResult result : results) {
            diagnostics.addAll(result.diagnostics);
            for (Tuple<MethodReference, Map<MethodReference, List<Integer>>> call : result.calls) {
                MethodReference caller = call.getX();
                graph.addVertex(caller);
                call.getY().forEach((callee, callSites) -> {
                    graph.addVertex(callee);
                    graph.addEdge(caller, callee, new CallEdge(callSites));
                });
            }
        }

        int internalMethods = (int) graph.vertexSet().stream()
                .filter(method -> classTable.contains(method.getClassName()))
                .count();

        CallGraph callGraph = new CallGraph(graph, packageFilter, diagnostics, internalMethods, candidates.size());
        LOGGER.info("Call graph: " + callGraph.getStatistics() + ", " + diagnostics.size() + " diagnostics.");
        return callGraph;
    }

    /**
     * The invocations found by one worker.
     */
    private static class ScanResult {
        private final List<Tuple<MethodReference, Map<MethodReference, List<Integer>>>> calls = new ArrayList<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();
    }
}
