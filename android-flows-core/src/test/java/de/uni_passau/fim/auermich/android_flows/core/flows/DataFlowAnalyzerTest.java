package de.uni_passau.fim.auermich.android_flows.core.flows;

import de.uni_passau.fim.auermich.android_flows.core.SyntheticApp;
import de.uni_passau.fim.auermich.android_flows.core.app.components.ComponentType;
import de.uni_passau.fim.auermich.android_flows.core.app.xml.Manifest;
import de.uni_passau.fim.auermich.android_flows.core.app.xml.ManifestComponent;
import de.uni_passau.fim.auermich.android_flows.core.dex.ClassTable;
import de.uni_passau.fim.auermich.android_flows.core.dex.DexClass;
import de.uni_passau.fim.auermich.android_flows.core.dex.DexMethod;
import de.uni_passau.fim.auermich.android_flows.core.dex.MethodReference;
import de.uni_passau.fim.auermich.android_flows.core.dex.ReferenceTable;
import de.uni_passau.fim.auermich.android_flows.core.entrypoints.EntryPointAnalyzer;
import de.uni_passau.fim.auermich.android_flows.core.errors.Diagnostic;
import de.uni_passau.fim.auermich.android_flows.core.errors.DiagnosticKind;
import de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph.CallGraph;
import de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph.CallGraphBuilder;
import de.uni_passau.fim.auermich.android_flows.core.resources.ResourceResolver;
import de.uni_passau.fim.auermich.android_flows.core.utility.CancellationToken;
import de.uni_passau.fim.auermich.android_flows.core.utility.Properties;
import org.jf.dexlib2.AccessFlags;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class DataFlowAnalyzerTest {

    private static final double DELTA = 1e-9;

    private static final String RESOURCE_ACTIVITY = "com.x.ResourceActivity";
    private static final int URL_RESOURCE_ID = 0x7f0e0001;

    private static final MethodReference GET_STRING =
            new MethodReference("android.app.Activity", "getString", List.of("int"), "java.lang.String");

    private static DataFlowAnalyzer analyzer(ClassTable classTable, Manifest manifest) {
        CallGraph callGraph = new CallGraphBuilder(classTable).build();
        return new DataFlowAnalyzer(new EntryPointAnalyzer(manifest, classTable), callGraph);
    }

    private static DataFlowAnalyzer syntheticAnalyzer() {
        return analyzer(SyntheticApp.classTable(), SyntheticApp.manifest());
    }

    @DisplayName("Testing the flow of an activity invoking loadUrl through a helper method.")
    @Test
    void testSingleFlow() {

        ClassTable classTable = new ClassTable(List.of(SyntheticApp.mainActivity()),
                List.of(new ReferenceTable(0, SyntheticApp.METHOD_TABLE, SyntheticApp.FIELD_TABLE,
                        SyntheticApp.STRING_TABLE)), List.of());
        Manifest manifest = new Manifest(SyntheticApp.PACKAGE, List.of(new ManifestComponent(
                SyntheticApp.MAIN_ACTIVITY, ComponentType.ACTIVITY, true, List.of())));

        List<Flow> flows = analyzer(classTable, manifest).findWebviewFlows(10);

        assertEquals(1, flows.size());
        Flow flow = flows.get(0);
        assertEquals(SyntheticApp.MAIN_ACTIVITY, flow.getEntryPointClass());
        assertEquals(ComponentType.ACTIVITY, flow.getComponentType());
        assertEquals(SyntheticApp.LOAD_URL, flow.getSink());
        assertEquals(List.of(SyntheticApp.MAIN_ON_CREATE), flow.getLifecycleMethods());
        assertEquals(1, flow.getPathCount());
        assertEquals(2, flow.getMinPathLength());
        assertEquals(List.of(SyntheticApp.MAIN_ON_CREATE, SyntheticApp.MAIN_B, SyntheticApp.LOAD_URL),
                flow.getShortestPath().getMethods());
        assertFalse(flow.isDeeplinkHandler());
    }

    @DisplayName("Testing that the depth bound cuts off longer paths.")
    @Test
    void testDepthBound() {
        assertTrue(syntheticAnalyzer().findWebviewFlows(1).isEmpty());
        assertEquals(2, syntheticAnalyzer().findWebviewFlows(2).size());
    }

    @DisplayName("Testing that components without class and unmatched sinks yield no flows.")
    @Test
    void testNoFlows() {
        DataFlowAnalyzer analyzer = syntheticAnalyzer();
        assertTrue(analyzer.findSqlFlows(10).isEmpty());
        assertTrue(analyzer.findFileFlows(10).isEmpty());
        assertTrue(analyzer.findNetworkFlows(10).isEmpty());
        assertTrue(analyzer.findFlowsTo(List.of("DoesNot.exist"), 10).isEmpty());

        assertTrue(analyzer.findWebviewFlows(10).stream()
                .noneMatch(flow -> flow.getEntryPointClass().equals("com.x.MissingService")));
    }

    @DisplayName("Testing the sink lookup by qualified name.")
    @Test
    void testFindSinkMethods() {
        DataFlowAnalyzer analyzer = syntheticAnalyzer();
        assertEquals(List.of(SyntheticApp.LOAD_URL), analyzer.findSinkMethods(SinkCategory.WEBVIEW.getPatterns()));
        assertEquals(List.of(SyntheticApp.GET_INTENT, SyntheticApp.LOAD_URL),
                analyzer.findSinkMethods(List.of("WebView.loadUrl", "Activity.getIntent", "WebView.loadUrl")));
    }

    @DisplayName("Testing the confidence of a constant URL and of Intent data reaching loadUrl.")
    @Test
    void testDataFlows() {

        DataFlowAnalyzer analyzer = syntheticAnalyzer();
        List<Flow> flows = analyzer.findWebviewFlows(10);
        assertEquals(List.of(SyntheticApp.MAIN_ACTIVITY, SyntheticApp.DEEPLINK_ACTIVITY),
                flows.stream().map(Flow::getEntryPointClass).collect(Collectors.toList()));

        List<DataFlow> dataFlows = analyzer.analyzeDataFlows(flows);
        assertEquals(2, dataFlows.size());

        DataFlow main = dataFlows.get(0);
        assertSame(flows.get(0), main.getFlow());
        assertEquals(TaintEvidence.NONE, main.getEvidence());
        assertTrue(main.isConstantSinkArgument());
        assertEquals(Optional.empty(), main.getSource());
        assertEquals(0.2, main.getConfidence(), DELTA);
        assertEquals(ConfidenceLevel.LOW, main.getConfidenceLevel());

        DataFlow deeplink = dataFlows.get(1);
        assertTrue(deeplink.getFlow().isDeeplinkHandler());
        assertEquals(SyntheticApp.LOAD_URL, deeplink.getSink());
        assertEquals(List.of(SyntheticApp.DEEPLINK_ON_CREATE, SyntheticApp.DEEPLINK_OPEN, SyntheticApp.LOAD_URL),
                deeplink.getPath().getMethods());
        assertEquals(TaintEvidence.SINK_ARGUMENT, deeplink.getEvidence());
        assertFalse(deeplink.isConstantSinkArgument());
        assertEquals(Optional.of(SyntheticApp.GET_STRING_EXTRA), deeplink.getSource());
        assertEquals(0.95, deeplink.getConfidence(), DELTA);
        assertEquals(ConfidenceLevel.HIGH, deeplink.getConfidenceLevel());
    }

    @DisplayName("Testing that only deeplink handlers are reported as deeplink flows.")
    @Test
    void testDeeplinkFlows() {
        List<Flow> flows = syntheticAnalyzer().findDeeplinkFlows(SinkCategory.WEBVIEW.getPatterns(), 10);
        assertEquals(1, flows.size());
        assertEquals(SyntheticApp.DEEPLINK_ACTIVITY, flows.get(0).getEntryPointClass());
    }

    @DisplayName("Testing that sequential and parallel call graphs yield the same data flows.")
    @Test
    void testDeterminism() {

        ClassTable classTable = SyntheticApp.classTable();
        EntryPointAnalyzer entryPoints = new EntryPointAnalyzer(SyntheticApp.manifest(), classTable);
        Properties properties = new Properties(4, 16, true);

        DataFlowAnalyzer sequential = new DataFlowAnalyzer(entryPoints, new CallGraphBuilder(classTable).build(),
                properties, null);
        DataFlowAnalyzer parallel = new DataFlowAnalyzer(entryPoints,
                new CallGraphBuilder(classTable).withProperties(properties).buildParallel(), properties, null);

        List<String> first = describe(sequential);
        for (int run = 0; run < 3; run++) {
            assertEquals(first, describe(parallel));
            assertEquals(first, describe(sequential));
        }
    }

    private static List<String> describe(DataFlowAnalyzer analyzer) {
        List<String> description = new ArrayList<>();
        for (DataFlow dataFlow : analyzer.analyzeDataFlows(analyzer.findWebviewFlows(10))) {
            description.add(dataFlow.getFlow().getPaths() + " " + dataFlow.getPath() + " " + dataFlow.getEvidence()
                    + " " + dataFlow.getConfidence());
        }
        return description;
    }

    @DisplayName("Testing that a cancelled search aborts.")
    @Test
    void testCancellation() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        assertThrows(CancellationException.class,
                () -> syntheticAnalyzer().findFlowsTo(SinkCategory.WEBVIEW.getPatterns(), 10, token));
    }

    @DisplayName("Testing the statistics.")
    @Test
    void testStatistics() {
        Map<String, Integer> statistics = syntheticAnalyzer().getStatistics();
        assertEquals(List.of("entryPoints", "deeplinkHandlers", "classesFound", "methods", "edges"),
                new ArrayList<>(statistics.keySet()));
        assertEquals(3, statistics.get("entryPoints"));
        assertEquals(1, statistics.get("deeplinkHandlers"));
        assertEquals(2, statistics.get("classesFound"));
        assertEquals(7, statistics.get("methods"));
        assertEquals(6, statistics.get("edges"));
    }

    /**
     * ResourceActivity.onCreate(Bundle) passes {@code getString(R.string.url)} to loadUrl.
     */
    private static DataFlowAnalyzer resourceAnalyzer(ResourceResolver resourceResolver) {

        DexMethod onCreate = new DexMethod(RESOURCE_ACTIVITY, "onCreate", List.of("android.os.Bundle"), "void",
                AccessFlags.PROTECTED.getValue(), 4, new short[]{
                0x0114, 0x0001, 0x7f0e,     // const v1, #0x7f0e0001
                0x206e, 0x0006, 0x0012,     // invoke-virtual {v2, v1}, method@6 (getString)
                0x000c,                     // move-result-object v0
                0x206e, 0x0002, 0x0003,     // invoke-virtual {v3, v0}, method@2 (loadUrl)
                0x000e                      // return-void
        });
        DexClass activity = new DexClass(RESOURCE_ACTIVITY, "android.app.Activity", Set.of(),
                AccessFlags.PUBLIC.getValue(), List.of(onCreate), List.of(), 0);

        List<MethodReference> methods = new ArrayList<>(SyntheticApp.METHOD_TABLE);
        methods.add(GET_STRING);
        ClassTable classTable = new ClassTable(List.of(activity),
                List.of(new ReferenceTable(0, methods, List.of(), List.of())), List.of());
        Manifest manifest = new Manifest(SyntheticApp.PACKAGE, List.of(new ManifestComponent(
                RESOURCE_ACTIVITY, ComponentType.ACTIVITY, true, List.of())));

        return new DataFlowAnalyzer(new EntryPointAnalyzer(manifest, classTable),
                new CallGraphBuilder(classTable).build(), Properties.defaults(), resourceResolver);
    }

    @DisplayName("Testing that a resolved string resource counts as a constant sink argument.")
    @Test
    void testStringResourceArgument() {

        DataFlowAnalyzer resolved = resourceAnalyzer(id -> id == URL_RESOURCE_ID
                ? Optional.of("https://example.com") : Optional.empty());
        List<DataFlow> dataFlows = resolved.analyzeDataFlows(resolved.findWebviewFlows(10));

        assertEquals(1, dataFlows.size());
        assertEquals(1, dataFlows.get(0).getPath().getLength());
        assertTrue(dataFlows.get(0).isConstantSinkArgument());
        assertEquals(0.25, dataFlows.get(0).getConfidence(), DELTA);

        // an unknown resource id is not a constant
        DataFlowAnalyzer unresolved = resourceAnalyzer(id -> Optional.empty());
        assertFalse(unresolved.analyzeDataFlows(unresolved.findWebviewFlows(10)).get(0).isConstantSinkArgument());

        DataFlowAnalyzer withoutResolver = resourceAnalyzer(null);
        DataFlow dataFlow = withoutResolver.analyzeDataFlows(withoutResolver.findWebviewFlows(10)).get(0);
        assertFalse(dataFlow.isConstantSinkArgument());
        assertEquals(TaintEvidence.NONE, dataFlow.getEvidence());
        assertEquals(0.35, dataFlow.getConfidence(), DELTA);
    }

    @DisplayName("Testing that a problem met by both the call graph and the taint analysis is reported once.")
    @Test
    void testDiagnostics() {

        MethodReference onCreate =
                new MethodReference(RESOURCE_ACTIVITY, "onCreate", List.of("android.os.Bundle"), "void");
        DexMethod method = new DexMethod(RESOURCE_ACTIVITY, "onCreate", List.of("android.os.Bundle"), "void",
                AccessFlags.PROTECTED.getValue(), 4, new short[]{
                0x003e,                     // undefined opcode
                0x001a, 0x0000,             // const-string v0, string@0
                0x206e, 0x0002, 0x0002,     // invoke-virtual {v2, v0}, method@2 (loadUrl)
                0x000e                      // return-void
        });
        DexClass activity = new DexClass(RESOURCE_ACTIVITY, "android.app.Activity", Set.of(),
                AccessFlags.PUBLIC.getValue(), List.of(method), List.of(), 0);
        ClassTable classTable = new ClassTable(List.of(activity),
                List.of(new ReferenceTable(0, SyntheticApp.METHOD_TABLE, List.of(), SyntheticApp.STRING_TABLE)),
                List.of());
        Manifest manifest = new Manifest(SyntheticApp.PACKAGE, List.of(new ManifestComponent(
                RESOURCE_ACTIVITY, ComponentType.ACTIVITY, true, List.of())));

        DataFlowAnalyzer analyzer = analyzer(classTable, manifest);
        assertEquals(1, analyzer.getDiagnostics().size());

        List<DataFlow> dataFlows = analyzer.analyzeDataFlows(analyzer.findWebviewFlows(10));

        assertEquals(1, dataFlows.size());
        assertTrue(dataFlows.get(0).isConstantSinkArgument());

        List<Diagnostic> diagnostics = analyzer.getDiagnostics();
        assertEquals(1, diagnostics.size());
        assertEquals(DiagnosticKind.UNKNOWN_OPCODE, diagnostics.get(0).getKind());
        assertEquals(onCreate.getFullSignature(), diagnostics.get(0).getLocation());
    }
}
