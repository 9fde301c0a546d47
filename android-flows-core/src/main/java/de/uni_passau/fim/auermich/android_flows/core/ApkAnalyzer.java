package de.uni_passau.fim.auermich.android_flows.core;

import de.uni_passau.fim.auermich.android_flows.core.app.APK;
import de.uni_passau.fim.auermich.android_flows.core.dex.ClassExtractor;
import de.uni_passau.fim.auermich.android_flows.core.dex.ClassTable;
import de.uni_passau.fim.auermich.android_flows.core.dex.DexClass;
import de.uni_passau.fim.auermich.android_flows.core.entrypoints.EntryPoint;
import de.uni_passau.fim.auermich.android_flows.core.entrypoints.EntryPointAnalyzer;
import de.uni_passau.fim.auermich.android_flows.core.flows.DataFlow;
import de.uni_passau.fim.auermich.android_flows.core.flows.DataFlowAnalyzer;
import de.uni_passau.fim.auermich.android_flows.core.flows.Flow;
import de.uni_passau.fim.auermich.android_flows.core.flows.SinkCategory;
import de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph.CallGraph;
import de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph.CallGraphBuilder;
import de.uni_passau.fim.auermich.android_flows.core.resources.ResourceResolver;
import de.uni_passau.fim.auermich.android_flows.core.resources.StringResourceResolver;
import de.uni_passau.fim.auermich.android_flows.core.utility.DexUtils;
import de.uni_passau.fim.auermich.android_flows.core.utility.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * The entry point of the library: runs the analysis stages on an APK file.
 * <p>
 * Each operation opens the APK anew. Callers analysing the same APK repeatedly should use the stages
 * ({@link ClassExtractor}, {@link EntryPointAnalyzer}, {@link CallGraphBuilder}, {@link DataFlowAnalyzer})
 * directly and share the intermediate results.
 */
public class ApkAnalyzer {

    private static final Logger LOGGER = LogManager.getLogger(ApkAnalyzer.class);

    private final Properties properties;

    public ApkAnalyzer() {
        this(Properties.defaults());
    }

    public ApkAnalyzer(Properties properties) {
        this.properties = properties;
    }

    /**
     * Parses all classes of all dex files of the APK. Use {@link #extractClassTable(File, boolean)} to obtain
     * the diagnostics of the extraction as well.
     *
     * @param apkFile The APK file.
     * @param parallel Whether the classes should be parsed on a worker pool.
     * @return Returns the classes in dex file order; the order doesn't depend on {@code parallel}.
     */
    public List<DexClass> extractClasses(File apkFile, boolean parallel) {
        return extractClassTable(apkFile, parallel).getClasses();
    }

    /**
     * Parses all classes of all dex files of the APK into a class table.
     *
     * @param apkFile The APK file.
     * @param parallel Whether the classes should be parsed on a worker pool.
     * @return Returns the class table, which also holds the problems met while reading the classes.
     */
    public ClassTable extractClassTable(File apkFile, boolean parallel) {
        return extractClassTable(APK.open(apkFile), parallel);
    }

    /**
     * Links the components declared in the manifest with the classes of the APK.
     *
     * @param apkFile The APK file.
     * @return Returns one entry point per declared component.
     */
    public List<EntryPoint> analyzeEntryPoints(File apkFile) {
        APK apk = APK.open(apkFile);
        return new EntryPointAnalyzer(apk.getManifest(), extractClassTable(apk, true)).analyze();
    }

    /**
     * Builds the call graph of the APK.
     *
     * @param apkFile The APK file.
     * @param packageFilter The package prefixes whose methods are scanned for calls, empty for all classes.
     * @return Returns the call graph.
     */
    public CallGraph buildCallGraph(File apkFile, List<String> packageFilter) {
        ClassTable classTable = extractClassTable(APK.open(apkFile), true);
        return new CallGraphBuilder(classTable)
                .withPackageFilter(packageFilter)
                .withProperties(properties)
                .buildParallel();
    }

    /**
     * Finds the call paths from the entry points of the APK to the methods matching the sink patterns.
     *
     * @param apkFile The APK file.
     * @param sinkPatterns The sink patterns, e.g. {@code WebView.loadUrl}.
     * @param maxDepth The maximal number of edges of a path.
     * @param optimize Whether only the packages of the entry points should be scanned for calls, see
     *         {@link #derivePackageFilter(List, Properties)}.
     * @return Returns one flow per (entry point, sink) pair.
     */
    public List<Flow> findFlows(File apkFile, List<String> sinkPatterns, int maxDepth, boolean optimize) {
        return collectFlows(apkFile, sinkPatterns, maxDepth, optimize).getResults();
    }

    /**
     * Like {@link #findFlows(File, List, int, boolean)}, but returns the flows together with the diagnostics
     * of class extraction and call graph construction.
     *
     * @param apkFile The APK file.
     * @param sinkPatterns The sink patterns, e.g. {@code WebView.loadUrl}.
     * @param maxDepth The maximal number of edges of a path.
     * @param optimize Whether only the packages of the entry points should be scanned for calls.
     * @return Returns the flows and the diagnostics.
     */
    public AnalysisResult<Flow> collectFlows(File apkFile, List<String> sinkPatterns, int maxDepth,
                                             boolean optimize) {
        DataFlowAnalyzer analyzer = createDataFlowAnalyzer(APK.open(apkFile), optimize, false);
        return toResult(analyzer.findFlowsTo(sinkPatterns, maxDepth), analyzer);
    }

    /**
     * Finds the flows to the sinks of the given category and estimates for each of them whether Intent data
     * reaches the sink. String resources are resolved if the APK has been decoded next to the APK file.
     *
     * @param apkFile The APK file.
     * @param category The sink category.
     * @param maxDepth The maximal number of edges of a path.
     * @param optimize Whether only the packages of the entry points should be scanned for calls.
     * @return Returns one data flow per flow.
     */
    public List<DataFlow> analyzeFlows(File apkFile, SinkCategory category, int maxDepth, boolean optimize) {
        return collectDataFlows(apkFile, category, maxDepth, optimize).getResults();
    }

    /**
     * Like {@link #analyzeFlows(File, SinkCategory, int, boolean)}, but returns the data flows together with the
     * diagnostics of all stages, including methods the taint analysis couldn't decode.
     *
     * @param apkFile The APK file.
     * @param category The sink category.
     * @param maxDepth The maximal number of edges of a path.
     * @param optimize Whether only the packages of the entry points should be scanned for calls.
     * @return Returns the data flows and the diagnostics.
     */
    public AnalysisResult<DataFlow> collectDataFlows(File apkFile, SinkCategory category, int maxDepth,
                                                     boolean optimize) {
        DataFlowAnalyzer analyzer = createDataFlowAnalyzer(APK.open(apkFile), optimize, true);
        return toResult(analyzer.analyzeDataFlows(analyzer.findFlows(category, maxDepth)), analyzer);
    }

    private static <T> AnalysisResult<T> toResult(List<T> results, DataFlowAnalyzer analyzer) {
        AnalysisResult<T> result = new AnalysisResult<>(results, analyzer.getDiagnostics());
        if (result.hasDiagnostics()) {
            LOGGER.warn(result.getDiagnostics().size() + " problems were met during the analysis, "
                    + "flows through the affected methods may be missing.");
        }
        return result;
    }

    private DataFlowAnalyzer createDataFlowAnalyzer(APK apk, boolean optimize, boolean resolveResources) {

        ClassTable classTable = extractClassTable(apk, true);
        EntryPointAnalyzer entryPointAnalyzer = new EntryPointAnalyzer(apk.getManifest(), classTable);

        List<String> packageFilter = new ArrayList<>();
        if (optimize) {
            packageFilter = derivePackageFilter(entryPointAnalyzer.analyze(), properties);
            LOGGER.warn("Optimized mode: only methods of " + packageFilter + " are scanned for calls. "
                    + "This is faster but misses paths through code outside of these packages.");
        }

        CallGraph callGraph = new CallGraphBuilder(classTable)
                .withPackageFilter(packageFilter)
                .withProperties(properties)
                .buildParallel();

        ResourceResolver resourceResolver = null;
        if (resolveResources && apk.getDecodingOutputPath().isDirectory()) {
            resourceResolver = StringResourceResolver.fromDecodedAPK(classTable, apk.getDecodingOutputPath());
        }

        return new DataFlowAnalyzer(entryPointAnalyzer, callGraph, properties, resourceResolver);
    }

    private ClassTable extractClassTable(APK apk, boolean parallel) {
        return new ClassExtractor(properties).extract(apk.getDexFiles(), parallel);
    }

    /**
     * Derives the package filter of the optimized mode from the packages of the entry point classes. Classes
     * of frameworks and libraries (see {@link Properties#isExcluded(String)}) and classes of the default
     * package don't contribute. A package nested in another selected package is dropped.
     *
     * @param entryPoints The entry points.
     * @param properties Supplies the exclusion pattern.
     * @return Returns the sorted package prefixes, empty if no entry point contributes a package.
     */
    public static List<String> derivePackageFilter(List<EntryPoint> entryPoints, Properties properties) {

        TreeSet<String> packages = new TreeSet<>();
        for (EntryPoint entryPoint : entryPoints) {
            String className = entryPoint.getClassName();
            String packageName = DexUtils.getPackageName(className);
            if (!packageName.isEmpty() && !properties.isExcluded(className)) {
                packages.add(packageName);
            }
        }

        List<String> packageFilter = new ArrayList<>();
        for (String packageName : packages) {
            // sorted order visits a package before the packages nested in it
            if (packageFilter.stream().noneMatch(prefix -> DexUtils.matchesPackagePrefix(packageName, prefix))) {
                packageFilter.add(packageName);
            }
        }
        return packageFilter;
    }
}
