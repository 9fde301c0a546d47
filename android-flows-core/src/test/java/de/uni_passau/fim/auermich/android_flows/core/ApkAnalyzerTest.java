package de.uni_passau.fim.auermich.android_flows.core;

import de.uni_passau.fim.auermich.android_flows.core.app.components.ComponentType;
import de.uni_passau.fim.auermich.android_flows.core.app.xml.ManifestComponent;
import de.uni_passau.fim.auermich.android_flows.core.entrypoints.EntryPoint;
import de.uni_passau.fim.auermich.android_flows.core.flows.SinkCategory;
import de.uni_passau.fim.auermich.android_flows.core.errors.AnalysisException;
import de.uni_passau.fim.auermich.android_flows.core.errors.Diagnostic;
import de.uni_passau.fim.auermich.android_flows.core.errors.DiagnosticKind;
import de.uni_passau.fim.auermich.android_flows.core.errors.ErrorKind;
import de.uni_passau.fim.auermich.android_flows.core.utility.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ApkAnalyzerTest {

    private static EntryPoint entryPoint(String className) {
        return new EntryPoint(new ManifestComponent(className, ComponentType.ACTIVITY, null, List.of()), true);
    }

    @DisplayName("Testing the package filter of the optimized mode.")
    @Test
    void testDerivePackageFilter() {
        List<EntryPoint> entryPoints = List.of(
                entryPoint("com.x.ui.DetailActivity"),
                entryPoint("com.x.MainActivity"),
                entryPoint("org.app.PushReceiver"),
                entryPoint("com.xyz.OtherActivity"),
                entryPoint("androidx.core.app.CoreComponentFactory"),
                entryPoint("DefaultPackageActivity"));

        assertEquals(List.of("com.x", "com.xyz", "org.app"),
                ApkAnalyzer.derivePackageFilter(entryPoints, Properties.defaults()));
    }

    @DisplayName("Testing that only excluded entry points yield an empty package filter.")
    @Test
    void testEmptyPackageFilter() {
        assertTrue(ApkAnalyzer.derivePackageFilter(List.of(entryPoint("com.google.android.gms.Activity")),
                Properties.defaults()).isEmpty());
        assertTrue(ApkAnalyzer.derivePackageFilter(List.of(), Properties.defaults()).isEmpty());
    }

    @DisplayName("Testing that a missing APK file is reported.")
    @Test
    void testMissingApk(@TempDir File tempDir) {
        AnalysisException exception = assertThrows(AnalysisException.class,
                () -> new ApkAnalyzer().analyzeEntryPoints(new File(tempDir, "missing.apk")));
        assertEquals(ErrorKind.INVALID_ARCHIVE, exception.getKind());
    }

    @DisplayName("Testing that the collecting variants report a missing APK file as well.")
    @Test
    void testCollectFromMissingApk(@TempDir File tempDir) {
        File apkFile = new File(tempDir, "missing.apk");
        ApkAnalyzer analyzer = new ApkAnalyzer();

        assertEquals(ErrorKind.INVALID_ARCHIVE, assertThrows(AnalysisException.class,
                () -> analyzer.collectFlows(apkFile, SinkCategory.WEBVIEW.getPatterns(), 10, false)).getKind());
        assertEquals(ErrorKind.INVALID_ARCHIVE, assertThrows(AnalysisException.class,
                () -> analyzer.collectDataFlows(apkFile, SinkCategory.WEBVIEW, 10, false)).getKind());
        assertEquals(ErrorKind.INVALID_ARCHIVE, assertThrows(AnalysisException.class,
                () -> analyzer.extractClassTable(apkFile, false)).getKind());
    }

    @DisplayName("Testing that an analysis result keeps a snapshot of results and diagnostics.")
    @Test
    void testAnalysisResult() {
        List<String> results = new ArrayList<>(List.of("flow"));
        List<Diagnostic> diagnostics = new ArrayList<>();

        AnalysisResult<String> empty = new AnalysisResult<>(results, diagnostics);
        diagnostics.add(new Diagnostic(DiagnosticKind.UNKNOWN_OPCODE, "com.x.A.a(): void", "Skipped opcode"));
        results.clear();

        assertEquals(List.of("flow"), empty.getResults());
        assertFalse(empty.hasDiagnostics());

        AnalysisResult<String> result = new AnalysisResult<>(results, diagnostics);
        assertTrue(result.hasDiagnostics());
        assertEquals(diagnostics, result.getDiagnostics());
        assertThrows(UnsupportedOperationException.class, () -> result.getDiagnostics().clear());
    }
}
