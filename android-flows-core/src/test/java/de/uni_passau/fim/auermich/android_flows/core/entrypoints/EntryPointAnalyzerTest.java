package de.uni_passau.fim.auermich.android_flows.core.entrypoints;

import de.uni_passau.fim.auermich.android_flows.core.SyntheticApp;
import de.uni_passau.fim.auermich.android_flows.core.app.components.ComponentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class EntryPointAnalyzerTest {

    private EntryPointAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new EntryPointAnalyzer(SyntheticApp.manifest(), SyntheticApp.classTable());
    }

    @DisplayName("Testing that every declared component becomes an entry point.")
    @Test
    void testAnalyze() {
        List<EntryPoint> entryPoints = analyzer.analyze();
        assertEquals(List.of(SyntheticApp.MAIN_ACTIVITY, SyntheticApp.DEEPLINK_ACTIVITY, "com.x.MissingService"),
                entryPoints.stream().map(EntryPoint::getClassName).collect(Collectors.toList()));
        assertTrue(entryPoints.get(0).isClassFound());
        assertTrue(entryPoints.get(0).isLauncher());
        assertFalse(entryPoints.get(2).isClassFound());
        assertEquals(ComponentType.SERVICE, entryPoints.get(2).getComponentType());
    }

    @DisplayName("Testing deeplink handlers.")
    @Test
    void testDeeplinkHandlers() {
        List<EntryPoint> handlers = analyzer.getDeeplinkHandlers();
        assertEquals(1, handlers.size());
        assertEquals(SyntheticApp.DEEPLINK_ACTIVITY, handlers.get(0).getClassName());
        assertEquals(List.of("x://open"), handlers.get(0).getDeeplinkPatterns());
        assertTrue(handlers.get(0).handlesAction("android.intent.action.VIEW"));
        assertFalse(handlers.get(0).handlesAction("android.intent.action.MAIN"));
    }

    @DisplayName("Testing the lookup of an entry point together with its class.")
    @Test
    void testEntryPointWithClass() {
        var pair = analyzer.getEntryPointWithClass(SyntheticApp.MAIN_ACTIVITY).orElseThrow();
        assertEquals(SyntheticApp.MAIN_ACTIVITY, pair.getX().getClassName());
        assertEquals(2, pair.getY().getMethods().size());

        assertTrue(analyzer.getEntryPointWithClass("com.x.MissingService").isEmpty());
        assertTrue(analyzer.getEntryPoint("com.x.MissingService").isPresent());
        assertTrue(analyzer.getEntryPointWithClass("com.x.Unknown").isEmpty());
    }

    @DisplayName("Testing entry point statistics.")
    @Test
    void testStatistics() {
        Map<String, Integer> statistics = analyzer.getStatistics();
        assertEquals(3, statistics.get("entryPoints"));
        assertEquals(1, statistics.get("deeplinkHandlers"));
        assertEquals(1, statistics.get("launchers"));
        assertEquals(2, statistics.get("classesFound"));
        assertEquals(1, statistics.get("classesMissing"));
        assertEquals(2, statistics.get("activity"));
        assertEquals(1, statistics.get("service"));
        assertEquals(0, statistics.get("receiver"));
    }
}
