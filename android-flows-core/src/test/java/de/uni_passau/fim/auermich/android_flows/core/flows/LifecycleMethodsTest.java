package de.uni_passau.fim.auermich.android_flows.core.flows;

import de.uni_passau.fim.auermich.android_flows.core.app.components.ComponentType;
import de.uni_passau.fim.auermich.android_flows.core.dex.ClassTable;
import de.uni_passau.fim.auermich.android_flows.core.dex.DexClass;
import de.uni_passau.fim.auermich.android_flows.core.dex.DexMethod;
import de.uni_passau.fim.auermich.android_flows.core.dex.MethodReference;
import de.uni_passau.fim.auermich.android_flows.core.dex.ReferenceTable;
import de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph.CallGraph;
import de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph.CallGraphBuilder;
import org.jf.dexlib2.AccessFlags;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class LifecycleMethodsTest {

    private static final String BASE = "com.x.BaseActivity";
    private static final String CHILD = "com.x.ChildActivity";

    private static ClassTable classTable;
    private static CallGraph callGraph;

    private static DexMethod method(String className, String name, String... parameterTypes) {
        return new DexMethod(className, name, List.of(parameterTypes), "void", AccessFlags.PUBLIC.getValue(),
                parameterTypes.length + 1, new short[]{0x000e});
    }

    private static MethodReference reference(String className, String name, String... parameterTypes) {
        return new MethodReference(className, name, List.of(parameterTypes), "void");
    }

    @BeforeAll
    static void init() {
        // BaseActivity declares onCreate and onStart, ChildActivity overrides onStart and declares two onNewIntent
        DexClass base = new DexClass(BASE, "android.app.Activity", Set.of(), AccessFlags.PUBLIC.getValue(),
                List.of(method(BASE, "onCreate", "android.os.Bundle"), method(BASE, "onStart")), List.of(), 0);
        DexClass child = new DexClass(CHILD, BASE, Set.of(), AccessFlags.PUBLIC.getValue(),
                List.of(method(CHILD, "onStart"), method(CHILD, "onNewIntent", "android.content.Intent"),
                        method(CHILD, "onNewIntent", "android.content.Intent", "boolean"),
                        method(CHILD, "helper")), List.of(), 0);
        classTable = new ClassTable(List.of(base, child),
                List.of(new ReferenceTable(0, List.of(), List.of(), List.of())), List.of());
        callGraph = new CallGraphBuilder(classTable).build();
    }

    @DisplayName("Testing the lifecycle method names per component type.")
    @Test
    void testNames() {
        assertEquals(List.of("onReceive"), LifecycleMethods.getNames(ComponentType.BROADCAST_RECEIVER));
        assertTrue(LifecycleMethods.getNames(ComponentType.ACTIVITY).contains("onCreate"));
        assertTrue(LifecycleMethods.getNames(ComponentType.SERVICE).contains("onStartCommand"));
        assertTrue(LifecycleMethods.getNames(ComponentType.CONTENT_PROVIDER).contains("query"));
    }

    @DisplayName("Testing the resolution of inherited lifecycle methods.")
    @Test
    void testInherited() {
        List<MethodReference> methods = LifecycleMethods.resolve(ComponentType.ACTIVITY, CHILD, classTable,
                callGraph, true);
        assertEquals(List.of(reference(BASE, "onCreate", "android.os.Bundle"), reference(CHILD, "onStart"),
                reference(CHILD, "onNewIntent", "android.content.Intent"),
                reference(CHILD, "onNewIntent", "android.content.Intent", "boolean")), methods);
        assertFalse(methods.contains(reference(BASE, "onStart")));
    }

    @DisplayName("Testing that only declared lifecycle methods are used without inheritance.")
    @Test
    void testDeclaredOnly() {
        List<MethodReference> methods = LifecycleMethods.resolve(ComponentType.ACTIVITY, CHILD, classTable,
                callGraph, false);
        assertEquals(List.of(reference(CHILD, "onStart"), reference(CHILD, "onNewIntent", "android.content.Intent"),
                reference(CHILD, "onNewIntent", "android.content.Intent", "boolean")), methods);
    }

    @DisplayName("Testing classes without lifecycle methods.")
    @Test
    void testNoLifecycleMethods() {
        assertTrue(LifecycleMethods.resolve(ComponentType.BROADCAST_RECEIVER, CHILD, classTable, callGraph, true)
                .isEmpty());
        assertTrue(LifecycleMethods.resolve(ComponentType.ACTIVITY, "com.x.Unknown", classTable, callGraph, true)
                .isEmpty());
    }
}
