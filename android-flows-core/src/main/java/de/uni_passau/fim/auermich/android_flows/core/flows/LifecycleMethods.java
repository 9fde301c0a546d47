package de.uni_passau.fim.auermich.android_flows.core.flows;

import de.uni_passau.fim.auermich.android_flows.core.app.components.ComponentType;
import de.uni_passau.fim.auermich.android_flows.core.dex.ClassTable;
import de.uni_passau.fim.auermich.android_flows.core.dex.DexClass;
import de.uni_passau.fim.auermich.android_flows.core.dex.DexMethod;
import de.uni_passau.fim.auermich.android_flows.core.dex.MethodReference;
import de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph.CallGraph;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The callbacks through which the Android framework hands control (and Intents) to a component.
 */
public final class LifecycleMethods {

    private static final Map<ComponentType, List<String>> LIFECYCLE_METHODS = new EnumMap<>(ComponentType.class);

    static {
        LIFECYCLE_METHODS.put(ComponentType.ACTIVITY,
                List.of("onCreate", "onStart", "onResume", "onNewIntent", "onActivityResult"));
        LIFECYCLE_METHODS.put(ComponentType.SERVICE, List.of("onCreate", "onStart", "onStartCommand", "onBind"));
        LIFECYCLE_METHODS.put(ComponentType.BROADCAST_RECEIVER, List.of("onReceive"));
        LIFECYCLE_METHODS.put(ComponentType.CONTENT_PROVIDER,
                List.of("onCreate", "query", "insert", "update", "delete"));
    }

    private LifecycleMethods() {
        throw new UnsupportedOperationException("Utility class!");
    }

    /**
     * Returns the names of the lifecycle methods of the given component type.
     *
     * @param type The component type.
     * @return Returns the method names in callback order.
     */
    public static List<String> getNames(ComponentType type) {
        return LIFECYCLE_METHODS.getOrDefault(type, List.of());
    }

    /**
     * Resolves the lifecycle methods of a component class that appear in the call graph. A lifecycle method
     * not overridden by the class itself is taken from the closest superclass within the APK declaring it,
     * if {@code includeInherited} is set.
     *
     * @param type The component type.
     * @param className The component class.
     * @param classTable The classes of the APK.
     * @param callGraph The call graph.
     * @param includeInherited Whether to look up lifecycle methods along the superclass chain.
     * @return Returns the lifecycle methods (all overloads) in callback order.
     */
    public static List<MethodReference> resolve(ComponentType type, String className, ClassTable classTable,
                                                CallGraph callGraph, boolean includeInherited) {

        List<DexClass> hierarchy = classTable.getSuperclassChain(className);
        if (!includeInherited && !hierarchy.isEmpty()) {
            hierarchy = hierarchy.subList(0, 1);
        }

        Set<MethodReference> methods = new LinkedHashSet<>();

        for (String name : getNames(type)) {
            for (DexClass dexClass : hierarchy) {
                List<DexMethod> declared = dexClass.getMethods(name);
                if (!declared.isEmpty()) {
                    for (DexMethod method : declared) {
                        MethodReference reference = method.toMethodReference();
                        if (callGraph.containsMethod(reference)) {
                            methods.add(reference);
                        }
                    }
                    // the closest declaration overrides the ones further up
                    break;
                }
            }
        }

        return new ArrayList<>(methods);
    }
}
