package de.uni_passau.fim.auermich.android_flows.core.flows;

import de.uni_passau.fim.auermich.android_flows.core.app.components.ComponentType;
import de.uni_passau.fim.auermich.android_flows.core.dex.MethodReference;
import de.uni_passau.fim.auermich.android_flows.core.entrypoints.EntryPoint;
import de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph.CallPath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * The call paths leading from the lifecycle methods of one entry point to one sink method.
 */
public class Flow {

    private final EntryPoint entryPoint;
    private final List<MethodReference> lifecycleMethods;
    private final MethodReference sink;

    /**
     * Distinct paths, shortest first.
     */
    private final List<CallPath> paths;

    public Flow(EntryPoint entryPoint, List<MethodReference> lifecycleMethods, MethodReference sink,
                List<CallPath> paths) {
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("A flow consists of at least one path!");
        }
        this.entryPoint = entryPoint;
        this.lifecycleMethods = List.copyOf(lifecycleMethods);
        this.sink = sink;
        this.paths = Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(paths)));
    }

    public EntryPoint getEntryPoint() {
        return entryPoint;
    }

    public String getEntryPointClass() {
        return entryPoint.getClassName();
    }

    public ComponentType getComponentType() {
        return entryPoint.getComponentType();
    }

    /**
     * Returns the lifecycle methods the search started from, including those without a path to the sink.
     *
     * @return Returns the lifecycle methods.
     */
    public List<MethodReference> getLifecycleMethods() {
        return lifecycleMethods;
    }

    public MethodReference getSink() {
        return sink;
    }

    public List<CallPath> getPaths() {
        return paths;
    }

    public int getPathCount() {
        return paths.size();
    }

    public int getMinPathLength() {
        return paths.get(0).getLength();
    }

    public CallPath getShortestPath() {
        return paths.get(0);
    }

    public boolean isDeeplinkHandler() {
        return entryPoint.isDeeplinkHandler();
    }

    @Override
    public String toString() {
        return "Flow{" + getEntryPointClass() + " -> " + sink.getQualifiedName() + ", paths=" + getPathCount()
                + ", minLength=" + getMinPathLength() + ", deeplink=" + isDeeplinkHandler() + "}";
    }
}
