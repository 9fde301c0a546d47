package de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph;

import de.uni_passau.fim.auermich.android_flows.core.dex.MethodReference;
import org.jgrapht.graph.DefaultEdge;

import java.util.List;

/**
 * An edge in the {@link CallGraph}: the source method invokes the target method at one or more call sites.
 */
public class CallEdge extends DefaultEdge {

    /**
     * The code addresses of the invoke instructions within the caller, in ascending order.
     */
    private final List<Integer> callSites;

    public CallEdge(List<Integer> callSites) {
        this.callSites = List.copyOf(callSites);
    }

    @Override
    public MethodReference getSource() {
        return (MethodReference) super.getSource();
    }

    @Override
    public MethodReference getTarget() {
        return (MethodReference) super.getTarget();
    }

    public List<Integer> getCallSites() {
        return callSites;
    }

    @Override
    public String toString() {
        return "(" + getSource() + "->" + getTarget() + ")";
    }
}
