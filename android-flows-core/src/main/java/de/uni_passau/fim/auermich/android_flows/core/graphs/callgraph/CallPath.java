package de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph;

import de.uni_passau.fim.auermich.android_flows.core.dex.MethodReference;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A sequence of methods where each method calls its successor. The length of a path is its number of edges.
 * Paths are ordered by length first and by the signatures of their methods second.
 */
public class CallPath implements Comparable<CallPath> {

    private final List<MethodReference> methods;

    public CallPath(List<MethodReference> methods) {
        if (methods.isEmpty()) {
            throw new IllegalArgumentException("A call path consists of at least one method!");
        }
        this.methods = List.copyOf(methods);
    }

    public List<MethodReference> getMethods() {
        return methods;
    }

    public int getLength() {
        return methods.size() - 1;
    }

    public MethodReference getSource() {
        return methods.get(0);
    }

    public MethodReference getTarget() {
        return methods.get(methods.size() - 1);
    }

    public boolean contains(MethodReference method) {
        return methods.contains(method);
    }

    @Override
    public int compareTo(CallPath other) {
        int result = Integer.compare(getLength(), other.getLength());
        for (int i = 0; result == 0 && i < methods.size(); i++) {
            result = methods.get(i).compareTo(other.methods.get(i));
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return methods.equals(((CallPath) o).methods);
    }

    @Override
    public int hashCode() {
        return methods.hashCode();
    }

    @Override
    public String toString() {
        return methods.stream().map(MethodReference::getQualifiedName).collect(Collectors.joining(" -> "));
    }
}
