package de.uni_passau.fim.auermich.android_flows.core.flows;

import de.uni_passau.fim.auermich.android_flows.core.dex.MethodReference;
import de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph.CallPath;

import java.util.Locale;
import java.util.Optional;

/**
 * The outcome of the taint analysis of one {@link Flow}: the most convincing path together with the
 * confidence that Intent data actually reaches the sink along it.
 */
public class DataFlow {

    private final Flow flow;
    private final CallPath path;
    private final MethodReference source;
    private final TaintEvidence evidence;
    private final boolean constantSinkArgument;
    private final double confidence;

    public DataFlow(Flow flow, CallPath path, MethodReference source, TaintEvidence evidence,
                    boolean constantSinkArgument, double confidence) {
        this.flow = flow;
        this.path = path;
        this.source = source;
        this.evidence = evidence;
        this.constantSinkArgument = constantSinkArgument;
        this.confidence = confidence;
    }

    public Flow getFlow() {
        return flow;
    }

    public CallPath getPath() {
        return path;
    }

    public MethodReference getSink() {
        return flow.getSink();
    }

    /**
     * Returns the Intent method the tainted data was extracted with, e.g. {@code Intent.getStringExtra}.
     *
     * @return Returns the first Intent extraction found along the path, if any.
     */
    public Optional<MethodReference> getSource() {
        return Optional.ofNullable(source);
    }

    public TaintEvidence getEvidence() {
        return evidence;
    }

    public boolean isConstantSinkArgument() {
        return constantSinkArgument;
    }

    public double getConfidence() {
        return confidence;
    }

    public ConfidenceLevel getConfidenceLevel() {
        return ConfidenceLevel.of(confidence);
    }

    @Override
    public String toString() {
        return "DataFlow{" + getSource().map(MethodReference::getQualifiedName).orElse("?") + " -> "
                + getSink().getQualifiedName() + " via " + path.getLength() + " edges, "
                + String.format(Locale.ROOT, "%.2f", confidence) + " (" + getConfidenceLevel() + ")}";
    }
}
