package de.uni_passau.fim.auermich.android_flows.core.flows;

/**
 * How strongly the taint analysis links Intent data with the sink of a path, strongest first.
 */
public enum TaintEvidence {

    /**
     * A register holding (data derived from) an Intent extraction result is passed to the sink.
     */
    SINK_ARGUMENT,

    /**
     * Intent data is extracted somewhere along the path but couldn't be traced into the sink call.
     */
    PATH_SOURCE,

    NONE
}
