package de.uni_passau.fim.auermich.android_flows.core.dex.instructions;

/**
 * The opcode families distinguished by the analysis.
 */
public enum InstructionKind {
    CONST,
    INVOKE,
    MOVE,
    BRANCH,
    RETURN,
    OTHER
}
