package de.uni_passau.fim.auermich.android_flows.core.errors;

/**
 * The kinds of non-fatal problems recorded while analysing a single unit (class, method, instruction).
 */
public enum DiagnosticKind {

    /**
     * The bytecode of a method is truncated or otherwise unreadable.
     */
    MALFORMED_METHOD,

    /**
     * An invoke instruction references a method index outside of the method table.
     */
    UNRESOLVED_METHOD,

    /**
     * An opcode value is not defined for the targeted API level. The instruction was skipped.
     */
    UNKNOWN_OPCODE,

    /**
     * The same class is defined in more than one dex file. Only the first definition is kept.
     */
    DUPLICATE_CLASS
}
