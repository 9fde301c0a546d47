package de.uni_passau.fim.auermich.android_flows.core.dex.instructions;

import org.jf.dexlib2.ReferenceType;

/**
 * Describes into which table the index operand of an instruction points.
 */
public enum ReferenceKind {
    STRING,
    TYPE,
    FIELD,
    METHOD,
    METHOD_PROTO,
    CALL_SITE,
    METHOD_HANDLE,
    NONE;

    /**
     * Maps the dexlib2 reference type of an opcode.
     *
     * @param referenceType One of the {@link ReferenceType} constants.
     * @return Returns the corresponding reference kind.
     */
    public static ReferenceKind fromReferenceType(int referenceType) {
        switch (referenceType) {
            case ReferenceType.STRING:
                return STRING;
            case ReferenceType.TYPE:
                return TYPE;
            case ReferenceType.FIELD:
                return FIELD;
            case ReferenceType.METHOD:
                return METHOD;
            case ReferenceType.METHOD_PROTO:
                return METHOD_PROTO;
            case ReferenceType.CALL_SITE:
                return CALL_SITE;
            case ReferenceType.METHOD_HANDLE:
                return METHOD_HANDLE;
            default:
                return NONE;
        }
    }

    /**
     * Returns the prefix of an index operand in the textual form of an instruction.
     *
     * @return Returns e.g. {@code method} for {@code method@12}.
     */
    public String getPrefix() {
        switch (this) {
            case METHOD_PROTO:
                return "proto";
            case CALL_SITE:
                return "call_site";
            case METHOD_HANDLE:
                return "method_handle";
            default:
                return name().toLowerCase();
        }
    }
}
