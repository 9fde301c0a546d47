package de.uni_passau.fim.auermich.android_flows.core.dex.instructions;

/**
 * Signals that the bytecode of a single method can't be decoded, e.g. because an instruction is cut off.
 * This affects only the method at hand, the analysis of all other methods continues.
 */
public class MalformedBytecodeException extends Exception {

    private final int address;

    public MalformedBytecodeException(int address, String message) {
        super(message + " (at code unit " + address + ")");
        this.address = address;
    }

    /**
     * Returns the code unit offset of the offending instruction.
     *
     * @return Returns the code address.
     */
    public int getAddress() {
        return address;
    }
}
