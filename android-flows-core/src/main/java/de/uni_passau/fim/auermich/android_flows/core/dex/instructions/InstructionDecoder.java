package de.uni_passau.fim.auermich.android_flows.core.dex.instructions;

import de.uni_passau.fim.auermich.android_flows.core.errors.Diagnostic;
import de.uni_passau.fim.auermich.android_flows.core.errors.DiagnosticKind;
import de.uni_passau.fim.auermich.android_flows.core.utility.Utility;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jf.dexlib2.Format;
import org.jf.dexlib2.Opcode;
import org.jf.dexlib2.Opcodes;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes the code units of a method into {@link Instruction}s. The operand layout of each opcode is taken
 * from its dexlib2 {@link Format}; narrow literal fields are sign-extended.
 */
public class InstructionDecoder {

    private static final Logger LOGGER = LogManager.getLogger(InstructionDecoder.class);

    private static final int PACKED_SWITCH_PAYLOAD = 0x0100;
    private static final int SPARSE_SWITCH_PAYLOAD = 0x0200;
    private static final int ARRAY_PAYLOAD = 0x0300;

    private final Opcodes opcodes;

    public InstructionDecoder() {
        this(Utility.API_OPCODE);
    }

    public InstructionDecoder(Opcodes opcodes) {
        this.opcodes = opcodes;
    }

    /**
     * Decodes the given code units.
     *
     * @param words The code units of a method.
     * @return Returns the decoded instructions in address order.
     * @throws MalformedBytecodeException If an instruction is cut off.
     */
    public List<Instruction> decode(short[] words) throws MalformedBytecodeException {
        return decode(words, "<unknown>", new ArrayList<>());
    }

    /**
     * Decodes the given code units. Payload pseudo-instructions (switch tables, array data) are skipped.
     * An undefined opcode is skipped as a single code unit and reported as
     * {@link DiagnosticKind#UNKNOWN_OPCODE}.
     *
     * @param words The code units of a method.
     * @param location The method the code belongs to, used for diagnostics.
     * @param diagnostics Collects the problems found while decoding.
     * @return Returns the decoded instructions in address order.
     * @throws MalformedBytecodeException If an instruction is cut off.
     */
    public List<Instruction> decode(short[] words, String location, List<Diagnostic> diagnostics)
            throws MalformedBytecodeException {

        List<Instruction> instructions = new ArrayList<>();
        int address = 0;

        while (address < words.length) {

            int first = unit(words, address);
            int opcodeValue = first & 0xFF;

            if (opcodeValue == 0 && first != 0) {
                address += payloadSize(words, address, first);
                continue;
            }

            Opcode opcode = opcodes.getOpcodeByValue(opcodeValue);

            if (opcode == null) {
                LOGGER.debug("Unknown opcode 0x" + Integer.toHexString(opcodeValue) + " in " + location
                        + " at " + address);
                diagnostics.add(new Diagnostic(DiagnosticKind.UNKNOWN_OPCODE, location,
                        "Skipped undefined opcode 0x" + Integer.toHexString(opcodeValue) + " at code unit " + address));
                address++;
                continue;
            }

            int codeUnits = opcode.format.size / 2;
            if (codeUnits <= 0) {
                throw new MalformedBytecodeException(address, "Opcode " + opcode.name + " has no fixed size");
            }
            require(words, address, codeUnits, opcode);

            instructions.add(decodeOperands(words, address, opcode, codeUnits));
            address += codeUnits;
        }

        return instructions;
    }

    /**
     * Computes the size of a payload pseudo-instruction from its header.
     */
    private static int payloadSize(short[] words, int address, int identifier) throws MalformedBytecodeException {

        int size;

        switch (identifier) {
            case PACKED_SWITCH_PAYLOAD:
                require(words, address, 2, null);
                size = unit(words, address + 1) * 2 + 4;
                break;
            case SPARSE_SWITCH_PAYLOAD:
                require(words, address, 2, null);
                size = unit(words, address + 1) * 4 + 2;
                break;
            case ARRAY_PAYLOAD:
                require(words, address, 4, null);
                long elementWidth = unit(words, address + 1);
                long elementCount = unit(words, address + 2) | ((long) unit(words, address + 3) << 16);
                long dataUnits = (elementWidth * elementCount + 1) / 2;
                if (dataUnits > words.length) {
                    throw new MalformedBytecodeException(address, "Array payload exceeds the method");
                }
                size = (int) dataUnits + 4;
                break;
            default:
                throw new MalformedBytecodeException(address, "Invalid payload identifier 0x"
                        + Integer.toHexString(identifier));
        }

        require(words, address, size, null);
        return size;
    }

    private static void require(short[] words, int address, int codeUnits, Opcode opcode)
            throws MalformedBytecodeException {
        if (address + codeUnits > words.length) {
            throw new MalformedBytecodeException(address, "Truncated " + (opcode == null ? "payload" : opcode.name)
                    + ": needs " + codeUnits + " code units, " + (words.length - address) + " left");
        }
    }

    private static int unit(short[] words, int index) {
        return words[index] & 0xFFFF;
    }

    private static Instruction decodeOperands(short[] words, int address, Opcode opcode, int codeUnits)
            throws MalformedBytecodeException {

        Instruction.Builder builder = new Instruction.Builder(address, opcode, codeUnits);
        ReferenceKind referenceKind = ReferenceKind.fromReferenceType(opcode.referenceType);

        int first = unit(words, address);
        int a = (first >> 8) & 0xF;
        int b = (first >> 12) & 0xF;
        int aa = (first >> 8) & 0xFF;

        switch (opcode.format) {
            case Format10t:
                builder.withBranchOffset((byte) aa);
                break;
            case Format20t:
                builder.withBranchOffset((short) unit(words, address + 1));
                break;
            case Format30t:
                builder.withBranchOffset(int32(words, address + 1));
                break;
            case Format11n:
                // the literal occupies the upper nibble, (b << 28) >> 28 sign-extends it
                builder.withDestination(a).withLiteral((b << 28) >> 28);
                break;
            case Format11x:
                if (opcode.setsRegister()) {
                    builder.withDestination(aa);
                } else {
                    builder.withSource(aa);
                }
                break;
            case Format12x:
                if (opcode.setsRegister()) {
                    builder.withDestination(a);
                    if (opcode.name.endsWith("/2addr")) {
                        builder.withSource(a);
                    }
                    builder.withSource(b);
                } else {
                    builder.withSource(a).withSource(b);
                }
                break;
            case Format21c:
            case Format31c:
                int index = opcode.format == Format.Format21c
                        ? unit(words, address + 1) : int32(words, address + 1);
                if (opcode.setsRegister()) {
                    builder.withDestination(aa);
                    if (opcode == Opcode.CHECK_CAST) {
                        builder.withSource(aa);
                    }
                } else {
                    builder.withSource(aa);
                }
                builder.withReference(index, referenceKind);
                break;
            case Format21ih:
                builder.withDestination(aa).withLiteral(unit(words, address + 1) << 16);
                break;
            case Format21lh:
                builder.withDestination(aa).withLiteral((long) (short) unit(words, address + 1) << 48);
                break;
            case Format21s:
                builder.withDestination(aa).withLiteral((short) unit(words, address + 1));
                break;
            case Format21t:
                builder.withSource(aa).withBranchOffset((short) unit(words, address + 1));
                break;
            case Format22b:
                int second = unit(words, address + 1);
                builder.withDestination(aa).withSource(second & 0xFF).withLiteral((byte) (second >> 8));
                break;
            case Format22c:
            case Format22cs:
                if (opcode.setsRegister()) {
                    builder.withDestination(a).withSource(b);
                } else {
                    builder.withSource(a).withSource(b);
                }
                if (opcode.format == Format.Format22c) {
                    builder.withReference(unit(words, address + 1), referenceKind);
                }
                break;
            case Format22s:
                builder.withDestination(a).withSource(b).withLiteral((short) unit(words, address + 1));
                break;
            case Format22t:
                builder.withSource(a).withSource(b).withBranchOffset((short) unit(words, address + 1));
                break;
            case Format22x:
                builder.withDestination(aa).withSource(unit(words, address + 1));
                break;
            case Format23x:
                int registers = unit(words, address + 1);
                if (opcode.setsRegister()) {
                    builder.withDestination(aa);
                } else {
                    builder.withSource(aa);
                }
                builder.withSource(registers & 0xFF).withSource(registers >> 8);
                break;
            case Format31i:
                builder.withDestination(aa).withLiteral(int32(words, address + 1));
                break;
            case Format31t:
                builder.withSource(aa).withBranchOffset(int32(words, address + 1));
                break;
            case Format32x:
                builder.withDestination(unit(words, address + 1)).withSource(unit(words, address + 2));
                break;
            case Format35c:
            case Format35mi:
            case Format35ms:
            case Format45cc:
                decodeArgumentList(words, address, opcode, builder, b, a);
                if (opcode.format == Format.Format35c || opcode.format == Format.Format45cc) {
                    builder.withReference(unit(words, address + 1), referenceKind);
                }
                break;
            case Format3rc:
            case Format3rmi:
            case Format3rms:
            case Format4rcc:
                int firstRegister = unit(words, address + 2);
                for (int i = 0; i < aa; i++) {
                    builder.withSource(firstRegister + i);
                }
                if (opcode.format == Format.Format3rc || opcode.format == Format.Format4rcc) {
                    builder.withReference(unit(words, address + 1), referenceKind);
                }
                break;
            case Format51l:
                long value = unit(words, address + 1)
                        | ((long) unit(words, address + 2) << 16)
                        | ((long) unit(words, address + 3) << 32)
                        | ((long) unit(words, address + 4) << 48);
                builder.withDestination(aa).withLiteral(value);
                break;
            default:
                // no register operands, e.g. nop, return-void or odex-only forms
                break;
        }

        return builder.build();
    }

    /**
     * Decodes the argument registers {vC, vD, vE, vF, vG} of the 35c family. The first {@code count}
     * registers are used in this order, the receiver of an instance call being vC.
     */
    private static void decodeArgumentList(short[] words, int address, Opcode opcode, Instruction.Builder builder,
                                           int count, int g) throws MalformedBytecodeException {

        if (count > 5) {
            throw new MalformedBytecodeException(address, opcode.name + " with " + count + " arguments");
        }

        int registers = unit(words, address + 2);
        int[] arguments = {
                registers & 0xF,
                (registers >> 4) & 0xF,
                (registers >> 8) & 0xF,
                (registers >> 12) & 0xF,
                g
        };

        for (int i = 0; i < count; i++) {
            builder.withSource(arguments[i]);
        }
    }

    private static int int32(short[] words, int index) {
        return unit(words, index) | (unit(words, index + 1) << 16);
    }
}
