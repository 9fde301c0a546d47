package de.uni_passau.fim.auermich.android_flows.core.dex.instructions;

import org.jf.dexlib2.Opcode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.stream.Collectors;

/**
 * A decoded instruction. Registers are split into the (optional) register the instruction writes and the
 * ordered registers it reads. For invocations the read registers are the arguments, starting with the
 * receiver for instance calls.
 */
public class Instruction {

    private final int address;
    private final Opcode opcode;
    private final InstructionKind kind;
    private final int codeUnits;
    private final Integer destination;
    private final int[] sources;
    private final Long literal;
    private final Integer branchOffset;
    private final Integer referenceIndex;
    private final ReferenceKind referenceKind;

    private Instruction(Builder builder) {
        this.address = builder.address;
        this.opcode = builder.opcode;
        this.kind = kindOf(builder.opcode);
        this.codeUnits = builder.codeUnits;
        this.destination = builder.destination;
        this.sources = builder.sources.stream().mapToInt(Integer::intValue).toArray();
        this.literal = builder.literal;
        this.branchOffset = builder.branchOffset;
        this.referenceIndex = builder.referenceIndex;
        this.referenceKind = builder.referenceIndex == null ? ReferenceKind.NONE : builder.referenceKind;
    }

    /**
     * Derives the opcode family from the opcode mnemonic.
     *
     * @param opcode The opcode.
     * @return Returns the opcode family.
     */
    static InstructionKind kindOf(Opcode opcode) {
        String name = opcode.name;
        if (name.startsWith("const")) {
            return InstructionKind.CONST;
        } else if (name.startsWith("invoke")) {
            return InstructionKind.INVOKE;
        } else if (name.startsWith("move")) {
            return InstructionKind.MOVE;
        } else if (name.startsWith("if-") || name.startsWith("goto") || name.endsWith("-switch")) {
            return InstructionKind.BRANCH;
        } else if (name.startsWith("return")) {
            return InstructionKind.RETURN;
        } else {
            return InstructionKind.OTHER;
        }
    }

    /**
     * Returns the offset of the instruction in code units from the start of the method.
     *
     * @return Returns the code address.
     */
    public int getAddress() {
        return address;
    }

    public Opcode getOpcode() {
        return opcode;
    }

    public InstructionKind getKind() {
        return kind;
    }

    public int getCodeUnits() {
        return codeUnits;
    }

    public OptionalInt getDestination() {
        return destination == null ? OptionalInt.empty() : OptionalInt.of(destination);
    }

    public List<Integer> getSources() {
        return Arrays.stream(sources).boxed().collect(Collectors.toList());
    }

    /**
     * Returns the sign-extended literal of const and literal arithmetic instructions.
     *
     * @return Returns the literal if the instruction carries one.
     */
    public OptionalLong getLiteral() {
        return literal == null ? OptionalLong.empty() : OptionalLong.of(literal);
    }

    /**
     * Returns the signed branch offset in code units of goto, if and switch instructions.
     *
     * @return Returns the branch offset if the instruction carries one.
     */
    public OptionalInt getBranchOffset() {
        return branchOffset == null ? OptionalInt.empty() : OptionalInt.of(branchOffset);
    }

    public OptionalInt getReferenceIndex() {
        return referenceIndex == null ? OptionalInt.empty() : OptionalInt.of(referenceIndex);
    }

    public ReferenceKind getReferenceKind() {
        return referenceKind;
    }

    public boolean isInvoke() {
        return kind == InstructionKind.INVOKE;
    }

    /**
     * Checks whether this instruction is one of the move-result variants that fetch the result of the
     * preceding invocation.
     *
     * @return Returns {@code true} for move-result, move-result-wide and move-result-object.
     */
    public boolean isMoveResult() {
        return opcode == Opcode.MOVE_RESULT || opcode == Opcode.MOVE_RESULT_WIDE
                || opcode == Opcode.MOVE_RESULT_OBJECT;
    }

    /**
     * Checks whether the instruction is a static invocation, i.e. the first argument is no receiver.
     *
     * @return Returns {@code true} for invoke-static and invoke-static/range.
     */
    public boolean isStaticInvoke() {
        return opcode == Opcode.INVOKE_STATIC || opcode == Opcode.INVOKE_STATIC_RANGE;
    }

    @Override
    public String toString() {

        List<String> operands = new ArrayList<>();

        if (destination != null) {
            operands.add("v" + destination);
        }

        if (kind == InstructionKind.INVOKE || opcode.name.startsWith("filled-new-array")) {
            operands.add(Arrays.stream(sources).mapToObj(r -> "v" + r).collect(Collectors.joining(", ", "{", "}")));
        } else {
            for (int source : sources) {
                if (destination == null || source != destination) {
                    operands.add("v" + source);
                }
            }
        }

        if (literal != null) {
            operands.add("#" + literal);
        }
        if (branchOffset != null) {
            operands.add((branchOffset >= 0 ? "+" : "") + branchOffset);
        }
        if (referenceIndex != null) {
            operands.add(referenceKind.getPrefix() + "@" + referenceIndex);
        }

        return operands.isEmpty() ? opcode.name : opcode.name + " " + String.join(", ", operands);
    }

    static class Builder {

        private final int address;
        private final Opcode opcode;
        private final int codeUnits;
        private final List<Integer> sources = new ArrayList<>();
        private Integer destination;
        private Long literal;
        private Integer branchOffset;
        private Integer referenceIndex;
        private ReferenceKind referenceKind = ReferenceKind.NONE;

        Builder(int address, Opcode opcode, int codeUnits) {
            this.address = address;
            this.opcode = opcode;
            this.codeUnits = codeUnits;
        }

        Builder withDestination(int register) {
            this.destination = register;
            return this;
        }

        Builder withSource(int register) {
            this.sources.add(register);
            return this;
        }

        Builder withLiteral(long literal) {
            this.literal = literal;
            return this;
        }

        Builder withBranchOffset(int offset) {
            this.branchOffset = offset;
            return this;
        }

        Builder withReference(int index, ReferenceKind kind) {
            this.referenceIndex = index;
            this.referenceKind = kind;
            return this;
        }

        Instruction build() {
            return new Instruction(this);
        }
    }
}
