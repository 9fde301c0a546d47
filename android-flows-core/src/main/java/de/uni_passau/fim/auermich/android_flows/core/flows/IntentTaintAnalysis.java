package de.uni_passau.fim.auermich.android_flows.core.flows;

import de.uni_passau.fim.auermich.android_flows.core.dex.ClassTable;
import de.uni_passau.fim.auermich.android_flows.core.dex.DexClass;
import de.uni_passau.fim.auermich.android_flows.core.dex.DexMethod;
import de.uni_passau.fim.auermich.android_flows.core.dex.MethodReference;
import de.uni_passau.fim.auermich.android_flows.core.dex.ReferenceTable;
import de.uni_passau.fim.auermich.android_flows.core.dex.instructions.Instruction;
import de.uni_passau.fim.auermich.android_flows.core.dex.instructions.InstructionDecoder;
import de.uni_passau.fim.auermich.android_flows.core.dex.instructions.InstructionKind;
import de.uni_passau.fim.auermich.android_flows.core.dex.instructions.MalformedBytecodeException;
import de.uni_passau.fim.auermich.android_flows.core.errors.Diagnostic;
import de.uni_passau.fim.auermich.android_flows.core.errors.DiagnosticKind;
import de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph.CallPath;
import de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph.CallTargetResolver;
import de.uni_passau.fim.auermich.android_flows.core.resources.ResourceResolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jf.dexlib2.Opcode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Tracks data extracted from Intents along a call path.
 * <p>
 * Each method on the path is analysed flow-insensitively: a register is tainted if any instruction of the method
 * may write Intent data into it. Taint is seeded by the results of Intent getters such as
 * {@code getStringExtra} or {@code getData} and propagates through moves, casts, arithmetic, array elements,
 * fields and the results of calls with a tainted argument or receiver. A call with a tainted argument taints its
 * receiver too, unless the receiver is the analysed method's own {@code this} register. Tainted arguments of the
 * call to the next method on the path taint the corresponding parameter registers of that method.
 * <p>
 * Decoded methods are cached, hence an instance should be used by a single thread only.
 */
public class IntentTaintAnalysis {

    private static final Logger LOGGER = LogManager.getLogger(IntentTaintAnalysis.class);

    static final String INTENT_CLASS = "android.content.Intent";

    private static final Set<String> INTENT_SOURCES = Set.of("getData", "getDataString", "getClipData",
            "getExtras", "getBundleExtra", "getStringExtra", "getCharSequenceExtra", "getIntExtra", "getLongExtra",
            "getBooleanExtra", "getDoubleExtra", "getFloatExtra", "getParcelableExtra", "getSerializableExtra",
            "getStringArrayExtra", "getStringArrayListExtra", "getParcelableArrayExtra",
            "getParcelableArrayListExtra", "getByteArrayExtra", "getIntArrayExtra");

    private final ClassTable classTable;
    private final CallTargetResolver resolver;
    private final ResourceResolver resourceResolver;
    private final InstructionDecoder decoder = new InstructionDecoder();
    private final Map<MethodReference, Optional<List<Instruction>>> decodedMethods = new HashMap<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Creates a new taint analysis.
     *
     * @param classTable The classes of the APK.
     * @param resourceResolver Resolves string resources passed to the sink, may be {@code null}.
     */
    public IntentTaintAnalysis(ClassTable classTable, ResourceResolver resourceResolver) {
        this.classTable = classTable;
        this.resolver = new CallTargetResolver(classTable);
        this.resourceResolver = resourceResolver;
    }

    /**
     * Checks whether the given method extracts externally controlled data from an Intent.
     *
     * @param method The invoked method.
     * @return Returns {@code true} for the Intent getters of extras and URI data.
     */
    public static boolean isIntentSource(MethodReference method) {
        return method.getClassName().equals(INTENT_CLASS) && INTENT_SOURCES.contains(method.getMethodName());
    }

    /**
     * Analyses the given path. The last method of the path is the sink; the call of the sink by the
     * second to last method decides whether the sink receives tainted data.
     *
     * @param path The call path from a lifecycle method to a sink.
     * @return Returns the taint findings of the path.
     */
    public Result analyze(CallPath path) {

        List<MethodReference> methods = path.getMethods();
        Set<String> taintedFields = new HashSet<>();
        Set<Integer> entryTaint = new HashSet<>();
        MethodReference source = null;
        boolean sinkArgumentTainted = false;
        boolean constantSinkArgument = false;

        for (int i = 0; i < methods.size() - 1; i++) {

            MethodReference current = methods.get(i);
            MethodReference next = methods.get(i + 1);

            Optional<DexClass> declaringClass = classTable.lookup(current.getClassName());
            Optional<DexMethod> method = classTable.getMethod(current);
            Optional<List<Instruction>> instructions = method.flatMap(this::decode);

            if (declaringClass.isEmpty() || instructions.isEmpty()) {
                LOGGER.debug("Taint tracking stops at " + current + ", no bytecode available.");
                break;
            }

            int dexIndex = declaringClass.get().getDexIndex();
            MethodTaint taint = propagate(dexIndex, instructions.get(), thisRegister(method.get()), entryTaint,
                    taintedFields);

            if (source == null) {
                source = taint.source;
            }

            List<Integer> callSites = findCalls(dexIndex, instructions.get(), next);

            if (i == methods.size() - 2) {
                sinkArgumentTainted = callSites.stream()
                        .map(instructions.get()::get)
                        .anyMatch(call -> parameterArguments(call).stream().anyMatch(taint.registers::contains));
                constantSinkArgument = !callSites.isEmpty() && callSites.stream()
                        .allMatch(site -> isConstantArgument(dexIndex, instructions.get(), site));
            } else {
                entryTaint = mapIntoCallee(next, instructions.get(), callSites, taint.registers);
            }
        }

        TaintEvidence evidence;
        if (sinkArgumentTainted) {
            evidence = TaintEvidence.SINK_ARGUMENT;
        } else if (source != null) {
            evidence = TaintEvidence.PATH_SOURCE;
        } else {
            evidence = TaintEvidence.NONE;
        }

        return new Result(source, evidence, constantSinkArgument && !sinkArgumentTainted);
    }

    /**
     * Returns the problems met while decoding the methods along the analysed paths.
     *
     * @return Returns an unmodifiable view on the diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    private Optional<List<Instruction>> decode(DexMethod method) {
        return decodedMethods.computeIfAbsent(method.toMethodReference(), m -> {
            Optional<short[]> bytecode = method.getBytecode();
            if (bytecode.isEmpty()) {
                return Optional.empty();
            }
            String location = m.getFullSignature();
            try {
                return Optional.of(decoder.decode(bytecode.get(), location, diagnostics));
            } catch (MalformedBytecodeException e) {
                LOGGER.debug("Couldn't decode " + location + ": " + e.getMessage());
                diagnostics.add(new Diagnostic(DiagnosticKind.MALFORMED_METHOD, location, e.getMessage()));
                return Optional.empty();
            }
        });
    }

    /**
     * Returns the register holding the receiver of an instance method, i.e. the first parameter register.
     *
     * @return Returns the register or -1 for static methods.
     */
    private static int thisRegister(DexMethod method) {
        return method.isStatic() ? -1 : method.getRegisterCount() - method.getParameterRegisterCount();
    }

    /**
     * Computes the tainted registers and fields of a method until a fixpoint is reached.
     */
    private MethodTaint propagate(int dexIndex, List<Instruction> instructions, int thisRegister,
                                  Set<Integer> entryTaint, Set<String> taintedFields) {

        ReferenceTable referenceTable = classTable.getReferenceTable(dexIndex);
        MethodTaint taint = new MethodTaint(entryTaint);
        boolean changed = true;

        while (changed) {

            changed = false;
            boolean resultTainted = false;

            for (Instruction instruction : instructions) {

                if (instruction.isMoveResult()) {
                    if (resultTainted) {
                        changed |= taint.registers.add(instruction.getDestination().getAsInt());
                    }
                    resultTainted = false;
                    continue;
                }

                resultTainted = false;
                List<Integer> sources = instruction.getSources();
                OptionalInt destination = instruction.getDestination();
                String name = instruction.getOpcode().name;

                if (instruction.getKind() == InstructionKind.INVOKE) {
                    Optional<MethodReference> target = resolver.resolve(dexIndex, instruction);
                    if (target.isPresent() && isIntentSource(target.get())) {
                        if (taint.source == null) {
                            taint.source = target.get();
                        }
                        resultTainted = true;
                    } else if (sources.stream().anyMatch(taint.registers::contains)) {
                        if (!instruction.isStaticInvoke() && sources.get(0) != thisRegister) {
                            changed |= taint.registers.add(sources.get(0));
                        }
                        resultTainted = true;
                    }
                } else if (instruction.getKind() == InstructionKind.MOVE) {
                    if (destination.isPresent() && !sources.isEmpty() && taint.registers.contains(sources.get(0))) {
                        changed |= taint.registers.add(destination.getAsInt());
                    }
                } else if (name.startsWith("iget") || name.startsWith("sget")) {
                    Optional<String> field = field(referenceTable, instruction);
                    if (field.isPresent() && taintedFields.contains(field.get())) {
                        changed |= taint.registers.add(destination.getAsInt());
                    }
                } else if (name.startsWith("iput") || name.startsWith("sput")) {
                    Optional<String> field = field(referenceTable, instruction);
                    if (field.isPresent() && taint.registers.contains(sources.get(0))) {
                        changed |= taintedFields.add(field.get());
                    }
                } else if (name.startsWith("aput")) {
                    if (taint.registers.contains(sources.get(0))) {
                        changed |= taint.registers.add(sources.get(1));
                    }
                } else if (name.startsWith("aget")) {
                    if (taint.registers.contains(sources.get(0))) {
                        changed |= taint.registers.add(destination.getAsInt());
                    }
                } else if (name.startsWith("filled-new-array")) {
                    resultTainted = sources.stream().anyMatch(taint.registers::contains);
                } else if (instruction.getKind() == InstructionKind.OTHER && destination.isPresent()) {
                    // arithmetic, conversions and casts
                    if (sources.stream().anyMatch(taint.registers::contains)) {
                        changed |= taint.registers.add(destination.getAsInt());
                    }
                }
            }
        }

        return taint;
    }

    private static Optional<String> field(ReferenceTable referenceTable, Instruction instruction) {
        OptionalInt index = instruction.getReferenceIndex();
        return index.isPresent() ? referenceTable.findField(index.getAsInt()) : Optional.empty();
    }

    /**
     * Returns the positions of the invocations of the given method.
     */
    private List<Integer> findCalls(int dexIndex, List<Instruction> instructions, MethodReference callee) {
        List<Integer> callSites = new ArrayList<>();
        for (int i = 0; i < instructions.size(); i++) {
            Optional<MethodReference> target = resolver.resolve(dexIndex, instructions.get(i));
            if (target.isPresent() && target.get().equals(callee)) {
                callSites.add(i);
            }
        }
        return callSites;
    }

    /**
     * Maps tainted arguments to the parameter registers of the callee. The arguments occupy the last registers
     * of the callee's frame in argument order.
     */
    private Set<Integer> mapIntoCallee(MethodReference next, List<Instruction> instructions, List<Integer> callSites,
                                       Set<Integer> tainted) {

        Set<Integer> calleeTaint = new HashSet<>();
        Optional<DexMethod> callee = classTable.getMethod(next);

        if (callee.isEmpty()) {
            return calleeTaint;
        }

        int registerCount = callee.get().getRegisterCount();

        for (int site : callSites) {
            List<Integer> arguments = instructions.get(site).getSources();
            for (int position = 0; position < arguments.size(); position++) {
                if (tainted.contains(arguments.get(position))) {
                    calleeTaint.add(registerCount - arguments.size() + position);
                }
            }
        }
        return calleeTaint;
    }

    /**
     * Returns the argument registers of an invocation without the receiver.
     */
    private static List<Integer> parameterArguments(Instruction call) {
        List<Integer> arguments = call.getSources();
        if (call.isStaticInvoke() || arguments.isEmpty()) {
            return arguments;
        }
        return arguments.subList(1, arguments.size());
    }

    /**
     * Checks whether the first parameter of the call at the given position is always a constant: a string
     * literal, or a string resource that can be resolved.
     */
    private boolean isConstantArgument(int dexIndex, List<Instruction> instructions, int callSite) {

        List<Integer> arguments = parameterArguments(instructions.get(callSite));
        if (arguments.isEmpty()) {
            return false;
        }

        List<Integer> writers = writersOf(instructions, arguments.get(0));
        if (writers.isEmpty()) {
            return false;
        }

        for (int writer : writers) {
            Opcode opcode = instructions.get(writer).getOpcode();
            if (opcode == Opcode.CONST_STRING || opcode == Opcode.CONST_STRING_JUMBO) {
                continue;
            }
            if (!isResolvedStringResource(dexIndex, instructions, writer)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks whether the instruction at the given position fetches the result of a {@code getString(int)} call
     * whose resource id is a literal the resource resolver knows.
     */
    private boolean isResolvedStringResource(int dexIndex, List<Instruction> instructions, int position) {

        if (resourceResolver == null || position == 0 || !instructions.get(position).isMoveResult()) {
            return false;
        }

        Instruction call = instructions.get(position - 1);
        Optional<MethodReference> target = resolver.resolve(dexIndex, call);

        if (target.isEmpty() || !target.get().getMethodName().equals("getString")
                || !target.get().getParameterTypes().equals(List.of("int"))) {
            return false;
        }

        List<Integer> arguments = call.getSources();
        List<Integer> writers = writersOf(instructions, arguments.get(arguments.size() - 1));

        return !writers.isEmpty() && writers.stream().map(instructions::get).allMatch(writer ->
                writer.getKind() == InstructionKind.CONST && writer.getLiteral().isPresent()
                        && resourceResolver.resolveString((int) writer.getLiteral().getAsLong()).isPresent());
    }

    private static List<Integer> writersOf(List<Instruction> instructions, int register) {
        List<Integer> writers = new ArrayList<>();
        for (int i = 0; i < instructions.size(); i++) {
            OptionalInt destination = instructions.get(i).getDestination();
            if (destination.isPresent() && destination.getAsInt() == register) {
                writers.add(i);
            }
        }
        return writers;
    }

    private static class MethodTaint {

        private final Set<Integer> registers;
        private MethodReference source;

        private MethodTaint(Set<Integer> entryTaint) {
            this.registers = new HashSet<>(entryTaint);
        }
    }

    /**
     * The findings of the taint analysis of a single path.
     */
    public static class Result {

        private final MethodReference source;
        private final TaintEvidence evidence;
        private final boolean constantSinkArgument;

        Result(MethodReference source, TaintEvidence evidence, boolean constantSinkArgument) {
            this.source = source;
            this.evidence = evidence;
            this.constantSinkArgument = constantSinkArgument;
        }

        /**
         * Returns the first Intent getter invoked along the path.
         *
         * @return Returns the Intent getter if any.
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
    }
}
