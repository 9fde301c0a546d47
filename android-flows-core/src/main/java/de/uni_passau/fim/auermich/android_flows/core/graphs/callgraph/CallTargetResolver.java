package de.uni_passau.fim.auermich.android_flows.core.graphs.callgraph;

import de.uni_passau.fim.auermich.android_flows.core.dex.ClassTable;
import de.uni_passau.fim.auermich.android_flows.core.dex.DexMethod;
import de.uni_passau.fim.auermich.android_flows.core.dex.MethodReference;
import de.uni_passau.fim.auermich.android_flows.core.dex.instructions.Instruction;
import de.uni_passau.fim.auermich.android_flows.core.dex.instructions.ReferenceKind;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Resolves the method an invoke instruction targets. A reference to a class of the APK is redirected to the
 * declaring method along the superclass chain, e.g. a call of {@code MainActivity.helper()} where helper is
 * declared by {@code BaseActivity} targets {@code BaseActivity.helper()}. References to classes outside the
 * APK are kept as they are.
 */
public class CallTargetResolver {

    private final ClassTable classTable;

    public CallTargetResolver(ClassTable classTable) {
        this.classTable = classTable;
    }

    /**
     * Resolves the target of an invoke instruction.
     *
     * @param dexIndex The dex file defining the calling method.
     * @param instruction The invoke instruction.
     * @return Returns the invoked method, or an empty optional if the instruction references no method or the
     *         method index is out of range.
     */
    public Optional<MethodReference> resolve(int dexIndex, Instruction instruction) {

        OptionalInt index = instruction.getReferenceIndex();

        if (!instruction.isInvoke() || index.isEmpty() || instruction.getReferenceKind() != ReferenceKind.METHOD) {
            return Optional.empty();
        }

        return classTable.getReferenceTable(dexIndex).findMethod(index.getAsInt()).map(this::normalize);
    }

    /**
     * Redirects a method reference to its declaring method within the APK.
     *
     * @param referenced The referenced method.
     * @return Returns the declaring method, or the given reference if it is not declared within the APK.
     */
    public MethodReference normalize(MethodReference referenced) {
        if (!classTable.contains(referenced.getClassName())) {
            return referenced;
        }
        return classTable.resolveDeclaringMethod(referenced)
                .map(DexMethod::toMethodReference)
                .orElse(referenced);
    }
}
