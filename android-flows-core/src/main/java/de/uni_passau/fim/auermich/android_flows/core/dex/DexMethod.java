package de.uni_passau.fim.auermich.android_flows.core.dex;

import de.uni_passau.fim.auermich.android_flows.core.utility.DexUtils;
import org.jf.dexlib2.AccessFlags;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A method declared by a {@link DexClass}. A method is identified by its declaring class, its name and its
 * parameter types. The raw bytecode is kept as the sequence of 16 bit code units and decoded on demand.
 */
public class DexMethod {

    private final String className;
    private final String name;
    private final List<String> parameterTypes;
    private final String returnType;
    private final int accessFlags;
    private final int registerCount;

    /**
     * The code units, {@code null} for abstract and native methods or when the code couldn't be read.
     */
    private final short[] bytecode;

    public DexMethod(String className, String name, List<String> parameterTypes, String returnType,
                     int accessFlags, int registerCount, short[] bytecode) {
        this.className = Objects.requireNonNull(className);
        this.name = Objects.requireNonNull(name);
        this.parameterTypes = List.copyOf(parameterTypes);
        this.returnType = Objects.requireNonNull(returnType);
        this.accessFlags = accessFlags;
        this.registerCount = registerCount;
        this.bytecode = bytecode == null ? null : bytecode.clone();
    }

    public String getClassName() {
        return className;
    }

    public String getName() {
        return name;
    }

    public List<String> getParameterTypes() {
        return parameterTypes;
    }

    public String getReturnType() {
        return returnType;
    }

    public int getAccessFlags() {
        return accessFlags;
    }

    /**
     * Returns the total number of registers the method uses, including the parameter registers.
     *
     * @return Returns the register count.
     */
    public int getRegisterCount() {
        return registerCount;
    }

    public boolean hasBytecode() {
        return bytecode != null;
    }

    /**
     * Returns a copy of the raw code units.
     *
     * @return Returns the code units if the method has an implementation.
     */
    public Optional<short[]> getBytecode() {
        return bytecode == null ? Optional.empty() : Optional.of(bytecode.clone());
    }

    public boolean isStatic() {
        return AccessFlags.STATIC.isSet(accessFlags);
    }

    public boolean isAbstract() {
        return AccessFlags.ABSTRACT.isSet(accessFlags);
    }

    public boolean isNative() {
        return AccessFlags.NATIVE.isSet(accessFlags);
    }

    /**
     * Returns the number of registers occupied by the parameters, including the implicit 'this' reference
     * of instance methods. Parameters of type long and double take two registers.
     *
     * @return Returns the number of parameter registers.
     */
    public int getParameterRegisterCount() {
        int count = isStatic() ? 0 : 1;
        for (String parameterType : parameterTypes) {
            count += DexUtils.isWideType(parameterType) ? 2 : 1;
        }
        return count;
    }

    /**
     * Returns the reference under which the method appears in the call graph.
     *
     * @return Returns the method reference.
     */
    public MethodReference toMethodReference() {
        return new MethodReference(className, name, parameterTypes, returnType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DexMethod dexMethod = (DexMethod) o;
        return className.equals(dexMethod.className) && name.equals(dexMethod.name)
                && parameterTypes.equals(dexMethod.parameterTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(className, name, parameterTypes);
    }

    @Override
    public String toString() {
        return toMethodReference().getFullSignature();
    }
}
