package de.uni_passau.fim.auermich.android_flows.core.dex;

import de.uni_passau.fim.auermich.android_flows.core.utility.DexUtils;
import org.jf.dexlib2.AccessFlags;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A class parsed from one of the dex files of an APK. The dotted class name is the unique key of a class
 * within a {@link ClassTable}.
 */
public class DexClass {

    private final String className;
    private final String superclass;
    private final Set<String> interfaces;
    private final int accessFlags;
    private final List<DexMethod> methods;
    private final List<DexField> fields;

    /**
     * The position of the defining dex file within the APK, selects the {@link ReferenceTable} that the
     * indices within the bytecode of this class refer to.
     */
    private final int dexIndex;

    public DexClass(String className, String superclass, Set<String> interfaces, int accessFlags,
                    List<DexMethod> methods, List<DexField> fields, int dexIndex) {
        this.className = Objects.requireNonNull(className);
        this.superclass = superclass;
        this.interfaces = Collections.unmodifiableSet(new LinkedHashSet<>(interfaces));
        this.accessFlags = accessFlags;
        this.methods = List.copyOf(methods);
        this.fields = List.copyOf(fields);
        this.dexIndex = dexIndex;
    }

    public String getClassName() {
        return className;
    }

    public String getPackageName() {
        return DexUtils.getPackageName(className);
    }

    public String getSimpleName() {
        return DexUtils.getSimpleName(className);
    }

    public Optional<String> getSuperclass() {
        return Optional.ofNullable(superclass);
    }

    public Set<String> getInterfaces() {
        return interfaces;
    }

    public int getAccessFlags() {
        return accessFlags;
    }

    public List<DexMethod> getMethods() {
        return methods;
    }

    public List<DexField> getFields() {
        return fields;
    }

    public int getDexIndex() {
        return dexIndex;
    }

    public boolean isInterface() {
        return AccessFlags.INTERFACE.isSet(accessFlags);
    }

    public boolean isAbstract() {
        return AccessFlags.ABSTRACT.isSet(accessFlags);
    }

    /**
     * Looks up a declared method by name and parameter types.
     *
     * @param name The method name.
     * @param parameterTypes The dotted parameter types.
     * @return Returns the declared method if present.
     */
    public Optional<DexMethod> getMethod(String name, List<String> parameterTypes) {
        return methods.stream()
                .filter(m -> m.getName().equals(name) && m.getParameterTypes().equals(parameterTypes))
                .findFirst();
    }

    /**
     * Returns all declared overloads of the given method name.
     *
     * @param name The method name.
     * @return Returns the matching methods in declaration order.
     */
    public List<DexMethod> getMethods(String name) {
        return methods.stream().filter(m -> m.getName().equals(name)).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DexClass dexClass = (DexClass) o;
        return className.equals(dexClass.className);
    }

    @Override
    public int hashCode() {
        return className.hashCode();
    }

    @Override
    public String toString() {
        return className;
    }
}
