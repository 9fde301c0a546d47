package de.uni_passau.fim.auermich.android_flows.core.dex;

import java.util.Objects;
import java.util.Optional;

/**
 * A field declared by a {@link DexClass}.
 */
public class DexField {

    private final String className;
    private final String name;
    private final String type;
    private final int accessFlags;

    /**
     * The static initial value if it is an int constant, e.g. the id of an R$string entry.
     */
    private final Integer initialValue;

    public DexField(String className, String name, String type, int accessFlags, Integer initialValue) {
        this.className = className;
        this.name = name;
        this.type = type;
        this.accessFlags = accessFlags;
        this.initialValue = initialValue;
    }

    public String getClassName() {
        return className;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public int getAccessFlags() {
        return accessFlags;
    }

    public Optional<Integer> getInitialValue() {
        return Optional.ofNullable(initialValue);
    }

    /**
     * Returns the dotted name of the field, e.g. {@code com.x.R$string.app_name}.
     *
     * @return Returns the qualified field name.
     */
    public String getQualifiedName() {
        return className + "." + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DexField dexField = (DexField) o;
        return className.equals(dexField.className) && name.equals(dexField.name) && type.equals(dexField.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(className, name, type);
    }

    @Override
    public String toString() {
        return getQualifiedName() + ": " + type;
    }
}
