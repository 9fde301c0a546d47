package de.uni_passau.fim.auermich.android_flows.core.dex;

import de.uni_passau.fim.auermich.android_flows.core.utility.DexUtils;

import java.util.List;
import java.util.Objects;

/**
 * A resolved method reference (class, name, parameter types, return type). Method references label the
 * vertices of the call graph and are the unit sink patterns are matched against. All type names are in
 * dotted Java notation.
 */
public class MethodReference implements Comparable<MethodReference> {

    private final String className;
    private final String methodName;
    private final List<String> parameterTypes;
    private final String returnType;

    /**
     * The full signature is queried by every substring search and comparison, hence computed once.
     */
    private final String fullSignature;

    public MethodReference(String className, String methodName, List<String> parameterTypes, String returnType) {
        this.className = Objects.requireNonNull(className);
        this.methodName = Objects.requireNonNull(methodName);
        this.parameterTypes = List.copyOf(parameterTypes);
        this.returnType = Objects.requireNonNull(returnType);
        this.fullSignature = className + "." + methodName + "(" + String.join(", ", this.parameterTypes) + "): "
                + returnType;
    }

    /**
     * Converts a dexlib2 method reference into its dotted representation.
     *
     * @param reference The dexlib2 method reference, e.g. {@code Lcom/x/Foo;->bar(I)V}.
     * @return Returns the corresponding method reference, e.g. {@code com.x.Foo.bar(int): void}.
     */
    public static MethodReference of(org.jf.dexlib2.iface.reference.MethodReference reference) {
        return new MethodReference(DexUtils.toJavaType(reference.getDefiningClass()), reference.getName(),
                DexUtils.toJavaTypes(reference.getParameterTypes()), DexUtils.toJavaType(reference.getReturnType()));
    }

    public String getClassName() {
        return className;
    }

    public String getMethodName() {
        return methodName;
    }

    public List<String> getParameterTypes() {
        return parameterTypes;
    }

    public String getReturnType() {
        return returnType;
    }

    /**
     * Returns the class name followed by the method name, e.g. {@code android.webkit.WebView.loadUrl}.
     *
     * @return Returns the qualified method name.
     */
    public String getQualifiedName() {
        return className + "." + methodName;
    }

    /**
     * Returns the full signature, e.g. {@code android.webkit.WebView.loadUrl(java.lang.String): void}.
     * Overloads differ in their full signature.
     *
     * @return Returns the full signature.
     */
    public String getFullSignature() {
        return fullSignature;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MethodReference that = (MethodReference) o;
        return fullSignature.equals(that.fullSignature);
    }

    @Override
    public int hashCode() {
        return fullSignature.hashCode();
    }

    @Override
    public int compareTo(MethodReference other) {
        return fullSignature.compareTo(other.fullSignature);
    }

    @Override
    public String toString() {
        return fullSignature;
    }
}
