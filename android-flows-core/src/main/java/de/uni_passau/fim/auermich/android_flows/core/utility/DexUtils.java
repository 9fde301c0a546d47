package de.uni_passau.fim.auermich.android_flows.core.utility;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts dex type descriptors into the dotted Java notation used throughout the analysis.
 */
public final class DexUtils {

    private DexUtils() {
        throw new UnsupportedOperationException("Utility class!");
    }

    /**
     * Converts a type descriptor into its Java representation, e.g. {@code Lcom/x/Foo;} becomes
     * {@code com.x.Foo}, {@code [I} becomes {@code int[]} and {@code V} becomes {@code void}.
     *
     * @param descriptor The type descriptor.
     * @return Returns the dotted Java type name.
     */
    public static String toJavaType(CharSequence descriptor) {

        String type = descriptor.toString();
        int dimensions = 0;

        while (dimensions < type.length() && type.charAt(dimensions) == '[') {
            dimensions++;
        }

        String elementType = type.substring(dimensions);
        String javaType;

        switch (elementType) {
            case "V":
                javaType = "void";
                break;
            case "Z":
                javaType = "boolean";
                break;
            case "B":
                javaType = "byte";
                break;
            case "S":
                javaType = "short";
                break;
            case "C":
                javaType = "char";
                break;
            case "I":
                javaType = "int";
                break;
            case "J":
                javaType = "long";
                break;
            case "F":
                javaType = "float";
                break;
            case "D":
                javaType = "double";
                break;
            default:
                if (elementType.startsWith("L") && elementType.endsWith(";")) {
                    javaType = elementType.substring(1, elementType.length() - 1).replace('/', '.');
                } else {
                    // already dotted or unknown, keep as is
                    javaType = elementType;
                }
        }

        return javaType + "[]".repeat(dimensions);
    }

    /**
     * Converts the given descriptors into their Java representation.
     *
     * @param descriptors The type descriptors.
     * @return Returns the dotted Java type names in the same order.
     */
    public static List<String> toJavaTypes(Collection<? extends CharSequence> descriptors) {
        return descriptors.stream().map(DexUtils::toJavaType).collect(Collectors.toList());
    }

    /**
     * Returns the package of a dotted class name, or the empty string for the default package.
     *
     * @param className The dotted class name.
     * @return Returns the package name.
     */
    public static String getPackageName(String className) {
        int index = className.lastIndexOf('.');
        return index == -1 ? "" : className.substring(0, index);
    }

    /**
     * Returns the simple name of a dotted class name. Inner classes keep their '$' separated suffix.
     *
     * @param className The dotted class name.
     * @return Returns the simple class name.
     */
    public static String getSimpleName(String className) {
        return className.substring(className.lastIndexOf('.') + 1);
    }

    /**
     * Checks whether a class lies within a package prefix. A prefix matches the class itself, its
     * package, and every sub package, but never a sibling sharing a textual prefix
     * ({@code com.x} matches {@code com.x.Foo} but not {@code com.xyz.Foo}).
     *
     * @param className The dotted class name.
     * @param prefix The package prefix, with or without a trailing dot.
     * @return Returns {@code true} if the class is covered by the prefix.
     */
    public static boolean matchesPackagePrefix(String className, String prefix) {
        if (prefix.isEmpty()) {
            return true;
        }
        if (prefix.endsWith(".")) {
            return className.startsWith(prefix);
        }
        return className.equals(prefix) || className.startsWith(prefix + ".");
    }

    /**
     * Checks whether the wide (64 bit) types long and double occupy two registers.
     *
     * @param javaType The dotted Java type.
     * @return Returns {@code true} for long and double.
     */
    public static boolean isWideType(String javaType) {
        return javaType.equals("long") || javaType.equals("double");
    }
}
