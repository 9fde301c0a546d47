package de.uni_passau.fim.auermich.android_flows.core.dex;

import de.uni_passau.fim.auermich.android_flows.core.utility.DexUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects classes by package, name and modifiers. All criteria are optional and combined conjunctively.
 */
public class ClassFilter {

    private final List<String> packages;
    private final List<String> excludedPackages;
    private final String className;
    private final Integer requiredAccessFlags;

    private ClassFilter(Builder builder) {
        this.packages = List.copyOf(builder.packages);
        this.excludedPackages = List.copyOf(builder.excludedPackages);
        this.className = builder.className;
        this.requiredAccessFlags = builder.requiredAccessFlags;
    }

    /**
     * Returns a filter accepting every class.
     *
     * @return Returns the accept-all filter.
     */
    public static ClassFilter any() {
        return new Builder().build();
    }

    /**
     * Checks whether the given class satisfies every criterion of the filter.
     *
     * @param dexClass The class to be checked.
     * @return Returns {@code true} if the class matches.
     */
    public boolean matches(DexClass dexClass) {

        if (!packages.isEmpty() && packages.stream()
                .noneMatch(p -> DexUtils.matchesPackagePrefix(dexClass.getClassName(), p))) {
            return false;
        }

        if (excludedPackages.stream().anyMatch(p -> DexUtils.matchesPackagePrefix(dexClass.getClassName(), p))) {
            return false;
        }

        if (className != null && !dexClass.getClassName().contains(className)
                && !dexClass.getSimpleName().contains(className)) {
            return false;
        }

        return requiredAccessFlags == null
                || (dexClass.getAccessFlags() & requiredAccessFlags) == requiredAccessFlags;
    }

    public static class Builder {

        private final List<String> packages = new ArrayList<>();
        private final List<String> excludedPackages = new ArrayList<>();
        private String className;
        private Integer requiredAccessFlags;

        public Builder withPackage(String packagePrefix) {
            packages.add(packagePrefix);
            return this;
        }

        public Builder withPackages(List<String> packagePrefixes) {
            packages.addAll(packagePrefixes);
            return this;
        }

        public Builder withExcludedPackage(String packagePrefix) {
            excludedPackages.add(packagePrefix);
            return this;
        }

        public Builder withClassName(String className) {
            this.className = className;
            return this;
        }

        public Builder withAccessFlags(int accessFlags) {
            this.requiredAccessFlags = accessFlags;
            return this;
        }

        public ClassFilter build() {
            return new ClassFilter(this);
        }
    }
}
