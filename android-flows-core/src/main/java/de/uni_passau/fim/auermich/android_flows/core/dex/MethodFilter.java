package de.uni_passau.fim.auermich.android_flows.core.dex;

import java.util.ArrayList;
import java.util.List;

/**
 * Selects methods by name, parameters, return type and modifiers. Names and types are matched as substrings.
 */
public class MethodFilter {

    private final String methodName;
    private final Integer parameterCount;
    private final List<String> parameterTypes;
    private final String returnType;
    private final Integer requiredAccessFlags;

    private MethodFilter(Builder builder) {
        this.methodName = builder.methodName;
        this.parameterCount = builder.parameterCount;
        this.parameterTypes = builder.parameterTypes == null ? null : List.copyOf(builder.parameterTypes);
        this.returnType = builder.returnType;
        this.requiredAccessFlags = builder.requiredAccessFlags;
    }

    public static MethodFilter any() {
        return new Builder().build();
    }

    /**
     * Checks whether the given method satisfies every criterion of the filter.
     *
     * @param method The method to be checked.
     * @return Returns {@code true} if the method matches.
     */
    public boolean matches(DexMethod method) {

        if (methodName != null && !method.getName().contains(methodName)) {
            return false;
        }

        if (parameterCount != null && method.getParameterTypes().size() != parameterCount) {
            return false;
        }

        if (parameterTypes != null) {
            if (method.getParameterTypes().size() != parameterTypes.size()) {
                return false;
            }
            for (int i = 0; i < parameterTypes.size(); i++) {
                if (!method.getParameterTypes().get(i).contains(parameterTypes.get(i))) {
                    return false;
                }
            }
        }

        if (returnType != null && !method.getReturnType().contains(returnType)) {
            return false;
        }

        return requiredAccessFlags == null
                || (method.getAccessFlags() & requiredAccessFlags) == requiredAccessFlags;
    }

    public static class Builder {

        private String methodName;
        private Integer parameterCount;
        private List<String> parameterTypes;
        private String returnType;
        private Integer requiredAccessFlags;

        public Builder withMethodName(String methodName) {
            this.methodName = methodName;
            return this;
        }

        public Builder withParameterCount(int parameterCount) {
            this.parameterCount = parameterCount;
            return this;
        }

        public Builder withParameterTypes(List<String> parameterTypes) {
            this.parameterTypes = new ArrayList<>(parameterTypes);
            return this;
        }

        public Builder withReturnType(String returnType) {
            this.returnType = returnType;
            return this;
        }

        public Builder withAccessFlags(int accessFlags) {
            this.requiredAccessFlags = accessFlags;
            return this;
        }

        public MethodFilter build() {
            return new MethodFilter(this);
        }
    }
}
