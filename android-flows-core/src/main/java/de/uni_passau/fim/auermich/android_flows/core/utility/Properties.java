package de.uni_passau.fim.auermich.android_flows.core.utility;

import java.util.regex.Pattern;

/**
 * The tunable knobs of an analysis run.
 */
public class Properties {

    private static final Pattern EXCLUSION_PATTERN = Utility.readExcludePatterns();

    /**
     * The number of worker threads used by the parallel extraction and graph construction.
     */
    public final int parallelism;

    /**
     * The number of chunks the work is split into in parallel mode.
     */
    public final int partitions;

    /**
     * Whether lifecycle methods inherited from a superclass within the app count as entry methods.
     */
    public final boolean resolveInheritedLifecycleMethods;

    /**
     * Matches class names of frameworks and libraries, see {@link Utility#readExcludePatterns()}.
     * The pattern is read once and shared by all instances.
     */
    public final Pattern exclusionPattern = EXCLUSION_PATTERN;

    public Properties(int parallelism, int partitions, boolean resolveInheritedLifecycleMethods) {
        if (parallelism < 1 || partitions < 1) {
            throw new IllegalArgumentException("Parallelism and partitions must be positive!");
        }
        this.parallelism = parallelism;
        this.partitions = partitions;
        this.resolveInheritedLifecycleMethods = resolveInheritedLifecycleMethods;
    }

    /**
     * The default properties: one worker per available processor, four chunks per worker.
     *
     * @return Returns the default properties.
     */
    public static Properties defaults() {
        int processors = Runtime.getRuntime().availableProcessors();
        return new Properties(processors, processors * 4, true);
    }

    /**
     * Checks whether the given class belongs to a framework or library according to the exclusion pattern.
     *
     * @param className The dotted class name.
     * @return Returns {@code true} if the class is excluded, otherwise {@code false}.
     */
    public boolean isExcluded(String className) {
        return exclusionPattern != null && exclusionPattern.matcher(className).matches();
    }
}
