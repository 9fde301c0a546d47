package de.uni_passau.fim.auermich.android_flows.core.dex;

import de.uni_passau.fim.auermich.android_flows.core.errors.AnalysisException;
import de.uni_passau.fim.auermich.android_flows.core.errors.Diagnostic;
import de.uni_passau.fim.auermich.android_flows.core.errors.DiagnosticKind;
import de.uni_passau.fim.auermich.android_flows.core.errors.ErrorKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The classes of one APK keyed by their dotted class name, together with the reference tables of the dex
 * files they were read from. The table is immutable and may be shared between threads.
 */
public class ClassTable {

    private static final Logger LOGGER = LogManager.getLogger(ClassTable.class);

    private final List<DexClass> classes;
    private final Map<String, DexClass> classesByName;
    private final List<ReferenceTable> referenceTables;
    private final List<Diagnostic> diagnostics;

    /**
     * Creates a new class table. If a class name occurs more than once, the first occurrence is kept and a
     * {@link DiagnosticKind#DUPLICATE_CLASS} diagnostic is recorded.
     *
     * @param classes The classes in dex file order.
     * @param referenceTables The reference tables, one per dex file, ordered by dex index.
     * @param diagnostics The diagnostics recorded while reading the classes.
     */
    public ClassTable(List<DexClass> classes, List<ReferenceTable> referenceTables, List<Diagnostic> diagnostics) {

        List<DexClass> unique = new ArrayList<>(classes.size());
        Map<String, DexClass> byName = new HashMap<>();
        List<Diagnostic> allDiagnostics = new ArrayList<>(diagnostics);

        for (DexClass dexClass : classes) {
            if (byName.putIfAbsent(dexClass.getClassName(), dexClass) == null) {
                unique.add(dexClass);
            } else {
                LOGGER.debug("Duplicate class definition: " + dexClass.getClassName());
                allDiagnostics.add(new Diagnostic(DiagnosticKind.DUPLICATE_CLASS, dexClass.getClassName(),
                        "Class defined again in dex file " + dexClass.getDexIndex()));
            }
        }

        this.classes = Collections.unmodifiableList(unique);
        this.classesByName = Collections.unmodifiableMap(byName);
        this.referenceTables = List.copyOf(referenceTables);
        this.diagnostics = Collections.unmodifiableList(allDiagnostics);
    }

    public List<DexClass> getClasses() {
        return classes;
    }

    public int size() {
        return classes.size();
    }

    /**
     * Looks up a class by its dotted name.
     *
     * @param className The dotted class name.
     * @return Returns the class if it is defined in the APK.
     */
    public Optional<DexClass> lookup(String className) {
        return Optional.ofNullable(classesByName.get(className));
    }

    public boolean contains(String className) {
        return classesByName.containsKey(className);
    }

    public List<ReferenceTable> getReferenceTables() {
        return referenceTables;
    }

    public ReferenceTable getReferenceTable(int dexIndex) {
        if (dexIndex < 0 || dexIndex >= referenceTables.size()) {
            throw new AnalysisException(ErrorKind.NOT_FOUND, "No dex file with index " + dexIndex);
        }
        return referenceTables.get(dexIndex);
    }

    /**
     * Resolves a method index within the method table of the given dex file.
     *
     * @param dexIndex The dex file the index belongs to.
     * @param methodIndex The method index.
     * @return Returns the referenced method.
     * @throws AnalysisException of kind {@link ErrorKind#NOT_FOUND} if the index is out of range.
     */
    public MethodReference resolveMethod(int dexIndex, int methodIndex) {
        return getReferenceTable(dexIndex).resolveMethod(methodIndex);
    }

    /**
     * Resolves a method index without knowing the dex file it belongs to. The method tables are tried
     * in dex file order, which is exact for single-dex APKs only.
     *
     * @param methodIndex The method index.
     * @return Returns the first method found under the index.
     * @throws AnalysisException of kind {@link ErrorKind#NOT_FOUND} if no table contains the index.
     */
    public MethodReference resolveMethod(int methodIndex) {
        for (ReferenceTable table : referenceTables) {
            Optional<MethodReference> method = table.findMethod(methodIndex);
            if (method.isPresent()) {
                return method.get();
            }
        }
        throw new AnalysisException(ErrorKind.NOT_FOUND, "Method index " + methodIndex + " not found in any of "
                + referenceTables.size() + " dex files");
    }

    /**
     * Returns the method the given reference denotes if it is declared by a class of the APK.
     *
     * @param method The method reference.
     * @return Returns the declared method if present.
     */
    public Optional<DexMethod> getMethod(MethodReference method) {
        return lookup(method.getClassName())
                .flatMap(c -> c.getMethod(method.getMethodName(), method.getParameterTypes()));
    }

    /**
     * Looks up the method that a call to the given reference executes if the receiver is exactly of the
     * referenced class: the method declared by the class itself or else by the closest superclass within
     * the APK.
     *
     * @param method The method reference.
     * @return Returns the declaring method if it lies within the APK.
     */
    public Optional<DexMethod> resolveDeclaringMethod(MethodReference method) {
        for (DexClass dexClass : getSuperclassChain(method.getClassName())) {
            Optional<DexMethod> declared = dexClass.getMethod(method.getMethodName(), method.getParameterTypes());
            if (declared.isPresent()) {
                return declared;
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the given class followed by its superclasses as long as they are defined in the APK.
     *
     * @param className The dotted class name.
     * @return Returns the chain of classes, empty if the class itself is not defined.
     */
    public List<DexClass> getSuperclassChain(String className) {
        List<DexClass> chain = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Optional<DexClass> current = lookup(className);
        while (current.isPresent() && seen.add(current.get().getClassName())) {
            chain.add(current.get());
            current = current.get().getSuperclass().flatMap(this::lookup);
        }
        return chain;
    }

    public Optional<DexClass> findClass(ClassFilter filter) {
        return classes.stream().filter(filter::matches).findFirst();
    }

    /**
     * Returns the classes matching the given filter.
     *
     * @param filter The class filter.
     * @param limit The maximal number of classes to return.
     * @return Returns the matching classes in table order.
     */
    public List<DexClass> findClasses(ClassFilter filter, int limit) {
        return classes.stream().filter(filter::matches).limit(limit).collect(Collectors.toList());
    }

    /**
     * Returns the methods matching the method filter that are declared by classes matching the class filter.
     *
     * @param classFilter The class filter.
     * @param methodFilter The method filter.
     * @param limit The maximal number of methods to return.
     * @return Returns the matching methods in table order.
     */
    public List<DexMethod> findMethods(ClassFilter classFilter, MethodFilter methodFilter, int limit) {
        return classes.stream()
                .filter(classFilter::matches)
                .flatMap(c -> c.getMethods().stream())
                .filter(methodFilter::matches)
                .limit(limit)
                .collect(Collectors.toList());
    }

    /**
     * Returns the problems recorded while the classes were read.
     *
     * @return Returns an unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
