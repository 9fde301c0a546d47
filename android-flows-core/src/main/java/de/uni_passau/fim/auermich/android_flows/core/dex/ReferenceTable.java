package de.uni_passau.fim.auermich.android_flows.core.dex;

import de.uni_passau.fim.auermich.android_flows.core.errors.AnalysisException;
import de.uni_passau.fim.auermich.android_flows.core.errors.ErrorKind;
import de.uni_passau.fim.auermich.android_flows.core.utility.DexUtils;
import org.jf.dexlib2.dexbacked.DexBackedDexFile;
import org.jf.dexlib2.iface.reference.FieldReference;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The method, field and string tables of a single dex file. Indices found in the bytecode of a class refer
 * to the table of the dex file defining the class. A table is built once and read concurrently afterwards.
 */
public class ReferenceTable {

    private final int dexIndex;
    private final List<MethodReference> methods;

    /**
     * Field references in the dotted form {@code class.field}.
     */
    private final List<String> fields;

    private final List<String> strings;

    public ReferenceTable(int dexIndex, List<MethodReference> methods, List<String> fields, List<String> strings) {
        this.dexIndex = dexIndex;
        this.methods = List.copyOf(methods);
        this.fields = List.copyOf(fields);
        this.strings = List.copyOf(strings);
    }

    /**
     * Reads the method, field and string sections of the given dex file.
     *
     * @param dexIndex The position of the dex file within the APK.
     * @param dexFile The dex file.
     * @return Returns the reference table of the dex file.
     */
    public static ReferenceTable fromDexFile(int dexIndex, DexBackedDexFile dexFile) {

        var methodSection = dexFile.getMethodSection();
        List<MethodReference> methods = new ArrayList<>(methodSection.size());
        for (int i = 0; i < methodSection.size(); i++) {
            methods.add(MethodReference.of(methodSection.get(i)));
        }

        var fieldSection = dexFile.getFieldSection();
        List<String> fields = new ArrayList<>(fieldSection.size());
        for (int i = 0; i < fieldSection.size(); i++) {
            FieldReference field = fieldSection.get(i);
            fields.add(DexUtils.toJavaType(field.getDefiningClass()) + "." + field.getName());
        }

        var stringSection = dexFile.getStringSection();
        List<String> strings = new ArrayList<>(stringSection.size());
        for (int i = 0; i < stringSection.size(); i++) {
            strings.add(stringSection.get(i));
        }

        return new ReferenceTable(dexIndex, methods, fields, strings);
    }

    public int getDexIndex() {
        return dexIndex;
    }

    /**
     * Resolves a method index.
     *
     * @param methodIndex The index into the method table.
     * @return Returns the referenced method.
     * @throws AnalysisException of kind {@link ErrorKind#NOT_FOUND} if the index is out of range.
     */
    public MethodReference resolveMethod(int methodIndex) {
        return findMethod(methodIndex).orElseThrow(() -> new AnalysisException(ErrorKind.NOT_FOUND,
                "Method index " + methodIndex + " out of range in dex file " + dexIndex + " ("
                        + methods.size() + " methods)"));
    }

    public Optional<MethodReference> findMethod(int methodIndex) {
        if (methodIndex < 0 || methodIndex >= methods.size()) {
            return Optional.empty();
        }
        return Optional.of(methods.get(methodIndex));
    }

    public Optional<String> findField(int fieldIndex) {
        if (fieldIndex < 0 || fieldIndex >= fields.size()) {
            return Optional.empty();
        }
        return Optional.of(fields.get(fieldIndex));
    }

    public Optional<String> findString(int stringIndex) {
        if (stringIndex < 0 || stringIndex >= strings.size()) {
            return Optional.empty();
        }
        return Optional.of(strings.get(stringIndex));
    }

    public int getMethodCount() {
        return methods.size();
    }

    public int getFieldCount() {
        return fields.size();
    }

    public int getStringCount() {
        return strings.size();
    }
}
