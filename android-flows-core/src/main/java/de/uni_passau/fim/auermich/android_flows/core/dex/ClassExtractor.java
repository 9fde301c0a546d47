package de.uni_passau.fim.auermich.android_flows.core.dex;

import de.uni_passau.fim.auermich.android_flows.core.errors.Diagnostic;
import de.uni_passau.fim.auermich.android_flows.core.errors.DiagnosticKind;
import de.uni_passau.fim.auermich.android_flows.core.utility.DexUtils;
import de.uni_passau.fim.auermich.android_flows.core.utility.Properties;
import de.uni_passau.fim.auermich.android_flows.core.utility.Tuple;
import de.uni_passau.fim.auermich.android_flows.core.utility.Utility;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jf.dexlib2.dexbacked.DexBackedDexFile;
import org.jf.dexlib2.dexbacked.instruction.DexBackedInstruction;
import org.jf.dexlib2.iface.ClassDef;
import org.jf.dexlib2.iface.Field;
import org.jf.dexlib2.iface.Method;
import org.jf.dexlib2.iface.MethodImplementation;
import org.jf.dexlib2.iface.instruction.Instruction;
import org.jf.dexlib2.iface.value.EncodedValue;
import org.jf.dexlib2.iface.value.IntEncodedValue;
import org.jf.util.ExceptionWithContext;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Reads the classes of a set of dex files into a {@link ClassTable}. The dexlib2 representation is only
 * touched here; everything downstream works on the immutable {@link DexClass} model.
 */
public class ClassExtractor {

    private static final Logger LOGGER = LogManager.getLogger(ClassExtractor.class);

    private final Properties properties;

    public ClassExtractor(Properties properties) {
        this.properties = properties;
    }

    /**
     * Extracts every class of the given dex files. In parallel mode the class definitions are split into
     * contiguous chunks that are converted by independent workers; the chunk results are concatenated in
     * order afterwards, thus both modes produce the same table.
     *
     * @param dexFiles The dex files of the APK in their natural order (classes.dex, classes2.dex, ...).
     * @param parallel Whether the conversion should run on a worker pool.
     * @return Returns the class table.
     */
    public ClassTable extract(List<? extends DexBackedDexFile> dexFiles, boolean parallel) {

        List<ReferenceTable> referenceTables = new ArrayList<>(dexFiles.size());
        List<Tuple<Integer, ClassDef>> classDefinitions = new ArrayList<>();

        for (int dexIndex = 0; dexIndex < dexFiles.size(); dexIndex++) {
            DexBackedDexFile dexFile = dexFiles.get(dexIndex);
            referenceTables.add(ReferenceTable.fromDexFile(dexIndex, dexFile));
            for (ClassDef classDef : dexFile.getClasses()) {
                classDefinitions.add(new Tuple<>(dexIndex, classDef));
            }
        }

        LOGGER.info("Extracting " + classDefinitions.size() + " classes from " + dexFiles.size()
                + " dex files" + (parallel ? " in parallel." : "."));

        List<Tuple<List<DexClass>, List<Diagnostic>>> results;

        if (parallel) {
            results = Utility.processInPartitions(classDefinitions, properties.partitions,
                    properties.parallelism, this::extractChunk);
        } else {
            results = List.of(extractChunk(classDefinitions));
        }

        List<DexClass> classes = new ArrayList<>(classDefinitions.size());
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Tuple<List<DexClass>, List<Diagnostic>> result : results) {
            classes.addAll(result.getX());
            diagnostics.addAll(result.getY());
        }

        ClassTable classTable = new ClassTable(classes, referenceTables, diagnostics);
        LOGGER.info("Extracted " + classTable.size() + " classes with " + classTable.getDiagnostics().size()
                + " diagnostics.");
        return classTable;
    }

    private Tuple<List<DexClass>, List<Diagnostic>> extractChunk(List<Tuple<Integer, ClassDef>> chunk) {
        List<DexClass> classes = new ArrayList<>(chunk.size());
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Tuple<Integer, ClassDef> classDefinition : chunk) {
            classes.add(toDexClass(classDefinition.getX(), classDefinition.getY(), diagnostics));
        }
        return new Tuple<>(classes, diagnostics);
    }

    private DexClass toDexClass(int dexIndex, ClassDef classDef, List<Diagnostic> diagnostics) {

        String className = DexUtils.toJavaType(classDef.getType());
        String superclass = classDef.getSuperclass() == null ? null : DexUtils.toJavaType(classDef.getSuperclass());

        List<DexMethod> methods = new ArrayList<>();
        for (Method method : classDef.getMethods()) {
            methods.add(toDexMethod(className, method, diagnostics));
        }

        List<DexField> fields = new ArrayList<>();
        for (Field field : classDef.getFields()) {
            EncodedValue initialValue = field.getInitialValue();
            Integer value = initialValue instanceof IntEncodedValue ? ((IntEncodedValue) initialValue).getValue() : null;
            fields.add(new DexField(className, field.getName(), DexUtils.toJavaType(field.getType()),
                    field.getAccessFlags(), value));
        }

        return new DexClass(className, superclass, new LinkedHashSet<>(DexUtils.toJavaTypes(classDef.getInterfaces())),
                classDef.getAccessFlags(), methods, fields, dexIndex);
    }

    private DexMethod toDexMethod(String className, Method method, List<Diagnostic> diagnostics) {

        List<String> parameterTypes = DexUtils.toJavaTypes(method.getParameterTypes());
        String returnType = DexUtils.toJavaType(method.getReturnType());
        MethodImplementation implementation = method.getImplementation();

        int registerCount = 0;
        short[] bytecode = null;

        if (implementation != null) {
            try {
                registerCount = implementation.getRegisterCount();
                bytecode = readCodeUnits(implementation);
            } catch (ExceptionWithContext | IndexOutOfBoundsException | IllegalArgumentException e) {
                String location = new MethodReference(className, method.getName(), parameterTypes, returnType)
                        .getFullSignature();
                LOGGER.debug("Couldn't read bytecode of " + location + ": " + e.getMessage());
                diagnostics.add(new Diagnostic(DiagnosticKind.MALFORMED_METHOD, location,
                        "Unreadable code item: " + e.getMessage()));
                bytecode = null;
            }
        }

        return new DexMethod(className, method.getName(), parameterTypes, returnType, method.getAccessFlags(),
                registerCount, bytecode);
    }

    /**
     * Copies the raw code units of a method. The instructions of a code item are stored contiguously, thus
     * the code units span from the start of the first instruction over the summed instruction sizes.
     *
     * @param implementation The method implementation backed by a dex file.
     * @return Returns the code units.
     */
    private static short[] readCodeUnits(MethodImplementation implementation) {

        DexBackedInstruction first = null;
        int codeUnits = 0;

        for (Instruction instruction : implementation.getInstructions()) {
            if (first == null) {
                if (!(instruction instanceof DexBackedInstruction)) {
                    throw new IllegalArgumentException("Method implementation is not backed by a dex file!");
                }
                first = (DexBackedInstruction) instruction;
            }
            codeUnits += instruction.getCodeUnits();
        }

        short[] words = new short[codeUnits];

        if (first != null) {
            var buffer = first.dexFile.getDataBuffer();
            for (int i = 0; i < codeUnits; i++) {
                words[i] = (short) buffer.readUshort(first.instructionStart + 2 * i);
            }
        }
        return words;
    }
}
