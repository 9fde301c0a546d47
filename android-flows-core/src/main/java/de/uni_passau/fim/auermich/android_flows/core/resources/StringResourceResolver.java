package de.uni_passau.fim.auermich.android_flows.core.resources;

import de.uni_passau.fim.auermich.android_flows.core.dex.ClassTable;
import de.uni_passau.fim.auermich.android_flows.core.dex.DexClass;
import de.uni_passau.fim.auermich.android_flows.core.dex.DexField;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dom4j.Document;
import org.dom4j.DocumentException;
import org.dom4j.Element;
import org.dom4j.io.SAXReader;

import java.io.File;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves string resources by combining the ids of the {@code R$string} classes of the APK with the texts
 * of the decoded {@code res/values/strings.xml} file.
 */
public class StringResourceResolver implements ResourceResolver {

    private static final Logger LOGGER = LogManager.getLogger(StringResourceResolver.class);

    private static final String STRING_RESOURCE_CLASS_SUFFIX = "R$string";

    private final Map<Integer, String> strings;

    /**
     * Creates a resolver from an explicit mapping.
     *
     * @param strings Maps resource ids to texts.
     */
    public StringResourceResolver(Map<Integer, String> strings) {
        this.strings = Collections.unmodifiableMap(new HashMap<>(strings));
    }

    /**
     * Creates a resolver for an APK that has been decoded, e.g. by apktool.
     *
     * @param classTable The classes of the APK, including the {@code R$string} classes.
     * @param decodedAPKPath The directory the APK has been decoded into.
     * @return Returns the resolver.
     */
    public static StringResourceResolver fromDecodedAPK(ClassTable classTable, File decodedAPKPath) {
        Map<String, Integer> ids = lookupStringIds(classTable);
        Map<String, String> texts = parseStringsXMLFile(decodedAPKPath);

        Map<Integer, String> strings = new HashMap<>();
        ids.forEach((name, id) -> {
            String text = texts.get(name);
            if (text != null) {
                strings.put(id, text);
            }
        });

        LOGGER.debug("Resolved " + strings.size() + " of " + ids.size() + " string resources.");
        return new StringResourceResolver(strings);
    }

    /**
     * Collects the int constants of the {@code R$string} classes.
     *
     * @param classTable The classes of the APK.
     * @return Returns a mapping from resource name to resource id, e.g. 'app_name' -> 0x7f0e001b.
     */
    public static Map<String, Integer> lookupStringIds(ClassTable classTable) {
        Map<String, Integer> ids = new HashMap<>();
        for (DexClass dexClass : classTable.getClasses()) {
            if (dexClass.getClassName().endsWith(STRING_RESOURCE_CLASS_SUFFIX)) {
                for (DexField field : dexClass.getFields()) {
                    if (field.getType().equals("int")) {
                        field.getInitialValue().ifPresent(id -> ids.putIfAbsent(field.getName(), id));
                    }
                }
            }
        }
        return ids;
    }

    /**
     * Parses the strings.xml file within the res/values folder.
     *
     * @param decodedAPKPath The decoded APK path.
     * @return Returns a mapping from resource name to the actual text, e.g. 'app_name' -> 'BMI Calculator'.
     *         The mapping is empty if the file is missing or malformed.
     */
    public static Map<String, String> parseStringsXMLFile(File decodedAPKPath) {

        final File stringsXMLPath = new File(decodedAPKPath,
                Paths.get("res", "values", "strings.xml").toString());

        Map<String, String> translations = new HashMap<>();

        if (!stringsXMLPath.isFile()) {
            LOGGER.warn("No strings.xml found at " + stringsXMLPath + ", string resources stay unresolved.");
            return translations;
        }

        Document document;

        try {
            document = new SAXReader().read(stringsXMLPath);
        } catch (DocumentException e) {
            LOGGER.warn("Couldn't parse " + stringsXMLPath + ", string resources stay unresolved.", e);
            return translations;
        }

        Iterator<Element> itr = document.getRootElement().elementIterator("string");
        while (itr.hasNext()) {
            Element element = itr.next();
            String name = element.attributeValue("name");
            if (name != null) {
                translations.put(name, element.getText());
            }
        }

        return translations;
    }

    @Override
    public Optional<String> resolveString(int resourceId) {
        return Optional.ofNullable(strings.get(resourceId));
    }

    public int size() {
        return strings.size();
    }
}
