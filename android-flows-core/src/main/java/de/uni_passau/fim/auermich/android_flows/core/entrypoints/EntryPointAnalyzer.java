package de.uni_passau.fim.auermich.android_flows.core.entrypoints;

import de.uni_passau.fim.auermich.android_flows.core.app.components.ComponentType;
import de.uni_passau.fim.auermich.android_flows.core.app.xml.Manifest;
import de.uni_passau.fim.auermich.android_flows.core.app.xml.ManifestComponent;
import de.uni_passau.fim.auermich.android_flows.core.dex.ClassTable;
import de.uni_passau.fim.auermich.android_flows.core.dex.DexClass;
import de.uni_passau.fim.auermich.android_flows.core.utility.Tuple;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Links the components declared in the manifest with the classes of the APK.
 */
public class EntryPointAnalyzer {

    private static final Logger LOGGER = LogManager.getLogger(EntryPointAnalyzer.class);

    private final Manifest manifest;
    private final ClassTable classTable;
    private final List<EntryPoint> entryPoints;
    private final Map<String, EntryPoint> entryPointsByClass;

    public EntryPointAnalyzer(Manifest manifest, ClassTable classTable) {

        this.manifest = manifest;
        this.classTable = classTable;

        List<EntryPoint> entryPoints = new ArrayList<>();
        Map<String, EntryPoint> entryPointsByClass = new HashMap<>();

        for (ManifestComponent component : manifest.getComponents()) {
            boolean classFound = classTable.contains(component.getClassName());
            if (!classFound) {
                LOGGER.debug("No class found for declared component " + component.getClassName());
            }
            EntryPoint entryPoint = new EntryPoint(component, classFound);
            entryPoints.add(entryPoint);
            entryPointsByClass.putIfAbsent(component.getClassName(), entryPoint);
        }

        this.entryPoints = Collections.unmodifiableList(entryPoints);
        this.entryPointsByClass = Collections.unmodifiableMap(entryPointsByClass);
        LOGGER.info("Found " + entryPoints.size() + " entry points, "
                + getDeeplinkHandlers().size() + " of them handle deeplinks.");
    }

    /**
     * Returns one entry point per declared component in declaration order.
     *
     * @return Returns the entry points.
     */
    public List<EntryPoint> analyze() {
        return entryPoints;
    }

    /**
     * Returns the entry points with a deeplink intent filter whose class is defined in the APK.
     *
     * @return Returns the deeplink handlers.
     */
    public List<EntryPoint> getDeeplinkHandlers() {
        return entryPoints.stream()
                .filter(EntryPoint::isDeeplinkHandler)
                .filter(EntryPoint::isClassFound)
                .collect(Collectors.toList());
    }

    public List<EntryPoint> getLauncherEntryPoints() {
        return entryPoints.stream().filter(EntryPoint::isLauncher).collect(Collectors.toList());
    }

    public Optional<EntryPoint> getEntryPoint(String className) {
        return Optional.ofNullable(entryPointsByClass.get(className));
    }

    /**
     * Looks up the entry point declared for the given class together with the class itself.
     *
     * @param className The dotted class name.
     * @return Returns the pair if the class is both declared as component and defined in the APK.
     */
    public Optional<Tuple<EntryPoint, DexClass>> getEntryPointWithClass(String className) {
        EntryPoint entryPoint = entryPointsByClass.get(className);
        if (entryPoint == null) {
            return Optional.empty();
        }
        return classTable.lookup(className).map(dexClass -> new Tuple<>(entryPoint, dexClass));
    }

    /**
     * Summarises the entry points.
     *
     * @return Returns counters keyed by name, in a stable order.
     */
    public Map<String, Integer> getStatistics() {
        Map<String, Integer> statistics = new LinkedHashMap<>();
        statistics.put("entryPoints", entryPoints.size());
        statistics.put("deeplinkHandlers", getDeeplinkHandlers().size());
        statistics.put("launchers", getLauncherEntryPoints().size());
        statistics.put("classesFound", (int) entryPoints.stream().filter(EntryPoint::isClassFound).count());
        statistics.put("classesMissing", (int) entryPoints.stream().filter(e -> !e.isClassFound()).count());
        for (ComponentType type : ComponentType.values()) {
            statistics.put(type.getTag(), (int) entryPoints.stream().filter(e -> e.getComponentType() == type).count());
        }
        return statistics;
    }

    public Manifest getManifest() {
        return manifest;
    }

    public ClassTable getClassTable() {
        return classTable;
    }
}
