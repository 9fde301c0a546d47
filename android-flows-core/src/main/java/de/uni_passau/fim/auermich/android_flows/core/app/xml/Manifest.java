package de.uni_passau.fim.auermich.android_flows.core.app.xml;

import de.uni_passau.fim.auermich.android_flows.core.app.components.ComponentType;
import de.uni_passau.fim.auermich.android_flows.core.errors.AnalysisException;
import de.uni_passau.fim.auermich.android_flows.core.errors.ErrorKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.dom4j.Document;
import org.dom4j.DocumentException;
import org.dom4j.Element;
import org.dom4j.Node;
import org.dom4j.io.SAXReader;

import java.io.File;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Mirrors the AndroidManifest.xml file contained within each APK.
 */
public class Manifest {

    private static final Logger LOGGER = LogManager.getLogger(Manifest.class);

    private final String packageName;
    private final String versionCode;
    private final String versionName;
    private final String minSdkVersion;
    private final String targetSdkVersion;
    private final String applicationLabel;
    private final List<String> permissions;
    private final List<ManifestComponent> components;

    /**
     * Creates a new manifest with the given package name and components.
     *
     * @param packageName The package name.
     * @param components The declared components.
     */
    public Manifest(String packageName, List<ManifestComponent> components) {
        this(packageName, null, null, null, null, null, List.of(), components);
    }

    public Manifest(String packageName, String versionCode, String versionName, String minSdkVersion,
                    String targetSdkVersion, String applicationLabel, List<String> permissions,
                    List<ManifestComponent> components) {
        this.packageName = packageName;
        this.versionCode = versionCode;
        this.versionName = versionName;
        this.minSdkVersion = minSdkVersion;
        this.targetSdkVersion = targetSdkVersion;
        this.applicationLabel = applicationLabel;
        this.permissions = List.copyOf(permissions);
        this.components = List.copyOf(components);
    }

    /**
     * Parses the AndroidManifest.xml file!
     *
     * @param manifestFile The path to the manifest file.
     * @return Returns the parsed manifest file.
     */
    public static Manifest parse(File manifestFile) {
        LOGGER.debug("Parsing AndroidManifest.xml from " + manifestFile);
        try {
            return parse(new SAXReader().read(manifestFile));
        } catch (DocumentException e) {
            LOGGER.error("Couldn't load AndroidManifest.xml!");
            throw new AnalysisException(ErrorKind.INVALID_MANIFEST, "Couldn't load " + manifestFile, e);
        }
    }

    /**
     * Parses a textual AndroidManifest.xml from the given stream.
     *
     * @param inputStream The stream providing the xml document.
     * @return Returns the parsed manifest file.
     */
    public static Manifest parse(InputStream inputStream) {
        try {
            return parse(new SAXReader().read(inputStream));
        } catch (DocumentException e) {
            LOGGER.error("Couldn't load AndroidManifest.xml!");
            throw new AnalysisException(ErrorKind.INVALID_MANIFEST, "Couldn't parse AndroidManifest.xml", e);
        }
    }

    private static Manifest parse(Document document) {

        Element rootElement = document.getRootElement();

        String packageName = rootElement.attributeValue("package");
        if (packageName == null) {
            throw new AnalysisException(ErrorKind.INVALID_MANIFEST, "Manifest declares no package name!");
        }
        LOGGER.debug("Package name: " + packageName);

        List<String> permissions = new ArrayList<>();
        rootElement.selectNodes("uses-permission").forEach(permissionNode -> {
            String permission = ((Element) permissionNode).attributeValue("name");
            if (permission != null) {
                permissions.add(permission);
            }
        });

        String minSdkVersion = null;
        String targetSdkVersion = null;
        Node usesSdk = rootElement.selectSingleNode("uses-sdk");
        if (usesSdk != null) {
            minSdkVersion = ((Element) usesSdk).attributeValue("minSdkVersion");
            targetSdkVersion = ((Element) usesSdk).attributeValue("targetSdkVersion");
        }

        String applicationLabel = null;
        Map<String, MutableComponent> components = new LinkedHashMap<>();
        List<Element> aliases = new ArrayList<>();

        Element application = rootElement.element("application");
        if (application != null) {

            applicationLabel = application.attributeValue("label");

            for (Element element : application.elements()) {

                if (element.getName().equals("activity-alias")) {
                    aliases.add(element);
                    continue;
                }

                Optional<ComponentType> type = ComponentType.fromTag(element.getName());
                String name = element.attributeValue("name");

                if (type.isEmpty() || name == null) {
                    continue;
                }

                String className = resolveClassName(packageName, name);
                MutableComponent component = components.computeIfAbsent(className,
                        c -> new MutableComponent(className, type.get(), parseExported(element)));
                component.intentFilters.addAll(parseIntentFilters(element));
            }
        }

        // an activity-alias exposes its target activity under the alias' intent filters
        for (Element alias : aliases) {
            String target = alias.attributeValue("targetActivity");
            if (target == null) {
                continue;
            }
            String className = resolveClassName(packageName, target);
            MutableComponent component = components.computeIfAbsent(className,
                    c -> new MutableComponent(className, ComponentType.ACTIVITY, parseExported(alias)));
            component.intentFilters.addAll(parseIntentFilters(alias));
        }

        List<ManifestComponent> manifestComponents = components.values().stream()
                .map(c -> new ManifestComponent(c.className, c.type, c.exported, c.intentFilters))
                .collect(Collectors.toList());

        LOGGER.debug("Parsed " + manifestComponents.size() + " components.");

        return new Manifest(packageName, rootElement.attributeValue("versionCode"),
                rootElement.attributeValue("versionName"), minSdkVersion, targetSdkVersion, applicationLabel,
                permissions, manifestComponents);
    }

    private static Boolean parseExported(Element element) {
        String exported = element.attributeValue("exported");
        return exported == null ? null : Boolean.parseBoolean(exported);
    }

    private static List<IntentFilter> parseIntentFilters(Element componentElement) {

        List<IntentFilter> intentFilters = new ArrayList<>();

        componentElement.selectNodes("intent-filter").forEach(intentFilterNode -> {

            Set<String> actions = new LinkedHashSet<>();
            Set<String> categories = new LinkedHashSet<>();
            List<IntentFilterData> data = new ArrayList<>();

            // parse action tags
            intentFilterNode.selectNodes("action").forEach(actionNode -> {
                String action = ((Element) actionNode).attributeValue("name");
                if (action != null) {
                    actions.add(action);
                }
            });

            // parse category tags
            intentFilterNode.selectNodes("category").forEach(categoryNode -> {
                String category = ((Element) categoryNode).attributeValue("name");
                if (category != null) {
                    categories.add(category);
                }
            });

            intentFilterNode.selectNodes("data").forEach(dataNode -> {
                Element dataTag = (Element) dataNode;
                data.add(new IntentFilterData.Builder()
                        .withScheme(dataTag.attributeValue("scheme"))
                        .withHost(dataTag.attributeValue("host"))
                        .withPort(dataTag.attributeValue("port"))
                        .withPath(dataTag.attributeValue("path"))
                        .withPathPrefix(dataTag.attributeValue("pathPrefix"))
                        .withPathPattern(dataTag.attributeValue("pathPattern"))
                        .withMimeType(dataTag.attributeValue("mimeType"))
                        .build());
            });

            intentFilters.add(new IntentFilter(actions, categories, data));
        });

        return intentFilters;
    }

    /**
     * Resolves a component name against the package name, e.g. '.MainActivity' or 'MainActivity' become
     * 'com.example.MainActivity'.
     *
     * @param packageName The package name of the app.
     * @param componentName The component name as written in the manifest.
     * @return Returns the fully-qualified class name.
     */
    public static String resolveClassName(String packageName, String componentName) {
        if (componentName.startsWith(".")) {
            return packageName + componentName;
        } else if (!componentName.contains(".")) {
            return packageName + "." + componentName;
        } else {
            return componentName;
        }
    }

    public String getPackageName() {
        return packageName;
    }

    public Optional<String> getVersionCode() {
        return Optional.ofNullable(versionCode);
    }

    public Optional<String> getVersionName() {
        return Optional.ofNullable(versionName);
    }

    public Optional<String> getMinSdkVersion() {
        return Optional.ofNullable(minSdkVersion);
    }

    public Optional<String> getTargetSdkVersion() {
        return Optional.ofNullable(targetSdkVersion);
    }

    public Optional<String> getApplicationLabel() {
        return Optional.ofNullable(applicationLabel);
    }

    public List<String> getPermissions() {
        return permissions;
    }

    public List<ManifestComponent> getComponents() {
        return components;
    }

    public List<ManifestComponent> getComponents(ComponentType type) {
        return components.stream().filter(c -> c.getType() == type).collect(Collectors.toList());
    }

    /**
     * Returns the activity that is started from the launcher.
     *
     * @return Returns the main activity if one is declared.
     */
    public Optional<String> getMainActivity() {
        return components.stream()
                .filter(c -> c.getType() == ComponentType.ACTIVITY)
                .filter(c -> c.getIntentFilters().stream().anyMatch(IntentFilter::isLauncher))
                .map(ManifestComponent::getClassName)
                .findFirst();
    }

    /**
     * Returns all intent filters that declare a deeplink.
     *
     * @return Returns the deeplink filters in declaration order.
     */
    public List<IntentFilter> getDeeplinkFilters() {
        return components.stream()
                .flatMap(c -> c.getIntentFilters().stream())
                .filter(IntentFilter::isDeeplink)
                .collect(Collectors.toList());
    }

    /**
     * Collects the attributes of a component while the manifest is traversed.
     */
    private static class MutableComponent {

        private final String className;
        private final ComponentType type;
        private final Boolean exported;
        private final List<IntentFilter> intentFilters = new ArrayList<>();

        private MutableComponent(String className, ComponentType type, Boolean exported) {
            this.className = className;
            this.type = type;
            this.exported = exported;
        }
    }
}
