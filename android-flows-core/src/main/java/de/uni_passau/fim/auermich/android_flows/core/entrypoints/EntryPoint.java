package de.uni_passau.fim.auermich.android_flows.core.entrypoints;

import de.uni_passau.fim.auermich.android_flows.core.app.components.ComponentType;
import de.uni_passau.fim.auermich.android_flows.core.app.xml.IntentFilter;
import de.uni_passau.fim.auermich.android_flows.core.app.xml.ManifestComponent;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A component reachable from outside the app. The implementing class is not embedded; it is looked up by
 * class name, see {@link EntryPointAnalyzer#getEntryPointWithClass(String)}.
 */
public class EntryPoint {

    private final ManifestComponent component;

    /**
     * Whether a class with the component's name is defined in the APK. Stripped or dynamically loaded
     * components are still entry points.
     */
    private final boolean classFound;

    public EntryPoint(ManifestComponent component, boolean classFound) {
        this.component = component;
        this.classFound = classFound;
    }

    public ManifestComponent getComponent() {
        return component;
    }

    public String getClassName() {
        return component.getClassName();
    }

    public ComponentType getComponentType() {
        return component.getType();
    }

    public List<IntentFilter> getIntentFilters() {
        return component.getIntentFilters();
    }

    public boolean isClassFound() {
        return classFound;
    }

    public boolean isLauncher() {
        return component.getIntentFilters().stream().anyMatch(IntentFilter::isLauncher);
    }

    public boolean isDeeplinkHandler() {
        return component.getIntentFilters().stream().anyMatch(IntentFilter::isDeeplink);
    }

    /**
     * Returns the URI patterns of all data entries, e.g. {@code myapp://open/item*}.
     *
     * @return Returns the non-empty patterns in declaration order.
     */
    public List<String> getDeeplinkPatterns() {
        return component.getIntentFilters().stream()
                .flatMap(filter -> filter.getData().stream())
                .map(data -> data.toUriPattern())
                .filter(pattern -> !pattern.isEmpty())
                .collect(Collectors.toList());
    }

    public List<String> getActions() {
        return component.getIntentFilters().stream()
                .flatMap(filter -> filter.getActions().stream())
                .collect(Collectors.toList());
    }

    public boolean handlesAction(String action) {
        return component.getIntentFilters().stream().anyMatch(filter -> filter.getActions().contains(action));
    }

    @Override
    public String toString() {
        return "EntryPoint{" + component.getType() + ", " + getClassName() + ", deeplink=" + isDeeplinkHandler()
                + ", found=" + classFound + "}";
    }
}
