package de.uni_passau.fim.auermich.android_flows.core.app.xml;

import de.uni_passau.fim.auermich.android_flows.core.app.components.ComponentType;

import java.util.List;
import java.util.Optional;

/**
 * A component declared in the AndroidManifest.xml.
 */
public class ManifestComponent {

    private final String className;
    private final ComponentType type;

    /**
     * The value of android:exported, absent if the attribute is not specified.
     */
    private final Boolean exported;

    private final List<IntentFilter> intentFilters;

    public ManifestComponent(String className, ComponentType type, Boolean exported,
                             List<IntentFilter> intentFilters) {
        this.className = className;
        this.type = type;
        this.exported = exported;
        this.intentFilters = List.copyOf(intentFilters);
    }

    /**
     * Returns the fully-qualified name of the implementing class.
     *
     * @return Returns the dotted class name.
     */
    public String getClassName() {
        return className;
    }

    public ComponentType getType() {
        return type;
    }

    public Optional<Boolean> getExported() {
        return Optional.ofNullable(exported);
    }

    /**
     * Checks whether other apps can start the component. Without an explicit android:exported attribute,
     * a component is exported as soon as it declares an intent filter.
     *
     * @return Returns {@code true} if the component is reachable from outside the app.
     */
    public boolean isExported() {
        return exported != null ? exported : !intentFilters.isEmpty();
    }

    public List<IntentFilter> getIntentFilters() {
        return intentFilters;
    }

    @Override
    public String toString() {
        return type + "{" + className + "}";
    }
}
