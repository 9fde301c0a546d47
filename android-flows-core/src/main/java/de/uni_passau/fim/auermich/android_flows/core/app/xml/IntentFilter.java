package de.uni_passau.fim.auermich.android_flows.core.app.xml;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An {@code <intent-filter>} of a manifest component.
 */
public class IntentFilter {

    public static final String ACTION_MAIN = "android.intent.action.MAIN";
    public static final String ACTION_VIEW = "android.intent.action.VIEW";
    public static final String CATEGORY_LAUNCHER = "android.intent.category.LAUNCHER";
    public static final String CATEGORY_DEFAULT = "android.intent.category.DEFAULT";
    public static final String CATEGORY_BROWSABLE = "android.intent.category.BROWSABLE";

    private final Set<String> actions;
    private final Set<String> categories;
    private final List<IntentFilterData> data;

    public IntentFilter(Set<String> actions, Set<String> categories, List<IntentFilterData> data) {
        this.actions = Collections.unmodifiableSet(new LinkedHashSet<>(actions));
        this.categories = Collections.unmodifiableSet(new LinkedHashSet<>(categories));
        this.data = List.copyOf(data);
    }

    public Set<String> getActions() {
        return actions;
    }

    public Set<String> getCategories() {
        return categories;
    }

    public List<IntentFilterData> getData() {
        return data;
    }

    /**
     * Checks whether the filter accepts externally supplied URIs: it contains the VIEW action, the DEFAULT or
     * BROWSABLE category, and at least one data entry with a scheme or host.
     *
     * @return Returns {@code true} if the filter declares a deeplink.
     */
    public boolean isDeeplink() {
        return actions.contains(ACTION_VIEW)
                && (categories.contains(CATEGORY_DEFAULT) || categories.contains(CATEGORY_BROWSABLE))
                && data.stream().anyMatch(IntentFilterData::hasSchemeOrHost);
    }

    /**
     * Checks whether the filter marks the main entry of the app, i.e. the MAIN action and the LAUNCHER category.
     *
     * @return Returns {@code true} if the filter declares a launcher.
     */
    public boolean isLauncher() {
        return actions.contains(ACTION_MAIN) && categories.contains(CATEGORY_LAUNCHER);
    }

    @Override
    public String toString() {
        return "IntentFilter{actions=" + actions + ", categories=" + categories + ", data=" + data + "}";
    }
}
