package de.uni_passau.fim.auermich.android_flows.core.app.components;

import java.util.Arrays;
import java.util.Optional;

/**
 * The kinds of components an app can declare in its manifest.
 */
public enum ComponentType {

    ACTIVITY("activity"),
    SERVICE("service"),
    BROADCAST_RECEIVER("receiver"),
    CONTENT_PROVIDER("provider");

    /**
     * The name of the xml tag declaring the component in the AndroidManifest.xml.
     */
    private final String tag;

    ComponentType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Maps a manifest tag to its component type.
     *
     * @param tag The tag name, e.g. 'receiver'.
     * @return Returns the component type if the tag declares a component.
     */
    public static Optional<ComponentType> fromTag(String tag) {
        return Arrays.stream(values()).filter(type -> type.tag.equals(tag)).findFirst();
    }
}
