package de.uni_passau.fim.auermich.android_flows.core.resources;

import java.util.Optional;

/**
 * Maps resource ids, as they appear as int literals in the bytecode, to the values they denote.
 */
public interface ResourceResolver {

    /**
     * Resolves the id of a string resource.
     *
     * @param resourceId The resource id, e.g. {@code 0x7f0e001b}.
     * @return Returns the (default) text of the string resource if the id denotes one.
     */
    Optional<String> resolveString(int resourceId);
}
