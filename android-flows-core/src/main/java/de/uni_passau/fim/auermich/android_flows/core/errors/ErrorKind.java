package de.uni_passau.fim.auermich.android_flows.core.errors;

/**
 * The kinds of fatal errors that abort an analysis request.
 */
public enum ErrorKind {

    /**
     * The archive is missing, unreadable or not a zip file.
     */
    INVALID_ARCHIVE,

    /**
     * The archive contains no AndroidManifest.xml.
     */
    MISSING_MANIFEST,

    /**
     * The manifest exists but could not be parsed.
     */
    INVALID_MANIFEST,

    /**
     * None of the contained dex files could be loaded.
     */
    MALFORMED_DEX,

    /**
     * A referenced entity (method index, class, ...) does not exist.
     */
    NOT_FOUND
}
