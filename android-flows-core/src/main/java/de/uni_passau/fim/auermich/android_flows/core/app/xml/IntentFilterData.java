package de.uni_passau.fim.auermich.android_flows.core.app.xml;

import java.util.Objects;
import java.util.Optional;

/**
 * A {@code <data>} entry of an intent filter. All attributes are optional.
 */
public class IntentFilterData {

    private final String scheme;
    private final String host;
    private final String port;
    private final String path;
    private final String pathPrefix;
    private final String pathPattern;
    private final String mimeType;

    private IntentFilterData(Builder builder) {
        this.scheme = builder.scheme;
        this.host = builder.host;
        this.port = builder.port;
        this.path = builder.path;
        this.pathPrefix = builder.pathPrefix;
        this.pathPattern = builder.pathPattern;
        this.mimeType = builder.mimeType;
    }

    public Optional<String> getScheme() {
        return Optional.ofNullable(scheme);
    }

    public Optional<String> getHost() {
        return Optional.ofNullable(host);
    }

    public Optional<String> getPort() {
        return Optional.ofNullable(port);
    }

    public Optional<String> getPath() {
        return Optional.ofNullable(path);
    }

    public Optional<String> getPathPrefix() {
        return Optional.ofNullable(pathPrefix);
    }

    public Optional<String> getPathPattern() {
        return Optional.ofNullable(pathPattern);
    }

    public Optional<String> getMimeType() {
        return Optional.ofNullable(mimeType);
    }

    /**
     * Checks whether the entry names a URI, i.e. it has a non-empty scheme or host.
     *
     * @return Returns {@code true} if a scheme or a host is present.
     */
    public boolean hasSchemeOrHost() {
        return (scheme != null && !scheme.isEmpty()) || (host != null && !host.isEmpty());
    }

    /**
     * Renders the URI pattern the entry accepts, e.g. {@code https://example.com/item*}.
     *
     * @return Returns the pattern, empty if neither scheme, host nor path are given.
     */
    public String toUriPattern() {

        StringBuilder pattern = new StringBuilder();

        if (scheme != null) {
            pattern.append(scheme).append("://");
        }

        if (host != null) {
            pattern.append(host);
        }

        if (path != null) {
            pattern.append(path);
        } else if (pathPrefix != null) {
            pattern.append(pathPrefix).append('*');
        } else if (pathPattern != null) {
            pattern.append(pathPattern);
        }

        return pattern.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IntentFilterData that = (IntentFilterData) o;
        return Objects.equals(scheme, that.scheme) && Objects.equals(host, that.host)
                && Objects.equals(port, that.port) && Objects.equals(path, that.path)
                && Objects.equals(pathPrefix, that.pathPrefix) && Objects.equals(pathPattern, that.pathPattern)
                && Objects.equals(mimeType, that.mimeType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scheme, host, port, path, pathPrefix, pathPattern, mimeType);
    }

    @Override
    public String toString() {
        return "data{" + toUriPattern() + (mimeType != null ? ", mimeType=" + mimeType : "") + "}";
    }

    public static class Builder {

        private String scheme;
        private String host;
        private String port;
        private String path;
        private String pathPrefix;
        private String pathPattern;
        private String mimeType;

        public Builder withScheme(String scheme) {
            this.scheme = scheme;
            return this;
        }

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(String port) {
            this.port = port;
            return this;
        }

        public Builder withPath(String path) {
            this.path = path;
            return this;
        }

        public Builder withPathPrefix(String pathPrefix) {
            this.pathPrefix = pathPrefix;
            return this;
        }

        public Builder withPathPattern(String pathPattern) {
            this.pathPattern = pathPattern;
            return this;
        }

        public Builder withMimeType(String mimeType) {
            this.mimeType = mimeType;
            return this;
        }

        public IntentFilterData build() {
            return new IntentFilterData(this);
        }
    }
}
