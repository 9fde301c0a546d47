package de.uni_passau.fim.auermich.android_flows.core.errors;

import java.util.Objects;

/**
 * A non-fatal problem attached to a location, e.g. a method signature or a class name.
 */
public class Diagnostic {

    private final DiagnosticKind kind;
    private final String location;
    private final String message;

    public Diagnostic(DiagnosticKind kind, String location, String message) {
        this.kind = kind;
        this.location = location;
        this.message = message;
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    /**
     * Returns where the problem occurred, typically a method signature.
     *
     * @return Returns the location of the problem.
     */
    public String getLocation() {
        return location;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Diagnostic that = (Diagnostic) o;
        return kind == that.kind && Objects.equals(location, that.location) && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, location, message);
    }

    @Override
    public String toString() {
        return kind + " at " + location + ": " + message;
    }
}
