package de.uni_passau.fim.auermich.android_flows.core.errors;

/**
 * Signals a fatal analysis error. The {@link ErrorKind} tells callers which
 * part of the input was rejected.
 */
public class AnalysisException extends RuntimeException {

    private final ErrorKind kind;

    public AnalysisException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AnalysisException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Returns the kind of error.
     *
     * @return Returns the error kind.
     */
    public ErrorKind getKind() {
        return kind;
    }

    @Override
    public String toString() {
        return "AnalysisException{" + kind + ": " + getMessage() + "}";
    }
}
