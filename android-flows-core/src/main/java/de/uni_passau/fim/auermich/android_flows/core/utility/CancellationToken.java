package de.uni_passau.fim.auermich.android_flows.core.utility;

import java.util.concurrent.CancellationException;

/**
 * A cooperative cancellation flag. Long running searches poll the token inside their loops
 * and abort with a {@link CancellationException} once {@link #cancel()} was invoked from another thread.
 */
public class CancellationToken {

    /**
     * A token that is never cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("The NONE token can't be cancelled!");
        }
    };

    private volatile boolean cancelled;

    /**
     * Requests cancellation.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Throws a {@link CancellationException} if cancellation was requested.
     *
     * @param operation The name of the running operation, used in the exception message.
     */
    public void throwIfCancelled(String operation) {
        if (cancelled) {
            throw new CancellationException(operation + " was cancelled!");
        }
    }
}
