package de.uni_passau.fim.auermich.android_flows.core.utility;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

public class CancellationTokenTest {

    @DisplayName("Testing cancellation.")
    @Test
    void testCancel() {
        CancellationToken token = new CancellationToken();
        assertFalse(token.isCancelled());
        token.throwIfCancelled("Search");

        token.cancel();
        assertTrue(token.isCancelled());
        CancellationException exception = assertThrows(CancellationException.class,
                () -> token.throwIfCancelled("Search"));
        assertEquals("Search was cancelled!", exception.getMessage());
    }

    @DisplayName("Testing that the shared token can't be cancelled.")
    @Test
    void testNone() {
        assertThrows(UnsupportedOperationException.class, CancellationToken.NONE::cancel);
        assertFalse(CancellationToken.NONE.isCancelled());
    }
}
