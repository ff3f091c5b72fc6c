package com.pipeline.executor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationTokenTest {

    @Test
    @DisplayName("The first cancellation reason wins")
    void testFirstReasonWins() {
        CancellationToken token = new CancellationToken();

        assertThat(token.isCancelled()).isFalse();
        assertThat(token.cancel(CancellationToken.Reason.TIMEOUT)).isTrue();
        assertThat(token.cancel(CancellationToken.Reason.USER)).isFalse();

        assertThat(token.isCancelled()).isTrue();
        assertThat(token.reason()).contains(CancellationToken.Reason.TIMEOUT);
    }

    @Test
    @DisplayName("Await returns once the token is signalled")
    void testAwaitReturnsOnceSignalled() throws Exception {
        CancellationToken token = new CancellationToken();

        assertThat(token.await(Duration.ofMillis(10))).isFalse();
        token.cancel(CancellationToken.Reason.SHUTDOWN);
        assertThat(token.await(Duration.ofSeconds(5))).isTrue();
    }
}
