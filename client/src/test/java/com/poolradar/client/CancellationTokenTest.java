package com.poolradar.client;

import com.poolradar.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationTokenTest {

    @Test
    @DisplayName("cancel fires the token and completes waiters")
    void cancel() {
        CancellationToken token = CancellationToken.create();
        var waiter = token.whenCancelled();
        assertThat(token.isCancelled()).isFalse();
        assertThatCode(token::throwIfCancelled).doesNotThrowAnyException();

        token.cancel();

        assertThat(token.isCancelled()).isTrue();
        assertThat(waiter).isDone();
        assertThatThrownBy(token::throwIfCancelled)
                .isInstanceOf(RequestCancelledException.class)
                .hasMessage("Request cancelled");
    }

    @Test
    @DisplayName("deadline fires once the clock reaches it")
    void deadline() {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        CancellationToken token = CancellationToken.withTimeout(Duration.ofSeconds(2), clock);

        assertThat(token.remaining()).contains(Duration.ofSeconds(2));
        clock.advance(Duration.ofSeconds(3));

        assertThat(token.isCancelled()).isTrue();
        assertThat(token.remaining()).contains(Duration.ZERO);
        assertThatThrownBy(token::throwIfCancelled)
                .isInstanceOf(RequestCancelledException.class)
                .hasMessageContaining("Deadline exceeded");
    }

    @Test
    @DisplayName("absolute deadline holds until the clock reaches it")
    void absoluteDeadline() {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        Instant deadline = Instant.parse("2024-05-01T12:00:30Z");
        CancellationToken token = CancellationToken.withDeadline(deadline, clock);

        assertThat(token.getDeadline()).contains(deadline);
        assertThat(token.remaining()).contains(Duration.ofSeconds(30));
        clock.advance(Duration.ofSeconds(29));
        assertThat(token.isCancelled()).isFalse();
        assertThatCode(token::throwIfCancelled).doesNotThrowAnyException();

        clock.advance(Duration.ofSeconds(1));

        assertThat(token.isCancelled()).isTrue();
        assertThat(token.remaining()).contains(Duration.ZERO);
        assertThatThrownBy(token::throwIfCancelled)
                .isInstanceOf(RequestCancelledException.class)
                .hasMessage("Deadline exceeded at 2024-05-01T12:00:30Z");
        assertThatThrownBy(() -> CancellationToken.withDeadline(null, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("token without deadline has no remaining time")
    void noDeadline() {
        assertThat(CancellationToken.create().remaining()).isEmpty();
        assertThat(CancellationToken.create().getDeadline()).isEmpty();
    }

    @Test
    @DisplayName("completing a waiter copy does not cancel the token")
    void waiterCopyIsolated() {
        CancellationToken token = CancellationToken.create();
        token.whenCancelled().cancel(true);
        assertThat(token.isCancelled()).isFalse();
    }
}
