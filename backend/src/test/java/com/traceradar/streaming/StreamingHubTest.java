package com.traceradar.streaming;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Set;

import static com.traceradar.domain.TraceFixtures.account;
import static org.assertj.core.api.Assertions.assertThat;

class StreamingHubTest {

    private final StreamingHub hub = new StreamingHub();

    @Test
    @DisplayName("trace subscribers receive only traces touching their accounts")
    void filtersTracesByAccount() {
        TraceEvent mine = new TraceEvent(Set.of(account(1), account(2)), "h1");
        TraceEvent other = new TraceEvent(Set.of(account(3)), "h2");

        StepVerifier.create(hub.traces(Set.of(account(2))).take(1))
                .then(() -> {
                    hub.publishTrace(other);
                    hub.publishTrace(mine);
                })
                .expectNext(mine)
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("transaction subscribers receive only their accounts' transactions")
    void filtersTransactionsByAccount() {
        TransactionEvent mine = new TransactionEvent(account(1), 10L, "t1");

        StepVerifier.create(hub.transactions(Set.of(account(1))).take(1))
                .then(() -> {
                    hub.publishTransaction(new TransactionEvent(account(9), 11L, "t2"));
                    hub.publishTransaction(mine);
                })
                .expectNext(mine)
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("publishing without subscribers is silently dropped; late subscribers see nothing old")
    void noReplay() {
        hub.publishTrace(new TraceEvent(Set.of(account(1)), "old"));

        StepVerifier.create(hub.traces(Set.of(account(1))))
                .expectSubscription()
                .expectNoEvent(Duration.ofMillis(100))
                .thenCancel()
                .verify();
    }

    @Test
    @DisplayName("subscriber counts follow subscribe and cancel")
    void subscriberCounts() {
        assertThat(hub.traceSubscriberCount()).isZero();

        var subscription = hub.traces(Set.of(account(1))).subscribe();
        assertThat(hub.traceSubscriberCount()).isEqualTo(1);
        assertThat(hub.transactionSubscriberCount()).isZero();

        subscription.dispose();
        assertThat(hub.traceSubscriberCount()).isZero();
    }
}
