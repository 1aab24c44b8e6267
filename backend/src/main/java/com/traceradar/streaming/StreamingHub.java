package com.traceradar.streaming;

import com.traceradar.domain.AccountId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Set;

/**
 * In-process fan-out of trace and transaction events to streaming subscribers.
 * Events are not buffered: a subscriber sees only what is published after it subscribed,
 * and a subscriber that cannot keep up loses events instead of slowing publishers down.
 */
@Component
@Slf4j
public class StreamingHub {

    private final Sinks.Many<TraceEvent> traces = Sinks.many().multicast().directBestEffort();
    private final Sinks.Many<TransactionEvent> transactions = Sinks.many().multicast().directBestEffort();

    public synchronized void publishTrace(TraceEvent event) {
        emit(traces, event);
    }

    public synchronized void publishTransaction(TransactionEvent event) {
        emit(transactions, event);
    }

    /** Traces touching at least one of the given accounts. */
    public Flux<TraceEvent> traces(Set<AccountId> accounts) {
        return traces.asFlux()
                .filter(event -> event.accounts().stream().anyMatch(accounts::contains));
    }

    public Flux<TransactionEvent> transactions(Set<AccountId> accounts) {
        return transactions.asFlux()
                .filter(event -> accounts.contains(event.account()));
    }

    public int traceSubscriberCount() {
        return traces.currentSubscriberCount();
    }

    public int transactionSubscriberCount() {
        return transactions.currentSubscriberCount();
    }

    private static <T> void emit(Sinks.Many<T> sink, T event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Dropped streaming event {}: {}", event, result);
        }
    }
}
