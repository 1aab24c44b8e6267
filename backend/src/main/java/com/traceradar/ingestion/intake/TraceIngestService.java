package com.traceradar.ingestion.intake;

import com.traceradar.domain.AccountId;
import com.traceradar.domain.Trace;
import com.traceradar.domain.TraceRepository;
import com.traceradar.domain.Transaction;
import com.traceradar.streaming.StreamingHub;
import com.traceradar.streaming.TraceEvent;
import com.traceradar.streaming.TransactionEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point for the upstream trace builder. Every version of a trace is stored (latest wins);
 * only once it is no longer in progress are its trace and transaction events pushed to subscribers.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TraceIngestService {

    private final TraceRepository traceRepository;
    private final StreamingHub streamingHub;

    /**
     * @return true when the trace was final and has been published
     */
    public Mono<Boolean> accept(Trace trace) {
        if (trace == null || trace.getTransaction() == null || trace.getId() == null) {
            return Mono.error(new IllegalArgumentException("Trace with a root transaction hash is required"));
        }
        return Mono.fromCallable(() -> traceRepository.save(trace))
                .subscribeOn(Schedulers.boundedElastic())
                .map(saved -> {
                    int uncompleted = saved.countUncompleted();
                    if (uncompleted != 0) {
                        log.debug("Trace {} stored, {} outbound messages still unmatched", saved.getId(), uncompleted);
                        return false;
                    }
                    publish(saved);
                    return true;
                });
    }

    private void publish(Trace trace) {
        Set<AccountId> accounts = new LinkedHashSet<>();
        List<TransactionEvent> transactions = new ArrayList<>();
        trace.visit(node -> {
            Transaction tx = node.getTransaction();
            if (tx == null || tx.getAccount() == null) {
                return;
            }
            accounts.add(tx.getAccount());
            transactions.add(new TransactionEvent(tx.getAccount(), tx.getLt(), tx.getHash()));
        });
        transactions.forEach(streamingHub::publishTransaction);
        streamingHub.publishTrace(new TraceEvent(accounts, trace.getId()));
        log.debug("Trace {} published: {} transactions, {} accounts", trace.getId(), transactions.size(), accounts.size());
    }
}
