package com.traceradar.ingestion.intake;

import com.traceradar.domain.Trace;
import com.traceradar.domain.TraceRepository;
import com.traceradar.streaming.StreamingHub;
import com.traceradar.streaming.TraceEvent;
import com.traceradar.streaming.TransactionEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Set;

import static com.traceradar.domain.TraceFixtures.account;
import static com.traceradar.domain.TraceFixtures.node;
import static com.traceradar.domain.TraceFixtures.transaction;
import static com.traceradar.domain.TraceFixtures.txHash;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TraceIngestServiceTest {

    @Mock
    private TraceRepository traceRepository;
    @Mock
    private StreamingHub streamingHub;

    @InjectMocks
    private TraceIngestService service;

    @Test
    @DisplayName("complete trace is stored, then its transactions and the trace are published")
    void publishesCompleteTrace() {
        Trace trace = node(1, account(1), node(2, account(2)), node(3, account(1)));
        when(traceRepository.save(trace)).thenReturn(trace);

        StepVerifier.create(service.accept(trace)).expectNext(true).verifyComplete();

        ArgumentCaptor<TransactionEvent> transactions = ArgumentCaptor.forClass(TransactionEvent.class);
        verify(streamingHub, times(3)).publishTransaction(transactions.capture());
        assertThat(transactions.getAllValues()).extracting(TransactionEvent::txHash)
                .containsExactly(txHash(1), txHash(2), txHash(3));
        verify(streamingHub).publishTrace(new TraceEvent(Set.of(account(1), account(2)), txHash(1)));
    }

    @Test
    @DisplayName("in-progress trace is stored but not published")
    void storesInProgressTrace() {
        Trace trace = Trace.of(transaction(1, account(1), null, 1), List.of(), List.of());
        when(traceRepository.save(trace)).thenReturn(trace);

        StepVerifier.create(service.accept(trace)).expectNext(false).verifyComplete();

        verify(streamingHub, never()).publishTrace(any());
        verify(streamingHub, never()).publishTransaction(any());
    }

    @Test
    @DisplayName("trace without root transaction is rejected before storage")
    void rejectsInvalidTrace() {
        StepVerifier.create(service.accept(new Trace()))
                .expectError(IllegalArgumentException.class)
                .verify();

        verifyNoInteractions(traceRepository, streamingHub);
    }

    @Test
    @DisplayName("storage failure propagates and nothing is published")
    void storageFailure() {
        Trace trace = node(1, account(1));
        when(traceRepository.save(trace)).thenThrow(new IllegalStateException("mongo down"));

        StepVerifier.create(service.accept(trace)).expectErrorMessage("mongo down").verify();

        verifyNoInteractions(streamingHub);
    }
}
