package com.traceradar.streaming;

import com.traceradar.domain.AccountId;

import java.util.Set;

/**
 * A trace became final. Carries every account that has a transaction in it.
 */
public record TraceEvent(Set<AccountId> accounts, String hash) {

    public TraceEvent {
        accounts = Set.copyOf(accounts);
    }
}
