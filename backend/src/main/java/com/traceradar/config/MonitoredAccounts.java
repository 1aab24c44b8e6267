package com.traceradar.config;

import com.traceradar.domain.AccountId;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Accounts this instance indexes. Streaming subscriptions are limited to this set.
 */
public final class MonitoredAccounts {

    private final Set<AccountId> accounts;

    public MonitoredAccounts(Collection<AccountId> accounts) {
        this.accounts = Collections.unmodifiableSet(new LinkedHashSet<>(accounts));
    }

    public boolean contains(AccountId account) {
        return accounts.contains(account);
    }

    public Set<AccountId> all() {
        return accounts;
    }

    public int size() {
        return accounts.size();
    }
}
