package com.traceradar.streaming;

import com.traceradar.domain.AccountId;

public record TransactionEvent(AccountId account, long lt, String txHash) {
}
