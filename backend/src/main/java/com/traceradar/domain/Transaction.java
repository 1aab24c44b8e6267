package com.traceradar.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Ledger transaction as embedded in a trace node.
 * Inside a {@link Trace}, outMsgs holds only messages not matched to a child node.
 */
@NoArgsConstructor
@Getter
@Setter
public class Transaction {

    private String hash;
    private long lt;
    private AccountId account;
    private long utime;
    private boolean success;
    /** Nanotons. */
    private long totalFee;
    private Message inMsg;
    private List<Message> outMsgs = new ArrayList<>();

    public void setOutMsgs(List<Message> outMsgs) {
        this.outMsgs = outMsgs != null ? new ArrayList<>(outMsgs) : new ArrayList<>();
    }
}
