package com.traceradar.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Inbound or outbound message of a transaction.
 */
@NoArgsConstructor
@Getter
@Setter
public class Message {

    private MessageType msgType;
    /** Absent for external-in messages. */
    private AccountId source;
    /** Absent for external-out messages. */
    private AccountId destination;
    /** Attached value in nanotons. */
    private long value;
    private long createdLt;
    /** Null when the body could not be decoded. */
    private DecodedBody decodedBody;
}
