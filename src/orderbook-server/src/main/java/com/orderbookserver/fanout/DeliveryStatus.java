package com.orderbookserver.fanout;

/**
 * Result of offering one line to a session's outbound buffer.
 */
public enum DeliveryStatus {

    /** Line was queued for writing. */
    QUEUED,

    /** Outbound buffer is over its high-water mark; the line was dropped. */
    OVERFLOW,

    /** Session is closed; nothing was written. */
    CLOSED,

    /** Writing failed; the session should be closed. */
    FAILED
}
