package com.endecrelay.relay.broker;

/**
 * Final outcome of one {@link ReliablePublisher#publish(Object, String)} call.
 */
public enum PublishOutcome {

    /** The broker confirmed the message. */
    DELIVERED,

    /** The broker returned the message: no queue is bound for the routing key. */
    UNROUTABLE,

    /** Serialization failed or the retry budget was exhausted. */
    FAILED,

    /** Shutdown was requested while waiting to retry. */
    CANCELLED
}
