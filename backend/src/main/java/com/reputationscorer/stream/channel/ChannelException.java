package com.reputationscorer.stream.channel;

/**
 * Transport-level failure of the activity channel (connect, poll, publish, commit).
 * Never tied to a single message: the processor reconnects instead of emitting a failure envelope.
 */
public class ChannelException extends RuntimeException {

    public ChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
