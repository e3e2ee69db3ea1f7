package com.reputationscorer.stream.channel;

/**
 * Opens a fresh channel per processing session (initial connect and every reconnect).
 */
public interface ActivityChannelFactory {

    /**
     * @throws ChannelException if the clients cannot be created or subscribed
     */
    ActivityChannel open();
}
