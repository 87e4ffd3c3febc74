package com.switchyard.core.queue;

/**
 * Point-in-time view of one channel.
 *
 * @param pending     tasks waiting for a slot, including tasks waiting out a retry backoff
 * @param running     tasks currently in flight
 * @param concurrency maximum tasks in flight
 * @param paused      whether the channel is holding back new starts
 */
public record ChannelStatus(
    int pending,
    int running,
    int concurrency,
    boolean paused
) {}
