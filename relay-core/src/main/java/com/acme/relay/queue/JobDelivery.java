package com.acme.relay.queue;

/**
 * Delivers one dequeued job. Implementations wrap the send in the retry policy and throw once
 * the job has failed terminally.
 */
@FunctionalInterface
public interface JobDelivery {
  void deliver(RelayJob job);
}
