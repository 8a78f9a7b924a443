package com.wayfinder.worker;

/**
 * Creates unconnected worker connections; {@link WorkerConnection#initialize} starts them.
 */
@FunctionalInterface
public interface WorkerConnectionFactory {

    WorkerConnection create(String sessionId);
}
