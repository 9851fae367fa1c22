package com.ivamare.agentqueue.backpressure;

/**
 * Reads the number of ready messages on a broker queue.
 */
@FunctionalInterface
public interface QueueDepthReader {

    /**
     * @param queueName Broker queue name
     * @return ready message count, 0 if the queue does not exist
     */
    long depth(String queueName);
}
