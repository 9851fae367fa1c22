package com.ivamare.agentqueue.amqp;

/**
 * Exchange, queue and routing-key naming for organization and agent topology.
 */
public final class TopologyNames {

    public static final String REQUESTS_ROUTING_KEY = "requests";
    public static final String DEAD_ROUTING_KEY = "dead";
    public static final String RESPONSES_ROUTING_KEY = "responses";

    private static final String AGENT_PREFIX = "agent.";
    private static final String RESPONSE_QUEUE_SUFFIX = ".responses.q";

    private TopologyNames() {
    }

    public static String requestExchange(String orgId) {
        return "org." + orgId + ".requests";
    }

    public static String requestQueue(String orgId) {
        return requestExchange(orgId) + ".q";
    }

    public static String retryExchange(String orgId) {
        return "org." + orgId + ".retry";
    }

    public static String delayQueue(String orgId, long delayMs) {
        return retryExchange(orgId) + "." + delayMs;
    }

    public static String delayRoutingKey(long delayMs) {
        return "delay_" + delayMs;
    }

    public static String deadLetterExchange(String orgId) {
        return "org." + orgId + ".dlx";
    }

    public static String deadLetterQueue(String orgId) {
        return "org." + orgId + ".dlq";
    }

    public static String agentResponseExchange(String agentId) {
        return AGENT_PREFIX + agentId + ".responses";
    }

    public static String agentResponseQueue(String agentId) {
        return AGENT_PREFIX + agentId + RESPONSE_QUEUE_SUFFIX;
    }

    /**
     * Inverse of {@link #agentResponseQueue(String)}.
     *
     * @param queueName Consumer queue name
     * @return agent id, or null if the name is not an agent response queue
     */
    public static String agentIdFromResponseQueue(String queueName) {
        if (queueName == null || !queueName.startsWith(AGENT_PREFIX) || !queueName.endsWith(RESPONSE_QUEUE_SUFFIX)) {
            return null;
        }
        return queueName.substring(AGENT_PREFIX.length(), queueName.length() - RESPONSE_QUEUE_SUFFIX.length());
    }
}
