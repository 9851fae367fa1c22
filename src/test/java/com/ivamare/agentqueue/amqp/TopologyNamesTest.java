package com.ivamare.agentqueue.amqp;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TopologyNamesTest {

    @Test
    void shouldNameOrganizationTopology() {
        assertEquals("org.acme.requests", TopologyNames.requestExchange("acme"));
        assertEquals("org.acme.requests.q", TopologyNames.requestQueue("acme"));
        assertEquals("org.acme.retry", TopologyNames.retryExchange("acme"));
        assertEquals("org.acme.retry.4000", TopologyNames.delayQueue("acme", 4000));
        assertEquals("delay_4000", TopologyNames.delayRoutingKey(4000));
        assertEquals("org.acme.dlx", TopologyNames.deadLetterExchange("acme"));
        assertEquals("org.acme.dlq", TopologyNames.deadLetterQueue("acme"));
    }

    @Test
    void shouldNameAgentResponseTopology() {
        assertEquals("agent.planner.responses", TopologyNames.agentResponseExchange("planner"));
        assertEquals("agent.planner.responses.q", TopologyNames.agentResponseQueue("planner"));
    }

    @Test
    void shouldRecoverAgentIdFromResponseQueue() {
        assertEquals("planner", TopologyNames.agentIdFromResponseQueue(TopologyNames.agentResponseQueue("planner")));
        assertEquals("web.search", TopologyNames.agentIdFromResponseQueue("agent.web.search.responses.q"));
        assertNull(TopologyNames.agentIdFromResponseQueue("org.acme.requests.q"));
        assertNull(TopologyNames.agentIdFromResponseQueue(null));
    }
}
