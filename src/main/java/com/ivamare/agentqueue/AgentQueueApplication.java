package com.ivamare.agentqueue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Standalone agent queue service: workers and the response coordinator,
 * with actuator health and Prometheus metrics.
 */
@SpringBootApplication
public class AgentQueueApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentQueueApplication.class, args);
    }
}
