package com.ivamare.agentqueue.cli;

import com.ivamare.agentqueue.AgentQueueApplication;
import com.ivamare.agentqueue.ops.DlqReplayService;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;
import picocli.CommandLine;

/**
 * Entry point for the DLQ replay tool.
 *
 * <p>The Spring context is only started once arguments parse, with worker and
 * coordinator auto-start disabled.
 */
public final class ReplayDlqCli {

    private ReplayDlqCli() {
    }

    public static void main(String[] args) {
        ConfigurableApplicationContext[] context = new ConfigurableApplicationContext[1];
        ReplayDlqCommand command = new ReplayDlqCommand(() -> {
            context[0] = new SpringApplicationBuilder(AgentQueueApplication.class)
                .web(WebApplicationType.NONE)
                .logStartupInfo(false)
                .properties(
                    "agentqueue.worker.auto-start=false",
                    "agentqueue.coordinator.auto-start=false",
                    "agentqueue.retention.enabled=false")
                .run();
            return context[0].getBean(DlqReplayService.class);
        });

        int code;
        try {
            code = new CommandLine(command).execute(args);
        } finally {
            if (context[0] != null) {
                context[0].close();
            }
        }
        System.exit(code);
    }
}
