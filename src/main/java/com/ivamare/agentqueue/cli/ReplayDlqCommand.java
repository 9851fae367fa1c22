package com.ivamare.agentqueue.cli;

import com.ivamare.agentqueue.model.Priority;
import com.ivamare.agentqueue.ops.DlqReplayService;
import com.ivamare.agentqueue.ops.ReplayRequest;
import com.ivamare.agentqueue.ops.ReplayResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Replays dead-lettered messages for one organization.
 */
@Command(
    name = "replay-dlq",
    version = "0.1.0",
    description = "Replay dead-lettered messages back onto an organization's request queue",
    mixinStandardHelpOptions = true,
    footerHeading = "%nExit codes:%n",
    footer = {
        "  0  replayed, or dry run listed candidates",
        "  1  no replayable messages matched",
        "  2  invalid arguments",
        "  3  priority override needs --yes",
        "  4  some messages could not be republished"
    }
)
public class ReplayDlqCommand implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_NO_CANDIDATES = 1;
    public static final int EXIT_CONFIRMATION_REQUIRED = 3;
    public static final int EXIT_PARTIAL_FAILURE = 4;

    @Spec
    private CommandSpec spec;

    @Option(names = "--org-id", required = true, description = "Organization whose DLQ is replayed")
    private String orgId;

    @Option(names = "--limit", defaultValue = "100", description = "Maximum messages to replay (default: ${DEFAULT-VALUE})")
    private int limit;

    @Option(names = "--type", description = "Only replay messages of this type (e.g. tool_call)")
    private String type;

    @Option(names = "--since", description = "Only messages dead-lettered at or after this instant (ISO-8601)")
    private Instant since;

    @Option(names = "--until", description = "Only messages dead-lettered before this instant (ISO-8601)")
    private Instant until;

    @Option(names = "--priority", description = "Republish at this priority (P0-P3 or 0-3)")
    private String priority;

    @Option(names = "--dry-run", description = "Report candidates without publishing")
    private boolean dryRun;

    @Option(names = "--yes", description = "Confirm a priority override that changes message priorities")
    private boolean confirmed;

    private final Supplier<DlqReplayService> serviceSupplier;

    public ReplayDlqCommand(Supplier<DlqReplayService> serviceSupplier) {
        this.serviceSupplier = serviceSupplier;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (limit < 1) {
            throw new ParameterException(spec.commandLine(), "--limit must be at least 1");
        }

        Priority override = priority != null ? Priority.parse(priority) : null;
        ReplayRequest request = new ReplayRequest(orgId, type, since, until, limit, override, dryRun, confirmed);
        ReplayResult result = serviceSupplier.get().replay(request);

        switch (result.status()) {
            case NO_CANDIDATES:
                err.printf("No replayable DLQ messages for org %s%n", orgId);
                return EXIT_NO_CANDIDATES;
            case DRY_RUN:
                out.printf("Dry run: %d message(s) would be replayed for org %s%n", result.count(), orgId);
                result.messageIds().forEach(id -> out.printf("  %s%n", id));
                return EXIT_OK;
            case CONFIRMATION_REQUIRED:
                err.printf("%d message(s) would change priority to %s; re-run with --yes to confirm%n",
                    result.count(), override);
                return EXIT_CONFIRMATION_REQUIRED;
            default:
                out.printf("Replayed %d message(s) for org %s%n", result.count(), orgId);
                if (result.failed() > 0) {
                    err.printf("%d message(s) failed to replay%n", result.failed());
                    return EXIT_PARTIAL_FAILURE;
                }
                return EXIT_OK;
        }
    }
}
