package com.bridge.cli;

import static com.bridge.cli.ui.Ansi.CYAN;
import static com.bridge.cli.ui.Ansi.GREEN;
import static com.bridge.cli.ui.Ansi.RED;
import static com.bridge.cli.ui.Ansi.RESET;
import static com.bridge.cli.ui.Ansi.YELLOW;

import com.bridge.cli.ui.Spinner;
import com.bridge.dto.request.SyncRequest;
import com.bridge.dto.response.CommandResponse;
import com.bridge.model.Environment;
import com.bridge.model.InvocationRecord;
import com.bridge.model.ReplayOutcome;
import com.bridge.model.SyncReport;
import com.bridge.service.api.InvocationTracker;
import com.bridge.service.api.ReplayService;
import java.util.List;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Shell commands for reviewing tracked changes and replaying them into another environment.
 */
@ShellComponent
public class SyncCommand {

    private final InvocationTracker tracker;
    private final ReplayService replayService;
    private final Spinner spinner;

    public SyncCommand(InvocationTracker tracker, ReplayService replayService, Spinner spinner) {
        this.tracker = tracker;
        this.replayService = replayService;
        this.spinner = spinner;
    }

    @ShellMethod(key = "changes", value = "List the tracked calls of an environment.")
    public String changes(
            @ShellOption(value = {"--env", "-e"}, help = "sandbox, production or external.", defaultValue = "sandbox") String env
    ) {
        try {
            Environment environment = Environment.fromKey(env);
            List<InvocationRecord> records = tracker.session(environment).drain();
            if (records.isEmpty()) {
                return YELLOW + "No tracked changes in " + environment.key() + "." + RESET;
            }
            StringBuilder out = new StringBuilder();
            out.append(CYAN).append(records.size()).append(" tracked changes in ").append(YELLOW)
                    .append(environment.key()).append(RESET).append("\n");
            for (InvocationRecord record : records) {
                out.append("  #").append(record.ordinal()).append(" ").append(GREEN).append(record.operationName())
                        .append(RESET).append(" ").append(record.arguments()).append(" at ").append(record.timestamp())
                        .append("\n");
            }
            return out.toString().stripTrailing();
        } catch (IllegalArgumentException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "changes-clear", value = "Forget the tracked calls of an environment.")
    public String clearChanges(
            @ShellOption(value = {"--env", "-e"}, help = "sandbox, production or external.", defaultValue = "sandbox") String env
    ) {
        try {
            Environment environment = Environment.fromKey(env);
            int cleared = tracker.session(environment).size();
            tracker.session(environment).clear();
            return CommandResponse.ok("Cleared " + cleared + " tracked changes in " + environment.key() + ".").toAnsiString();
        } catch (IllegalArgumentException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }

    /**
     * Replays the tracked calls of {@code from} against {@code to}, in order.
     */
    @ShellMethod(key = "sync", value = "Replay tracked calls from one environment into another.")
    public String sync(
            @ShellOption(value = "--from", help = "Environment whose changes are replayed.", defaultValue = "sandbox") String from,
            @ShellOption(value = "--to", help = "Environment receiving the changes.", defaultValue = "production") String to
    ) {
        try {
            SyncRequest request = new SyncRequest(Environment.fromKey(from), Environment.fromKey(to));
            SyncReport report = spinner.spin(replayService.replay(request.source(), request.target()));
            return render(report);
        } catch (Exception e) {
            return CommandResponse.error("An error occurred: " + e.getMessage()).toAnsiString();
        }
    }

    private String render(SyncReport report) {
        StringBuilder out = new StringBuilder();
        for (ReplayOutcome outcome : report.outcomes()) {
            InvocationRecord record = outcome.record();
            if (outcome.success()) {
                out.append(GREEN).append("  [OK]   ").append(RESET);
            } else {
                out.append(RED).append("  [FAIL] ").append(RESET);
            }
            out.append("#").append(record.ordinal()).append(" ").append(record.operationName());
            if (!outcome.success()) {
                out.append(": ").append(outcome.error());
            }
            out.append("\n");
        }
        out.append(new CommandResponse(report.success(), report.message()).toAnsiString());
        return out.toString();
    }
}
