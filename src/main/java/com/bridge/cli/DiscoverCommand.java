package com.bridge.cli;

import static com.bridge.cli.ui.Ansi.CYAN;
import static com.bridge.cli.ui.Ansi.GREEN;
import static com.bridge.cli.ui.Ansi.RESET;
import static com.bridge.cli.ui.Ansi.YELLOW;

import com.bridge.cli.ui.JsonPrinter;
import com.bridge.cli.ui.Spinner;
import com.bridge.dto.response.CommandResponse;
import com.bridge.model.CapabilityDescriptor;
import com.bridge.model.Environment;
import com.bridge.model.Result;
import com.bridge.model.error.DiscoveryError;
import com.bridge.service.api.DiscoveryService;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Shell commands for browsing the capabilities a provider exposes.
 */
@ShellComponent
public class DiscoverCommand {

    private final DiscoveryService discoveryService;
    private final Spinner spinner;

    public DiscoverCommand(DiscoveryService discoveryService, Spinner spinner) {
        this.discoveryService = discoveryService;
        this.spinner = spinner;
    }

    /**
     * Lists the environment's capabilities grouped by category.
     *
     * @param env The environment key.
     * @return the rendered listing or error.
     */
    @ShellMethod(key = "discover", value = "List the capabilities of an environment, grouped by category.")
    public String discover(
            @ShellOption(value = {"--env", "-e"}, help = "sandbox, production or external.", defaultValue = "sandbox") String env
    ) {
        try {
            Environment environment = Environment.fromKey(env);
            Result<List<CapabilityDescriptor>, DiscoveryError> result = spinner.spin(discoveryService.discover(environment));
            if (result.isFailure()) {
                return CommandResponse.error(result.error().message()).toAnsiString();
            }
            List<CapabilityDescriptor> descriptors = result.value();
            if (descriptors.isEmpty()) {
                return YELLOW + "No capabilities found in " + environment.key() + "." + RESET;
            }
            Map<String, List<CapabilityDescriptor>> byCategory = descriptors.stream()
                    .collect(Collectors.groupingBy(CapabilityDescriptor::category, TreeMap::new, Collectors.toList()));

            StringBuilder out = new StringBuilder();
            out.append(CYAN).append(descriptors.size()).append(" capabilities in ").append(YELLOW)
                    .append(environment.key()).append(RESET).append("\n");
            byCategory.forEach((category, members) -> {
                out.append(GREEN).append(category).append(RESET).append(" (").append(members.size()).append(")\n");
                for (CapabilityDescriptor descriptor : members) {
                    out.append("  - ").append(descriptor.name());
                    if (descriptor.description() != null && !descriptor.description().isBlank()) {
                        out.append(": ").append(descriptor.description());
                    }
                    out.append("\n");
                }
            });
            return out.toString().stripTrailing();
        } catch (Exception e) {
            return CommandResponse.error("An error occurred: " + e.getMessage()).toAnsiString();
        }
    }

    /**
     * Shows one capability's metadata and input schema.
     *
     * @param name The capability name.
     * @param env  The environment key.
     * @return the rendered details or error.
     */
    @ShellMethod(key = "details", value = "Show the description, category and input schema of a capability.")
    public String details(
            @ShellOption(help = "The capability name.") String name,
            @ShellOption(value = {"--env", "-e"}, help = "sandbox, production or external.", defaultValue = "sandbox") String env
    ) {
        try {
            Environment environment = Environment.fromKey(env);
            Result<List<CapabilityDescriptor>, DiscoveryError> result = spinner.spin(discoveryService.discover(environment));
            if (result.isFailure()) {
                return CommandResponse.error(result.error().message()).toAnsiString();
            }
            Optional<CapabilityDescriptor> match = result.value().stream()
                    .filter(descriptor -> descriptor.name().equals(name))
                    .findFirst();
            if (match.isEmpty()) {
                return CommandResponse.error("Capability '" + name + "' not found in " + environment.key() + ".").toAnsiString();
            }
            CapabilityDescriptor descriptor = match.get();
            StringBuilder out = new StringBuilder();
            out.append(CYAN).append("Capability: ").append(YELLOW).append(descriptor.name()).append(RESET).append("\n");
            out.append("  Category: ").append(descriptor.category()).append("\n");
            out.append("  Description: ").append(descriptor.description() == null ? "-" : descriptor.description()).append("\n");
            out.append(CYAN).append("  Input schema:").append(RESET).append("\n");
            if (descriptor.hasInputSchema()) {
                for (String line : JsonPrinter.format(descriptor.inputSchema()).split("\n")) {
                    out.append("    ").append(line).append("\n");
                }
            } else {
                out.append("    (none; any arguments are accepted)\n");
            }
            return out.toString().stripTrailing();
        } catch (Exception e) {
            return CommandResponse.error("An error occurred: " + e.getMessage()).toAnsiString();
        }
    }
}
