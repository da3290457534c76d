package com.bridge.cli;

import static com.bridge.cli.ui.Ansi.CYAN;
import static com.bridge.cli.ui.Ansi.GREEN;
import static com.bridge.cli.ui.Ansi.RED;
import static com.bridge.cli.ui.Ansi.RESET;
import static com.bridge.cli.ui.Ansi.YELLOW;

import com.bridge.cli.ui.Spinner;
import com.bridge.model.CapabilityDescriptor;
import com.bridge.model.CircuitBreakerState;
import com.bridge.model.Environment;
import com.bridge.model.Result;
import com.bridge.model.error.DiscoveryError;
import com.bridge.service.api.DiscoveryService;
import com.bridge.service.api.ProviderRegistry;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;

/**
 * Reports, per configured environment, whether its provider answers and how its breaker stands.
 */
@ShellComponent
public class HealthCommand {

    private final ProviderRegistry providerRegistry;
    private final DiscoveryService discoveryService;
    private final Spinner spinner;

    public HealthCommand(ProviderRegistry providerRegistry, DiscoveryService discoveryService, Spinner spinner) {
        this.providerRegistry = providerRegistry;
        this.discoveryService = discoveryService;
        this.spinner = spinner;
    }

    @ShellMethod(key = "health", value = "Check every configured provider.")
    public String health() {
        Set<Environment> environments = new TreeSet<>(providerRegistry.configuredEnvironments());
        if (environments.isEmpty()) {
            return YELLOW + "No providers configured. Set bridge.providers.<env>.url." + RESET;
        }
        StringBuilder out = new StringBuilder();
        boolean healthy = true;
        for (Environment environment : environments) {
            out.append(CYAN).append(environment.key()).append(RESET).append(": ");
            try {
                Result<List<CapabilityDescriptor>, DiscoveryError> result = spinner.spin(discoveryService.discover(environment));
                if (result.isSuccess()) {
                    out.append(GREEN).append("ok").append(RESET).append(", ").append(result.value().size()).append(" capabilities");
                } else {
                    healthy = false;
                    out.append(RED).append("unavailable").append(RESET).append(", ").append(result.error().cause().message());
                }
                CircuitBreakerState breaker = providerRegistry.connection(environment).circuitBreaker().state();
                out.append(", breaker ").append(breaker.open() ? RED + "open" + RESET : "closed")
                        .append(" (").append(breaker.consecutiveFailures()).append("/").append(breaker.threshold())
                        .append(" failures)");
            } catch (Exception e) {
                healthy = false;
                out.append(RED).append("error").append(RESET).append(", ").append(e.getMessage());
            }
            out.append("\n");
        }
        out.append(healthy ? GREEN + "All providers healthy." : RED + "Some providers are unhealthy.").append(RESET);
        return out.toString();
    }
}
