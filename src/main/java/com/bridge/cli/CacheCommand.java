package com.bridge.cli;

import com.bridge.dto.response.CommandResponse;
import com.bridge.model.Environment;
import com.bridge.service.api.DiscoveryService;
import com.bridge.service.api.OperationFactory;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

@ShellComponent
public class CacheCommand {

    private final DiscoveryService discoveryService;
    private final OperationFactory operationFactory;

    public CacheCommand(DiscoveryService discoveryService, OperationFactory operationFactory) {
        this.discoveryService = discoveryService;
        this.operationFactory = operationFactory;
    }

    /**
     * Drops cached descriptors and operations so the next command re-discovers.
     *
     * @param env The environment key; omitted means every environment.
     */
    @ShellMethod(key = "invalidate", value = "Drop cached capabilities and operations.")
    public String invalidate(
            @ShellOption(value = {"--env", "-e"}, help = "Environment to invalidate; all when omitted.", defaultValue = ShellOption.NULL) String env
    ) {
        try {
            Environment environment = env == null ? null : Environment.fromKey(env);
            operationFactory.invalidate(environment);
            discoveryService.invalidate(environment);
            return CommandResponse.ok("Invalidated caches for "
                    + (environment == null ? "all environments" : environment.key()) + ".").toAnsiString();
        } catch (IllegalArgumentException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }
}
