package com.bridge.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.bridge.cli.ui.Spinner;
import com.bridge.model.CapabilityDescriptor;
import com.bridge.model.Environment;
import com.bridge.model.Result;
import com.bridge.model.error.DiscoveryError;
import com.bridge.model.error.TransportError;
import com.bridge.resilience.CircuitBreaker;
import com.bridge.service.api.DiscoveryService;
import com.bridge.service.api.ProviderConnection;
import com.bridge.service.api.ProviderRegistry;
import com.bridge.support.MutableClock;
import com.bridge.support.StubTransport;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class HealthCommandTest {

    @Mock
    private ProviderRegistry providerRegistry;
    @Mock
    private DiscoveryService discoveryService;
    @Mock
    private Spinner spinner;

    private HealthCommand healthCommand;

    @BeforeEach
    void setUp() {
        when(spinner.spin(any())).thenAnswer(invocation -> invocation.getArgument(0, Mono.class).block());
        for (Environment environment : Environment.values()) {
            when(providerRegistry.connection(environment)).thenReturn(new ProviderConnection(environment,
                    new StubTransport(), new CircuitBreaker(environment.key(), 5, Duration.ofSeconds(30), new MutableClock())));
        }
        healthCommand = new HealthCommand(providerRegistry, discoveryService, spinner);
    }

    @Test
    void health_noProviders() {
        when(providerRegistry.configuredEnvironments()).thenReturn(Set.of());

        assertThat(healthCommand.health()).contains("No providers configured");
    }

    @Test
    void health_allHealthy() {
        when(providerRegistry.configuredEnvironments()).thenReturn(Set.of(Environment.SANDBOX));
        when(discoveryService.discover(Environment.SANDBOX)).thenReturn(Mono.just(Result.success(List.of(
                new CapabilityDescriptor("ping", null, null, null, Environment.SANDBOX)))));

        String output = healthCommand.health();

        assertThat(output).contains("sandbox").contains("ok").contains("1 capabilities")
                .contains("breaker closed (0/5 failures)").contains("All providers healthy.");
    }

    @Test
    void health_reportsUnavailableProvider() {
        when(providerRegistry.configuredEnvironments()).thenReturn(Set.of(Environment.SANDBOX, Environment.PRODUCTION));
        when(discoveryService.discover(Environment.SANDBOX)).thenReturn(Mono.just(Result.success(List.of())));
        DiscoveryError error = new DiscoveryError(Environment.PRODUCTION,
                new TransportError(TransportError.Reason.UNREACHABLE, "connection refused", null));
        when(discoveryService.discover(Environment.PRODUCTION))
                .thenReturn(Mono.just(Result.<List<CapabilityDescriptor>, DiscoveryError>failure(error)));

        String output = healthCommand.health();

        assertThat(output).contains("unavailable").contains("connection refused").contains("Some providers are unhealthy.");
        assertThat(output.indexOf("sandbox")).isLessThan(output.indexOf("production"));
    }
}
