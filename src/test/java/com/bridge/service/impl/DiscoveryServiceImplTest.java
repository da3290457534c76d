package com.bridge.service.impl;

import static com.bridge.support.Json.json;
import static org.assertj.core.api.Assertions.assertThat;

import com.bridge.cache.DiscoveryCache;
import com.bridge.model.CapabilityDescriptor;
import com.bridge.model.Environment;
import com.bridge.model.RawCapability;
import com.bridge.model.Result;
import com.bridge.model.error.CircuitOpenError;
import com.bridge.model.error.DiscoveryError;
import com.bridge.model.error.TransportError;
import com.bridge.support.MutableClock;
import com.bridge.support.StaticProviderRegistry;
import com.bridge.support.StubTransport;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

class DiscoveryServiceImplTest {

    private MutableClock clock;
    private StubTransport sandbox;
    private StubTransport production;
    private DiscoveryServiceImpl discoveryService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        sandbox = new StubTransport().listing(List.of(
                new RawCapability("posts-list", "List posts", json("{'type':'object'}")),
                new RawCapability("users/get", null, null),
                new RawCapability("ping", "Health check", null)));
        production = new StubTransport().listing(List.of(new RawCapability("posts-list", "List posts", null)));
        StaticProviderRegistry registry = new StaticProviderRegistry(clock)
                .with(Environment.SANDBOX, sandbox, 2, Duration.ofSeconds(30))
                .with(Environment.PRODUCTION, production);
        discoveryService = new DiscoveryServiceImpl(registry, new DiscoveryCache<>("descriptor", Duration.ofMinutes(5), clock));
    }

    @Test
    void discover_mapsListingToDescriptors() {
        Result<List<CapabilityDescriptor>, DiscoveryError> result = discoveryService.discover(Environment.SANDBOX).block();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value()).extracting(CapabilityDescriptor::name).containsExactly("posts-list", "users/get", "ping");
        assertThat(result.value()).extracting(CapabilityDescriptor::category).containsExactly("posts", "users", "unknown");
        assertThat(result.value()).allMatch(descriptor -> descriptor.environment() == Environment.SANDBOX);
    }

    @Test
    void discover_twiceWithinTtl_listsOnce() {
        discoveryService.discover(Environment.SANDBOX).block();
        clock.advance(Duration.ofMinutes(4));
        discoveryService.discover(Environment.SANDBOX).block();

        assertThat(sandbox.listCalls()).isEqualTo(1);
    }

    @Test
    void discover_afterTtl_listsAgain() {
        discoveryService.discover(Environment.SANDBOX).block();
        clock.advance(Duration.ofMinutes(5));
        discoveryService.discover(Environment.SANDBOX).block();

        assertThat(sandbox.listCalls()).isEqualTo(2);
    }

    @Test
    void cacheIsIsolatedPerEnvironment() {
        discoveryService.discover(Environment.SANDBOX).block();
        Result<List<CapabilityDescriptor>, DiscoveryError> result = discoveryService.discover(Environment.PRODUCTION).block();

        assertThat(production.listCalls()).isEqualTo(1);
        assertThat(result.value()).hasSize(1);
        assertThat(result.value().get(0).environment()).isEqualTo(Environment.PRODUCTION);
    }

    @Test
    void invalidate_forcesNewListing() {
        discoveryService.discover(Environment.SANDBOX).block();
        discoveryService.discover(Environment.PRODUCTION).block();

        discoveryService.invalidate(Environment.SANDBOX);
        discoveryService.discover(Environment.SANDBOX).block();
        discoveryService.discover(Environment.PRODUCTION).block();
        assertThat(sandbox.listCalls()).isEqualTo(2);
        assertThat(production.listCalls()).isEqualTo(1);

        discoveryService.invalidate(null);
        discoveryService.discover(Environment.PRODUCTION).block();
        assertThat(production.listCalls()).isEqualTo(2);
    }

    @Test
    void failures_areReturnedAndNotCached() {
        sandbox.failListing(TransportError.Reason.UNREACHABLE, "connection refused");

        Result<List<CapabilityDescriptor>, DiscoveryError> failed = discoveryService.discover(Environment.SANDBOX).block();
        assertThat(failed.isFailure()).isTrue();
        assertThat(failed.error().cause()).isInstanceOf(TransportError.class);
        assertThat(((TransportError) failed.error().cause()).reason()).isEqualTo(TransportError.Reason.UNREACHABLE);

        sandbox.listing(List.of(new RawCapability("ping", null, null)));
        Result<List<CapabilityDescriptor>, DiscoveryError> recovered = discoveryService.discover(Environment.SANDBOX).block();
        assertThat(recovered.isSuccess()).isTrue();
        assertThat(sandbox.listCalls()).isEqualTo(2);
    }

    @Test
    void openBreaker_failsWithoutListing() {
        sandbox.failListing(TransportError.Reason.HTTP_STATUS, "HTTP 500");
        discoveryService.discover(Environment.SANDBOX).block();
        discoveryService.discover(Environment.SANDBOX).block();

        Result<List<CapabilityDescriptor>, DiscoveryError> result = discoveryService.discover(Environment.SANDBOX).block();

        assertThat(result.error().cause()).isInstanceOf(CircuitOpenError.class);
        assertThat(sandbox.listCalls()).isEqualTo(2);
    }

    @Test
    void unconfiguredEnvironment_failsWithNotConfigured() {
        Result<List<CapabilityDescriptor>, DiscoveryError> result = discoveryService.discover(Environment.EXTERNAL).block();

        assertThat(result.isFailure()).isTrue();
        assertThat(((TransportError) result.error().cause()).reason()).isEqualTo(TransportError.Reason.NOT_CONFIGURED);
        assertThat(result.error().message()).contains("bridge.providers.external.url");
    }

    @Test
    void concurrentDiscovery_sharesOneListing() {
        Sinks.One<List<RawCapability>> pending = Sinks.one();
        sandbox.listing(pending::asMono);

        Mono<Result<List<CapabilityDescriptor>, DiscoveryError>> first = discoveryService.discover(Environment.SANDBOX);
        Mono<Result<List<CapabilityDescriptor>, DiscoveryError>> second = discoveryService.discover(Environment.SANDBOX);
        var firstResult = first.toFuture();
        var secondResult = second.toFuture();

        pending.tryEmitValue(List.of(new RawCapability("ping", null, null)));

        assertThat(firstResult.join().value()).hasSize(1);
        assertThat(secondResult.join().value()).hasSize(1);
        assertThat(sandbox.listCalls()).isEqualTo(1);
    }

    @Test
    void listing_skipsBlankNames_andKeepsLastDuplicate() {
        sandbox.listing(List.of(
                new RawCapability("posts-list", "first", null),
                new RawCapability(" ", "blank", null),
                new RawCapability("ping", null, null),
                new RawCapability("posts-list", "second", null)));

        List<CapabilityDescriptor> descriptors = discoveryService.discover(Environment.SANDBOX).block().value();

        assertThat(descriptors).extracting(CapabilityDescriptor::name).containsExactly("ping", "posts-list");
        assertThat(descriptors.get(1).description()).isEqualTo("second");
    }

    @Test
    void deriveCategory_usesLeadingSegment() {
        assertThat(DiscoveryServiceImpl.deriveCategory("wordpress-list-posts")).isEqualTo("wordpress");
        assertThat(DiscoveryServiceImpl.deriveCategory("media.upload")).isEqualTo("media");
        assertThat(DiscoveryServiceImpl.deriveCategory("admin:reset")).isEqualTo("admin");
        assertThat(DiscoveryServiceImpl.deriveCategory("standalone")).isEqualTo("unknown");
        assertThat(DiscoveryServiceImpl.deriveCategory("-leading")).isEqualTo("unknown");
    }
}
