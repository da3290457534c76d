package com.bridge.config;

import com.bridge.model.Environment;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the {@code bridge.*} properties.
 */
@Data
@ConfigurationProperties(prefix = "bridge")
public class BridgeProperties {

    /**
     * Provider endpoints keyed by environment. Environments without an entry are not configured.
     */
    private Map<Environment, Provider> providers = new EnumMap<>(Environment.class);

    private Cache cache = new Cache();

    private Breaker breaker = new Breaker();

    private Http http = new Http();

    private WarmUp warmUp = new WarmUp();

    @Data
    public static class Provider {
        private String url;
        private String username;
        /**
         * May be given as {@code ENC(...)}; jasypt decrypts it on binding.
         */
        private String password;

        public boolean hasUrl() {
            return url != null && !url.isBlank();
        }

        public boolean hasCredentials() {
            return username != null && !username.isBlank() && password != null;
        }
    }

    @Data
    public static class Cache {
        private Duration descriptorTtl = Duration.ofMinutes(5);
        private Duration operationTtl = Duration.ofMinutes(5);
        /**
         * Fixed delay between scheduled invalidations of every cache; zero disables them.
         */
        private Duration refreshInterval = Duration.ZERO;
    }

    @Data
    public static class Breaker {
        private int threshold = 5;
        private Duration coolDown = Duration.ofSeconds(30);
    }

    @Data
    public static class Http {
        private Duration timeout = Duration.ofSeconds(30);
        private Retry retry = new Retry();

        @Data
        public static class Retry {
            private int maxAttempts = 3;
            private Duration initialInterval = Duration.ofMillis(500);
        }
    }

    @Data
    public static class WarmUp {
        private List<Environment> environments = new ArrayList<>();
    }
}
