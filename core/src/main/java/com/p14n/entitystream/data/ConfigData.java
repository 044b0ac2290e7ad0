package com.p14n.entitystream.data;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.p14n.entitystream.registry.OverflowPolicy;

public record ConfigData(boolean enabled,
        BrokerType brokerType,
        String brokerHost,
        int brokerPort,
        String brokerUser,
        String brokerPassword,
        int serverPort,
        String path,
        Set<String> streamableEntities,
        int outboundQueueSize,
        OverflowPolicy overflowPolicy,
        long publishTimeoutMillis,
        String jwtSecret,
        String jwtAlgorithm) implements StreamingConfig {

    public static final String DEFAULT_PATH = "/api/v1/stream";
    public static final int DEFAULT_SERVER_PORT = 8000;
    public static final int DEFAULT_OUTBOUND_QUEUE_SIZE = 256;
    public static final long DEFAULT_PUBLISH_TIMEOUT_MILLIS = 5000;

    public ConfigData {
        if (brokerType == null) {
            throw new IllegalArgumentException("brokerType cannot be null");
        }
        if (brokerPort < 0 || brokerPort > 65535) {
            throw new IllegalArgumentException("Invalid broker port: " + brokerPort);
        }
        if (serverPort < 0 || serverPort > 65535) {
            throw new IllegalArgumentException("Invalid server port: " + serverPort);
        }
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("Streaming path must start with '/': " + path);
        }
        if (outboundQueueSize < 1) {
            throw new IllegalArgumentException("Outbound queue size must be at least 1");
        }
        if (publishTimeoutMillis < 1) {
            throw new IllegalArgumentException("Publish timeout must be positive");
        }
        streamableEntities = streamableEntities == null ? Set.of() : Set.copyOf(streamableEntities);
    }

    /**
     * Single-node configuration: in-memory broker, defaults everywhere else.
     */
    public ConfigData(int serverPort, String jwtSecret) {
        this(true, BrokerType.MEMORY, "localhost", 0, "guest", "guest", serverPort, DEFAULT_PATH, Set.of(),
                DEFAULT_OUTBOUND_QUEUE_SIZE, OverflowPolicy.DROP_OLDEST, DEFAULT_PUBLISH_TIMEOUT_MILLIS, jwtSecret,
                "HS256");
    }

    /**
     * Reads the configuration from environment variables.
     *
     * @throws IllegalArgumentException if a variable holds an invalid value
     */
    public static ConfigData fromEnv(Map<String, String> env) {
        BrokerType brokerType = BrokerType.fromName(value(env, "STREAMING_BROKER", "kafka"));
        return new ConfigData(
                bool(env, "ENABLE_STREAMING", false),
                brokerType,
                value(env, "STREAMING_BROKER_HOST", "localhost"),
                integer(env, "STREAMING_BROKER_PORT", brokerType.defaultPort()),
                value(env, "STREAMING_BROKER_USER", "guest"),
                value(env, "STREAMING_BROKER_PASSWORD", "guest"),
                integer(env, "STREAMING_SERVER_PORT", DEFAULT_SERVER_PORT),
                value(env, "STREAMING_PATH", DEFAULT_PATH),
                list(env, "STREAMING_ENTITIES"),
                integer(env, "STREAMING_OUTBOUND_QUEUE_SIZE", DEFAULT_OUTBOUND_QUEUE_SIZE),
                OverflowPolicy.fromName(value(env, "STREAMING_OVERFLOW_POLICY", "drop-oldest")),
                integer(env, "STREAMING_PUBLISH_TIMEOUT_MS", (int) DEFAULT_PUBLISH_TIMEOUT_MILLIS),
                value(env, "JWT_SECRET_KEY", "your-secret-key"),
                value(env, "JWT_ALGORITHM", "HS256"));
    }

    private static String value(Map<String, String> env, String name, String defaultValue) {
        String v = env.get(name);
        return v == null || v.isBlank() ? defaultValue : v.trim();
    }

    private static boolean bool(Map<String, String> env, String name, boolean defaultValue) {
        String v = value(env, name, null);
        if (v == null) {
            return defaultValue;
        }
        switch (v.toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
            case "yes":
                return true;
            case "false":
            case "0":
            case "no":
                return false;
            default:
                throw new IllegalArgumentException(name + " must be true or false: " + v);
        }
    }

    private static int integer(Map<String, String> env, String name, int defaultValue) {
        String v = value(env, name, null);
        if (v == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number: " + v, e);
        }
    }

    private static Set<String> list(Map<String, String> env, String name) {
        String v = value(env, name, null);
        if (v == null) {
            return Set.of();
        }
        return Arrays.stream(v.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
    }
}
