package com.p14n.entitystream.data;

import java.time.Duration;
import java.util.Set;

import com.p14n.entitystream.publisher.StreamablePolicy;
import com.p14n.entitystream.registry.OverflowPolicy;

/**
 * Configuration of the streaming subsystem.
 */
public interface StreamingConfig {

    /**
     * Master switch. When false no server is started and entity mutations are
     * not published.
     */
    boolean enabled();

    BrokerType brokerType();

    String brokerHost();

    int brokerPort();

    String brokerUser();

    String brokerPassword();

    int serverPort();

    /**
     * @return the HTTP path the WebSocket endpoint is served on
     */
    String path();

    /**
     * @return entity types whose mutations are streamed; empty streams all
     */
    Set<String> streamableEntities();

    int outboundQueueSize();

    OverflowPolicy overflowPolicy();

    long publishTimeoutMillis();

    String jwtSecret();

    String jwtAlgorithm();

    default String brokerAddress() {
        return brokerHost() + ":" + brokerPort();
    }

    default Duration publishTimeout() {
        return Duration.ofMillis(publishTimeoutMillis());
    }

    default StreamablePolicy streamablePolicy() {
        Set<String> entities = streamableEntities();
        return entities == null || entities.isEmpty() ? StreamablePolicy.all() : StreamablePolicy.of(entities);
    }
}
