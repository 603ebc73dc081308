/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.gateway.adapter.inbound.relay;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.OutboundMessage;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.inbound.ChannelPort;
import me.golemcore.gateway.port.outbound.MessageBusPort;
import org.springframework.http.server.reactive.HttpHandler;
import org.springframework.http.server.reactive.ReactorHttpHandlerAdapter;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.server.RouterFunctions;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

import java.time.Duration;

/**
 * {@link ChannelPort} implementation for the HTTP relay channel.
 *
 * <p>
 * Binds its own listener and serves one endpoint that answers each request with
 * an event stream fed by the agent's outbound messages. {@link #send} is the
 * relay's outbound dispatcher: it matches messages to pending requests by the
 * correlation id in their metadata.
 *
 * <p>
 * Each {@link #start()} builds a fresh {@link CorrelationRegistry};
 * {@link #stop()} stops accepting requests, closes every pending delivery
 * channel (queued messages are dropped and open streams end with a shutdown
 * notice), empties the registry and releases the listener.
 */
@Component
@Slf4j
public class HttpRelayChannelAdapter implements ChannelPort {

    public static final String CHANNEL_TYPE = "http_relay";

    private static final Duration DISPOSE_TIMEOUT = Duration.ofSeconds(5);

    private final GatewayProperties.HttpRelayProperties config;
    private final MessageBusPort messageBus;
    private final ObjectMapper objectMapper;

    private final Object lifecycleLock = new Object();
    private volatile boolean accepting = false;
    private volatile CorrelationRegistry registry;
    private volatile RelayOutboundDispatcher dispatcher;
    private DisposableServer server;

    public HttpRelayChannelAdapter(GatewayProperties properties, MessageBusPort messageBus,
            ObjectMapper objectMapper) {
        this.config = properties.getChannels().getHttpRelay();
        this.messageBus = messageBus;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (server != null) {
                log.debug("[HttpRelay] Already started");
                return;
            }

            CorrelationRegistry newRegistry = new CorrelationRegistry();
            HttpRelayHandler handler = createHandler(newRegistry);
            registry = newRegistry;
            dispatcher = new RelayOutboundDispatcher(newRegistry);
            accepting = true;

            HttpHandler httpHandler = RouterFunctions.toHttpHandler(handler.routes(config.getPath()),
                    HttpRelayHandler.handlerStrategies());
            try {
                server = HttpServer.create()
                        .host(config.getHost())
                        .port(config.getPort())
                        .handle(new ReactorHttpHandlerAdapter(httpHandler))
                        .bindNow();
            } catch (RuntimeException e) {
                accepting = false;
                dispatcher = null;
                registry = null;
                throw e;
            }

            log.info("[HttpRelay] Channel started on {}:{}{}", config.getHost(), server.port(), config.getPath());
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            accepting = false;
            dispatcher = null;

            CorrelationRegistry current = registry;
            registry = null;
            if (current != null) {
                int drained = current.drainAll();
                if (drained > 0) {
                    log.info("[HttpRelay] Closed {} pending request(s)", drained);
                }
            }

            if (server != null) {
                try {
                    server.disposeNow(DISPOSE_TIMEOUT);
                } catch (IllegalStateException e) {
                    log.warn("[HttpRelay] Listener did not close within {}: {}", DISPOSE_TIMEOUT, e.getMessage());
                } finally {
                    server = null;
                }
            }
            log.info("[HttpRelay] Channel stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return accepting;
    }

    @Override
    public void send(OutboundMessage message) {
        RelayOutboundDispatcher current = dispatcher;
        if (current == null) {
            return;
        }
        current.deliver(message);
    }

    /**
     * Port the listener is bound to, or {@code -1} when stopped.
     */
    public int getBoundPort() {
        synchronized (lifecycleLock) {
            return server != null ? server.port() : -1;
        }
    }

    /**
     * Number of requests currently waiting for outbound messages.
     */
    public int getPendingRequestCount() {
        CorrelationRegistry current = registry;
        return current != null ? current.size() : 0;
    }

    private HttpRelayHandler createHandler(CorrelationRegistry correlationRegistry) {
        return new HttpRelayHandler(
                correlationRegistry,
                messageBus,
                new RelayRequestReader(objectMapper),
                new RelayStreamEmitter(config),
                new RelayEventWriter(objectMapper),
                () -> accepting,
                config.getFailureNotice(),
                RelayMetadata::newRequestId);
    }
}
