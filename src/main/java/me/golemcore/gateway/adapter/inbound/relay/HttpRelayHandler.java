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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.inbound.relay.dto.RelayErrorResponse;
import me.golemcore.gateway.adapter.inbound.relay.dto.RelayMessageRequest;
import me.golemcore.gateway.domain.model.InboundMessage;
import me.golemcore.gateway.port.outbound.MessageBusPort;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.server.HandlerStrategies;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Handles {@code POST /message}: one inbound message in, one event stream out.
 *
 * <p>
 * Request flow:
 * <ol>
 * <li>validate the body (400 with {@code {"error": ...}} on failure, no stream
 * opened)</li>
 * <li>mint a correlation id and tag the caller's metadata with it</li>
 * <li>register a delivery channel for the id</li>
 * <li>open the event stream and publish the inbound message on the bus</li>
 * <li>stream progress events until a terminal one</li>
 * </ol>
 * The registry entry is bound to the stream with {@link Flux#using}, so it is
 * removed on completion, error and caller disconnect alike. Bodies above
 * {@link #MAX_BODY_BYTES} are refused with 413; route with
 * {@link #handlerStrategies()} so the codecs buffer that much.
 */
@Slf4j
public class HttpRelayHandler {

    static final String NOT_ACCEPTING = "Relay is not accepting requests";
    static final String PAYLOAD_TOO_LARGE = "Payload too large";

    public static final int MAX_BODY_BYTES = 1024 * 1024;

    private final CorrelationRegistry registry;
    private final MessageBusPort messageBus;
    private final RelayRequestReader requestReader;
    private final RelayStreamEmitter streamEmitter;
    private final RelayEventWriter eventWriter;
    private final BooleanSupplier accepting;
    private final String failureNotice;
    private final Supplier<String> requestIdGenerator;

    public HttpRelayHandler(CorrelationRegistry registry, MessageBusPort messageBus,
            RelayRequestReader requestReader, RelayStreamEmitter streamEmitter,
            RelayEventWriter eventWriter, BooleanSupplier accepting, String failureNotice,
            Supplier<String> requestIdGenerator) {
        this.registry = registry;
        this.messageBus = messageBus;
        this.requestReader = requestReader;
        this.streamEmitter = streamEmitter;
        this.eventWriter = eventWriter;
        this.accepting = accepting;
        this.failureNotice = failureNotice;
        this.requestIdGenerator = requestIdGenerator;
    }

    /**
     * Strategies whose codecs accept request bodies up to
     * {@link #MAX_BODY_BYTES}.
     */
    public static HandlerStrategies handlerStrategies() {
        return HandlerStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_BODY_BYTES))
                .build();
    }

    public RouterFunction<ServerResponse> routes(String path) {
        return RouterFunctions.route(RequestPredicates.POST(path), this::handleMessage);
    }

    public Mono<ServerResponse> handleMessage(ServerRequest request) {
        if (!accepting.getAsBoolean()) {
            return error(HttpStatus.SERVICE_UNAVAILABLE, NOT_ACCEPTING);
        }
        return request.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(requestReader::read)
                .flatMap(this::openStream)
                .onErrorResume(RelayRequestException.class, e -> {
                    log.warn("[HttpRelay] Rejected request: {}", e.getMessage());
                    return error(HttpStatus.BAD_REQUEST, e.getMessage());
                })
                .onErrorResume(DataBufferLimitException.class, e -> {
                    log.warn("[HttpRelay] Rejected request: body exceeds {} bytes", MAX_BODY_BYTES);
                    return error(HttpStatus.PAYLOAD_TOO_LARGE, PAYLOAD_TOO_LARGE);
                });
    }

    private Mono<ServerResponse> openStream(RelayMessageRequest relayRequest) {
        String requestId = requestIdGenerator.get();
        InboundMessage message = InboundMessage.builder()
                .channel(HttpRelayChannelAdapter.CHANNEL_TYPE)
                .senderId(relayRequest.getSenderId())
                .chatId(relayRequest.getChatId())
                .content(relayRequest.getContent())
                .media(List.of())
                .metadata(RelayMetadata.withRelayRequestId(relayRequest.getMetadata(), requestId))
                .timestamp(Instant.now())
                .build();

        log.debug("[HttpRelay] Accepted request {} (senderId={}, chatId={})",
                requestId, message.getSenderId(), message.getChatId());

        Flux<RelayEvent> events = Flux.using(
                () -> registry.register(requestId),
                channel -> publishAndStream(new RelayStream(requestId), channel, message),
                channel -> release(requestId))
                .onErrorResume(DuplicateCorrelationIdException.class, e -> {
                    log.error("[HttpRelay] {}", e.getMessage());
                    return Flux.just(RelayEvent.notice(failureNotice, RelayEvent.Origin.FAILURE));
                });

        return ServerResponse.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .header(HttpHeaders.CACHE_CONTROL, "no-cache")
                .header(HttpHeaders.CONNECTION, "keep-alive")
                .header("X-Accel-Buffering", "no")
                .body(eventWriter.inserter(events));
    }

    private Flux<RelayEvent> publishAndStream(RelayStream stream, DeliveryChannel channel, InboundMessage message) {
        try {
            messageBus.publishInbound(message);
        } catch (RuntimeException e) { // NOSONAR - reported to the caller as a terminal event
            log.error("[HttpRelay] Failed to enqueue inbound message for request {}: {}",
                    stream.getRequestId(), e.getMessage());
            return Flux.just(RelayEvent.notice(failureNotice, RelayEvent.Origin.FAILURE));
        }
        return streamEmitter.stream(stream, channel)
                .onErrorResume(e -> {
                    log.error("[HttpRelay] Stream for request {} failed", stream.getRequestId(), e);
                    return Flux.just(RelayEvent.notice(failureNotice, RelayEvent.Origin.FAILURE));
                });
    }

    private void release(String requestId) {
        registry.remove(requestId);
        log.debug("[HttpRelay] Request {} finished, {} pending", requestId, registry.size());
    }

    private Mono<ServerResponse> error(HttpStatus status, String message) {
        return ServerResponse.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new RelayErrorResponse(message));
    }
}
