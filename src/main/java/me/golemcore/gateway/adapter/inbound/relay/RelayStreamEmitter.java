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
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Turns a request's delivery channel into its event stream.
 *
 * <p>
 * The stream ends after exactly one terminal event:
 * <ul>
 * <li>a delivered message without the progress flag,</li>
 * <li>a timeout notice when nothing arrives within the idle window (measured
 * from the previous delivery, or from subscription for the first one),</li>
 * <li>a shutdown notice when the channel is closed by {@code stop()}.</li>
 * </ul>
 * A caller that disconnects cancels the stream; no terminal event is produced
 * then because nobody is left to read it.
 */
@Slf4j
public class RelayStreamEmitter {

    static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(900);

    private final Duration responseTimeout;
    private final String timeoutNotice;
    private final String shutdownNotice;

    public RelayStreamEmitter(GatewayProperties.HttpRelayProperties config) {
        this(config.getResponseTimeout(), config.getTimeoutNotice(), config.getShutdownNotice());
    }

    public RelayStreamEmitter(Duration responseTimeout, String timeoutNotice, String shutdownNotice) {
        this.responseTimeout = responseTimeout != null && !responseTimeout.isNegative() && !responseTimeout.isZero()
                ? responseTimeout
                : DEFAULT_RESPONSE_TIMEOUT;
        this.timeoutNotice = timeoutNotice;
        this.shutdownNotice = shutdownNotice;
    }

    public Duration getResponseTimeout() {
        return responseTimeout;
    }

    public Flux<RelayEvent> stream(RelayStream stream, DeliveryChannel channel) {
        return channel.messages()
                .map(RelayEvent::of)
                .timeout(responseTimeout, Mono.just(RelayEvent.notice(timeoutNotice, RelayEvent.Origin.TIMEOUT)))
                .concatWith(Mono.just(RelayEvent.notice(shutdownNotice, RelayEvent.Origin.SHUTDOWN)))
                .takeUntil(RelayEvent::isTerminal)
                .doOnNext(event -> {
                    stream.onEvent(event);
                    logEvent(stream, event);
                })
                .doOnCancel(() -> {
                    stream.onAbandoned();
                    log.info("[HttpRelay] Caller disconnected from request {}", stream.getRequestId());
                });
    }

    private void logEvent(RelayStream stream, RelayEvent event) {
        switch (event.origin()) {
            case TIMEOUT -> log.info("[HttpRelay] Request {} timed out after {}", stream.getRequestId(),
                    responseTimeout);
            case SHUTDOWN -> log.info("[HttpRelay] Request {} ended by channel shutdown", stream.getRequestId());
            default -> log.debug("[HttpRelay] Request {}: {} event", stream.getRequestId(),
                    event.type().getWireName());
        }
    }
}
