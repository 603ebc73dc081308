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

import me.golemcore.gateway.domain.model.OutboundMessage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Per-request FIFO queue carrying outbound messages from the dispatcher to the
 * request's stream.
 *
 * <p>
 * Backed by an unbounded unicast sink: offers never block, and exactly one
 * subscriber (the request's stream) may consume it. Once closed the channel
 * refuses new messages and drops whatever is still queued.
 */
public class DeliveryChannel {

    private final String requestId;
    private final Sinks.Many<OutboundMessage> sink = Sinks.many().unicast().onBackpressureBuffer();
    private volatile boolean open = true;

    public DeliveryChannel(String requestId) {
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }

    public boolean isOpen() {
        return open;
    }

    /**
     * Enqueues a message without blocking.
     *
     * @return {@code false} if the channel is closed or its stream has already
     *         finished
     */
    public synchronized boolean offer(OutboundMessage message) {
        if (!open) {
            return false;
        }
        return sink.tryEmitNext(message).isSuccess();
    }

    /**
     * Messages in enqueue order. Completes when the channel is closed, without
     * replaying anything still queued at that point.
     */
    public Flux<OutboundMessage> messages() {
        return sink.asFlux().takeWhile(message -> open);
    }

    /**
     * Closes the channel. Idempotent.
     */
    public synchronized void close() {
        if (!open) {
            return;
        }
        open = false;
        sink.tryEmitComplete();
    }
}
