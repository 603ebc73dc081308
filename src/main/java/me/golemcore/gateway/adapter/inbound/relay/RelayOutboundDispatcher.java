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
import me.golemcore.gateway.domain.model.OutboundMessage;

import java.util.Optional;

/**
 * Routes outbound messages to the relay request they answer.
 *
 * <p>
 * Every outbound message on the bus passes through here. Messages without a
 * resolvable correlation id belong to other channels, and messages whose
 * request already finished arrive too late; both are dropped without error.
 */
@Slf4j
public class RelayOutboundDispatcher {

    private final CorrelationRegistry registry;

    public RelayOutboundDispatcher(CorrelationRegistry registry) {
        this.registry = registry;
    }

    /**
     * @return {@code true} if the message was queued for a pending request
     */
    public boolean deliver(OutboundMessage message) {
        Optional<String> requestId = RelayMetadata.resolveRequestId(message.getMetadata());
        if (requestId.isEmpty()) {
            return false;
        }

        Optional<DeliveryChannel> channel = registry.lookup(requestId.get());
        if (channel.isEmpty()) {
            log.debug("[HttpRelay] No pending HTTP relay request for request_id={}", requestId.get());
            return false;
        }

        boolean queued = channel.get().offer(message);
        if (!queued) {
            log.debug("[HttpRelay] Request {} already finished, message dropped", requestId.get());
        }
        return queued;
    }
}
