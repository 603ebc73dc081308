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

package me.golemcore.gateway.port.outbound;

import me.golemcore.gateway.domain.model.InboundMessage;
import me.golemcore.gateway.domain.model.OutboundMessage;

/**
 * Port for the internal publish/subscribe bus connecting channels with the
 * agent backend.
 */
public interface MessageBusPort {

    /**
     * Publishes a message received by a channel. Fire-and-forget, but may fail
     * synchronously with a {@link RuntimeException} when no consumer can take it.
     */
    void publishInbound(InboundMessage message);

    /**
     * Publishes a message produced by the agent backend. Every running channel
     * is offered the message.
     */
    void publishOutbound(OutboundMessage message);
}
