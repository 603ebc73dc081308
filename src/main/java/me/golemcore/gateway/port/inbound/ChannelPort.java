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

package me.golemcore.gateway.port.inbound;

import me.golemcore.gateway.domain.model.OutboundMessage;

/**
 * Bidirectional port for communication channels (HTTP relay, chat platforms,
 * email). Implementations publish what they receive on the message bus and
 * manage their own connection lifecycle.
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "http_relay").
     */
    String getChannelType();

    /**
     * Starts listening for incoming messages from the channel. Calling it on a
     * running channel has no effect.
     */
    void start();

    /**
     * Stops listening for messages and releases the channel's resources. Safe to
     * call on a channel that never started.
     */
    void stop();

    /**
     * Checks if the channel is currently active and listening.
     */
    boolean isRunning();

    /**
     * Offers an outbound message produced by the agent. Channels ignore messages
     * that do not belong to them.
     */
    void send(OutboundMessage message);
}
