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

/**
 * One event of a relay stream. {@code origin} is for logging only and never
 * reaches the caller.
 */
public record RelayEvent(RelayEventType type, String content, Origin origin) {

    public enum Origin {
        MESSAGE, TIMEOUT, SHUTDOWN, FAILURE
    }

    public static RelayEvent of(OutboundMessage message) {
        RelayEventType type = RelayMetadata.isProgress(message.getMetadata())
                ? RelayEventType.PROGRESS
                : RelayEventType.RESPONSE;
        return new RelayEvent(type, message.getContent(), Origin.MESSAGE);
    }

    public static RelayEvent notice(String content, Origin origin) {
        return new RelayEvent(RelayEventType.RESPONSE, content, origin);
    }

    public boolean isTerminal() {
        return type == RelayEventType.RESPONSE;
    }
}
