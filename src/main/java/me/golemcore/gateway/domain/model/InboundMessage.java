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

package me.golemcore.gateway.domain.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Message received by a channel and published on the bus for the agent
 * backend. The metadata map travels with the message unchanged, so channels
 * use it to tag requests they expect answers for.
 */
@Data
@Builder
public class InboundMessage {

    private String channel;
    private String senderId;
    private String chatId;
    private String content;

    private List<String> media;
    private Map<String, Object> metadata;
    private Instant timestamp;

    /**
     * Checks if this message carries media attachments.
     */
    public boolean hasMedia() {
        return media != null && !media.isEmpty();
    }
}
