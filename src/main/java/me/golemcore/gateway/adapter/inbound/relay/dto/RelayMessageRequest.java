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

package me.golemcore.gateway.adapter.inbound.relay.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Validated body of {@code POST /message}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelayMessageRequest {

    /** {@code senderId} or {@code sender_id}. Required. */
    private String senderId;

    /** {@code chatId} or {@code chat_id}. Required. */
    private String chatId;

    /** Message text. Required, may be empty. */
    private String content;

    /** Caller metadata passed through to the inbound message. */
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
