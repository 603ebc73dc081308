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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.adapter.inbound.relay.dto.RelayMessageRequest;

import java.util.HashMap;
import java.util.Map;

/**
 * Parses and validates the body of a relay request.
 *
 * <p>
 * Identifiers accept a camelCase and a snake_case key; the camelCase one wins
 * when both carry a value. Empty strings, {@code 0}, {@code false} and empty
 * containers count as absent for identifiers. {@code content} is only absent
 * when missing or {@code null}, so an empty message is valid.
 */
public class RelayRequestReader {

    static final String INVALID_JSON = "Invalid JSON body";
    static final String NOT_AN_OBJECT = "Payload must be an object";
    static final String MISSING_FIELDS = "Missing sender_id/chat_id/content";

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public RelayRequestReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RelayMessageRequest read(String body) {
        JsonNode root = parse(body);
        if (root == null || !root.isObject()) {
            throw new RelayRequestException(NOT_AN_OBJECT);
        }

        String senderId = identifier(root, "senderId", "sender_id");
        String chatId = identifier(root, "chatId", "chat_id");
        JsonNode contentNode = root.get("content");

        if (senderId == null || chatId == null || contentNode == null || contentNode.isNull()) {
            throw new RelayRequestException(MISSING_FIELDS);
        }

        return RelayMessageRequest.builder()
                .senderId(senderId)
                .chatId(chatId)
                .content(render(contentNode))
                .metadata(metadata(root.get("metadata")))
                .build();
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            throw new RelayRequestException(INVALID_JSON);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RelayRequestException(INVALID_JSON, e);
        }
    }

    private String identifier(JsonNode root, String... keys) {
        for (String key : keys) {
            JsonNode node = root.get(key);
            if (isPresent(node)) {
                return render(node);
            }
        }
        return null;
    }

    private boolean isPresent(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return false;
        }
        if (node.isTextual()) {
            return !node.asText().isEmpty();
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        if (node.isNumber()) {
            return node.asDouble() != 0;
        }
        return node.size() > 0;
    }

    private String render(JsonNode node) {
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private Map<String, Object> metadata(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new HashMap<>();
        }
        return objectMapper.convertValue(node, METADATA_TYPE);
    }
}
