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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Metadata conventions shared by the relay and the agent backend.
 *
 * <p>
 * A correlation id may travel under two namespaces:
 * <ol>
 * <li>{@code progress.request_id} - set by the backend's progress
 * tracking</li>
 * <li>{@code http_relay.request_id} - set by the relay on the inbound
 * message</li>
 * </ol>
 * Resolution checks them in that order and the first non-empty string wins,
 * even if the other namespace names a different id.
 */
public final class RelayMetadata {

    public static final String PROGRESS_NAMESPACE = "progress";
    public static final String RELAY_NAMESPACE = "http_relay";
    public static final String REQUEST_ID = "request_id";
    public static final String IS_PROGRESS = "is_progress";

    private RelayMetadata() {
    }

    /**
     * Mints a fresh correlation id: 128 random bits as 32 lowercase hex chars.
     */
    public static String newRequestId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static Optional<String> resolveRequestId(Map<String, Object> metadata) {
        Optional<String> fromProgress = requestIdIn(namespace(metadata, PROGRESS_NAMESPACE));
        if (fromProgress.isPresent()) {
            return fromProgress;
        }
        return requestIdIn(namespace(metadata, RELAY_NAMESPACE));
    }

    /**
     * Whether {@code progress.is_progress} announces more messages for the same
     * request. Only {@code true}, {@code "true"} or a non-zero number count;
     * other strings such as {@code "false"} or {@code "yes"}, and collections,
     * are not progress even when non-empty.
     */
    public static boolean isProgress(Map<String, Object> metadata) {
        Map<?, ?> progress = namespace(metadata, PROGRESS_NAMESPACE);
        if (progress == null) {
            return false;
        }
        Object flag = progress.get(IS_PROGRESS);
        if (flag instanceof Boolean bool) {
            return bool;
        }
        if (flag instanceof String text) {
            return Boolean.parseBoolean(text.trim());
        }
        if (flag instanceof Number number) {
            return number.doubleValue() != 0;
        }
        return false;
    }

    /**
     * Copies the caller's metadata and adds {@code http_relay.request_id}. Other
     * keys of an existing {@code http_relay} object are kept.
     */
    public static Map<String, Object> withRelayRequestId(Map<String, Object> callerMetadata, String requestId) {
        Map<String, Object> merged = callerMetadata != null
                ? new LinkedHashMap<>(callerMetadata)
                : new LinkedHashMap<>();
        Map<String, Object> relay = new LinkedHashMap<>();
        if (merged.get(RELAY_NAMESPACE) instanceof Map<?, ?> existing) {
            existing.forEach((key, value) -> relay.put(String.valueOf(key), value));
        }
        relay.put(REQUEST_ID, requestId);
        merged.put(RELAY_NAMESPACE, relay);
        return merged;
    }

    private static Map<?, ?> namespace(Map<String, Object> metadata, String name) {
        if (metadata == null) {
            return null;
        }
        return metadata.get(name) instanceof Map<?, ?> map ? map : null;
    }

    private static Optional<String> requestIdIn(Map<?, ?> namespace) {
        if (namespace == null) {
            return Optional.empty();
        }
        Object value = namespace.get(REQUEST_ID);
        if (value instanceof String id && !id.isEmpty()) {
            return Optional.of(id);
        }
        return Optional.empty();
    }
}
