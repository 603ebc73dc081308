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

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps correlation ids of in-flight relay requests to their delivery channels.
 *
 * <p>
 * Shared between every request handler and the outbound dispatcher. All
 * operations are O(1) map operations on a {@link ConcurrentHashMap} and never
 * block on I/O.
 */
@Slf4j
public class CorrelationRegistry {

    private final Map<String, DeliveryChannel> pending = new ConcurrentHashMap<>();

    /**
     * Creates and registers a fresh delivery channel.
     *
     * @throws DuplicateCorrelationIdException
     *             if {@code requestId} is already registered; the existing entry
     *             is left untouched
     */
    public DeliveryChannel register(String requestId) {
        DeliveryChannel channel = new DeliveryChannel(requestId);
        DeliveryChannel existing = pending.putIfAbsent(requestId, channel);
        if (existing != null) {
            throw new DuplicateCorrelationIdException(requestId);
        }
        return channel;
    }

    public Optional<DeliveryChannel> lookup(String requestId) {
        return Optional.ofNullable(pending.get(requestId));
    }

    /**
     * Removes and closes the entry. No-op if absent.
     */
    public void remove(String requestId) {
        DeliveryChannel channel = pending.remove(requestId);
        if (channel != null) {
            channel.close();
        }
    }

    public int size() {
        return pending.size();
    }

    /**
     * Closes every channel, discarding queued messages, and empties the registry.
     *
     * @return number of entries that were still pending
     */
    public int drainAll() {
        int drained = 0;
        Iterator<DeliveryChannel> iterator = pending.values().iterator();
        while (iterator.hasNext()) {
            DeliveryChannel channel = iterator.next();
            iterator.remove();
            channel.close();
            drained++;
        }
        log.debug("[HttpRelay] Drained {} pending request(s)", drained);
        return drained;
    }
}
