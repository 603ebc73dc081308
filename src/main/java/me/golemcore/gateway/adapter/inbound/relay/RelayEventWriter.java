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
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.gateway.adapter.inbound.relay.dto.RelayEventPayload;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.ReactiveHttpOutputMessage;
import org.springframework.web.reactive.function.BodyInserter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Serializes relay events in the event-stream format:
 *
 * <pre>
 * event: progress
 * data: {"content":"thinking..."}
 *
 * </pre>
 *
 * Every event is flushed on its own so progress reaches the caller without
 * waiting for the next one.
 */
public class RelayEventWriter {

    private final ObjectMapper objectMapper;

    public RelayEventWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(RelayEvent event) {
        try {
            String data = objectMapper.writeValueAsString(new RelayEventPayload(event.content()));
            return "event: " + event.type().getWireName() + "\n"
                    + "data: " + data + "\n\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize relay event", e);
        }
    }

    public BodyInserter<Flux<RelayEvent>, ReactiveHttpOutputMessage> inserter(Flux<RelayEvent> events) {
        return (message, context) -> message.writeAndFlushWith(
                events.map(event -> Mono.just(toBuffer(message.bufferFactory(), event))));
    }

    private DataBuffer toBuffer(DataBufferFactory bufferFactory, RelayEvent event) {
        return bufferFactory.wrap(encode(event).getBytes(StandardCharsets.UTF_8));
    }
}
