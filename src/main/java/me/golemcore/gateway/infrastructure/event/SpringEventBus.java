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

package me.golemcore.gateway.infrastructure.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.InboundMessage;
import me.golemcore.gateway.domain.model.InboundMessageEvent;
import me.golemcore.gateway.domain.model.OutboundMessage;
import me.golemcore.gateway.domain.model.OutboundMessageEvent;
import me.golemcore.gateway.port.outbound.MessageBusPort;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Message bus implementation using Spring's ApplicationEventPublisher.
 *
 * <p>
 * Events are delivered synchronously to all registered Spring
 * {@code @EventListener} methods, so an exception thrown by a listener reaches
 * the publisher. The agent backend subscribes with:
 *
 * <pre>{@code
 * &#64;EventListener
 * public void onInbound(InboundMessageEvent event) { ... }
 * }</pre>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEventBus implements MessageBusPort {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void publishInbound(InboundMessage message) {
        log.debug("[Bus] Publishing inbound (channel={}, chatId={})", message.getChannel(), message.getChatId());
        eventPublisher.publishEvent(new InboundMessageEvent(message));
    }

    @Override
    public void publishOutbound(OutboundMessage message) {
        log.debug("[Bus] Publishing outbound (channel={}, chatId={})", message.getChannel(), message.getChatId());
        eventPublisher.publishEvent(new OutboundMessageEvent(message));
    }
}
