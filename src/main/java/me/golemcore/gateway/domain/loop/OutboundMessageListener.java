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

package me.golemcore.gateway.domain.loop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.OutboundMessage;
import me.golemcore.gateway.domain.model.OutboundMessageEvent;
import me.golemcore.gateway.port.inbound.ChannelPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Listens for outbound messages and offers each one to every running channel.
 *
 * <p>
 * Channels decide for themselves whether a message is theirs; the HTTP relay,
 * for instance, matches on the correlation id carried in the metadata.
 * </p>
 */
@Component
@Slf4j
public class OutboundMessageListener {

    private final List<ChannelPort> channelPorts;

    public OutboundMessageListener(List<ChannelPort> channelPorts) {
        this.channelPorts = channelPorts;
    }

    @EventListener
    public void onOutboundMessage(OutboundMessageEvent event) {
        OutboundMessage message = event.message();
        log.debug("[Outbound] dispatch message (channel={}, chatId={})", message.getChannel(), message.getChatId());
        for (ChannelPort channel : channelPorts) {
            if (!channel.isRunning()) {
                continue;
            }
            try {
                channel.send(message);
            } catch (RuntimeException e) { // NOSONAR - must not starve the remaining channels
                log.warn("[Outbound] Channel {} failed to accept message: {}", channel.getChannelType(),
                        e.getMessage());
            }
        }
    }
}
