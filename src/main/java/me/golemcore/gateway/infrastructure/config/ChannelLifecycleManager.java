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

package me.golemcore.gateway.infrastructure.config;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.inbound.relay.HttpRelayChannelAdapter;
import me.golemcore.gateway.port.inbound.ChannelPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Starts and stops the gateway's channels together with the Spring context.
 *
 * <p>
 * Channels are discovered via dependency injection and started on context
 * initialization if their {@code gateway.channels.<type>.enabled} property is
 * true. On context shutdown every running channel is stopped, after which
 * {@link #awaitShutdown()} returns and the main thread may exit.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ChannelLifecycleManager {

    private final GatewayProperties properties;
    private final List<ChannelPort> channelPorts;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public ChannelLifecycleManager(GatewayProperties properties, List<ChannelPort> channelPorts) {
        this.properties = properties;
        this.channelPorts = channelPorts;
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Gateway starting with {} channel(s)...", channelPorts.size());
        for (ChannelPort channel : channelPorts) {
            String channelType = channel.getChannelType();
            if (!isChannelEnabled(channelType)) {
                log.info("[Channels] {} disabled, not starting", channelType);
                continue;
            }
            try {
                log.info("[Channels] Starting channel: {}", channelType);
                channel.start();
            } catch (RuntimeException e) { // NOSONAR - one broken channel must not block the others
                log.error("[Channels] Failed to start channel {}", channelType, e);
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        try {
            for (ChannelPort channel : channelPorts) {
                if (!channel.isRunning()) {
                    continue;
                }
                try {
                    log.info("[Channels] Stopping channel: {}", channel.getChannelType());
                    channel.stop();
                } catch (RuntimeException e) { // NOSONAR
                    log.error("[Channels] Failed to stop channel {}", channel.getChannelType(), e);
                }
            }
        } finally {
            shutdownLatch.countDown();
        }
    }

    /**
     * Blocks until {@link #shutdown()} has completed.
     */
    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    boolean isChannelEnabled(String channelType) {
        if (HttpRelayChannelAdapter.CHANNEL_TYPE.equals(channelType)) {
            return properties.getChannels().getHttpRelay().isEnabled();
        }
        return false;
    }
}
