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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the gateway, bound from
 * application.properties.
 *
 * <p>
 * All gateway configuration is organized under the {@code gateway.*} prefix:
 * <ul>
 * <li>{@link ChannelsProperties} - front-end channels</li>
 * <li>{@link HttpRelayProperties} - the HTTP relay channel (listener, stream
 * timeout, notices written to the caller)</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayProperties {

    private ChannelsProperties channels = new ChannelsProperties();

    @Data
    public static class ChannelsProperties {
        private HttpRelayProperties httpRelay = new HttpRelayProperties();
    }

    @Data
    public static class HttpRelayProperties {
        private boolean enabled = true;
        private String host = "0.0.0.0";
        private int port = 18790;
        private String path = "/message";
        /** Idle window between two deliveries before the stream gives up. */
        private Duration responseTimeout = Duration.ofSeconds(900);
        private String failureNotice = "I could not process this message. Please retry.";
        private String timeoutNotice = "Upstream response timed out.";
        private String shutdownNotice = "Relay channel stopped.";
    }
}
