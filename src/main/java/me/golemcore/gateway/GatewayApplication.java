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

package me.golemcore.gateway;

import me.golemcore.gateway.infrastructure.config.ChannelLifecycleManager;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Main application class for the GolemCore Gateway.
 *
 * <p>
 * The gateway accepts messages from front-end channels, hands them to the agent
 * backend over an in-process message bus and routes the agent's replies back to
 * the channel that asked.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → HttpRelayChannelAdapter (POST /message, SSE replies)
 * Domain Layer       → InboundMessage / OutboundMessage, OutboundMessageListener
 * Infrastructure     → SpringEventBus, ChannelLifecycleManager, GatewayProperties
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code gateway.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GatewayApplication {

    public static void main(String[] args) throws InterruptedException {
        ConfigurableApplicationContext context = SpringApplication.run(GatewayApplication.class, args);
        context.getBean(ChannelLifecycleManager.class).awaitShutdown();
    }

}
