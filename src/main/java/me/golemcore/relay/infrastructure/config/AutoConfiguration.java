package me.golemcore.relay.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.loop.GatewayEventPump;
import me.golemcore.relay.domain.service.PermissionPolicyService;
import me.golemcore.relay.port.inbound.GatewayPort;
import me.golemcore.relay.port.outbound.CompletionPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.time.Clock;

/**
 * Spring configuration that wires shared beans and starts the relay once the
 * context is ready.
 *
 * <p>
 * On startup this logs the completion provider, storage location and gateway
 * addresses, opens the gateway connection and starts the event pump.
 *
 * @since 1.0
 */
@Configuration
@Slf4j
public class AutoConfiguration {

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public RelayStarter relayStarter(BotProperties properties, GatewayPort gateway, GatewayEventPump pump,
            CompletionPort completionPort, PermissionPolicyService policyService,
            ObjectProvider<BuildProperties> buildPropertiesProvider) {
        return new RelayStarter(properties, gateway, pump, completionPort, policyService, buildPropertiesProvider);
    }

    /**
     * Starts the gateway connection after every bean is initialized.
     */
    public static class RelayStarter {

        private final BotProperties properties;
        private final GatewayPort gateway;
        private final GatewayEventPump pump;
        private final CompletionPort completionPort;
        private final PermissionPolicyService policyService;
        private final ObjectProvider<BuildProperties> buildPropertiesProvider;

        RelayStarter(BotProperties properties, GatewayPort gateway, GatewayEventPump pump,
                CompletionPort completionPort, PermissionPolicyService policyService,
                ObjectProvider<BuildProperties> buildPropertiesProvider) {
            this.properties = properties;
            this.gateway = gateway;
            this.pump = pump;
            this.completionPort = completionPort;
            this.policyService = policyService;
            this.buildPropertiesProvider = buildPropertiesProvider;
        }

        @EventListener(ApplicationReadyEvent.class)
        public void start() {
            BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
            String version = buildProps != null ? buildProps.getVersion() : "dev";
            log.info("GolemCore Relay v{} starting...", version);
            log.info("Completion Provider: {} (model {}, available={})", completionPort.getProviderId(),
                    properties.getCompletion().getModel(), completionPort.isAvailable());
            log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
            log.info("Gateway: events {} / commands {}", properties.getGateway().getWebsocketUrl(),
                    properties.getGateway().getHttpUrl());
            log.info("Permission policy: default={}, private={}, {} admin(s), {} override(s)",
                    policyService.current().getDefaultTier(), policyService.current().getPrivateTier(),
                    policyService.current().getAdminIds().size(), policyService.current().getOverrides().size());

            gateway.start();
            pump.start();
            log.info("GolemCore Relay started successfully");
        }
    }
}
