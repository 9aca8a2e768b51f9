package me.golemcore.agent.infrastructure.config;

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
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.service.ToolRegistry;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

/**
 * Core beans and startup hooks of the agent runtime.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AgentConfiguration {

    private final AgentProperties properties;
    private final ToolRegistry toolRegistry;

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        AgentProperties.ToolsProperties tools = properties.getTools();
        log.info("GolemCore Agent starting...");
        log.info("Workspace: {}", tools.resolveWorkspace());
        log.info("Allow list: {}, block list: {}",
                tools.getCoreTools() != null ? tools.getCoreTools() : "(unrestricted)", tools.getExcludeTools());
        log.info("MCP enabled: {}, configured servers: {}", properties.getMcp().isEnabled(),
                properties.getMcp().getServers().keySet());
        log.info("Max turns: {}", properties.getTurn().getMaxTurns());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void discoverToolsOnStartup() {
        toolRegistry.discoverTools();
    }
}
