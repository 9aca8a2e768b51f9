package me.golemcore.agent.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Static credentials attached to HTTP-based MCP transports.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class McpAuthConfig {

    private String bearerToken;

    @Builder.Default
    private String headerName = "Authorization";

    public boolean isConfigured() {
        return bearerToken != null && !bearerToken.isBlank();
    }

    public String headerValue() {
        return "Authorization".equalsIgnoreCase(headerName) ? "Bearer " + bearerToken : bearerToken;
    }
}
