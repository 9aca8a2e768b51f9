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

package me.golemcore.agent.tools;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.ConfirmationRequest;
import me.golemcore.agent.domain.model.ConfirmationType;
import me.golemcore.agent.domain.model.ToolConfirmationOutcome;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fetches a web page over HTTP(S) and returns its text. HTML is reduced to
 * plain text by {@link HtmlSanitizer}; the result is capped at
 * {@code agent.tools.web-fetch.max-content-chars}. Cancelling the token
 * cancels the in-flight call.
 */
@Component
@Slf4j
public class WebFetchTool implements ToolComponent {

    public static final String TOOL_NAME = "web_fetch";

    private final OkHttpClient okHttpClient;
    private final int maxContentChars;
    private final AtomicBoolean approveAll = new AtomicBoolean(false);

    public WebFetchTool(OkHttpClient okHttpClient, AgentProperties properties) {
        this.okHttpClient = okHttpClient;
        this.maxContentChars = properties.getTools().getWebFetch().getMaxContentChars();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Fetch a web page by URL and return its text content.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "url", Map.of(
                                        "type", "string",
                                        "description", "Absolute http or https URL")),
                        "required", List.of("url")))
                .build();
    }

    @Override
    public CompletableFuture<Optional<ConfirmationRequest>> shouldConfirmExecute(Map<String, Object> parameters) {
        Object url = parameters.get("url");
        if (approveAll.get() || url == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        ConfirmationRequest request = ConfirmationRequest.builder()
                .type(ConfirmationType.INFO)
                .title("Confirm Web Fetch")
                .target(url.toString())
                .prompt("Fetch content from " + url)
                .urls(List.of(url.toString()))
                .onConfirm(outcome -> {
                    if (outcome == ToolConfirmationOutcome.PROCEED_ALWAYS) {
                        approveAll.set(true);
                    }
                })
                .build();
        return CompletableFuture.completedFuture(Optional.of(request));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters,
            CancellationToken cancellationToken) {
        Object urlParam = parameters.get("url");
        HttpUrl url = urlParam != null ? HttpUrl.parse(urlParam.toString()) : null;
        if (url == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("Invalid URL: " + urlParam));
        }
        if (cancellationToken.isCancelled()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.CANCELLED, "Cancelled before execution"));
        }

        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", "golemcore-agent/1.0")
                .get()
                .build();
        Call call = okHttpClient.newCall(request);
        CompletableFuture<ToolResult> result = new CompletableFuture<>();
        Runnable unregister = cancellationToken.onCancel(call::cancel);
        result.whenComplete((r, e) -> unregister.run());

        log.info("[WebFetch] GET {}", url);
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failedCall, IOException e) {
                if (cancellationToken.isCancelled()) {
                    result.complete(ToolResult.failure(ToolFailureKind.CANCELLED, "Fetch cancelled"));
                } else {
                    log.warn("[WebFetch] Request to {} failed: {}", url, e.getMessage());
                    result.complete(ToolResult.failure("Request failed: " + e.getMessage()));
                }
            }

            @Override
            public void onResponse(Call successfulCall, Response response) {
                try (response) {
                    result.complete(toResult(url, response));
                } catch (IOException e) {
                    result.complete(ToolResult.failure("Failed to read response: " + e.getMessage()));
                }
            }
        });
        return result;
    }

    private ToolResult toResult(HttpUrl url, Response response) throws IOException {
        if (!response.isSuccessful()) {
            return ToolResult.failure("HTTP " + response.code() + " fetching " + url);
        }
        ResponseBody body = response.body();
        if (body == null) {
            return ToolResult.success("", "Fetched " + url + " (empty)");
        }
        MediaType mediaType = body.contentType();
        String raw = body.string();
        boolean html = mediaType != null && mediaType.subtype().toLowerCase(Locale.ROOT).contains("html");
        String text = html ? HtmlSanitizer.stripHtml(raw) : raw;

        if (text.length() > maxContentChars) {
            text = text.substring(0, maxContentChars) + "\n[Content truncated...]";
        }
        return ToolResult.success(text, "Fetched " + url + " (" + text.length() + " chars)");
    }
}
