package me.golemcore.exterm.adapter.outbound.llm;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.exterm.domain.exception.LlmException;
import me.golemcore.exterm.domain.exception.LlmProviderException;
import me.golemcore.exterm.domain.exception.LlmTransportException;
import me.golemcore.exterm.domain.model.LlmRequest;
import me.golemcore.exterm.domain.model.Message;
import me.golemcore.exterm.domain.model.StreamDelta;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import me.golemcore.exterm.infrastructure.http.FeignClientFactory;
import me.golemcore.exterm.port.outbound.LlmPort;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter for OpenAI-compatible chat completion APIs (OpenRouter, Groq,
 * DeepInfra).
 *
 * <p>
 * Streaming goes over the shared OkHttp client and is decoded by
 * {@link SseStreamDecoder}; cancelling the returned flux cancels the HTTP call.
 * Non-streaming completions, used for summaries, go through Feign.
 *
 * <p>
 * Configuration: {@code exterm.llm.provider} selects an entry of
 * {@code exterm.llm.providers}.
 */
@Component
@Slf4j
public class OpenAiCompatibleLlmAdapter implements LlmPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String COMPLETIONS_PATH = "/chat/completions";
    private static final int MAX_ERROR_BODY = 2000;

    private final ExtermProperties properties;
    private final OkHttpClient okHttpClient;
    private final FeignClientFactory feignClientFactory;
    private final ObjectMapper objectMapper;

    private volatile ChatCompletionApi completionApi;

    public OpenAiCompatibleLlmAdapter(ExtermProperties properties, OkHttpClient okHttpClient,
            FeignClientFactory feignClientFactory, ObjectMapper objectMapper) {
        this.properties = properties;
        this.okHttpClient = okHttpClient;
        this.feignClientFactory = feignClientFactory;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getProviderId() {
        return properties.getLlm().getProvider();
    }

    @Override
    public String getCurrentModel() {
        String model = properties.getLlm().getModel();
        if (model != null && !model.isBlank()) {
            return model;
        }
        ExtermProperties.ProviderProperties provider = properties.getLlm().getProviders().get(getProviderId());
        return provider != null ? provider.getDefaultModel() : null;
    }

    @Override
    public boolean isAvailable() {
        ExtermProperties.ProviderProperties provider = properties.getLlm().getProviders().get(getProviderId());
        return provider != null
                && provider.getApiUrl() != null && !provider.getApiUrl().isBlank()
                && provider.getApiKey() != null && !provider.getApiKey().isBlank();
    }

    @Override
    public Flux<StreamDelta> chatStream(LlmRequest request) {
        return Flux.defer(() -> {
            ExtermProperties.ProviderProperties provider = requireProvider();
            String body;
            try {
                body = objectMapper.writeValueAsString(buildRequest(request, true));
            } catch (JsonProcessingException e) {
                return Flux.error(new LlmException("Failed to encode request: " + e.getOriginalMessage()));
            }

            Request httpRequest = new Request.Builder()
                    .url(trimTrailingSlash(provider.getApiUrl()) + COMPLETIONS_PATH)
                    .header("Authorization", "Bearer " + provider.getApiKey())
                    .header("Accept", "text/event-stream")
                    .post(RequestBody.create(body, JSON))
                    .build();

            Duration timeout = properties.getLlm().getRequestTimeout();
            Call call = okHttpClient.newBuilder()
                    .callTimeout(timeout)
                    .build()
                    .newCall(httpRequest);

            log.debug("[LLM] Streaming {} via {} ({} messages)", request.getModel(), getProviderId(),
                    request.getMessages().size());
            return Flux.using(
                    () -> open(call),
                    response -> Flux.fromIterable(() -> new SseStreamDecoder(reader(response), objectMapper)),
                    Response::close)
                    .doOnCancel(call::cancel);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public CompletableFuture<String> complete(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ExtermProperties.ProviderProperties provider = requireProvider();
            try {
                ChatCompletionResponse response = api(provider)
                        .chatCompletion(provider.getApiKey(), buildRequest(request, false));
                if (response == null || response.getChoices() == null || response.getChoices().isEmpty()
                        || response.getChoices().get(0).getMessage() == null) {
                    throw new LlmException("Provider returned no choices");
                }
                String content = response.getChoices().get(0).getMessage().getContent();
                return content != null ? content : "";
            } catch (FeignException e) {
                if (e.status() > 0) {
                    throw new LlmProviderException(e.status(), e.contentUTF8());
                }
                throw new LlmTransportException("Completion request failed: " + e.getMessage(), e);
            }
        });
    }

    private Response open(Call call) {
        Response response;
        try {
            response = call.execute();
        } catch (IOException e) {
            throw new LlmTransportException("Connection to " + getProviderId() + " failed: " + e.getMessage(), e);
        }
        if (!response.isSuccessful()) {
            String errorBody = readErrorBody(response);
            int status = response.code();
            response.close();
            log.warn("[LLM] {} returned HTTP {}", getProviderId(), status);
            throw new LlmProviderException(status, errorBody);
        }
        return response;
    }

    private static BufferedReader reader(Response response) {
        ResponseBody body = response.body();
        if (body == null) {
            throw new LlmTransportException("Empty response body", null);
        }
        return new BufferedReader(new InputStreamReader(body.byteStream(), StandardCharsets.UTF_8));
    }

    private static String readErrorBody(Response response) {
        try (ResponseBody body = response.body()) {
            if (body == null) {
                return "";
            }
            String text = body.string();
            return text.length() > MAX_ERROR_BODY ? text.substring(0, MAX_ERROR_BODY) : text;
        } catch (IOException e) {
            return "";
        }
    }

    private ExtermProperties.ProviderProperties requireProvider() {
        ExtermProperties.ProviderProperties provider = properties.getLlm().getProviders().get(getProviderId());
        if (provider == null || provider.getApiUrl() == null || provider.getApiUrl().isBlank()) {
            throw new LlmException("LLM provider not configured: " + getProviderId());
        }
        return provider;
    }

    private ChatCompletionApi api(ExtermProperties.ProviderProperties provider) {
        ChatCompletionApi api = completionApi;
        if (api == null) {
            synchronized (this) {
                api = completionApi;
                if (api == null) {
                    api = feignClientFactory.create(ChatCompletionApi.class,
                            trimTrailingSlash(provider.getApiUrl()), properties.getLlm().getRequestTimeout());
                    completionApi = api;
                }
            }
        }
        return api;
    }

    ChatCompletionRequest buildRequest(LlmRequest request, boolean stream) {
        ChatCompletionRequest apiRequest = new ChatCompletionRequest();
        apiRequest.setModel(request.getModel() != null ? request.getModel() : getCurrentModel());
        apiRequest.setTemperature(request.getTemperature());
        apiRequest.setMaxTokens(request.getMaxTokens());
        apiRequest.setStream(stream ? Boolean.TRUE : null);

        apiRequest.setMessages(request.getMessages().stream()
                .map(OpenAiCompatibleLlmAdapter::toApiMessage)
                .toList());

        if (request.hasTools()) {
            apiRequest.setTools(request.getTools().stream()
                    .map(tool -> {
                        ApiTool apiTool = new ApiTool();
                        apiTool.setType("function");
                        ApiToolFunction func = new ApiToolFunction();
                        func.setName(tool.getName());
                        func.setDescription(tool.getDescription());
                        func.setParameters(tool.getInputSchema());
                        apiTool.setFunction(func);
                        return apiTool;
                    })
                    .toList());
        }
        return apiRequest;
    }

    private static ApiMessage toApiMessage(Message msg) {
        ApiMessage apiMsg = new ApiMessage();
        apiMsg.setRole(msg.getRole());
        apiMsg.setContent(msg.getContent());
        if (msg.hasToolCalls()) {
            apiMsg.setToolCalls(msg.getToolCalls().stream()
                    .map(tc -> {
                        ApiToolCall atc = new ApiToolCall();
                        atc.setId(tc.getId());
                        atc.setType("function");
                        ApiFunction func = new ApiFunction();
                        func.setName(tc.getName());
                        func.setArguments(tc.getArguments() == null || tc.getArguments().isBlank()
                                ? "{}"
                                : tc.getArguments());
                        atc.setFunction(func);
                        return atc;
                    })
                    .toList());
        }
        if (msg.getToolCallId() != null) {
            apiMsg.setToolCallId(msg.getToolCallId());
            apiMsg.setName(msg.getToolName());
        }
        return apiMsg;
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // Feign API interface
    public interface ChatCompletionApi {
        @RequestLine("POST /chat/completions")
        @Headers({
                "Content-Type: application/json",
                "Authorization: Bearer {apiKey}"
        })
        ChatCompletionResponse chatCompletion(@Param("apiKey") String apiKey, ChatCompletionRequest request);
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        private List<ApiTool> tools;
        private double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
        private Boolean stream;
    }

    @Data
    public static class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
    }

    @Data
    public static class ChatChoice {
        private int index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ApiMessage {
        private String role;
        private String content;
        private String name;
        @JsonProperty("tool_calls")
        private List<ApiToolCall> toolCalls;
        @JsonProperty("tool_call_id")
        private String toolCallId;
    }

    @Data
    public static class ApiTool {
        private String type;
        private ApiToolFunction function;
    }

    @Data
    public static class ApiToolFunction {
        private String name;
        private String description;
        private Map<String, Object> parameters;
    }

    @Data
    public static class ApiToolCall {
        private String id;
        private String type;
        private ApiFunction function;
    }

    @Data
    public static class ApiFunction {
        private String name;
        private String arguments;
    }
}
