package com.providergateway.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible wire types of the inbound client API.
 */
public class ChatModels {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatRequest {
        @NotBlank(message = "Model is required")
        private String model;

        @Valid
        @NotNull(message = "Messages cannot be null")
        @NotEmpty(message = "Messages cannot be empty")
        private List<Message> messages;

        private Double temperature;

        @JsonProperty("max_tokens")
        private Integer maxTokens;

        @Builder.Default
        private Boolean stream = false;

        @JsonProperty("top_p")
        private Double topP;

        @JsonProperty("frequency_penalty")
        private Double frequencyPenalty;

        @JsonProperty("presence_penalty")
        private Double presencePenalty;

        private List<String> stop;

        private String user;

        /**
         * Overall budget for this call; falls back to the configured default.
         */
        @JsonProperty("timeout_seconds")
        private Integer timeoutSeconds;

        /**
         * Fields the gateway does not model; kept so proxies can pass them through.
         */
        @JsonAnySetter
        @Getter(AccessLevel.NONE)
        @Setter(AccessLevel.NONE)
        @Builder.Default
        private Map<String, Object> additionalFields = new LinkedHashMap<>();

        @JsonAnyGetter
        public Map<String, Object> additionalFields() {
            return additionalFields;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Message {
        @NotBlank
        private String role;

        @NotNull
        private String content;

        private String name;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatResponse {
        private String id;
        private String object;
        private Long created;
        private String model;
        private List<Choice> choices;
        private Usage usage;

        // Gateway metadata
        private GatewayMetadata gateway;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Choice {
        private Integer index;
        private Message message;

        @JsonProperty("finish_reason")
        @JsonInclude(JsonInclude.Include.ALWAYS)
        private String finishReason;

        private Delta delta; // For streaming
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Delta {
        private String role;
        private String content;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Usage {
        @JsonProperty("prompt_tokens")
        private Integer promptTokens;

        @JsonProperty("completion_tokens")
        private Integer completionTokens;

        @JsonProperty("total_tokens")
        private Integer totalTokens;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class GatewayMetadata {
        private String provider;
        private String nativeModel;
        private Long latencyMs;
        private Boolean cached;
        private Integer retryCount;
        private String requestId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorResponse {
        private Error error;

        @Data
        @Builder
        @NoArgsConstructor
        @AllArgsConstructor
        @JsonInclude(JsonInclude.Include.NON_NULL)
        public static class Error {
            private String message;
            private String type;
            private String code;
            private String param;

            @JsonProperty("correlation_id")
            private String correlationId;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelList {
        @Builder.Default
        private String object = "list";
        private List<ModelInfo> data;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ModelInfo {
        private String id;
        @Builder.Default
        private String object = "model";
        private Long created;

        @JsonProperty("owned_by")
        private String ownedBy;

        @JsonProperty("max_tokens")
        private Integer maxTokens;

        @JsonProperty("context_window")
        private Integer contextWindow;
    }
}
