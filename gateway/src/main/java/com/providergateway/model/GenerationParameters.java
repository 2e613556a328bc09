package com.providergateway.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class GenerationParameters {

    public static final GenerationParameters DEFAULTS = GenerationParameters.builder().build();

    Double temperature;
    Integer maxTokens;
    Double topP;
    Double frequencyPenalty;
    Double presencePenalty;
    List<String> stop;
    String user;

    public static GenerationParameters from(ChatModels.ChatRequest request) {
        return GenerationParameters.builder()
                .temperature(request.getTemperature())
                .maxTokens(request.getMaxTokens())
                .topP(request.getTopP())
                .frequencyPenalty(request.getFrequencyPenalty())
                .presencePenalty(request.getPresencePenalty())
                .stop(request.getStop())
                .user(request.getUser())
                .build();
    }

    /**
     * OpenAI-style request fields for the parameters that are set.
     */
    public Map<String, Object> toOpenAiFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (temperature != null) {
            fields.put("temperature", temperature);
        }
        if (maxTokens != null) {
            fields.put("max_tokens", maxTokens);
        }
        if (topP != null) {
            fields.put("top_p", topP);
        }
        if (frequencyPenalty != null) {
            fields.put("frequency_penalty", frequencyPenalty);
        }
        if (presencePenalty != null) {
            fields.put("presence_penalty", presencePenalty);
        }
        if (stop != null && !stop.isEmpty()) {
            fields.put("stop", stop);
        }
        if (user != null) {
            fields.put("user", user);
        }
        return fields;
    }
}
