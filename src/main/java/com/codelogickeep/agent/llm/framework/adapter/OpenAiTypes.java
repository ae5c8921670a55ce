package com.codelogickeep.agent.llm.framework.adapter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * OpenAI Chat Completions API 的请求/响应结构，仅供 {@link OpenAiProvider} 使用
 */
final class OpenAiTypes {

    private OpenAiTypes() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OpenAiMessage(String role, String content) {
    }

    record ChatCompletionRequest(
            String model,
            List<OpenAiMessage> messages,
            double temperature,
            @JsonProperty("max_tokens") int maxTokens
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatCompletionResponse(
            String id,
            String object,
            Long created,
            String model,
            List<Choice> choices
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(
            Integer index,
            OpenAiMessage message,
            @JsonProperty("finish_reason") String finishReason
    ) {
    }
}
