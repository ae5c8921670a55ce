package com.codelogickeep.agent.llm.framework.adapter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Anthropic Messages API 的请求/响应结构，仅供 {@link AnthropicProvider} 使用
 */
final class AnthropicTypes {

    private AnthropicTypes() {
    }

    record AnthropicMessage(String role, String content) {
    }

    /**
     * system 为 null 时不序列化该字段
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record MessagesRequest(
            String model,
            List<AnthropicMessage> messages,
            String system,
            double temperature,
            @JsonProperty("max_tokens") int maxTokens
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessagesResponse(
            String id,
            String type,
            String role,
            List<ContentBlock> content,
            String model,
            @JsonProperty("stop_reason") String stopReason
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ContentBlock(String type, String text) {
    }
}
