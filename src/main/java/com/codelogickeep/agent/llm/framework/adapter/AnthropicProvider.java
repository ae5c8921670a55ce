package com.codelogickeep.agent.llm.framework.adapter;

import com.codelogickeep.agent.llm.exception.ProviderException;
import com.codelogickeep.agent.llm.framework.adapter.AnthropicTypes.AnthropicMessage;
import com.codelogickeep.agent.llm.framework.adapter.AnthropicTypes.ContentBlock;
import com.codelogickeep.agent.llm.framework.adapter.AnthropicTypes.MessagesRequest;
import com.codelogickeep.agent.llm.framework.adapter.AnthropicTypes.MessagesResponse;
import com.codelogickeep.agent.llm.framework.model.Message;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Claude (Anthropic) 适配器
 *
 * Anthropic API 与 OpenAI 的关键区别：
 * - System 消息作为单独字段传递，不允许出现在 messages 数组中
 * - 鉴权使用 x-api-key 头，并要求 anthropic-version 头
 * - 响应文本位于 content[0].text
 */
public class AnthropicProvider extends AbstractHttpProvider<MessagesRequest, MessagesResponse> {

    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    public static final String API_VERSION = "2023-06-01";

    private final URI endpoint;

    private AnthropicProvider(Builder builder) {
        super(builder, MessagesResponse.class, SystemMessageMode.EXTRACT);
        this.endpoint = URI.create(normalizeBaseUrl(builder.baseUrl) + "/v1/messages");
    }

    /**
     * 规范化 base URL，去掉末尾斜杠和多余的 /v1
     */
    static String normalizeBaseUrl(String url) {
        if (url == null || url.isBlank()) {
            return DEFAULT_BASE_URL;
        }
        url = url.trim().replaceAll("/+$", "");
        if (url.endsWith("/v1")) {
            url = url.substring(0, url.length() - 3);
        }
        return url;
    }

    @Override
    public String getName() {
        return "Anthropic";
    }

    @Override
    protected MessagesRequest buildRequest(List<Message> messages) {
        ConversationParts parts = ConversationParts.split(messages);
        List<AnthropicMessage> turns = parts.turns().stream()
                .map(m -> new AnthropicMessage(m.role().wireName(), m.content()))
                .toList();
        return new MessagesRequest(model, turns, parts.system(), temperature, maxTokens);
    }

    @Override
    protected String extractText(MessagesResponse response) {
        List<ContentBlock> content = response.content();
        if (content == null) {
            throw ProviderException.deserializationFailure(getName(), null,
                    new IllegalStateException("missing 'content' array"));
        }
        if (content.isEmpty()) {
            throw ProviderException.emptyResponse(getName(), "content");
        }
        String text = content.get(0).text();
        if (text == null) {
            throw ProviderException.emptyResponse(getName(), "text in the first content block");
        }
        return text;
    }

    @Override
    protected URI endpoint() {
        return endpoint;
    }

    @Override
    protected Map<String, String> providerHeaders() {
        return Map.of(
                "x-api-key", apiKey,
                "anthropic-version", API_VERSION
        );
    }

    // ==================== Builder ====================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends AbstractHttpProvider.Builder<AnthropicProvider, Builder> {

        private Builder() {
            super("claude-3-5-sonnet-20241022");
        }

        @Override
        public AnthropicProvider build() {
            validate();
            if (systemMessageMode == SystemMessageMode.INLINE) {
                throw new IllegalArgumentException(
                        "Anthropic Messages API does not accept inline system turns; use EXTRACT");
            }
            return new AnthropicProvider(this);
        }
    }
}
