package com.codelogickeep.agent.llm.framework.adapter;

import com.codelogickeep.agent.llm.exception.ProviderException;
import com.codelogickeep.agent.llm.framework.adapter.OpenAiTypes.ChatCompletionRequest;
import com.codelogickeep.agent.llm.framework.adapter.OpenAiTypes.ChatCompletionResponse;
import com.codelogickeep.agent.llm.framework.adapter.OpenAiTypes.Choice;
import com.codelogickeep.agent.llm.framework.adapter.OpenAiTypes.OpenAiMessage;
import com.codelogickeep.agent.llm.framework.model.Message;
import com.codelogickeep.agent.llm.framework.model.Role;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * OpenAI 兼容适配器 - 支持 OpenAI API 及兼容的 Chat Completions 服务
 *
 * 默认 system 消息原位发送（INLINE）；EXTRACT 模式下合并为开头的一条 system 消息。
 */
public class OpenAiProvider extends AbstractHttpProvider<ChatCompletionRequest, ChatCompletionResponse> {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    private final URI endpoint;

    private OpenAiProvider(Builder builder) {
        super(builder, ChatCompletionResponse.class, SystemMessageMode.INLINE);
        this.endpoint = URI.create(normalizeBaseUrl(builder.baseUrl) + "/chat/completions");
    }

    /**
     * 规范化 base URL
     */
    static String normalizeBaseUrl(String url) {
        if (url == null || url.isBlank()) {
            return DEFAULT_BASE_URL;
        }
        // 移除末尾斜杠
        url = url.trim().replaceAll("/+$", "");
        // 如果没有 /v1 路径，添加它
        if (!url.endsWith("/v1")) {
            url = url + "/v1";
        }
        return url;
    }

    @Override
    public String getName() {
        return "OpenAI";
    }

    @Override
    protected ChatCompletionRequest buildRequest(List<Message> messages) {
        List<OpenAiMessage> converted = new ArrayList<>();

        if (systemMessageMode == SystemMessageMode.EXTRACT) {
            ConversationParts parts = ConversationParts.split(messages);
            if (parts.hasSystem()) {
                converted.add(new OpenAiMessage(Role.SYSTEM.wireName(), parts.system()));
            }
            parts.turns().forEach(m -> converted.add(toOpenAi(m)));
        } else {
            messages.forEach(m -> converted.add(toOpenAi(m)));
        }

        return new ChatCompletionRequest(model, converted, temperature, maxTokens);
    }

    private static OpenAiMessage toOpenAi(Message message) {
        return new OpenAiMessage(message.role().wireName(), message.content());
    }

    @Override
    protected String extractText(ChatCompletionResponse response) {
        List<Choice> choices = response.choices();
        if (choices == null) {
            throw ProviderException.deserializationFailure(getName(), null,
                    new IllegalStateException("missing 'choices' array"));
        }
        if (choices.isEmpty()) {
            throw ProviderException.emptyResponse(getName(), "choices");
        }
        OpenAiMessage message = choices.get(0).message();
        if (message == null || message.content() == null) {
            throw ProviderException.emptyResponse(getName(), "message content in the first choice");
        }
        return message.content();
    }

    @Override
    protected URI endpoint() {
        return endpoint;
    }

    @Override
    protected Map<String, String> providerHeaders() {
        return Map.of("Authorization", "Bearer " + apiKey);
    }

    // ==================== Builder ====================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder extends AbstractHttpProvider.Builder<OpenAiProvider, Builder> {

        private Builder() {
            super("gpt-4o");
        }

        @Override
        public OpenAiProvider build() {
            validate();
            return new OpenAiProvider(this);
        }
    }
}
