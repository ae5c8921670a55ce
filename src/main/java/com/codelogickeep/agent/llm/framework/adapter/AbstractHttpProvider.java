package com.codelogickeep.agent.llm.framework.adapter;

import com.codelogickeep.agent.llm.exception.ProviderException;
import com.codelogickeep.agent.llm.framework.model.Message;
import com.codelogickeep.agent.llm.framework.transport.HttpTransport;
import com.codelogickeep.agent.llm.framework.util.JsonUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 基于 HTTP + JSON 的适配器骨架
 *
 * 流程：转换消息 → 序列化请求 → 一次 POST → 校验状态码 → 反序列化 → 取第一条文本。
 * 子类只提供各自的请求/响应结构和端点信息。
 *
 * @param <Q> 请求体类型
 * @param <R> 响应体类型
 */
public abstract class AbstractHttpProvider<Q, R> implements LlmProvider {
    private static final Logger log = LoggerFactory.getLogger(AbstractHttpProvider.class);

    private static final int MAX_LOGGED_BODY = 1000;

    protected final String apiKey;
    protected final String model;
    protected final double temperature;
    protected final int maxTokens;
    protected final SystemMessageMode systemMessageMode;
    private final Map<String, String> customHeaders;
    private final HttpTransport transport;
    private final Class<R> responseType;

    /**
     * @param defaultMode 构建器未指定 system 消息策略时使用
     */
    protected AbstractHttpProvider(Builder<?, ?> builder, Class<R> responseType, SystemMessageMode defaultMode) {
        this.apiKey = builder.apiKey;
        this.model = builder.model;
        this.temperature = builder.temperature;
        this.maxTokens = builder.maxTokens;
        this.systemMessageMode = builder.systemMessageMode != null
                ? builder.systemMessageMode
                : defaultMode;
        this.customHeaders = Map.copyOf(builder.customHeaders);
        this.transport = builder.transport != null
                ? builder.transport
                : HttpTransport.create(builder.timeout);
        this.responseType = responseType;
    }

    @Override
    public final String send(List<Message> messages) {
        Objects.requireNonNull(messages, "messages must not be null");

        Q request = buildRequest(messages);
        String requestBody = serialize(request);
        URI endpoint = endpoint();

        log.debug("Sending {} message(s) to {} at {} (model={}, systemMode={})",
                messages.size(), getName(), endpoint, model, systemMessageMode);

        HttpResponse<String> response = transport.post(getName(), endpoint, headers(), requestBody);

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.error("{} API error: {} - {}", getName(), status, abbreviate(response.body()));
            throw ProviderException.fromStatus(getName(), status, response.body());
        }

        R parsed = deserialize(response.body());
        return extractText(parsed);
    }

    /**
     * 将统一消息转换为后端请求结构
     */
    protected abstract Q buildRequest(List<Message> messages);

    /**
     * 从响应中取第一个候选的文本
     *
     * @throws ProviderException EMPTY_RESPONSE 或 DESERIALIZATION_FAILURE
     */
    protected abstract String extractText(R response);

    protected abstract URI endpoint();

    /**
     * 后端专属请求头（鉴权、版本）
     */
    protected abstract Map<String, String> providerHeaders();

    public SystemMessageMode getSystemMessageMode() {
        return systemMessageMode;
    }

    public String getModel() {
        return model;
    }

    /**
     * 请求头名不区分大小写，后写入的覆盖先写入的
     */
    private Map<String, String> headers() {
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.put("Content-Type", "application/json");
        headers.putAll(providerHeaders());
        headers.putAll(customHeaders);
        return headers;
    }

    private String serialize(Q request) {
        try {
            return JsonUtil.toJson(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to build " + getName() + " request", e);
        }
    }

    private R deserialize(String body) {
        R parsed;
        try {
            parsed = JsonUtil.fromJson(body, responseType);
        } catch (JsonProcessingException e) {
            log.error("{} returned an unparseable body: {}", getName(), abbreviate(body));
            throw ProviderException.deserializationFailure(getName(), body, e);
        }
        if (parsed == null) {
            throw ProviderException.deserializationFailure(getName(), body, null);
        }
        return parsed;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "(null)";
        }
        return body.length() > MAX_LOGGED_BODY ? body.substring(0, MAX_LOGGED_BODY) + "..." : body;
    }

    /**
     * 适配器公共构建器
     *
     * @param <P> 构建出的适配器类型
     * @param <B> 构建器自身类型
     */
    @SuppressWarnings("unchecked")
    public abstract static class Builder<P extends AbstractHttpProvider<?, ?>, B extends Builder<P, B>> {
        protected String baseUrl;
        protected String apiKey;
        protected String model;
        protected double temperature = 0.7;
        protected int maxTokens = 1024;
        protected Duration timeout = HttpTransport.DEFAULT_REQUEST_TIMEOUT;
        protected SystemMessageMode systemMessageMode;
        protected Map<String, String> customHeaders = Map.of();
        protected HttpTransport transport;

        protected Builder(String defaultModel) {
            this.model = defaultModel;
        }

        public B baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return (B) this;
        }

        public B apiKey(String apiKey) {
            this.apiKey = apiKey;
            return (B) this;
        }

        public B model(String model) {
            this.model = model;
            return (B) this;
        }

        public B temperature(double temperature) {
            this.temperature = temperature;
            return (B) this;
        }

        public B maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return (B) this;
        }

        public B timeout(Duration timeout) {
            this.timeout = timeout;
            return (B) this;
        }

        public B systemMessageMode(SystemMessageMode systemMessageMode) {
            this.systemMessageMode = systemMessageMode;
            return (B) this;
        }

        public B customHeaders(Map<String, String> customHeaders) {
            this.customHeaders = customHeaders != null ? customHeaders : Map.of();
            return (B) this;
        }

        /**
         * 共享传输层；未设置时按 timeout 新建
         */
        public B transport(HttpTransport transport) {
            this.transport = transport;
            return (B) this;
        }

        protected void validate() {
            if (apiKey == null || apiKey.isEmpty()) {
                throw new IllegalArgumentException("API key is required");
            }
            if (model == null || model.isEmpty()) {
                throw new IllegalArgumentException("Model is required");
            }
            if (temperature < 0.0 || temperature > 2.0) {
                throw new IllegalArgumentException("Temperature must be between 0.0 and 2.0, got " + temperature);
            }
            if (maxTokens <= 0) {
                throw new IllegalArgumentException("Max tokens must be positive, got " + maxTokens);
            }
            List<String> headerProblems = HttpTransport.headerProblems(customHeaders);
            if (!headerProblems.isEmpty()) {
                throw new IllegalArgumentException("Invalid custom headers: " + String.join("; ", headerProblems));
            }
        }

        public abstract P build();
    }
}
