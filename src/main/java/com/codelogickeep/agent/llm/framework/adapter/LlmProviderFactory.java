package com.codelogickeep.agent.llm.framework.adapter;

import com.codelogickeep.agent.llm.config.AppConfig;
import com.codelogickeep.agent.llm.framework.transport.HttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * LLM 提供商工厂 - 根据配置创建对应的适配器
 *
 * 配置应已通过 ConfigValidator 校验并补全默认值。
 */
public class LlmProviderFactory {
    private static final Logger log = LoggerFactory.getLogger(LlmProviderFactory.class);

    private LlmProviderFactory() {
    }

    /**
     * 根据配置创建适配器，使用新建的传输层
     */
    public static LlmProvider create(AppConfig.LlmConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("LLM config is required");
        }
        return create(config, HttpTransport.create(timeoutOf(config)));
    }

    /**
     * 根据配置创建适配器，复用给定的传输层
     */
    public static LlmProvider create(AppConfig.LlmConfig config, HttpTransport transport) {
        if (config == null) {
            throw new IllegalArgumentException("LLM config is required");
        }

        String protocol = config.getProtocol() != null ? config.getProtocol().trim().toLowerCase() : "openai";
        SystemMessageMode mode = SystemMessageMode.fromString(config.getSystemMessages());

        log.info("Creating LLM provider: protocol={}, model={}, baseUrl={}",
                protocol, config.getModel(), config.getBaseUrl());

        return switch (protocol) {
            case "anthropic", "claude" -> configure(AnthropicProvider.builder(), config, mode, transport).build();
            case "openai" -> configure(OpenAiProvider.builder(), config, mode, transport).build();
            default -> throw new IllegalArgumentException(
                    "Unsupported protocol: " + protocol + ". Supported: anthropic, claude, openai");
        };
    }

    private static <B extends AbstractHttpProvider.Builder<?, B>> B configure(
            B builder, AppConfig.LlmConfig config, SystemMessageMode mode, HttpTransport transport) {
        builder.baseUrl(config.getBaseUrl())
                .apiKey(config.getApiKey())
                .timeout(timeoutOf(config))
                .systemMessageMode(mode)
                .customHeaders(config.getCustomHeaders())
                .transport(transport);
        if (config.getModel() != null) {
            builder.model(config.getModel());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        if (config.getMaxTokens() != null) {
            builder.maxTokens(config.getMaxTokens());
        }
        return builder;
    }

    private static Duration timeoutOf(AppConfig.LlmConfig config) {
        return config.getTimeout() != null
                ? Duration.ofSeconds(config.getTimeout())
                : HttpTransport.DEFAULT_REQUEST_TIMEOUT;
    }

    /**
     * 测试适配器连接
     */
    public static boolean testConnection(LlmProvider provider) {
        log.info("Testing connection to {}...", provider.getName());
        boolean success = provider.testConnection();
        if (success) {
            log.info("Connection test passed for {}", provider.getName());
        } else {
            log.warn("Connection test failed for {}", provider.getName());
        }
        return success;
    }
}
