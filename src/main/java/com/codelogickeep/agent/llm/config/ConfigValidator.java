package com.codelogickeep.agent.llm.config;

import com.codelogickeep.agent.llm.exception.ConfigException;
import com.codelogickeep.agent.llm.framework.transport.HttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * LLM 配置校验与默认值
 *
 * 校验会收集全部问题后一次性抛出 {@link ConfigException}，不会在第一个错误处停止。
 */
public class ConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(ConfigValidator.class);

    // 与 classpath agent.yml 保持一致
    static final double DEFAULT_TEMPERATURE = 0.7;
    static final int DEFAULT_MAX_TOKENS = 1024;
    static final long DEFAULT_TIMEOUT = 120L;

    static final Set<String> SUPPORTED_PROTOCOLS = Set.of("anthropic", "claude", "openai");
    private static final Set<String> ANTHROPIC_PROTOCOLS = Set.of("anthropic", "claude");
    private static final Set<String> SYSTEM_MESSAGE_MODES = Set.of("extract", "inline");

    private ConfigValidator() {
    }

    /**
     * 校验配置
     *
     * @throws ConfigException 列出所有发现的问题
     */
    public static void validate(AppConfig config) {
        if (config == null) {
            throw new ConfigException("Configuration is null", "No configuration loaded");
        }

        AppConfig.LlmConfig llm = config.getLlm();
        List<String> problems = llm == null
                ? List.of("llm: section is missing")
                : collectProblems(llm);

        if (!problems.isEmpty()) {
            throw new ConfigException("Invalid LLM configuration:\n  - " + String.join("\n  - ", problems),
                    "Fix agent.yml or pass the value on the command line");
        }
        log.debug("LLM configuration is valid: protocol={}, model={}", llm.getProtocol(), llm.getModel());
    }

    private static List<String> collectProblems(AppConfig.LlmConfig llm) {
        List<String> problems = new ArrayList<>();

        if (isMissing(llm.getApiKey())) {
            problems.add("llm.api-key: missing (set --api-key or ${env:NAME} in agent.yml)");
        }
        if (isMissing(llm.getModel())) {
            problems.add("llm.model: missing (set --model)");
        }

        String protocol = normalize(llm.getProtocol());
        if (protocol.isEmpty()) {
            problems.add("llm.protocol: missing (anthropic | claude | openai)");
        } else if (!SUPPORTED_PROTOCOLS.contains(protocol)) {
            problems.add("llm.protocol: '" + llm.getProtocol() + "' is not one of anthropic, claude, openai");
        }

        if (llm.getTemperature() != null && !inRange(llm.getTemperature())) {
            problems.add("llm.temperature: " + llm.getTemperature() + " is outside 0.0..2.0");
        }
        if (llm.getMaxTokens() != null && llm.getMaxTokens() <= 0) {
            problems.add("llm.max-tokens: " + llm.getMaxTokens() + " is not a positive integer");
        }
        if (llm.getTimeout() != null && llm.getTimeout() <= 0) {
            problems.add("llm.timeout: " + llm.getTimeout() + " is not a positive number of seconds");
        }

        String mode = normalize(llm.getSystemMessages());
        if (!mode.isEmpty() && !SYSTEM_MESSAGE_MODES.contains(mode)) {
            problems.add("llm.system-messages: '" + llm.getSystemMessages() + "' is not one of extract, inline");
        } else if (mode.equals("inline") && ANTHROPIC_PROTOCOLS.contains(protocol)) {
            problems.add("llm.system-messages: anthropic only supports 'extract'");
        }

        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            String urlProblem = baseUrlProblem(llm.getBaseUrl().trim());
            if (urlProblem != null) {
                problems.add("llm.base-url: '" + llm.getBaseUrl() + "' " + urlProblem);
            }
        }
        HttpTransport.headerProblems(llm.getCustomHeaders())
                .forEach(problem -> problems.add("llm.custom-headers: " + problem));

        return problems;
    }

    private static String baseUrlProblem(String baseUrl) {
        URI uri;
        try {
            uri = new URI(baseUrl);
        } catch (URISyntaxException e) {
            return "is not a valid URL: " + e.getReason();
        }
        String scheme = normalize(uri.getScheme());
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return "must use http or https";
        }
        if (uri.getHost() == null) {
            return "has no host";
        }
        return null;
    }

    /**
     * 为未设置的采样参数和超时填充默认值
     */
    public static void applyDefaults(AppConfig config) {
        if (config == null || config.getLlm() == null) {
            return;
        }
        AppConfig.LlmConfig llm = config.getLlm();
        if (llm.getTemperature() == null) {
            llm.setTemperature(DEFAULT_TEMPERATURE);
        }
        if (llm.getMaxTokens() == null) {
            llm.setMaxTokens(DEFAULT_MAX_TOKENS);
        }
        if (llm.getTimeout() == null) {
            llm.setTimeout(DEFAULT_TIMEOUT);
        }
    }

    /**
     * 先补默认值再校验
     */
    public static void validateAndApplyDefaults(AppConfig config) {
        applyDefaults(config);
        validate(config);
    }

    /**
     * 生效配置的摘要，API key 已脱敏
     */
    public static String getConfigSummary(AppConfig config) {
        if (config == null || config.getLlm() == null) {
            return "Configuration not loaded";
        }
        AppConfig.LlmConfig llm = config.getLlm();

        List<String> lines = new ArrayList<>();
        lines.add("protocol        = " + llm.getProtocol());
        lines.add("model           = " + llm.getModel());
        lines.add("api-key         = " + mask(llm.getApiKey()));
        lines.add("temperature     = " + llm.getTemperature());
        lines.add("max-tokens      = " + llm.getMaxTokens());
        lines.add("timeout         = " + llm.getTimeout() + "s");
        if (!isMissing(llm.getBaseUrl())) {
            lines.add("base-url        = " + llm.getBaseUrl());
        }
        if (llm.getSystemMessages() != null) {
            lines.add("system-messages = " + llm.getSystemMessages());
        }
        return "[llm]\n" + String.join("\n", lines) + "\n";
    }

    static String mask(String apiKey) {
        if (apiKey == null || apiKey.isEmpty()) {
            return "(not set)";
        }
        return apiKey.length() <= 8 ? "****" : apiKey.substring(0, 4) + "****";
    }

    private static boolean inRange(double temperature) {
        return temperature >= 0.0 && temperature <= 2.0;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * 空白或未解析的 ${env:...} 占位符都视为缺失
     */
    private static boolean isMissing(String value) {
        if (value == null || value.isBlank()) {
            return true;
        }
        return value.contains("${env:") && value.contains("}");
    }
}
