package com.codelogickeep.agent.llm.config;

import com.codelogickeep.agent.llm.exception.ConfigException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * 分层加载 agent.yml
 *
 * 优先级从低到高：
 * 1. classpath agent.yml（默认值）
 * 2. ~/.llm-provider-bridge/agent.yml
 * 3. 当前目录 agent.yml
 * 4. 显式指定的配置文件
 */
@Slf4j
public class ConfigLoader {

    static final String CONFIG_FILE_NAME = "agent.yml";
    static final String USER_CONFIG_DIR = ".llm-provider-bridge";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    private final Path userHome;
    private final Path workingDir;
    private final UnaryOperator<String> env;

    public ConfigLoader() {
        this(Paths.get(System.getProperty("user.home")), Paths.get("."), System::getenv);
    }

    /**
     * @param userHome   用户目录，读取其下的 .llm-provider-bridge/agent.yml
     * @param workingDir 当前目录，读取其下的 agent.yml
     * @param env        环境变量查找，用于解析 ${env:NAME}
     */
    public ConfigLoader(Path userHome, Path workingDir, UnaryOperator<String> env) {
        this.userHome = userHome;
        this.workingDir = workingDir;
        this.env = env;
    }

    /**
     * 加载并合并配置
     *
     * @param explicitPath 命令行指定的配置文件，可以为 null
     * @throws ConfigException 显式指定的文件不存在或无法解析
     */
    public AppConfig load(String explicitPath) {
        AppConfig config = new AppConfig();

        try (InputStream in = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE_NAME)) {
            if (in != null) {
                mapper.readerForUpdating(config).readValue(in);
            }
        } catch (IOException e) {
            log.warn("Failed to read classpath {}: {}", CONFIG_FILE_NAME, e.getMessage());
        }

        mergeConfigFromFile(config, userHome.resolve(USER_CONFIG_DIR).resolve(CONFIG_FILE_NAME).toFile());
        mergeConfigFromFile(config, workingDir.resolve(CONFIG_FILE_NAME).toFile());

        if (explicitPath != null) {
            File file = new File(explicitPath);
            if (!file.exists()) {
                throw new ConfigException("Configuration file not found: " + file.getAbsolutePath(),
                        "Check the --config option");
            }
            try {
                mapper.readerForUpdating(config).readValue(file);
                log.info("Merged configuration from {}", file.getAbsolutePath());
            } catch (IOException e) {
                throw new ConfigException("Failed to parse " + file.getAbsolutePath() + ": " + e.getMessage(),
                        "Check the YAML syntax", e);
            }
        }

        resolveEnvVars(config);
        return config;
    }

    private void mergeConfigFromFile(AppConfig config, File file) {
        if (file.exists()) {
            try {
                mapper.readerForUpdating(config).readValue(file);
                log.info("Merged configuration from {}", file.getAbsolutePath());
            } catch (IOException e) {
                log.warn("Failed to merge config from {}: {}", file.getAbsolutePath(), e.getMessage());
            }
        }
    }

    private void resolveEnvVars(AppConfig config) {
        AppConfig.LlmConfig llm = config.getLlm();
        if (llm == null) {
            return;
        }
        llm.setProtocol(replaceEnvVars(llm.getProtocol()));
        llm.setApiKey(replaceEnvVars(llm.getApiKey()));
        llm.setBaseUrl(replaceEnvVars(llm.getBaseUrl()));
        llm.setModel(replaceEnvVars(llm.getModel()));
        if (llm.getCustomHeaders() != null) {
            Map<String, String> headers = new LinkedHashMap<>();
            llm.getCustomHeaders().forEach((k, v) -> headers.put(k, replaceEnvVars(v)));
            llm.setCustomHeaders(headers);
        }
    }

    /**
     * 整个值为 ${env:NAME} 时替换为环境变量；变量不存在时保留原值，由校验器报告
     */
    String replaceEnvVars(String value) {
        if (value == null || !value.contains("${env:")) {
            return value;
        }

        if (value.startsWith("${env:") && value.endsWith("}")) {
            String envVar = value.substring(6, value.length() - 1);
            String envValue = env.apply(envVar);
            return envValue != null ? envValue : value;
        }

        return value;
    }
}
