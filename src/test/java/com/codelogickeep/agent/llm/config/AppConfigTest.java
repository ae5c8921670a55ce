package com.codelogickeep.agent.llm.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AppConfig Tests")
class AppConfigTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper(new YAMLFactory());
    }

    @Nested
    @DisplayName("YAML Parsing")
    class YamlParsing {

        @Test
        void kebabCaseKeys() throws Exception {
            String yaml = """
                    llm:
                      protocol: openai
                      api-key: sk-abc
                      model: gpt-4o
                      temperature: 0.2
                      max-tokens: 2048
                      base-url: http://localhost:8000/v1
                      timeout: 60
                      system-messages: extract
                      custom-headers:
                        X-Trace: enabled
                    """;

            AppConfig config = mapper.readValue(yaml, AppConfig.class);
            AppConfig.LlmConfig llm = config.getLlm();

            assertEquals("openai", llm.getProtocol());
            assertEquals("sk-abc", llm.getApiKey());
            assertEquals("gpt-4o", llm.getModel());
            assertEquals(0.2, llm.getTemperature());
            assertEquals(2048, llm.getMaxTokens());
            assertEquals("http://localhost:8000/v1", llm.getBaseUrl());
            assertEquals(60L, llm.getTimeout());
            assertEquals("extract", llm.getSystemMessages());
            assertEquals(Map.of("X-Trace", "enabled"), llm.getCustomHeaders());
        }

        @Test
        @DisplayName("兼容 camelCase 与别名")
        void aliases() throws Exception {
            String yaml = """
                    llm:
                      provider: anthropic
                      apiKey: sk-ant
                      modelName: claude-3-haiku-20240307
                      maxTokens: 512
                      baseUrl: https://proxy.local
                    """;

            AppConfig.LlmConfig llm = mapper.readValue(yaml, AppConfig.class).getLlm();

            assertEquals("anthropic", llm.getProtocol());
            assertEquals("sk-ant", llm.getApiKey());
            assertEquals("claude-3-haiku-20240307", llm.getModel());
            assertEquals(512, llm.getMaxTokens());
            assertEquals("https://proxy.local", llm.getBaseUrl());
        }

        @Test
        void unknownKeysAreIgnored() throws Exception {
            String yaml = """
                    workflow:
                      max-retries: 3
                    llm:
                      protocol: openai
                      streaming: true
                    """;

            AppConfig config = mapper.readValue(yaml, AppConfig.class);

            assertEquals("openai", config.getLlm().getProtocol());
        }

        @Test
        void unsetFieldsStayNull() throws Exception {
            AppConfig.LlmConfig llm = mapper.readValue("llm:\n  protocol: openai\n", AppConfig.class).getLlm();

            assertNull(llm.getTemperature());
            assertNull(llm.getMaxTokens());
            assertNull(llm.getTimeout());
            assertNull(llm.getSystemMessages());
        }
    }

    @Test
    @DisplayName("toString 不包含 API key")
    void toStringExcludesApiKey() {
        AppConfig.LlmConfig llm = new AppConfig.LlmConfig();
        llm.setApiKey("sk-very-secret");
        llm.setModel("gpt-4o");
        AppConfig config = new AppConfig();
        config.setLlm(llm);

        assertFalse(config.toString().contains("sk-very-secret"));
        assertTrue(config.toString().contains("gpt-4o"));
    }
}
