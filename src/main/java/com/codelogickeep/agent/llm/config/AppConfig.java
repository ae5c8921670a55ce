package com.codelogickeep.agent.llm.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;

import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    // 分层加载时逐字段合并，而不是整体替换
    @JsonMerge
    private LlmConfig llm;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LlmConfig {
        /**
         * anthropic | claude | openai
         */
        @JsonAlias("provider")
        private String protocol;

        @ToString.Exclude
        @JsonProperty("api-key")
        @JsonAlias("apiKey")
        private String apiKey;

        @JsonAlias({"model-name", "modelName"})
        private String model;

        private Double temperature;

        @JsonProperty("max-tokens")
        @JsonAlias("maxTokens")
        private Integer maxTokens;

        @JsonProperty("base-url")
        @JsonAlias("baseUrl")
        private String baseUrl;

        private Long timeout; // in seconds

        /**
         * extract | inline，为空时使用适配器默认值
         */
        @JsonProperty("system-messages")
        @JsonAlias("systemMessages")
        private String systemMessages;

        @JsonProperty("custom-headers")
        @JsonAlias("customHeaders")
        private Map<String, String> customHeaders;
    }
}
