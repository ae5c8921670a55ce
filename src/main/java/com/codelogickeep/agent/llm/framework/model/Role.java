package com.codelogickeep.agent.llm.framework.model;

/**
 * 消息角色 - 对话轮次的发言方
 */
public enum Role {
    SYSTEM("system"),
    USER("user"),
    ASSISTANT("assistant");

    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Anthropic 与 OpenAI 共用的小写角色名
     */
    public String wireName() {
        return wireName;
    }
}
