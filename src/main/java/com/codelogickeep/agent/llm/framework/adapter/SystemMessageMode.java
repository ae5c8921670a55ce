package com.codelogickeep.agent.llm.framework.adapter;

/**
 * System 消息处理策略 - 每个适配器显式声明
 */
public enum SystemMessageMode {
    /**
     * 从轮次中移除所有 system 消息，按出现顺序以空行拼接成一段独立的 system 文本
     */
    EXTRACT,
    /**
     * system 消息保留在原位置，作为普通轮次发送
     */
    INLINE;

    public static SystemMessageMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (SystemMessageMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Invalid system message mode: " + value
                + ". Supported: extract, inline");
    }
}
