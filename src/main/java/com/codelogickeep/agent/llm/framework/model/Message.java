package com.codelogickeep.agent.llm.framework.model;

import java.util.Objects;

/**
 * 统一消息模型 - 所有适配器共享的对话轮次
 *
 * 列表中的顺序即对话顺序，适配器依赖它做 system 消息提取和轮次映射。
 * content 允许为空字符串，原样传递。
 */
public record Message(Role role, String content) {

    public Message {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static Message system(String content) {
        return new Message(Role.SYSTEM, content);
    }

    public static Message user(String content) {
        return new Message(Role.USER, content);
    }

    public static Message assistant(String content) {
        return new Message(Role.ASSISTANT, content);
    }

    public boolean isSystem() {
        return role == Role.SYSTEM;
    }
}
