package com.codelogickeep.agent.llm.framework.adapter;

import com.codelogickeep.agent.llm.framework.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * 拆分后的对话 - system 文本与其余轮次
 *
 * @param system 所有 system 消息按顺序以空行拼接的结果；没有 system 消息时为 null
 * @param turns  非 system 消息，保持原顺序
 */
public record ConversationParts(String system, List<Message> turns) {

    public static final String SYSTEM_SEPARATOR = "\n\n";

    public ConversationParts {
        turns = List.copyOf(turns);
    }

    /**
     * 提取 system 消息
     *
     * 空的 system 消息同样参与拼接：只要出现过 system 消息，system 就不为 null。
     */
    public static ConversationParts split(List<Message> messages) {
        StringBuilder system = null;
        List<Message> turns = new ArrayList<>();

        for (Message message : messages) {
            if (message.isSystem()) {
                if (system == null) {
                    system = new StringBuilder(message.content());
                } else {
                    system.append(SYSTEM_SEPARATOR).append(message.content());
                }
            } else {
                turns.add(message);
            }
        }

        return new ConversationParts(system != null ? system.toString() : null, turns);
    }

    public boolean hasSystem() {
        return system != null;
    }
}
