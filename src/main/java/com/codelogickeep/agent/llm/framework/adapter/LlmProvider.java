package com.codelogickeep.agent.llm.framework.adapter;

import com.codelogickeep.agent.llm.exception.ProviderException;
import com.codelogickeep.agent.llm.framework.model.Message;

import java.util.List;

/**
 * LLM 提供商接口 - 屏蔽各后端的请求/响应格式
 *
 * 实现类只持有不可变配置，可被多个线程并发调用。
 */
public interface LlmProvider {

    /**
     * 发送一次对话请求
     *
     * 每次调用恰好发出一个请求，不重试。
     *
     * @param messages 按对话顺序排列的消息，可以为空
     * @return 第一个候选结果的文本
     * @throws ProviderException 调用失败，类型见 {@link ProviderException.ErrorKind}
     */
    String send(List<Message> messages);

    /**
     * 获取提供商名称
     */
    String getName();

    /**
     * 测试连接是否正常
     *
     * @return true 如果后端返回了文本
     */
    default boolean testConnection() {
        try {
            String reply = send(List.of(Message.user("Hi")));
            return reply != null;
        } catch (ProviderException e) {
            return false;
        }
    }
}
