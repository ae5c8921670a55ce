package com.codelogickeep.agent.llm.framework.executor;

import com.codelogickeep.agent.llm.exception.ProviderException;
import com.codelogickeep.agent.llm.framework.adapter.LlmProvider;
import com.codelogickeep.agent.llm.framework.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 将一次提供商调用记录为 {@link StepResult}
 *
 * 只要返回了文本即视为成功，不检查文本内容；失败时 output 为错误描述。
 * 不做重试，也不决定后续步骤是否继续。
 */
public class StepRecorder {
    private static final Logger log = LoggerFactory.getLogger(StepRecorder.class);

    private StepRecorder() {
    }

    public static StepResult record(String stepType, LlmProvider provider, List<Message> messages) {
        long startTime = System.currentTimeMillis();
        try {
            String reply = provider.send(messages);
            log.info("Step '{}' succeeded via {} in {}ms", stepType, provider.getName(),
                    System.currentTimeMillis() - startTime);
            return StepResult.success(stepType, reply);
        } catch (ProviderException e) {
            log.warn("Step '{}' failed via {}: {} - {} ({})", stepType, provider.getName(),
                    e.getKind(), e.getKind().getDescription(), e.getMessage());
            return StepResult.failure(stepType, e.describe());
        }
    }
}
