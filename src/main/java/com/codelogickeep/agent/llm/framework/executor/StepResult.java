package com.codelogickeep.agent.llm.framework.executor;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 单个步骤的执行结果
 */
public record StepResult(
        @JsonProperty("step_type") String stepType,
        String output,
        boolean success
) {

    /**
     * 创建成功结果
     */
    public static StepResult success(String stepType, String output) {
        return new StepResult(stepType, output, true);
    }

    /**
     * 创建失败结果，output 为错误描述
     */
    public static StepResult failure(String stepType, String output) {
        return new StepResult(stepType, output, false);
    }
}
