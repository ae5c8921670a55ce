package com.codelogickeep.agent.llm.framework.executor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 整个计划的执行结果
 *
 * 如何由步骤结果得出 success 与 finalResponse 属于执行器策略，这里只承载数据。
 */
public record ExecutionResult(
        boolean success,
        @JsonProperty("final_response") String finalResponse,
        @JsonProperty("step_results") List<StepResult> stepResults
) {

    public ExecutionResult {
        stepResults = stepResults != null ? List.copyOf(stepResults) : List.of();
    }

    /**
     * 获取摘要信息
     */
    @JsonIgnore
    public String getSummary() {
        long failed = stepResults.stream().filter(s -> !s.success()).count();
        if (success) {
            return String.format("Success: %d step(s)", stepResults.size());
        }
        return String.format("Failed: %d of %d step(s) failed", failed, stepResults.size());
    }
}
