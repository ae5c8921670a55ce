package com.codelogickeep.agent.llm.framework.executor;

import com.codelogickeep.agent.llm.framework.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExecutionResult Tests")
class ExecutionResultTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        void stepResultsAreCopied() {
            List<StepResult> steps = new ArrayList<>();
            steps.add(StepResult.success("llm_call", "a"));
            ExecutionResult result = new ExecutionResult(true, "a", steps);

            steps.add(StepResult.failure("llm_call", "b"));

            assertEquals(1, result.stepResults().size());
            assertThrows(UnsupportedOperationException.class,
                    () -> result.stepResults().add(StepResult.success("x", "y")));
        }

        @Test
        void nullStepResultsBecomeEmpty() {
            ExecutionResult result = new ExecutionResult(false, null, null);

            assertTrue(result.stepResults().isEmpty());
            assertNull(result.finalResponse());
        }

        @Test
        @DisplayName("success 与步骤结果不做一致性校验")
        void successIsNotDerived() {
            ExecutionResult result = new ExecutionResult(true, "done",
                    List.of(StepResult.failure("llm_call", "boom")));

            assertTrue(result.success());
            assertFalse(result.stepResults().get(0).success());
        }
    }

    @Nested
    @DisplayName("Summary")
    class Summary {

        @Test
        void success() {
            ExecutionResult result = new ExecutionResult(true, "ok",
                    List.of(StepResult.success("llm_call", "ok"), StepResult.success("llm_call", "ok2")));

            assertEquals("Success: 2 step(s)", result.getSummary());
        }

        @Test
        void failure() {
            ExecutionResult result = new ExecutionResult(false, null,
                    List.of(StepResult.success("llm_call", "ok"), StepResult.failure("llm_call", "err")));

            assertEquals("Failed: 1 of 2 step(s) failed", result.getSummary());
        }
    }

    @Nested
    @DisplayName("JSON")
    class Json {

        @Test
        void serializesWithSnakeCaseNames() throws Exception {
            ExecutionResult result = new ExecutionResult(true, "hello",
                    List.of(StepResult.success("llm_call", "hello")));

            JsonNode node = JsonUtil.parse(JsonUtil.toJson(result));

            assertTrue(node.get("success").asBoolean());
            assertEquals("hello", node.get("final_response").asText());
            assertFalse(node.has("summary"));
            JsonNode step = node.get("step_results").get(0);
            assertEquals("llm_call", step.get("step_type").asText());
            assertEquals("hello", step.get("output").asText());
            assertTrue(step.get("success").asBoolean());
        }

        @Test
        void absentFinalResponseIsNull() throws Exception {
            JsonNode node = JsonUtil.parse(JsonUtil.toJson(new ExecutionResult(false, null, List.of())));

            assertTrue(node.get("final_response").isNull());
            assertEquals(0, node.get("step_results").size());
        }

        @Test
        void deserializesFromSnakeCase() throws Exception {
            String json = """
                    {"success": false, "final_response": null,
                     "step_results": [{"step_type": "llm_call", "output": "[P001] TIMEOUT", "success": false}]}
                    """;

            ExecutionResult result = JsonUtil.fromJson(json, ExecutionResult.class);

            assertFalse(result.success());
            assertEquals(1, result.stepResults().size());
            assertEquals("llm_call", result.stepResults().get(0).stepType());
            assertEquals("[P001] TIMEOUT", result.stepResults().get(0).output());
        }
    }
}
