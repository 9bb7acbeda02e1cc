package com.taskforge.core.agent;

import com.taskforge.core.context.ContextView;
import com.taskforge.core.model.StepCategory;
import com.taskforge.core.model.Tier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InstructionBuilderTest {

    private static AgentRequest request(List<String> feedback, int depth, ContextView context) {
        return new AgentRequest("L", "3", "Implement the tokenizer", StepCategory.FEATURE, Tier.MID, 1,
                List.of("src/lexer.rs"), "cargo check", context, feedback, depth, null);
    }

    @Test
    @DisplayName("first attempt lists objective, files and success criteria")
    void firstAttempt() {
        String text = InstructionBuilder.build(request(List.of(), 0, ContextView.empty()));
        assertTrue(text.contains("# Step: 3"));
        assertTrue(text.contains("Implement the tokenizer"));
        assertTrue(text.contains("- src/lexer.rs"));
        assertTrue(text.contains("`cargo check` exits with status 0"));
        assertFalse(text.contains("Previous Attempt"));
        assertFalse(text.contains("subtasks"));
    }

    @Test
    @DisplayName("retries include the latest verification failure")
    void retry() {
        String text = InstructionBuilder.build(request(List.of("first error", "second error"), 1, ContextView.empty()));
        assertTrue(text.contains("second error"));
        assertFalse(text.contains("first error"));
        assertTrue(text.contains("1 earlier failure(s) omitted"));
        assertTrue(text.contains("return subtasks"));
    }

    @Test
    @DisplayName("context from earlier steps is included")
    void context() {
        var view = new ContextView(List.of(), List.of(), Map.of(), List.of("[1] token enum exists"), Map.of("1", "done"));
        String text = InstructionBuilder.build(request(List.of(), 0, view));
        assertTrue(text.contains("## Context From Earlier Steps"));
        assertTrue(text.contains("[1] token enum exists"));
    }

    @Test
    @DisplayName("long feedback keeps its tail")
    void truncates() {
        String longText = "x".repeat(InstructionBuilder.MAX_FEEDBACK_CHARS) + "END";
        String tail = InstructionBuilder.tail(longText);
        assertTrue(tail.startsWith("...[truncated]..."));
        assertTrue(tail.endsWith("END"));
    }
}
