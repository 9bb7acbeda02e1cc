package com.taskforge.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
        MDC.remove("other");
    }

    @Test
    @DisplayName("setTaskList puts taskListId in MDC")
    void setTaskList() {
        MdcContext.setTaskList("TF-2026-0001");
        assertEquals("TF-2026-0001", MDC.get("taskListId"));
    }

    @Test
    @DisplayName("setStep and setAttempt put step, tier and attempt in MDC")
    void setStepAndAttempt() {
        MdcContext.setStep("TF-2026-0001", "3");
        MdcContext.setAttempt("mid", 2);
        assertEquals("TF-2026-0001", MDC.get("taskListId"));
        assertEquals("3", MDC.get("stepId"));
        assertEquals("mid", MDC.get("tier"));
        assertEquals("2", MDC.get("attempt"));
    }

    @Test
    @DisplayName("restore brings back a snapshot taken before a nested run")
    void snapshotAndRestore() {
        MdcContext.setStep("outer", "1");
        var saved = MdcContext.snapshot();

        MdcContext.setStep("outer.1.1", "a");
        MdcContext.setAttempt("local", 1);
        MdcContext.restore(saved);

        assertEquals("outer", MDC.get("taskListId"));
        assertEquals("1", MDC.get("stepId"));
        assertNull(MDC.get("tier"));
    }

    @Test
    @DisplayName("clear removes only taskforge MDC keys")
    void clear() {
        MDC.put("other", "kept");
        MdcContext.setStep("TF-2026-0001", "1");
        MdcContext.setAttempt("premium", 4);
        MdcContext.clear();
        assertNull(MDC.get("taskListId"));
        assertNull(MDC.get("stepId"));
        assertNull(MDC.get("tier"));
        assertNull(MDC.get("attempt"));
        assertEquals("kept", MDC.get("other"));
    }
}
