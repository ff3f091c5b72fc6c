package com.pipeline.core.model;

import com.pipeline.core.exception.StageValidationException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class TaskTypeTest {

    @Test
    void progressWeights_shouldSumToOne() {
        double sum = Arrays.stream(TaskType.values()).mapToDouble(TaskType::progressWeight).sum();
        assertEquals(1.0, sum, 1e-9);
    }

    @Test
    void fromWireName_shouldIgnoreCaseAndWhitespace() {
        assertEquals(TaskType.IMAGES, TaskType.fromWireName("images"));
        assertEquals(TaskType.SUBTITLES, TaskType.fromWireName(" Subtitles "));
    }

    @Test
    void fromWireName_withUnknownStage_shouldThrow() {
        StageValidationException ex = assertThrows(StageValidationException.class,
            () -> TaskType.fromWireName("video"));
        assertEquals(StageValidationException.ERROR_CODE, ex.getErrorCode());
        assertTrue(ex.getMessage().contains("video"));
    }

    @Test
    void fromWireName_withNull_shouldThrow() {
        assertThrows(StageValidationException.class, () -> TaskType.fromWireName(null));
    }
}
