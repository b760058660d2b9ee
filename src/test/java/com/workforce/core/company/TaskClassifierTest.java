package com.workforce.core.company;

import com.workforce.core.model.TaskType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class TaskClassifierTest {

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({
            "Write a blog post about cold brew, CONTENT_CREATION",
            "Draft a newsletter for March, CONTENT_CREATION",
            "How did our campaigns perform last quarter?, ANALYSIS",
            "Show me the conversion funnel, ANALYSIS",
            "Research current coffee trends, RESEARCH",
            "What keywords should we target?, RESEARCH",
            "Plan the spring campaign, STRATEGY",
            "Hello there, STRATEGY"
    })
    void classifies(String request, TaskType expected) {
        assertEquals(expected, TaskClassifier.classify(request));
    }

    @Test
    @DisplayName("short keywords match whole words only")
    void wordBoundaries() {
        assertEquals(TaskType.STRATEGY, TaskClassifier.classify("Migrate postgres to the cloud"));
        assertEquals(TaskType.CONTENT_CREATION, TaskClassifier.classify("Five posts for Instagram"));
    }

    @Test
    @DisplayName("blank requests default to strategy")
    void blank() {
        assertEquals(TaskType.STRATEGY, TaskClassifier.classify(null));
        assertEquals(TaskType.STRATEGY, TaskClassifier.classify("   "));
    }
}
