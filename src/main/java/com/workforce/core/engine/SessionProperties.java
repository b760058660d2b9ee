package com.workforce.core.engine;

import com.workforce.core.model.TaskType;
import com.workforce.core.session.SessionSettings;
import com.workforce.core.state.TaskContext;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "workforce.session")
public class SessionProperties {

    private int maxIterations = TaskContext.DEFAULT_MAX_ITERATIONS;
    private int maxTurns = SessionSettings.DEFAULT_MAX_TURNS;
    private Set<TaskType> reviewedTaskTypes = EnumSet.of(TaskType.CONTENT_CREATION);

    public SessionSettings toSettings() {
        return new SessionSettings(maxIterations, maxTurns, reviewedTaskTypes);
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public int getMaxTurns() {
        return maxTurns;
    }

    public void setMaxTurns(int maxTurns) {
        this.maxTurns = maxTurns;
    }

    public Set<TaskType> getReviewedTaskTypes() {
        return reviewedTaskTypes;
    }

    public void setReviewedTaskTypes(Set<TaskType> reviewedTaskTypes) {
        this.reviewedTaskTypes = reviewedTaskTypes;
    }
}
