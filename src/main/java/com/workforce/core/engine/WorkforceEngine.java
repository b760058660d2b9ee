package com.workforce.core.engine;

import com.workforce.core.agent.AgentExecutor;
import com.workforce.core.artifacts.ArtifactStore;
import com.workforce.core.company.CompanyDataLoader;
import com.workforce.core.company.CompanyProfile;
import com.workforce.core.company.TaskClassifier;
import com.workforce.core.cost.CostEstimator;
import com.workforce.core.events.EventBus;
import com.workforce.core.metrics.WorkforceMetrics;
import com.workforce.core.model.TaskType;
import com.workforce.core.protocol.MessageCodec;
import com.workforce.core.session.RunResult;
import com.workforce.core.session.Session;
import com.workforce.core.session.SessionDependencies;
import com.workforce.core.session.SessionEventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Entry point for running goals against a company's workforce.
 * <p>
 * Resolves the company, picks the task type (classifying the goal when none is given),
 * generates the run id and builds a fresh {@link Session} per run. Nothing run-specific
 * is kept here, so concurrent runs share only immutable company data.
 */
@Service
public class WorkforceEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkforceEngine.class);

    private final CompanyDataLoader companies;
    private final SessionProperties sessionProperties;
    private final RunIdGenerator runIds;
    private final SessionDependencies dependencies;

    public WorkforceEngine(CompanyDataLoader companies,
                           SessionProperties sessionProperties,
                           RunIdGenerator runIds,
                           AgentExecutor executor,
                           MessageCodec codec,
                           ArtifactStore artifactStore,
                           CostEstimator costEstimator,
                           EventBus eventBus,
                           WorkforceMetrics metrics,
                           Clock clock) {
        this.companies = companies;
        this.sessionProperties = sessionProperties;
        this.runIds = runIds;
        this.dependencies = new SessionDependencies(executor, codec, artifactStore, costEstimator,
                eventBus, metrics, clock);
    }

    /**
     * Creates a session for the company's orchestrator.
     *
     * @param companyId company id; null or blank selects the default company
     * @param goal      the user's request
     * @param taskType  task type, or null to classify the goal
     */
    public Session newSession(String companyId, String goal, TaskType taskType) {
        CompanyProfile company = companies.load(companyId);
        return newSession(company, company.registry().orchestrator().id(), goal, taskType);
    }

    public Session newSession(CompanyProfile company, String entryAgentId, String goal, TaskType taskType) {
        TaskType type = taskType != null ? taskType : TaskClassifier.classify(goal);
        String runId = runIds.next();
        log.info("Creating run {} for company {} (task type {})", runId, company.id(), type.wireName());
        return new Session(runId, company, entryAgentId, goal, type, sessionProperties.toSettings(), dependencies);
    }

    public RunResult run(String companyId, String goal, TaskType taskType) {
        return newSession(companyId, goal, taskType).run();
    }

    public RunResult run(CompanyProfile company, String entryAgentId, String goal, TaskType taskType) {
        return newSession(company, entryAgentId, goal, taskType).run();
    }

    public SessionEventStream runStream(String companyId, String goal, TaskType taskType) {
        return newSession(companyId, goal, taskType).stream();
    }

    public String defaultCompanyId() {
        return companies.defaultCompanyId();
    }
}
