package com.workforce.core.session;

import com.workforce.core.agent.AgentExecutionException;
import com.workforce.core.agent.AgentTurn;
import com.workforce.core.agent.ConversationEntry;
import com.workforce.core.agent.TurnListener;
import com.workforce.core.agent.TurnOutcome;
import com.workforce.core.artifacts.ArtifactStore;
import com.workforce.core.artifacts.ArtifactStoreException;
import com.workforce.core.artifacts.ConversationLog;
import com.workforce.core.artifacts.RunTrace;
import com.workforce.core.company.CompanyProfile;
import com.workforce.core.evaluation.EvaluationController;
import com.workforce.core.evaluation.EvaluationDecision;
import com.workforce.core.evaluation.ResultDisposition;
import com.workforce.core.events.SessionEvent;
import com.workforce.core.events.SessionEventType;
import com.workforce.core.logging.MdcContext;
import com.workforce.core.model.AgentNode;
import com.workforce.core.model.CostEstimate;
import com.workforce.core.model.EvaluationOutcome;
import com.workforce.core.model.HandoffStep;
import com.workforce.core.model.OrchestrationException;
import com.workforce.core.model.RunOutcome;
import com.workforce.core.model.TaskType;
import com.workforce.core.protocol.Message;
import com.workforce.core.protocol.MessageKind;
import com.workforce.core.registry.AgentRegistry;
import com.workforce.core.routing.DelegationStack;
import com.workforce.core.routing.HandoffRouter;
import com.workforce.core.routing.RouteDecision;
import com.workforce.core.state.RunRecord;
import com.workforce.core.state.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One run of the orchestration engine: a single goal worked through a company's agents.
 * <p>
 * The session drives agent turns one at a time, routes each handoff through the
 * {@link HandoffRouter}, lets the {@link EvaluationController} intercept results bound for the
 * orchestrator, and emits one event per step. Every hop is recorded in the trace before its
 * {@code agent_change} event goes out. At the end the run's artifacts are written and exactly one
 * terminal state is reached: completed, errored or aborted.
 * <p>
 * A session is single use: {@link #stream()} or {@link #run()} may be called once.
 */
public class Session {

    private static final Logger log = LoggerFactory.getLogger(Session.class);

    /** Sender recorded for the opening task. */
    public static final String USER = "user";

    private final String runId;
    private final CompanyProfile company;
    private final AgentRegistry registry;
    private final String entryAgentId;
    private final String goal;
    private final TaskType taskType;
    private final SessionSettings settings;
    private final SessionDependencies deps;
    private final AtomicBoolean started = new AtomicBoolean();

    public Session(String runId, CompanyProfile company, String entryAgentId, String goal, TaskType taskType,
                   SessionSettings settings, SessionDependencies deps) {
        this.runId = runId;
        this.company = company;
        this.registry = company.registry();
        this.goal = goal;
        this.taskType = taskType;
        this.settings = settings;
        this.deps = deps;
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("Goal must not be blank");
        }
        AgentNode entry = registry.find(entryAgentId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown entry agent: " + entryAgentId));
        if (!entry.isOrchestrator()) {
            throw new IllegalArgumentException("Entry agent must be the orchestrator, got " + entryAgentId);
        }
        this.entryAgentId = entryAgentId;
    }

    public String runId() {
        return runId;
    }

    /**
     * Starts the run lazily: nothing happens until the first element is pulled.
     *
     * @throws IllegalStateException if this session was already started
     */
    public SessionEventStream stream() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Session " + runId + " has already been started");
        }
        return new Driver();
    }

    /**
     * Runs to a terminal state and returns the summary.
     */
    public RunResult run() {
        try (SessionEventStream events = stream()) {
            while (events.hasNext()) {
                events.next();
            }
            return events.result();
        }
    }

    private enum Phase { NEW, RUNNING, FINISHED }

    /**
     * Advances the run one step at a time on whichever thread pulls from the stream.
     */
    private final class Driver implements SessionEventStream, TurnListener {

        private final ReentrantLock lock = new ReentrantLock();
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private final ArrayDeque<SessionEvent> buffer = new ArrayDeque<>();

        private final TaskContext task = new TaskContext(goal, taskType, settings.maxIterations());
        private final HandoffRouter router = new HandoffRouter(registry);
        private final EvaluationController evaluation =
                new EvaluationController(registry, deps.codec(), settings.reviewedTaskTypes());
        private final List<ConversationEntry> conversation = new ArrayList<>();
        private final ArtifactStore store = deps.artifactStore();

        private RunRecord record;
        private DelegationStack stack = DelegationStack.empty();
        private Phase phase = Phase.NEW;
        /** Set once finish or fail starts; their events are emitted even if a cancel arrives meanwhile. */
        private boolean terminating;
        private int turns;
        private String currentAgent;
        private String sender;
        private Message input;
        private CostEstimate cost;
        private RunResult result;

        @Override
        public String runId() {
            return runId;
        }

        @Override
        public boolean hasNext() {
            lock.lock();
            try {
                if (cancelled.get() && phase != Phase.FINISHED) {
                    abort();
                    return false;
                }
                while (buffer.isEmpty() && phase != Phase.FINISHED) {
                    step();
                    if (cancelled.get() && phase != Phase.FINISHED) {
                        abort();
                        return false;
                    }
                }
                return !buffer.isEmpty();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public SessionEvent next() {
            lock.lock();
            try {
                if (!hasNext()) {
                    throw new NoSuchElementException("Run " + runId + " has no more events");
                }
                return buffer.poll();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void cancel() {
            if (!cancelled.compareAndSet(false, true)) {
                return;
            }
            // Called from inside a turn or an event callback: the pulling loop aborts once it regains control.
            if (lock.isHeldByCurrentThread()) {
                log.info("Cancellation requested for run {}", runId);
                return;
            }
            // If a turn is in flight the pulling thread aborts once it returns.
            if (lock.tryLock()) {
                try {
                    if (phase == Phase.FINISHED) {
                        log.debug("Run {} already finished, nothing to cancel", runId);
                        return;
                    }
                    log.info("Cancellation requested for run {}", runId);
                    abort();
                } finally {
                    lock.unlock();
                }
            } else {
                log.info("Cancellation requested for run {}", runId);
            }
        }

        @Override
        public void close() {
            if (!isFinished()) {
                cancel();
            }
        }

        @Override
        public RunResult result() {
            lock.lock();
            try {
                if (result == null) {
                    throw new IllegalStateException("Run " + runId + " has not finished");
                }
                return result;
            } finally {
                lock.unlock();
            }
        }

        private boolean isFinished() {
            lock.lock();
            try {
                return phase == Phase.FINISHED;
            } finally {
                lock.unlock();
            }
        }

        // --- driving ---

        private void step() {
            MdcContext.setRun(runId, company.id());
            try {
                if (phase == Phase.NEW) {
                    begin();
                } else {
                    takeTurn();
                }
            } catch (OrchestrationException e) {
                fail(e);
            } catch (RuntimeException e) {
                fail(new AgentExecutionException("Unexpected failure: " + describe(e), e));
            } finally {
                MdcContext.clear();
            }
        }

        private void begin() {
            Instant now = deps.clock().instant();
            record = new RunRecord(runId, company.id(), now);
            phase = Phase.RUNNING;
            log.info("Starting run {} for company {} ({}): {}", runId, company.id(), taskType, goal);
            if (store.isEnabled()) {
                persist(() -> store.writeInput(runId, goal));
            }

            currentAgent = entryAgentId;
            sender = USER;
            input = Message.task(goal);
            record.involve(entryAgentId);
            conversation.add(new ConversationEntry(USER, entryAgentId, MessageKind.TASK, goal));

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("input", goal);
            data.put("company", company.id());
            data.put("task_type", taskType.wireName());
            data.put("max_iterations", task.maxIterations());
            emit(SessionEventType.START, entryAgentId, data, now);
        }

        private void takeTurn() {
            if (++turns > settings.maxTurns()) {
                throw new TurnLimitExceededException(settings.maxTurns());
            }
            AgentNode agent = registry.require(currentAgent);
            AgentTurn turn = new AgentTurn(runId, company, agent, sender, input, conversation,
                    new AgentTurn.TaskSnapshot(task.goal(), task.taskType(), task.iteration(),
                            task.maxIterations(), task.status()),
                    router.allowedTargets(stack, agent.id()));

            MdcContext.setAgent(agent.id());
            TurnOutcome outcome;
            try {
                log.debug("Turn {} for {} (input {} from {})", turns, agent.id(), input.kind().wireName(), sender);
                outcome = deps.executor().execute(turn, this);
            } catch (OrchestrationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new AgentExecutionException("Agent " + agent.id() + " failed: " + describe(e), e);
            } finally {
                MdcContext.clearAgent();
            }
            if (outcome == null) {
                throw new AgentExecutionException("Agent " + agent.id() + " produced no outcome");
            }
            record.addUsage(outcome.usage());
            deps.metrics().recordTokens(outcome.usage());

            if (cancelled.get()) {
                abort();
                return;
            }

            if (outcome instanceof TurnOutcome.FinalAnswer answer) {
                RouteDecision.Terminate done = router.answer(stack, agent.id(), answer.text());
                finish(done.answer(), EvaluationOutcome.NOT_REVIEWED);
            } else if (outcome instanceof TurnOutcome.Handoff handoff) {
                handle(agent, handoff);
            }
        }

        private void handle(AgentNode agent, TurnOutcome.Handoff handoff) {
            RouteDecision.Deliver delivery = router.route(stack, agent.id(), handoff.target(), handoff.message());
            stack = delivery.nextStack();
            Message message = delivery.message();
            boolean toOrchestrator = registry.orchestrator().id().equals(delivery.to());

            if (toOrchestrator && message.kind() == MessageKind.RESULT) {
                ResultDisposition disposition = evaluation.onResult(task, agent.id(), message);
                transition(agent.id(), delivery.to(), message, disposition.artifact().key());
                if (disposition instanceof ResultDisposition.ToReviewer review) {
                    delegate(delivery.to(), review.reviewerId(), review.reviewTask(),
                            "review " + disposition.artifact().key());
                } else {
                    deliver(agent.id(), delivery.to(), message);
                }
            } else if (toOrchestrator && message.kind() == MessageKind.EVALUATION
                    && evaluation.isAwaitingEvaluation()) {
                EvaluationDecision decision = evaluation.onEvaluation(task, message);
                deps.metrics().recordEvaluation(decision.evaluation().verdict());
                transition(agent.id(), delivery.to(), message, decision.evaluation().verdict().name());
                if (decision instanceof EvaluationDecision.Finish finish) {
                    deps.metrics().recordIterationDepth(task.iteration());
                    finish(finish.answer(), finish.outcome());
                } else if (decision instanceof EvaluationDecision.Revise revise) {
                    delegate(delivery.to(), revise.producerId(), revise.feedback(),
                            "revision " + revise.iteration() + "/" + task.maxIterations());
                }
            } else {
                transition(agent.id(), delivery.to(), message, "");
                deliver(agent.id(), delivery.to(), message);
            }
        }

        /** The orchestrator hands off on the engine's behalf; the route table still applies. */
        private void delegate(String from, String to, Message message, String note) {
            RouteDecision.Deliver delivery = router.route(stack, from, to, message);
            stack = delivery.nextStack();
            transition(from, to, message, note);
            deliver(from, to, message);
        }

        private void deliver(String from, String to, Message message) {
            sender = from;
            currentAgent = to;
            input = message;
        }

        private void transition(String from, String to, Message message, String note) {
            Instant now = deps.clock().instant();
            HandoffStep step = new HandoffStep(from, to, message.kind(), now, note);
            record.recordHandoff(step);
            conversation.add(new ConversationEntry(from, to, message.kind(), message.payload()));
            deps.metrics().recordHandoff(message.kind());
            log.info("Handoff {} -> {} [{}]{}", from, to, message.kind().wireName(), note.isEmpty() ? "" : " " + note);

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("from", from);
            data.put("to", to);
            data.put("kind", message.kind().wireName());
            data.put("note", note);
            emit(SessionEventType.AGENT_CHANGE, to, data, now);
        }

        // --- terminal states ---

        private void finish(String answer, EvaluationOutcome evaluationOutcome) {
            terminating = true;
            task.markDone();
            Instant now = deps.clock().instant();
            record.evaluationOutcome(evaluationOutcome);
            record.complete(answer, now);
            cost = deps.costEstimator().estimate(record.usage());
            log.info("Run {} completed in {}ms ({} handoffs, {})", runId, record.durationMs(),
                    record.trace().size(), evaluationOutcome);

            if (store.isEnabled()) {
                List<String> written = new ArrayList<>();
                persist(() -> written.add(store.writeResponse(runId, answer).getFileName().toString()));
                flushRecord(written);
                Map<String, Object> saved = new LinkedHashMap<>();
                saved.put("path", store.runDirectory(runId).toAbsolutePath().toString());
                saved.put("files", written);
                emit(SessionEventType.ARTIFACTS_SAVED, entryAgentId, saved, deps.clock().instant());
            }

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("response", answer);
            data.put("agents_involved", record.agentsInvolved());
            data.put("duration_ms", record.durationMs());
            data.put("evaluation_outcome", evaluationOutcome.name());
            data.put("iteration", task.iteration());
            data.put("usage", record.usage());
            data.put("cost", cost);
            emit(SessionEventType.COMPLETE, entryAgentId, data, deps.clock().instant());
            end(RunOutcome.COMPLETED);
        }

        private void fail(OrchestrationException e) {
            if (phase == Phase.FINISHED) {
                return;
            }
            if (cancelled.get()) {
                log.debug("Run {} failed after cancellation: {}", runId, e.getMessage());
                abort();
                return;
            }
            Instant now = deps.clock().instant();
            if (record == null) {
                record = new RunRecord(runId, company.id(), now);
            }
            if (record.isTerminal()) {
                log.warn("Run {} failed after reaching {}: {}", runId, record.outcome(), e.getMessage());
                end(record.outcome());
                return;
            }
            terminating = true;
            record.fail(e.errorType(), e.getMessage(), now);
            cost = deps.costEstimator().estimate(record.usage());
            log.error("Run {} failed with {} error: {}", runId, e.errorType(), e.getMessage(), e);

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("error", e.getMessage());
            data.put("error_type", e.errorType());
            emit(SessionEventType.ERROR, currentAgent != null ? currentAgent : entryAgentId, data, now);
            if (store.isEnabled()) {
                flushRecord(new ArrayList<>());
            }
            end(RunOutcome.ERRORED);
        }

        private void abort() {
            if (phase == Phase.FINISHED) {
                return;
            }
            buffer.clear();
            Instant now = deps.clock().instant();
            if (record == null) {
                record = new RunRecord(runId, company.id(), now);
            }
            if (!record.isTerminal()) {
                record.abort(now);
            }
            cost = deps.costEstimator().estimate(record.usage());
            log.info("Run {} aborted after {} turns", runId, turns);
            if (store.isEnabled() && phase == Phase.RUNNING) {
                flushRecord(new ArrayList<>());
            }
            end(RunOutcome.ABORTED);
        }

        private void end(RunOutcome outcome) {
            phase = Phase.FINISHED;
            deps.metrics().recordRunResult(outcome, record.durationMs());
            result = new RunResult(
                    runId,
                    record.response(),
                    record.agentsInvolved(),
                    record.durationMs(),
                    record.eventCount(),
                    store.isEnabled() ? store.runDirectory(runId).toAbsolutePath().toString() : null,
                    record.usage(),
                    cost,
                    record.outcome(),
                    record.evaluationOutcome(),
                    task.status(),
                    task.iteration(),
                    record.errorMessage(),
                    record.errorType());
        }

        private void flushRecord(List<String> written) {
            persist(() -> written.add(store.writeTrace(runId, trace()).getFileName().toString()));
            persist(() -> written.add(store.writeConversation(runId, new ConversationLog(
                    runId, goal, List.copyOf(conversation), List.copyOf(task.artifacts().values()),
                    record.response())).getFileName().toString()));
        }

        private RunTrace trace() {
            return new RunTrace(
                    runId,
                    company.id(),
                    goal,
                    taskType,
                    record.startedAt(),
                    record.endedAt(),
                    record.durationMs(),
                    record.outcome(),
                    record.evaluationOutcome(),
                    task.status(),
                    task.iteration(),
                    task.maxIterations(),
                    record.trace(),
                    record.agentsInvolved(),
                    record.usage(),
                    cost,
                    record.errorMessage(),
                    record.errorType());
        }

        // --- events ---

        private void emit(SessionEventType type, String agent, Map<String, Object> data, Instant at) {
            if (cancelled.get() && !terminating) {
                return;
            }
            SessionEvent event = new SessionEvent(type, runId, agent, data, at);
            record.countEvent();
            if (store.isEnabled()) {
                persist(() -> store.appendEvent(runId, event));
            }
            deps.eventBus().publish(event);
            buffer.add(event);
        }

        @Override
        public void onToolCall(String tool, Map<String, Object> arguments) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("tool", tool);
            data.put("arguments", arguments != null ? arguments : Map.of());
            emit(SessionEventType.TOOL_CALL, currentAgent, data, deps.clock().instant());
        }

        @Override
        public void onToolResult(String tool, String output) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("tool", tool);
            data.put("content", output != null ? output : "");
            emit(SessionEventType.TOOL_RESULT, currentAgent, data, deps.clock().instant());
        }

        @Override
        public void onDelta(String content) {
            if (content == null || content.isEmpty()) {
                return;
            }
            emit(SessionEventType.DELTA, currentAgent, Map.of("content", content), deps.clock().instant());
        }

        private void persist(Runnable write) {
            try {
                write.run();
            } catch (ArtifactStoreException e) {
                log.warn("Artifact write failed for run {}: {}", runId, e.getMessage());
            }
        }

        private String describe(Throwable e) {
            return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }
    }
}
