package com.workforce.core.routing;

import com.workforce.core.model.AgentNode;
import com.workforce.core.model.AgentRole;
import com.workforce.core.protocol.Message;
import com.workforce.core.protocol.MessageKind;
import com.workforce.core.registry.AgentRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides, for each handoff an agent requests, whether it is legal and who runs next.
 * <p>
 * Route table:
 * <ul>
 *   <li>orchestrator to any lead, worker or reviewer, with task or feedback</li>
 *   <li>lead to one of its own workers with task, or back to its delegator with result</li>
 *   <li>worker back to its delegator with result</li>
 *   <li>reviewer back to the orchestrator with evaluation</li>
 * </ul>
 * An agent holding an open delegation must answer the agent that delegated to it, with exactly
 * one result, before control can go anywhere else. Only the orchestrator ends a run.
 * <p>
 * Stateless: all routing state travels in the {@link DelegationStack} passed in and out.
 */
public class HandoffRouter {

    private final AgentRegistry registry;

    public HandoffRouter(AgentRegistry registry) {
        this.registry = registry;
    }

    /**
     * Routes a handoff from {@code from} to {@code to}.
     *
     * @param stack   open delegations before this hop
     * @param from    agent that just finished its turn
     * @param to      target named by that agent
     * @param message message it produced
     * @return where control goes and the stack after the hop
     * @throws RoutingException if the hop breaks the route table or the bounce-back rule
     */
    public RouteDecision.Deliver route(DelegationStack stack, String from, String to, Message message) {
        AgentNode sender = known(from, "Sender");
        if (to == null || to.isBlank()) {
            throw new RoutingException(from + " handed off without naming a target");
        }
        AgentNode target = known(to, "Target");
        if (sender.id().equals(target.id())) {
            throw new RoutingException(from + " cannot hand off to itself");
        }
        checkTurnOwner(stack, sender);

        return switch (sender.role()) {
            case ORCHESTRATOR -> fromOrchestrator(stack, sender, target, message);
            case LEAD -> fromLead(stack, sender, target, message);
            case WORKER -> returnToDelegator(stack, sender, target, message, MessageKind.RESULT);
            case REVIEWER -> returnToDelegator(stack, sender, target, message, MessageKind.EVALUATION);
        };
    }

    /**
     * Accepts a final answer. Only the orchestrator may answer, and only with nothing left open.
     *
     * @throws RoutingException if any other agent tries to answer the user
     */
    public RouteDecision.Terminate answer(DelegationStack stack, String from, String text) {
        AgentNode sender = known(from, "Sender");
        if (!sender.isOrchestrator()) {
            throw new RoutingException(from + " (" + sender.role().displayName()
                    + ") cannot answer the user; only the orchestrator produces the final answer");
        }
        if (!stack.isEmpty()) {
            throw new RoutingException(from + " answered while delegation " + stack.top().orElseThrow()
                    + " is still open");
        }
        return new RouteDecision.Terminate(from, text != null ? text : "");
    }

    /**
     * Targets the given agent may legally address right now. Used to brief agents before their turn.
     */
    public List<String> allowedTargets(DelegationStack stack, String agentId) {
        AgentNode agent = registry.find(agentId).orElse(null);
        if (agent == null) {
            return List.of();
        }
        List<String> targets = new ArrayList<>();
        Optional<DelegationStack.Delegation> top = stack.top();
        switch (agent.role()) {
            case ORCHESTRATOR -> {
                if (stack.isEmpty()) {
                    registry.agents().stream()
                            .filter(a -> !a.isOrchestrator())
                            .forEach(a -> targets.add(a.id()));
                }
            }
            case LEAD -> {
                if (top.isPresent() && top.get().delegate().equals(agentId)) {
                    targets.addAll(agent.children());
                    targets.add(top.get().delegator());
                }
            }
            case WORKER, REVIEWER -> top
                    .filter(d -> d.delegate().equals(agentId))
                    .ifPresent(d -> targets.add(d.delegator()));
        }
        return List.copyOf(targets);
    }

    private RouteDecision.Deliver fromOrchestrator(DelegationStack stack, AgentNode sender,
                                                   AgentNode target, Message message) {
        requireKind(sender, target, message, MessageKind.TASK, MessageKind.FEEDBACK);
        if (!stack.isEmpty()) {
            throw new RoutingException(sender.id() + " delegated to " + target.id()
                    + " while " + stack.top().orElseThrow() + " is still open");
        }
        if (target.role() == AgentRole.REVIEWER && message.kind() != MessageKind.TASK) {
            throw new RoutingException("Reviewer " + target.id() + " only accepts task messages");
        }
        return new RouteDecision.Deliver(sender.id(), target.id(), message, stack.push(sender.id(), target.id()));
    }

    private RouteDecision.Deliver fromLead(DelegationStack stack, AgentNode sender,
                                           AgentNode target, Message message) {
        DelegationStack.Delegation open = stack.top().orElseThrow();
        if (target.id().equals(open.delegator())) {
            return returnToDelegator(stack, sender, target, message, MessageKind.RESULT);
        }
        if (!sender.children().contains(target.id())) {
            throw new RoutingException(sender.id() + " may only delegate to its own workers "
                    + sender.children() + " or report back to " + open.delegator() + ", not " + target.id());
        }
        requireKind(sender, target, message, MessageKind.TASK);
        return new RouteDecision.Deliver(sender.id(), target.id(), message, stack.push(sender.id(), target.id()));
    }

    private RouteDecision.Deliver returnToDelegator(DelegationStack stack, AgentNode sender, AgentNode target,
                                                    Message message, MessageKind expected) {
        DelegationStack.Delegation open = stack.top().orElseThrow();
        if (!target.id().equals(open.delegator())) {
            throw new RoutingException(sender.id() + " must report back to its delegator "
                    + open.delegator() + ", not " + target.id());
        }
        if (sender.role() == AgentRole.REVIEWER && !target.isOrchestrator()) {
            throw new RoutingException("Reviewer " + sender.id() + " may only report to the orchestrator");
        }
        requireKind(sender, target, message, expected);
        return new RouteDecision.Deliver(sender.id(), target.id(), message, stack.pop());
    }

    /** Non-orchestrators may only act while they hold the innermost open delegation. */
    private static void checkTurnOwner(DelegationStack stack, AgentNode sender) {
        if (sender.isOrchestrator()) {
            return;
        }
        Optional<DelegationStack.Delegation> top = stack.top();
        if (top.isEmpty() || !top.get().delegate().equals(sender.id())) {
            throw new RoutingException(sender.id() + " has no open delegation to answer");
        }
    }

    private static void requireKind(AgentNode sender, AgentNode target, Message message, MessageKind... allowed) {
        for (MessageKind kind : allowed) {
            if (message.kind() == kind) {
                return;
            }
        }
        throw new RoutingException(sender.role().displayName() + " " + sender.id() + " cannot send "
                + message.kind().wireName() + " to " + target.id());
    }

    private AgentNode known(String agentId, String what) {
        return registry.find(agentId)
                .orElseThrow(() -> new RoutingException(what + " '" + agentId + "' is not a known agent"));
    }
}
