package com.abhikarta.orchestrator.service;

import com.abhikarta.orchestrator.capability.AgentRegistry;
import com.abhikarta.orchestrator.capability.CapabilityDescriptor;
import com.abhikarta.orchestrator.capability.ToolRegistry;
import com.abhikarta.orchestrator.capability.impl.EchoAgent;
import com.abhikarta.orchestrator.dag.DagDefinition;
import com.abhikarta.orchestrator.dag.DagNodeDefinition;
import com.abhikarta.orchestrator.dag.DagRegistry;
import com.abhikarta.orchestrator.dag.DagSummary;
import com.abhikarta.orchestrator.graph.Node;
import com.abhikarta.orchestrator.graph.NodeType;
import com.abhikarta.orchestrator.model.Plan;
import com.abhikarta.orchestrator.repository.PlanRepository;
import com.abhikarta.orchestrator.planning.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Turns a free-form request into a persisted plan awaiting approval.
 *
 * Stages, in order:
 * <ol>
 *   <li>ANALYZE_REQUEST: ask the planner what is being asked</li>
 *   <li>EVALUATE_RESOURCES: snapshot agents, tools and DAGs</li>
 *   <li>DECIDE_STRATEGY: reuse a DAG or synthesize steps, and in which mode</li>
 *   <li>CONSTRUCT_PLAN: compile the DAG or ask the planner for steps</li>
 *   <li>REQUEST_APPROVAL: persist the plan as pending_approval and stop</li>
 * </ol>
 *
 * Every planner call site tolerates failure. An unavailable planner, an
 * unparseable answer, or a plan that does not validate against the
 * registered capabilities is replaced by a fixed fallback, and the
 * substitution is noted in the message trail.
 */
@Component
public class PlanSupervisor {

    private static final Logger log = LoggerFactory.getLogger(PlanSupervisor.class);

    enum Stage { ANALYZE_REQUEST, EVALUATE_RESOURCES, DECIDE_STRATEGY, CONSTRUCT_PLAN, REQUEST_APPROVAL }

    /** Working state threaded through the stages of one createPlan call. */
    static final class PlanningState {
        final String userId;
        final String sessionId;
        final String request;
        final List<String> messages = new ArrayList<>();

        RequestAnalysis            analysis;
        List<CapabilityDescriptor> agents = List.of();
        List<CapabilityDescriptor> tools  = List.of();
        List<DagSummary>           dags   = List.of();
        StrategyDecision           decision;
        PlanType                   planType;
        ExecutionPlan              plan;
        Plan                       saved;

        PlanningState(String userId, String sessionId, String request) {
            this.userId    = userId;
            this.sessionId = sessionId;
            this.request   = request;
        }
    }

    private final PlanningStrategy   strategy;
    private final PlanResponseParser parser;
    private final AgentRegistry      agentRegistry;
    private final ToolRegistry       toolRegistry;
    private final DagRegistry        dagRegistry;
    private final PlanRepository     planRepo;
    private final ObjectMapper       objectMapper;

    public PlanSupervisor(PlanningStrategy strategy,
                          PlanResponseParser parser,
                          AgentRegistry agentRegistry,
                          ToolRegistry toolRegistry,
                          DagRegistry dagRegistry,
                          PlanRepository planRepo,
                          ObjectMapper objectMapper) {
        this.strategy      = strategy;
        this.parser        = parser;
        this.agentRegistry = agentRegistry;
        this.toolRegistry  = toolRegistry;
        this.dagRegistry   = dagRegistry;
        this.planRepo      = planRepo;
        this.objectMapper  = objectMapper;
    }

    public PlanDraft createPlan(String userId, String sessionId, String request) {
        PlanningState state = new PlanningState(userId, sessionId, request);
        Stage stage = Stage.ANALYZE_REQUEST;
        while (stage != null) {
            stage = switch (stage) {
                case ANALYZE_REQUEST    -> analyzeRequest(state);
                case EVALUATE_RESOURCES -> evaluateResources(state);
                case DECIDE_STRATEGY    -> decideStrategy(state);
                case CONSTRUCT_PLAN     -> constructPlan(state);
                case REQUEST_APPROVAL   -> requestApproval(state);
            };
        }
        return new PlanDraft(
                state.saved.getId(),
                state.planType,
                state.saved.getStatus(),
                state.analysis,
                state.decision,
                state.plan,
                state.saved.getSummary(),
                state.saved.isRequiresHitl(),
                List.copyOf(state.messages));
    }

    // ------------------------------------------------------------------
    // Stages
    // ------------------------------------------------------------------

    Stage analyzeRequest(PlanningState state) {
        state.analysis = ask("analyze_request",
                () -> PlanningPrompts.analyzeRequest(state.request),
                parser::parseAnalysis,
                () -> RequestAnalysis.fallback(state.request),
                state);
        state.messages.add("Analysis: intent='%s', complexity=%s, requires_hitl=%s"
                .formatted(state.analysis.intent(), state.analysis.complexity(), state.analysis.requiresHitl()));
        return Stage.EVALUATE_RESOURCES;
    }

    Stage evaluateResources(PlanningState state) {
        state.agents = agentRegistry.list();
        state.tools  = toolRegistry.list();
        state.dags   = dagRegistry.listDags();
        state.messages.add("Available resources: %d agent(s) %s, %d tool(s) %s, %d DAG(s) %s".formatted(
                state.agents.size(), state.agents.stream().map(CapabilityDescriptor::id).toList(),
                state.tools.size(),  state.tools.stream().map(CapabilityDescriptor::id).toList(),
                state.dags.size(),   state.dags.stream().map(DagSummary::dagId).toList()));
        return Stage.DECIDE_STRATEGY;
    }

    Stage decideStrategy(PlanningState state) {
        state.decision = ask("decide_strategy",
                () -> PlanningPrompts.decideStrategy(state.request, state.analysis,
                        state.dags, state.agents, state.tools),
                parser::parseDecision,
                StrategyDecision::fallback,
                state);
        state.planType = state.decision.planType();
        state.messages.add("Strategy: %s, mode %s%s".formatted(
                state.planType.value(),
                state.decision.executionMode().value(),
                state.decision.selectedDagId() == null ? "" : ", DAG " + state.decision.selectedDagId()));
        return Stage.CONSTRUCT_PLAN;
    }

    Stage constructPlan(PlanningState state) {
        if (state.planType == PlanType.USE_EXISTING_DAG) {
            Optional<DagDefinition> dag = dagRegistry.getDagConfig(state.decision.selectedDagId());
            if (dag.isPresent()) {
                state.plan = fromDag(dag.get(), state.decision.executionMode());
                state.messages.add("Using existing DAG: %s with %d steps"
                        .formatted(dag.get().dagId(), state.plan.steps().size()));
                return Stage.REQUEST_APPROVAL;
            }
            log.warn("Selected DAG '{}' not found; building a new plan instead",
                    state.decision.selectedDagId());
            state.messages.add("DAG " + state.decision.selectedDagId() + " not found; building a new plan");
            state.planType = PlanType.CREATE_STATEGRAPH;
        }

        ExecutionMode mode = state.decision.executionMode();
        ExecutionPlan plan = ask("construct_plan",
                () -> PlanningPrompts.constructPlan(state.request, mode, state.agents, state.tools),
                parser::parsePlan,
                () -> null,
                state);
        if (plan != null) {
            if (plan.executionMode() == null) {
                plan = plan.withExecutionMode(mode);
            }
            plan = withKnownCheckpoints(plan, state);
            Optional<String> problem = validate(plan);
            if (problem.isPresent()) {
                log.warn("Planner produced an invalid plan ({}); using fallback", problem.get());
                state.messages.add("Planner output rejected: " + problem.get() + "; using fallback plan");
                plan = null;
            }
        }
        state.plan = plan != null ? plan : fallbackPlan(state.request, mode, state.agents);
        state.messages.add("Created StateGraph plan with %d steps".formatted(state.plan.steps().size()));
        return Stage.REQUEST_APPROVAL;
    }

    Stage requestApproval(PlanningState state) {
        String summary = summarize(state.plan);
        boolean requiresHitl = state.analysis.requiresHitl() || state.plan.requiresHitl();
        state.saved = planRepo.save(new Plan(
                state.userId, state.sessionId, state.request,
                state.planType.value(), toJson(state.plan), summary, requiresHitl));
        state.messages.add("Plan created (ID: %s). Summary:\n%s\nPlease approve to execute."
                .formatted(state.saved.getId(), summary));
        log.info("Plan {} created ({}, {} steps) for user {}",
                state.saved.getId(), state.planType.value(), state.plan.steps().size(), state.userId);
        return null;
    }

    // ------------------------------------------------------------------
    // Planner calls with fallback
    // ------------------------------------------------------------------

    private <T> T ask(String stage,
                      Supplier<String> prompt,
                      Function<String, T> parse,
                      Supplier<T> fallback,
                      PlanningState state) {
        try {
            return parse.apply(strategy.generate(prompt.get()));
        } catch (PlanningUnavailableException | PlanParseException e) {
            log.warn("Planner {} unusable at {}: {}; using fallback",
                    e instanceof PlanParseException ? "answer" : "call", stage, e.getMessage());
            state.messages.add("Planner unavailable or unparseable at " + stage + "; using fallback");
            return fallback.get();
        }
    }

    // ------------------------------------------------------------------
    // Plan construction helpers
    // ------------------------------------------------------------------

    /**
     * One step per DAG node, ids and dependencies preserved. Tool name and
     * input are read the way a direct DAG run reads them, so a tool named
     * only in {@code config.tool_name} keeps its tool.
     */
    static ExecutionPlan fromDag(DagDefinition dag, ExecutionMode mode) {
        List<PlanStep> steps = new ArrayList<>();
        for (DagNodeDefinition def : dag.nodes()) {
            Node node = new Node(def.nodeId(), NodeType.fromValue(def.nodeType()),
                    def.agentId(), def.toolName(), def.config());
            Object message = def.config().get("message");
            steps.add(new PlanStep(
                    def.nodeId(),
                    def.nodeId(),
                    StepType.fromValue(def.nodeType()),
                    node.getAgentId(),
                    node.getToolName(),
                    node.getInput(),
                    def.dependencies(),
                    null,
                    null,
                    false,
                    message == null ? null : message.toString()));
        }
        return new ExecutionPlan(ExecutionPlan.TYPE_DAG, dag.dagId(), mode, steps, Map.of(), List.of(), null);
    }

    /** A single agent step over the whole request. */
    static ExecutionPlan fallbackPlan(String request, ExecutionMode mode, List<CapabilityDescriptor> agents) {
        String agentId = agents.isEmpty() ? EchoAgent.ID : agents.get(0).id();
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("request", request);
        PlanStep step = PlanStep.agent("step_1", "Execute request", agentId, input, List.of());
        return new ExecutionPlan(ExecutionPlan.TYPE_STATEGRAPH, null, mode, List.of(step), Map.of(), List.of(), null);
    }

    private static ExecutionPlan withKnownCheckpoints(ExecutionPlan plan, PlanningState state) {
        Set<String> stepIds = new HashSet<>();
        plan.steps().forEach(s -> stepIds.add(s.stepId()));
        List<String> known = plan.hitlCheckpoints().stream().filter(stepIds::contains).toList();
        if (known.size() == plan.hitlCheckpoints().size()) {
            return plan;
        }
        state.messages.add("Ignoring checkpoint(s) that name no step");
        return new ExecutionPlan(plan.type(), plan.dagId(), plan.executionMode(), plan.steps(),
                plan.parallelGroups(), known, plan.loopConfig());
    }

    /** @return the first problem found, or empty if the plan is executable */
    Optional<String> validate(ExecutionPlan plan) {
        if (plan.steps().isEmpty()) {
            return Optional.of("plan has no steps");
        }
        Set<String> ids = new HashSet<>();
        for (PlanStep step : plan.steps()) {
            if (step.stepId() == null || step.stepId().isBlank()) {
                return Optional.of("a step has no step_id");
            }
            if (!ids.add(step.stepId())) {
                return Optional.of("duplicate step_id '" + step.stepId() + "'");
            }
            if (step.type() == StepType.AGENT && !agentRegistry.contains(step.agentId())) {
                return Optional.of("step '" + step.stepId() + "' uses unknown agent '" + step.agentId() + "'");
            }
            if (step.type() == StepType.TOOL && !toolRegistry.contains(step.toolName())) {
                return Optional.of("step '" + step.stepId() + "' uses unknown tool '" + step.toolName() + "'");
            }
        }
        try {
            PlanCompiler.compile("validation", plan);
        } catch (IllegalArgumentException e) {
            return Optional.of(e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Human-readable summary shown with the approval request:
     * <pre>
     * Plan Type: stategraph
     * Total Steps: 2
     * Execution Mode: sequential
     *
     * Steps:
     * 1. Fetch (agent: echo_agent)
     * 2. Count (tool: word_count)
     *    Dependencies: step_1
     * </pre>
     */
    static String summarize(ExecutionPlan plan) {
        StringBuilder sb = new StringBuilder();
        sb.append("Plan Type: ").append(plan.type()).append('\n');
        sb.append("Total Steps: ").append(plan.steps().size()).append('\n');
        sb.append("Execution Mode: ").append(plan.effectiveMode().value()).append("\n\n");
        sb.append("Steps:\n");
        int i = 1;
        for (PlanStep step : plan.steps()) {
            sb.append(i++).append(". ").append(step.displayName())
              .append(" (").append(step.type() == null ? "unknown" : step.type().value())
              .append(": ").append(step.resource()).append(")\n");
            if (!step.dependencies().isEmpty()) {
                sb.append("   Dependencies: ").append(String.join(", ", step.dependencies())).append('\n');
            }
        }
        if (!plan.hitlCheckpoints().isEmpty()) {
            sb.append("\nHITL Checkpoints: ").append(String.join(", ", plan.hitlCheckpoints())).append('\n');
        }
        return sb.toString();
    }

    private String toJson(ExecutionPlan plan) {
        try {
            return objectMapper.writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize execution plan: " + e.getMessage(), e);
        }
    }
}
