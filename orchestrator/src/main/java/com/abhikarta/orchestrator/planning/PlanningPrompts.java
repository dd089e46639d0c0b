package com.abhikarta.orchestrator.planning;

import com.abhikarta.orchestrator.capability.CapabilityDescriptor;
import com.abhikarta.orchestrator.dag.DagSummary;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompts for the three planner decisions: analyze, decide, construct.
 *
 * Each prompt names the exact JSON shape the matching {@link PlanResponseParser}
 * method binds. Placeholders in {{DOUBLE_BRACES}} are substituted per call.
 */
public final class PlanningPrompts {

    private PlanningPrompts() {}

    public static String analyzeRequest(String request) {
        return ANALYZE_PROMPT.replace("{{REQUEST}}", request);
    }

    public static String decideStrategy(String request,
                                        RequestAnalysis analysis,
                                        List<DagSummary> dags,
                                        List<CapabilityDescriptor> agents,
                                        List<CapabilityDescriptor> tools) {
        String dagList = dags.isEmpty()
                ? "No pre-defined DAGs available"
                : dags.stream()
                      .map(d -> "- %s: %s (%d nodes)".formatted(
                              d.dagId(),
                              d.description() == null ? "No description" : d.description(),
                              d.nodeCount()))
                      .collect(Collectors.joining("\n"));

        return DECIDE_PROMPT
                .replace("{{REQUEST}}", request)
                .replace("{{COMPLEXITY}}", analysis.complexity())
                .replace("{{REQUIREMENTS}}", String.join(", ", analysis.keyRequirements()))
                .replace("{{DAGS}}", dagList)
                .replace("{{AGENTS}}", ids(agents))
                .replace("{{TOOLS}}", ids(tools));
    }

    public static String constructPlan(String request,
                                       ExecutionMode mode,
                                       List<CapabilityDescriptor> agents,
                                       List<CapabilityDescriptor> tools) {
        return CONSTRUCT_PROMPT
                .replace("{{REQUEST}}", request)
                .replace("{{MODE}}", mode.value())
                .replace("{{AGENTS}}", describe(agents))
                .replace("{{TOOLS}}", describe(tools));
    }

    private static String ids(List<CapabilityDescriptor> capabilities) {
        return capabilities.stream().map(CapabilityDescriptor::id).collect(Collectors.joining(", "));
    }

    private static String describe(List<CapabilityDescriptor> capabilities) {
        if (capabilities.isEmpty()) return "  (none)";
        return capabilities.stream()
                .map(c -> "  - " + c.id() + ": " + c.description())
                .collect(Collectors.joining("\n"));
    }

    // ------------------------------------------------------------------
    // Prompt templates
    // ------------------------------------------------------------------

    private static final String ANALYZE_PROMPT = """
            Analyze this request and extract what is needed to plan its execution.

            Request: "{{REQUEST}}"

            Respond with a JSON object:
            {
              "intent": "what the user wants to accomplish",
              "complexity": "simple" | "moderate" | "complex",
              "requires_hitl": true | false,
              "key_requirements": ["..."],
              "suggested_approach": "one sentence"
            }

            Respond ONLY with valid JSON.
            """;

    private static final String DECIDE_PROMPT = """
            Choose an execution strategy for this request.

            Request: "{{REQUEST}}"
            Complexity: {{COMPLEXITY}}
            Key requirements: {{REQUIREMENTS}}

            Available DAGs:
            {{DAGS}}

            Available agents: {{AGENTS}}
            Available tools: {{TOOLS}}

            Use an existing DAG only when one clearly matches the request.

            Respond with a JSON object:
            {
              "strategy": "use_existing_dag" | "create_stategraph" | "simple_execution",
              "reasoning": "why",
              "selected_dag_id": "dag id when strategy is use_existing_dag, otherwise null",
              "execution_mode": "sequential" | "parallel" | "conditional" | "loop",
              "estimated_steps": 3
            }

            Respond ONLY with valid JSON.
            """;

    private static final String CONSTRUCT_PROMPT = """
            Create an execution plan for this request.

            Request: "{{REQUEST}}"
            Execution mode: {{MODE}}

            Agents (use the id as agent_id):
            {{AGENTS}}

            Tools (use the id as tool_name):
            {{TOOLS}}

            Rules:
              - Every step uses exactly one of the agents or tools listed above.
              - dependencies lists step_ids that must finish first; no cycles.
              - parallel mode: steps without mutual dependencies run in the same batch.
              - loop mode: set loop_config.max_iterations; loop_config.condition is an
                optional SpEL expression over #results and #status, true to continue.
              - conditional mode: conditional.condition is a SpEL expression over
                #results (step_id -> result map) and #status (step_id -> status);
                when false the step and its listed branches are skipped.
              - Put the step_ids that need human review into hitl_checkpoints.

            Respond with a JSON object:
            {
              "type": "stategraph",
              "execution_mode": "{{MODE}}",
              "steps": [
                {
                  "step_id": "step_1",
                  "name": "Step name",
                  "type": "agent" | "tool",
                  "agent_id": "agent id (agent steps)",
                  "tool_name": "tool name (tool steps)",
                  "input": {},
                  "dependencies": [],
                  "parallel_group": null,
                  "conditional": null,
                  "use_previous_result": false
                }
              ],
              "parallel_groups": {},
              "hitl_checkpoints": [],
              "loop_config": null
            }

            Respond ONLY with valid JSON.
            """;
}
