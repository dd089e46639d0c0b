package com.abhikarta.orchestrator.service;

import com.abhikarta.orchestrator.graph.Graph;
import com.abhikarta.orchestrator.graph.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.DataBindingPropertyAccessor;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evaluates plan step conditions and loop continue-conditions.
 *
 * Expressions are SpEL, run in a {@link SimpleEvaluationContext}: map and
 * read-only bean property access only, no type references, no constructors,
 * no assignment. Variables:
 * <pre>
 *   #results    step id → result map (completed steps only)
 *   #status     step id → status name
 *   #iteration  loop passes completed so far
 * </pre>
 * Example: {@code #results['check']['words'] > 3 and #status['fetch'] == 'COMPLETED'}
 *
 * A blank expression is true. An expression that fails to parse or evaluate,
 * or yields anything but {@code true}, is false.
 */
@Component
public class StepConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(StepConditionEvaluator.class);

    private final ExpressionParser parser = new SpelExpressionParser();

    public boolean evaluate(String expression, Graph graph, int iteration) {
        if (expression == null || expression.isBlank()) {
            return true;
        }
        Map<String, Object> results = new LinkedHashMap<>();
        Map<String, String> status  = new LinkedHashMap<>();
        for (Node node : graph.nodes()) {
            status.put(node.getNodeId(), node.getStatus().name());
            if (node.getResult() != null) {
                results.put(node.getNodeId(), node.getResult());
            }
        }

        SimpleEvaluationContext context = SimpleEvaluationContext
                .forPropertyAccessors(new MapAccessor(), DataBindingPropertyAccessor.forReadOnlyAccess())
                .build();
        context.setVariable("results", results);
        context.setVariable("status", status);
        context.setVariable("iteration", iteration);

        try {
            Expression parsed = parser.parseExpression(expression);
            return Boolean.TRUE.equals(parsed.getValue(context, Boolean.class));
        } catch (RuntimeException e) {
            log.warn("Condition '{}' could not be evaluated, treating as false: {}", expression, e.getMessage());
            return false;
        }
    }
}
