package com.abhikarta.orchestrator.capability;

import java.util.List;
import java.util.Map;

/**
 * An agent capability that workflow nodes of type {@code agent} dispatch to.
 *
 * Implementations are Spring {@code @Component}s; {@link AgentRegistry}
 * collects them at startup keyed by {@link #agentId()}.
 *
 * The returned map is the node result. A map with {@code success: false}
 * is treated as a failure and its {@code error} entry becomes the node error.
 * Throwing is also a failure. Implementations may be called more than once
 * for the same input (crash recovery is at-least-once).
 */
public interface Agent {

    String agentId();

    String name();

    String description();

    default List<String> capabilities() {
        return List.of();
    }

    Map<String, Object> execute(Map<String, Object> input);
}
