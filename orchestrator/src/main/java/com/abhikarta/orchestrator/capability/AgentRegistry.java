package com.abhikarta.orchestrator.capability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * All {@link Agent} beans, keyed by agent id.
 *
 * Adding an agent only requires declaring it as a {@code @Component}.
 */
@Component
public class AgentRegistry extends CapabilityRegistry<Agent> {

    public AgentRegistry(List<Agent> agents, MeterRegistry meterRegistry) {
        super("agent", agents, meterRegistry);
    }

    @Override
    protected String idOf(Agent agent) {
        return agent.agentId();
    }

    @Override
    protected CapabilityDescriptor describe(Agent agent) {
        return new CapabilityDescriptor(agent.agentId(), "agent", agent.name(),
                agent.description(), List.copyOf(agent.capabilities()));
    }

    @Override
    protected Map<String, Object> invoke(Agent agent, Map<String, Object> input) {
        return agent.execute(input);
    }
}
