package com.abhikarta.orchestrator.capability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * All {@link Tool} beans, keyed by tool name.
 */
@Component
public class ToolRegistry extends CapabilityRegistry<Tool> {

    public ToolRegistry(List<Tool> tools, MeterRegistry meterRegistry) {
        super("tool", tools, meterRegistry);
    }

    @Override
    protected String idOf(Tool tool) {
        return tool.toolName();
    }

    @Override
    protected CapabilityDescriptor describe(Tool tool) {
        return new CapabilityDescriptor(tool.toolName(), "tool", tool.toolName(),
                tool.description(), List.of());
    }

    @Override
    protected Map<String, Object> invoke(Tool tool, Map<String, Object> arguments) {
        return tool.execute(arguments);
    }
}
