package com.abhikarta.orchestrator.capability.impl;

import com.abhikarta.orchestrator.capability.Agent;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Returns its {@code input} entry unchanged. Used for smoke tests and sample DAGs. */
@Component
public class EchoAgent implements Agent {

    public static final String ID = "echo_agent";

    @Override public String agentId()     { return ID; }
    @Override public String name()        { return "Echo Agent"; }
    @Override public String description() { return "Echoes the 'input' field back to the caller."; }
    @Override public List<String> capabilities() { return List.of("echo", "testing"); }

    @Override
    public Map<String, Object> execute(Map<String, Object> input) {
        Object value = input.get("input");
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("echo", value == null ? "No input provided" : value);
        result.put("agent", ID);
        return result;
    }
}
