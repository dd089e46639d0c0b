package com.abhikarta.orchestrator.service;

import com.abhikarta.orchestrator.capability.Agent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Test agent that echoes like echo_agent and remembers every call, in order,
 * in a journal shared between agents.
 */
class RecordingAgent implements Agent {

    record Call(String agentId, Map<String, Object> input) {}

    private final String id;
    private final boolean fails;
    private final List<Call> journal;

    RecordingAgent(String id, boolean fails, List<Call> journal) {
        this.id      = id;
        this.fails   = fails;
        this.journal = journal;
    }

    static List<Call> journal() {
        return new ArrayList<>();
    }

    @Override public String agentId()     { return id; }
    @Override public String name()        { return id; }
    @Override public String description() { return "records calls"; }

    @Override
    public Map<String, Object> execute(Map<String, Object> input) {
        journal.add(new Call(id, Map.copyOf(input)));
        Map<String, Object> result = new LinkedHashMap<>();
        if (fails) {
            result.put("success", false);
            result.put("error", id + " failed on purpose");
            return result;
        }
        result.put("success", true);
        result.put("echo", input.getOrDefault("input", "No input provided"));
        result.put("agent", id);
        return result;
    }
}
