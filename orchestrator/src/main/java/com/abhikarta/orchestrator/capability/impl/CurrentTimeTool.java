package com.abhikarta.orchestrator.capability.impl;

import com.abhikarta.orchestrator.capability.Tool;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class CurrentTimeTool implements Tool {

    private final Clock clock;

    public CurrentTimeTool() {
        this(Clock.systemUTC());
    }

    CurrentTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override public String toolName()    { return "current_time"; }
    @Override public String description() { return "Returns the current UTC time."; }

    @Override
    public Map<String, Object> execute(Map<String, Object> arguments) {
        Instant now = clock.instant();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("iso", now.toString());
        result.put("epoch_millis", now.toEpochMilli());
        return result;
    }
}
