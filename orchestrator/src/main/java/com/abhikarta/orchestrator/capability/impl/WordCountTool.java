package com.abhikarta.orchestrator.capability.impl;

import com.abhikarta.orchestrator.capability.Tool;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class WordCountTool implements Tool {

    @Override public String toolName()    { return "word_count"; }
    @Override public String description() { return "Counts words and characters in 'text'."; }

    @Override
    public Map<String, Object> execute(Map<String, Object> arguments) {
        Object text = arguments.get("text");
        if (text == null) {
            return Map.of("success", false, "error", "Missing required argument 'text'");
        }
        String s = text.toString();
        String trimmed = s.trim();
        int words = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("words", words);
        result.put("characters", s.length());
        return result;
    }
}
