package com.abhikarta.orchestrator.capability;

import java.util.List;

/**
 * What the planner and the API see of a registered agent or tool.
 *
 * @param id           agent id or tool name
 * @param kind         "agent" or "tool"
 * @param name         display name
 * @param description  one-line description shown to the planner
 * @param capabilities free-form capability tags (agents only)
 */
public record CapabilityDescriptor(
        String       id,
        String       kind,
        String       name,
        String       description,
        List<String> capabilities) {}
