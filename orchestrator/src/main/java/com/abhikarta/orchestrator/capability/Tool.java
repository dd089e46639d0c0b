package com.abhikarta.orchestrator.capability;

import java.util.Map;

/**
 * A tool capability that workflow nodes of type {@code tool} dispatch to.
 *
 * Same result contract as {@link Agent#execute}: a {@code success: false}
 * map or an exception marks the node failed.
 */
public interface Tool {

    String toolName();

    String description();

    Map<String, Object> execute(Map<String, Object> arguments);
}
