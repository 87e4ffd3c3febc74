package com.switchyard.core.orchestrator;

import com.switchyard.core.model.AgentCategory;

/**
 * An {@link AgentHandler} that knows its own category. Spring beans of this type are
 * registered with the orchestrator at startup.
 */
public interface CategorizedAgent extends AgentHandler {
    AgentCategory category();
}
