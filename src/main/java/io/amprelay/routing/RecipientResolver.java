package io.amprelay.routing;

import io.amprelay.agent.AgentRecord;

import java.util.List;
import java.util.Optional;

public interface RecipientResolver {
    String name();

    Optional<AgentRecord> resolve(String identifier, List<AgentRecord> agents);
}
