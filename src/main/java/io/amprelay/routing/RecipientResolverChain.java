package io.amprelay.routing;

import io.amprelay.agent.AgentRecord;
import io.amprelay.storage.AgentStore;

import java.util.List;
import java.util.Optional;

public final class RecipientResolverChain {
    private final AgentStore agents;
    private final List<RecipientResolver> resolvers;

    public RecipientResolverChain(AgentStore agents, List<RecipientResolver> resolvers) {
        this.agents = agents;
        this.resolvers = List.copyOf(resolvers);
    }

    public Optional<AgentRecord> resolve(String identifier) {
        return resolve(identifier, agents.list());
    }

    public Optional<AgentRecord> resolve(String identifier, List<AgentRecord> directory) {
        for (RecipientResolver resolver : resolvers) {
            Optional<AgentRecord> found = resolver.resolve(identifier, directory);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    public List<RecipientResolver> resolvers() {
        return resolvers;
    }
}
