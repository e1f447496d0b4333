package io.amprelay.routing;

import io.amprelay.agent.AgentRecord;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.BiPredicate;

public final class RecipientResolvers {
    private RecipientResolvers() {
    }

    /**
     * Resolution order used for local recipients: stable id, name, alias,
     * session name, then a single segment of the session name.
     */
    public static List<RecipientResolver> defaults() {
        return List.of(byId(), byName(), byAlias(), bySessionName(), bySessionSegment());
    }

    public static RecipientResolver byId() {
        return matching("id", (identifier, agent) -> identifier.equals(agent.id()));
    }

    public static RecipientResolver byName() {
        return matching("name", (identifier, agent) -> identifier.equalsIgnoreCase(agent.name()));
    }

    public static RecipientResolver byAlias() {
        return matching("alias", (identifier, agent) -> agent.alias() != null && identifier.equalsIgnoreCase(agent.alias()));
    }

    public static RecipientResolver bySessionName() {
        return matching("session", (identifier, agent) -> identifier.equals(agent.sessionName()));
    }

    /**
     * "crm" matches session "23blocks-api-crm".
     */
    public static RecipientResolver bySessionSegment() {
        return matching("session-segment", (identifier, agent) -> {
            if (agent.sessionName() == null || agent.sessionName().isBlank()) {
                return false;
            }
            String wanted = identifier.toLowerCase(Locale.ROOT);
            for (String segment : agent.sessionName().toLowerCase(Locale.ROOT).split("[-_]")) {
                if (!segment.isEmpty() && segment.equals(wanted)) {
                    return true;
                }
            }
            return false;
        });
    }

    private static RecipientResolver matching(String name, BiPredicate<String, AgentRecord> predicate) {
        return new RecipientResolver() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<AgentRecord> resolve(String identifier, List<AgentRecord> agents) {
                if (identifier == null || identifier.isBlank()) {
                    return Optional.empty();
                }
                String trimmed = identifier.trim();
                for (AgentRecord agent : agents) {
                    if (predicate.test(trimmed, agent)) {
                        return Optional.of(agent);
                    }
                }
                return Optional.empty();
            }

            @Override
            public String toString() {
                return "RecipientResolver[" + name + "]";
            }
        };
    }
}
