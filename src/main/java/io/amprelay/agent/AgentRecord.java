package io.amprelay.agent;

public record AgentRecord(
        String id,
        String name,
        String alias,
        String sessionName,
        String organization,
        boolean online,
        long createdAtMs
) {
    public String address(String provider) {
        return name + "@" + organization + "." + provider;
    }
}
