package io.amprelay.cli;

import io.amprelay.agent.AgentRecord;
import io.amprelay.config.AmpRelayConfig;
import io.amprelay.model.Payload;
import io.amprelay.model.PayloadType;
import io.amprelay.model.PeerHost;
import io.amprelay.model.Priority;
import io.amprelay.model.RouteOutcome;
import io.amprelay.peers.PeerSync;
import io.amprelay.routing.RouteRequest;
import io.amprelay.runtime.AmpRuntime;
import io.amprelay.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "amprelay",
        mixinStandardHelpOptions = true,
        description = "AMP agent messaging relay",
        subcommands = {
                AmpRelayCommand.InitCommand.class,
                AmpRelayCommand.ServeCommand.class,
                AmpRelayCommand.AgentRegisterCommand.class,
                AmpRelayCommand.AgentOnlineCommand.class,
                AmpRelayCommand.AgentsCommand.class,
                AmpRelayCommand.KeygenCommand.class,
                AmpRelayCommand.SendCommand.class,
                AmpRelayCommand.PendingCommand.class,
                AmpRelayCommand.AckCommand.class,
                AmpRelayCommand.ExpireRelayCommand.class,
                AmpRelayCommand.InboxCommand.class,
                AmpRelayCommand.IdentityCommand.class,
                AmpRelayCommand.PeersCommand.class,
                AmpRelayCommand.AddPeerCommand.class,
                AmpRelayCommand.SyncPeersCommand.class,
                AmpRelayCommand.AuditTailCommand.class,
                AmpRelayCommand.SchemaMigrationsCommand.class
        }
)
public final class AmpRelayCommand implements Runnable {
    @Option(names = {"--root"}, description = "Relay data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | serve | agent-register | agent-online | agents | keygen | send | pending | ack | expire-relay | inbox | identity | peers | add-peer | sync-peers | audit-tail | schema-migrations");
    }

    AmpRuntime runtime() {
        AmpRuntime runtime = new AmpRuntime(AmpRelayConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    static AgentRecord requireAgent(AmpRuntime runtime, String name) {
        return runtime.findAgent(name).orElseThrow(() -> new IllegalArgumentException("Unknown agent: " + name));
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        AmpRelayCommand parent;

        @Override
        public Integer call() {
            try (AmpRuntime runtime = parent.runtime()) {
                System.out.println("Initialized AMP relay at: " + runtime.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "serve", description = "Serve the AMP HTTP API")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        AmpRelayCommand parent;

        @Option(names = {"--port"}, defaultValue = "23000", description = "Bind port")
        int port;

        @Override
        public Integer call() throws Exception {
            AmpRuntime runtime = parent.runtime();
            AmpHttpServer server = AmpHttpServer.start(runtime, port);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.stop(1);
                runtime.close();
            }, "amprelay-shutdown"));
            System.out.println("AMP relay " + runtime.settings().hostId() + " listening on http://127.0.0.1:" + port);
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "agent-register", description = "Register a local agent and print its API key")
    static final class AgentRegisterCommand implements Callable<Integer> {
        @ParentCommand
        AmpRelayCommand parent;

        @Parameters(index = "0", description = "Agent name")
        String name;

        @Option(names = {"--alias"}, description = "Display alias")
        String alias;

        @Option(names = {"--session"}, description = "Terminal session name")
        String session;

        @Option(names = {"--online"}, defaultValue = "false", description = "Mark the agent online immediately")
        boolean online;

        @Override
        public Integer call() {
            try (AmpRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.registerAgent(name, alias, session, online)));
            }
            return 0;
        }
    }

    @Command(name = "agent-online", description = "Set an agent's delivery channel online or offline")
    static final class AgentOnlineCommand implements Callable<Integer> {
        @ParentCommand
        AmpRelayCommand parent;

        @Parameters(index = "0", description = "Agent name")
        String name;

        @Option(names = {"--offline"}, defaultValue = "false", description = "Mark offline instead")
        boolean offline;

        @Override
        public Integer call() {
            try (AmpRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.setOnline(name, !offline)));
            }
            return 0;
        }
    }

    @Command(name = "agents", description = "List local agents")
    static final class AgentsCommand implements Callable<Integer> {
        @ParentCommand
        AmpRelayCommand parent;

        @Override
        public Integer call() {
            try (AmpRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.listAgents()));
            }
            return 0;
        }
    }

    @Command(name = "keygen", description = "Revoke an agent's API keys and issue a new one")
    static final class KeygenCommand implements Callable<Integer> {
        @ParentCommand
        AmpRelayCommand parent;

        @Parameters(index = "0", description = "Agent name")
        String name;

        @Option(names = {"--test"}, defaultValue = "false", description = "Issue a test key instead of a live key")
        boolean test;

        @Override
        public Integer call() {
            try (AmpRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(Map.of("agent", name, "api_key", runtime.rotateApiKey(name, !test))));
            }
            return 0;
        }
    }

    @Command(name = "send", description = "Route a message from a local agent")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        AmpRelayCommand parent;

        @Option(names = {"--from"}, required = true, description = "Sending agent name")
        String from;

        @Option(names = {"--to"}, required = true, description = "Recipient address name@organization.provider")
        String to;

        @Option(names = {"--subject"}, required = true, description = "Subject line")
        String subject;

        @Option(names = {"--message"}, required = true, description = "Message text")
        String message;

        @Option(names = {"--type"}, defaultValue = "notification", description = "request|response|notification|update|system")
        String type;

        @Option(names = {"--priority"}, defaultValue = "normal", description = "low|normal|high|urgent")
        String priority;

        @Option(names = {"--in-reply-to"}, description = "Message id this one answers")
        String inReplyTo;

        @Override
        public Integer call() {
            try (AmpRuntime runtime = parent.runtime()) {
                RouteOutcome outcome = runtime.route(requireAgent(runtime, from), new RouteRequest(
                        to,
                        subject,
                        Payload.of(PayloadType.fromString(type), message),
                        Priority.fromString(priority),
                        inReplyTo
                ));
                System.out.println(Jsons.toJson(outcome.isRejected() ? outcome.error() : outcome));
                return outcome.isRejected() ? 1 : 0;
            }
        }
    }

    @Command(name = "pending", description = "List messages held in the relay queue for an agent")
    static final class PendingCommand implements Callable<Integer> {
        @ParentCommand
        AmpRelayCommand parent;

        @Parameters(index = "0", description = "Agent name")
        String name;

        @Option(names = {"--limit"}, defaultValue = "10", description = "Maximum messages to return (max 100)")
        int limit;

        @Override
        public Integer call() {
            try (AmpRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.pending(requireAgent(runtime, name), limit)));
            }
            return 0;
        }
    }

    @Command(name = "ack", description = "Acknowledge relayed messages")
    static final class AckCommand implements Callable<Integer> {
        @ParentCommand
        AmpRelayCommand parent;

        @Parameters(index = "0", description = "Agent name")
        String name;

        @Parameters(index = "1..*", arity = "1..*", description = "Message ids")
        List<String> ids;

        @Override
        public Integer call() {
            try (AmpRuntime runtime = parent.runtime()) {
                int acknowledged = runtime.acknowledgeBatch(requireAgent(runtime, name), ids);
                System.out.println(Jsons.toJson(Map.of("acknowledged", acknowledged)));
            }
            return 0;
        }
    }

    @Command(name = "inbox", description = "Print messages delivered to an agent's inbox")
    static final class InboxCommand implements Callable<Integer> {
        @ParentCommand
        AmpRelayCommand parent;

        @Parameters(index = "0", description = "Agent name")
        String name;

        @Override
        public Integer call() {
            try (AmpRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.inbox(name)));
            }
            return 0;
        }
    }

    @Command(name = "identity", description = "Print this host's identity")
    static final class IdentityCommand implements Callable<Integer> {
        @ParentCommand
        AmpRelayCommand parent;

        @Override
        public Integer call() {
            try (AmpRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(Map.of("host", runtime.identity(null, null))));
            }
            return 0;
        }
    }

    @Command(name = "peers", description = "List known peer hosts")
    static final class PeersCommand implements Callable<Integer> {
        @ParentCommand
        AmpRelayCommand parent;

        @Override
        public Integer call() {
            try (AmpRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.listPeers()));
            }
            return 0;
        }
    }

    @Command(name = "add-peer", description = "Add a peer host and synchronize with it")
    static final class AddPeerCommand implements Callable<Integer> {
        @ParentCommand
        AmpRelayCommand parent;

        @Option(names = {"--id"}, required = true, description = "Peer host id")
        String id;

        @Option(names = {"--url"}, required = true, description = "Peer base url")
        String url;

        @Option(names = {"--name"}, description = "Display name (defaults to id)")
        String name;

        @Option(names = {"--alias"}, split = ",", description = "Aliases, comma-separated")
        List<String> aliases;

        @Option(names = {"--description"}, description = "Description")
        String description;

        @Override
        public Integer call() {
            try (AmpRuntime runtime = parent.runtime()) {
                PeerSync.SyncResult result = runtime.addPeerWithSync(PeerHost.descriptor(id, name, url, aliases, description));
                System.out.println(Jsons.toJson(result));
                return result.success() ? 0 : 1;
            }
        }
    }

    @Command(name = "sync-peers", description = "Re-register with every known peer and learn their peers")
    static final class SyncPeersCommand implements Callable<Integer> {
        @ParentCommand
        AmpRelayCommand parent;

        @Override
        public Integer call() {
            try (AmpRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.syncPeers()));
            }
            return 0;
        }
    }

    @Command(name = "audit-tail", description = "Print the most recent audit rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        AmpRelayCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Rows to print")
        int limit;

        @Override
        public Integer call() {
            try (AmpRuntime runtime = parent.runtime()) {
                runtime.auditTail(limit).forEach(System.out::println);
            }
            return 0;
        }
    }

    @Command(name = "expire-relay", description = "Delete relay entries past their expiry")
    static final class ExpireRelayCommand implements Callable<Integer> {
        @ParentCommand
        AmpRelayCommand parent;

        @Override
        public Integer call() {
            try (AmpRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(Map.of("expired", runtime.expireRelay())));
            }
            return 0;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        AmpRelayCommand parent;

        @Override
        public Integer call() {
            try (AmpRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.schemaMigrations()));
            }
            return 0;
        }
    }
}
