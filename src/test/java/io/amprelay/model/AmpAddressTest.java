package io.amprelay.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class AmpAddressTest {

    @Test
    void parsesOrganizationScopeAndProvider() {
        AmpAddress simple = AmpAddress.parse("alice@acme.aimaestro.local").orElseThrow();
        Assertions.assertEquals("alice", simple.name());
        Assertions.assertEquals("acme", simple.organization());
        Assertions.assertNull(simple.scope());
        Assertions.assertEquals("aimaestro.local", simple.provider());

        AmpAddress scoped = AmpAddress.parse("bob@team.eng.corp.example.com").orElseThrow();
        Assertions.assertEquals("team", scoped.organization());
        Assertions.assertEquals("eng.corp", scoped.scope());
        Assertions.assertEquals("example.com", scoped.provider());
    }

    @Test
    void toStringReconstructsTheAddress() {
        for (String raw : List.of("alice@acme.aimaestro.local", "bob@team.eng.corp.example.com", "x-1@o.p.q")) {
            Assertions.assertEquals(raw, AmpAddress.parse(raw).orElseThrow().toString());
        }
    }

    @Test
    void rejectsMalformedAddresses() {
        for (String raw : List.of(
                "",
                "alice",
                "@acme.aimaestro.local",
                "alice@@acme.aimaestro.local",
                "alice@bob@acme.aimaestro.local",
                "alice@aimaestro.local",
                "alice@acme..local",
                "al ice@acme.aimaestro.local",
                "alice@acme.aimaestro.local."
        )) {
            Assertions.assertTrue(AmpAddress.parse(raw).isEmpty(), raw);
            Assertions.assertFalse(AmpAddress.isValid(raw), raw);
        }
        Assertions.assertTrue(AmpAddress.parse(null).isEmpty());
    }

    @Test
    void localProvidersAreRoutedLocally() {
        Assertions.assertTrue(AmpAddress.parse("a@o.anything.local").orElseThrow().isLocalTo("aimaestro.local"));
        Assertions.assertTrue(AmpAddress.parse("a@o.crabmail.ai").orElseThrow().isLocalTo("CrabMail.ai"));
        Assertions.assertFalse(AmpAddress.parse("a@o.crabmail.ai").orElseThrow().isLocalTo("aimaestro.local"));
    }

    @Test
    void priorityParsingDefaultsToNormalAndRejectsUnknownValues() {
        Assertions.assertEquals(Priority.NORMAL, Priority.fromString(null));
        Assertions.assertEquals(Priority.URGENT, Priority.fromString("URGENT"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Priority.fromString("critical"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> PayloadType.fromString("chat"));
    }
}
