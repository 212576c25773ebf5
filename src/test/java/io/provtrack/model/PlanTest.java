package io.provtrack.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

final class PlanTest {

    @Test
    void argvPutsPositionedSlotsAfterCommand() {
        Plan plan = Plan.builder()
                .command("python train.py")
                .output("model out.bin", "--out ", 3, false)
                .input("data.csv", "--data=", 1)
                .parameter("0.5", "--rate ", 2)
                .input("unpositioned.txt")
                .build();

        Assertions.assertEquals(
                List.of("python", "train.py", "--data=data.csv", "--rate", "0.5", "--out", "\"model out.bin\""),
                plan.toArgv());
    }

    @Test
    void similarityIgnoresIdsAndSlotOrder() {
        Plan first = Plan.builder()
                .command("cat")
                .input("a.txt", null, 1)
                .input("b.txt", null, 2)
                .output("out.txt")
                .parameter("-n", null, 0)
                .build();
        Plan second = Plan.builder()
                .command("cat")
                .input("b.txt", null, 2)
                .input("a.txt", null, 1)
                .output("out.txt")
                .parameter("-n", null, 0)
                .build();

        Assertions.assertNotEquals(first.id(), second.id());
        Assertions.assertTrue(first.isSimilarTo(second));
        Assertions.assertTrue(second.isSimilarTo(first));
    }

    @Test
    void differentCommandOrPathsAreNotSimilar() {
        Plan base = Plan.builder().command("cat").input("a.txt").output("out.txt").build();

        Assertions.assertFalse(base.isSimilarTo(Plan.builder().command("tac").input("a.txt").output("out.txt").build()));
        Assertions.assertFalse(base.isSimilarTo(Plan.builder().command("cat").input("b.txt").output("out.txt").build()));
        Assertions.assertFalse(base.isSimilarTo(Plan.builder().command("cat").input("a.txt").output("x.txt").build()));
        Assertions.assertFalse(base.isSimilarTo(Plan.builder()
                .command("cat").input("a.txt").output("out.txt").successCodes(List.of(0, 1)).build()));
    }

    @Test
    void generatedNameIsShortAndSafe() {
        Plan plan = Plan.builder()
                .command("python scripts/a-very-long-script-name.py")
                .input("data/in.csv", null, 1)
                .build();

        Assertions.assertTrue(plan.name().length() <= Plan.MAX_GENERATED_NAME_LENGTH, plan.name());
        Assertions.assertTrue(plan.name().startsWith("python-scripts_a-ve"), plan.name());
        Assertions.assertTrue(plan.name().matches("[A-Za-z0-9_.-]+"), plan.name());
        Assertions.assertEquals("explicit", Plan.builder().name("explicit").command("ls").build().name());
    }

    @Test
    void slotIdsFollowThePlanId() {
        Plan plan = Plan.builder().command("cp").input("a", null, 1).output("b", null, 2, false).build();
        String oldId = plan.id();
        Assertions.assertEquals(oldId + "/inputs/1", plan.inputs().get(0).id());
        Assertions.assertEquals(oldId + "/outputs/2", plan.outputs().get(0).id());

        plan.assignNewId();
        Assertions.assertNotEquals(oldId, plan.id());
        Assertions.assertTrue(plan.id().startsWith("/plans/"));
        Assertions.assertEquals(plan.id() + "/inputs/1", plan.inputs().get(0).id());
        Assertions.assertEquals(plan.id() + "/outputs/2", plan.outputs().get(0).id());
        Assertions.assertNull(plan.oid());
    }

    @Test
    void deriveCopiesUnderNewId() {
        Plan plan = Plan.builder().command("wc -l").input("a.txt", null, 1).keyword("count").build();
        Plan derived = plan.derive();

        Assertions.assertNotEquals(plan.id(), derived.id());
        Assertions.assertEquals(plan.id(), derived.derivedFrom());
        Assertions.assertTrue(derived.isSimilarTo(plan));
        Assertions.assertEquals(List.of("count"), derived.keywords());
        Assertions.assertEquals(derived.id() + "/inputs/1", derived.inputs().get(0).id());
    }

    @Test
    void invalidationIsRecorded() {
        Plan plan = Plan.builder().command("ls").build();
        Assertions.assertFalse(plan.isInvalidated());
        Instant at = Instant.parse("2024-01-01T00:00:00Z");
        plan.invalidate(at);
        Assertions.assertTrue(plan.isInvalidated());
        Assertions.assertEquals(at, plan.invalidatedAt());
        Assertions.assertEquals(List.of(0), plan.successCodes());
    }

    @Test
    void planNeedsCommandOrSlots() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> Plan.builder().build());
        Assertions.assertThrows(IllegalArgumentException.class, () -> Plan.builder().command("x").input(" ").build());
    }
}
