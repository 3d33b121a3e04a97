package com.claim.traversal.liveness;

import com.claim.traversal.core.model.Claim;
import com.claim.traversal.core.model.ConflictOption;
import com.claim.traversal.core.model.ForcingPoint;
import com.claim.traversal.core.model.ForcingPointType;
import com.claim.traversal.state.TraversalState;
import com.claim.traversal.state.TraversalStateMachine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LivenessEvaluator Tests")
class LivenessEvaluatorTest {

    private final Claim a = Claim.of("A", "Label A");
    private final Claim b = Claim.of("B", "Label B");
    private final Claim c = Claim.of("C", "Label C");
    private final List<Claim> claims = List.of(a, b, c);

    private static ForcingPoint conditional(String id, String... affected) {
        return ForcingPoint.builder()
                .id(id)
                .type(ForcingPointType.CONDITIONAL)
                .tier(0)
                .question(id + "?")
                .condition(id + "?")
                .affectedClaims(List.of(affected))
                .build();
    }

    private static ForcingPoint conflict(Claim x, Claim y, String... gates) {
        return ForcingPoint.builder()
                .id("fp_conflict_" + x.getId() + "::" + y.getId())
                .type(ForcingPointType.CONFLICT)
                .tier(1)
                .question("Choose")
                .condition(x.getLabel() + " vs " + y.getLabel())
                .options(List.of(ConflictOption.of(x), ConflictOption.of(y)))
                .blockedByGateIds(List.of(gates))
                .build();
    }

    @Nested
    @DisplayName("Conditionals")
    class Conditionals {

        @Test
        @DisplayName("Unresolved conditional with an active claim is live")
        void liveWhileUnresolved() {
            ForcingPoint g1 = conditional("g1", "A");
            TraversalState state = TraversalStateMachine.initTraversalState(claims);

            assertEquals(List.of(g1), LivenessEvaluator.getLiveForcingPoints(List.of(g1), state));
            assertFalse(LivenessEvaluator.isTraversalComplete(List.of(g1), state));
        }

        @Test
        @DisplayName("Conditional whose claims are all pruned is no longer live")
        void deadWhenAllAffectedPruned() {
            ForcingPoint g1 = conditional("g1", "A", "B");
            ForcingPoint g2 = conditional("g2", "A");
            List<ForcingPoint> fps = List.of(g1, g2);

            TraversalState state = TraversalStateMachine.resolveConditional(
                    TraversalStateMachine.initTraversalState(claims), "g1", g1, false);

            assertTrue(LivenessEvaluator.getLiveForcingPoints(fps, state).isEmpty());
            assertTrue(LivenessEvaluator.isTraversalComplete(fps, state));
        }

        @Test
        @DisplayName("Conditional over claims unknown to the state is not live")
        void unknownClaimsAreNotActive() {
            ForcingPoint g1 = conditional("g1", "Z");

            assertTrue(LivenessEvaluator.isTraversalComplete(List.of(g1),
                    TraversalStateMachine.initTraversalState(claims)));
        }
    }

    @Nested
    @DisplayName("Conflicts")
    class Conflicts {

        @Test
        @DisplayName("Ungated conflict is live and completes once chosen")
        void ungatedConflict() {
            ForcingPoint ab = conflict(a, b);
            List<ForcingPoint> fps = List.of(ab);
            TraversalState state = TraversalStateMachine.initTraversalState(List.of(a, b));

            assertEquals(List.of(ab), LivenessEvaluator.getLiveForcingPoints(fps, state));

            TraversalState chosen = TraversalStateMachine.resolveConflict(state, ab.getId(), ab, "A", "Label A");

            assertTrue(chosen.isPruned("B"));
            assertTrue(LivenessEvaluator.isTraversalComplete(fps, chosen));
        }

        @Test
        @DisplayName("Any live conditional holds back every conflict")
        void conditionalsClearFirst() {
            ForcingPoint g1 = conditional("g1", "C");
            ForcingPoint ab = conflict(a, b);
            List<ForcingPoint> fps = List.of(g1, ab);
            TraversalState state = TraversalStateMachine.initTraversalState(claims);

            assertEquals(List.of(g1), LivenessEvaluator.getLiveForcingPoints(fps, state));

            TraversalState answered = TraversalStateMachine.resolveConditional(state, "g1", g1, true);

            assertEquals(List.of(ab), LivenessEvaluator.getLiveForcingPoints(fps, answered));
        }

        @Test
        @DisplayName("Gated conflict waits for a satisfied gate")
        void gateSatisfied() {
            ForcingPoint g1 = conditional("g1", "A");
            ForcingPoint ab = conflict(a, b, "g1");
            List<ForcingPoint> fps = List.of(g1, ab);
            TraversalState state = TraversalStateMachine.initTraversalState(claims);

            assertTrue(LivenessEvaluator.isBlockedByGate(ab, state));
            assertEquals(List.of(g1), LivenessEvaluator.getLiveForcingPoints(fps, state));

            TraversalState satisfied = TraversalStateMachine.resolveConditional(state, "g1", g1, true);

            assertFalse(LivenessEvaluator.isBlockedByGate(ab, satisfied));
            assertEquals(List.of(ab), LivenessEvaluator.getLiveForcingPoints(fps, satisfied));
        }

        @Test
        @DisplayName("Failed gate resolves the conflict by cascading pruning")
        void gateUnsatisfied() {
            ForcingPoint g1 = conditional("g1", "A");
            ForcingPoint ab = conflict(a, b, "g1");
            List<ForcingPoint> fps = List.of(g1, ab);

            TraversalState failed = TraversalStateMachine.resolveConditional(
                    TraversalStateMachine.initTraversalState(claims), "g1", g1, false);

            assertEquals(1, LivenessEvaluator.activeOptionCount(ab, failed));
            assertTrue(LivenessEvaluator.getLiveForcingPoints(fps, failed).isEmpty());
            assertTrue(LivenessEvaluator.isTraversalComplete(fps, failed));
        }

        @Test
        @DisplayName("A gate that was never extracted blocks forever")
        void unknownGateBlocks() {
            ForcingPoint ab = conflict(a, b, "missing");
            TraversalState state = TraversalStateMachine.initTraversalState(claims);

            assertTrue(LivenessEvaluator.getLiveForcingPoints(List.of(ab), state).isEmpty());
        }

        @Test
        @DisplayName("A conflict resolution does not count as a satisfied gate")
        void conflictResolutionIsNotAGate() {
            ForcingPoint bc = conflict(b, c);
            ForcingPoint ab = conflict(a, b, bc.getId());
            TraversalState state = TraversalStateMachine.resolveConflict(
                    TraversalStateMachine.initTraversalState(claims), bc.getId(), bc, "B", "Label B");

            assertTrue(LivenessEvaluator.isBlockedByGate(ab, state));
        }
    }
}
