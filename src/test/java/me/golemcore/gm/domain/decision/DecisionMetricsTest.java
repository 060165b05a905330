package me.golemcore.gm.domain.decision;

import me.golemcore.gm.domain.model.ActionOutcome;
import me.golemcore.gm.domain.model.ActionResult;
import me.golemcore.gm.domain.model.ActionType;
import me.golemcore.gm.domain.model.DecisionPriority;
import me.golemcore.gm.domain.model.DecisionResult;
import me.golemcore.gm.domain.model.DecisionStats;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DecisionMetricsTest {

    private static DecisionResult result(DecisionPriority priority, ActionOutcome outcome) {
        return DecisionResult.builder()
                .priorityUsed(priority)
                .actionResult(ActionResult.builder().outcome(outcome).actionType(ActionType.PARSED_COMMAND).build())
                .build();
    }

    @Test
    void shouldStartWithZeroedCountersForEveryBucket() {
        DecisionStats stats = new DecisionMetrics().snapshot();

        assertEquals(0, stats.totalDecisions());
        assertEquals(DecisionPriority.values().length, stats.priorityUsage().size());
        assertEquals(ActionOutcome.values().length, stats.actionOutcomes().size());
        assertEquals(0.0, stats.successRate());
    }

    @Test
    void shouldCountPriorityAndOutcomeOncePerDecision() {
        DecisionMetrics metrics = new DecisionMetrics();
        metrics.record(result(DecisionPriority.PARSED_COMMAND, ActionOutcome.SUCCESS));
        metrics.record(result(DecisionPriority.PARSED_COMMAND, ActionOutcome.FAILURE));
        metrics.record(result(DecisionPriority.FALLBACK, ActionOutcome.REQUIRES_FOLLOWUP));
        metrics.recordCollaboratorFailure();

        DecisionStats stats = metrics.snapshot();
        assertEquals(3, stats.totalDecisions());
        assertEquals(2, stats.priorityCount(DecisionPriority.PARSED_COMMAND));
        assertEquals(1, stats.priorityCount(DecisionPriority.FALLBACK));
        assertEquals(1, stats.outcomeCount(ActionOutcome.SUCCESS));
        assertEquals(1, stats.collaboratorFailures());
        assertEquals(1.0 / 3, stats.successRate(), 1e-9);
    }

    @Test
    void shouldReturnDetachedSnapshot() {
        DecisionMetrics metrics = new DecisionMetrics();
        DecisionStats before = metrics.snapshot();
        metrics.record(result(DecisionPriority.FALLBACK, ActionOutcome.INVALID));

        assertEquals(0, before.totalDecisions());
        assertEquals(0, before.outcomeCount(ActionOutcome.INVALID));
        assertThrows(UnsupportedOperationException.class,
                () -> before.priorityUsage().put(DecisionPriority.FALLBACK, 9L));
    }
}
