package me.golemcore.gm.domain.service;

import me.golemcore.gm.domain.decision.DecisionEngine;
import me.golemcore.gm.domain.model.ActionOutcome;
import me.golemcore.gm.domain.model.ActionResult;
import me.golemcore.gm.domain.model.ActionType;
import me.golemcore.gm.domain.model.DecisionContext;
import me.golemcore.gm.domain.model.DecisionPriority;
import me.golemcore.gm.domain.model.DecisionResult;
import me.golemcore.gm.domain.model.GameContext;
import me.golemcore.gm.domain.pacing.PacingIntegration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GameMasterServiceTest {

    private DecisionEngine decisionEngine;
    private PacingIntegration pacingIntegration;
    private GameMasterService service;
    private DecisionResult result;

    @BeforeEach
    void setUp() {
        decisionEngine = mock(DecisionEngine.class);
        pacingIntegration = mock(PacingIntegration.class);
        service = new GameMasterService(decisionEngine, pacingIntegration);
        result = DecisionResult.builder()
                .priorityUsed(DecisionPriority.PARSED_COMMAND)
                .actionResult(ActionResult.builder()
                        .outcome(ActionOutcome.SUCCESS)
                        .actionType(ActionType.PARSED_COMMAND)
                        .build())
                .build();
    }

    @Test
    void shouldStampInputDecideAndUpdatePacingInOrder() {
        DecisionContext context = DecisionContext.builder().sessionId("s1").playerId("p1").rawInput("look").build();
        GameContext scene = GameContext.builder().sessionId("s1").build();
        when(decisionEngine.decide(context)).thenReturn(result);

        DecisionResult handled = service.handleInput(context, scene);

        assertSame(result, handled);
        InOrder order = inOrder(pacingIntegration, decisionEngine);
        order.verify(pacingIntegration).onPlayerInput("s1");
        order.verify(decisionEngine).decide(context);
        order.verify(pacingIntegration).onResponse("s1", "look", result, scene);
    }

    @Test
    void shouldReturnDecisionWhenPacingFails() {
        DecisionContext context = DecisionContext.builder().sessionId("s1").playerId("p1").build();
        when(decisionEngine.decide(context)).thenReturn(result);
        doThrow(new IllegalStateException("ledger broken")).when(pacingIntegration)
                .onResponse(anyString(), anyString(), any(), any());

        assertSame(result, service.handleInput(context, null));
    }

    @Test
    void shouldDelegateMissingContextToEngineWithoutPacing() {
        DecisionResult invalid = DecisionResult.builder()
                .priorityUsed(DecisionPriority.FALLBACK)
                .actionResult(ActionResult.builder().outcome(ActionOutcome.INVALID).actionType(ActionType.ERROR)
                        .build())
                .build();
        when(decisionEngine.decide(null)).thenReturn(invalid);

        assertSame(invalid, service.handleInput(null, null));
        verifyNoInteractions(pacingIntegration);
    }
}
