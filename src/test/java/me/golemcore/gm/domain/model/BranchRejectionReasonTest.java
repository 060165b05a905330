package me.golemcore.gm.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BranchRejectionReasonTest {

    @Test
    void shouldMapKnownValues() {
        assertEquals(BranchRejectionReason.ALREADY_ACTIVE, BranchRejectionReason.fromValue("already_active"));
        assertEquals(BranchRejectionReason.PLAYER_STATE_BLOCKING,
                BranchRejectionReason.fromValue(" PLAYER_STATE_BLOCKING "));
    }

    @Test
    void shouldDefaultUnknownValuesToConditionsNotMet() {
        assertEquals(BranchRejectionReason.CONDITIONS_NOT_MET, BranchRejectionReason.fromValue("moon_phase"));
        assertEquals(BranchRejectionReason.CONDITIONS_NOT_MET, BranchRejectionReason.fromValue(null));
    }
}
