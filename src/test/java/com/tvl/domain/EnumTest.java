package com.tvl.domain;

import com.tvl.domain.exception.ErrorCategory;
import com.tvl.domain.exception.LedgerErrorCode;
import com.tvl.domain.model.Role;
import com.tvl.domain.model.ScheduleStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for domain enums
 */
class EnumTest {

    @Test
    void testRole() {
        assertEquals(Role.ADMIN, Role.fromValue("ADMIN"));
        assertEquals(Role.VESTING_ADMIN, Role.fromValue("vesting_admin"));
        assertEquals(Role.MANUAL_UNLOCK, Role.fromValue("MANUAL_UNLOCK"));
        assertTrue(Role.isValid("manual_unlock"));
        assertFalse(Role.isValid("OWNER"));
        assertThrows(IllegalArgumentException.class, () -> Role.fromValue("OWNER"));
    }

    @Test
    void testScheduleStatus() {
        assertEquals(ScheduleStatus.ACTIVE, ScheduleStatus.fromValue("ACTIVE"));
        assertEquals(ScheduleStatus.COMPLETED, ScheduleStatus.fromValue("completed"));
        assertFalse(ScheduleStatus.ACTIVE.isTerminal());
        assertTrue(ScheduleStatus.COMPLETED.isTerminal());
        assertTrue(ScheduleStatus.REVOKED.isTerminal());
        assertThrows(IllegalArgumentException.class, () -> ScheduleStatus.fromValue("PAUSED"));
    }

    @Test
    void testErrorCategories() {
        assertEquals(ErrorCategory.AUTHORIZATION, LedgerErrorCode.NOT_BENEFICIARY.getCategory());
        assertEquals(ErrorCategory.INVALID_INPUT, LedgerErrorCode.ARRAYS_LENGTH_MISMATCH.getCategory());
        assertEquals(ErrorCategory.INVALID_REFERENCE, LedgerErrorCode.INVALID_SCHEDULE_ID.getCategory());
        assertEquals(ErrorCategory.STATE_CONFLICT, LedgerErrorCode.REENTRANT_CALL.getCategory());
        assertEquals(ErrorCategory.SYSTEM_HALTED, LedgerErrorCode.ENFORCED_PAUSE.getCategory());
    }
}
