package com.ryuqq.courier.core.statemachine;

import org.junit.jupiter.api.Test;

import static com.ryuqq.courier.core.statemachine.HandlerState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * HandlerStateTransition 테스트.
 *
 * <ul>
 *   <li>ACTIVE ↔ DISPATCHING 반복 전이 성공</li>
 *   <li>ACTIVE → STOPPED 성공</li>
 *   <li>DISPATCHING → STOPPED 시도 시 IllegalStateException</li>
 *   <li>STOPPED에서의 모든 전이 시 IllegalStateException</li>
 * </ul>
 *
 * @author Courier Team
 * @since 1.0.0
 */
class HandlerStateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void validate_ActiveToDispatching_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> HandlerStateTransition.validate(ACTIVE, DISPATCHING));
    }

    @Test
    void validate_DispatchingToActive_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> HandlerStateTransition.validate(DISPATCHING, ACTIVE));
    }

    @Test
    void transition_DispatchLoopThenStop_Succeeds() {
        // Given
        HandlerState state = ACTIVE;

        // When
        for (int i = 0; i < 3; i++) {
            state = HandlerStateTransition.transition(state, DISPATCHING);
            state = HandlerStateTransition.transition(state, ACTIVE);
        }
        state = HandlerStateTransition.transition(state, STOPPED);

        // Then
        assertEquals(STOPPED, state);
        assertTrue(state.isTerminal());
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void validate_DispatchingToStopped_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> HandlerStateTransition.validate(DISPATCHING, STOPPED)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_StoppedToActive_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> HandlerStateTransition.validate(STOPPED, ACTIVE)
        );
        assertTrue(exception.getMessage().contains("terminal state"));
    }

    @Test
    void validate_ActiveToActive_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, () -> HandlerStateTransition.validate(ACTIVE, ACTIVE));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgumentException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> HandlerStateTransition.validate(null, ACTIVE));
        assertThrows(IllegalArgumentException.class, () -> HandlerStateTransition.validate(ACTIVE, null));
    }

    @Test
    void isTerminal_OnlyStopped() {
        // Then
        assertFalse(ACTIVE.isTerminal());
        assertFalse(DISPATCHING.isTerminal());
        assertTrue(STOPPED.isTerminal());
    }
}
