package com.flagship.savings_circle.penalty;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PenaltyEngineTest {

    private static final BigDecimal RATE = new BigDecimal("0.05");

    @Test
    void testPenaltyAmount_Floored() {
        assertEquals(50, PenaltyEngine.penaltyAmount(1000, RATE));
        assertEquals(52, PenaltyEngine.penaltyAmount(1059, RATE));
        assertEquals(0, PenaltyEngine.penaltyAmount(19, RATE));
    }
}
