package io.github.cyfko.dnfql.core.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RuleLimitExceededExceptionTest {

    @Test
    @DisplayName("Should report clause count and limit")
    void shouldReportCountAndLimit() {
        RuleLimitExceededException exception = new RuleLimitExceededException(4096, 2000);

        assertEquals(4096, exception.getClauseCount());
        assertEquals(2000, exception.getMaxRules());
        assertEquals("DNF rule limit exceeded (4096 clauses, max: 2000)", exception.getMessage());
    }

    @Test
    @DisplayName("Should describe a saturated count as overflowing")
    void shouldDescribeSaturatedCount() {
        RuleLimitExceededException exception = new RuleLimitExceededException(Long.MAX_VALUE, 10);

        assertTrue(exception.getMessage().contains("overflowing"));
        assertEquals(Long.MAX_VALUE, exception.getClauseCount());
    }
}
