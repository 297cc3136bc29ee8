package io.github.cyfko.dnfql.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class FormulaPolicyTest {

    @Test
    @DisplayName("Presets carry their limits")
    void presets() {
        assertEquals(2000, FormulaPolicy.defaults().maxRules());
        assertEquals(5000, FormulaPolicy.defaults().maxFormulaLength());
        assertEquals(256, FormulaPolicy.defaults().maxDepth());
        assertEquals(500, FormulaPolicy.strict().maxRules());
        assertEquals(64, FormulaPolicy.strict().maxDepth());
        assertEquals(1000, FormulaPolicy.relaxed().maxDepth());
        assertEquals(20000, FormulaPolicy.relaxed().maxRules());
        assertEquals("STRICT_POLICY", FormulaPolicy.strict().policyName());
    }

    @Test
    @DisplayName("Builder starts from the default limits")
    void builderDefaults() {
        FormulaPolicy policy = FormulaPolicy.builder().maxRules(8).build();

        assertEquals(8, policy.maxRules());
        assertEquals(5000, policy.maxFormulaLength());
        assertEquals(256, policy.maxDepth());
        assertEquals(FormulaPolicy.PolicyName.CUSTOM_POLICY.name(), policy.policyName());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    @DisplayName("Non-positive limits are rejected")
    void invalidLimits(int value) {
        assertThrows(IllegalArgumentException.class, () -> FormulaPolicy.builder().maxRules(value).build());
        assertThrows(IllegalArgumentException.class, () -> FormulaPolicy.builder().maxFormulaLength(value).build());
        assertThrows(IllegalArgumentException.class, () -> FormulaPolicy.builder().maxDepth(value).build());
    }

    @Test
    @DisplayName("Blank policy name is rejected")
    void blankName() {
        assertThrows(IllegalArgumentException.class, () -> new FormulaPolicy(" ", 10, 10, 10));
    }
}
