package io.github.cyfko.dnfql.core.config;

import io.github.cyfko.dnfql.core.exception.OperatorConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OperatorConfig Tests")
class OperatorConfigTest {

    private static Map<OperatorRole, List<String>> defaultMapping() {
        Map<OperatorRole, List<String>> raw = new EnumMap<>(OperatorRole.class);
        raw.put(OperatorRole.AND, List.of("&", "AND"));
        raw.put(OperatorRole.OR, List.of("|", "OR"));
        raw.put(OperatorRole.NOT, List.of("!", "NOT"));
        raw.put(OperatorRole.EQ, List.of("="));
        raw.put(OperatorRole.NEQ, List.of("<>", "!="));
        raw.put(OperatorRole.LPAREN, List.of("("));
        raw.put(OperatorRole.RPAREN, List.of(")"));
        return raw;
    }

    @Nested
    @DisplayName("Defaults")
    class DefaultsTests {

        @Test
        @DisplayName("Default table declares every role")
        void defaultTable() {
            OperatorConfig config = OperatorConfig.defaults();

            assertEquals(List.of("&", "AND"), config.tokens(OperatorRole.AND));
            assertEquals(List.of("|", "OR"), config.tokens(OperatorRole.OR));
            assertEquals(List.of("!", "NOT"), config.tokens(OperatorRole.NOT));
            assertEquals(List.of("="), config.eqTokens());
            assertEquals(List.of("<>", "!="), config.neqTokens());
            assertEquals("<defaults>", config.source());
        }

        @Test
        @DisplayName("Default expression operators are ordered longest first, then by role")
        void defaultScanOrder() {
            List<String> order = OperatorConfig.defaults().expressionOperators().stream()
                    .map(OperatorToken::token)
                    .collect(Collectors.toList());

            assertEquals(List.of("AND", "NOT", "OR", "&", "|", "!", "(", ")"), order);
        }

        @Test
        @DisplayName("Same mapping means equal configurations")
        void equalityIgnoresSource() {
            OperatorConfig fromMap = OperatorConfig.of(defaultMapping(), "test");

            assertEquals(OperatorConfig.defaults(), fromMap);
            assertEquals(OperatorConfig.defaults().hashCode(), fromMap.hashCode());
        }
    }

    @Nested
    @DisplayName("Normalization")
    class NormalizationTests {

        @Test
        @DisplayName("Word tokens are stripped and upper-cased")
        void wordTokensUpperCased() {
            OperatorConfig config = OperatorConfig.builder()
                    .role(OperatorRole.AND, " and ", "&")
                    .role(OperatorRole.OR, "or")
                    .role(OperatorRole.EQ, "=")
                    .role(OperatorRole.NEQ, "<>")
                    .role(OperatorRole.LPAREN, "(")
                    .role(OperatorRole.RPAREN, ")")
                    .build();

            assertEquals(List.of("AND", "&"), config.tokens(OperatorRole.AND));
            assertEquals(List.of("OR"), config.tokens(OperatorRole.OR));
            assertEquals(OperatorConfig.PROGRAMMATIC_SOURCE, config.source());
        }

        @Test
        @DisplayName("Duplicate tokens within one role collapse")
        void duplicatesWithinRoleCollapse() {
            OperatorConfig config = OperatorConfig.builder()
                    .role(OperatorRole.AND, "AND", "and", "&")
                    .role(OperatorRole.OR, "|")
                    .role(OperatorRole.EQ, "=")
                    .role(OperatorRole.NEQ, "<>")
                    .role(OperatorRole.LPAREN, "(")
                    .role(OperatorRole.RPAREN, ")")
                    .build();

            assertEquals(List.of("AND", "&"), config.tokens(OperatorRole.AND));
        }

        @Test
        @DisplayName("NOT may be omitted or left empty")
        void notIsOptional() {
            Map<OperatorRole, List<String>> raw = defaultMapping();
            raw.put(OperatorRole.NOT, List.of());

            OperatorConfig config = OperatorConfig.of(raw, "test");

            assertTrue(config.tokens(OperatorRole.NOT).isEmpty());
            assertTrue(config.expressionOperators().stream().noneMatch(op -> op.role() == OperatorRole.NOT));
        }

        @Test
        @DisplayName("Expression operators are ordered longest first")
        void longestFirst() {
            OperatorConfig config = OperatorConfig.builder()
                    .role(OperatorRole.AND, "&", "&&")
                    .role(OperatorRole.OR, "|", "||")
                    .role(OperatorRole.NOT, "NOT")
                    .role(OperatorRole.EQ, "=")
                    .role(OperatorRole.NEQ, "!=")
                    .role(OperatorRole.LPAREN, "(")
                    .role(OperatorRole.RPAREN, ")")
                    .build();

            List<String> order = config.expressionOperators().stream()
                    .map(OperatorToken::token)
                    .collect(Collectors.toList());

            assertEquals(List.of("NOT", "&&", "||", "&", "|", "(", ")"), order);
        }

        @Test
        @DisplayName("Comparators are excluded from expression operators")
        void comparatorsExcluded() {
            assertTrue(OperatorConfig.defaults().expressionOperators().stream()
                    .noneMatch(op -> op.role() == OperatorRole.EQ || op.role() == OperatorRole.NEQ));
        }

        @Test
        @DisplayName("Word tokens are flagged")
        void wordFlag() {
            OperatorToken and = OperatorConfig.defaults().expressionOperators().stream()
                    .filter(op -> op.token().equals("AND"))
                    .findFirst()
                    .orElseThrow();

            assertTrue(and.word());
            assertTrue(OperatorConfig.isWordToken("XOR"));
            assertFalse(OperatorConfig.isWordToken("&&"));
            assertFalse(OperatorConfig.isWordToken("A1"));
            assertFalse(OperatorConfig.isWordToken(""));
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Null mapping is rejected")
        void nullMapping() {
            assertThrows(OperatorConfigException.class, () -> OperatorConfig.of(null, "test"));
        }

        @Test
        @DisplayName("Missing required roles are listed")
        void missingRoles() {
            Map<OperatorRole, List<String>> raw = defaultMapping();
            raw.remove(OperatorRole.AND);
            raw.remove(OperatorRole.RPAREN);

            OperatorConfigException e = assertThrows(OperatorConfigException.class, () -> OperatorConfig.of(raw, "cfg.json"));

            assertTrue(e.getMessage().contains("Missing required roles: [AND, RPAREN]"), e.getMessage());
            assertTrue(e.getMessage().contains("cfg.json"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   "})
        @DisplayName("Blank tokens are rejected")
        void blankToken(String token) {
            Map<OperatorRole, List<String>> raw = defaultMapping();
            raw.put(OperatorRole.OR, List.of("|", token));

            OperatorConfigException e = assertThrows(OperatorConfigException.class, () -> OperatorConfig.of(raw, "test"));
            assertTrue(e.getMessage().contains("must not be empty"));
        }

        @Test
        @DisplayName("Required role with no token is rejected")
        void emptyRequiredRole() {
            Map<OperatorRole, List<String>> raw = defaultMapping();
            raw.put(OperatorRole.EQ, List.of());

            OperatorConfigException e = assertThrows(OperatorConfigException.class, () -> OperatorConfig.of(raw, "test"));
            assertTrue(e.getMessage().contains("'EQ' must have at least one token"));
        }

        @Test
        @DisplayName("A token shared by two roles is rejected")
        void duplicateAcrossRoles() {
            Map<OperatorRole, List<String>> raw = defaultMapping();
            raw.put(OperatorRole.OR, List.of("|", "and"));

            OperatorConfigException e = assertThrows(OperatorConfigException.class, () -> OperatorConfig.of(raw, "test"));
            assertTrue(e.getMessage().contains("Duplicate token 'AND' in roles AND and OR"), e.getMessage());
        }
    }
}
