package io.github.cyfko.dnfql.core.parsing;

import io.github.cyfko.dnfql.core.config.OperatorConfig;
import io.github.cyfko.dnfql.core.config.OperatorRole;
import io.github.cyfko.dnfql.core.exception.FormulaSyntaxException;
import io.github.cyfko.dnfql.core.model.Literal;
import io.github.cyfko.dnfql.core.model.LiteralOperation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LiteralNormalizer Tests")
class LiteralNormalizerTest {

    private static final OperatorConfig DEFAULTS = OperatorConfig.defaults();

    @Nested
    @DisplayName("Supported forms")
    class SupportedTests {

        @ParameterizedTest
        @CsvSource({
                "A, A, EQ1",
                "A=1, A, EQ1",
                "A=0, A, EQ0",
                "A<>1, A, NEQ1",
                "A!=1, A, NEQ1",
                "!A, A, NEQ1",
                "'  ePBN993847_1 =1 ', ePBN993847_1, EQ1",
                "'! B_2', B_2, NEQ1"
        })
        @DisplayName("Suffix resolution")
        void suffixResolution(String raw, String id, LiteralOperation operation) {
            Literal literal = LiteralNormalizer.parseLiteral(raw, null, DEFAULTS);

            assertEquals(id, literal.id());
            assertEquals(operation, literal.operation());
            assertEquals(id, literal.displayName());
        }

        @Test
        @DisplayName("Display name is attached as given")
        void displayName() {
            Literal literal = LiteralNormalizer.parseLiteral("A<>1", "Has diabetes", DEFAULTS);

            assertEquals("Has diabetes", literal.displayName());
        }

        @Test
        @DisplayName("Default interpreter uses the raw text as display name")
        void interpreter() {
            Literal literal = LiteralNormalizer.interpreter(DEFAULTS).interpret("B=0");

            assertEquals(new Literal("B", "B=0", LiteralOperation.EQ0), literal);
        }

        @Test
        @DisplayName("Comparators come from the configuration")
        void configuredComparators() {
            OperatorConfig custom = OperatorConfig.builder()
                    .role(OperatorRole.AND, "&")
                    .role(OperatorRole.OR, "|")
                    .role(OperatorRole.EQ, "==")
                    .role(OperatorRole.NEQ, "~=")
                    .role(OperatorRole.LPAREN, "(")
                    .role(OperatorRole.RPAREN, ")")
                    .build();

            assertEquals(LiteralOperation.NEQ1, LiteralNormalizer.parseLiteral("A~=1", null, custom).operation());
            assertEquals(LiteralOperation.EQ0, LiteralNormalizer.parseLiteral("A==0", null, custom).operation());
            assertThrows(FormulaSyntaxException.class, () -> LiteralNormalizer.parseLiteral("A=1", null, custom));
            assertThrows(FormulaSyntaxException.class, () -> LiteralNormalizer.parseLiteral("A~=0", null, custom));
        }
    }

    @Nested
    @DisplayName("Rejected forms")
    class RejectedTests {

        @ParameterizedTest
        @ValueSource(strings = {"A<>0", "A!=0"})
        @DisplayName("Not-equal-to-zero is rejected")
        void notEqualZero(String raw) {
            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                    () -> LiteralNormalizer.parseLiteral(raw, null, DEFAULTS));

            assertTrue(e.getMessage().startsWith("Invalid comparison in literal"), e.getMessage());
        }

        @ParameterizedTest
        @ValueSource(strings = {"A<1", "A>0", "A<=1", "A>=1", "A<>1>"})
        @DisplayName("Ordering comparators are rejected")
        void orderingComparators(String raw) {
            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                    () -> LiteralNormalizer.parseLiteral(raw, null, DEFAULTS));

            assertTrue(e.getMessage().startsWith("Unsupported comparison in literal"), e.getMessage());
        }

        @ParameterizedTest
        @ValueSource(strings = {"XOR", "if", "A XOR B"})
        @DisplayName("XOR and IF keywords are rejected")
        void keywords(String raw) {
            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                    () -> LiteralNormalizer.parseLiteral(raw, null, DEFAULTS));

            assertTrue(e.getMessage().startsWith("Unsupported operator in literal"), e.getMessage());
        }

        @Test
        @DisplayName("Identifiers containing XOR are not keywords")
        void keywordInsideIdentifier() {
            assertEquals("XOR_FLAG", LiteralNormalizer.parseLiteral("XOR_FLAG", null, DEFAULTS).id());
        }

        @ParameterizedTest
        @ValueSource(strings = {"!", "=1", "<>1", "  "})
        @DisplayName("Missing identifier is rejected")
        void missingIdentifier(String raw) {
            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                    () -> LiteralNormalizer.parseLiteral(raw, null, DEFAULTS));

            assertTrue(e.getMessage().startsWith("Literal missing identifier"), e.getMessage());
        }

        @ParameterizedTest
        @ValueSource(strings = {"A-B", "A.B=1", "é=0"})
        @DisplayName("Identifiers outside [A-Za-z0-9_] are rejected")
        void invalidIdentifier(String raw) {
            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                    () -> LiteralNormalizer.parseLiteral(raw, null, DEFAULTS));

            assertTrue(e.getMessage().startsWith("Invalid literal identifier"), e.getMessage());
        }
    }
}
