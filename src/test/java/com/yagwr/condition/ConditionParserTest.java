package com.yagwr.condition;

import com.yagwr.condition.impl.LiteralCondition;
import com.yagwr.exception.InvalidExpressionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.yaml.snakeyaml.Yaml;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for parsing and serializing condition descriptions.
 */
class ConditionParserTest {

    // =====================================================================
    // Literal parsing
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Literal expressions are split into trimmed key, operator and value")
    @CsvSource(delimiter = '|', value = {
            "gitlab_event=Push Hook     | gitlab_event | EQ        | Push Hook",
            "gitlab_event = Push Hook   | gitlab_event | EQ        | Push Hook",
            "path != /hook              | path         | NEQ       | /hook",
            "gitlab_host ~= git.*       | gitlab_host  | MATCH     | git.*",
            "gitlab token !~= ^secret$  | gitlab token | NOT_MATCH | ^secret$",
            "a=                         | a            | EQ        | ''"
    })
    void parsesLiteral(String expression, String field, LiteralOperator operator, String operand) {
        Condition condition = ConditionParser.parse(expression);

        assertEquals(ConditionType.LITERAL, condition.getType());
        LiteralCondition literal = (LiteralCondition) condition;
        assertEquals(field, literal.getField());
        assertEquals(operator, literal.getOperator());
        assertEquals(operand, literal.getOperand());
    }

    @ParameterizedTest
    @DisplayName("Strings that are not key<OP>value are rejected")
    @ValueSource(strings = {"bad syntax", "", "=value", " key=value", "-key=value", "key"})
    void rejectsMalformedLiteral(String expression) {
        assertThrows(InvalidExpressionException.class, () -> ConditionParser.parse(expression));
    }

    @Test
    @DisplayName("The first operator splits the expression")
    void firstOperatorWins() {
        LiteralCondition literal = (LiteralCondition) ConditionParser.parse("key == value");

        assertEquals("key", literal.getField());
        assertEquals(LiteralOperator.EQ, literal.getOperator());
        assertEquals("= value", literal.getOperand());
    }

    @Test
    @DisplayName("Invalid regular expressions are rejected when parsing")
    void rejectsInvalidRegex() {
        assertThrows(InvalidExpressionException.class, () -> ConditionParser.parse("path ~= ([a-z"));
        assertDoesNotThrow(() -> ConditionParser.parse("path = ([a-z"));
    }

    // =====================================================================
    // Compound parsing
    // =====================================================================

    @Test
    @DisplayName("Operator keys are case-insensitive")
    void operatorKeysIgnoreCase() {
        assertEquals(ConditionType.ANY, ConditionParser.parse(Map.of("ANY", List.of("a=1"))).getType());
        assertEquals(ConditionType.ALL, ConditionParser.parse(Map.of("All", List.of("a=1"))).getType());
        assertEquals(ConditionType.NOT, ConditionParser.parse(Map.of("nOt", List.of("a=1"))).getType());
    }

    @Test
    @DisplayName("ANY and ALL accept empty lists")
    void acceptsEmptyCompound() {
        assertTrue(ConditionParser.parse(Map.of("all", List.of())).evaluate(Map.of()));
        assertFalse(ConditionParser.parse(Map.of("any", List.of())).evaluate(Map.of()));
    }

    @Test
    @DisplayName("Mappings must have exactly one known key")
    void rejectsBadMappings() {
        assertThrows(InvalidExpressionException.class, () -> ConditionParser.parse(Map.of()));
        assertThrows(InvalidExpressionException.class,
                () -> ConditionParser.parse(Map.of("any", List.of("a=1"), "all", List.of("b=2"))));
        assertThrows(InvalidExpressionException.class,
                () -> ConditionParser.parse(Map.of("xor", List.of("a=1"))));
    }

    @Test
    @DisplayName("NOT requires a single-element list")
    void notRequiresOneElement() {
        assertThrows(InvalidExpressionException.class, () -> ConditionParser.parse(Map.of("not", "a=1")));
        assertThrows(InvalidExpressionException.class, () -> ConditionParser.parse(Map.of("not", List.of())));
        assertThrows(InvalidExpressionException.class,
                () -> ConditionParser.parse(Map.of("not", List.of("a=1", "b=2"))));
    }

    @Test
    @DisplayName("ANY and ALL require a list")
    void compoundRequiresList() {
        assertThrows(InvalidExpressionException.class, () -> ConditionParser.parse(Map.of("any", "a=1")));
        assertThrows(InvalidExpressionException.class, () -> ConditionParser.parse(Map.of("all", Map.of())));
    }

    @Test
    @DisplayName("Descriptions must be strings or mappings")
    void rejectsOtherTypes() {
        assertThrows(InvalidExpressionException.class, () -> ConditionParser.parse(42));
        assertThrows(InvalidExpressionException.class, () -> ConditionParser.parse(List.of("a=1")));
        assertThrows(InvalidExpressionException.class, () -> ConditionParser.parse(null));
    }

    @Test
    @DisplayName("Errors in nested descriptions are reported")
    void rejectsNestedErrors() {
        Map<String, Object> description = Map.of("any", List.of("a=1", Map.of("all", List.of("broken"))));
        assertThrows(InvalidExpressionException.class, () -> ConditionParser.parse(description));
    }

    // =====================================================================
    // Serialization
    // =====================================================================

    @Test
    @DisplayName("Literals serialize to their original text")
    void literalKeepsOriginalText() {
        String expression = "  gitlab_event   =  Push Hook  ";
        assertEquals(expression, ConditionParser.parse(expression).toDescription());
    }

    @Test
    @DisplayName("Parsing then serializing returns the original description")
    void roundTripsYamlDescription() {
        String yaml = """
                any:
                  - "akane != kun"
                  - all:
                      - "genma = san"
                      - "nabiki ~= tendou?"
                      - not:
                          - "ranma=girl"
                  - any: []
                """;
        Object description = new Yaml().load(yaml);

        assertEquals(description, ConditionParser.parse(description).toDescription());
    }
}
