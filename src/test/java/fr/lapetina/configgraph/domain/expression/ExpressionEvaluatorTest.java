package fr.lapetina.configgraph.domain.expression;

import fr.lapetina.configgraph.domain.exception.ExpressionException;
import fr.lapetina.configgraph.domain.model.Settings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionEvaluatorTest {

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    private Object eval(String expression) {
        return evaluator.evaluate(expression);
    }

    @Nested
    @DisplayName("arithmetic")
    class Arithmetic {

        @Test
        @DisplayName("should follow operator precedence")
        void shouldFollowPrecedence() {
            assertThat(eval("1 + 2 * 3")).isEqualTo(7);
            assertThat(eval("(1 + 2) * 3")).isEqualTo(9);
            assertThat(eval("2 ** 3 ** 2")).isEqualTo(512);
            assertThat(eval("-2 ** 2")).isEqualTo(-4);
        }

        @Test
        @DisplayName("should floor integer division and modulo")
        void shouldFloorDivision() {
            assertThat(eval("7 // 2")).isEqualTo(3);
            assertThat(eval("-7 // 2")).isEqualTo(-4);
            assertThat(eval("-7 % 3")).isEqualTo(2);
            assertThat(eval("7 / 2")).isEqualTo(3.5);
        }

        @Test
        @DisplayName("should reject division by zero")
        void shouldRejectDivisionByZero() {
            assertThatThrownBy(() -> eval("1 / 0")).isInstanceOf(ExpressionException.class);
        }

        @Test
        @DisplayName("should concatenate strings and lists")
        void shouldConcatenate() {
            assertThat(eval("'a' + 'b'")).isEqualTo("ab");
            assertThat(eval("[1] + [2]")).isEqualTo(List.of(1, 2));
        }

        @Test
        @DisplayName("should repeat strings and reject counts beyond an int")
        void shouldRepeatStrings() {
            assertThat(eval("'ab' * 3")).isEqualTo("ababab");
            assertThat(eval("'ab' * -1")).isEqualTo("");
            assertThatThrownBy(() -> eval("'a' * 4294967297"))
                    .isInstanceOf(ExpressionException.class)
                    .hasMessageContaining("too large");
        }
    }

    @Nested
    @DisplayName("logic")
    class Logic {

        @Test
        @DisplayName("should evaluate comparisons and boolean operators")
        void shouldCompare() {
            assertThat(eval("1 < 2 and 2 <= 2")).isEqualTo(true);
            assertThat(eval("not 1 == 1")).isEqualTo(false);
            assertThat(eval("2 in [1, 2]")).isEqualTo(true);
            assertThat(eval("None is None")).isEqualTo(true);
        }

        @Test
        @DisplayName("should return operands of and/or")
        void shouldReturnOperands() {
            assertThat(eval("0 or 'x'")).isEqualTo("x");
            assertThat(eval("'' and 1")).isEqualTo("");
        }

        @Test
        @DisplayName("should evaluate conditional expressions")
        void shouldEvaluateConditional() {
            assertThat(eval("'yes' if 1 > 0 else 'no'")).isEqualTo("yes");
        }
    }

    @Nested
    @DisplayName("builtins and modules")
    class BuiltinsAndModules {

        @Test
        @DisplayName("should call builtins")
        void shouldCallBuiltins() {
            assertThat(eval("len([1, 2, 3])")).isEqualTo(3);
            assertThat(eval("sum(range(5))")).isEqualTo(10);
            assertThat(eval("sorted([3, 1, 2])")).isEqualTo(List.of(1, 2, 3));
            assertThat(eval("max(1, 5, 3)")).isEqualTo(5);
            assertThat(eval("int('12')")).isEqualTo(12);
        }

        @Test
        @DisplayName("should import modules under an alias")
        void shouldImportAlias() {
            Object result = evaluator.evaluate("list(it.islice(it.count(), 3))", List.of("itertools as it"), Map.of());

            assertThat(result).isEqualTo(List.of(0, 1, 2));
        }

        @Test
        @DisplayName("should import math")
        void shouldImportMath() {
            assertThat(evaluator.evaluate("math.floor(math.sqrt(17))", List.of("math"), Map.of())).isEqualTo(4);
        }

        @Test
        @DisplayName("should reject modules outside the allowed set")
        void shouldRejectUnknownModule() {
            ExpressionEvaluator restricted = new ExpressionEvaluator(ExpressionModules.standard().restrictTo(List.of("math")));

            assertThatThrownBy(() -> restricted.evaluate("1", List.of("itertools"), Map.of()))
                    .isInstanceOf(ExpressionException.class)
                    .hasMessageContaining("itertools");
        }

        @Test
        @DisplayName("should read settings attributes of locals")
        void shouldReadLocals() {
            Settings limits = new Settings("limits", Map.of("size", 10));

            assertThat(evaluator.evaluate("l.size + 1", List.of(), Map.of("l", limits))).isEqualTo(11);
        }
    }

    @Nested
    @DisplayName("sandbox")
    class Sandbox {

        @Test
        @DisplayName("should reject unknown names")
        void shouldRejectUnknownNames() {
            assertThatThrownBy(() -> eval("__import__('os')"))
                    .isInstanceOf(ExpressionException.class);
        }

        @Test
        @DisplayName("should reject attribute access on plain values")
        void shouldRejectAttributes() {
            assertThatThrownBy(() -> eval("'x'.upper()")).isInstanceOf(ExpressionException.class);
        }

        @Test
        @DisplayName("should reject syntax errors")
        void shouldRejectSyntaxErrors() {
            assertThatThrownBy(() -> eval("1 +")).isInstanceOf(ExpressionException.class);
        }
    }
}
