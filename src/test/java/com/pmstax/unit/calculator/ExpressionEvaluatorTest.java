package com.pmstax.unit.calculator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pmstax.calculator.ExpressionEvaluator;
import com.pmstax.calculator.ExpressionException;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ExpressionEvaluator.
 *
 * <p>Verifies: operator precedence, parentheses, unary signs, grouping commas,
 * rounding to two places, and every rejection message.
 */
class ExpressionEvaluatorTest {

    @Nested
    @DisplayName("Evaluation")
    class Evaluation {

        @Test
        void evaluate_respectsPrecedence() throws Exception {
            assertThat(ExpressionEvaluator.evaluate("=10000*10+5000")).isEqualByComparingTo("105000");
        }

        @Test
        void evaluate_withoutLeadingEquals() throws Exception {
            assertThat(ExpressionEvaluator.evaluate("2+3*4")).isEqualByComparingTo("14");
        }

        @Test
        void evaluate_parenthesesOverridePrecedence() throws Exception {
            assertThat(ExpressionEvaluator.evaluate("=(2+3)*4")).isEqualByComparingTo("20");
        }

        @Test
        void evaluate_unaryMinus() throws Exception {
            assertThat(ExpressionEvaluator.evaluate("=-5+10")).isEqualByComparingTo("5");
            assertThat(ExpressionEvaluator.evaluate("=2*-3")).isEqualByComparingTo("-6");
        }

        @Test
        void evaluate_ignoresGroupingCommasAndWhitespace() throws Exception {
            assertThat(ExpressionEvaluator.evaluate("= 1,00,000 / 12 * 12 ")).isEqualByComparingTo("100000");
        }

        @Test
        void evaluate_roundsHalfUpToTwoPlaces() throws Exception {
            BigDecimal result = ExpressionEvaluator.evaluate("=10/3");

            assertThat(result).isEqualByComparingTo("3.33");
            assertThat(ExpressionEvaluator.evaluate("=0.125+0")).isEqualByComparingTo("0.13");
        }

        @Test
        void evaluate_wholeResultHasNoFraction() throws Exception {
            assertThat(ExpressionEvaluator.evaluate("=2.5*4").toPlainString()).isEqualTo("10");
        }

        @Test
        void evaluate_decimalOperands() throws Exception {
            assertThat(ExpressionEvaluator.evaluate("=.5+1.25")).isEqualByComparingTo("1.75");
        }
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        void divisionByZero() {
            assertThatThrownBy(() -> ExpressionEvaluator.evaluate("=10/0"))
                    .isInstanceOf(ExpressionException.class)
                    .hasMessage("Division by zero is not allowed.");
        }

        @Test
        void divisionByZeroExpression() {
            assertThatThrownBy(() -> ExpressionEvaluator.evaluate("=10/(5-5)"))
                    .hasMessage("Division by zero is not allowed.");
        }

        @Test
        void emptyAfterEquals() {
            assertThatThrownBy(() -> ExpressionEvaluator.evaluate("=  ")).hasMessage("Empty expression after =");
        }

        @Test
        void lettersAreRejected() {
            assertThatThrownBy(() -> ExpressionEvaluator.evaluate("=10a"))
                    .hasMessage("Invalid characters in expression. Only numbers and +, -, *, /, () are allowed.");
        }

        @Test
        void percentIsNotSupported() {
            assertThatThrownBy(() -> ExpressionEvaluator.evaluate("=10%"))
                    .hasMessageStartingWith("Invalid characters in expression");
        }

        @Test
        void doubleStar() {
            assertThatThrownBy(() -> ExpressionEvaluator.evaluate("=2**3"))
                    .hasMessage("Use * for multiplication, not **");
        }

        @Test
        void doubleSlash() {
            assertThatThrownBy(() -> ExpressionEvaluator.evaluate("=8//2")).hasMessage("Use / for division, not //");
        }

        @Test
        void unmatchedClosingParenthesis() {
            assertThatThrownBy(() -> ExpressionEvaluator.evaluate("=(1+2))"))
                    .hasMessage("Unmatched closing parenthesis");
        }

        @Test
        void unmatchedOpeningParenthesis() {
            assertThatThrownBy(() -> ExpressionEvaluator.evaluate("=((1+2)"))
                    .hasMessage("Unmatched opening parenthesis");
        }

        @Test
        void trailingOperator() {
            assertThatThrownBy(() -> ExpressionEvaluator.evaluate("=5+")).hasMessage("Invalid mathematical expression.");
        }

        @Test
        void numberWithTwoDots() {
            assertThatThrownBy(() -> ExpressionEvaluator.evaluate("=1.2.3+1"))
                    .hasMessage("Invalid number: 1.2.3");
        }

        @Test
        void errorCarriesPosition() {
            assertThatThrownBy(() -> ExpressionEvaluator.evaluate("=12x"))
                    .isInstanceOfSatisfying(
                            ExpressionException.class, e -> assertThat(e.getPosition()).isEqualTo(2));
        }
    }
}
