package com.todoflow.worker.strategy;

import com.todoflow.worker.ExecutionContext;
import com.todoflow.worker.ExecutionException;
import com.todoflow.worker.ExecutionOutput;
import com.todoflow.worker.ExecutionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds arithmetic expressions in the todo content and evaluates them.
 *
 * Supports {@code + - * /} with the usual precedence, parentheses, unary minus and decimals.
 * Content with no expression succeeds with guidance; a malformed expression or a division by
 * zero fails permanently, since retrying the same content cannot succeed.
 */
public class MathExecutionStrategy implements ExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(MathExecutionStrategy.class);

    public static final String INVALID_EXPRESSION = "INVALID_EXPRESSION";
    public static final String DIVISION_BY_ZERO = "DIVISION_BY_ZERO";

    static final String NO_EXPRESSION_GUIDANCE =
        "Math todo identified but no clear expressions found. Consider breaking down into specific calculations.";

    private static final Pattern CANDIDATE = Pattern.compile("[\\d(][\\d\\s+\\-*/().]*[\\d)]");
    private static final Pattern NUMBER_OPERATOR_NUMBER = Pattern.compile("\\d\\)*\\s*[+\\-*/]\\s*\\(*\\s*-?\\d");

    @Override
    public ExecutionOutput execute(ExecutionContext context) throws ExecutionException {
        List<String> expressions = extract(context.getContent());
        if (expressions.isEmpty()) {
            return new ExecutionOutput(NO_EXPRESSION_GUIDANCE, "No calculation performed",
                Map.of("expressions", 0));
        }

        List<String> lines = new ArrayList<>(expressions.size());
        for (String expression : expressions) {
            String value = format(evaluate(expression));
            log.debug("Todo {}: {} = {}", context.getTodoId(), expression, value);
            lines.add(expression + " = " + value);
        }
        return new ExecutionOutput(
            String.join("\n", lines),
            "Successfully calculated " + expressions.size() + " mathematical expression(s)",
            Map.of("expressions", expressions.size())
        );
    }

    /**
     * Expressions in order of appearance. Candidates without a binary operation are skipped.
     */
    static List<String> extract(String content) {
        List<String> expressions = new ArrayList<>();
        Matcher matcher = CANDIDATE.matcher(content);
        while (matcher.find()) {
            String candidate = matcher.group().strip();
            if (NUMBER_OPERATOR_NUMBER.matcher(candidate).find()) {
                expressions.add(candidate);
            }
        }
        return expressions;
    }

    /**
     * Evaluate a single expression.
     *
     * @throws ExecutionException if the expression is malformed or divides by zero
     */
    static BigDecimal evaluate(String expression) throws ExecutionException {
        return new Parser(expression).parse();
    }

    static String format(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.signum() == 0 ? "0" : stripped.toPlainString();
    }

    /**
     * Recursive-descent parser: expression := term (('+'|'-') term)*, term := factor (('*'|'/') factor)*,
     * factor := '-' factor | number | '(' expression ')'.
     */
    private static final class Parser {

        private final String source;
        private int pos;

        Parser(String source) {
            this.source = source;
        }

        BigDecimal parse() throws ExecutionException {
            BigDecimal value = expression();
            skipSpaces();
            if (pos < source.length()) {
                throw invalid("unexpected '" + source.charAt(pos) + "' at position " + pos);
            }
            return value;
        }

        private BigDecimal expression() throws ExecutionException {
            BigDecimal value = term();
            while (true) {
                if (accept('+')) {
                    value = value.add(term(), MathContext.DECIMAL64);
                } else if (accept('-')) {
                    value = value.subtract(term(), MathContext.DECIMAL64);
                } else {
                    return value;
                }
            }
        }

        private BigDecimal term() throws ExecutionException {
            BigDecimal value = factor();
            while (true) {
                if (accept('*')) {
                    value = value.multiply(factor(), MathContext.DECIMAL64);
                } else if (accept('/')) {
                    BigDecimal divisor = factor();
                    if (divisor.signum() == 0) {
                        throw ExecutionException.permanent(DIVISION_BY_ZERO,
                            "Division by zero in '" + source + "'");
                    }
                    value = value.divide(divisor, MathContext.DECIMAL64);
                } else {
                    return value;
                }
            }
        }

        private BigDecimal factor() throws ExecutionException {
            if (accept('-')) {
                return factor().negate();
            }
            if (accept('(')) {
                BigDecimal value = expression();
                if (!accept(')')) {
                    throw invalid("missing ')'");
                }
                return value;
            }
            return number();
        }

        private BigDecimal number() throws ExecutionException {
            skipSpaces();
            int start = pos;
            while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
                pos++;
            }
            if (start == pos) {
                throw invalid(pos < source.length()
                    ? "expected a number at position " + pos
                    : "expression ends early");
            }
            try {
                return new BigDecimal(source.substring(start, pos));
            } catch (NumberFormatException e) {
                throw invalid("malformed number '" + source.substring(start, pos) + "'");
            }
        }

        private boolean accept(char expected) {
            skipSpaces();
            if (pos < source.length() && source.charAt(pos) == expected) {
                pos++;
                return true;
            }
            return false;
        }

        private void skipSpaces() {
            while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
                pos++;
            }
        }

        private ExecutionException invalid(String reason) {
            return ExecutionException.permanent(INVALID_EXPRESSION,
                "Invalid expression '" + source + "': " + reason);
        }
    }
}
