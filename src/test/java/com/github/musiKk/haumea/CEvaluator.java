package com.github.musiKk.haumea;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.LongBinaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates the integer C expressions the compiler emits, with C's precedence and typing: literals
 * without an {@code L} suffix are {@code int}, variables are {@code long}, and arithmetic on two
 * {@code int}s is done in 32 bits. Signed overflow is undefined in C and fails with an
 * {@link ArithmeticException}. Comparisons and logical operators yield an {@code int} 0 or 1.
 */
class CEvaluator {

    private static final Pattern TOKEN = Pattern.compile(
            "\\s*(\\d+L?|[A-Za-z_][A-Za-z0-9_]*|<=|>=|==|!=|&&|\\|\\||[-+*/%<>()?:!~])");

    private record CValue(long value, boolean isLong) {
        static CValue ofInt(long value) {
            return new CValue(Math.toIntExact(value), false);
        }
        static CValue ofBoolean(boolean b) {
            return new CValue(b ? 1 : 0, false);
        }
        boolean isTrue() {
            return value != 0;
        }
    }

    private final List<String> tokens = new ArrayList<>();
    private final Map<String, Long> variables;
    private int index;

    private CEvaluator(String expression, Map<String, Long> variables) {
        this.variables = variables;
        Matcher m = TOKEN.matcher(expression);
        int end = 0;
        while (m.find() && m.start() == end) {
            tokens.add(m.group(1));
            end = m.end();
        }
        if (!expression.substring(end).isBlank()) {
            throw new IllegalArgumentException("cannot tokenize " + expression.substring(end));
        }
    }

    static long evaluate(String expression, Map<String, Long> variables) {
        var evaluator = new CEvaluator(expression, variables);
        var value = evaluator.conditional();
        if (evaluator.index != evaluator.tokens.size()) {
            throw new IllegalArgumentException("trailing input in " + expression);
        }
        return value.value();
    }

    // usual arithmetic conversions: long if either side is long
    private static CValue arithmetic(CValue left, CValue right, LongBinaryOperator op) {
        if (left.isLong() || right.isLong()) {
            return new CValue(op.applyAsLong(left.value(), right.value()), true);
        }
        return CValue.ofInt(op.applyAsLong(left.value(), right.value()));
    }

    private CValue conditional() {
        var condition = or();
        if (accept("?")) {
            var then = conditional();
            expect(":");
            var otherwise = conditional();
            return condition.isTrue() ? then : otherwise;
        }
        return condition;
    }

    private CValue or() {
        var value = and();
        while (accept("||")) {
            var right = and();
            value = CValue.ofBoolean(value.isTrue() || right.isTrue());
        }
        return value;
    }

    private CValue and() {
        var value = equality();
        while (accept("&&")) {
            var right = equality();
            value = CValue.ofBoolean(value.isTrue() && right.isTrue());
        }
        return value;
    }

    private CValue equality() {
        var value = relational();
        while (true) {
            if (accept("==")) {
                value = CValue.ofBoolean(value.value() == relational().value());
            } else if (accept("!=")) {
                value = CValue.ofBoolean(value.value() != relational().value());
            } else {
                return value;
            }
        }
    }

    private CValue relational() {
        var value = additive();
        while (true) {
            if (accept("<=")) {
                value = CValue.ofBoolean(value.value() <= additive().value());
            } else if (accept(">=")) {
                value = CValue.ofBoolean(value.value() >= additive().value());
            } else if (accept("<")) {
                value = CValue.ofBoolean(value.value() < additive().value());
            } else if (accept(">")) {
                value = CValue.ofBoolean(value.value() > additive().value());
            } else {
                return value;
            }
        }
    }

    private CValue additive() {
        var value = multiplicative();
        while (true) {
            if (accept("+")) {
                value = arithmetic(value, multiplicative(), Math::addExact);
            } else if (accept("-")) {
                value = arithmetic(value, multiplicative(), Math::subtractExact);
            } else {
                return value;
            }
        }
    }

    private CValue multiplicative() {
        var value = unary();
        while (true) {
            if (accept("*")) {
                value = arithmetic(value, unary(), Math::multiplyExact);
            } else if (accept("/")) {
                value = arithmetic(value, unary(), (a, b) -> a / b);
            } else if (accept("%")) {
                value = arithmetic(value, unary(), (a, b) -> a % b);
            } else {
                return value;
            }
        }
    }

    private CValue unary() {
        if (accept("-")) {
            var operand = unary();
            return operand.isLong() ? new CValue(Math.negateExact(operand.value()), true) : CValue.ofInt(-operand.value());
        } else if (accept("!")) {
            return CValue.ofBoolean(!unary().isTrue());
        } else if (accept("~")) {
            var operand = unary();
            return new CValue(~operand.value(), operand.isLong());
        }
        return primary();
    }

    private CValue primary() {
        if (accept("(")) {
            var value = conditional();
            expect(")");
            return value;
        }
        var token = tokens.get(index++);
        if (Character.isDigit(token.charAt(0))) {
            if (token.endsWith("L")) {
                return new CValue(Long.parseLong(token.substring(0, token.length() - 1)), true);
            }
            return CValue.ofInt(Long.parseLong(token));
        }
        var value = variables.get(token);
        if (value == null) {
            throw new IllegalArgumentException("unbound variable " + token);
        }
        return new CValue(value, true);
    }

    private boolean accept(String token) {
        if (index < tokens.size() && tokens.get(index).equals(token)) {
            index++;
            return true;
        }
        return false;
    }

    private void expect(String token) {
        if (!accept(token)) {
            throw new IllegalArgumentException("expected " + token + " at token " + index + " of " + tokens);
        }
    }

}
