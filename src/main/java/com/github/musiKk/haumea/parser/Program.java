package com.github.musiKk.haumea.parser;

import java.util.List;
import java.util.Optional;

/**
 * A parsed haumea program. Nodes are immutable and every child is held by exactly one parent.
 */
public record Program(List<FunctionDeclaration> functions) {

    public Program {
        functions = List.copyOf(functions);
    }

    /**
     * {@code parameters} is empty when the function has no {@code with} clause, which is not the same
     * as {@code with ()} in the source but compiles to the same thing.
     */
    public record FunctionDeclaration(String name, Optional<List<String>> parameters, Statement body) {
        public FunctionDeclaration {
            parameters = parameters.map(List::copyOf);
        }
        public FunctionDeclaration(String name, Statement body) {
            this(name, Optional.empty(), body);
        }
        public FunctionDeclaration(String name, List<String> parameters, Statement body) {
            this(name, Optional.of(parameters), body);
        }
    }

    public sealed interface Statement {}

    public record ReturnStatement(Expression value) implements Statement {}
    public record VariableDeclaration(String name) implements Statement {}
    public record AssignmentStatement(String name, Expression value) implements Statement {}
    public record ChangeStatement(String name, Expression amount) implements Statement {}
    public record IfStatement(Expression condition, Statement thenBranch, Optional<Statement> elseBranch) implements Statement {
        public IfStatement(Expression condition, Statement thenBranch) {
            this(condition, thenBranch, Optional.empty());
        }
        public IfStatement(Expression condition, Statement thenBranch, Statement elseBranch) {
            this(condition, thenBranch, Optional.of(elseBranch));
        }
    }
    public record BlockStatement(List<Statement> statements) implements Statement {
        public BlockStatement {
            statements = List.copyOf(statements);
        }
    }
    public record CallStatement(String name, List<Expression> arguments) implements Statement {
        public CallStatement {
            arguments = List.copyOf(arguments);
        }
    }
    public record ForeverStatement(Statement body) implements Statement {}
    public record WhileStatement(Expression condition, Statement body) implements Statement {}
    public record ForEachStatement(String variable, Expression start, Expression end, Expression step,
            RangeKind rangeKind, Statement body) implements Statement {}

    public sealed interface Expression {}

    public record NumberExpression(int value) implements Expression {}
    public record VariableExpression(String name) implements Expression {}
    public record BinaryExpression(Expression left, Operator operator, Expression right) implements Expression {}
    public record UnaryExpression(Operator operator, Expression operand) implements Expression {}
    public record FunctionEvaluationExpression(String name, List<Expression> arguments) implements Expression {
        public FunctionEvaluationExpression {
            arguments = List.copyOf(arguments);
        }
    }

    public enum Operator {
        ADD("+"), SUB("-"), MUL("*"), DIV("/"), MODULO("modulo"),
        NEGATE("-"),
        EQUALS("="), NOT_EQUALS("!="),
        GT(">"), LT("<"), GTE(">="), LTE("<="),
        LOGICAL_AND("and"), LOGICAL_OR("or"), LOGICAL_NOT("not"),
        BINARY_AND("&"), BINARY_OR("|"), BINARY_NOT("~");

        /** How the operator is written in haumea source. */
        public final String image;

        private Operator(String image) {
            this.image = image;
        }
    }

    /** Whether a {@code for each} range includes its end value. */
    public enum RangeKind {
        TO("to"), THROUGH("through");

        public final String keyword;

        private RangeKind(String keyword) {
            this.keyword = keyword;
        }
    }

}
