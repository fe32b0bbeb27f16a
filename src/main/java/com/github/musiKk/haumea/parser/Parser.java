package com.github.musiKk.haumea.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.github.musiKk.haumea.Tokenizer.Token;
import com.github.musiKk.haumea.Tokenizer.TokenType;
import com.github.musiKk.haumea.Tokenizer.Tokens;
import com.github.musiKk.haumea.exception.SyntaxException;
import com.github.musiKk.haumea.parser.Program.AssignmentStatement;
import com.github.musiKk.haumea.parser.Program.BinaryExpression;
import com.github.musiKk.haumea.parser.Program.BlockStatement;
import com.github.musiKk.haumea.parser.Program.CallStatement;
import com.github.musiKk.haumea.parser.Program.ChangeStatement;
import com.github.musiKk.haumea.parser.Program.Expression;
import com.github.musiKk.haumea.parser.Program.ForEachStatement;
import com.github.musiKk.haumea.parser.Program.ForeverStatement;
import com.github.musiKk.haumea.parser.Program.FunctionDeclaration;
import com.github.musiKk.haumea.parser.Program.FunctionEvaluationExpression;
import com.github.musiKk.haumea.parser.Program.IfStatement;
import com.github.musiKk.haumea.parser.Program.NumberExpression;
import com.github.musiKk.haumea.parser.Program.Operator;
import com.github.musiKk.haumea.parser.Program.RangeKind;
import com.github.musiKk.haumea.parser.Program.ReturnStatement;
import com.github.musiKk.haumea.parser.Program.Statement;
import com.github.musiKk.haumea.parser.Program.UnaryExpression;
import com.github.musiKk.haumea.parser.Program.VariableDeclaration;
import com.github.musiKk.haumea.parser.Program.VariableExpression;
import com.github.musiKk.haumea.parser.Program.WhileStatement;

import lombok.extern.java.Log;

/**
 * Recursive descent parser for haumea. Stops at the first token that does not fit.
 *
 * <p>Every binary precedence level parses its right operand by calling itself, so all binary
 * operators associate to the right: {@code 10 - 2 - 3} is {@code 10 - (2 - 3)}. Prefix operators take
 * a whole expression as their operand, so {@code -1 + 2} is {@code -(1 + 2)}.
 */
@Log
public class Parser {

    private static final Map<String, Operator> PREFIX = Map.of(
            "-", Operator.NEGATE,
            "not", Operator.LOGICAL_NOT,
            "~", Operator.BINARY_NOT);
    private static final Map<String, Operator> MULTIPLICATIVE = Map.of(
            "*", Operator.MUL,
            "/", Operator.DIV,
            "modulo", Operator.MODULO);
    private static final Map<String, Operator> ADDITIVE = Map.of(
            "+", Operator.ADD,
            "-", Operator.SUB);
    private static final Map<String, Operator> RELATIONAL = Map.of(
            ">", Operator.GT,
            ">=", Operator.GTE,
            "<", Operator.LT,
            "<=", Operator.LTE,
            "=", Operator.EQUALS,
            "!=", Operator.NOT_EQUALS);
    private static final Map<String, Operator> LOGICAL = Map.of(
            "and", Operator.LOGICAL_AND,
            "or", Operator.LOGICAL_OR,
            "&", Operator.BINARY_AND,
            "|", Operator.BINARY_OR);

    /**
     * Parses a whole program, consuming every token.
     *
     * @throws SyntaxException at the first token that does not fit the grammar
     * @throws com.github.musiKk.haumea.exception.LexicalException if an error token is reached
     */
    public Program parse(Iterable<Token> tokens) {
        return parseProgram(new Tokens(tokens));
    }

    Program parseProgram(Tokens tokens) {
        List<FunctionDeclaration> functions = new ArrayList<>();

        while (!tokens.atEnd()) {
            functions.add(parseFunction(tokens));
        }

        log.fine(() -> "parsed " + functions.size() + " function(s)");
        return new Program(functions);
    }

    // <> to name ("with" "(" parameters* ")")? statement
    FunctionDeclaration parseFunction(Tokens tokens) {
        tokens.nextKeyword("to");
        var nameToken = tokens.next(TokenType.IDENTIFIER, "a function name");
        var parameters = parseSignature(tokens);
        var body = parseStatement(tokens);
        return new FunctionDeclaration(nameToken.image(), parameters, body);
    }

    private Optional<List<String>> parseSignature(Tokens tokens) {
        if (!tokens.matchesKeyword("with")) {
            return Optional.empty();
        }
        tokens.nextKeyword("with");
        tokens.next(TokenType.LPAREN, "'('");

        List<String> parameters = new ArrayList<>();
        if (tokens.matches(TokenType.RPAREN)) {
            tokens.next();
            return Optional.of(parameters);
        }
        while (true) {
            var parameterToken = tokens.next(TokenType.IDENTIFIER, "a parameter name");
            parameters.add(parameterToken.image());
            if (tokens.matches(TokenType.RPAREN)) {
                tokens.next();
                break;
            }
            tokens.next(TokenType.COMMA, "',' or ')'");
        }
        return Optional.of(parameters);
    }

    Statement parseStatement(Tokens tokens) {
        var token = tokens.peek();

        if (token.type() == TokenType.IDENTIFIER) {
            return parseCallStatement(tokens);
        }
        if (token.type() != TokenType.KEYWORD) {
            throw new SyntaxException("a statement", token);
        }

        return switch (token.image()) {
            case "return" -> {
                tokens.next();
                yield new ReturnStatement(parseExpression(tokens));
            }
            case "do" -> parseBlockStatement(tokens);
            case "if" -> parseIfStatement(tokens);
            case "set" -> {
                tokens.next();
                var nameToken = tokens.next(TokenType.IDENTIFIER, "a variable name");
                tokens.nextKeyword("to");
                yield new AssignmentStatement(nameToken.image(), parseExpression(tokens));
            }
            case "change" -> {
                tokens.next();
                var nameToken = tokens.next(TokenType.IDENTIFIER, "a variable name");
                tokens.nextKeyword("by");
                yield new ChangeStatement(nameToken.image(), parseExpression(tokens));
            }
            case "variable" -> {
                tokens.next();
                var nameToken = tokens.next(TokenType.IDENTIFIER, "a variable name");
                yield new VariableDeclaration(nameToken.image());
            }
            case "forever" -> {
                tokens.next();
                yield new ForeverStatement(parseStatement(tokens));
            }
            case "while" -> {
                tokens.next();
                var condition = parseExpression(tokens);
                yield new WhileStatement(condition, parseStatement(tokens));
            }
            case "for" -> parseForEachStatement(tokens);
            default -> throw new SyntaxException("a statement", token);
        };
    }

    // <> do statement* end
    private BlockStatement parseBlockStatement(Tokens tokens) {
        tokens.nextKeyword("do");
        List<Statement> statements = new ArrayList<>();
        while (!tokens.matchesKeyword("end")) {
            if (tokens.atEnd()) {
                throw new SyntaxException("'end'", tokens.peek());
            }
            statements.add(parseStatement(tokens));
        }
        tokens.nextKeyword("end");
        return new BlockStatement(statements);
    }

    // <> if expression then statement (else statement)?
    private IfStatement parseIfStatement(Tokens tokens) {
        tokens.nextKeyword("if");
        var condition = parseExpression(tokens);
        tokens.nextKeyword("then");
        var thenBranch = parseStatement(tokens);
        var elseBranch = Optional.<Statement>empty();
        if (tokens.matchesKeyword("else")) {
            tokens.next();
            elseBranch = Optional.of(parseStatement(tokens));
        }
        return new IfStatement(condition, thenBranch, elseBranch);
    }

    // <> for each name in expression (to | through) expression (by expression)? statement
    private ForEachStatement parseForEachStatement(Tokens tokens) {
        tokens.nextKeyword("for");
        tokens.nextKeyword("each");
        var variableToken = tokens.next(TokenType.IDENTIFIER, "a loop variable");
        tokens.nextKeyword("in");
        var start = parseExpression(tokens);

        var rangeToken = tokens.peek();
        RangeKind rangeKind;
        if (rangeToken.is(TokenType.KEYWORD, RangeKind.TO.keyword)) {
            rangeKind = RangeKind.TO;
        } else if (rangeToken.is(TokenType.KEYWORD, RangeKind.THROUGH.keyword)) {
            rangeKind = RangeKind.THROUGH;
        } else {
            throw new SyntaxException("'to' or 'through'", rangeToken);
        }
        tokens.next();
        var end = parseExpression(tokens);

        Expression step = new NumberExpression(1);
        if (tokens.matchesKeyword("by")) {
            tokens.next();
            step = parseExpression(tokens);
        }

        var body = parseStatement(tokens);
        return new ForEachStatement(variableToken.image(), start, end, step, rangeKind, body);
    }

    // <> name "(" arguments* ")"
    private CallStatement parseCallStatement(Tokens tokens) {
        var nameToken = tokens.next(TokenType.IDENTIFIER, "a function name");
        return new CallStatement(nameToken.image(), parseArguments(tokens));
    }

    Expression parseExpression(Tokens tokens) {
        return parseLogical(tokens);
    }

    private Expression parseLogical(Tokens tokens) {
        var left = parseComparison(tokens);
        var operator = nextOperator(tokens, LOGICAL);
        if (operator.isEmpty()) {
            return left;
        }
        return new BinaryExpression(left, operator.get(), parseLogical(tokens));
    }

    private Expression parseComparison(Tokens tokens) {
        var left = parsePlus(tokens);
        var operator = nextOperator(tokens, RELATIONAL);
        if (operator.isEmpty()) {
            return left;
        }
        return new BinaryExpression(left, operator.get(), parseComparison(tokens));
    }

    private Expression parsePlus(Tokens tokens) {
        var left = parseTimes(tokens);
        var operator = nextOperator(tokens, ADDITIVE);
        if (operator.isEmpty()) {
            return left;
        }
        return new BinaryExpression(left, operator.get(), parsePlus(tokens));
    }

    private Expression parseTimes(Tokens tokens) {
        var left = parseAtom(tokens);
        var operator = nextOperator(tokens, MULTIPLICATIVE);
        if (operator.isEmpty()) {
            return left;
        }
        return new BinaryExpression(left, operator.get(), parseTimes(tokens));
    }

    private Optional<Operator> nextOperator(Tokens tokens, Map<String, Operator> level) {
        if (!tokens.matches(TokenType.OPERATOR)) {
            return Optional.empty();
        }
        var operator = level.get(tokens.peek().image());
        if (operator != null) {
            tokens.next();
        }
        return Optional.ofNullable(operator);
    }

    private Expression parseAtom(Tokens tokens) {
        var token = tokens.peek();

        return switch (token.type()) {
            case LPAREN -> {
                tokens.next();
                var e = parseExpression(tokens);
                tokens.next(TokenType.RPAREN, "')'");
                yield e;
            }
            case NUMBER -> {
                tokens.next();
                yield new NumberExpression(token.intValue());
            }
            case IDENTIFIER -> parseNameExpression(tokens);
            case OPERATOR -> {
                var operator = PREFIX.get(token.image());
                if (operator == null) {
                    throw new SyntaxException("an expression", token);
                }
                tokens.next();
                yield new UnaryExpression(operator, parseExpression(tokens));
            }
            default -> throw new SyntaxException("an expression", token);
        };
    }

    private Expression parseNameExpression(Tokens tokens) {
        var nameToken = tokens.next(TokenType.IDENTIFIER, "an identifier");
        if (tokens.matches(TokenType.LPAREN)) {
            return new FunctionEvaluationExpression(nameToken.image(), parseArguments(tokens));
        }
        return new VariableExpression(nameToken.image());
    }

    // "(" (expression ("," expression)*)? ")"
    private List<Expression> parseArguments(Tokens tokens) {
        tokens.next(TokenType.LPAREN, "'('");

        List<Expression> arguments = new ArrayList<>();
        if (tokens.matches(TokenType.RPAREN)) {
            tokens.next();
            return arguments;
        }
        while (true) {
            arguments.add(parseExpression(tokens));
            if (tokens.matches(TokenType.RPAREN)) {
                tokens.next();
                break;
            }
            tokens.next(TokenType.COMMA, "',' or ')'");
        }
        return arguments;
    }

}
