package com.github.musiKk.haumea;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.stream.Collectors;

import com.github.musiKk.haumea.exception.CompileException;
import com.github.musiKk.haumea.exception.InternalConsistencyException;
import com.github.musiKk.haumea.parser.Parser;
import com.github.musiKk.haumea.parser.Program;
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

import lombok.RequiredArgsConstructor;
import lombok.Setter;
import lombok.extern.java.Log;

/**
 * Translates haumea programs to C.
 */
@Log
public class Compiler implements ConfigReader.ConfigTarget {

    static final String PROLOGUE = """
            /* Haumea prolog */
            #include <stdio.h>

            long display(long n) {
                printf("%ld\\n", n);
                return 0;
            }

            long read() {
                printf("Enter an integer: ");
                long n;
                scanf("%ld", &n);
                return n;
            }

            /* End prolog */

            /* Start compiled program */
            """;

    static final String EPILOGUE = """

            /* End compiled program */
            """;

    static final String INTEGER_TYPE = "long";

    private static final Map<Operator, String> C_OPERATORS = new EnumMap<>(Operator.class);

    static {
        C_OPERATORS.put(Operator.ADD, "+");
        C_OPERATORS.put(Operator.SUB, "-");
        C_OPERATORS.put(Operator.NEGATE, "-");
        C_OPERATORS.put(Operator.MUL, "*");
        C_OPERATORS.put(Operator.DIV, "/");
        C_OPERATORS.put(Operator.MODULO, "%");
        C_OPERATORS.put(Operator.EQUALS, "==");
        C_OPERATORS.put(Operator.NOT_EQUALS, "!=");
        C_OPERATORS.put(Operator.GT, ">");
        C_OPERATORS.put(Operator.LT, "<");
        C_OPERATORS.put(Operator.GTE, ">=");
        C_OPERATORS.put(Operator.LTE, "<=");
        C_OPERATORS.put(Operator.LOGICAL_AND, "&&");
        C_OPERATORS.put(Operator.LOGICAL_OR, "||");
        C_OPERATORS.put(Operator.LOGICAL_NOT, "!");
        C_OPERATORS.put(Operator.BINARY_AND, "&");
        C_OPERATORS.put(Operator.BINARY_OR, "|");
        C_OPERATORS.put(Operator.BINARY_NOT, "~");
    }

    private static final Set<Operator> PREFIX_OPERATORS = EnumSet.of(Operator.NEGATE, Operator.LOGICAL_NOT, Operator.BINARY_NOT);

    /** Spaces per nesting level. */
    @Setter
    private int indent = 4;
    @Setter
    private String tempPrefix = "__HAUMEA_TEMP_";

    public static void main(String[] args) {
        var compiler = new Compiler();
        ConfigReader.readConfig().applyConfig(compiler);
        System.exit(compiler.run(args, System.in, System.out, System.err));
    }

    /**
     * Compiles the file named by {@code args[0]}, or all of {@code in} when there are no arguments, and
     * writes the C program to {@code out}. Nothing is written to {@code out} when compilation fails.
     *
     * @return the process exit status
     */
    int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        String programString;
        try {
            if (args.length > 0) {
                programString = Files.readString(Path.of(args[0]));
            } else {
                programString = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            err.println("error: cannot read input: " + e.getMessage());
            log.log(Level.FINE, "reading input failed", e);
            return 1;
        }

        try {
            out.print(compile(programString));
            out.flush();
            return 0;
        } catch (CompileException e) {
            err.println("error: " + e.getMessage());
            log.log(Level.FINE, "compilation failed", e);
            return 1;
        }
    }

    /**
     * Runs the whole pipeline on one source text.
     *
     * @throws CompileException on the first lexical or syntax error
     */
    public String compile(String programString) {
        var tokens = new Tokenizer().tokenize(programString);
        var program = new Parser().parse(tokens);
        return generate(program);
    }

    /**
     * Generates the C text for {@code program}. Temporary names start from 1 again on every call.
     */
    public String generate(Program program) {
        var emitter = new OutputEmitter(" ".repeat(indent), new Temporaries(tempPrefix));
        emitter.emitProgram(program);
        var output = emitter.output();
        log.fine(() -> "generated " + output.length() + " characters for " + program.functions().size() + " function(s)");
        return output;
    }

    /** Mints the names of the variables that hold {@code for each} bounds. */
    @RequiredArgsConstructor
    static class Temporaries {
        private final String prefix;
        private int count = 0;

        String newTemp() {
            return prefix + (++count);
        }
    }

    @RequiredArgsConstructor
    static class OutputEmitter {
        private final String indentUnit;
        private final Temporaries temporaries;
        private final StringBuilder out = new StringBuilder();

        String output() {
            return out.toString();
        }

        void emitProgram(Program program) {
            emit(PROLOGUE);
            program.functions().forEach(this::emitFunction);
            emit(EPILOGUE);
        }

        void emitFunction(FunctionDeclaration function) {
            var returnType = function.name().equals("main") ? "int" : INTEGER_TYPE;
            var parameters = function.parameters().orElse(List.of()).stream()
                    .map(p -> INTEGER_TYPE + " " + p)
                    .collect(Collectors.joining(", "));

            emit("\n");
            emitLineNl(returnType + " " + function.name() + "(" + parameters + ") {", 0);
            emitStatement(function.body(), 1);
            // falling off the end returns 0
            emitLineNl("return 0;", 1);
            emitLineNl("}", 0);
        }

        void emitStatement(Statement statement, int depth) {
            if (statement instanceof ReturnStatement rs) {
                emitLineNl("return " + compileExpression(rs.value()) + ";", depth);
            } else if (statement instanceof BlockStatement bs) {
                emitLineNl("{", depth);
                bs.statements().forEach(s -> emitStatement(s, depth + 1));
                emitLineNl("}", depth);
            } else if (statement instanceof CallStatement cs) {
                emitLineNl(compileCall(cs.name(), cs.arguments()) + ";", depth);
            } else if (statement instanceof VariableDeclaration vd) {
                emitLineNl(INTEGER_TYPE + " " + vd.name() + ";", depth);
            } else if (statement instanceof AssignmentStatement as) {
                emitLineNl(as.name() + " = " + compileExpression(as.value()) + ";", depth);
            } else if (statement instanceof ChangeStatement cs) {
                emitLineNl(cs.name() + " += " + compileExpression(cs.amount()) + ";", depth);
            } else if (statement instanceof IfStatement is) {
                emitLineNl("if " + compileCondition(is.condition()), depth);
                emitBody(is.thenBranch(), depth);
                if (is.elseBranch().isPresent()) {
                    emitLineNl("else", depth);
                    emitBody(is.elseBranch().get(), depth);
                }
            } else if (statement instanceof ForeverStatement fs) {
                emitLineNl("while (1)", depth);
                emitBody(fs.body(), depth);
            } else if (statement instanceof WhileStatement ws) {
                emitLineNl("while " + compileCondition(ws.condition()), depth);
                emitBody(ws.body(), depth);
            } else if (statement instanceof ForEachStatement fes) {
                emitForEach(fes, depth);
            } else {
                throw new InternalConsistencyException("cannot compile statement " + statement);
            }
        }

        /**
         * Emits the body of an {@code if}, {@code else} or loop header written at {@code depth}. Braced
         * bodies line up with the header. A lone declaration is no valid C body and gets braces.
         */
        private void emitBody(Statement body, int depth) {
            if (body instanceof BlockStatement || body instanceof ForEachStatement) {
                emitStatement(body, depth);
            } else if (body instanceof VariableDeclaration) {
                emitLineNl("{", depth);
                emitStatement(body, depth + 1);
                emitLineNl("}", depth);
            } else {
                emitStatement(body, depth + 1);
            }
        }

        // C has no range loop, so the bounds and the step are evaluated once into temporaries and the
        // direction of the loop is decided at runtime from start and end
        private void emitForEach(ForEachStatement fes, int depth) {
            var startName = temporaries.newTemp();
            var endName = temporaries.newTemp();
            var stepName = temporaries.newTemp();

            String ascending;
            String descending;
            if (fes.rangeKind() == RangeKind.TO) {
                ascending = "<";
                descending = ">";
            } else if (fes.rangeKind() == RangeKind.THROUGH) {
                ascending = "<=";
                descending = ">=";
            } else {
                throw new InternalConsistencyException("no range kind in " + fes);
            }

            var variable = fes.variable();
            var test = String.format("(%s <= %s ? %s %s %s : %s %s %s)",
                    startName, endName,
                    variable, ascending, endName,
                    variable, descending, endName);

            emitLineNl("{", depth);
            emitLineNl(INTEGER_TYPE + " " + startName + " = " + compileExpression(fes.start()) + ";", depth + 1);
            emitLineNl(INTEGER_TYPE + " " + endName + " = " + compileExpression(fes.end()) + ";", depth + 1);
            emitLineNl(INTEGER_TYPE + " " + stepName + " = " + compileExpression(fes.step()) + ";", depth + 1);
            emitLineNl(String.format("for (%s %s = %s; %s; %s += %s)",
                    INTEGER_TYPE, variable, startName, test, variable, stepName), depth + 1);
            emitBody(fes.body(), depth + 1);
            emitLineNl("}", depth);
        }

        String compileExpression(Expression expression) {
            if (expression instanceof NumberExpression ne) {
                // long like every variable; a bare literal is a 32-bit int in C
                return ne.value() + "L";
            } else if (expression instanceof VariableExpression ve) {
                return ve.name();
            } else if (expression instanceof BinaryExpression be) {
                if (PREFIX_OPERATORS.contains(be.operator())) {
                    throw new InternalConsistencyException(be.operator() + " used as a binary operator");
                }
                return "(" + compileExpression(be.left()) + " " + cOperator(be.operator()) + " " + compileExpression(be.right()) + ")";
            } else if (expression instanceof UnaryExpression ue) {
                if (!PREFIX_OPERATORS.contains(ue.operator())) {
                    throw new InternalConsistencyException(ue.operator() + " used as a prefix operator");
                }
                return "(" + cOperator(ue.operator()) + compileExpression(ue.operand()) + ")";
            } else if (expression instanceof FunctionEvaluationExpression fee) {
                return compileCall(fee.name(), fee.arguments());
            }
            throw new InternalConsistencyException("cannot compile expression " + expression);
        }

        // operator expressions compile with their own parentheses already
        private String compileCondition(Expression condition) {
            var compiled = compileExpression(condition);
            if (condition instanceof BinaryExpression || condition instanceof UnaryExpression) {
                return compiled;
            }
            return "(" + compiled + ")";
        }

        private String compileCall(String name, List<Expression> arguments) {
            return name + "(" + arguments.stream()
                    .map(this::compileExpression)
                    .collect(Collectors.joining(", ")) + ")";
        }

        private static String cOperator(Operator operator) {
            var cOperator = C_OPERATORS.get(operator);
            if (cOperator == null) {
                throw new InternalConsistencyException("no C spelling for " + operator);
            }
            return cOperator;
        }

        void emitLineNl(String line, int depth) {
            emit(indentUnit.repeat(depth));
            emit(line);
            emit("\n");
        }

        void emit(String text) {
            out.append(text);
        }
    }

}
