package work.lcod.flow.support;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import work.lcod.flow.ast.ConfigBlock;
import work.lcod.flow.ast.ConfigEntry;
import work.lcod.flow.ast.ErrorHandler;
import work.lcod.flow.ast.Expression;
import work.lcod.flow.ast.Expression.InterpolatedString;
import work.lcod.flow.ast.OtherwiseIf;
import work.lcod.flow.ast.Parameter;
import work.lcod.flow.ast.Program;
import work.lcod.flow.ast.ServiceDeclaration;
import work.lcod.flow.ast.ServiceHeader;
import work.lcod.flow.ast.ServicesBlock;
import work.lcod.flow.ast.SourceLocation;
import work.lcod.flow.ast.Statement;
import work.lcod.flow.ast.Trigger;
import work.lcod.flow.ast.WorkflowBlock;
import work.lcod.flow.parser.ParseResult;
import work.lcod.flow.parser.Parser;
import work.lcod.flow.runtime.ExecutionResult;
import work.lcod.flow.runtime.Interpreter;
import work.lcod.flow.runtime.LogEntry;
import work.lcod.flow.runtime.RuntimeOptions;

/**
 * Shared helpers for the Flow test suites: fixture lookup, parse-and-run shortcuts and an AST
 * normalizer that drops source locations so trees can be compared structurally.
 */
public final class FlowTestSupport {
    private FlowTestSupport() {}

    public static Path flowFile(String name) {
        return Path.of("src", "test", "resources", "flows", name).toAbsolutePath();
    }

    public static Path inputFile(String name) {
        return Path.of("src", "test", "resources", "inputs", name).toAbsolutePath();
    }

    public static Path settingsDirectory() {
        return Path.of("src", "test", "resources", "settings").toAbsolutePath();
    }

    public static String read(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    /** Joins lines with newlines and a trailing newline; keeps Flow snippets readable in tests. */
    public static String source(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    /** Parses {@code source} and fails the test on syntax errors. */
    public static Program parse(String source) {
        ParseResult result = Parser.parse(source, "test.flow");
        assertTrue(result.errors().isEmpty(), () -> "Unexpected syntax errors: " + result.errors());
        return result.program();
    }

    public static ExecutionResult run(String source) {
        return run(source, RuntimeOptions.builder());
    }

    public static ExecutionResult run(String source, RuntimeOptions.Builder options) {
        return Interpreter.execute(parse(source), source, options.fileName("test.flow").build()).join();
    }

    public static ExecutionResult run(String source, Map<String, Object> input) {
        return run(source, RuntimeOptions.builder().input(input));
    }

    public static List<String> actions(List<LogEntry> log) {
        return log.stream().map(LogEntry::action).collect(Collectors.toList());
    }

    // ------------------------------------------------------------- normalize

    public static Program withoutLocations(Program program) {
        return new Program(
            program.config().map(FlowTestSupport::config),
            program.services().map(FlowTestSupport::services),
            program.workflow().map(FlowTestSupport::workflow),
            SourceLocation.NONE
        );
    }

    private static ConfigBlock config(ConfigBlock block) {
        var entries = new ArrayList<ConfigEntry>();
        for (ConfigEntry entry : block.entries()) {
            entries.add(new ConfigEntry(entry.key(), entry.value(), SourceLocation.NONE));
        }
        return new ConfigBlock(entries, SourceLocation.NONE);
    }

    private static ServicesBlock services(ServicesBlock block) {
        var declarations = new ArrayList<ServiceDeclaration>();
        for (ServiceDeclaration declaration : block.declarations()) {
            var headers = new ArrayList<ServiceHeader>();
            for (ServiceHeader header : declaration.headers()) {
                headers.add(new ServiceHeader(header.name(), expression(header.value()), SourceLocation.NONE));
            }
            declarations.add(new ServiceDeclaration(declaration.name(), declaration.kind(), declaration.target(), headers,
                SourceLocation.NONE));
        }
        return new ServicesBlock(declarations, SourceLocation.NONE);
    }

    private static WorkflowBlock workflow(WorkflowBlock block) {
        return new WorkflowBlock(
            block.trigger().map(trigger -> new Trigger(trigger.description(), SourceLocation.NONE)),
            statements(block.body()),
            SourceLocation.NONE
        );
    }

    private static List<Statement> statements(List<Statement> statements) {
        var copy = new ArrayList<Statement>();
        for (Statement statement : statements) {
            copy.add(statement(statement));
        }
        return copy;
    }

    private static Statement statement(Statement statement) {
        if (statement instanceof Statement.StepBlock step) {
            return new Statement.StepBlock(step.name(), statements(step.body()), SourceLocation.NONE);
        }
        if (statement instanceof Statement.ServiceCall call) {
            return new Statement.ServiceCall(
                call.verb(),
                call.description(),
                call.service(),
                call.path().map(FlowTestSupport::expression),
                parameters(call.parameters()),
                call.resultVariable(),
                call.statusVariable(),
                call.headersVariable(),
                call.errorHandler().map(FlowTestSupport::errorHandler),
                SourceLocation.NONE
            );
        }
        if (statement instanceof Statement.AskStatement ask) {
            return new Statement.AskStatement(ask.agent(), expression(ask.instruction()), ask.resultVariable(),
                ask.confidenceVariable(), SourceLocation.NONE);
        }
        if (statement instanceof Statement.SetStatement set) {
            return new Statement.SetStatement(set.variable(), expression(set.value()), SourceLocation.NONE);
        }
        if (statement instanceof Statement.IfStatement ifStatement) {
            var branches = new ArrayList<OtherwiseIf>();
            for (OtherwiseIf branch : ifStatement.otherwiseIfs()) {
                branches.add(new OtherwiseIf(expression(branch.condition()), statements(branch.body()), SourceLocation.NONE));
            }
            return new Statement.IfStatement(expression(ifStatement.condition()), statements(ifStatement.body()), branches,
                ifStatement.otherwise().map(FlowTestSupport::statements), SourceLocation.NONE);
        }
        if (statement instanceof Statement.ForEachStatement loop) {
            return new Statement.ForEachStatement(loop.itemName(), expression(loop.collection()), statements(loop.body()),
                SourceLocation.NONE);
        }
        if (statement instanceof Statement.LogStatement logStatement) {
            return new Statement.LogStatement(expression(logStatement.message()), SourceLocation.NONE);
        }
        if (statement instanceof Statement.CompleteStatement complete) {
            return new Statement.CompleteStatement(parameters(complete.outputs()), SourceLocation.NONE);
        }
        if (statement instanceof Statement.RejectStatement reject) {
            return new Statement.RejectStatement(expression(reject.message()), SourceLocation.NONE);
        }
        throw new IllegalStateException("Unknown statement " + statement);
    }

    private static ErrorHandler errorHandler(ErrorHandler handler) {
        return new ErrorHandler(handler.kind(), handler.retryCount(), handler.retryWait(),
            handler.fallback().map(FlowTestSupport::statements), SourceLocation.NONE);
    }

    private static List<Parameter> parameters(List<Parameter> parameters) {
        var copy = new ArrayList<Parameter>();
        for (Parameter parameter : parameters) {
            copy.add(new Parameter(parameter.name(), expression(parameter.value()), SourceLocation.NONE));
        }
        return copy;
    }

    public static Expression expression(Expression expression) {
        if (expression instanceof Expression.StringLiteral literal) {
            return new Expression.StringLiteral(literal.value(), SourceLocation.NONE);
        }
        if (expression instanceof InterpolatedString interpolated) {
            var parts = new ArrayList<InterpolatedString.Part>();
            for (InterpolatedString.Part part : interpolated.parts()) {
                if (part instanceof InterpolatedString.ExpressionPart expressionPart) {
                    parts.add(new InterpolatedString.ExpressionPart(expression(expressionPart.expression())));
                } else {
                    parts.add(part);
                }
            }
            return new InterpolatedString(parts, SourceLocation.NONE);
        }
        if (expression instanceof Expression.NumberLiteral literal) {
            return new Expression.NumberLiteral(literal.value(), SourceLocation.NONE);
        }
        if (expression instanceof Expression.BooleanLiteral literal) {
            return new Expression.BooleanLiteral(literal.value(), SourceLocation.NONE);
        }
        if (expression instanceof Expression.Identifier identifier) {
            return new Expression.Identifier(identifier.name(), SourceLocation.NONE);
        }
        if (expression instanceof Expression.DotAccess access) {
            return new Expression.DotAccess((Expression.Identifier) expression(access.root()), access.properties(),
                SourceLocation.NONE);
        }
        if (expression instanceof Expression.MathExpression math) {
            return new Expression.MathExpression(expression(math.left()), math.operator(), expression(math.right()),
                SourceLocation.NONE);
        }
        if (expression instanceof Expression.ComparisonExpression comparison) {
            return new Expression.ComparisonExpression(expression(comparison.left()), comparison.operator(),
                comparison.right().map(FlowTestSupport::expression), SourceLocation.NONE);
        }
        if (expression instanceof Expression.LogicalExpression logical) {
            return new Expression.LogicalExpression(logical.operator(), expression(logical.left()),
                logical.right().map(FlowTestSupport::expression), SourceLocation.NONE);
        }
        throw new IllegalStateException("Unknown expression " + expression);
    }

    public static <T> T only(List<T> items) {
        assertTrue(items.size() == 1, () -> "Expected exactly one element but got " + items);
        return items.get(0);
    }

    public static Optional<LogEntry> firstEntry(List<LogEntry> log, String action) {
        return log.stream().filter(entry -> entry.action().equals(action)).findFirst();
    }
}
