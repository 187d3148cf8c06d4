package work.lcod.flow.analyzer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import work.lcod.flow.ast.ConfigBlock;
import work.lcod.flow.ast.ConfigEntry;
import work.lcod.flow.ast.ConfigValue;
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
import work.lcod.flow.diagnostics.FlowDiagnostic;
import work.lcod.flow.diagnostics.Severity;
import work.lcod.flow.diagnostics.Suggestions;
import work.lcod.flow.shared.DurationParser;

/**
 * Read-only validation pass over a parsed program.
 *
 * <p>Every problem is collected; nothing stops at the first error. Variables are tracked with a
 * scope chain that mirrors the runtime: a global scope ({@code env}, {@code request}), the
 * workflow scope and one child scope per loop body. Steps and if-branches share the scope of
 * the enclosing block.
 */
public final class Analyzer {
    public static final List<String> KNOWN_CONFIG_KEYS = List.of("name", "version", "timeout", "description");
    public static final List<String> GLOBAL_NAMES = List.of("env", "request");

    private final Program program;
    private final String source;
    private final String fileName;
    private final List<FlowDiagnostic> diagnostics = new ArrayList<>();
    private final Set<String> serviceNames = new LinkedHashSet<>();

    private Analyzer(Program program, String source, String fileName) {
        this.program = program;
        this.source = source;
        this.fileName = fileName;
    }

    public static List<FlowDiagnostic> analyze(Program program, String source, String fileName) {
        var analyzer = new Analyzer(program, source, fileName);
        analyzer.run();
        return List.copyOf(analyzer.diagnostics);
    }

    private void run() {
        program.config().ifPresent(this::analyzeConfig);
        program.services().ifPresent(this::analyzeServices);
        program.workflow().ifPresent(workflow -> {
            var global = Scope.root();
            var workflowScope = global.child();
            analyzeStatements(workflow.body(), workflowScope);
        });
    }

    // ---------------------------------------------------------------- config

    private void analyzeConfig(ConfigBlock config) {
        var seen = new HashSet<String>();
        for (ConfigEntry entry : config.entries()) {
            if (!seen.add(entry.key())) {
                error(entry.location(), "Duplicate config key \"" + entry.key() + "\". Each config key can only appear once.",
                    null, null);
            }
            if (!KNOWN_CONFIG_KEYS.contains(entry.key())) {
                String suggestion = Suggestions.closestMatch(entry.key(), KNOWN_CONFIG_KEYS)
                    .map(match -> "Did you mean \"" + match + "\"?")
                    .orElse(null);
                warning(entry.location(), "Unknown config key \"" + entry.key() + "\".", suggestion,
                    "Known config keys are: " + String.join(", ", KNOWN_CONFIG_KEYS));
                continue;
            }
            checkConfigShape(entry);
        }
    }

    private void checkConfigShape(ConfigEntry entry) {
        ConfigValue value = entry.value();
        switch (entry.key()) {
            case "name":
            case "description":
                if (!(value instanceof ConfigValue.Text)) {
                    error(entry.location(), "The config key \"" + entry.key() + "\" should be text.", null,
                        "Example: " + entry.key() + ": \"Order Processing\"");
                }
                break;
            case "timeout":
                if (value instanceof ConfigValue.Numeric numeric && numeric.value() < 0) {
                    error(entry.location(), "The timeout can't be negative.", null, null);
                } else if (value instanceof ConfigValue.Numeric numeric && !fitsDuration(numeric.value())) {
                    error(entry.location(), "The timeout is too long.", null, "Example: timeout: 30 seconds");
                } else if (value instanceof ConfigValue.Text text && !isDuration(text.value())) {
                    error(entry.location(), "I don't understand the timeout \"" + text.value() + "\".",
                        "Use a number of seconds or a duration like 5 minutes.", "Example: timeout: 30 seconds");
                }
                break;
            default:
                break;
        }
    }

    private static boolean fitsDuration(double seconds) {
        try {
            DurationParser.ofSeconds(seconds);
            return true;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    private static boolean isDuration(String text) {
        try {
            return DurationParser.parse(text).isPresent();
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    // -------------------------------------------------------------- services

    private void analyzeServices(ServicesBlock services) {
        for (ServiceDeclaration declaration : services.declarations()) {
            if (!serviceNames.add(declaration.name())) {
                error(declaration.location(),
                    "Duplicate service name \"" + declaration.name() + "\". Each service must have a unique name.", null, null);
            }
            if (declaration.headers().isEmpty()) {
                continue;
            }
            if (!declaration.kind().supportsHeaders()) {
                warning(declaration.headers().get(0).location(),
                    "Headers are not supported on " + declaration.kind().name().toLowerCase(Locale.ROOT)
                        + " services. They will be ignored.",
                    "Remove the \"with headers:\" block from \"" + declaration.name() + "\".", null);
            }
            var seenHeaders = new HashSet<String>();
            var headerScope = Scope.root();
            for (ServiceHeader header : declaration.headers()) {
                if (!seenHeaders.add(header.name().toLowerCase(Locale.ROOT))) {
                    warning(header.location(), "Duplicate header \"" + header.name() + "\" on service \""
                        + declaration.name() + "\". The last value will be used.", null, null);
                }
                checkExpression(header.value(), headerScope);
            }
        }
    }

    private void checkServiceReference(String name, SourceLocation location) {
        if (serviceNames.contains(name)) {
            return;
        }
        String suggestion = Suggestions.closestMatch(name, serviceNames)
            .map(match -> "Did you mean \"" + match + "\"?")
            .orElse(null);
        error(location, "I don't know what \"" + name + "\" is. You haven't declared it in your services block.", suggestion,
            "Every service must be declared at the top of your file:\n    services:\n        " + name
                + " is an API at \"https://...\"");
    }

    // ------------------------------------------------------------ statements

    private void analyzeStatements(List<Statement> statements, Scope scope) {
        var stepNames = new HashSet<String>();
        for (Statement statement : statements) {
            if (statement instanceof Statement.StepBlock step && !stepNames.add(step.name())) {
                error(step.location(), "Duplicate step name \"" + step.name() + "\". Each step must have a unique name.",
                    "Rename one of the steps to something different.", null);
            }
            analyzeStatement(statement, scope);
        }
    }

    private void analyzeStatement(Statement statement, Scope scope) {
        if (statement instanceof Statement.StepBlock step) {
            analyzeStatements(step.body(), scope);
        } else if (statement instanceof Statement.ServiceCall call) {
            analyzeServiceCall(call, scope);
        } else if (statement instanceof Statement.AskStatement ask) {
            checkServiceReference(ask.agent(), ask.location());
            checkExpression(ask.instruction(), scope);
            ask.resultVariable().ifPresent(scope::define);
            ask.confidenceVariable().ifPresent(scope::define);
        } else if (statement instanceof Statement.SetStatement set) {
            checkExpression(set.value(), scope);
            scope.define(set.variable());
        } else if (statement instanceof Statement.IfStatement ifStatement) {
            checkExpression(ifStatement.condition(), scope);
            analyzeStatements(ifStatement.body(), scope);
            for (OtherwiseIf branch : ifStatement.otherwiseIfs()) {
                checkExpression(branch.condition(), scope);
                analyzeStatements(branch.body(), scope);
            }
            ifStatement.otherwise().ifPresent(body -> analyzeStatements(body, scope));
        } else if (statement instanceof Statement.ForEachStatement loop) {
            checkExpression(loop.collection(), scope);
            var loopScope = scope.child();
            loopScope.define(loop.itemName());
            analyzeStatements(loop.body(), loopScope);
        } else if (statement instanceof Statement.LogStatement logStatement) {
            checkExpression(logStatement.message(), scope);
        } else if (statement instanceof Statement.CompleteStatement complete) {
            for (Parameter output : complete.outputs()) {
                checkExpression(output.value(), scope);
            }
        } else if (statement instanceof Statement.RejectStatement reject) {
            checkExpression(reject.message(), scope);
        } else {
            throw new IllegalStateException("Unknown statement " + statement);
        }
    }

    private void analyzeServiceCall(Statement.ServiceCall call, Scope scope) {
        Optional<String> service = call.service();
        if (service.isEmpty()) {
            error(call.location(), "I don't know which service to use for \"" + call.action() + "\".",
                "Add \"using\" followed by one of your services.", "Example: " + call.action() + " using MyService");
        } else {
            checkServiceReference(service.get(), call.location());
        }
        call.path().ifPresent(path -> checkExpression(path, scope));
        for (Parameter parameter : call.parameters()) {
            checkExpression(parameter.value(), scope);
        }
        call.resultVariable().ifPresent(scope::define);
        call.statusVariable().ifPresent(scope::define);
        call.headersVariable().ifPresent(scope::define);
        call.errorHandler()
            .flatMap(ErrorHandler::fallback)
            .ifPresent(fallback -> analyzeStatements(fallback, scope));
    }

    // ----------------------------------------------------------- expressions

    private void checkExpression(Expression expression, Scope scope) {
        if (expression instanceof Expression.Identifier identifier) {
            if (!scope.isDefined(identifier.name())) {
                String suggestion = Suggestions.closestMatch(identifier.name(), scope.visibleNames())
                    .map(match -> "Did you mean \"" + match + "\"?")
                    .orElse(null);
                error(identifier.location(),
                    "I don't recognize the variable \"" + identifier.name() + "\". It hasn't been set yet.", suggestion,
                    "Variables must be created with \"set\" before they can be used:\n    set " + identifier.name() + " to ...");
            }
        } else if (expression instanceof InterpolatedString interpolated) {
            for (InterpolatedString.Part part : interpolated.parts()) {
                if (part instanceof InterpolatedString.ExpressionPart expressionPart) {
                    checkExpression(expressionPart.expression(), scope);
                }
            }
        } else if (expression instanceof Expression.MathExpression math) {
            checkExpression(math.left(), scope);
            checkExpression(math.right(), scope);
        } else if (expression instanceof Expression.ComparisonExpression comparison) {
            checkExpression(comparison.left(), scope);
            comparison.right().ifPresent(right -> checkExpression(right, scope));
        } else if (expression instanceof Expression.LogicalExpression logical) {
            checkExpression(logical.left(), scope);
            logical.right().ifPresent(right -> checkExpression(right, scope));
        }
        // Literals carry no names; dot-access roots may be external data and are not checked.
    }

    private void error(SourceLocation location, String message, String suggestion, String hint) {
        report(Severity.ERROR, location, message, suggestion, hint);
    }

    private void warning(SourceLocation location, String message, String suggestion, String hint) {
        report(Severity.WARNING, location, message, suggestion, hint);
    }

    private void report(Severity severity, SourceLocation location, String message, String suggestion, String hint) {
        diagnostics.add(FlowDiagnostic.of(severity, fileName, location.line(), location.column(), message, source,
            suggestion, hint));
    }

    /** Names visible at one point of the traversal. */
    private static final class Scope {
        private final Set<String> names = new LinkedHashSet<>();
        private final Scope parent;

        private Scope(Scope parent) {
            this.parent = parent;
        }

        static Scope root() {
            var scope = new Scope(null);
            GLOBAL_NAMES.forEach(scope::define);
            return scope;
        }

        Scope child() {
            return new Scope(this);
        }

        void define(String name) {
            names.add(name);
        }

        boolean isDefined(String name) {
            for (Scope scope = this; scope != null; scope = scope.parent) {
                if (scope.names.contains(name)) {
                    return true;
                }
            }
            return false;
        }

        List<String> visibleNames() {
            var visible = new ArrayList<String>();
            for (Scope scope = this; scope != null; scope = scope.parent) {
                visible.addAll(scope.names);
            }
            return visible;
        }
    }
}
