package work.lcod.flow.parser;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import work.lcod.flow.ast.ConfigBlock;
import work.lcod.flow.ast.ConfigEntry;
import work.lcod.flow.ast.ConfigValue;
import work.lcod.flow.ast.ErrorHandler;
import work.lcod.flow.ast.Expression;
import work.lcod.flow.ast.Expression.InterpolatedString;
import work.lcod.flow.ast.LogicalOperator;
import work.lcod.flow.ast.OtherwiseIf;
import work.lcod.flow.ast.Parameter;
import work.lcod.flow.ast.Program;
import work.lcod.flow.ast.ServiceDeclaration;
import work.lcod.flow.ast.ServiceHeader;
import work.lcod.flow.ast.ServicesBlock;
import work.lcod.flow.ast.Statement;
import work.lcod.flow.ast.WorkflowBlock;

/**
 * Renders an AST back to canonical Flow source. Parsing the output yields the same tree
 * (source locations aside), and printing that tree again gives identical text.
 */
public final class AstPrinter {
    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();

    private AstPrinter() {}

    public static String print(Program program) {
        var printer = new AstPrinter();
        printer.program(program);
        return printer.out.toString();
    }

    public static String print(Expression expression) {
        return expression(expression);
    }

    private void program(Program program) {
        program.config().ifPresent(this::config);
        program.services().ifPresent(this::services);
        program.workflow().ifPresent(this::workflow);
    }

    private void separateBlock() {
        if (out.length() > 0) {
            out.append('\n');
        }
    }

    private void config(ConfigBlock block) {
        separateBlock();
        line(0, "config:");
        for (ConfigEntry entry : block.entries()) {
            line(1, entry.key() + ": " + configValue(entry.value()));
        }
    }

    private void services(ServicesBlock block) {
        separateBlock();
        line(0, "services:");
        for (ServiceDeclaration declaration : block.declarations()) {
            line(1, declaration.name() + " is " + declaration.kind().phrase() + " " + quote(declaration.target()));
            if (!declaration.headers().isEmpty()) {
                line(2, "with headers:");
                for (ServiceHeader header : declaration.headers()) {
                    line(3, header.name() + ": " + expression(header.value()));
                }
            }
        }
    }

    private void workflow(WorkflowBlock block) {
        separateBlock();
        line(0, "workflow:");
        block.trigger().ifPresent(trigger -> line(1, ("trigger: " + trigger.description()).stripTrailing()));
        statements(block.body(), 1);
    }

    private void statements(List<Statement> statements, int depth) {
        for (Statement statement : statements) {
            statement(statement, depth);
        }
    }

    private void statement(Statement statement, int depth) {
        if (statement instanceof Statement.StepBlock step) {
            line(depth, "step " + step.name() + ":");
            statements(step.body(), depth + 1);
        } else if (statement instanceof Statement.ServiceCall call) {
            serviceCall(call, depth);
        } else if (statement instanceof Statement.AskStatement ask) {
            line(depth, "ask " + ask.agent() + " to " + expression(ask.instruction()));
            ask.resultVariable().ifPresent(name -> line(depth + 1, "save the result as " + name));
            ask.confidenceVariable().ifPresent(name -> line(depth + 1, "save the confidence as " + name));
        } else if (statement instanceof Statement.SetStatement set) {
            line(depth, "set " + set.variable() + " to " + expression(set.value()));
        } else if (statement instanceof Statement.IfStatement ifStatement) {
            line(depth, "if " + expression(ifStatement.condition()) + ":");
            statements(ifStatement.body(), depth + 1);
            for (OtherwiseIf branch : ifStatement.otherwiseIfs()) {
                line(depth, "otherwise if " + expression(branch.condition()) + ":");
                statements(branch.body(), depth + 1);
            }
            ifStatement.otherwise().ifPresent(body -> {
                line(depth, "otherwise:");
                statements(body, depth + 1);
            });
        } else if (statement instanceof Statement.ForEachStatement loop) {
            line(depth, "for each " + loop.itemName() + " in " + expression(loop.collection()) + ":");
            statements(loop.body(), depth + 1);
        } else if (statement instanceof Statement.LogStatement logStatement) {
            line(depth, "log " + expression(logStatement.message()));
        } else if (statement instanceof Statement.CompleteStatement complete) {
            line(depth, complete.outputs().isEmpty() ? "complete" : "complete with " + parameters(complete.outputs()));
        } else if (statement instanceof Statement.RejectStatement reject) {
            line(depth, "reject with " + expression(reject.message()));
        } else {
            throw new IllegalStateException("Unknown statement " + statement);
        }
    }

    private void serviceCall(Statement.ServiceCall call, int depth) {
        var text = new StringBuilder(call.verb());
        if (!call.description().isEmpty()) {
            text.append(' ').append(call.description());
        }
        call.service().ifPresent(service -> {
            text.append(" using ").append(service);
            call.path().ifPresent(path -> text.append(" at ").append(expression(path)));
            List<Parameter> parameters = call.parameters();
            if (parameters.size() == 1 && "to".equals(parameters.get(0).name())) {
                text.append(" to ").append(expression(parameters.get(0).value()));
            } else if (!parameters.isEmpty()) {
                text.append(" with ").append(parameters(parameters));
            }
        });
        line(depth, text.toString());
        call.resultVariable().ifPresent(name -> line(depth + 1, "save the result as " + name));
        call.statusVariable().ifPresent(name -> line(depth + 1, "save the status as " + name));
        call.headersVariable().ifPresent(name -> line(depth + 1, "save the response headers as " + name));
        call.errorHandler().ifPresent(handler -> errorHandler(handler, depth + 1));
    }

    private void errorHandler(ErrorHandler handler, int depth) {
        line(depth, handler.kind().keyword() + ":");
        handler.retryCount().ifPresent(count -> {
            String retry = "retry " + count + " times";
            if (handler.retryWait().isPresent()) {
                retry += " waiting " + waitText(handler.retryWait().get());
            }
            line(depth + 1, retry);
        });
        handler.fallback().ifPresent(body -> {
            line(depth + 1, "if still failing:");
            statements(body, depth + 2);
        });
    }

    private static String waitText(Duration wait) {
        long millis = wait.toMillis();
        if (millis > 0 && millis % 3_600_000L == 0) {
            return millis / 3_600_000L + " hours";
        }
        if (millis > 0 && millis % 60_000L == 0) {
            return millis / 60_000L + " minutes";
        }
        return BigDecimal.valueOf(millis).movePointLeft(3).stripTrailingZeros().toPlainString() + " seconds";
    }

    private static String parameters(List<Parameter> parameters) {
        return parameters.stream()
            .map(parameter -> parameter.name() + " " + expression(parameter.value()))
            .collect(Collectors.joining(" and "));
    }

    private static String configValue(ConfigValue value) {
        if (value instanceof ConfigValue.Text text) {
            return text.quoted() ? quote(text.value()) : text.value();
        }
        if (value instanceof ConfigValue.Numeric numeric) {
            return number(numeric.value());
        }
        throw new IllegalStateException("Unknown config value " + value);
    }

    private static String expression(Expression expression) {
        if (expression instanceof Expression.StringLiteral literal) {
            return quote(literal.value());
        }
        if (expression instanceof InterpolatedString interpolated) {
            var text = new StringBuilder("\"");
            for (InterpolatedString.Part part : interpolated.parts()) {
                if (part instanceof InterpolatedString.TextPart textPart) {
                    text.append(escape(textPart.text()));
                } else if (part instanceof InterpolatedString.ExpressionPart expressionPart) {
                    text.append('{').append(expression(expressionPart.expression())).append('}');
                }
            }
            return text.append('"').toString();
        }
        if (expression instanceof Expression.NumberLiteral literal) {
            return number(literal.value());
        }
        if (expression instanceof Expression.BooleanLiteral literal) {
            return Boolean.toString(literal.value());
        }
        if (expression instanceof Expression.Identifier identifier) {
            return identifier.name();
        }
        if (expression instanceof Expression.DotAccess access) {
            return access.path();
        }
        if (expression instanceof Expression.MathExpression math) {
            return expression(math.left()) + " " + math.operator().keyword() + " " + expression(math.right());
        }
        if (expression instanceof Expression.ComparisonExpression comparison) {
            String text = expression(comparison.left()) + " " + comparison.operator().keyword();
            return comparison.right().map(right -> text + " " + expression(right)).orElse(text);
        }
        if (expression instanceof Expression.LogicalExpression logical) {
            if (logical.operator() == LogicalOperator.NOT) {
                return "not " + expression(logical.left());
            }
            return expression(logical.left()) + " " + logical.operator().keyword() + " "
                + expression(logical.right().orElseThrow());
        }
        throw new IllegalStateException("Unknown expression " + expression);
    }

    static String number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String quote(String text) {
        return "\"" + escape(text) + "\"";
    }

    private static String escape(String text) {
        var escaped = new StringBuilder();
        for (char ch : text.toCharArray()) {
            switch (ch) {
                case '\\':
                    escaped.append("\\\\");
                    break;
                case '"':
                    escaped.append("\\\"");
                    break;
                case '\n':
                    escaped.append("\\n");
                    break;
                case '\t':
                    escaped.append("\\t");
                    break;
                case '{':
                    escaped.append("{{");
                    break;
                case '}':
                    escaped.append("}}");
                    break;
                default:
                    escaped.append(ch);
            }
        }
        return escaped.toString();
    }

    private void line(int depth, String text) {
        out.append(INDENT.repeat(depth)).append(text).append('\n');
    }
}
