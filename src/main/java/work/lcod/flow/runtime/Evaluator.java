package work.lcod.flow.runtime;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import work.lcod.flow.ast.Expression;
import work.lcod.flow.ast.Expression.InterpolatedString;
import work.lcod.flow.ast.MathOperator;
import work.lcod.flow.ast.SourceLocation;

/**
 * Evaluates expressions against an environment. Evaluation never suspends.
 */
final class Evaluator {
    private static final String ENV = "env";

    private final ExecutionContext context;

    Evaluator(ExecutionContext context) {
        this.context = context;
    }

    FlowValue evaluate(Expression expression, Environment env) {
        if (expression instanceof Expression.StringLiteral literal) {
            return FlowValue.text(literal.value());
        }
        if (expression instanceof Expression.NumberLiteral literal) {
            return FlowValue.number(literal.value());
        }
        if (expression instanceof Expression.BooleanLiteral literal) {
            return FlowValue.bool(literal.value());
        }
        if (expression instanceof Expression.Identifier identifier) {
            return env.get(identifier.name()).orElseThrow(() -> context.error(
                identifier.location(), "The variable \"" + identifier.name() + "\" hasn't been set yet."));
        }
        if (expression instanceof Expression.DotAccess access) {
            return dotAccess(access, env);
        }
        if (expression instanceof InterpolatedString interpolated) {
            var text = new StringBuilder();
            for (InterpolatedString.Part part : interpolated.parts()) {
                if (part instanceof InterpolatedString.TextPart textPart) {
                    text.append(textPart.text());
                } else if (part instanceof InterpolatedString.ExpressionPart expressionPart) {
                    text.append(FlowValues.display(evaluate(expressionPart.expression(), env)));
                }
            }
            return FlowValue.text(text.toString());
        }
        if (expression instanceof Expression.MathExpression math) {
            return math(math, env);
        }
        if (expression instanceof Expression.ComparisonExpression comparison) {
            return comparison(comparison, env);
        }
        if (expression instanceof Expression.LogicalExpression logical) {
            return logical(logical, env);
        }
        throw new IllegalStateException("Unknown expression " + expression);
    }

    private FlowValue dotAccess(Expression.DotAccess access, Environment env) {
        String rootName = access.root().name();
        var root = env.get(rootName);
        if (root.isEmpty()) {
            return FlowValue.EMPTY;
        }
        boolean envAccess = ENV.equals(rootName);
        FlowValue value = root.get();
        for (String property : access.properties()) {
            if (value instanceof FlowValue.RecordValue record) {
                FlowValue field = record.fields().get(property);
                if (field == null) {
                    if (envAccess) {
                        missingEnv(property, access.location());
                    }
                    return FlowValue.EMPTY;
                }
                value = field;
            } else if (value == FlowValue.EMPTY) {
                return FlowValue.EMPTY;
            } else {
                throw context.error(access.location(), "I can't access \"." + property + "\" on a " + value.typeName()
                    + " value. Only records have fields.");
            }
        }
        return value;
    }

    private void missingEnv(String name, SourceLocation location) {
        if (context.strictEnv) {
            throw context.error(location, "The environment variable \"" + name
                + "\" is not set. Add it to your .env file or set it in your system environment.");
        }
        if (context.verbose) {
            context.log.add("env warning", LogOutcome.SKIPPED,
                Map.of("message", "Environment variable \"" + name + "\" is not set"));
        }
    }

    private FlowValue math(Expression.MathExpression math, Environment env) {
        FlowValue left = evaluate(math.left(), env);
        FlowValue right = evaluate(math.right(), env);
        if (math.operator() == MathOperator.PLUS
            && left instanceof FlowValue.Text a && right instanceof FlowValue.Text b) {
            return FlowValue.text(a.value() + b.value());
        }
        double l = number(left, math.left().location());
        double r = number(right, math.right().location());
        switch (math.operator()) {
            case PLUS:
                return FlowValue.number(l + r);
            case MINUS:
                return FlowValue.number(l - r);
            case TIMES:
                return FlowValue.number(l * r);
            case DIVIDED_BY:
                if (r == 0) {
                    throw context.error(math.right().location(), "I can't divide by zero.");
                }
                return FlowValue.number(l / r);
            case ROUNDED_TO:
                return FlowValue.number(round(l, r, math.right().location()));
            default:
                throw new IllegalStateException("Unknown operator " + math.operator());
        }
    }

    private double round(double value, double places, SourceLocation location) {
        if (places < 0 || places > 100 || places != Math.rint(places)) {
            throw context.error(location, "I can only round to a whole number of decimal places between 0 and 100.");
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale((int) places, RoundingMode.HALF_UP).doubleValue();
    }

    private FlowValue comparison(Expression.ComparisonExpression comparison, Environment env) {
        FlowValue left = evaluate(comparison.left(), env);
        switch (comparison.operator()) {
            case IS_EMPTY:
                return FlowValue.bool(!FlowValues.isTruthy(left));
            case IS_NOT_EMPTY:
                return FlowValue.bool(FlowValues.isTruthy(left));
            case EXISTS:
                return FlowValue.bool(left != FlowValue.EMPTY);
            case DOES_NOT_EXIST:
                return FlowValue.bool(left == FlowValue.EMPTY);
            default:
                break;
        }
        Expression rightExpression = comparison.right().orElseThrow();
        FlowValue right = evaluate(rightExpression, env);
        switch (comparison.operator()) {
            case IS:
                return FlowValue.bool(FlowValues.equal(left, right));
            case IS_NOT:
                return FlowValue.bool(!FlowValues.equal(left, right));
            case IS_ABOVE:
                return FlowValue.bool(number(left, comparison.left().location()) > number(right, rightExpression.location()));
            case IS_BELOW:
                return FlowValue.bool(number(left, comparison.left().location()) < number(right, rightExpression.location()));
            case IS_AT_LEAST:
                return FlowValue.bool(number(left, comparison.left().location()) >= number(right, rightExpression.location()));
            case IS_AT_MOST:
                return FlowValue.bool(number(left, comparison.left().location()) <= number(right, rightExpression.location()));
            case CONTAINS:
                return contains(left, right, comparison.location());
            default:
                throw new IllegalStateException("Unknown operator " + comparison.operator());
        }
    }

    private FlowValue contains(FlowValue left, FlowValue right, SourceLocation location) {
        if (left instanceof FlowValue.Text text && right instanceof FlowValue.Text part) {
            return FlowValue.bool(text.value().contains(part.value()));
        }
        if (left instanceof FlowValue.ListValue list) {
            return FlowValue.bool(list.items().stream().anyMatch(item -> FlowValues.equal(item, right)));
        }
        throw context.error(location,
            "I can't use \"contains\" on a " + left.typeName() + " value. It works with text and lists.");
    }

    private FlowValue logical(Expression.LogicalExpression logical, Environment env) {
        boolean left = FlowValues.isTruthy(evaluate(logical.left(), env));
        switch (logical.operator()) {
            case NOT:
                return FlowValue.bool(!left);
            case AND:
                return FlowValue.bool(left && FlowValues.isTruthy(evaluate(logical.right().orElseThrow(), env)));
            case OR:
                return FlowValue.bool(left || FlowValues.isTruthy(evaluate(logical.right().orElseThrow(), env)));
            default:
                throw new IllegalStateException("Unknown operator " + logical.operator());
        }
    }

    private double number(FlowValue value, SourceLocation location) {
        if (value instanceof FlowValue.Num number) {
            return number.value();
        }
        throw context.error(location, "I expected a number here, but got " + value.typeName() + " ("
            + FlowValues.display(value) + ").");
    }
}
