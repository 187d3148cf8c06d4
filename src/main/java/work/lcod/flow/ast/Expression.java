package work.lcod.flow.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Value expressions. The set is closed; the evaluator and the analyzer dispatch over every variant.
 */
public sealed interface Expression {
    SourceLocation location();

    record StringLiteral(String value, SourceLocation location) implements Expression {
        public StringLiteral {
            Objects.requireNonNull(value, "value");
        }
    }

    record InterpolatedString(List<Part> parts, SourceLocation location) implements Expression {
        public InterpolatedString {
            parts = List.copyOf(parts);
        }

        public sealed interface Part {}

        public record TextPart(String text) implements Part {}

        public record ExpressionPart(Expression expression) implements Part {}
    }

    record NumberLiteral(double value, SourceLocation location) implements Expression {}

    record BooleanLiteral(boolean value, SourceLocation location) implements Expression {}

    record Identifier(String name, SourceLocation location) implements Expression {
        public Identifier {
            Objects.requireNonNull(name, "name");
        }
    }

    /** {@code root.a.b}: a chain of property names read from a root variable. */
    record DotAccess(Identifier root, List<String> properties, SourceLocation location) implements Expression {
        public DotAccess {
            Objects.requireNonNull(root, "root");
            properties = List.copyOf(properties);
            if (properties.isEmpty()) {
                throw new IllegalArgumentException("DotAccess needs at least one property");
            }
        }

        public String path() {
            return root.name() + "." + String.join(".", properties);
        }
    }

    record MathExpression(
        Expression left,
        MathOperator operator,
        Expression right,
        SourceLocation location
    ) implements Expression {
        public MathExpression {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
        }
    }

    record ComparisonExpression(
        Expression left,
        ComparisonOperator operator,
        Optional<Expression> right,
        SourceLocation location
    ) implements Expression {
        public ComparisonExpression {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(right, "right");
            if (operator.isUnary() == right.isPresent()) {
                throw new IllegalArgumentException("Operand count does not match " + operator.keyword());
            }
        }
    }

    /** {@code and}/{@code or} take two operands; {@code not} only uses {@code left}. */
    record LogicalExpression(
        LogicalOperator operator,
        Expression left,
        Optional<Expression> right,
        SourceLocation location
    ) implements Expression {
        public LogicalExpression {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
            if ((operator == LogicalOperator.NOT) == right.isPresent()) {
                throw new IllegalArgumentException("Operand count does not match " + operator.keyword());
            }
        }
    }
}
