package work.lcod.flow.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Workflow statements. The set is closed; consumers dispatch over every variant.
 */
public sealed interface Statement {
    SourceLocation location();

    /** Named group of statements; does not open a scope. */
    record StepBlock(String name, List<Statement> body, SourceLocation location) implements Statement {
        public StepBlock {
            Objects.requireNonNull(name, "name");
            body = List.copyOf(body);
        }
    }

    record ServiceCall(
        String verb,
        String description,
        Optional<String> service,
        Optional<Expression> path,
        List<Parameter> parameters,
        Optional<String> resultVariable,
        Optional<String> statusVariable,
        Optional<String> headersVariable,
        Optional<ErrorHandler> errorHandler,
        SourceLocation location
    ) implements Statement {
        public ServiceCall {
            Objects.requireNonNull(verb, "verb");
            Objects.requireNonNull(description, "description");
            Objects.requireNonNull(service, "service");
            Objects.requireNonNull(path, "path");
            parameters = List.copyOf(parameters);
            Objects.requireNonNull(resultVariable, "resultVariable");
            Objects.requireNonNull(statusVariable, "statusVariable");
            Objects.requireNonNull(headersVariable, "headersVariable");
            Objects.requireNonNull(errorHandler, "errorHandler");
        }

        /** Text used for the log entry of this call, e.g. {@code verify the email}. */
        public String action() {
            return description.isEmpty() ? verb : verb + " " + description;
        }
    }

    record AskStatement(
        String agent,
        Expression instruction,
        Optional<String> resultVariable,
        Optional<String> confidenceVariable,
        SourceLocation location
    ) implements Statement {
        public AskStatement {
            Objects.requireNonNull(agent, "agent");
            Objects.requireNonNull(instruction, "instruction");
            Objects.requireNonNull(resultVariable, "resultVariable");
            Objects.requireNonNull(confidenceVariable, "confidenceVariable");
        }
    }

    record SetStatement(String variable, Expression value, SourceLocation location) implements Statement {
        public SetStatement {
            Objects.requireNonNull(variable, "variable");
            Objects.requireNonNull(value, "value");
        }
    }

    record IfStatement(
        Expression condition,
        List<Statement> body,
        List<OtherwiseIf> otherwiseIfs,
        Optional<List<Statement>> otherwise,
        SourceLocation location
    ) implements Statement {
        public IfStatement {
            Objects.requireNonNull(condition, "condition");
            body = List.copyOf(body);
            otherwiseIfs = List.copyOf(otherwiseIfs);
            otherwise = otherwise.map(List::copyOf);
        }
    }

    record ForEachStatement(
        String itemName,
        Expression collection,
        List<Statement> body,
        SourceLocation location
    ) implements Statement {
        public ForEachStatement {
            Objects.requireNonNull(itemName, "itemName");
            Objects.requireNonNull(collection, "collection");
            body = List.copyOf(body);
        }
    }

    record LogStatement(Expression message, SourceLocation location) implements Statement {
        public LogStatement {
            Objects.requireNonNull(message, "message");
        }
    }

    record CompleteStatement(List<Parameter> outputs, SourceLocation location) implements Statement {
        public CompleteStatement {
            outputs = List.copyOf(outputs);
        }
    }

    record RejectStatement(Expression message, SourceLocation location) implements Statement {
        public RejectStatement {
            Objects.requireNonNull(message, "message");
        }
    }
}
