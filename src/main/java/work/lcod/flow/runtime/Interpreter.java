package work.lcod.flow.runtime;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.flow.ast.OtherwiseIf;
import work.lcod.flow.ast.Parameter;
import work.lcod.flow.ast.Program;
import work.lcod.flow.ast.ServiceDeclaration;
import work.lcod.flow.ast.ServiceHeader;
import work.lcod.flow.ast.Statement;
import work.lcod.flow.diagnostics.FlowDiagnostic;

/**
 * Tree-walking interpreter. Each call to {@link #execute} builds its own environment, log and
 * connector table; only the program is shared.
 */
public final class Interpreter {
    private static final Logger log = LoggerFactory.getLogger(Interpreter.class);
    private static final ExecutorService DEFAULT_EXECUTOR = Executors.newCachedThreadPool(runnable -> {
        var thread = new Thread(runnable, "flow-interpreter");
        thread.setDaemon(true);
        return thread;
    });

    private Interpreter() {}

    public static CompletableFuture<ExecutionResult> execute(Program program, String source, RuntimeOptions options) {
        Executor executor = options.executor().orElse(DEFAULT_EXECUTOR);
        return CompletableFuture.supplyAsync(() -> new Run(program, source, options).run(), executor);
    }

    /** State of a single execution. */
    private static final class Run {
        private final Program program;
        private final RuntimeOptions options;
        private final ExecutionLog executionLog = new ExecutionLog();
        private final ExecutionContext context;
        private final Evaluator evaluator;
        private final RetryExecutor retries;
        private final Map<String, ServiceConnector> connectors = new LinkedHashMap<>();
        private final Map<String, Map<String, String>> resolvedHeaders = new LinkedHashMap<>();

        Run(Program program, String source, RuntimeOptions options) {
            this.program = program;
            this.options = options;
            this.context = new ExecutionContext(source, options.fileName(), executionLog, options.verbose(),
                options.strictEnv(), options.sleeper(), connectors, resolvedHeaders);
            this.evaluator = new Evaluator(context);
            this.retries = new RetryExecutor(context);
        }

        ExecutionResult run() {
            if (program.workflow().isEmpty()) {
                return finish(new WorkflowResult.Completed(Map.of()));
            }
            try {
                Environment root = rootEnvironment();
                bindConnectors();
                resolveHeaders(root);
                Outcome outcome = executeAll(program.workflow().get().body(), root);
                if (outcome instanceof Outcome.Completed completed) {
                    return finish(new WorkflowResult.Completed(completed.outputs()));
                }
                if (outcome instanceof Outcome.Rejected rejected) {
                    return finish(new WorkflowResult.Rejected(rejected.message()));
                }
                return finish(new WorkflowResult.Completed(Map.of()));
            } catch (FlowRuntimeException ex) {
                log.debug("Workflow {} failed: {}", options.fileName(), ex.getMessage());
                return finish(new WorkflowResult.Errored(ex.diagnostic()));
            } catch (RuntimeException ex) {
                log.warn("Unexpected failure while running {}", options.fileName(), ex);
                String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
                return finish(new WorkflowResult.Errored(
                    FlowDiagnostic.error(options.fileName(), 1, 1, "Unexpected error: " + message, context.source)));
            }
        }

        private ExecutionResult finish(WorkflowResult result) {
            return new ExecutionResult(result, executionLog.entries());
        }

        private Environment rootEnvironment() {
            Environment root = Environment.root();
            var env = new LinkedHashMap<String, FlowValue>();
            options.envVars().forEach((key, value) -> env.put(key, FlowValue.text(value)));
            root.define("env", FlowValue.record(env));

            var request = new LinkedHashMap<String, FlowValue>();
            options.input().forEach((key, value) -> request.put(key, FlowValues.fromJava(value)));
            root.define("request", FlowValue.record(request));
            request.forEach(root::define);
            return root;
        }

        private void bindConnectors() {
            connectors.putAll(options.connectors());
            program.services().ifPresent(services -> {
                for (ServiceDeclaration declaration : services.declarations()) {
                    connectors.computeIfAbsent(declaration.name(), name -> new MockConnector(declaration.kind()));
                }
            });
        }

        private void resolveHeaders(Environment root) {
            program.services().ifPresent(services -> {
                for (ServiceDeclaration declaration : services.declarations()) {
                    if (declaration.headers().isEmpty()) {
                        continue;
                    }
                    var headers = new LinkedHashMap<String, String>();
                    for (ServiceHeader header : declaration.headers()) {
                        headers.put(header.name(), FlowValues.display(evaluator.evaluate(header.value(), root)));
                    }
                    resolvedHeaders.put(declaration.name(), headers);
                }
            });
        }

        private Outcome executeAll(List<Statement> statements, Environment env) {
            for (Statement statement : statements) {
                Outcome outcome = execute(statement, env);
                if (outcome != Outcome.Continue.INSTANCE) {
                    return outcome;
                }
            }
            return Outcome.Continue.INSTANCE;
        }

        private Outcome execute(Statement statement, Environment env) {
            if (statement instanceof Statement.StepBlock step) {
                return step(step, env);
            }
            if (statement instanceof Statement.ServiceCall call) {
                return serviceCall(call, env);
            }
            if (statement instanceof Statement.AskStatement ask) {
                ask(ask, env);
                return Outcome.Continue.INSTANCE;
            }
            if (statement instanceof Statement.SetStatement set) {
                env.set(set.variable(), evaluator.evaluate(set.value(), env));
                return Outcome.Continue.INSTANCE;
            }
            if (statement instanceof Statement.IfStatement ifStatement) {
                return ifStatement(ifStatement, env);
            }
            if (statement instanceof Statement.ForEachStatement loop) {
                return forEach(loop, env);
            }
            if (statement instanceof Statement.LogStatement logStatement) {
                String message = FlowValues.display(evaluator.evaluate(logStatement.message(), env));
                executionLog.add("log", LogOutcome.SUCCESS, Map.of("message", message));
                return Outcome.Continue.INSTANCE;
            }
            if (statement instanceof Statement.CompleteStatement complete) {
                var outputs = new LinkedHashMap<String, FlowValue>();
                for (Parameter output : complete.outputs()) {
                    outputs.put(output.name(), evaluator.evaluate(output.value(), env));
                }
                return new Outcome.Completed(outputs);
            }
            if (statement instanceof Statement.RejectStatement reject) {
                return new Outcome.Rejected(FlowValues.display(evaluator.evaluate(reject.message(), env)));
            }
            throw new IllegalStateException("Unknown statement " + statement);
        }

        private Outcome step(Statement.StepBlock step, Environment env) {
            Optional<String> previous = executionLog.enterStep(step.name());
            try {
                log.debug("Entering step {}", step.name());
                executionLog.add("step \"" + step.name() + "\" started", LogOutcome.SUCCESS, Map.of());
                long started = System.nanoTime();
                Outcome outcome = executeAll(step.body(), env);
                if (outcome == Outcome.Continue.INSTANCE) {
                    executionLog.add("step \"" + step.name() + "\" completed", LogOutcome.SUCCESS,
                        Duration.ofNanos(System.nanoTime() - started), Map.of());
                }
                return outcome;
            } finally {
                executionLog.restoreStep(previous);
            }
        }

        private Outcome ifStatement(Statement.IfStatement statement, Environment env) {
            if (FlowValues.isTruthy(evaluator.evaluate(statement.condition(), env))) {
                return executeAll(statement.body(), env);
            }
            for (OtherwiseIf branch : statement.otherwiseIfs()) {
                if (FlowValues.isTruthy(evaluator.evaluate(branch.condition(), env))) {
                    return executeAll(branch.body(), env);
                }
            }
            return statement.otherwise()
                .map(body -> executeAll(body, env))
                .orElse(Outcome.Continue.INSTANCE);
        }

        private Outcome forEach(Statement.ForEachStatement loop, Environment env) {
            FlowValue collection = evaluator.evaluate(loop.collection(), env);
            if (!(collection instanceof FlowValue.ListValue list)) {
                throw context.error(loop.collection().location(), "I expected a list to loop over, but got "
                    + collection.typeName() + " (" + FlowValues.display(collection) + ").");
            }
            for (FlowValue item : list.items()) {
                Environment iteration = env.child();
                iteration.define(loop.itemName(), item);
                Outcome outcome = executeAll(loop.body(), iteration);
                if (outcome != Outcome.Continue.INSTANCE) {
                    return outcome;
                }
            }
            return Outcome.Continue.INSTANCE;
        }

        private Outcome serviceCall(Statement.ServiceCall call, Environment env) {
            String service = call.service().orElseThrow(() -> context.error(call.location(),
                "I don't know which service to use for \"" + call.action() + "\"."));
            ServiceConnector connector = connectors.get(service);
            if (connector == null) {
                throw context.error(call.location(), "No connector found for service \"" + service + "\".");
            }
            var parameters = new LinkedHashMap<String, FlowValue>();
            for (Parameter parameter : call.parameters()) {
                parameters.put(parameter.name(), evaluator.evaluate(parameter.value(), env));
            }
            Optional<String> path = call.path().map(expression -> FlowValues.display(evaluator.evaluate(expression, env)));
            var request = new ServiceRequest(call.verb(), call.description(), parameters, path,
                resolvedHeaders.getOrDefault(service, Map.of()));

            RetryExecutor.Attempt attempt = () -> {
                long started = System.nanoTime();
                ServiceResponse response = call(connector, request);
                store(call, response, env);
                executionLog.add(call.action(), LogOutcome.SUCCESS, Duration.ofNanos(System.nanoTime() - started),
                    Map.of("service", service));
            };

            if (call.errorHandler().isPresent()) {
                var details = new LinkedHashMap<String, Object>();
                details.put("service", service);
                details.put("verb", call.verb());
                details.put("description", call.description());
                return retries.execute(call.errorHandler().get(), call.location(), details, attempt,
                    fallback -> executeAll(fallback, env));
            }

            long started = System.nanoTime();
            try {
                attempt.run();
            } catch (ServiceCallException ex) {
                var details = new LinkedHashMap<String, Object>();
                details.put("service", service);
                details.put("error", ex.getMessage());
                executionLog.add(call.action(), LogOutcome.FAILURE, Duration.ofNanos(System.nanoTime() - started), details);
                throw context.error(call.location(), "The service \"" + service + "\" failed: " + ex.getMessage());
            }
            return Outcome.Continue.INSTANCE;
        }

        private void store(Statement.ServiceCall call, ServiceResponse response, Environment env) {
            call.resultVariable().ifPresent(name -> env.set(name, response.value()));
            call.statusVariable().ifPresent(name -> env.set(name,
                response.status().map(status -> FlowValue.number(status)).orElse(FlowValue.EMPTY)));
            call.headersVariable().ifPresent(name -> env.set(name, response.headers()
                .map(headers -> {
                    var fields = new LinkedHashMap<String, FlowValue>();
                    headers.forEach((key, value) -> fields.put(key, FlowValue.text(value)));
                    return FlowValue.record(fields);
                })
                .orElse(FlowValue.EMPTY)));
        }

        private void ask(Statement.AskStatement ask, Environment env) {
            ServiceConnector connector = connectors.get(ask.agent());
            if (connector == null) {
                throw context.error(ask.location(), "No connector found for agent \"" + ask.agent() + "\".");
            }
            String instruction = FlowValues.display(evaluator.evaluate(ask.instruction(), env));
            var request = new ServiceRequest("ask", instruction, Map.of(), Optional.empty(),
                resolvedHeaders.getOrDefault(ask.agent(), Map.of()));
            String action = "ask " + ask.agent();
            long started = System.nanoTime();
            ServiceResponse response;
            try {
                response = call(connector, request);
            } catch (ServiceCallException ex) {
                var details = new LinkedHashMap<String, Object>();
                details.put("agent", ask.agent());
                details.put("error", ex.getMessage());
                executionLog.add(action, LogOutcome.FAILURE, Duration.ofNanos(System.nanoTime() - started), details);
                throw context.error(ask.location(), "The agent \"" + ask.agent() + "\" failed: " + ex.getMessage());
            }
            var details = new LinkedHashMap<String, Object>();
            details.put("agent", ask.agent());
            details.put("instruction", instruction);
            executionLog.add(action, LogOutcome.SUCCESS, Duration.ofNanos(System.nanoTime() - started), details);

            FlowValue value = response.value();
            ask.resultVariable().ifPresent(name -> env.set(name, value instanceof FlowValue.RecordValue record
                ? record.fields().getOrDefault("result", value)
                : value));
            ask.confidenceVariable().ifPresent(name -> env.set(name, value instanceof FlowValue.RecordValue record
                ? record.fields().getOrDefault("confidence", FlowValue.EMPTY)
                : FlowValue.EMPTY));
        }

        private ServiceResponse call(ServiceConnector connector, ServiceRequest request) {
            log.debug("Calling connector for {} {}", request.verb(), request.description());
            CompletionStage<ServiceResponse> stage;
            try {
                stage = connector.call(request);
            } catch (RuntimeException ex) {
                log.warn("Connector call {} {} failed: {}", request.verb(), request.description(), ex.getMessage());
                throw new ServiceCallException(messageOf(ex), ex);
            }
            try {
                return stage.toCompletableFuture().get();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new ServiceCallException("The call was interrupted.", ex);
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                log.warn("Connector call {} {} failed: {}", request.verb(), request.description(), cause.getMessage());
                throw new ServiceCallException(messageOf(cause), cause);
            }
        }

        private static String messageOf(Throwable error) {
            return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        }
    }
}
