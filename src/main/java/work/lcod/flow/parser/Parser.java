package work.lcod.flow.parser;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import work.lcod.flow.ast.ComparisonOperator;
import work.lcod.flow.ast.ConfigBlock;
import work.lcod.flow.ast.ConfigEntry;
import work.lcod.flow.ast.ConfigValue;
import work.lcod.flow.ast.ErrorHandler;
import work.lcod.flow.ast.Expression;
import work.lcod.flow.ast.Expression.InterpolatedString;
import work.lcod.flow.ast.LogicalOperator;
import work.lcod.flow.ast.MathOperator;
import work.lcod.flow.ast.OtherwiseIf;
import work.lcod.flow.ast.Parameter;
import work.lcod.flow.ast.Program;
import work.lcod.flow.ast.ServiceDeclaration;
import work.lcod.flow.ast.ServiceHeader;
import work.lcod.flow.ast.ServiceKind;
import work.lcod.flow.ast.ServicesBlock;
import work.lcod.flow.ast.SourceLocation;
import work.lcod.flow.ast.Statement;
import work.lcod.flow.ast.Trigger;
import work.lcod.flow.ast.WorkflowBlock;
import work.lcod.flow.diagnostics.FlowDiagnostic;
import work.lcod.flow.diagnostics.Severity;
import work.lcod.flow.lexer.Keywords;
import work.lcod.flow.lexer.Lexer;
import work.lcod.flow.lexer.Token;
import work.lcod.flow.lexer.TokenKind;

/**
 * Recursive-descent parser for Flow programs.
 *
 * <p>Syntax errors never abort the parse: each one is recorded and the parser resumes at the
 * next statement boundary, so a single pass reports every problem it can find.
 */
public final class Parser {
    private static final String ERROR_PLACEHOLDER = "<error>";

    private final List<Token> tokens;
    private final String source;
    private final String fileName;
    private final List<FlowDiagnostic> errors = new ArrayList<>();
    private int pos;

    private Parser(List<Token> tokens, String source, String fileName) {
        this.tokens = tokens;
        this.source = source;
        this.fileName = fileName;
    }

    public static ParseResult parse(List<Token> tokens, String source, String fileName) {
        var parser = new Parser(tokens, source, fileName);
        var program = parser.parseProgram();
        return new ParseResult(program, parser.errors);
    }

    /**
     * Lexes then parses {@code source}. Lexical errors are fatal and surface as
     * {@link work.lcod.flow.lexer.LexerException}.
     */
    public static ParseResult parse(String source, String fileName) {
        return parse(Lexer.tokenize(source, fileName), source, fileName);
    }

    // ---------------------------------------------------------------- blocks

    private Program parseProgram() {
        Optional<ConfigBlock> config = Optional.empty();
        Optional<ServicesBlock> services = Optional.empty();
        Optional<WorkflowBlock> workflow = Optional.empty();
        skipNewlines();

        while (!atEnd()) {
            Token tok = current();
            if (tok.is(TokenKind.KEYWORD, "config")) {
                if (config.isPresent()) {
                    addError(tok, "Duplicate config block. You can only have one config block per file.");
                }
                config = Optional.of(parseConfigBlock());
            } else if (tok.is(TokenKind.KEYWORD, "services")) {
                if (services.isPresent()) {
                    addError(tok, "Duplicate services block. You can only have one services block per file.");
                }
                services = Optional.of(parseServicesBlock());
            } else if (tok.is(TokenKind.KEYWORD, "workflow")) {
                if (workflow.isPresent()) {
                    addError(tok, "Duplicate workflow block. You can only have one workflow block per file.");
                }
                workflow = Optional.of(parseWorkflowBlock());
            } else if (tok.is(TokenKind.NEWLINE) || tok.is(TokenKind.INDENT) || tok.is(TokenKind.DEDENT)) {
                advance();
            } else {
                addError(
                    tok,
                    "I found \"" + tok.text() + "\" at the top level, but Flow files can only have \"config:\", "
                        + "\"services:\", or \"workflow:\" blocks at the top level.",
                    "Check your indentation. This might be a statement that should be inside a block.",
                    "A Flow file looks like:\n    config:\n        ...\n    services:\n        ...\n    workflow:\n        ..."
                );
                recover();
            }
        }
        return new Program(config, services, workflow, new SourceLocation(1, 1));
    }

    private ConfigBlock parseConfigBlock() {
        var location = location();
        parseBlockHeader("config");
        var entries = new ArrayList<ConfigEntry>();
        if (!match(TokenKind.INDENT)) {
            addError(
                current(),
                "Expected indented config entries after \"config:\".",
                "Add your config settings indented under config:",
                "Example:\n    config:\n        name: \"My Workflow\"\n        version: 1"
            );
            return new ConfigBlock(entries, location);
        }
        eachLine(() -> entries.add(parseConfigEntry()));
        return new ConfigBlock(entries, location);
    }

    private ConfigEntry parseConfigEntry() {
        var location = location();
        Token keyToken = current();
        if (!keyToken.is(TokenKind.IDENTIFIER) && !keyToken.is(TokenKind.KEYWORD)) {
            throw fail(
                keyToken,
                "Expected a config key (like \"name\", \"version\", or \"timeout\"), but found \"" + keyToken.text() + "\".",
                null,
                null
            );
        }
        String key = advance().text();
        expect(TokenKind.COLON, null, "after config key");

        Token valueToken = current();
        ConfigValue value;
        if (valueToken.is(TokenKind.STRING)) {
            value = new ConfigValue.Text(advance().text(), true);
        } else if (valueToken.is(TokenKind.NUMBER)) {
            String number = advance().text();
            if (current().endsStatement()) {
                value = new ConfigValue.Numeric(Double.parseDouble(number));
            } else {
                value = new ConfigValue.Text(number + " " + restOfLine(), false);
            }
        } else if (valueToken.is(TokenKind.IDENTIFIER) || valueToken.is(TokenKind.KEYWORD)
            || valueToken.is(TokenKind.BOOLEAN)) {
            value = new ConfigValue.Text(restOfLine(), false);
        } else {
            throw fail(valueToken, "Expected a value after \"" + key + ":\", but found \"" + valueToken.text() + "\".", null, null);
        }
        expectNewline();
        return new ConfigEntry(key, value, location);
    }

    private ServicesBlock parseServicesBlock() {
        var location = location();
        parseBlockHeader("services");
        var declarations = new ArrayList<ServiceDeclaration>();
        if (!match(TokenKind.INDENT)) {
            addError(
                current(),
                "Expected indented service declarations after \"services:\".",
                "Add your services indented under services:",
                "Example:\n    services:\n        MyAPI is an API at \"https://...\""
            );
            return new ServicesBlock(declarations, location);
        }
        eachLine(() -> declarations.add(parseServiceDeclaration()));
        return new ServicesBlock(declarations, location);
    }

    private ServiceDeclaration parseServiceDeclaration() {
        var location = location();
        Token nameToken = current();
        if (!nameToken.is(TokenKind.IDENTIFIER)) {
            throw fail(
                nameToken,
                "Expected a service name (like \"Stripe\" or \"EmailVerifier\"), but found \"" + nameToken.text() + "\".",
                "Service names should start with a capital letter.",
                "Example: Stripe is a plugin \"flow-connector-stripe\""
            );
        }
        String name = advance().text();
        if (!match(TokenKind.KEYWORD, "is")) {
            throw fail(current(), "Expected \"is\" after service name \"" + name + "\".", null,
                "Example: " + name + " is an API at \"https://...\"");
        }

        ServiceKind kind = parseServiceKind(name);
        Token targetToken = current();
        if (!targetToken.is(TokenKind.STRING)) {
            throw fail(
                targetToken,
                "Expected a quoted string for the service target, but found \"" + targetToken.text() + "\".",
                "Wrap the value in double quotes.",
                "Example: " + name + " is " + kind.phrase() + " \"value-here\""
            );
        }
        String target = advance().text();
        expectNewline();

        var headers = new ArrayList<ServiceHeader>();
        if (match(TokenKind.INDENT)) {
            eachLine(() -> parseHeadersSection(headers));
        }
        return new ServiceDeclaration(name, kind, target, headers, location);
    }

    private ServiceKind parseServiceKind(String name) {
        String validKinds = "Valid service types:\n    " + name + " is an API at \"https://...\"\n    "
            + name + " is an AI using \"model-name\"\n    " + name + " is a plugin \"package-name\"\n    "
            + name + " is a webhook at \"/path\"";
        Token article = current();
        if ("an".equals(article.text())) {
            advance();
            Token type = current();
            if (type.is(TokenKind.IDENTIFIER, "API")) {
                advance();
                expect(TokenKind.KEYWORD, "at", "after \"API\"");
                return ServiceKind.API;
            }
            if (type.is(TokenKind.IDENTIFIER, "AI")) {
                advance();
                expect(TokenKind.KEYWORD, "using", "after \"AI\"");
                return ServiceKind.AI;
            }
            throw fail(type, "Expected \"API\" or \"AI\" after \"is an\", but found \"" + type.text() + "\".", null, validKinds);
        }
        if ("a".equals(article.text())) {
            advance();
            Token type = current();
            if (type.is(TokenKind.IDENTIFIER, "plugin")) {
                advance();
                return ServiceKind.PLUGIN;
            }
            if (type.is(TokenKind.IDENTIFIER, "webhook")) {
                advance();
                expect(TokenKind.KEYWORD, "at", "after \"webhook\"");
                return ServiceKind.WEBHOOK;
            }
            throw fail(type, "Expected \"plugin\" or \"webhook\" after \"is a\", but found \"" + type.text() + "\".", null, validKinds);
        }
        throw fail(
            article,
            "Expected \"an\" or \"a\" after \"is\" in service declaration, but found \"" + article.text() + "\".",
            null,
            validKinds
        );
    }

    private void parseHeadersSection(List<ServiceHeader> headers) {
        Token tok = current();
        if (!tok.is(TokenKind.KEYWORD, "with") || !peekNext().is(TokenKind.IDENTIFIER, "headers")) {
            throw fail(tok, "Expected \"with headers:\" under the service declaration, but found \"" + tok.text() + "\".", null,
                "Example:\n    GitHub is an API at \"https://api.github.com\"\n        with headers:\n"
                    + "            Authorization: \"token {env.GITHUB_TOKEN}\"");
        }
        advance();
        advance();
        expect(TokenKind.COLON, null, "after \"with headers\"");
        expectNewline();
        if (!match(TokenKind.INDENT)) {
            addError(current(), "Expected indented headers after \"with headers:\".");
            return;
        }
        eachLine(() -> {
            var location = location();
            Token nameToken = current();
            if (!nameToken.is(TokenKind.IDENTIFIER) && !nameToken.is(TokenKind.KEYWORD)) {
                throw fail(nameToken, "Expected a header name, but found \"" + nameToken.text() + "\".", null,
                    "Example: Authorization: \"Bearer {env.API_TOKEN}\"");
            }
            String name = advance().text();
            expect(TokenKind.COLON, null, "after header name");
            Expression value = parseExpression();
            expectNewline();
            headers.add(new ServiceHeader(name, value, location));
        });
    }

    private WorkflowBlock parseWorkflowBlock() {
        var location = location();
        parseBlockHeader("workflow");
        var body = new ArrayList<Statement>();
        var trigger = new ArrayList<Trigger>(1);
        if (!match(TokenKind.INDENT)) {
            addError(current(), "Expected indented workflow content after \"workflow:\".");
            return new WorkflowBlock(Optional.empty(), body, location);
        }
        eachLine(() -> {
            if (check(TokenKind.KEYWORD, "trigger")) {
                if (!trigger.isEmpty()) {
                    addError(current(), "Duplicate trigger. A workflow can only have one trigger.");
                    trigger.clear();
                }
                trigger.add(parseTrigger());
            } else {
                body.add(parseStatement());
            }
        });
        return new WorkflowBlock(trigger.stream().findFirst(), body, location);
    }

    private Trigger parseTrigger() {
        var location = location();
        advance();
        expect(TokenKind.COLON, null, "after \"trigger\"");
        String description = restOfLine();
        expectNewline();
        return new Trigger(description, location);
    }

    private void parseBlockHeader(String keyword) {
        expect(TokenKind.KEYWORD, keyword, null);
        expect(TokenKind.COLON, null, null);
        expectNewline();
    }

    private List<Statement> parseBlock() {
        var statements = new ArrayList<Statement>();
        if (!match(TokenKind.INDENT)) {
            addError(current(), "Expected an indented block here.");
            return statements;
        }
        eachLine(() -> statements.add(parseStatement()));
        return statements;
    }

    /**
     * Runs {@code lineParser} for every line of the current indented block and consumes the
     * closing DEDENT. A line that fails is recorded and skipped.
     */
    private void eachLine(Runnable lineParser) {
        while (!check(TokenKind.DEDENT) && !atEnd()) {
            skipNewlines();
            if (check(TokenKind.DEDENT) || atEnd()) {
                break;
            }
            int before = pos;
            try {
                lineParser.run();
            } catch (SyntaxError error) {
                errors.add(error.diagnostic);
                recover();
            }
            if (pos == before) {
                advance();
            }
            skipNewlines();
        }
        match(TokenKind.DEDENT);
    }

    // ------------------------------------------------------------ statements

    private Statement parseStatement() {
        Token tok = current();
        if (tok.is(TokenKind.KEYWORD, "step")) {
            return parseStep();
        }
        if (tok.is(TokenKind.KEYWORD, "if")) {
            return parseIf();
        }
        if (tok.is(TokenKind.KEYWORD_COMPOUND, "for each")) {
            return parseForEach();
        }
        if (tok.is(TokenKind.KEYWORD, "set")) {
            return parseSet();
        }
        if (tok.is(TokenKind.KEYWORD, "ask")) {
            return parseAsk();
        }
        if (tok.is(TokenKind.KEYWORD, "complete")) {
            return parseComplete();
        }
        if (tok.is(TokenKind.KEYWORD, "reject")) {
            return parseReject();
        }
        if (tok.is(TokenKind.KEYWORD, "log")) {
            return parseLog();
        }
        if (tok.is(TokenKind.KEYWORD, "otherwise") || tok.is(TokenKind.KEYWORD_COMPOUND, "otherwise if")) {
            throw fail(tok, "I found \"" + tok.text() + "\" without an \"if\" before it.",
                "Make sure \"" + tok.text() + "\" lines up with its \"if\".", null);
        }
        if (tok.is(TokenKind.IDENTIFIER) || tok.is(TokenKind.KEYWORD)) {
            return parseServiceCall();
        }
        throw fail(tok, "I don't understand \"" + tok.text() + "\" here. Expected a statement like \"set\", \"if\", \"log\", \"step\", etc.",
            null, null);
    }

    private Statement parseStep() {
        var location = location();
        advance();
        var name = new StringBuilder();
        while (!check(TokenKind.COLON) && !current().endsStatement()) {
            appendWord(name, advance().text());
        }
        if (name.length() == 0) {
            addError(current(), "Expected a name for this step.", null, "Example: step Verify Email:");
        }
        expect(TokenKind.COLON, null, "after step name");
        expectNewline();
        return new Statement.StepBlock(name.toString(), parseBlock(), location);
    }

    private Statement parseIf() {
        var location = location();
        advance();
        Expression condition = parseExpression();
        expect(TokenKind.COLON, null, "after condition");
        expectNewline();
        List<Statement> body = parseBlock();

        var otherwiseIfs = new ArrayList<OtherwiseIf>();
        while (check(TokenKind.KEYWORD_COMPOUND, "otherwise if")) {
            var branchLocation = location();
            advance();
            Expression branchCondition = parseExpression();
            expect(TokenKind.COLON, null, "after condition");
            expectNewline();
            otherwiseIfs.add(new OtherwiseIf(branchCondition, parseBlock(), branchLocation));
        }

        Optional<List<Statement>> otherwise = Optional.empty();
        if (match(TokenKind.KEYWORD, "otherwise")) {
            expect(TokenKind.COLON, null, "after \"otherwise\"");
            expectNewline();
            otherwise = Optional.of(parseBlock());
        }
        return new Statement.IfStatement(condition, body, otherwiseIfs, otherwise, location);
    }

    private Statement parseForEach() {
        var location = location();
        advance();
        Token item = current();
        if (!item.is(TokenKind.IDENTIFIER)) {
            throw fail(item, "Expected a variable name after \"for each\", but found \"" + item.text() + "\".", null,
                "Example: for each item in order.items:");
        }
        String itemName = advance().text();
        expect(TokenKind.KEYWORD, "in", "after loop variable name");
        Expression collection = parseAtom();
        expect(TokenKind.COLON, null, "after collection");
        expectNewline();
        return new Statement.ForEachStatement(itemName, collection, parseBlock(), location);
    }

    private Statement parseSet() {
        var location = location();
        advance();
        String variable = expectName("after \"set\"", "Example: set greeting to \"Hello\"");
        expect(TokenKind.KEYWORD, "to", "after variable name");
        Expression value = parseExpression();
        expectNewline();
        return new Statement.SetStatement(variable, value, location);
    }

    private Statement parseAsk() {
        var location = location();
        advance();
        Token agentToken = current();
        if (!agentToken.is(TokenKind.IDENTIFIER)) {
            throw fail(agentToken, "Expected an agent name after \"ask\", but found \"" + agentToken.text() + "\".", null,
                "Example: ask Analyst to summarize the report");
        }
        String agent = advance().text();
        expect(TokenKind.KEYWORD, "to", "after agent name");

        Expression instruction;
        if (check(TokenKind.STRING) || check(TokenKind.STRING_PART)) {
            instruction = parseAtom();
        } else {
            var instructionLocation = location();
            String words = restOfLine();
            if (words.isEmpty()) {
                addError(current(), "Expected an instruction for " + agent + ".", null,
                    "Example: ask " + agent + " to summarize the report");
            }
            instruction = new Expression.StringLiteral(words, instructionLocation);
        }
        expectNewline();

        var saves = new Saves();
        if (match(TokenKind.INDENT)) {
            eachLine(() -> {
                Token tok = current();
                if (tok.is(TokenKind.KEYWORD_COMPOUND, "save the result as")) {
                    advance();
                    saves.result = Optional.of(expectName("after \"save the result as\"", null));
                } else if (tok.is(TokenKind.KEYWORD_COMPOUND, "save the confidence as")) {
                    advance();
                    saves.confidence = Optional.of(expectName("after \"save the confidence as\"", null));
                } else {
                    throw fail(tok, "I don't understand \"" + tok.text() + "\" under an \"ask\" statement.", null,
                        "You can use:\n    save the result as <name>\n    save the confidence as <name>");
                }
                expectNewline();
            });
        }
        return new Statement.AskStatement(agent, instruction, saves.result, saves.confidence, location);
    }

    private Statement parseComplete() {
        var location = location();
        advance();
        var outputs = new ArrayList<Parameter>();
        if (match(TokenKind.KEYWORD, "with")) {
            do {
                outputs.add(parseParameter());
            } while (match(TokenKind.KEYWORD, "and"));
        }
        expectNewline();
        return new Statement.CompleteStatement(outputs, location);
    }

    private Statement parseReject() {
        var location = location();
        advance();
        expect(TokenKind.KEYWORD, "with", "after \"reject\"");
        Expression message = parseExpression();
        expectNewline();
        return new Statement.RejectStatement(message, location);
    }

    private Statement parseLog() {
        var location = location();
        advance();
        Expression message = parseExpression();
        expectNewline();
        return new Statement.LogStatement(message, location);
    }

    private Statement parseServiceCall() {
        var location = location();
        String verb = advance().text();
        var description = new StringBuilder();
        while (!current().endsStatement() && !check(TokenKind.KEYWORD, "using")) {
            appendWord(description, advance().text());
        }

        Optional<String> service = Optional.empty();
        Optional<Expression> path = Optional.empty();
        var parameters = new ArrayList<Parameter>();
        if (match(TokenKind.KEYWORD, "using")) {
            Token serviceToken = current();
            if (!serviceToken.is(TokenKind.IDENTIFIER) && !serviceToken.is(TokenKind.KEYWORD)) {
                throw fail(serviceToken, "Expected a service name after \"using\", but found \"" + serviceToken.text() + "\".",
                    null, null);
            }
            service = Optional.of(advance().text());
            if (match(TokenKind.KEYWORD, "at")) {
                path = Optional.of(parseAtom());
            }
            if (match(TokenKind.KEYWORD, "with")) {
                do {
                    parameters.add(parseParameter());
                } while (match(TokenKind.KEYWORD, "and"));
            } else if (check(TokenKind.KEYWORD, "to")) {
                var parameterLocation = location();
                advance();
                parameters.add(new Parameter("to", parseAtom(), parameterLocation));
            }
        }
        expectNewline();

        var saves = new Saves();
        if (match(TokenKind.INDENT)) {
            eachLine(() -> parseServiceCallOption(saves));
        }
        return new Statement.ServiceCall(
            verb,
            description.toString(),
            service,
            path,
            parameters,
            saves.result,
            saves.status,
            saves.headers,
            saves.handler,
            location
        );
    }

    private void parseServiceCallOption(Saves saves) {
        Token tok = current();
        if (tok.is(TokenKind.KEYWORD_COMPOUND, "save the result as")) {
            advance();
            saves.result = Optional.of(expectName("after \"save the result as\"", null));
            expectNewline();
        } else if (tok.is(TokenKind.KEYWORD_COMPOUND, "save the status as")) {
            advance();
            saves.status = Optional.of(expectName("after \"save the status as\"", null));
            expectNewline();
        } else if (tok.is(TokenKind.KEYWORD_COMPOUND, "save the response headers as")) {
            advance();
            saves.headers = Optional.of(expectName("after \"save the response headers as\"", null));
            expectNewline();
        } else if (tok.is(TokenKind.KEYWORD_COMPOUND, "on failure") || tok.is(TokenKind.KEYWORD_COMPOUND, "on timeout")) {
            if (saves.handler.isPresent()) {
                addError(tok, "This service call already has an error handler. Use only one \"on failure:\" or \"on timeout:\" block.");
            }
            saves.handler = Optional.of(parseErrorHandler());
        } else {
            throw fail(
                tok,
                "I don't understand \"" + tok.text() + "\" under a service call.",
                null,
                "You can use:\n    save the result as <name>\n    save the status as <name>\n"
                    + "    save the response headers as <name>\n    on failure:"
            );
        }
    }

    private ErrorHandler parseErrorHandler() {
        var location = location();
        Token kindToken = advance();
        var kind = kindToken.text().equals(ErrorHandler.Kind.TIMEOUT.keyword())
            ? ErrorHandler.Kind.TIMEOUT
            : ErrorHandler.Kind.FAILURE;
        expect(TokenKind.COLON, null, "after \"" + kind.keyword() + "\"");
        expectNewline();

        var handler = new HandlerParts();
        if (match(TokenKind.INDENT)) {
            eachLine(() -> {
                Token tok = current();
                if (tok.is(TokenKind.KEYWORD, "retry")) {
                    advance();
                    handler.retryCount = Optional.of(parseRetryCount());
                    expect(TokenKind.KEYWORD, "times", "after the retry count");
                    if (match(TokenKind.KEYWORD, "waiting")) {
                        handler.retryWait = Optional.of(parseWait());
                    }
                    expectNewline();
                } else if (tok.is(TokenKind.KEYWORD_COMPOUND, "if still failing")) {
                    advance();
                    expect(TokenKind.COLON, null, "after \"if still failing\"");
                    expectNewline();
                    handler.fallback = Optional.of(parseBlock());
                } else {
                    throw fail(tok, "I don't understand \"" + tok.text() + "\" inside \"" + kind.keyword() + ":\".", null,
                        "You can use:\n    retry 3 times waiting 5 seconds\n    if still failing:");
                }
            });
        }
        return new ErrorHandler(kind, handler.retryCount, handler.retryWait, handler.fallback, location);
    }

    private int parseRetryCount() {
        Token count = current();
        if (!count.is(TokenKind.NUMBER) || count.text().contains(".")) {
            throw fail(count, "Expected a whole number of retries after \"retry\", but found \"" + count.text() + "\".", null,
                "Example: retry 3 times waiting 5 seconds");
        }
        int retries;
        try {
            retries = Integer.parseInt(count.text());
        } catch (NumberFormatException ex) {
            retries = Integer.MAX_VALUE;
        }
        if (retries > ErrorHandler.MAX_RETRIES) {
            throw fail(count, "You can retry at most " + ErrorHandler.MAX_RETRIES + " times, but found \"" + count.text() + "\".",
                null, "Example: retry 3 times waiting 5 seconds");
        }
        advance();
        return retries;
    }

    private Duration parseWait() {
        Token amount = current();
        if (!amount.is(TokenKind.NUMBER)) {
            throw fail(amount, "Expected a number after \"waiting\", but found \"" + amount.text() + "\".", null,
                "Example: retry 3 times waiting 5 seconds");
        }
        advance();
        long unitMillis = 1_000L;
        Token unit = current();
        if (unit.is(TokenKind.IDENTIFIER) || unit.is(TokenKind.KEYWORD)) {
            advance();
            switch (unit.text().toLowerCase(Locale.ROOT)) {
                case "second":
                case "seconds":
                    unitMillis = 1_000L;
                    break;
                case "minute":
                case "minutes":
                    unitMillis = 60_000L;
                    break;
                case "hour":
                case "hours":
                    unitMillis = 3_600_000L;
                    break;
                default:
                    throw fail(unit, "I don't know the time unit \"" + unit.text() + "\".",
                        "Use seconds, minutes, or hours.", null);
            }
        }
        try {
            long millis = new BigDecimal(amount.text()).multiply(BigDecimal.valueOf(unitMillis))
                .setScale(0, RoundingMode.DOWN)
                .longValueExact();
            return Duration.ofMillis(millis);
        } catch (ArithmeticException ex) {
            throw fail(amount, "The wait after \"waiting " + amount.text() + "\" is too long.", null,
                "Example: retry 3 times waiting 5 seconds");
        }
    }

    private Parameter parseParameter() {
        var location = location();
        String name = expectName("for the parameter", "Example: with email request.email and name request.name");
        return new Parameter(name, parseAtom(), location);
    }

    // ----------------------------------------------------------- expressions

    private Expression parseExpression() {
        Expression left = parseNegation();
        while (check(TokenKind.KEYWORD, "and") || check(TokenKind.KEYWORD, "or")) {
            var operator = advance().text().equals("and") ? LogicalOperator.AND : LogicalOperator.OR;
            Expression right = parseNegation();
            left = new Expression.LogicalExpression(operator, left, Optional.of(right), left.location());
        }
        return left;
    }

    private Expression parseNegation() {
        if (check(TokenKind.KEYWORD, "not")) {
            var location = location();
            advance();
            return new Expression.LogicalExpression(LogicalOperator.NOT, parseNegation(), Optional.empty(), location);
        }
        return parseComparison();
    }

    private Expression parseComparison() {
        Expression left = parseArithmetic();
        Optional<ComparisonOperator> operator = comparisonOperator(current());
        if (operator.isEmpty()) {
            return left;
        }
        advance();
        Expression comparison;
        if (operator.get().isUnary()) {
            comparison = new Expression.ComparisonExpression(left, operator.get(), Optional.empty(), left.location());
        } else {
            Expression right = parseArithmetic();
            comparison = new Expression.ComparisonExpression(left, operator.get(), Optional.of(right), left.location());
        }
        if (comparisonOperator(current()).isPresent()) {
            throw fail(
                current(),
                "A condition can only have one comparison, but I found \"" + current().text() + "\" after \""
                    + operator.get().keyword() + "\".",
                "Use \"and\" or \"or\" to combine comparisons.",
                null
            );
        }
        return comparison;
    }

    private Expression parseArithmetic() {
        Expression left = parseAtom();
        Optional<MathOperator> operator = mathOperator(current());
        while (operator.isPresent()) {
            advance();
            Expression right = parseAtom();
            left = new Expression.MathExpression(left, operator.get(), right, left.location());
            operator = mathOperator(current());
        }
        return left;
    }

    private Expression parseAtom() {
        Token tok = current();
        var location = new SourceLocation(tok.line(), tok.column());
        switch (tok.kind()) {
            case STRING:
                advance();
                return new Expression.StringLiteral(tok.text(), location);
            case STRING_PART:
                return parseInterpolatedString();
            case NUMBER:
                advance();
                return new Expression.NumberLiteral(Double.parseDouble(tok.text()), location);
            case BOOLEAN:
                advance();
                return new Expression.BooleanLiteral("true".equals(tok.text()), location);
            case IDENTIFIER:
                return parseReference();
            case KEYWORD:
                if (!Keywords.STATEMENT.contains(tok.text())) {
                    return parseReference();
                }
                break;
            default:
                break;
        }
        addError(tok, "Expected a value (string, number, or variable name), but found \"" + tok.text() + "\".");
        if (!tok.endsStatement()) {
            advance();
        }
        return new Expression.StringLiteral(ERROR_PLACEHOLDER, location);
    }

    private Expression parseReference() {
        Token tok = advance();
        var root = new Expression.Identifier(tok.text(), new SourceLocation(tok.line(), tok.column()));
        var properties = new ArrayList<String>();
        while (check(TokenKind.DOT)) {
            advance();
            Token property = current();
            if (!property.is(TokenKind.IDENTIFIER) && !property.is(TokenKind.KEYWORD) && !property.is(TokenKind.BOOLEAN)) {
                addError(property, "Expected a property name after \".\", but found \"" + property.text() + "\".");
                break;
            }
            properties.add(advance().text());
        }
        return properties.isEmpty() ? root : new Expression.DotAccess(root, properties, root.location());
    }

    private Expression parseInterpolatedString() {
        var location = location();
        var parts = new ArrayList<InterpolatedString.Part>();
        while (true) {
            Token text = expect(TokenKind.STRING_PART, null, "in string");
            if (!text.text().isEmpty()) {
                parts.add(new InterpolatedString.TextPart(text.text()));
            }
            if (!match(TokenKind.INTERP_START)) {
                break;
            }
            parts.add(new InterpolatedString.ExpressionPart(parseReference()));
            expect(TokenKind.INTERP_END, null, "to close the interpolation");
        }
        if (parts.isEmpty()) {
            parts.add(new InterpolatedString.TextPart(""));
        }
        return new InterpolatedString(parts, location);
    }

    private static Optional<ComparisonOperator> comparisonOperator(Token tok) {
        if (!tok.is(TokenKind.KEYWORD) && !tok.is(TokenKind.KEYWORD_COMPOUND)) {
            return Optional.empty();
        }
        return ComparisonOperator.fromKeyword(tok.text());
    }

    private static Optional<MathOperator> mathOperator(Token tok) {
        if (!tok.is(TokenKind.KEYWORD) && !tok.is(TokenKind.KEYWORD_COMPOUND)) {
            return Optional.empty();
        }
        return MathOperator.fromKeyword(tok.text());
    }

    // ------------------------------------------------------- token navigation

    private Token current() {
        return pos < tokens.size() ? tokens.get(pos) : eof();
    }

    private Token peekNext() {
        return pos + 1 < tokens.size() ? tokens.get(pos + 1) : eof();
    }

    private Token eof() {
        if (!tokens.isEmpty()) {
            Token last = tokens.get(tokens.size() - 1);
            return new Token(TokenKind.EOF, "", last.line(), last.column());
        }
        return new Token(TokenKind.EOF, "", 1, 1);
    }

    private Token advance() {
        Token tok = current();
        if (!tok.is(TokenKind.EOF)) {
            pos++;
        }
        return tok;
    }

    private boolean atEnd() {
        return current().is(TokenKind.EOF);
    }

    private boolean check(TokenKind kind) {
        return current().is(kind);
    }

    private boolean check(TokenKind kind, String text) {
        return current().is(kind, text);
    }

    private boolean match(TokenKind kind) {
        if (check(kind)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean match(TokenKind kind, String text) {
        if (check(kind, text)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * Consumes the expected token, or records an error and returns a synthetic one so the caller
     * can carry on.
     */
    private Token expect(TokenKind kind, String text, String context) {
        Token tok = current();
        if (tok.kind() == kind && (text == null || tok.text().equals(text))) {
            return advance();
        }
        String expected = text != null ? "\"" + text + "\"" : kind.name();
        String suffix = context != null ? " " + context : "";
        addError(tok, "Expected " + expected + suffix + ", but found \"" + tok.text() + "\" (" + tok.kind() + ").");
        return new Token(kind, text != null ? text : "", tok.line(), tok.column());
    }

    private String expectName(String context, String hint) {
        Token tok = current();
        if (tok.is(TokenKind.IDENTIFIER) || (tok.is(TokenKind.KEYWORD) && !Keywords.STATEMENT.contains(tok.text()))) {
            return advance().text();
        }
        throw fail(tok, "Expected a name " + context + ", but found \"" + tok.text() + "\".", null, hint);
    }

    private void expectNewline() {
        if (match(TokenKind.NEWLINE) || atEnd() || check(TokenKind.DEDENT)) {
            return;
        }
        addError(current(), "Expected end of line, but found \"" + current().text() + "\".");
        skipToNextStatement();
        match(TokenKind.NEWLINE);
    }

    private void skipNewlines() {
        while (match(TokenKind.NEWLINE)) {
            // consecutive separators carry no meaning
        }
    }

    private void skipToNextStatement() {
        while (!current().endsStatement()) {
            advance();
        }
    }

    /** Skips the rest of a broken statement, including any block nested under it. */
    private void recover() {
        skipToNextStatement();
        skipNewlines();
        if (check(TokenKind.INDENT)) {
            int depth = 0;
            do {
                if (check(TokenKind.INDENT)) {
                    depth++;
                } else if (check(TokenKind.DEDENT)) {
                    depth--;
                }
                advance();
            } while (depth > 0 && !atEnd());
        }
    }

    private String restOfLine() {
        var words = new StringBuilder();
        while (!current().endsStatement()) {
            appendWord(words, advance().text());
        }
        return words.toString();
    }

    private static void appendWord(StringBuilder builder, String word) {
        if (builder.length() > 0) {
            builder.append(' ');
        }
        builder.append(word);
    }

    private SourceLocation location() {
        Token tok = current();
        return new SourceLocation(tok.line(), tok.column());
    }

    private void addError(Token tok, String message) {
        addError(tok, message, null, null);
    }

    private void addError(Token tok, String message, String suggestion, String hint) {
        errors.add(diagnostic(tok, message, suggestion, hint));
    }

    private SyntaxError fail(Token tok, String message, String suggestion, String hint) {
        return new SyntaxError(diagnostic(tok, message, suggestion, hint));
    }

    private FlowDiagnostic diagnostic(Token tok, String message, String suggestion, String hint) {
        return FlowDiagnostic.of(Severity.ERROR, fileName, tok.line(), tok.column(), message, source, suggestion, hint);
    }

    /** Mutable collector for the optional clauses under a call. */
    private static final class Saves {
        private Optional<String> result = Optional.empty();
        private Optional<String> status = Optional.empty();
        private Optional<String> headers = Optional.empty();
        private Optional<String> confidence = Optional.empty();
        private Optional<ErrorHandler> handler = Optional.empty();
    }

    private static final class HandlerParts {
        private Optional<Integer> retryCount = Optional.empty();
        private Optional<Duration> retryWait = Optional.empty();
        private Optional<List<Statement>> fallback = Optional.empty();
    }

    /** Aborts the current line; caught by {@link #eachLine(Runnable)}. */
    private static final class SyntaxError extends RuntimeException {
        private final FlowDiagnostic diagnostic;

        private SyntaxError(FlowDiagnostic diagnostic) {
            super(diagnostic.message(), null, false, false);
            this.diagnostic = diagnostic;
        }
    }
}
