package work.lcod.flow.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.lcod.flow.ast.ComparisonOperator;
import work.lcod.flow.ast.ConfigValue;
import work.lcod.flow.ast.ErrorHandler;
import work.lcod.flow.ast.Expression;
import work.lcod.flow.ast.LogicalOperator;
import work.lcod.flow.ast.MathOperator;
import work.lcod.flow.ast.ServiceDeclaration;
import work.lcod.flow.ast.ServiceKind;
import work.lcod.flow.ast.SourceLocation;
import work.lcod.flow.ast.Statement;
import work.lcod.flow.support.FlowTestSupport;

class ParserTest {
    @Test
    void parsesCompleteFile() {
        var program = FlowTestSupport.parse(FlowTestSupport.read(FlowTestSupport.flowFile("order.flow")));

        var config = program.config().orElseThrow();
        assertEquals(3, config.entries().size());
        assertEquals(new ConfigValue.Text("Order Processing", true), config.entries().get(0).value());
        assertEquals(new ConfigValue.Numeric(1), config.entries().get(1).value());
        assertEquals(new ConfigValue.Text("5 minutes", false), config.entries().get(2).value());

        var services = program.services().orElseThrow().declarations();
        assertEquals(List.of(ServiceKind.API, ServiceKind.AI, ServiceKind.WEBHOOK),
            services.stream().map(ServiceDeclaration::kind).collect(Collectors.toList()));
        assertEquals("anthropic/claude", services.get(1).target());
        assertEquals("Authorization", services.get(2).headers().get(0).name());

        var workflow = program.workflow().orElseThrow();
        assertEquals("when a new order arrives", workflow.trigger().orElseThrow().description());
        assertEquals(5, workflow.body().size());
        var validate = assertInstanceOf(Statement.StepBlock.class, workflow.body().get(0));
        assertEquals("Validate", validate.name());
        assertEquals(new SourceLocation(17, 5), validate.location());
    }

    @Test
    void mathIsLeftAssociativeWithoutPrecedence() {
        var set = (Statement.SetStatement) onlyStatement("set x to 2 plus 3 times 4");
        var outer = assertInstanceOf(Expression.MathExpression.class, set.value());
        assertEquals(MathOperator.TIMES, outer.operator());
        var inner = assertInstanceOf(Expression.MathExpression.class, outer.left());
        assertEquals(MathOperator.PLUS, inner.operator());
        assertEquals(4.0, ((Expression.NumberLiteral) outer.right()).value());
    }

    @Test
    void notBindsTighterThanAnd() {
        var ifStatement = (Statement.IfStatement) onlyStatement("if not ready and count is above 2:", "        log 1");
        var and = assertInstanceOf(Expression.LogicalExpression.class, ifStatement.condition());
        assertEquals(LogicalOperator.AND, and.operator());
        var not = assertInstanceOf(Expression.LogicalExpression.class, and.left());
        assertEquals(LogicalOperator.NOT, not.operator());
        var comparison = assertInstanceOf(Expression.ComparisonExpression.class, and.right().orElseThrow());
        assertEquals(ComparisonOperator.IS_ABOVE, comparison.operator());
    }

    @Test
    void unaryComparisonsTakeNoRightOperand() {
        var ifStatement = (Statement.IfStatement) onlyStatement("if request.items is not empty:", "        log 1");
        var comparison = assertInstanceOf(Expression.ComparisonExpression.class, ifStatement.condition());
        assertEquals(ComparisonOperator.IS_NOT_EMPTY, comparison.operator());
        assertTrue(comparison.right().isEmpty());
        var access = assertInstanceOf(Expression.DotAccess.class, comparison.left());
        assertEquals("request.items", access.path());
    }

    @Test
    void rejectsChainedComparisons() {
        var result = Parser.parse(FlowTestSupport.source(
            "workflow:",
            "    if a is b is c:",
            "        log 1"
        ), "test.flow");

        assertTrue(result.hasErrors());
        assertTrue(result.errors().get(0).message().startsWith("A condition can only have one comparison"));
    }

    @Test
    void reportsEveryErrorInOnePass() {
        var result = Parser.parse(FlowTestSupport.source(
            "workflow:",
            "    set x 5",
            "    set y to",
            "    log \"still parsed\""
        ), "test.flow");

        assertEquals(2, result.errors().size());
        assertEquals("Expected \"to\" after variable name, but found \"5\" (NUMBER).", result.errors().get(0).message());
        assertEquals(2, result.errors().get(0).line());
        assertTrue(result.errors().get(1).message().startsWith("Expected a value (string, number, or variable name)"));
        assertEquals(3, result.program().workflow().orElseThrow().body().size());
    }

    @Test
    void reportsStrayTopLevelContentAndKeepsGoing() {
        var result = Parser.parse(FlowTestSupport.source(
            "set x to 1",
            "workflow:",
            "    log 1"
        ), "test.flow");

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).message().startsWith("I found \"set\" at the top level"));
        assertEquals(1, result.program().workflow().orElseThrow().body().size());
    }

    @Test
    void parsesServiceCallClauses() {
        var call = (Statement.ServiceCall) onlyStatement(
            "fetch the user using Users at \"/users\" with id request.id and active true",
            "        save the result as user",
            "        save the status as code",
            "        save the response headers as headers",
            "        on failure:",
            "            retry 3 times waiting 2 minutes",
            "            if still failing:",
            "                reject with \"no user\""
        );

        assertEquals("fetch", call.verb());
        assertEquals("the user", call.description());
        assertEquals(Optional.of("Users"), call.service());
        assertEquals("/users", ((Expression.StringLiteral) call.path().orElseThrow()).value());
        assertEquals(List.of("id", "active"), List.of(call.parameters().get(0).name(), call.parameters().get(1).name()));
        assertEquals(Optional.of("user"), call.resultVariable());
        assertEquals(Optional.of("code"), call.statusVariable());
        assertEquals(Optional.of("headers"), call.headersVariable());

        ErrorHandler handler = call.errorHandler().orElseThrow();
        assertEquals(ErrorHandler.Kind.FAILURE, handler.kind());
        assertEquals(Optional.of(3), handler.retryCount());
        assertEquals(Optional.of(Duration.ofMinutes(2)), handler.retryWait());
        assertEquals(4, handler.maxAttempts());
        assertInstanceOf(Statement.RejectStatement.class, handler.fallback().orElseThrow().get(0));
    }

    @Test
    void reportsOversizedRetryCountAsSyntaxError() {
        var result = Parser.parse(FlowTestSupport.source(
            "workflow:",
            "    sync the data using Store",
            "        on failure:",
            "            retry 99999999999 times",
            "    log \"after\""
        ), "test.flow");

        assertEquals(1, result.errors().size());
        assertEquals("You can retry at most 100 times, but found \"99999999999\".", result.errors().get(0).message());
        assertEquals(4, result.errors().get(0).line());
        assertEquals(19, result.errors().get(0).column());
        assertEquals(2, result.program().workflow().orElseThrow().body().size());
    }

    @Test
    void capsRetryCount() {
        var result = Parser.parse(FlowTestSupport.source(
            "workflow:",
            "    sync the data using Store",
            "        on failure:",
            "            retry 2147483647 times"
        ), "test.flow");

        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).message().startsWith("You can retry at most 100 times"));
        assertThrows(IllegalArgumentException.class, () -> new ErrorHandler(ErrorHandler.Kind.FAILURE,
            Optional.of(Integer.MAX_VALUE), Optional.empty(), Optional.empty(), SourceLocation.NONE));
    }

    @Test
    void reportsWaitTooLongAsSyntaxError() {
        var result = Parser.parse(FlowTestSupport.source(
            "workflow:",
            "    sync the data using Store",
            "        on failure:",
            "            retry 2 times waiting 99999999999999999999 hours"
        ), "test.flow");

        assertEquals(1, result.errors().size());
        assertEquals("The wait after \"waiting 99999999999999999999\" is too long.", result.errors().get(0).message());
        assertEquals(4, result.errors().get(0).line());
    }

    @Test
    void parsesToShorthandAsParameter() {
        var call = (Statement.ServiceCall) onlyStatement("send the invoice using Mailer to request.email");
        assertEquals("to", call.parameters().get(0).name());
        assertInstanceOf(Expression.DotAccess.class, call.parameters().get(0).value());
    }

    @Test
    void parsesBranchesAndLoops() {
        var ifStatement = (Statement.IfStatement) onlyStatement(
            "if score is at least 90:",
            "        set grade to \"A\"",
            "    otherwise if score is at least 80:",
            "        set grade to \"B\"",
            "    otherwise:",
            "        for each item in request.items:",
            "            log item"
        );

        assertEquals(1, ifStatement.otherwiseIfs().size());
        var otherwise = ifStatement.otherwise().orElseThrow();
        var loop = assertInstanceOf(Statement.ForEachStatement.class, otherwise.get(0));
        assertEquals("item", loop.itemName());
        assertEquals(1, loop.body().size());
    }

    @Test
    void parsesAskWithBareInstruction() {
        var ask = (Statement.AskStatement) onlyStatement(
            "ask Writer to summarize the report",
            "        save the result as summary",
            "        save the confidence as sure"
        );

        assertEquals("Writer", ask.agent());
        assertEquals("summarize the report", ((Expression.StringLiteral) ask.instruction()).value());
        assertEquals(Optional.of("summary"), ask.resultVariable());
        assertEquals(Optional.of("sure"), ask.confidenceVariable());
    }

    @Test
    void parsesInterpolationParts() {
        var log = (Statement.LogStatement) onlyStatement("log \"Total: {order.total} due\"");
        var interpolated = assertInstanceOf(Expression.InterpolatedString.class, log.message());
        assertEquals(3, interpolated.parts().size());
        assertEquals(new Expression.InterpolatedString.TextPart("Total: "), interpolated.parts().get(0));
    }

    @Test
    void completeWithoutOutputs() {
        var complete = (Statement.CompleteStatement) onlyStatement("complete");
        assertTrue(complete.outputs().isEmpty());
    }

    @Test
    void reportsUnknownServiceKind() {
        var result = Parser.parse(FlowTestSupport.source(
            "services:",
            "    Store is a database \"pg\""
        ), "test.flow");

        assertEquals("Expected \"plugin\" or \"webhook\" after \"is a\", but found \"database\".",
            result.errors().get(0).message());
        assertFalse(result.errors().get(0).hint().isEmpty());
    }

    @Test
    void reportsOtherwiseWithoutIf() {
        var result = Parser.parse(FlowTestSupport.source(
            "workflow:",
            "    otherwise:",
            "        log 1"
        ), "test.flow");

        assertEquals("I found \"otherwise\" without an \"if\" before it.", result.errors().get(0).message());
    }

    private static Statement onlyStatement(String first, String... rest) {
        var lines = new String[rest.length + 2];
        lines[0] = "workflow:";
        lines[1] = "    " + first;
        System.arraycopy(rest, 0, lines, 2, rest.length);
        var program = FlowTestSupport.parse(FlowTestSupport.source(lines));
        return FlowTestSupport.only(program.workflow().orElseThrow().body());
    }
}
