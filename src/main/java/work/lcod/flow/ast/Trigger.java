package work.lcod.flow.ast;

public record Trigger(String description, SourceLocation location) {}
