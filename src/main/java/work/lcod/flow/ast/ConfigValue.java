package work.lcod.flow.ast;

/**
 * Right-hand side of a config entry: quoted text, bare words (such as {@code 5 minutes}) or a number.
 */
public sealed interface ConfigValue {
    record Text(String value, boolean quoted) implements ConfigValue {}

    record Numeric(double value) implements ConfigValue {}
}
