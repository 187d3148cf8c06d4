package work.lcod.flow.ast;

/**
 * Kinds of service a Flow file can declare, with the phrase that introduces each target.
 */
public enum ServiceKind {
    API("an API at"),
    AI("an AI using"),
    PLUGIN("a plugin"),
    WEBHOOK("a webhook at");

    private final String phrase;

    ServiceKind(String phrase) {
        this.phrase = phrase;
    }

    public String phrase() {
        return phrase;
    }

    public boolean supportsHeaders() {
        return this == API || this == WEBHOOK;
    }
}
