package work.lcod.flow.connectors;

import java.util.Locale;
import java.util.Set;

/**
 * Maps the verb of a service call to an HTTP method.
 */
public final class HttpMethods {
    private static final Set<String> GET_VERBS = Set.of("get", "fetch", "retrieve", "check", "pull", "list", "find", "search");
    private static final Set<String> POST_VERBS =
        Set.of("create", "send", "submit", "add", "post", "charge", "notify", "record", "verify");
    private static final Set<String> PUT_VERBS = Set.of("update", "modify", "change", "edit");
    private static final Set<String> DELETE_VERBS = Set.of("delete", "remove", "cancel");

    private HttpMethods() {}

    public static String infer(String verb) {
        String lower = verb.toLowerCase(Locale.ROOT);
        if (GET_VERBS.contains(lower)) {
            return "GET";
        }
        if (POST_VERBS.contains(lower)) {
            return "POST";
        }
        if (PUT_VERBS.contains(lower)) {
            return "PUT";
        }
        if (DELETE_VERBS.contains(lower)) {
            return "DELETE";
        }
        return "POST";
    }

    /** GET and DELETE send their parameters in the query string. */
    static boolean usesQueryString(String method) {
        return "GET".equals(method) || "DELETE".equals(method);
    }
}
