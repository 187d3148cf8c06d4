package work.lcod.flow.diagnostics;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * "Did you mean" helpers based on case-insensitive edit distance.
 */
public final class Suggestions {
    private Suggestions() {}

    public static int distance(String a, String b) {
        String left = a.toLowerCase(Locale.ROOT);
        String right = b.toLowerCase(Locale.ROOT);
        int[] previous = new int[right.length() + 1];
        int[] current = new int[right.length() + 1];
        for (int j = 0; j <= right.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= left.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= right.length(); j++) {
                int cost = left.charAt(i - 1) == right.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                    Math.min(previous[j] + 1, current[j - 1] + 1),
                    previous[j - 1] + cost
                );
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[right.length()];
    }

    /** Largest distance still worth suggesting for a name of the given length. */
    public static int threshold(String target) {
        return Math.max(3, (int) Math.floor(target.length() * 0.6));
    }

    public static Optional<String> closestMatch(String target, Collection<String> candidates) {
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            int candidateDistance = distance(target, candidate);
            if (candidateDistance < bestDistance) {
                bestDistance = candidateDistance;
                best = candidate;
            }
        }
        if (best != null && bestDistance <= threshold(target)) {
            return Optional.of(best);
        }
        return Optional.empty();
    }
}
