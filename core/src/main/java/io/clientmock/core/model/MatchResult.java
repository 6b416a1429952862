package io.clientmock.core.model;

/**
 * Result of testing one expectation against one request.
 *
 * @param matched whether every check passed
 * @param reason  why the expectation was rejected; {@code null} when matched
 */
public record MatchResult(boolean matched, String reason) {

    private static final MatchResult MATCHED = new MatchResult(true, null);

    public static MatchResult success() {
        return MATCHED;
    }

    public static MatchResult mismatch(String reason) {
        return new MatchResult(false, reason);
    }
}
