package io.clientmock.core.engine;

import io.clientmock.core.model.Expectation;
import io.clientmock.core.model.MatchResult;

/**
 * One line of {@link StubEngine#explain}: an expectation and how it fared against a request.
 *
 * @param expectation the registered expectation
 * @param result      whether it matched, and why not
 */
public record MatchReport(Expectation expectation, MatchResult result) {

    @Override
    public String toString() {
        return expectation.describe() + " -> " + (result.matched() ? "matched" : result.reason());
    }
}
