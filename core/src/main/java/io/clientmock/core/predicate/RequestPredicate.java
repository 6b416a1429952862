package io.clientmock.core.predicate;

import io.clientmock.core.model.RequestDescriptor;

/**
 * A boolean test over a {@link RequestDescriptor} that can also describe itself.
 *
 * <p>Predicates are values rather than opaque closures: a conjunction is a {@link Conjunction}
 * node whose operands can be inspected, displayed or re-evaluated. Mocking back ends that need
 * their own matcher type compile a predicate into it (see the Mockito adapter's
 * {@code RequestMatchers}); back ends that accept plain functions call {@link #test} directly.
 */
public interface RequestPredicate {

    /**
     * Evaluates the predicate.
     *
     * @param request the simulated request, never null
     * @return {@code true} if the request satisfies the predicate
     */
    boolean test(RequestDescriptor request);

    /** Human-readable form, e.g. {@code (method == GET AND pathParameter[fundId] == "abc")}. */
    String describe();

    /**
     * Conjunction of this predicate and {@code other}, evaluated left to right.
     *
     * @param other the right-hand operand
     * @return a {@link Conjunction} node
     */
    default RequestPredicate and(RequestPredicate other) {
        return RequestPredicates.and(this, other);
    }
}
