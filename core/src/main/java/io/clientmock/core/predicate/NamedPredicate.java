package io.clientmock.core.predicate;

import io.clientmock.core.model.RequestDescriptor;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Leaf predicate: a plain function paired with its description.
 *
 * @param description shown by {@link #describe()}
 * @param condition   the function evaluated by {@link #test}
 */
public record NamedPredicate(String description, Predicate<RequestDescriptor> condition)
        implements RequestPredicate {

    public NamedPredicate {
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
    }

    @Override
    public boolean test(RequestDescriptor request) {
        return condition.test(request);
    }

    @Override
    public String describe() {
        return description;
    }

    @Override
    public String toString() {
        return description;
    }
}
