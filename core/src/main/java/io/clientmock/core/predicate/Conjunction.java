package io.clientmock.core.predicate;

import io.clientmock.core.model.RequestDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Logical AND of several predicates, evaluated in order with short-circuit.
 *
 * <p>Nested conjunctions are flattened on construction, so {@code and(and(a, b), c)} and
 * {@code and(a, and(b, c))} produce the same node.
 *
 * @param operands the predicates, in evaluation order
 */
public record Conjunction(List<RequestPredicate> operands) implements RequestPredicate {

    public Conjunction {
        List<RequestPredicate> flat = new ArrayList<>();
        for (RequestPredicate operand : operands) {
            if (operand instanceof Conjunction nested) {
                flat.addAll(nested.operands());
            } else {
                flat.add(operand);
            }
        }
        operands = List.copyOf(flat);
    }

    @Override
    public boolean test(RequestDescriptor request) {
        for (RequestPredicate operand : operands) {
            if (!operand.test(request)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String describe() {
        return operands.stream().map(RequestPredicate::describe).collect(Collectors.joining(" AND ", "(", ")"));
    }

    @Override
    public String toString() {
        return describe();
    }
}
