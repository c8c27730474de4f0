package com.pypeek.core.walker;

import java.util.ArrayList;
import java.util.List;

/**
 * The branch predicates enclosing the statement currently being walked, outermost first.
 *
 * <p>Every {@link #push(String)} or {@link #pushNegated(String)} must be matched by a
 * {@link #pop()} once the branch has been walked. Snapshots are copies and do not change when
 * the stack does.
 */
public final class ConditionStack {

    /** Stands in for a predicate whose source text could not be recovered. */
    public static final String UNKNOWN = "<unknown>";

    private final List<String> conditions = new ArrayList<>();

    /**
     * Enters the branch taken when {@code condition} holds.
     *
     * @param condition predicate source text, or {@code null} if unknown
     */
    public void push(String condition) {
        conditions.add(orUnknown(condition));
    }

    /**
     * Enters the branch taken when {@code condition} does not hold.
     *
     * @param condition predicate source text, or {@code null} if unknown
     */
    public void pushNegated(String condition) {
        conditions.add(negate(orUnknown(condition)));
    }

    /**
     * Leaves the innermost branch.
     *
     * @return the removed entry
     * @throws IllegalStateException if the stack is empty
     */
    public String pop() {
        if (conditions.isEmpty()) {
            throw new IllegalStateException("pop on empty condition stack");
        }
        return conditions.remove(conditions.size() - 1);
    }

    public List<String> snapshot() {
        return List.copyOf(conditions);
    }

    public int depth() {
        return conditions.size();
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    static String negate(String condition) {
        return "not (" + condition + ")";
    }

    private static String orUnknown(String condition) {
        return condition == null || condition.isBlank() ? UNKNOWN : condition.strip();
    }
}
