package org.ashby.plot.compute;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.ashby.plot.api.DataAccessException;
import org.ashby.plot.api.IncompatibleOperandsException;
import org.ashby.plot.api.data.FieldValue;

/**
 * Registry of join predicates by function name.
 * <p>
 * New predicates are added with {@link #register(String, IJoinPredicate)}; the join algorithm in
 * {@link DataSetDeriver} is unaware of which predicates exist.
 */
public class JoinPredicates {

    /** Name of the numeric difference predicate: left minus right. */
    public static final String DIFF = "diff";

    private final Map<String, IJoinPredicate> predicates = new ConcurrentHashMap<>();

    /**
     * Creates a registry holding the standard predicates.
     *
     * @return a new registry
     */
    public static JoinPredicates standard() {
        JoinPredicates registry = new JoinPredicates();
        registry.register(DIFF, JoinPredicates::diff);
        return registry;
    }

    public JoinPredicates register(String name, IJoinPredicate predicate) {
        predicates.put(name, predicate);
        return this;
    }

    /**
     * Looks up a predicate.
     *
     * @param name function name from a computed dataset definition
     * @return the predicate, or null if unknown or {@code name} is null
     */
    public IJoinPredicate get(String name) {
        return name == null ? null : predicates.get(name);
    }

    public Set<String> getNames() {
        return Set.copyOf(predicates.keySet());
    }

    /**
     * Numeric subtraction {@code left - right}.
     * <p>
     * Two integers produce an integer; any float operand widens the result to float.
     *
     * @param left  minuend
     * @param right subtrahend
     * @return the difference
     * @throws IncompatibleOperandsException if either operand is not numeric
     * @throws DataAccessException           if an integer difference does not fit in 64 bits
     */
    static FieldValue diff(FieldValue left, FieldValue right) throws DataAccessException {
        if (!left.isNumeric() || !right.isNumeric()) {
            throw new IncompatibleOperandsException(DIFF, left.getKind(), right.getKind());
        }
        if (left.getKind() == FieldValue.Kind.INTEGER && right.getKind() == FieldValue.Kind.INTEGER) {
            try {
                return FieldValue.of(Math.subtractExact(left.asLong(), right.asLong()));
            } catch (ArithmeticException e) {
                throw new DataAccessException(String.format("cannot calculate %s of %d and %d: integer overflow",
                    DIFF, left.asLong(), right.asLong()), e);
            }
        }
        return FieldValue.of(left.toDouble() - right.toDouble());
    }
}
