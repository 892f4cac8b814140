package org.ashby.plot.api;

import org.ashby.plot.api.data.FieldValue;

/**
 * Thrown by a join predicate when the kinds of its two operands cannot be combined.
 */
public class IncompatibleOperandsException extends DataAccessException {

    private final FieldValue.Kind leftKind;
    private final FieldValue.Kind rightKind;

    public IncompatibleOperandsException(String operation, FieldValue.Kind leftKind, FieldValue.Kind rightKind) {
        super(String.format("cannot calculate %s of %s and %s", operation, leftKind, rightKind));
        this.leftKind = leftKind;
        this.rightKind = rightKind;
    }

    public FieldValue.Kind getLeftKind() {
        return leftKind;
    }

    public FieldValue.Kind getRightKind() {
        return rightKind;
    }
}
