package io.matchscan.model;

/**
 * Thrown when the front end hands the analyzer input that breaks its contract.
 * <p>
 * Unlike an unanalyzable branch or an unbounded domain (which are ordinary
 * "not proven exhaustive" answers), a contract violation means no analysis is
 * attempted at all.
 */
public class ContractViolationException extends RuntimeException {

    public enum Kind {
        /** A reference is mentioned but has no resolved type. */
        UNRESOLVED_REFERENCE,
        /** A derived reference is used before its base is known. */
        ORDERING_CONFLICT,
        /** A declared type is malformed for the reference it is attached to. */
        INVALID_TYPE
    }

    private final Kind kind;
    private final Reference reference;

    public ContractViolationException(Kind kind, Reference reference, String message) {
        super(message);
        this.kind = kind;
        this.reference = reference;
    }

    public Kind kind() {
        return kind;
    }

    public Reference reference() {
        return reference;
    }
}
