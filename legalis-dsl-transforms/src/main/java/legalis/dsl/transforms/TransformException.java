package legalis.dsl.transforms;

import java.util.Objects;

/// Exception thrown when a transform cannot be applied, reversed or validated.
///
/// Callers should branch on [#kind()] rather than on the message text.
public final class TransformException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final Kind kind;

    public TransformException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public TransformException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public Kind kind() {
        return kind;
    }

    public enum Kind {
        /// `reverse` was called on a transform that does not support it.
        NOT_REVERSIBLE,
        /// The `requires` graph has no topological order.
        CIRCULAR_DEPENDENCY,
        /// A transform refused the document before anything was applied.
        VALIDATION_FAILED
    }
}
