package legalis.dsl.transforms;

import legalis.dsl.ast.Document;

/// A rewrite of a whole [Document].
///
/// Implementations must not modify their input; they return a new document. A transform only
/// throws [TransformException] for genuine domain violations, such as a dependency cycle.
public interface DocumentTransform {

    /// Applies the transformation.
    /// @param document the input document
    /// @return the transformed document
    /// @throws TransformException if the document cannot be transformed
    Document transform(Document document);

    /// Short human-readable summary of what this transformation does.
    String description();

    /// Whether [#reverse] is supported. Implementations overriding one must override both.
    default boolean isReversible() {
        return false;
    }

    /// Undoes this transformation.
    /// @throws TransformException of kind `NOT_REVERSIBLE` unless overridden
    default Document reverse(Document document) {
        throw new TransformException(TransformException.Kind.NOT_REVERSIBLE,
                "Transformation '" + description() + "' is not reversible");
    }

    /// Checks that the transformation can be safely applied. Accepts everything by default.
    /// @throws TransformException if the document is rejected
    default void validate(Document document) {
    }
}
