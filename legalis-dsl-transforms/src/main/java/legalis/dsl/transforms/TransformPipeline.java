package legalis.dsl.transforms;

import legalis.dsl.ast.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// An ordered chain of [DocumentTransform]s.
///
/// Usage:
/// ```java
/// TransformPipeline pipeline = TransformPipeline.empty()
///     .add(new DeduplicateStatutes())
///     .add(new RemoveEmptyStatutes());
/// Document result = pipeline.apply(document);
/// ```
///
/// Application is fail-fast: the first member to throw aborts the run and the exception
/// propagates, so callers see either the fully transformed document or that error.
///
/// Pipelines are immutable; [#add] returns a new pipeline. A pipeline is itself a
/// [DocumentTransform] and can be nested or recorded in a [TransformHistory].
public final class TransformPipeline implements DocumentTransform {

    private static final Logger LOG = Logger.getLogger(TransformPipeline.class.getName());

    private final List<DocumentTransform> transforms;

    private TransformPipeline(List<DocumentTransform> transforms) {
        this.transforms = List.copyOf(transforms);
    }

    /// Creates a pipeline with no members; applying it returns its input.
    public static TransformPipeline empty() {
        return new TransformPipeline(List.of());
    }

    /// Returns a new pipeline with `transform` appended.
    public TransformPipeline add(DocumentTransform transform) {
        Objects.requireNonNull(transform, "transform must not be null");
        final List<DocumentTransform> extended = new ArrayList<>(transforms);
        extended.add(transform);
        return new TransformPipeline(extended);
    }

    /// Applies every member in order.
    /// @param document the input document
    /// @return the fully transformed document
    /// @throws TransformException from the first member that fails
    public Document apply(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        var result = document;
        for (final DocumentTransform transform : transforms) {
            LOG.fine(() -> "Applying transform: " + transform.description());
            result = transform.transform(result);
        }
        return result;
    }

    /// Runs every member's `validate` against `document`, then [#apply]. Validation sees only
    /// the original document, and nothing is applied unless every member accepts it.
    public Document applyValidated(Document document) {
        validate(document);
        return apply(document);
    }

    /// Runs every member's `validate` against the same document.
    @Override
    public void validate(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        for (final DocumentTransform transform : transforms) {
            transform.validate(document);
        }
    }

    @Override
    public Document transform(Document document) {
        return apply(document);
    }

    /// Member descriptions in pipeline order.
    public List<String> describe() {
        return transforms.stream().map(DocumentTransform::description).toList();
    }

    @Override
    public String description() {
        return "Pipeline" + describe();
    }

    /// True only if every member is reversible.
    @Override
    public boolean isReversible() {
        return transforms.stream().allMatch(DocumentTransform::isReversible);
    }

    /// Reverses every member, last first.
    @Override
    public Document reverse(Document document) {
        if (!isReversible()) {
            return DocumentTransform.super.reverse(document);
        }
        var result = document;
        for (int i = transforms.size() - 1; i >= 0; i--) {
            result = transforms.get(i).reverse(result);
        }
        return result;
    }

    public int size() {
        return transforms.size();
    }

    @Override
    public String toString() {
        return "TransformPipeline[transforms=" + transforms.size() + "]";
    }
}
