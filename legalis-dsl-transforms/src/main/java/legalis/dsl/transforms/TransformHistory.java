package legalis.dsl.transforms;

import legalis.dsl.ast.Document;
import legalis.dsl.ast.DslPrinter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Linear undo/redo log of whole-document snapshots.
///
/// Index 0 holds the initial document. Applying a transform discards every snapshot after the
/// current one before appending the result, so the log never branches.
///
/// Not thread-safe; use one history per editing session.
public final class TransformHistory {

    private static final Logger LOG = Logger.getLogger(TransformHistory.class.getName());

    private final List<Document> snapshots = new ArrayList<>();
    private int currentIndex;

    public TransformHistory(Document initial) {
        Objects.requireNonNull(initial, "initial must not be null");
        snapshots.add(initial);
        currentIndex = 0;
    }

    /// Transforms the current snapshot and makes the result current.
    ///
    /// If the transform throws, the history is left unchanged.
    /// @param transform the transform to apply
    /// @return the new current document
    public Document apply(DocumentTransform transform) {
        Objects.requireNonNull(transform, "transform must not be null");
        final Document transformed = transform.transform(current());

        final int discarded = snapshots.size() - currentIndex - 1;
        if (discarded > 0) {
            LOG.finer(() -> "Discarding " + discarded + " redo snapshot(s)");
        }
        snapshots.subList(currentIndex + 1, snapshots.size()).clear();
        snapshots.add(transformed);
        currentIndex++;

        LOG.fine(() -> "Applied '" + transform.description() + "', history index " + currentIndex);
        LOG.finest(() -> "Current document:\n" + DslPrinter.formatDocument(transformed));
        return transformed;
    }

    /// Steps back one snapshot.
    /// @return the document now current, or empty if already at the initial document
    public Optional<Document> undo() {
        if (!canUndo()) {
            return Optional.empty();
        }
        currentIndex--;
        LOG.fine(() -> "Undo to history index " + currentIndex);
        return Optional.of(current());
    }

    /// Steps forward one snapshot.
    /// @return the document now current, or empty if already at the newest snapshot
    public Optional<Document> redo() {
        if (!canRedo()) {
            return Optional.empty();
        }
        currentIndex++;
        LOG.fine(() -> "Redo to history index " + currentIndex);
        return Optional.of(current());
    }

    public Document current() {
        return snapshots.get(currentIndex);
    }

    public boolean canUndo() {
        return currentIndex > 0;
    }

    public boolean canRedo() {
        return currentIndex < snapshots.size() - 1;
    }

    public int currentIndex() {
        return currentIndex;
    }

    /// Number of snapshots held, the initial document included, so never less than one.
    public int size() {
        return snapshots.size();
    }
}
