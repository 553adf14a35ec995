package legalis.dsl.transforms;

import legalis.dsl.ast.Document;
import legalis.dsl.ast.Statute;

import java.util.List;
import java.util.logging.Logger;

/// Drops statutes that have neither an effect nor a discretion clause.
public final class RemoveEmptyStatutes implements DocumentTransform {

    private static final Logger LOG = Logger.getLogger(RemoveEmptyStatutes.class.getName());

    @Override
    public Document transform(Document document) {
        final List<Statute> kept = document.statutes().stream()
                .filter(s -> !s.effects().isEmpty() || s.hasDiscretion())
                .toList();
        final int removed = document.statutes().size() - kept.size();
        if (removed > 0) {
            LOG.finer(() -> "Removed " + removed + " empty statute(s)");
        }
        return document.withStatutes(kept);
    }

    @Override
    public String description() {
        return "Remove statutes with no effects";
    }
}
