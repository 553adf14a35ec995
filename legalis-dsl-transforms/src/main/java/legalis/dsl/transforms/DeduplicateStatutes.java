package legalis.dsl.transforms;

import legalis.dsl.ast.Document;
import legalis.dsl.ast.Statute;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/// Keeps the first statute for every id and drops later ones with the same id.
public final class DeduplicateStatutes implements DocumentTransform {

    private static final Logger LOG = Logger.getLogger(DeduplicateStatutes.class.getName());

    @Override
    public Document transform(Document document) {
        final Set<String> seen = new HashSet<>();
        final List<Statute> deduplicated = new ArrayList<>();

        for (final Statute statute : document.statutes()) {
            if (seen.add(statute.id())) {
                deduplicated.add(statute);
            } else {
                LOG.finer(() -> "Dropping duplicate statute " + statute.id());
            }
        }
        return document.withStatutes(deduplicated);
    }

    @Override
    public String description() {
        return "Remove duplicate statutes with the same ID";
    }
}
