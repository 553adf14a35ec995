package legalis.dsl.transforms;

import legalis.dsl.ast.Document;
import legalis.dsl.ast.Statute;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Lowercases statute ids and replaces spaces and underscores with hyphens.
///
/// `requires` and `supersedes` entries that name a statute of the document are rewritten with
/// the same mapping; entries naming no statute are left as they are.
public final class NormalizeIds implements DocumentTransform {

    @Override
    public Document transform(Document document) {
        final Map<String, String> mapping = new HashMap<>();
        for (final Statute statute : document.statutes()) {
            mapping.put(statute.id(), normalize(statute.id()));
        }

        final List<Statute> normalized = new ArrayList<>(document.statutes().size());
        for (final Statute statute : document.statutes()) {
            normalized.add(statute
                    .withId(mapping.get(statute.id()))
                    .withRequires(remap(statute.requires(), mapping))
                    .withSupersedes(remap(statute.supersedes(), mapping)));
        }
        return document.withStatutes(normalized);
    }

    @Override
    public String description() {
        return "Normalize statute IDs to lowercase with hyphens";
    }

    static String normalize(String id) {
        return id.toLowerCase(Locale.ROOT).replace(' ', '-').replace('_', '-');
    }

    private static List<String> remap(List<String> ids, Map<String, String> mapping) {
        return ids.stream().map(id -> mapping.getOrDefault(id, id)).toList();
    }
}
