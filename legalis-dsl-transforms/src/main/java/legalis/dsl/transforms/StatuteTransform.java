package legalis.dsl.transforms;

import legalis.dsl.ast.Document;
import legalis.dsl.ast.Statute;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// A rewrite of a single statute.
public interface StatuteTransform {

    Statute transform(Statute statute);

    String description();

    /// Lifts a statute transform to a document transform applied to every statute in order.
    static DocumentTransform forEachStatute(StatuteTransform transform) {
        Objects.requireNonNull(transform, "transform must not be null");
        return new DocumentTransform() {
            @Override
            public Document transform(Document document) {
                final List<Statute> rewritten = new ArrayList<>(document.statutes().size());
                for (final Statute statute : document.statutes()) {
                    rewritten.add(transform.transform(statute));
                }
                return document.withStatutes(rewritten);
            }

            @Override
            public String description() {
                return transform.description();
            }
        };
    }
}
