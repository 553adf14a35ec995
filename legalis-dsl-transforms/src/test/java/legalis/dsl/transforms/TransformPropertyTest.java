package legalis.dsl.transforms;

import legalis.dsl.ast.Condition;
import legalis.dsl.ast.Document;
import legalis.dsl.ast.Effect;
import legalis.dsl.ast.Statute;
import net.jqwik.api.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/// Property-based checks of the built-in transforms and the undo/redo history.
class TransformPropertyTest extends TransformsLoggingConfig {

    private static final Logger LOG = Logger.getLogger(TransformPropertyTest.class.getName());

    private static final List<String> IDS = List.of("Rule_A", "rule a", "Rule_B", "tax-credit", "X", "Old Law");

    @Provide
    Arbitrary<Document> documents() {
        final Arbitrary<Statute> statute = Combinators.combine(
                        Arbitraries.of(IDS),
                        Arbitraries.of(IDS).list().ofMaxSize(2),
                        Arbitraries.of(IDS).list().ofMaxSize(1),
                        Arbitraries.of(true, false))
                .as((id, requires, supersedes, withEffect) -> {
                    final var base = Statute.of(id, "Title of " + id)
                            .withRequires(requires)
                            .withSupersedes(supersedes)
                            .withConditions(List.of(Condition.not(Condition.not(Condition.has("citizen")))));
                    return withEffect ? base.withEffects(List.of(new Effect("grant", "ok"))) : base;
                });
        return statute.list().ofMaxSize(6).map(Document::of);
    }

    /// Documents whose `requires` graph is acyclic: statute `s<i>` only requires `s<j>` for
    /// `j > i`. Statutes are emitted in reverse so sorting has to move them.
    @Provide
    Arbitrary<Document> acyclicDocuments() {
        return Arbitraries.integers().between(0, 7).flatMap(n ->
                Arbitraries.integers().between(0, Math.max(0, n - 1)).list().ofSize(n).map(picks -> {
                    final List<Statute> statutes = new ArrayList<>();
                    for (int i = n - 1; i >= 0; i--) {
                        final List<String> requires = new ArrayList<>();
                        if (picks.get(i) > i) {
                            requires.add("s" + picks.get(i));
                        }
                        statutes.add(Statute.of("s" + i, "S" + i).withRequires(requires));
                    }
                    return Document.of(statutes);
                }));
    }

    @Provide
    Arbitrary<List<DocumentTransform>> transformSequences() {
        return Arbitraries.<DocumentTransform>of(
                        new DeduplicateStatutes(),
                        new SimplifyConditions(),
                        new RemoveEmptyStatutes(),
                        new NormalizeIds(),
                        new OptimizeStatutes(),
                        Presets.quickFix())
                .list().ofMinSize(1).ofMaxSize(5);
    }

    @Property
    void normalizationPreservesReferences(@ForAll("documents") Document document) {
        LOG.finer(() -> "Executing normalizationPreservesReferences");
        final Set<String> known = document.statutes().stream().map(Statute::id).collect(Collectors.toSet());

        final var result = new NormalizeIds().transform(document);

        assertThat(result.statutes()).hasSameSizeAs(document.statutes());
        for (int i = 0; i < document.statutes().size(); i++) {
            final var before = document.statutes().get(i);
            final var after = result.statutes().get(i);
            assertThat(after.id()).isEqualTo(NormalizeIds.normalize(before.id()));
            assertThat(after.requires()).containsExactlyElementsOf(before.requires().stream()
                    .map(r -> known.contains(r) ? NormalizeIds.normalize(r) : r)
                    .toList());
            assertThat(after.supersedes()).containsExactlyElementsOf(before.supersedes().stream()
                    .map(r -> known.contains(r) ? NormalizeIds.normalize(r) : r)
                    .toList());
        }
    }

    @Property
    void sortingYieldsTopologicalOrderOrReportsCycle(@ForAll("documents") Document document) {
        LOG.finer(() -> "Executing sortingYieldsTopologicalOrderOrReportsCycle");
        final Document sorted;
        try {
            sorted = new SortByDependencies().transform(document);
        } catch (TransformException ex) {
            assertThat(ex.kind()).isEqualTo(TransformException.Kind.CIRCULAR_DEPENDENCY);
            return;
        }

        assertThat(sorted.statutes()).containsExactlyInAnyOrderElementsOf(document.statutes());

        final Map<String, List<Integer>> positions = new HashMap<>();
        IntStream.range(0, sorted.statutes().size())
                .forEach(i -> positions.computeIfAbsent(sorted.statutes().get(i).id(), k -> new ArrayList<>()).add(i));
        for (int i = 0; i < sorted.statutes().size(); i++) {
            for (final String required : sorted.statutes().get(i).requires()) {
                for (final int position : positions.getOrDefault(required, List.of())) {
                    assertThat(position).isGreaterThan(i);
                }
            }
        }
    }

    @Property
    void acyclicDocumentsAlwaysSort(@ForAll("acyclicDocuments") Document document) {
        LOG.finer(() -> "Executing acyclicDocumentsAlwaysSort");

        final var sorted = new SortByDependencies().transform(document);

        assertThat(sorted.statutes()).hasSameSizeAs(document.statutes());
    }

    @Property
    void undoThenRedoRestoresEverySnapshot(
            @ForAll("documents") Document document,
            @ForAll("transformSequences") List<DocumentTransform> transforms) {
        LOG.finer(() -> "Executing undoThenRedoRestoresEverySnapshot");
        final var history = new TransformHistory(document);
        final List<Document> forward = new ArrayList<>();
        forward.add(document);
        for (final DocumentTransform transform : transforms) {
            forward.add(history.apply(transform));
        }

        for (int i = forward.size() - 2; i >= 0; i--) {
            assertThat(history.undo()).contains(forward.get(i));
        }
        assertThat(history.canUndo()).isFalse();

        for (int i = 1; i < forward.size(); i++) {
            assertThat(history.redo()).contains(forward.get(i));
        }
        assertThat(history.canRedo()).isFalse();
        assertThat(history.current()).isEqualTo(forward.get(forward.size() - 1));
    }
}
