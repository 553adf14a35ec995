package legalis.dsl.transforms;

import legalis.dsl.ast.Condition;
import legalis.dsl.ast.Document;
import legalis.dsl.ast.Effect;
import legalis.dsl.ast.Statute;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PresetsTest extends TransformsLoggingConfig {

    private static final Logger LOG = Logger.getLogger(PresetsTest.class.getName());

    private static final Effect GRANT = new Effect("grant", "ok");

    @Test
    void cleanupDeduplicatesDropsEmptyAndNormalizes() {
        LOG.info(() -> "TEST: cleanupDeduplicatesDropsEmptyAndNormalizes");
        final var doc = Document.of(
                Statute.of("A", "first").withEffects(List.of(GRANT)),
                Statute.of("A", "second").withEffects(List.of(GRANT)),
                Statute.of("Empty", "nothing"));

        final var result = Presets.cleanup().apply(doc);

        assertThat(result.statutes()).extracting(Statute::id).containsExactly("a");
        assertThat(result.statutes().get(0).title()).isEqualTo("first");
    }

    @Test
    void fullRunsEveryStep() {
        LOG.info(() -> "TEST: fullRunsEveryStep");
        final var condition = Condition.not(Condition.not(Condition.has("citizen")));
        final var doc = Document.of(
                Statute.of("Base_Rule", "base").withEffects(List.of(GRANT)),
                Statute.of("My Statute", "mine")
                        .withEffects(List.of(GRANT))
                        .withConditions(List.of(condition))
                        .withRequires(List.of("Base_Rule")),
                Statute.of("My Statute", "duplicate"),
                Statute.of("Unused", "no effects"));

        final var result = Presets.full().apply(doc);

        assertThat(result.statutes()).extracting(Statute::id).containsExactly("my-statute", "base-rule");
        assertThat(result.statutes().get(0).conditions()).containsExactly(Condition.has("citizen"));
        assertThat(result.statutes().get(0).requires()).containsExactly("base-rule");
    }

    @Test
    void quickFixKeepsEmptyStatutes() {
        LOG.info(() -> "TEST: quickFixKeepsEmptyStatutes");
        final var doc = Document.of(Statute.of("x", "x"), Statute.of("x", "again"));

        assertThat(Presets.quickFix().apply(doc).statutes()).hasSize(1);
    }

    @Test
    void presetCompositions() {
        LOG.info(() -> "TEST: presetCompositions");

        assertThat(Presets.cleanup().size()).isEqualTo(3);
        assertThat(Presets.optimization().size()).isEqualTo(2);
        assertThat(Presets.normalization().size()).isEqualTo(2);
        assertThat(Presets.full().size()).isEqualTo(5);
        assertThat(Presets.quickFix().size()).isEqualTo(2);
    }

    @Test
    void byNameResolvesEveryPreset() {
        LOG.info(() -> "TEST: byNameResolvesEveryPreset");

        assertThat(Presets.byName("cleanup").describe()).isEqualTo(Presets.cleanup().describe());
        assertThat(Presets.byName("optimization").describe()).isEqualTo(Presets.optimization().describe());
        assertThat(Presets.byName("normalization").describe()).isEqualTo(Presets.normalization().describe());
        assertThat(Presets.byName("full").describe()).isEqualTo(Presets.full().describe());
        assertThat(Presets.byName("quick-fix").describe()).isEqualTo(Presets.quickFix().describe());
    }

    @Test
    void byNameRejectsUnknownPreset() {
        LOG.info(() -> "TEST: byNameRejectsUnknownPreset");

        assertThatThrownBy(() -> Presets.byName("turbo"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown preset: turbo");
    }
}
