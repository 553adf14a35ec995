package legalis.dsl.transforms;

import java.util.Objects;

/// Ready-made pipelines for common jobs.
public final class Presets {

    private Presets() {
        // Static utility class
    }

    /// Deduplicate, remove empty statutes, normalize ids.
    public static TransformPipeline cleanup() {
        return TransformPipeline.empty()
                .add(new DeduplicateStatutes())
                .add(new RemoveEmptyStatutes())
                .add(new NormalizeIds());
    }

    /// Simplify conditions, remove empty statutes.
    public static TransformPipeline optimization() {
        return TransformPipeline.empty()
                .add(new SimplifyConditions())
                .add(new RemoveEmptyStatutes());
    }

    /// Normalize ids, sort by dependencies.
    public static TransformPipeline normalization() {
        return TransformPipeline.empty()
                .add(new NormalizeIds())
                .add(new SortByDependencies());
    }

    /// Cleanup, optimization and normalization combined.
    public static TransformPipeline full() {
        return TransformPipeline.empty()
                .add(new DeduplicateStatutes())
                .add(new SimplifyConditions())
                .add(new RemoveEmptyStatutes())
                .add(new NormalizeIds())
                .add(new SortByDependencies());
    }

    /// Deduplicate, simplify conditions.
    public static TransformPipeline quickFix() {
        return TransformPipeline.empty()
                .add(new DeduplicateStatutes())
                .add(new SimplifyConditions());
    }

    /// Looks a preset up by name: `cleanup`, `optimization`, `normalization`, `full` or
    /// `quick-fix`.
    /// @throws IllegalArgumentException for any other name
    public static TransformPipeline byName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return switch (name) {
            case "cleanup" -> cleanup();
            case "optimization" -> optimization();
            case "normalization" -> normalization();
            case "full" -> full();
            case "quick-fix" -> quickFix();
            default -> throw new IllegalArgumentException("Unknown preset: " + name);
        };
    }
}
