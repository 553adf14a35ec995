package legalis.dsl.transforms;

import legalis.dsl.ast.Document;
import legalis.dsl.optimizer.Optimizer;

import java.util.Objects;

/// Runs an [Optimizer] as a pipeline step, so an optimization can be recorded in a
/// [TransformHistory] and undone.
public final class OptimizeStatutes implements DocumentTransform {

    private final Optimizer optimizer;

    public OptimizeStatutes() {
        this(new Optimizer());
    }

    public OptimizeStatutes(Optimizer optimizer) {
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer must not be null");
    }

    /// The wrapped optimizer, whose statistics accumulate across applications.
    public Optimizer optimizer() {
        return optimizer;
    }

    @Override
    public Document transform(Document document) {
        return optimizer.optimize(document);
    }

    @Override
    public String description() {
        return "Optimize conditions (hoist, eliminate duplicates and dead code, reorder, fold)";
    }
}
