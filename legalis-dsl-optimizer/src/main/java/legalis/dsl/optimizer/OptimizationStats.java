package legalis.dsl.optimizer;

/// Snapshot of the counters an [Optimizer] has accumulated since creation or its last reset.
///
/// @param hoistedConditions invariant conditions moved to the front
/// @param eliminatedSubexpressions duplicate conditions removed
/// @param removedDeadConditions always-false conditions removed
/// @param reorderedConditions conditions passed through the reordering sort
/// @param foldedConstants simplifications applied by constant folding
public record OptimizationStats(
        int hoistedConditions,
        int eliminatedSubexpressions,
        int removedDeadConditions,
        int reorderedConditions,
        int foldedConstants
) {
    public static final OptimizationStats EMPTY = new OptimizationStats(0, 0, 0, 0, 0);

    /// Sum of all counters.
    public int total() {
        return hoistedConditions + eliminatedSubexpressions + removedDeadConditions
                + reorderedConditions + foldedConstants;
    }

    String summary() {
        return "hoisted=" + hoistedConditions
                + " cse=" + eliminatedSubexpressions
                + " dead=" + removedDeadConditions
                + " reordered=" + reorderedConditions
                + " folded=" + foldedConstants;
    }
}
