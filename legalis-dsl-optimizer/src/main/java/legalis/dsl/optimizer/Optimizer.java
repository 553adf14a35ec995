package legalis.dsl.optimizer;

import legalis.dsl.ast.Condition;
import legalis.dsl.ast.ConditionValue;
import legalis.dsl.ast.Document;
import legalis.dsl.ast.DslPrinter;
import legalis.dsl.ast.Statute;
import legalis.dsl.ast.TemporalField;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Rewrites the condition lists of every statute in a document.
///
/// [#optimize] runs five passes in a fixed order:
/// 1. **Hoisting** moves invariant conditions (static metadata checks) to the front.
/// 2. **Common-subexpression elimination** drops conditions that repeat an earlier one.
/// 3. **Dead-code elimination** drops conditions that can never hold.
/// 4. **Reordering** sorts conditions by estimated evaluation cost, cheapest first.
/// 5. **Constant folding** simplifies `AND`/`OR` with constant operands and double negation.
///
/// Every pass is also available on its own. Passes are total and never modify their input;
/// each returns a new document.
///
/// One run of the five passes does not always reach a fixed point since folding can expose
/// new dead conditions. Use [#optimizeToFixedPoint] when that matters.
///
/// Counters accumulate in this instance until [#resetStats]. An optimizer is meant for one
/// editing session; sharing one across threads needs external synchronization.
public final class Optimizer {

    private static final Logger LOG = Logger.getLogger(Optimizer.class.getName());

    private final OptimizerOptions options;

    private int hoistedConditions;
    private int eliminatedSubexpressions;
    private int removedDeadConditions;
    private int reorderedConditions;
    private int foldedConstants;

    public Optimizer() {
        this(OptimizerOptions.DEFAULT);
    }

    public Optimizer(OptimizerOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public OptimizerOptions options() {
        return options;
    }

    /// Applies all five passes in order.
    /// @param document the document to optimize
    /// @return a new, optimized document
    public Document optimize(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        LOG.fine(() -> "Optimizing document with " + document.statutes().size() + " statutes");

        var doc = document;
        doc = hoistOnly(doc);
        doc = cseOnly(doc);
        doc = deadCodeOnly(doc);
        doc = reorderOnly(doc);
        doc = foldOnly(doc);

        final var result = doc;
        LOG.fine(() -> "Optimization complete: " + stats().summary());
        LOG.finest(() -> "Optimized document:\n" + DslPrinter.formatDocument(result));
        return result;
    }

    /// Re-runs [#optimize] until the document stops changing or
    /// [OptimizerOptions#maxIterations] rounds have run.
    /// @param document the document to optimize
    /// @return the last document produced
    public Document optimizeToFixedPoint(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        var current = document;
        for (int round = 1; round <= options.maxIterations(); round++) {
            final var next = optimize(current);
            if (next.equals(current)) {
                final int rounds = round;
                LOG.fine(() -> "Fixed point reached after " + rounds + " round(s)");
                return next;
            }
            current = next;
        }
        LOG.warning(() -> "No fixed point after " + options.maxIterations() + " rounds; returning last result");
        return current;
    }

    /// Returns a snapshot of the accumulated counters.
    public OptimizationStats stats() {
        return new OptimizationStats(hoistedConditions, eliminatedSubexpressions, removedDeadConditions,
                reorderedConditions, foldedConstants);
    }

    /// Zeroes every counter.
    public void resetStats() {
        hoistedConditions = 0;
        eliminatedSubexpressions = 0;
        removedDeadConditions = 0;
        reorderedConditions = 0;
        foldedConstants = 0;
    }

    /// Applies only condition hoisting.
    public Document hoistOnly(Document document) {
        return eachStatute(document, "hoisting", this::hoistConditions);
    }

    /// Applies only common-subexpression elimination.
    public Document cseOnly(Document document) {
        return eachStatute(document, "cse", this::eliminateCommonSubexpressions);
    }

    /// Applies only dead-condition elimination.
    public Document deadCodeOnly(Document document) {
        return eachStatute(document, "dead-code", this::eliminateDeadConditions);
    }

    /// Applies only cost-based reordering.
    public Document reorderOnly(Document document) {
        return eachStatute(document, "reordering", this::reorderConditions);
    }

    /// Applies only constant folding.
    public Document foldOnly(Document document) {
        return eachStatute(document, "constant-folding", this::foldConstants);
    }

    private Document eachStatute(Document document, String pass, UnaryOperator<Statute> rewrite) {
        Objects.requireNonNull(document, "document must not be null");
        LOG.fine(() -> "Running " + pass + " pass over " + document.statutes().size() + " statutes");
        final List<Statute> rewritten = new ArrayList<>(document.statutes().size());
        for (final Statute statute : document.statutes()) {
            rewritten.add(rewrite.apply(statute));
        }
        return document.withStatutes(rewritten);
    }

    // ---- hoisting ----

    Statute hoistConditions(Statute statute) {
        final List<Condition> hoisted = new ArrayList<>();
        final List<Condition> remaining = new ArrayList<>();

        for (final Condition condition : statute.conditions()) {
            if (isInvariant(condition)) {
                hoisted.add(condition);
                hoistedConditions++;
            } else {
                remaining.add(condition);
            }
        }

        if (!hoisted.isEmpty()) {
            LOG.finer(() -> "Statute " + statute.id() + ": hoisted " + hoisted.size() + " invariant condition(s)");
        }
        hoisted.addAll(remaining);
        return statute.withConditions(hoisted);
    }

    /// A condition is invariant when its value cannot depend on the evaluated entity: a
    /// comparison on one of [OptimizerOptions#invariantFields], or `AND`/`OR`/`NOT` built only
    /// from invariant conditions. Attribute checks are never invariant.
    public boolean isInvariant(Condition condition) {
        if (condition instanceof Condition.Comparison c) {
            return options.invariantFields().contains(c.field());
        }
        if (condition instanceof Condition.And a) {
            return isInvariant(a.left()) && isInvariant(a.right());
        }
        if (condition instanceof Condition.Or o) {
            return isInvariant(o.left()) && isInvariant(o.right());
        }
        if (condition instanceof Condition.Not n) {
            return isInvariant(n.inner());
        }
        return false;
    }

    // ---- common subexpression elimination ----

    Statute eliminateCommonSubexpressions(Statute statute) {
        final Set<String> seen = new HashSet<>();
        final List<Condition> deduplicated = new ArrayList<>();

        for (final Condition condition : statute.conditions()) {
            if (seen.add(conditionSignature(condition))) {
                deduplicated.add(condition);
            } else {
                eliminatedSubexpressions++;
                LOG.finer(() -> "Statute " + statute.id() + ": dropped duplicate " + DslPrinter.formatCondition(condition));
            }
        }
        return statute.withConditions(deduplicated);
    }

    /// Canonical text key of a condition. Two conditions share a signature iff they are
    /// structurally equal. Every string operand is quoted with quotes and backslashes escaped,
    /// so no operand can imitate a separator.
    public String conditionSignature(Condition condition) {
        if (condition instanceof Condition.Comparison c) {
            return "CMP:" + quoted(c.field()) + ":" + quoted(c.operator()) + ":" + valueSignature(c.value());
        }
        if (condition instanceof Condition.HasAttribute h) {
            return "HAS:" + quoted(h.key());
        }
        if (condition instanceof Condition.And a) {
            return "AND:" + conditionSignature(a.left()) + ":" + conditionSignature(a.right());
        }
        if (condition instanceof Condition.Or o) {
            return "OR:" + conditionSignature(o.left()) + ":" + conditionSignature(o.right());
        }
        if (condition instanceof Condition.Not n) {
            return "NOT:" + conditionSignature(n.inner());
        }
        if (condition instanceof Condition.Between b) {
            return "BETWEEN:" + quoted(b.field()) + ":" + valueSignature(b.min()) + ":" + valueSignature(b.max());
        }
        if (condition instanceof Condition.In in) {
            return "IN:" + quoted(in.field()) + ":" + in.values().stream()
                    .map(Optimizer::valueSignature)
                    .collect(Collectors.joining(",", "[", "]"));
        }
        if (condition instanceof Condition.Like l) {
            return "LIKE:" + quoted(l.field()) + ":" + quoted(l.pattern());
        }
        if (condition instanceof Condition.Matches m) {
            return "MATCHES:" + quoted(m.field()) + ":" + quoted(m.regexPattern());
        }
        if (condition instanceof Condition.InRange r) {
            return "INRANGE:" + quoted(r.field()) + ":" + valueSignature(r.min()) + ":" + valueSignature(r.max())
                    + ":" + r.inclusiveMin() + ":" + r.inclusiveMax();
        }
        if (condition instanceof Condition.NotInRange r) {
            return "NOTINRANGE:" + quoted(r.field()) + ":" + valueSignature(r.min()) + ":" + valueSignature(r.max())
                    + ":" + r.inclusiveMin() + ":" + r.inclusiveMax();
        }
        final var t = (Condition.TemporalComparison) condition;
        return "TEMPORAL:" + temporalSignature(t.field()) + ":" + quoted(t.operator()) + ":" + valueSignature(t.value());
    }

    private static String valueSignature(ConditionValue value) {
        if (value instanceof ConditionValue.Number n) {
            return "Number(" + n.value() + ")";
        }
        if (value instanceof ConditionValue.Text t) {
            return "String(" + quoted(t.value()) + ")";
        }
        if (value instanceof ConditionValue.Bool b) {
            return "Boolean(" + b.value() + ")";
        }
        if (value instanceof ConditionValue.Date d) {
            return "Date(" + quoted(d.value()) + ")";
        }
        return "SetExpr(" + quoted(((ConditionValue.SetExpr) value).expression()) + ")";
    }

    private static String temporalSignature(TemporalField field) {
        if (field instanceof TemporalField.DateField df) {
            return "DateField(" + quoted(df.name()) + ")";
        }
        return "CurrentDate";
    }

    private static String quoted(String s) {
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    // ---- dead code elimination ----

    Statute eliminateDeadConditions(Statute statute) {
        final List<Condition> live = new ArrayList<>();

        for (final Condition condition : statute.conditions()) {
            if (isDeadCondition(condition)) {
                removedDeadConditions++;
                LOG.finer(() -> "Statute " + statute.id() + ": removed dead " + DslPrinter.formatCondition(condition));
            } else {
                live.add(condition);
            }
        }
        return statute.withConditions(live);
    }

    /// True only for conditions that provably never hold: `age < 0`, a `BETWEEN` whose numeric
    /// minimum exceeds its maximum, or an `AND` with a dead operand. Anything else, `OR`
    /// included, is treated as live.
    public boolean isDeadCondition(Condition condition) {
        if (condition instanceof Condition.Comparison c) {
            if ((c.field().equals("age") || c.field().equals("AGE")) && c.operator().equals("<")
                    && c.value() instanceof ConditionValue.Number n) {
                return n.value() == 0;
            }
            return false;
        }
        if (condition instanceof Condition.And a) {
            return isDeadCondition(a.left()) || isDeadCondition(a.right());
        }
        if (condition instanceof Condition.Between b) {
            if (b.min() instanceof ConditionValue.Number min && b.max() instanceof ConditionValue.Number max) {
                return min.value() > max.value();
            }
            return false;
        }
        return false;
    }

    // ---- reordering ----

    Statute reorderConditions(Statute statute) {
        final List<Condition> sorted = new ArrayList<>(statute.conditions());
        // List.sort is stable: equal-cost conditions keep their relative order
        sorted.sort(Comparator.comparingInt(this::conditionCost));
        reorderedConditions += sorted.size();
        return statute.withConditions(sorted);
    }

    /// Relative cost of evaluating a condition; cheaper conditions are evaluated first so an
    /// `AND` chain can short-circuit early.
    public int conditionCost(Condition condition) {
        if (condition instanceof Condition.HasAttribute) {
            return 1;
        }
        if (condition instanceof Condition.Comparison) {
            return 2;
        }
        if (condition instanceof Condition.Between) {
            return 3;
        }
        if (condition instanceof Condition.In in) {
            return 5 + in.values().size();
        }
        if (condition instanceof Condition.Like) {
            return 10;
        }
        if (condition instanceof Condition.Matches) {
            return 15;
        }
        if (condition instanceof Condition.And a) {
            return conditionCost(a.left()) + conditionCost(a.right());
        }
        if (condition instanceof Condition.Or o) {
            return conditionCost(o.left()) + conditionCost(o.right());
        }
        if (condition instanceof Condition.Not n) {
            return conditionCost(n.inner()) + 1;
        }
        return 5;
    }

    // ---- constant folding ----

    Statute foldConstants(Statute statute) {
        final List<Condition> folded = new ArrayList<>(statute.conditions().size());
        for (final Condition condition : statute.conditions()) {
            folded.add(foldCondition(condition));
        }
        return statute.withConditions(folded);
    }

    /// Folds a condition tree bottom-up:
    /// `AND(true, x) = x`, `AND(x, true) = x`, `OR(false, x) = x`, `OR(x, false) = x`,
    /// `NOT(NOT(x)) = x`. Each applied simplification counts once.
    /// @param condition the condition to fold
    /// @return the folded condition; leaves are returned unchanged
    public Condition foldCondition(Condition condition) {
        if (condition instanceof Condition.And a) {
            final Condition left = foldCondition(a.left());
            final Condition right = foldCondition(a.right());
            if (isAlwaysTrue(left)) {
                foldedConstants++;
                return right;
            }
            if (isAlwaysTrue(right)) {
                foldedConstants++;
                return left;
            }
            return new Condition.And(left, right);
        }
        if (condition instanceof Condition.Or o) {
            final Condition left = foldCondition(o.left());
            final Condition right = foldCondition(o.right());
            if (isAlwaysFalse(left)) {
                foldedConstants++;
                return right;
            }
            if (isAlwaysFalse(right)) {
                foldedConstants++;
                return left;
            }
            return new Condition.Or(left, right);
        }
        if (condition instanceof Condition.Not n) {
            final Condition inner = foldCondition(n.inner());
            if (inner instanceof Condition.Not doubled) {
                foldedConstants++;
                return doubled.inner();
            }
            return new Condition.Not(inner);
        }
        return condition;
    }

    /// Tautology detection is not implemented; this answers false for every condition, so the
    /// `AND` rules never fire.
    boolean isAlwaysTrue(Condition condition) {
        return false;
    }

    boolean isAlwaysFalse(Condition condition) {
        return isDeadCondition(condition);
    }
}
