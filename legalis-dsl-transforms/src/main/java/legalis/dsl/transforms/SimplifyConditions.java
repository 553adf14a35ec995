package legalis.dsl.transforms;

import legalis.dsl.ast.Condition;
import legalis.dsl.ast.Document;
import legalis.dsl.ast.Statute;

import java.util.ArrayList;
import java.util.List;

/// Eliminates double negation, `NOT(NOT(x)) => x`, throughout every condition tree.
///
/// Usable on a whole document or, as a [ConditionTransform], on a single condition.
public final class SimplifyConditions implements DocumentTransform, ConditionTransform {

    @Override
    public Condition transform(Condition condition) {
        if (condition instanceof Condition.Not n) {
            if (n.inner() instanceof Condition.Not doubled) {
                return transform(doubled.inner());
            }
            return new Condition.Not(transform(n.inner()));
        }
        if (condition instanceof Condition.And a) {
            return new Condition.And(transform(a.left()), transform(a.right()));
        }
        if (condition instanceof Condition.Or o) {
            return new Condition.Or(transform(o.left()), transform(o.right()));
        }
        return condition;
    }

    @Override
    public Document transform(Document document) {
        final List<Statute> simplified = new ArrayList<>(document.statutes().size());
        for (final Statute statute : document.statutes()) {
            final List<Condition> conditions = new ArrayList<>(statute.conditions().size());
            for (final Condition condition : statute.conditions()) {
                conditions.add(transform(condition));
            }
            simplified.add(statute.withConditions(conditions));
        }
        return document.withStatutes(simplified);
    }

    @Override
    public String description() {
        return "Simplify conditions (eliminate double negations)";
    }
}
