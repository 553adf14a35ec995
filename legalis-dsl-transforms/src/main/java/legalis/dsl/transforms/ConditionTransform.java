package legalis.dsl.transforms;

import legalis.dsl.ast.Condition;

/// A rewrite of a single condition tree.
public interface ConditionTransform {

    Condition transform(Condition condition);

    String description();
}
