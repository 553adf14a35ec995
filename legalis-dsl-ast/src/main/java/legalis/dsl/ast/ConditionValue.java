package legalis.dsl.ast;

import java.util.Objects;

/// Literal operand of a condition.
public sealed interface ConditionValue {

    record Number(long value) implements ConditionValue {}

    record Text(String value) implements ConditionValue {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record Bool(boolean value) implements ConditionValue {}

    /// Calendar date kept in its source spelling, e.g. `2024-01-01`.
    record Date(String value) implements ConditionValue {
        public Date {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /// Set expression, opaque to this library.
    record SetExpr(String expression) implements ConditionValue {
        public SetExpr {
            Objects.requireNonNull(expression, "expression must not be null");
        }
    }

    static ConditionValue number(long n) { return new Number(n); }
    static ConditionValue text(String s) { return new Text(s); }
    static ConditionValue bool(boolean b) { return new Bool(b); }
    static ConditionValue date(String d) { return new Date(d); }
}
