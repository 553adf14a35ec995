package legalis.dsl.ast;

import java.util.List;
import java.util.Objects;

/// Condition tree of a statute.
///
/// Leaves carry plain values only. `And`, `Or` and `Not` own their children; records are
/// immutable so a tree can never contain a cycle.
public sealed interface Condition {

    /// `field operator value`, e.g. `age >= 18`.
    record Comparison(String field, String operator, ConditionValue value) implements Condition {
        public Comparison {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record Between(String field, ConditionValue min, ConditionValue max) implements Condition {
        public Between {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(min, "min must not be null");
            Objects.requireNonNull(max, "max must not be null");
        }
    }

    /// Set membership.
    record In(String field, List<ConditionValue> values) implements Condition {
        public In {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(values, "values must not be null");
            values = List.copyOf(values);
        }
    }

    /// SQL-style wildcard pattern.
    record Like(String field, String pattern) implements Condition {
        public Like {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(pattern, "pattern must not be null");
        }
    }

    /// Regular expression match.
    record Matches(String field, String regexPattern) implements Condition {
        public Matches {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(regexPattern, "regexPattern must not be null");
        }
    }

    record InRange(String field, ConditionValue min, ConditionValue max,
                   boolean inclusiveMin, boolean inclusiveMax) implements Condition {
        public InRange {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(min, "min must not be null");
            Objects.requireNonNull(max, "max must not be null");
        }
    }

    record NotInRange(String field, ConditionValue min, ConditionValue max,
                      boolean inclusiveMin, boolean inclusiveMax) implements Condition {
        public NotInRange {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(min, "min must not be null");
            Objects.requireNonNull(max, "max must not be null");
        }
    }

    /// Attribute presence check, e.g. `HAS citizen`.
    record HasAttribute(String key) implements Condition {
        public HasAttribute {
            Objects.requireNonNull(key, "key must not be null");
        }
    }

    record TemporalComparison(TemporalField field, String operator, ConditionValue value) implements Condition {
        public TemporalComparison {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    record And(Condition left, Condition right) implements Condition {
        public And {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record Or(Condition left, Condition right) implements Condition {
        public Or {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }
    }

    record Not(Condition inner) implements Condition {
        public Not {
            Objects.requireNonNull(inner, "inner must not be null");
        }
    }

    static Condition compare(String field, String operator, long value) {
        return new Comparison(field, operator, new ConditionValue.Number(value));
    }

    static Condition has(String key) { return new HasAttribute(key); }
    static Condition and(Condition left, Condition right) { return new And(left, right); }
    static Condition or(Condition left, Condition right) { return new Or(left, right); }
    static Condition not(Condition inner) { return new Not(inner); }
}
