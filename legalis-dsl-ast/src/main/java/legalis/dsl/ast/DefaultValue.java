package legalis.dsl.ast;

import java.util.Objects;

/// `DEFAULT field = value`.
public record DefaultValue(String field, ConditionValue value) {
    public DefaultValue {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
