package legalis.dsl.ast;

import java.util.Objects;

/// Left-hand side of a temporal comparison.
public sealed interface TemporalField {

    /// The evaluation date.
    record CurrentDate() implements TemporalField {}

    /// A named date attribute of the entity.
    record DateField(String name) implements TemporalField {
        public DateField {
            Objects.requireNonNull(name, "name must not be null");
        }
    }
}
