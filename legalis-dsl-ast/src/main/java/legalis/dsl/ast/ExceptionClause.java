package legalis.dsl.ast;

import java.util.List;
import java.util.Objects;

/// `EXCEPTION WHEN ... "description"` clause of a statute.
public record ExceptionClause(List<Condition> conditions, String description) {
    public ExceptionClause {
        Objects.requireNonNull(conditions, "conditions must not be null");
        Objects.requireNonNull(description, "description must not be null");
        conditions = List.copyOf(conditions);
    }
}
