package legalis.dsl.ast;

import java.util.List;
import java.util.Objects;

/// Legal consequence of a statute, e.g. `GRANT "Full legal capacity"`.
public record Effect(String effectType, String description, List<String> parameters) {
    public Effect {
        Objects.requireNonNull(effectType, "effectType must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(parameters, "parameters must not be null");
        parameters = List.copyOf(parameters);
    }

    public Effect(String effectType, String description) {
        this(effectType, description, List.of());
    }
}
