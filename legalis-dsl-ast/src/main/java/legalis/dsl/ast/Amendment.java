package legalis.dsl.ast;

import java.util.Objects;

/// `AMENDMENT target VERSION n "description"`; version may be null.
public record Amendment(String targetId, Integer version, String description) {
    public Amendment {
        Objects.requireNonNull(targetId, "targetId must not be null");
        Objects.requireNonNull(description, "description must not be null");
    }
}
