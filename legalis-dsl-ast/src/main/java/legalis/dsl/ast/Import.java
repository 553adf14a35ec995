package legalis.dsl.ast;

import java.util.Objects;

/// Import declaration of a document. Carried through every pass untouched.
public record Import(String path, String alias) {
    public Import {
        Objects.requireNonNull(path, "path must not be null");
        // alias can be null
    }

    public Import(String path) {
        this(path, null);
    }
}
