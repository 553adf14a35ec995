package legalis.dsl.ast;

import java.util.List;
import java.util.Objects;

/// Root of the AST: imports followed by an ordered list of statutes.
///
/// Documents are values. Optimizer passes and transforms never modify one; they return a new
/// document that the caller owns outright.
public record Document(List<Import> imports, List<Statute> statutes) {
    public Document {
        Objects.requireNonNull(imports, "imports must not be null");
        Objects.requireNonNull(statutes, "statutes must not be null");
        imports = List.copyOf(imports);
        statutes = List.copyOf(statutes);
    }

    public static Document of(List<Statute> statutes) {
        return new Document(List.of(), statutes);
    }

    public static Document of(Statute... statutes) {
        return new Document(List.of(), List.of(statutes));
    }

    /// Returns a document with the same imports and the given statutes.
    public Document withStatutes(List<Statute> newStatutes) {
        return new Document(imports, newStatutes);
    }
}
