package legalis.dsl.ast;

import java.util.List;
import java.util.Objects;

/// A statute: an identified rule whose conditions are AND-combined and whose effects apply
/// when they all hold.
///
/// `requires` and `supersedes` hold statute ids. They are references resolved by looking the
/// id up among the statutes of a document, never live links, so the `requires` graph may
/// contain cycles.
///
/// @param id unique statute id
/// @param title human-readable title
/// @param conditions AND-combined conditions; order affects diagnostics and cost, not meaning
/// @param effects consequences of the statute
/// @param discretion free-text discretion clause, may be null
/// @param requires ids of statutes this one depends on
/// @param supersedes ids of statutes this one replaces
/// @param exceptions exception clauses
/// @param amendments amendment declarations
/// @param defaults default attribute values
public record Statute(
        String id,
        String title,
        List<Condition> conditions,
        List<Effect> effects,
        String discretion,
        List<String> requires,
        List<String> supersedes,
        List<ExceptionClause> exceptions,
        List<Amendment> amendments,
        List<DefaultValue> defaults
) {
    public Statute {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(conditions, "conditions must not be null");
        Objects.requireNonNull(effects, "effects must not be null");
        Objects.requireNonNull(requires, "requires must not be null");
        Objects.requireNonNull(supersedes, "supersedes must not be null");
        Objects.requireNonNull(exceptions, "exceptions must not be null");
        Objects.requireNonNull(amendments, "amendments must not be null");
        Objects.requireNonNull(defaults, "defaults must not be null");
        conditions = List.copyOf(conditions);
        effects = List.copyOf(effects);
        requires = List.copyOf(requires);
        supersedes = List.copyOf(supersedes);
        exceptions = List.copyOf(exceptions);
        amendments = List.copyOf(amendments);
        defaults = List.copyOf(defaults);
    }

    /// Creates a statute with no conditions, effects, references or clauses.
    public static Statute of(String id, String title) {
        return new Statute(id, title, List.of(), List.of(), null, List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public boolean hasDiscretion() {
        return discretion != null;
    }

    public Statute withId(String newId) {
        return new Statute(newId, title, conditions, effects, discretion, requires, supersedes, exceptions, amendments, defaults);
    }

    public Statute withConditions(List<Condition> newConditions) {
        return new Statute(id, title, newConditions, effects, discretion, requires, supersedes, exceptions, amendments, defaults);
    }

    public Statute withEffects(List<Effect> newEffects) {
        return new Statute(id, title, conditions, newEffects, discretion, requires, supersedes, exceptions, amendments, defaults);
    }

    public Statute withDiscretion(String newDiscretion) {
        return new Statute(id, title, conditions, effects, newDiscretion, requires, supersedes, exceptions, amendments, defaults);
    }

    public Statute withRequires(List<String> newRequires) {
        return new Statute(id, title, conditions, effects, discretion, newRequires, supersedes, exceptions, amendments, defaults);
    }

    public Statute withSupersedes(List<String> newSupersedes) {
        return new Statute(id, title, conditions, effects, discretion, requires, newSupersedes, exceptions, amendments, defaults);
    }

    public Statute withExceptions(List<ExceptionClause> newExceptions) {
        return new Statute(id, title, conditions, effects, discretion, requires, supersedes, newExceptions, amendments, defaults);
    }

    public Statute withAmendments(List<Amendment> newAmendments) {
        return new Statute(id, title, conditions, effects, discretion, requires, supersedes, exceptions, newAmendments, defaults);
    }

    public Statute withDefaults(List<DefaultValue> newDefaults) {
        return new Statute(id, title, conditions, effects, discretion, requires, supersedes, exceptions, amendments, newDefaults);
    }
}
