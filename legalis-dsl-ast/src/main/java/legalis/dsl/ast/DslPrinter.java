package legalis.dsl.ast;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/// Renders an AST back into DSL source text.
///
/// Output shape:
/// ```
/// IMPORT "path" AS alias
///
/// STATUTE id: "title" {
///     REQUIRES other
///     SUPERSEDES a, b
///     WHEN (age >= 18) AND (HAS citizen)
///     THEN GRANT "description"
///     DEFAULT field = value
///     EXCEPTION WHEN ... "description"
///     AMENDMENT target VERSION 2 "description"
///     DISCRETION "text"
/// }
/// ```
///
/// Composite conditions are always parenthesised so the rendering is unambiguous; it is meant
/// for diagnostics and round-tripping through the parser, not for pretty output.
public final class DslPrinter {

    private static final String INDENT = "    ";

    private DslPrinter() {
        // Static utility class
    }

    /// Formats a whole document: imports, a blank line, then statutes separated by blank lines.
    /// @param document the document to render
    /// @return DSL source text
    public static String formatDocument(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        final var out = new StringBuilder();

        for (final Import imp : document.imports()) {
            out.append("IMPORT \"").append(imp.path()).append('"');
            if (imp.alias() != null) {
                out.append(" AS ").append(imp.alias());
            }
            out.append('\n');
        }

        if (!document.imports().isEmpty() && !document.statutes().isEmpty()) {
            out.append('\n');
        }

        final List<Statute> statutes = document.statutes();
        for (int i = 0; i < statutes.size(); i++) {
            if (i > 0) {
                out.append('\n');
            }
            out.append(formatStatute(statutes.get(i)));
        }
        return out.toString();
    }

    /// Formats one statute block, terminated by a newline.
    public static String formatStatute(Statute statute) {
        Objects.requireNonNull(statute, "statute must not be null");
        final var out = new StringBuilder();

        out.append("STATUTE ").append(statute.id()).append(": ").append(quote(statute.title())).append(" {\n");

        for (final String req : statute.requires()) {
            out.append(INDENT).append("REQUIRES ").append(req).append('\n');
        }
        if (!statute.supersedes().isEmpty()) {
            out.append(INDENT).append("SUPERSEDES ").append(String.join(", ", statute.supersedes())).append('\n');
        }
        for (final Condition condition : statute.conditions()) {
            out.append(INDENT).append("WHEN ").append(formatCondition(condition)).append('\n');
        }
        for (final Effect effect : statute.effects()) {
            out.append(INDENT).append("THEN ")
                    .append(effect.effectType().toUpperCase(Locale.ROOT))
                    .append(' ').append(quote(effect.description())).append('\n');
        }
        for (final DefaultValue def : statute.defaults()) {
            out.append(INDENT).append("DEFAULT ").append(def.field()).append(" = ").append(formatValue(def.value())).append('\n');
        }
        for (final ExceptionClause exception : statute.exceptions()) {
            out.append(INDENT).append("EXCEPTION");
            if (!exception.conditions().isEmpty()) {
                out.append(" WHEN ").append(formatCondition(exception.conditions().get(0)));
            }
            out.append(' ').append(quote(exception.description())).append('\n');
        }
        for (final Amendment amendment : statute.amendments()) {
            out.append(INDENT).append("AMENDMENT ").append(amendment.targetId());
            if (amendment.version() != null) {
                out.append(" VERSION ").append(amendment.version());
            }
            out.append(' ').append(quote(amendment.description())).append('\n');
        }
        if (statute.hasDiscretion()) {
            out.append(INDENT).append("DISCRETION ").append(quote(statute.discretion())).append('\n');
        }

        out.append("}\n");
        return out.toString();
    }

    /// Formats a single condition tree on one line.
    public static String formatCondition(Condition condition) {
        Objects.requireNonNull(condition, "condition must not be null");
        if (condition instanceof Condition.Comparison c) {
            return c.field() + " " + c.operator() + " " + formatValue(c.value());
        }
        if (condition instanceof Condition.HasAttribute h) {
            return "HAS " + h.key();
        }
        if (condition instanceof Condition.Between b) {
            return b.field() + " BETWEEN " + formatValue(b.min()) + " AND " + formatValue(b.max());
        }
        if (condition instanceof Condition.In in) {
            return in.field() + " IN (" + in.values().stream().map(DslPrinter::formatValue).collect(Collectors.joining(", ")) + ")";
        }
        if (condition instanceof Condition.Like l) {
            return l.field() + " LIKE " + quote(l.pattern());
        }
        if (condition instanceof Condition.Matches m) {
            return m.field() + " MATCHES " + quote(m.regexPattern());
        }
        if (condition instanceof Condition.InRange r) {
            return r.field() + " IN_RANGE " + range(r.min(), r.max(), r.inclusiveMin(), r.inclusiveMax());
        }
        if (condition instanceof Condition.NotInRange r) {
            return r.field() + " NOT_IN_RANGE " + range(r.min(), r.max(), r.inclusiveMin(), r.inclusiveMax());
        }
        if (condition instanceof Condition.TemporalComparison t) {
            return formatTemporalField(t.field()) + " " + t.operator() + " " + formatValue(t.value());
        }
        if (condition instanceof Condition.And a) {
            return "(" + formatCondition(a.left()) + ") AND (" + formatCondition(a.right()) + ")";
        }
        if (condition instanceof Condition.Or o) {
            return "(" + formatCondition(o.left()) + ") OR (" + formatCondition(o.right()) + ")";
        }
        final Condition.Not n = (Condition.Not) condition;
        return "NOT (" + formatCondition(n.inner()) + ")";
    }

    /// Formats a literal operand.
    public static String formatValue(ConditionValue value) {
        Objects.requireNonNull(value, "value must not be null");
        if (value instanceof ConditionValue.Number n) {
            return Long.toString(n.value());
        }
        if (value instanceof ConditionValue.Text t) {
            return quote(t.value());
        }
        if (value instanceof ConditionValue.Bool b) {
            return Boolean.toString(b.value());
        }
        if (value instanceof ConditionValue.Date d) {
            return d.value();
        }
        return ((ConditionValue.SetExpr) value).expression();
    }

    static String formatTemporalField(TemporalField field) {
        if (field instanceof TemporalField.DateField df) {
            return df.name();
        }
        return "current_date";
    }

    private static String range(ConditionValue min, ConditionValue max, boolean inclusiveMin, boolean inclusiveMax) {
        return (inclusiveMin ? "[" : "(") + formatValue(min) + ".." + formatValue(max) + (inclusiveMax ? "]" : ")");
    }

    private static String quote(String s) {
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
