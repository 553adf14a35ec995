package legalis.dsl.optimizer;

import java.util.Arrays;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Settings for an [Optimizer].
///
/// @param invariantFields comparison fields holding static statute metadata; a comparison on
///                        one of these does not depend on the evaluated entity
/// @param maxIterations upper bound on `optimize` rounds in [Optimizer#optimizeToFixedPoint]
public record OptimizerOptions(Set<String> invariantFields, int maxIterations) {

    private static final Logger LOG = Logger.getLogger(OptimizerOptions.class.getName());

    /// System property listing invariant fields, comma separated.
    public static final String INVARIANT_FIELDS_PROPERTY = "legalis.optimizer.invariant.fields";

    /// System property bounding fixed-point iteration.
    public static final String MAX_ITERATIONS_PROPERTY = "legalis.optimizer.max.iterations";

    /// `VERSION` and `JURISDICTION` invariant, at most 16 rounds.
    public static final OptimizerOptions DEFAULT = new OptimizerOptions(Set.of("VERSION", "JURISDICTION"), 16);

    public OptimizerOptions {
        Objects.requireNonNull(invariantFields, "invariantFields must not be null");
        invariantFields = Set.copyOf(invariantFields);
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be > 0");
        }
    }

    /// Reads [#INVARIANT_FIELDS_PROPERTY] and [#MAX_ITERATIONS_PROPERTY], falling back to
    /// [#DEFAULT] for anything unset or invalid.
    public static OptimizerOptions fromSystemProperties() {
        var options = DEFAULT;

        final String fields = System.getProperty(INVARIANT_FIELDS_PROPERTY);
        if (fields != null) {
            final Set<String> parsed = Arrays.stream(fields.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.toUnmodifiableSet());
            if (parsed.isEmpty()) {
                LOG.warning(() -> "Ignoring empty " + INVARIANT_FIELDS_PROPERTY + ": '" + fields + "'");
            } else {
                options = options.withInvariantFields(parsed);
                LOG.fine(() -> "Invariant fields set via system property: " + parsed);
            }
        }

        final String iterations = System.getProperty(MAX_ITERATIONS_PROPERTY);
        if (iterations != null) {
            try {
                final int parsed = Integer.parseInt(iterations.trim());
                options = options.withMaxIterations(parsed);
                LOG.fine(() -> "Max iterations set via system property: " + parsed);
            } catch (IllegalArgumentException ex) {
                LOG.warning(() -> "Invalid " + MAX_ITERATIONS_PROPERTY + ": '" + iterations
                        + "'. Using default: " + DEFAULT.maxIterations());
            }
        }
        return options;
    }

    public OptimizerOptions withInvariantFields(Set<String> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        return new OptimizerOptions(fields, maxIterations);
    }

    public OptimizerOptions withMaxIterations(int iterations) {
        return new OptimizerOptions(invariantFields, iterations);
    }
}
