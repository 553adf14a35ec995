package legalis.dsl.transforms;

import legalis.dsl.ast.Document;
import legalis.dsl.ast.Statute;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/// Orders statutes topologically along their `requires` references using Kahn's algorithm.
///
/// Each `requires` entry is an edge from the requiring statute to the required one, so a
/// statute is placed before every statute it requires. A statute's in-degree is the number of
/// statutes requiring it. Among statutes that are ready at the same time the one appearing
/// first in the input is placed first, which makes the result reproducible.
///
/// `requires` entries that name no statute of the document add no edge. A statute requiring
/// itself is a cycle.
public final class SortByDependencies implements DocumentTransform {

    private static final Logger LOG = Logger.getLogger(SortByDependencies.class.getName());

    @Override
    public Document transform(Document document) {
        final List<Statute> statutes = document.statutes();
        final int n = statutes.size();

        final Map<String, List<Integer>> indicesById = new HashMap<>();
        for (int i = 0; i < n; i++) {
            indicesById.computeIfAbsent(statutes.get(i).id(), k -> new ArrayList<>()).add(i);
        }

        final List<Set<Integer>> edges = new ArrayList<>(n);
        final int[] inDegree = new int[n];
        for (int i = 0; i < n; i++) {
            final Set<Integer> targets = new LinkedHashSet<>();
            for (final String required : statutes.get(i).requires()) {
                targets.addAll(indicesById.getOrDefault(required, List.of()));
            }
            for (final int target : targets) {
                inDegree[target]++;
            }
            edges.add(targets);
        }

        final PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < n; i++) {
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }

        final List<Statute> sorted = new ArrayList<>(n);
        while (!ready.isEmpty()) {
            final int next = ready.poll();
            sorted.add(statutes.get(next));
            for (final int target : edges.get(next)) {
                if (--inDegree[target] == 0) {
                    ready.add(target);
                }
            }
        }

        if (sorted.size() != n) {
            final String unplaced = IntStream.range(0, n)
                    .filter(i -> inDegree[i] > 0)
                    .mapToObj(i -> statutes.get(i).id())
                    .collect(Collectors.joining(", "));
            LOG.fine(() -> "Dependency cycle among: " + unplaced);
            throw new TransformException(TransformException.Kind.CIRCULAR_DEPENDENCY,
                    "Cannot sort statutes: circular dependencies detected among [" + unplaced + "]");
        }
        return document.withStatutes(sorted);
    }

    @Override
    public String description() {
        return "Sort statutes by dependencies (topological order)";
    }
}
