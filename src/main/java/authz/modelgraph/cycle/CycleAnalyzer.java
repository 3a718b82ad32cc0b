package authz.modelgraph.cycle;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import authz.modelgraph.graph.Edge;
import authz.modelgraph.graph.Graph;
import authz.modelgraph.graph.Node;

/**
 * Enumerates every elementary cycle of a relation graph (Johnson, 1975) and
 * classifies each one by the edges along it.
 * <p>
 * Cycles are node sequences. Between two consecutive nodes the step counts as
 * computed when any parallel edge between them is computed; a cycle is
 * {@link CycleKind#DEFINITIVE} when every step, including the closing one, is computed.
 * <p>
 * Runtime is O((n + e)(c + 1)) for c cycles. Dense graphs can have exponentially
 * many elementary cycles and all of them are reported; relation graphs of real
 * models are sparse enough that this does not matter in practice.
 * The graph is only read.
 */
public final class CycleAnalyzer {

    public CycleReport classify(Graph graph) {
        return new Search(graph).run();
    }

    private static final class Search {

        private final Graph graph;
        private final Set<Long> computedSteps = new HashSet<>();
        private final List<Cycle> found = new ArrayList<>();

        // per start vertex
        private final Set<Integer> blocked = new HashSet<>();
        private final Map<Integer, Set<Integer>> blockedBy = new HashMap<>();
        private final Deque<Integer> stack = new ArrayDeque<>();
        private Set<Integer> component = Set.of();
        private int start;

        private Search(Graph graph) {
            this.graph = graph;
            for (Edge e : graph.edges()) {
                if (e.computed()) {
                    computedSteps.add(stepKey(e.from(), e.to()));
                }
            }
        }

        CycleReport run() {
            final List<Integer> order = new ArrayList<>(graph.nodes().size());
            for (Node n : graph.nodes()) {
                order.add(n.id());
            }

            // Johnson: for each start s, search only the strong component of s
            // within the subgraph of vertices not lower than s.
            for (int i = 0; i < order.size(); i++) {
                start = order.get(i);
                final Set<Integer> allowed = new HashSet<>(order.subList(i, order.size()));
                component = strongComponentOf(start, allowed);
                if (component.size() == 1 && !graph.successors(start).contains(start)) {
                    continue;
                }
                blocked.clear();
                blockedBy.clear();
                stack.clear();
                circuit(start);
            }

            return CycleReport.of(found);
        }

        private boolean circuit(int v) {
            boolean closed = false;
            stack.addLast(v);
            blocked.add(v);

            for (int w : graph.successors(v)) {
                if (!component.contains(w)) {
                    continue;
                }
                if (w == start) {
                    record();
                    closed = true;
                } else if (!blocked.contains(w) && circuit(w)) {
                    closed = true;
                }
            }

            if (closed) {
                unblock(v);
            } else {
                for (int w : graph.successors(v)) {
                    if (component.contains(w)) {
                        blockedBy.computeIfAbsent(w, k -> new HashSet<>()).add(v);
                    }
                }
            }

            stack.removeLast();
            return closed;
        }

        private void unblock(int u) {
            blocked.remove(u);
            final Set<Integer> waiting = blockedBy.remove(u);
            if (waiting == null) {
                return;
            }
            for (int w : waiting) {
                if (blocked.contains(w)) {
                    unblock(w);
                }
            }
        }

        private void record() {
            final List<Integer> ids = new ArrayList<>(stack);
            final List<String> labels = new ArrayList<>(ids.size());
            boolean allComputed = true;
            for (int i = 0; i < ids.size(); i++) {
                final int from = ids.get(i);
                final int to = ids.get((i + 1) % ids.size());
                labels.add(graph.label(from));
                if (!computedSteps.contains(stepKey(from, to))) {
                    allComputed = false;
                }
            }
            found.add(new Cycle(ids, labels, allComputed ? CycleKind.DEFINITIVE : CycleKind.POSSIBLE));
        }

        /**
         * Vertices of {@code allowed} that are both reachable from and able to reach {@code s}.
         */
        private Set<Integer> strongComponentOf(int s, Set<Integer> allowed) {
            final Map<Integer, Set<Integer>> predecessors = new HashMap<>();
            for (Edge e : graph.edges()) {
                if (allowed.contains(e.from()) && allowed.contains(e.to())) {
                    predecessors.computeIfAbsent(e.to(), k -> new HashSet<>()).add(e.from());
                }
            }

            final Set<Integer> forward = new HashSet<>();
            final Deque<Integer> work = new ArrayDeque<>();
            forward.add(s);
            work.add(s);
            while (!work.isEmpty()) {
                for (int w : graph.successors(work.poll())) {
                    if (allowed.contains(w) && forward.add(w)) {
                        work.add(w);
                    }
                }
            }

            final Set<Integer> scc = new HashSet<>();
            scc.add(s);
            work.add(s);
            while (!work.isEmpty()) {
                for (int p : predecessors.getOrDefault(work.poll(), Set.of())) {
                    if (forward.contains(p) && scc.add(p)) {
                        work.add(p);
                    }
                }
            }
            return scc;
        }

        private static long stepKey(int from, int to) {
            return ((long) from << 32) | (to & 0xffffffffL);
        }
    }
}
