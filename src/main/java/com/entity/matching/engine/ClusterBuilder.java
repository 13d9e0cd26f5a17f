package com.entity.matching.engine;

import com.entity.matching.core.model.Cluster;
import com.entity.matching.core.model.ScoredPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Groups scored pairs into clusters in which every member is directly paired with
 * every other member (cliques), not merely connected through a chain of pairs.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Pairs are consumed from the highest score down. Each pair unites the components
 *   of its two rows in a disjoint set; the pair is appended to the edge list of the
 *   merged component.</li>
 *   <li>Each resulting component is a connected group that may not be complete. It is
 *   split into cliques: nodes are visited in ascending key order, and each unvisited node
 *   grows a new clique breadth first, admitting a neighbour only if it is paired with
 *   every node already in the clique.</li>
 *   <li>Cliques of a single node, or of a single key shared by both tables, are dropped. The pairs of each clique are recovered
 *   from the component's edges.</li>
 * </ol>
 *
 * <p>The result is greedy and order sensitive: high-scoring pairs shape the clusters
 * first. Ties between equally valid cliques are broken by ascending row key.</p>
 *
 * <p>In match mode the left and right tables may reuse the same keys, so nodes are
 * kept apart by side; in deduplication mode both sides are the same table.</p>
 */
public class ClusterBuilder<K extends Comparable<K>> {
    private static final Logger log = LoggerFactory.getLogger(ClusterBuilder.class);

    private final boolean sided;

    /**
     * @param sided true when pairs join two different tables
     */
    public ClusterBuilder(boolean sided) {
        this.sided = sided;
    }

    /**
     * Builds the clusters of the given pairs.
     *
     * @param pairs pairs sorted by ascending score
     * @return clusters ordered by descending best score, then by smallest member
     */
    public List<Cluster<K>> build(List<ScoredPair<K>> pairs) {
        Map<Node<K>, Integer> ids = new HashMap<>();
        List<Node<K>> nodes = new ArrayList<>();
        for (ScoredPair<K> pair : pairs) {
            register(left(pair), ids, nodes);
            register(right(pair), ids, nodes);
        }

        DisjointSet components = new DisjointSet(nodes.size());
        Map<Integer, List<ScoredPair<K>>> edgesByRoot = new HashMap<>();
        for (int i = pairs.size() - 1; i >= 0; i--) {
            ScoredPair<K> pair = pairs.get(i);
            int a = ids.get(left(pair));
            int b = ids.get(right(pair));
            int rootA = components.find(a);
            int rootB = components.find(b);
            List<ScoredPair<K>> edges = mergeEdges(edgesByRoot.remove(rootA),
                    rootA == rootB ? null : edgesByRoot.remove(rootB));
            edges.add(pair);
            edgesByRoot.put(components.union(a, b), edges);
        }

        List<Cluster<K>> clusters = new ArrayList<>();
        for (List<ScoredPair<K>> edges : edgesByRoot.values()) {
            clusters.addAll(splitIntoCliques(edges));
        }
        clusters.sort(Comparator.comparingDouble((Cluster<K> c) -> c.maxScore()).reversed()
                .thenComparing(c -> c.members().first()));

        log.debug("clusters.built pairs={} components={} clusters={}",
                pairs.size(), edgesByRoot.size(), clusters.size());
        return clusters;
    }

    private List<Cluster<K>> splitIntoCliques(List<ScoredPair<K>> edges) {
        Map<Node<K>, Set<Node<K>>> adjacency = new TreeMap<>();
        Map<Set<Node<K>>, ScoredPair<K>> edgeMap = new HashMap<>();
        for (ScoredPair<K> edge : edges) {
            Node<K> a = left(edge);
            Node<K> b = right(edge);
            adjacency.computeIfAbsent(a, n -> new TreeSet<>()).add(b);
            adjacency.computeIfAbsent(b, n -> new TreeSet<>()).add(a);
            edgeMap.put(Set.of(a, b), edge);
        }

        List<Cluster<K>> cliques = new ArrayList<>();
        Set<Node<K>> visited = new HashSet<>();
        for (Node<K> start : adjacency.keySet()) {
            if (!visited.add(start)) {
                continue;
            }
            Set<Node<K>> clique = new LinkedHashSet<>();
            clique.add(start);
            Deque<Node<K>> queue = new ArrayDeque<>();
            queue.add(start);
            while (!queue.isEmpty()) {
                Node<K> current = queue.poll();
                for (Node<K> neighbour : adjacency.get(current)) {
                    if (visited.contains(neighbour)) {
                        continue;
                    }
                    if (adjacency.get(neighbour).containsAll(clique)) {
                        visited.add(neighbour);
                        clique.add(neighbour);
                        queue.add(neighbour);
                    }
                }
            }
            if (clique.size() > 1) {
                toCluster(clique, edgeMap).ifPresent(cliques::add);
            }
        }
        return cliques;
    }

    /**
     * Empty when the clique holds a single distinct key, as when a key of the left table
     * is paired only with the same key of the right table.
     */
    private Optional<Cluster<K>> toCluster(Set<Node<K>> clique, Map<Set<Node<K>>, ScoredPair<K>> edgeMap) {
        List<Node<K>> members = new ArrayList<>(clique);
        TreeSet<K> keys = new TreeSet<>();
        List<ScoredPair<K>> pairs = new ArrayList<>();
        for (int i = 0; i < members.size(); i++) {
            keys.add(members.get(i).key());
            for (int j = i + 1; j < members.size(); j++) {
                ScoredPair<K> edge = edgeMap.get(Set.of(members.get(i), members.get(j)));
                if (edge != null) {
                    pairs.add(edge);
                }
            }
        }
        if (keys.size() < 2) {
            log.debug("clusters.skipped key={} reason=single-key", keys.first());
            return Optional.empty();
        }
        return Optional.of(new Cluster<>(keys, pairs));
    }

    private static <K extends Comparable<K>> List<ScoredPair<K>> mergeEdges(List<ScoredPair<K>> a,
                                                                         List<ScoredPair<K>> b) {
        if (a == null && b == null) {
            return new ArrayList<>();
        }
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        if (a.size() < b.size()) {
            b.addAll(a);
            return b;
        }
        a.addAll(b);
        return a;
    }

    private static <K extends Comparable<K>> void register(Node<K> node, Map<Node<K>, Integer> ids,
                                                         List<Node<K>> nodes) {
        if (!ids.containsKey(node)) {
            ids.put(node, nodes.size());
            nodes.add(node);
        }
    }

    private Node<K> left(ScoredPair<K> pair) {
        return new Node<>(0, pair.keyA());
    }

    private Node<K> right(ScoredPair<K> pair) {
        return new Node<>(sided ? 1 : 0, pair.keyB());
    }

    /**
     * A row key tagged with the table it comes from.
     */
    private record Node<K extends Comparable<K>>(int side, K key) implements Comparable<Node<K>> {
        @Override
        public int compareTo(Node<K> other) {
            int byKey = key.compareTo(other.key);
            return byKey != 0 ? byKey : Integer.compare(side, other.side);
        }
    }
}
