/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.elasticquota;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An immutable snapshot of the quota tree's structure, rebuilt whenever a quota group is added, removed or
 * re-parented. Every group hangs below a synthetic {@link QuotaInfo#ROOT_QUOTA_NAME root} node.
 */
public class QuotaTopology {
    private static final Logger log = LoggerFactory.getLogger(QuotaTopology.class);

    private final long generation;
    private final QuotaTopoNode root;
    private final Map<String, QuotaTopoNode> nodes;
    private final List<QuotaTopoNode> topDown;

    private QuotaTopology(long generation, QuotaTopoNode root, Map<String, QuotaTopoNode> nodes, List<QuotaTopoNode> topDown) {
        this.generation = generation;
        this.root = root;
        this.nodes = nodes;
        this.topDown = topDown;
    }

    /**
     * @param generation the generation to tag the topology with
     * @return a topology without any quota group
     */
    public static QuotaTopology empty(long generation) {
        QuotaTopoNode root = new QuotaTopoNode(QuotaInfo.newQuotaInfo(true, true, QuotaInfo.ROOT_QUOTA_NAME, ""));
        return new QuotaTopology(generation, root, Map.of(), List.of(root));
    }

    /**
     * Assembles the tree from a flat set of quota groups.
     *
     * @param quotaInfos the groups, referenced by the resulting nodes
     * @param generation the generation to tag the topology with
     * @return the assembled topology
     * @throws QuotaTopologyException if a name is duplicated or reserved, a parent is absent or not marked as a
     *                                parent, or the parent links form a cycle
     */
    public static QuotaTopology build(Collection<QuotaInfo> quotaInfos, long generation) throws QuotaTopologyException {
        QuotaTopoNode root = new QuotaTopoNode(QuotaInfo.newQuotaInfo(true, true, QuotaInfo.ROOT_QUOTA_NAME, ""));
        Map<String, QuotaTopoNode> nodes = new HashMap<>();
        Map<String, QuotaInfo> snapshots = new HashMap<>();
        for (QuotaInfo quotaInfo : quotaInfos) {
            String name = quotaInfo.getName();
            if (QuotaInfo.ROOT_QUOTA_NAME.equals(name)) {
                throw new QuotaTopologyException(name, "name is reserved for the root of the tree");
            }
            if (nodes.putIfAbsent(name, new QuotaTopoNode(quotaInfo)) != null) {
                throw new QuotaTopologyException(name, "defined more than once");
            }
            snapshots.put(name, quotaInfo.deepCopy());
        }

        // sorted so that the reported inconsistency does not depend on iteration order
        for (String name : new TreeSet<>(nodes.keySet())) {
            String parentName = snapshots.get(name).getParentName();
            QuotaTopoNode node = nodes.get(name);
            if (parentName.isEmpty() || QuotaInfo.ROOT_QUOTA_NAME.equals(parentName)) {
                root.addChildGroupQuotaInfo(node);
                continue;
            }
            QuotaTopoNode parent = nodes.get(parentName);
            if (parent == null) {
                throw new QuotaTopologyException(name, "parent '" + parentName + "' does not exist");
            }
            if (!snapshots.get(parentName).isParent()) {
                throw new QuotaTopologyException(name, "parent '" + parentName + "' is not a parent quota group");
            }
            parent.addChildGroupQuotaInfo(node);
        }

        List<QuotaTopoNode> topDown = breadthFirst(root);
        if (topDown.size() != nodes.size() + 1) {
            TreeSet<String> unreachable = new TreeSet<>(nodes.keySet());
            topDown.forEach(node -> unreachable.remove(node.getName()));
            throw new QuotaTopologyException(unreachable.first(), "parent links form a cycle through " + unreachable);
        }
        if (log.isDebugEnabled()) {
            log.debug("Built quota topology generation {} with {} groups", generation, nodes.size());
        }
        return new QuotaTopology(generation, root, Collections.unmodifiableMap(nodes), Collections.unmodifiableList(topDown));
    }

    private static List<QuotaTopoNode> breadthFirst(QuotaTopoNode root) {
        List<QuotaTopoNode> ordered = new ArrayList<>();
        Deque<QuotaTopoNode> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            QuotaTopoNode node = queue.poll();
            ordered.add(node);
            queue.addAll(node.getChildGroupQuotaInfos().values());
        }
        return ordered;
    }

    public long getGeneration() {
        return generation;
    }

    public QuotaTopoNode getRoot() {
        return root;
    }

    /**
     * @param name the quota group name
     * @return the node of the group, empty if the group is not part of this topology
     */
    public Optional<QuotaTopoNode> getNode(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    /**
     * @return every node, the root included, parents always before their children
     */
    public List<QuotaTopoNode> topDown() {
        return topDown;
    }

    /**
     * @return the number of quota groups, the root excluded
     */
    public int size() {
        return nodes.size();
    }
}
