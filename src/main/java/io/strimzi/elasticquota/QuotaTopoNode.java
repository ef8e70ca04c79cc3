/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.elasticquota;

import java.util.LinkedHashMap;
import java.util.Map;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Only holds the parent/child structure of the quota tree. The resource figures stay in the referenced
 * {@link QuotaInfo} so a recalculation always reads and writes the authoritative record.
 */
public class QuotaTopoNode {
    private final String name;
    private final QuotaInfo quotaInfo;
    private QuotaTopoNode parQuotaTopoNode;
    private final Map<String, QuotaTopoNode> childGroupQuotaInfos = new LinkedHashMap<>();

    /**
     * @param quotaInfo the record to wrap, referenced rather than copied
     */
    @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "The node is a view onto the authoritative record")
    public QuotaTopoNode(QuotaInfo quotaInfo) {
        this.name = quotaInfo.getName();
        this.quotaInfo = quotaInfo;
    }

    public String getName() {
        return name;
    }

    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The node is a view onto the authoritative record")
    public QuotaInfo getQuotaInfo() {
        return quotaInfo;
    }

    /**
     * @return the parent node, null for the root
     */
    public QuotaTopoNode getParent() {
        return parQuotaTopoNode;
    }

    /**
     * Adds or replaces the child with the same name and points the child back at this node.
     *
     * @param childNode the child to add
     */
    public void addChildGroupQuotaInfo(QuotaTopoNode childNode) {
        childGroupQuotaInfos.put(childNode.name, childNode);
        childNode.parQuotaTopoNode = this;
    }

    /**
     * @param childName the child to remove
     * @return the removed child, null if it was not a child of this node
     */
    public QuotaTopoNode removeChildGroupQuotaInfo(String childName) {
        QuotaTopoNode removed = childGroupQuotaInfos.remove(childName);
        if (removed != null) {
            removed.parQuotaTopoNode = null;
        }
        return removed;
    }

    /**
     * Moves this node, with its subtree, below another parent.
     *
     * @param newParent the new parent
     */
    public void reparent(QuotaTopoNode newParent) {
        if (parQuotaTopoNode != null) {
            parQuotaTopoNode.removeChildGroupQuotaInfo(name);
        }
        newParent.addChildGroupQuotaInfo(this);
    }

    /**
     * @return a copy of the children keyed by name, changes to it do not affect the topology
     */
    public Map<String, QuotaTopoNode> getChildGroupQuotaInfos() {
        return new LinkedHashMap<>(childGroupQuotaInfos);
    }

    public boolean hasChildren() {
        return !childGroupQuotaInfos.isEmpty();
    }

    @Override
    public String toString() {
        return "QuotaTopoNode{" +
                "name='" + name + '\'' +
                ", parent=" + (parQuotaTopoNode == null ? null : parQuotaTopoNode.name) +
                ", children=" + childGroupQuotaInfos.keySet() +
                '}';
    }
}
