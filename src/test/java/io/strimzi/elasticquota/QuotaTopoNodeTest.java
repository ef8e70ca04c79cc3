/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.elasticquota;

import java.util.Map;

import io.strimzi.elasticquota.resource.ResourceVector;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QuotaTopoNodeTest {

    @Test
    void shouldReferenceRatherThanCopyQuotaInfo() {
        //Given
        QuotaInfo quotaInfo = QuotaInfo.newQuotaInfo(false, true, "team-a", "");
        QuotaTopoNode node = new QuotaTopoNode(quotaInfo);

        //When
        quotaInfo.addRequestNonNegative(ResourceVector.of("cpu", 3));

        //Then
        assertThat(node.getQuotaInfo()).isSameAs(quotaInfo);
        assertThat(node.getQuotaInfo().getRequest()).isEqualTo(ResourceVector.of("cpu", 3));
        assertThat(node.getName()).isEqualTo("team-a");
    }

    @Test
    void shouldAddChildAndLinkParent() {
        //Given
        QuotaTopoNode parent = node("org", true);
        QuotaTopoNode child = node("team-a", false);

        //When
        parent.addChildGroupQuotaInfo(child);

        //Then
        assertThat(parent.getChildGroupQuotaInfos()).containsOnlyKeys("team-a");
        assertThat(child.getParent()).isSameAs(parent);
        assertThat(parent.hasChildren()).isTrue();
    }

    @Test
    void shouldReturnCopyOfChildren() {
        //Given
        QuotaTopoNode parent = node("org", true);
        parent.addChildGroupQuotaInfo(node("team-a", false));

        //When
        Map<String, QuotaTopoNode> children = parent.getChildGroupQuotaInfos();
        children.put("team-b", node("team-b", false));
        children.remove("team-a");

        //Then
        assertThat(parent.getChildGroupQuotaInfos()).containsOnlyKeys("team-a");
    }

    @Test
    void shouldReparentByMovingBetweenChildMaps() {
        //Given
        QuotaTopoNode oldParent = node("org-1", true);
        QuotaTopoNode newParent = node("org-2", true);
        QuotaTopoNode child = node("team-a", true);
        QuotaTopoNode grandChild = node("app", false);
        oldParent.addChildGroupQuotaInfo(child);
        child.addChildGroupQuotaInfo(grandChild);

        //When
        child.reparent(newParent);

        //Then
        assertThat(oldParent.getChildGroupQuotaInfos()).isEmpty();
        assertThat(newParent.getChildGroupQuotaInfos()).containsOnlyKeys("team-a");
        assertThat(child.getParent()).isSameAs(newParent);
        assertThat(child.getChildGroupQuotaInfos()).containsOnlyKeys("app");
    }

    @Test
    void shouldRemoveChild() {
        //Given
        QuotaTopoNode parent = node("org", true);
        QuotaTopoNode child = node("team-a", false);
        parent.addChildGroupQuotaInfo(child);

        //When
        QuotaTopoNode removed = parent.removeChildGroupQuotaInfo("team-a");

        //Then
        assertThat(removed).isSameAs(child);
        assertThat(child.getParent()).isNull();
        assertThat(parent.removeChildGroupQuotaInfo("team-a")).isNull();
    }

    private static QuotaTopoNode node(String name, boolean isParent) {
        return new QuotaTopoNode(QuotaInfo.newQuotaInfo(isParent, true, name, ""));
    }
}
