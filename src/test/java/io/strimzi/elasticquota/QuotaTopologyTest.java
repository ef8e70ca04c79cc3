/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.elasticquota;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuotaTopologyTest {

    @Test
    void shouldAssembleTreeBelowRoot() throws QuotaTopologyException {
        //Given
        QuotaInfo org = quota("org", "", true);
        QuotaInfo team = quota("team", "org", true);
        QuotaInfo app = quota("app", "team", false);
        QuotaInfo other = quota("other", QuotaInfo.ROOT_QUOTA_NAME, false);

        //When
        QuotaTopology topology = QuotaTopology.build(List.of(app, team, other, org), 7L);

        //Then
        assertThat(topology.getGeneration()).isEqualTo(7L);
        assertThat(topology.size()).isEqualTo(4);
        assertThat(topology.getRoot().getChildGroupQuotaInfos()).containsOnlyKeys("org", "other");
        assertThat(topology.getNode("team").orElseThrow().getParent().getName()).isEqualTo("org");
        assertThat(topology.getNode("app").orElseThrow().getQuotaInfo()).isSameAs(app);
        assertThat(topology.getNode("missing")).isEmpty();
    }

    @Test
    void shouldOrderParentsBeforeChildren() throws QuotaTopologyException {
        //Given
        List<QuotaInfo> quotas = List.of(quota("app", "team", false), quota("team", "org", true), quota("org", "", true));

        //When
        List<String> order = QuotaTopology.build(quotas, 1L).topDown().stream().map(QuotaTopoNode::getName).collect(Collectors.toList());

        //Then
        assertThat(order).containsExactly(QuotaInfo.ROOT_QUOTA_NAME, "org", "team", "app");
    }

    @Test
    void shouldRejectMissingParent() {
        assertThatThrownBy(() -> QuotaTopology.build(List.of(quota("team", "org", false)), 1L))
                .isInstanceOf(QuotaTopologyException.class)
                .hasMessageContaining("parent 'org' does not exist")
                .extracting(e -> ((QuotaTopologyException) e).getQuotaName()).isEqualTo("team");
    }

    @Test
    void shouldRejectParentNotMarkedAsParent() {
        assertThatThrownBy(() -> QuotaTopology.build(List.of(quota("org", "", false), quota("team", "org", false)), 1L))
                .isInstanceOf(QuotaTopologyException.class)
                .hasMessageContaining("is not a parent quota group");
    }

    @Test
    void shouldRejectCycle() {
        assertThatThrownBy(() -> QuotaTopology.build(List.of(quota("a", "b", true), quota("b", "a", true)), 1L))
                .isInstanceOf(QuotaTopologyException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    void shouldRejectDuplicateNames() {
        assertThatThrownBy(() -> QuotaTopology.build(List.of(quota("a", "", false), quota("a", "", false)), 1L))
                .isInstanceOf(QuotaTopologyException.class)
                .hasMessageContaining("more than once");
    }

    @Test
    void shouldRejectRootName() {
        assertThatThrownBy(() -> QuotaTopology.build(List.of(quota(QuotaInfo.ROOT_QUOTA_NAME, "", true)), 1L))
                .isInstanceOf(QuotaTopologyException.class)
                .hasMessageContaining("reserved");
    }

    @Test
    void shouldBuildEmptyTopology() {
        QuotaTopology topology = QuotaTopology.empty(0L);

        assertThat(topology.size()).isZero();
        assertThat(topology.topDown()).containsExactly(topology.getRoot());
    }

    private static QuotaInfo quota(String name, String parentName, boolean isParent) {
        return QuotaInfo.newQuotaInfo(isParent, true, name, parentName);
    }
}
