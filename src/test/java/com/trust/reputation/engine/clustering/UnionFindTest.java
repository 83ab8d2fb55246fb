package com.trust.reputation.engine.clustering;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UnionFindTest {

    @Test
    void union_mergesSetsOnce() {
        UnionFind uf = new UnionFind(4);

        assertThat(uf.union(0, 1)).isTrue();
        assertThat(uf.union(1, 0)).isFalse();
        assertThat(uf.connected(0, 1)).isTrue();
        assertThat(uf.connected(0, 2)).isFalse();
    }

    @Test
    void components_orderedBySmallestMemberAndFilteredBySize() {
        UnionFind uf = new UnionFind(7);
        uf.union(5, 6);
        uf.union(4, 1);
        uf.union(1, 3);

        List<int[]> components = uf.components(2);

        assertThat(components).hasSize(2);
        assertThat(components.get(0)).containsExactly(1, 3, 4);
        assertThat(components.get(1)).containsExactly(5, 6);
        assertThat(uf.components(1)).hasSize(4);
    }

    @Test
    void find_longChainCompressesToOneRoot() {
        UnionFind uf = new UnionFind(1000);
        for (int i = 1; i < 1000; i++) {
            uf.union(i - 1, i);
        }

        int root = uf.find(999);
        for (int i = 0; i < 1000; i++) {
            assertThat(uf.find(i)).isEqualTo(root);
        }
    }
}
