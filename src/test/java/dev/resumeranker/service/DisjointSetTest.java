package dev.resumeranker.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DisjointSetTest {

    @Test
    @DisplayName("Should start with every element in its own set")
    void shouldStartDisjoint() {
        DisjointSet set = new DisjointSet(3);

        assertThat(set.size()).isEqualTo(3);
        assertThat(set.connected(0, 1)).isFalse();
        assertThat(set.find(2)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should connect elements transitively")
    void shouldConnectTransitively() {
        DisjointSet set = new DisjointSet(5);

        assertThat(set.union(0, 1)).isTrue();
        assertThat(set.union(1, 2)).isTrue();

        assertThat(set.connected(0, 2)).isTrue();
        assertThat(set.connected(0, 3)).isFalse();
        assertThat(set.find(0)).isEqualTo(set.find(2));
    }

    @Test
    @DisplayName("Should report false when merging elements already in the same set")
    void shouldRejectRedundantUnion() {
        DisjointSet set = new DisjointSet(3);
        set.union(0, 1);
        set.union(1, 2);

        assertThat(set.union(0, 2)).isFalse();
    }

    @Test
    @DisplayName("Should merge two larger sets into one")
    void shouldMergeSets() {
        DisjointSet set = new DisjointSet(6);
        set.union(0, 1);
        set.union(2, 3);
        set.union(3, 4);

        set.union(1, 4);

        for (int i = 1; i <= 4; i++) {
            assertThat(set.connected(0, i)).isTrue();
        }
        assertThat(set.connected(0, 5)).isFalse();
    }
}
