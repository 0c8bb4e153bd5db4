package com.starscape.phototriage.features.grouping.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DisjointSetTest {
    
    @Test
    @DisplayName("union reports whether two sets were merged")
    void union() {
        DisjointSet set = new DisjointSet(4);
        
        assertThat(set.union(0, 1)).isTrue();
        assertThat(set.union(1, 0)).isFalse();
        assertThat(set.connected(0, 1)).isTrue();
        assertThat(set.connected(0, 2)).isFalse();
        assertThat(set.sizeOf(1)).isEqualTo(2);
    }
    
    @Test
    @DisplayName("sets are listed by smallest member with members ascending")
    void setsAreOrdered() {
        DisjointSet set = new DisjointSet(6);
        set.union(5, 1);
        set.union(3, 4);
        set.union(4, 1);
        set.union(0, 2);
        
        List<int[]> sets = set.sets(2);
        
        assertThat(sets).hasSize(2);
        assertThat(sets.get(0)).containsExactly(0, 2);
        assertThat(sets.get(1)).containsExactly(1, 3, 4, 5);
    }
    
    @Test
    @DisplayName("singletons are left out when a minimum size is asked for")
    void minSize() {
        DisjointSet set = new DisjointSet(3);
        set.union(0, 1);
        
        assertThat(set.sets(2)).hasSize(1);
        assertThat(set.sets(1)).hasSize(2);
    }
}
