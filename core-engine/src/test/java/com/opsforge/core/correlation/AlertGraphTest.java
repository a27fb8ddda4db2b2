package com.opsforge.core.correlation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AlertGraph}.
 */
class AlertGraphTest {

    @Test
    @DisplayName("Should find connected components including isolated nodes")
    void shouldFindComponents() {
        AlertGraph graph = new AlertGraph(5);
        graph.addEdge(0, 2);
        graph.addEdge(2, 4);

        assertThat(graph.edgeCount()).isEqualTo(2);
        assertThat(graph.hasEdge(4, 2)).isTrue();
        assertThat(graph.connectedComponents())
                .containsExactlyInAnyOrder(List.of(0, 2, 4), List.of(1), List.of(3));
    }
}
