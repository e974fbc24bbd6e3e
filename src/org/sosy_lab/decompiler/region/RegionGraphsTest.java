// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.region;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableSet;
import com.google.common.graph.MutableGraph;
import org.junit.Test;

public class RegionGraphsTest {

  /** a -> b -> c -> b, c -> d */
  private static MutableGraph<String> loopGraph() {
    MutableGraph<String> graph = RegionGraphs.newGraph();
    graph.putEdge("a", "b");
    graph.putEdge("b", "c");
    graph.putEdge("c", "b");
    graph.putEdge("c", "d");
    return graph;
  }

  @Test
  public void topologicalSortOfDiamond() {
    MutableGraph<String> graph = RegionGraphs.newGraph();
    graph.putEdge("a", "b");
    graph.putEdge("a", "c");
    graph.putEdge("b", "d");
    graph.putEdge("c", "d");

    assertThat(RegionGraphs.topologicalSort(graph)).containsExactly("a", "b", "c", "d").inOrder();
  }

  @Test
  public void topologicalSortRejectsCycles() {
    assertThrows(IllegalArgumentException.class, () -> RegionGraphs.topologicalSort(loopGraph()));
  }

  @Test
  public void stronglyConnectedComponents() {
    MutableGraph<String> graph = loopGraph();

    assertThat(RegionGraphs.stronglyConnectedComponents(graph))
        .containsExactly(ImmutableSet.of("a"), ImmutableSet.of("b", "c"), ImmutableSet.of("d"));
    assertThat(RegionGraphs.componentOf(graph, "c")).containsExactly("b", "c");
    assertThat(RegionGraphs.componentOf(graph, "a")).containsExactly("a");
  }

  @Test
  public void quasiTopologicalSortKeepsComponentsTogether() {
    MutableGraph<String> graph = loopGraph();
    graph.putEdge("a", "d");

    assertThat(RegionGraphs.quasiTopologicalSort(graph, "a"))
        .containsExactly("a", "b", "c", "d")
        .inOrder();
  }

  @Test
  public void quasiTopologicalSortOrdersComponentFromHead() {
    MutableGraph<String> graph = RegionGraphs.newGraph();
    graph.putEdge("h", "x");
    graph.putEdge("x", "y");
    graph.putEdge("y", "h");

    assertThat(RegionGraphs.quasiTopologicalSort(graph, "h"))
        .containsExactly("h", "x", "y")
        .inOrder();
  }

  @Test
  public void replaceNodeKeepsEdgesAndPosition() {
    MutableGraph<String> graph = loopGraph();

    MutableGraph<String> replaced = RegionGraphs.replaceNode(graph, "b", "B");

    assertThat(replaced.nodes()).containsExactly("a", "B", "c", "d").inOrder();
    assertThat(replaced.successors("a")).containsExactly("B");
    assertThat(replaced.successors("c")).containsExactly("B", "d");
    assertThat(replaced.successors("B")).containsExactly("c");
    assertThat(graph.nodes()).contains("b");
  }

  @Test
  public void cycleDetection() {
    assertThat(RegionGraphs.hasCycle(loopGraph())).isTrue();
    MutableGraph<String> selfLoop = RegionGraphs.newGraph();
    selfLoop.putEdge("a", "a");
    assertThat(RegionGraphs.hasCycle(selfLoop)).isTrue();
  }
}
