// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.region;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.graph.ElementOrder;
import com.google.common.graph.Graph;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.MutableGraph;
import com.google.common.graph.Traverser;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Graph algorithms on region graphs. All orders are deterministic for a given insertion order. */
public final class RegionGraphs {

  private RegionGraphs() {}

  /**
   * Creates an empty directed graph that allows self loops and keeps nodes and successors in
   * insertion order.
   */
  public static <N> MutableGraph<N> newGraph() {
    return GraphBuilder.directed()
        .allowsSelfLoops(true)
        .nodeOrder(ElementOrder.insertion())
        .incidentEdgeOrder(ElementOrder.stable())
        .build();
  }

  public static <N> MutableGraph<N> copyOf(Graph<N> pGraph) {
    MutableGraph<N> copy = newGraph();
    for (N node : pGraph.nodes()) {
      copy.addNode(node);
    }
    for (N node : pGraph.nodes()) {
      for (N successor : pGraph.successors(node)) {
        copy.putEdge(node, successor);
      }
    }
    return copy;
  }

  /**
   * Returns a copy of the graph in which one node is replaced by another one. The replacement takes
   * the position of the old node in the node order and inherits all its edges.
   */
  public static <N> MutableGraph<N> replaceNode(Graph<N> pGraph, N pOld, N pReplacement) {
    checkArgument(pGraph.nodes().contains(pOld), "%s is not part of the graph", pOld);
    MutableGraph<N> result = newGraph();
    for (N node : pGraph.nodes()) {
      result.addNode(node == pOld ? pReplacement : node);
    }
    for (N node : pGraph.nodes()) {
      for (N successor : pGraph.successors(node)) {
        result.putEdge(
            node == pOld ? pReplacement : node, successor == pOld ? pReplacement : successor);
      }
    }
    return result;
  }

  public static boolean hasCycle(Graph<?> pGraph) {
    return Graphs.hasCycle(pGraph);
  }

  /**
   * Topological order of an acyclic graph. Among nodes that are ready at the same time, the one
   * that became ready first comes first.
   *
   * @throws IllegalArgumentException if the graph has a cycle
   */
  public static <N> ImmutableList<N> topologicalSort(Graph<N> pGraph) {
    Map<N, Integer> inDegree = new HashMap<>();
    Deque<N> ready = new ArrayDeque<>();
    for (N node : pGraph.nodes()) {
      int degree = pGraph.inDegree(node);
      inDegree.put(node, degree);
      if (degree == 0) {
        ready.add(node);
      }
    }

    ImmutableList.Builder<N> result = ImmutableList.builderWithExpectedSize(inDegree.size());
    int count = 0;
    while (!ready.isEmpty()) {
      N node = ready.poll();
      result.add(node);
      count++;
      for (N successor : pGraph.successors(node)) {
        int degree = inDegree.merge(successor, -1, Integer::sum);
        if (degree == 0) {
          ready.add(successor);
        }
      }
    }
    checkArgument(count == pGraph.nodes().size(), "graph has a cycle");
    return result.build();
  }

  /**
   * Strongly connected components in the order Tarjan's algorithm finishes them, i.e., every
   * component comes before all components that can reach it.
   */
  public static <N> ImmutableList<ImmutableSet<N>> stronglyConnectedComponents(Graph<N> pGraph) {
    Tarjan<N> tarjan = new Tarjan<>(pGraph);
    tarjan.run();
    return ImmutableList.copyOf(tarjan.components);
  }

  /** The strongly connected component that contains the given node. */
  public static <N> ImmutableSet<N> componentOf(Graph<N> pGraph, N pNode) {
    checkArgument(pGraph.nodes().contains(pNode), "%s is not part of the graph", pNode);
    for (ImmutableSet<N> component : stronglyConnectedComponents(pGraph)) {
      if (component.contains(pNode)) {
        return component;
      }
    }
    throw new AssertionError("node " + pNode + " without component");
  }

  /**
   * Order for graphs with cycles: strongly connected components are ordered topologically, nodes
   * within one component by their reverse postorder from the head. For acyclic graphs this is a
   * topological order.
   */
  public static <N> ImmutableList<N> quasiTopologicalSort(Graph<N> pGraph, N pHead) {
    checkArgument(pGraph.nodes().contains(pHead), "%s is not part of the graph", pHead);

    Map<N, Integer> position = new HashMap<>();
    ImmutableList<N> postorder =
        ImmutableList.copyOf(Traverser.forGraph(pGraph).depthFirstPostOrder(pHead));
    for (N node : Lists.reverse(postorder)) {
      position.put(node, position.size());
    }
    for (N node : pGraph.nodes()) {
      position.putIfAbsent(node, position.size());
    }

    ImmutableList<ImmutableSet<N>> components = stronglyConnectedComponents(pGraph);
    Map<N, Integer> componentIndex = new HashMap<>();
    for (int i = 0; i < components.size(); i++) {
      for (N node : components.get(i)) {
        componentIndex.put(node, i);
      }
    }

    List<Set<Integer>> condensed = new ArrayList<>(components.size());
    int[] inDegree = new int[components.size()];
    for (int i = 0; i < components.size(); i++) {
      condensed.add(new LinkedHashSet<>());
    }
    for (N node : pGraph.nodes()) {
      int from = componentIndex.get(node);
      for (N successor : pGraph.successors(node)) {
        int to = componentIndex.get(successor);
        if (from != to && condensed.get(from).add(to)) {
          inDegree[to]++;
        }
      }
    }

    Comparator<N> byPosition = Comparator.comparing(position::get);
    int[] firstPosition = new int[components.size()];
    List<Integer> roots = new ArrayList<>();
    for (int i = 0; i < components.size(); i++) {
      firstPosition[i] = Integer.MAX_VALUE;
      for (N node : components.get(i)) {
        firstPosition[i] = Math.min(firstPosition[i], position.get(node));
      }
      if (inDegree[i] == 0) {
        roots.add(i);
      }
    }
    roots.sort(Comparator.comparingInt(i -> firstPosition[i]));

    Deque<Integer> ready = new ArrayDeque<>(roots);
    ImmutableList.Builder<N> result = ImmutableList.builder();
    while (!ready.isEmpty()) {
      int component = ready.poll();
      List<N> nodes = new ArrayList<>(components.get(component));
      nodes.sort(byPosition);
      result.addAll(nodes);
      for (int successor : condensed.get(component)) {
        if (--inDegree[successor] == 0) {
          ready.add(successor);
        }
      }
    }
    return result.build();
  }

  private static final class Tarjan<N> {
    private final Graph<N> graph;
    private final Map<N, Integer> index = new HashMap<>();
    private final Map<N, Integer> lowlink = new HashMap<>();
    private final Deque<N> stack = new ArrayDeque<>();
    private final Set<N> onStack = new HashSet<>();
    private final List<ImmutableSet<N>> components = new ArrayList<>();

    private Tarjan(Graph<N> pGraph) {
      graph = pGraph;
    }

    private void run() {
      for (N node : graph.nodes()) {
        if (!index.containsKey(node)) {
          strongConnect(node);
        }
      }
    }

    private void strongConnect(N pNode) {
      index.put(pNode, index.size());
      lowlink.put(pNode, index.get(pNode));
      stack.push(pNode);
      onStack.add(pNode);

      for (N successor : graph.successors(pNode)) {
        if (!index.containsKey(successor)) {
          strongConnect(successor);
          lowlink.put(pNode, Math.min(lowlink.get(pNode), lowlink.get(successor)));
        } else if (onStack.contains(successor)) {
          lowlink.put(pNode, Math.min(lowlink.get(pNode), index.get(successor)));
        }
      }

      if (lowlink.get(pNode).equals(index.get(pNode))) {
        ImmutableSet.Builder<N> component = ImmutableSet.builder();
        N member;
        do {
          member = stack.pop();
          onStack.remove(member);
          component.add(member);
        } while (member != pNode);
        components.add(component.build());
      }
    }
  }
}
