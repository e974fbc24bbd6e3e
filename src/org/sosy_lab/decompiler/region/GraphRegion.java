// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.region;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.graph.Graph;
import com.google.common.graph.MutableGraph;
import java.util.HashMap;
import java.util.Map;

/**
 * Single-entry region of a control-flow graph: a directed graph over {@link RegionNode}s with a
 * designated head. Regions nest, a node of a region graph may itself be a region.
 *
 * <p>Apart from splicing in the structured result of a sub-region ({@link #replaceRegion}) the
 * graph of a region is not modified.
 */
public final class GraphRegion implements RegionNode {

  private RegionNode head;
  private MutableGraph<RegionNode> graph;

  public GraphRegion(RegionNode pHead, Graph<RegionNode> pGraph) {
    this(pHead, RegionGraphs.copyOf(pGraph), true);
  }

  private GraphRegion(RegionNode pHead, MutableGraph<RegionNode> pGraph, boolean pCheck) {
    checkArgument(
        !pCheck || pGraph.nodes().contains(pHead), "head %s is not part of the region", pHead);
    head = checkNotNull(pHead);
    graph = pGraph;
  }

  public static Builder builder() {
    return new Builder();
  }

  public RegionNode getHead() {
    return head;
  }

  /** The region graph. It must not be modified by callers. */
  public Graph<RegionNode> getGraph() {
    return graph;
  }

  @Override
  public long getAddress() {
    return head.getAddress();
  }

  /**
   * Replaces a nested region by the node that represents its structured form. The new node keeps
   * the position and the edges of the sub-region and becomes the head if the sub-region was.
   */
  public void replaceRegion(GraphRegion pSubRegion, RegionNode pReplacement) {
    checkArgument(
        graph.nodes().contains(pSubRegion), "%s is not a sub-region of %s", pSubRegion, this);
    graph = RegionGraphs.replaceNode(graph, pSubRegion, checkNotNull(pReplacement));
    if (head == pSubRegion) {
      head = pReplacement;
    }
  }

  /**
   * Copies this region together with all nested regions, blocks and multi-nodes, so that the copy
   * can be modified without affecting this region. Structured nodes are shared.
   */
  public GraphRegion recursiveCopy() {
    Map<RegionNode, RegionNode> copies = new HashMap<>();
    MutableGraph<RegionNode> copy = RegionGraphs.newGraph();
    for (RegionNode node : graph.nodes()) {
      RegionNode nodeCopy = copyNode(node);
      copies.put(node, nodeCopy);
      copy.addNode(nodeCopy);
    }
    for (RegionNode node : graph.nodes()) {
      for (RegionNode successor : graph.successors(node)) {
        copy.putEdge(copies.get(node), copies.get(successor));
      }
    }
    return new GraphRegion(copies.get(head), copy, false);
  }

  private static RegionNode copyNode(RegionNode pNode) {
    if (pNode instanceof Block) {
      return ((Block) pNode).copy();
    } else if (pNode instanceof MultiNode) {
      return ((MultiNode) pNode).copy();
    } else if (pNode instanceof GraphRegion) {
      return ((GraphRegion) pNode).recursiveCopy();
    }
    return pNode;
  }

  @Override
  public String toString() {
    return "GraphRegion 0x"
        + Long.toHexString(getAddress())
        + " ("
        + graph.nodes().size()
        + " nodes)";
  }

  /** Collects nodes and edges of a region. Nodes keep the order in which they were added. */
  public static final class Builder {

    private final MutableGraph<RegionNode> graph = RegionGraphs.newGraph();

    private Builder() {}

    public Builder addNode(RegionNode pNode) {
      graph.addNode(pNode);
      return this;
    }

    public Builder addEdge(RegionNode pSource, RegionNode pTarget) {
      graph.putEdge(pSource, pTarget);
      return this;
    }

    public GraphRegion build(RegionNode pHead) {
      return new GraphRegion(pHead, RegionGraphs.copyOf(graph), true);
    }
  }
}
