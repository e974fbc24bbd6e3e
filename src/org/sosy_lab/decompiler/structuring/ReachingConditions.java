// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import com.google.common.collect.ImmutableMap;
import com.google.common.graph.EndpointPair;
import com.google.common.graph.Graph;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.decompiler.ir.ConditionalJump;
import org.sosy_lab.decompiler.ir.Statement;
import org.sosy_lab.decompiler.logic.BooleanFormula;
import org.sosy_lab.decompiler.logic.Formulas;
import org.sosy_lab.decompiler.region.GraphRegion;
import org.sosy_lab.decompiler.region.RegionGraphs;
import org.sosy_lab.decompiler.region.RegionNode;
import org.sosy_lab.decompiler.structuring.nodes.ConditionalBreakNode;

/**
 * Conditions on the edges of a region graph and, derived from them, the condition under which each
 * node is reached from the head.
 *
 * <p>Nodes are visited in quasi-topological order. Predecessors that come later in this order (the
 * sources of back edges) contribute with reaching condition true.
 */
final class ReachingConditions {

  private final ImmutableMap<RegionNode, BooleanFormula> reachingConditions;
  private final ImmutableMap<EndpointPair<RegionNode>, BooleanFormula> edgeConditions;

  private ReachingConditions(
      Map<RegionNode, BooleanFormula> pReachingConditions,
      Map<EndpointPair<RegionNode>, BooleanFormula> pEdgeConditions) {
    reachingConditions = ImmutableMap.copyOf(pReachingConditions);
    edgeConditions = ImmutableMap.copyOf(pEdgeConditions);
  }

  static ReachingConditions recover(
      Graph<RegionNode> pGraph,
      RegionNode pHead,
      ConditionTranslator pTranslator,
      ConditionSimplifier pSimplifier)
      throws StructuringException {
    Map<RegionNode, BooleanFormula> reachingConditions = new HashMap<>();
    Map<EndpointPair<RegionNode>, BooleanFormula> edgeConditions = new HashMap<>();

    for (RegionNode node : RegionGraphs.quasiTopologicalSort(pGraph, pHead)) {
      if (node == pHead) {
        reachingConditions.put(node, Formulas.makeTrue());
        continue;
      }
      List<BooleanFormula> incoming = new ArrayList<>();
      for (RegionNode predecessor : pGraph.predecessors(node)) {
        BooleanFormula edgeCondition = edgeCondition(predecessor, node, pTranslator);
        edgeConditions.put(EndpointPair.ordered(predecessor, node), edgeCondition);
        BooleanFormula predecessorCondition =
            reachingConditions.getOrDefault(predecessor, Formulas.makeTrue());
        incoming.add(Formulas.and(predecessorCondition, edgeCondition));
      }
      if (!incoming.isEmpty()) {
        reachingConditions.put(node, pSimplifier.simplify(Formulas.or(incoming)));
      }
    }
    return new ReachingConditions(reachingConditions, edgeConditions);
  }

  /** Condition under which control flows from the source to the destination. */
  static BooleanFormula edgeCondition(
      RegionNode pSource, RegionNode pDestination, ConditionTranslator pTranslator)
      throws StructuringException {
    if (pSource instanceof ConditionalBreakNode) {
      ConditionalBreakNode breakNode = (ConditionalBreakNode) pSource;
      BooleanFormula condition = pTranslator.toFormula(breakNode.getCondition());
      return breakNode.getTarget() == pDestination.getAddress()
          ? condition
          : Formulas.not(condition);
    }
    if (pSource instanceof GraphRegion) {
      return Formulas.makeTrue();
    }

    Statement last = NodeStatements.getLastStatementOrNull(pSource);
    if (last instanceof ConditionalJump) {
      ConditionalJump jump = (ConditionalJump) last;
      BooleanFormula condition = pTranslator.toFormula(jump.getCondition());
      return jump.getTrueTarget() == pDestination.getAddress()
          ? condition
          : Formulas.not(condition);
    }
    return Formulas.makeTrue();
  }

  /** The reaching condition, or null for nodes that are not reachable from the head. */
  @Nullable BooleanFormula getReachingCondition(RegionNode pNode) {
    return reachingConditions.get(pNode);
  }

  @Nullable BooleanFormula getEdgeCondition(RegionNode pSource, RegionNode pDestination) {
    return edgeConditions.get(EndpointPair.ordered(pSource, pDestination));
  }
}
