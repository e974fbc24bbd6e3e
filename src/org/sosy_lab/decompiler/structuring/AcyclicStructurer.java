// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.decompiler.ir.Guard;
import org.sosy_lab.decompiler.logic.AndFormula;
import org.sosy_lab.decompiler.logic.BooleanFormula;
import org.sosy_lab.decompiler.logic.ComparisonFormula;
import org.sosy_lab.decompiler.logic.ComparisonOperator;
import org.sosy_lab.decompiler.logic.Formulas;
import org.sosy_lab.decompiler.logic.NotFormula;
import org.sosy_lab.decompiler.logic.OrFormula;
import org.sosy_lab.decompiler.logic.SatisfiabilityChecker;
import org.sosy_lab.decompiler.region.GraphRegion;
import org.sosy_lab.decompiler.region.RegionGraphs;
import org.sosy_lab.decompiler.region.RegionNode;
import org.sosy_lab.decompiler.structuring.nodes.CodeNode;
import org.sosy_lab.decompiler.structuring.nodes.ConditionNode;
import org.sosy_lab.decompiler.structuring.nodes.ConditionalBreakNode;
import org.sosy_lab.decompiler.structuring.nodes.SequenceNode;

/**
 * Structures an acyclic region.
 *
 * <p>The nodes are put into a sequence in topological order, each guarded by its reaching
 * condition. Adjacent nodes with equivalent conditions are merged, nodes with complementary
 * conditions become the branches of an if-else, and nodes that share a conjunct of their conditions
 * are grouped under it. Every nested sequence created this way is processed the same way. Finally
 * all remaining guards become condition nodes.
 */
final class AcyclicStructurer {

  /** A sequence that is still being rearranged. It never leaves this class. */
  private static final class WorkingSequence implements RegionNode {

    private final List<RegionNode> nodes = new ArrayList<>();

    @Override
    public long getAddress() {
      return nodes.isEmpty() ? NO_ADDRESS : nodes.get(0).getAddress();
    }

    @Override
    public String toString() {
      return "WorkingSequence" + nodes;
    }
  }

  /** A node of a sequence together with its position and the conjuncts of its condition. */
  private static final class GuardedNode {

    private final int position;
    private final CodeNode node;
    private final BooleanFormula condition;
    private final ImmutableList<BooleanFormula> subexpressions;

    private GuardedNode(
        int pPosition,
        CodeNode pNode,
        BooleanFormula pCondition,
        ImmutableList<BooleanFormula> pSubexpressions) {
      position = pPosition;
      node = pNode;
      condition = pCondition;
      subexpressions = pSubexpressions;
    }
  }

  private final Structurer structurer;
  private final GraphRegion region;
  private final ConditionTranslator translator;
  private final ConditionSimplifier simplifier;

  private final Deque<WorkingSequence> pendingSequences = new ArrayDeque<>();

  AcyclicStructurer(Structurer pStructurer, GraphRegion pRegion) {
    structurer = pStructurer;
    region = pRegion;
    translator = pStructurer.getTranslator();
    simplifier = pStructurer.getSimplifier();
  }

  SequenceNode structure() throws StructuringException {
    ReachingConditions reachingConditions =
        ReachingConditions.recover(region.getGraph(), region.getHead(), translator, simplifier);

    WorkingSequence sequence = new WorkingSequence();
    for (RegionNode node : RegionGraphs.topologicalSort(region.getGraph())) {
      sequence.nodes.add(new CodeNode(node, reachingConditions.getReachingCondition(node)));
    }

    pendingSequences.add(sequence);
    while (!pendingSequences.isEmpty()) {
      WorkingSequence current = pendingSequences.poll();
      mergeSameConditionedNodes(current);
      structureIfElse(current);
      groupByCommonSubexpressions(current);
    }

    SequenceNode result = makeConditionNodes(sequence);
    if (structurer.getOptions().mergeConditionalBreaks()) {
      result = mergeConditionalBreaks(result);
    }
    return result;
  }

  private @Nullable BooleanFormula conditionOf(RegionNode pNode) throws StructuringException {
    if (pNode instanceof CodeNode) {
      Guard condition = ((CodeNode) pNode).getReachingCondition();
      if (condition != null) {
        return translator.toFormula(condition);
      }
    }
    return null;
  }

  private static boolean isTrue(@Nullable Guard pCondition) {
    return pCondition instanceof BooleanFormula && Formulas.isTrue((BooleanFormula) pCondition);
  }

  private static WorkingSequence concatenate(RegionNode pFirst, RegionNode pSecond) {
    WorkingSequence result = new WorkingSequence();
    for (RegionNode node : ImmutableList.of(pFirst, pSecond)) {
      if (node instanceof WorkingSequence) {
        result.nodes.addAll(((WorkingSequence) node).nodes);
      } else if (node instanceof SequenceNode) {
        result.nodes.addAll(((SequenceNode) node).getNodes());
      } else {
        result.nodes.add(node);
      }
    }
    return result;
  }

  private void mergeSameConditionedNodes(WorkingSequence pSequence) throws StructuringException {
    List<RegionNode> nodes = pSequence.nodes;
    boolean merged = true;
    while (merged) {
      merged = false;
      for (int i = 0; i + 1 < nodes.size(); i++) {
        BooleanFormula first = conditionOf(nodes.get(i));
        BooleanFormula second = conditionOf(nodes.get(i + 1));
        if (first != null
            && second != null
            && SatisfiabilityChecker.isEquivalent(first, second)) {
          RegionNode mergedNode =
              concatenate(
                  ((CodeNode) nodes.get(i)).getNode(), ((CodeNode) nodes.get(i + 1)).getNode());
          nodes.set(i, new CodeNode(mergedNode, first));
          nodes.remove(i + 1);
          merged = true;
          break;
        }
      }
    }
  }

  /** Conditions that are negations are preferably put into the else branch. */
  private static boolean isNegative(BooleanFormula pCondition) {
    return pCondition instanceof NotFormula
        || (pCondition instanceof ComparisonFormula
            && ((ComparisonFormula) pCondition).getOperator() == ComparisonOperator.NOT_EQUAL);
  }

  private void structureIfElse(WorkingSequence pSequence) throws StructuringException {
    boolean structured = true;
    while (structured) {
      structured = false;
      CodeNode first = null;
      CodeNode second = null;
      search:
      for (RegionNode node0 : pSequence.nodes) {
        BooleanFormula condition0 = conditionOf(node0);
        if (condition0 == null || Formulas.isTrue(condition0)) {
          continue;
        }
        for (RegionNode node1 : pSequence.nodes) {
          BooleanFormula condition1 = conditionOf(node1);
          if (node1 == node0 || condition1 == null) {
            continue;
          }
          if (SatisfiabilityChecker.isComplement(condition0, condition1)) {
            first = (CodeNode) node0;
            second = (CodeNode) node1;
            break search;
          }
        }
      }
      if (first != null && second != null) {
        makeIfElse(pSequence, first, second);
        structured = true;
      }
    }
  }

  private void makeIfElse(WorkingSequence pSequence, CodeNode pFirst, CodeNode pSecond)
      throws StructuringException {
    CodeNode node0 = pFirst;
    CodeNode node1 = pSecond;
    BooleanFormula condition0 = conditionOf(node0);
    BooleanFormula condition1 = conditionOf(node1);
    if (isNegative(condition0) && !isNegative(condition1)) {
      node0 = pSecond;
      node1 = pFirst;
      condition0 = conditionOf(node0);
      condition1 = conditionOf(node1);
    }
    List<RegionNode> nodes = pSequence.nodes;
    int position0 = nodes.indexOf(node0);
    int position1 = nodes.indexOf(node1);

    List<GuardedNode> trueNodes = new ArrayList<>();
    trueNodes.add(
        new GuardedNode(position0, node0, condition0, ImmutableList.of(condition0)));
    for (GuardedNode candidate : nodesGuardedBy(pSequence, condition0, position0 + 1)) {
      if (candidate.position != position1) {
        trueNodes.add(candidate);
      }
    }
    List<GuardedNode> falseNodes = new ArrayList<>();
    falseNodes.add(
        new GuardedNode(position1, node1, condition1, ImmutableList.of(condition1)));
    for (GuardedNode candidate : nodesGuardedBy(pSequence, condition1, position1 + 1)) {
      if (candidate.position != position0) {
        falseNodes.add(candidate);
      }
    }

    CodeNode trueBranch = groupUnder(condition0, trueNodes);
    CodeNode falseBranch = groupUnder(condition1, falseNodes);

    Set<Integer> removed = new HashSet<>();
    trueNodes.forEach(n -> removed.add(n.position));
    falseNodes.forEach(n -> removed.add(n.position));
    int insertAt = Math.max(position0, position1);
    ConditionNode conditionNode =
        new ConditionNode(
            nodes.get(Math.min(position0, position1)).getAddress(),
            condition0,
            trueBranch,
            falseBranch);

    List<RegionNode> rearranged = new ArrayList<>();
    for (int i = 0; i < nodes.size(); i++) {
      if (i == insertAt) {
        rearranged.add(conditionNode);
      }
      if (!removed.contains(i)) {
        rearranged.add(nodes.get(i));
      }
    }
    nodes.clear();
    nodes.addAll(rearranged);
  }

  /**
   * Groups a child with all later children that share a conjunct of its condition. Children whose
   * condition is a disjunction do not take part: every grouped condition loses the shared conjunct,
   * so nested groups have strictly smaller conditions.
   */
  private void groupByCommonSubexpressions(WorkingSequence pSequence)
      throws StructuringException {
    List<RegionNode> nodes = pSequence.nodes;
    int i = 0;
    while (i + 1 < nodes.size()) {
      boolean grouped = false;
      BooleanFormula condition = conditionOf(nodes.get(i));
      if (condition != null && !(condition instanceof OrFormula)) {
        ImmutableList<BooleanFormula> subexpressions = subexpressionsOf(condition);
        for (BooleanFormula common : subexpressions) {
          List<GuardedNode> candidates = new ArrayList<>();
          for (GuardedNode candidate : nodesGuardedBy(pSequence, common, i + 1)) {
            if (!(candidate.condition instanceof OrFormula)) {
              candidates.add(candidate);
            }
          }
          if (candidates.isEmpty()) {
            continue;
          }
          candidates.add(
              0, new GuardedNode(i, (CodeNode) nodes.get(i), condition, subexpressions));
          CodeNode group = groupUnder(common, candidates);

          Set<Integer> removed = new HashSet<>();
          candidates.forEach(n -> removed.add(n.position));
          List<RegionNode> rearranged = new ArrayList<>();
          for (int j = 0; j < nodes.size(); j++) {
            if (j == i) {
              rearranged.add(group);
            } else if (!removed.contains(j)) {
              rearranged.add(nodes.get(j));
            }
          }
          nodes.clear();
          nodes.addAll(rearranged);
          grouped = true;
          break;
        }
      }
      if (!grouped) {
        i++;
      }
    }
  }

  /**
   * Conjuncts of a condition. Of a disjunction, only the conjuncts shared by its first two
   * operands are returned.
   */
  private static ImmutableList<BooleanFormula> subexpressionsOf(BooleanFormula pCondition) {
    Set<BooleanFormula> result = new LinkedHashSet<>();
    Deque<BooleanFormula> waitlist = new ArrayDeque<>();
    waitlist.add(pCondition);
    while (!waitlist.isEmpty()) {
      BooleanFormula current = waitlist.poll();
      if (current instanceof AndFormula) {
        waitlist.addAll(((AndFormula) current).getOperands());
      } else if (current instanceof OrFormula) {
        List<BooleanFormula> operands = ((OrFormula) current).getOperands();
        Set<BooleanFormula> shared = new LinkedHashSet<>(subexpressionsOf(operands.get(0)));
        shared.retainAll(subexpressionsOf(operands.get(1)));
        result.addAll(shared);
      } else {
        result.add(current);
      }
    }
    return ImmutableList.copyOf(result);
  }

  /** Nodes from the given position on whose condition contains the given conjunct. */
  private List<GuardedNode> nodesGuardedBy(
      WorkingSequence pSequence, BooleanFormula pConjunct, int pStart)
      throws StructuringException {
    List<GuardedNode> result = new ArrayList<>();
    if (Formulas.isTrue(pConjunct)) {
      return result;
    }
    for (int i = pStart; i < pSequence.nodes.size(); i++) {
      RegionNode node = pSequence.nodes.get(i);
      BooleanFormula condition = conditionOf(node);
      if (condition == null) {
        continue;
      }
      ImmutableList<BooleanFormula> subexpressions = subexpressionsOf(condition);
      if (subexpressions.contains(pConjunct)) {
        result.add(new GuardedNode(i, (CodeNode) node, condition, subexpressions));
      }
    }
    return result;
  }

  /**
   * Puts the nodes into a new sequence guarded by the common conjunct. Each node keeps the rest of
   * its condition. The new sequence is scheduled for structuring.
   */
  private CodeNode groupUnder(BooleanFormula pCommon, List<GuardedNode> pNodes) {
    WorkingSequence group = new WorkingSequence();
    for (GuardedNode guarded : pNodes) {
      BooleanFormula remaining;
      if (guarded.condition instanceof OrFormula) {
        remaining = guarded.condition;
      } else {
        List<BooleanFormula> rest = new ArrayList<>(guarded.subexpressions);
        rest.remove(pCommon);
        remaining = Formulas.and(rest);
      }
      group.nodes.add(new CodeNode(guarded.node.getNode(), remaining));
    }
    pendingSequences.add(group);
    return new CodeNode(group, pCommon);
  }

  private SequenceNode makeConditionNodes(WorkingSequence pSequence)
      throws StructuringException {
    List<RegionNode> result = new ArrayList<>(pSequence.nodes.size());
    for (RegionNode node : pSequence.nodes) {
      result.add(makeConditionNode(node));
    }
    return new SequenceNode(result);
  }

  private RegionNode makeConditionNode(RegionNode pNode) throws StructuringException {
    if (pNode instanceof WorkingSequence) {
      return makeConditionNodes((WorkingSequence) pNode);

    } else if (pNode instanceof CodeNode) {
      CodeNode code = (CodeNode) pNode;
      RegionNode inner = code.getNode();
      if (inner instanceof WorkingSequence) {
        inner = makeConditionNodes((WorkingSequence) inner);
      }
      Guard condition = code.getReachingCondition();
      if (condition == null || isTrue(condition)) {
        return new CodeNode(inner, null);
      }
      BooleanFormula formula = translator.toFormula(condition);
      if (inner instanceof ConditionalBreakNode) {
        ConditionalBreakNode breakNode = (ConditionalBreakNode) inner;
        BooleanFormula breakCondition =
            simplifier.simplify(
                Formulas.and(formula, translator.toFormula(breakNode.getCondition())));
        return new CodeNode(
            new ConditionalBreakNode(breakNode.getAddress(), breakCondition, breakNode.getTarget()),
            null);
      }
      return new ConditionNode(code.getAddress(), formula, new CodeNode(inner, null), null);

    } else if (pNode instanceof ConditionNode) {
      ConditionNode conditionNode = (ConditionNode) pNode;
      RegionNode falseNode = conditionNode.getFalseNode();
      return new ConditionNode(
          conditionNode.getAddress(),
          conditionNode.getCondition(),
          makeBranch(conditionNode.getTrueNode()),
          falseNode == null ? null : makeBranch(falseNode));
    }
    return pNode;
  }

  /** Branches drop the guard that the condition node already checks. */
  private RegionNode makeBranch(RegionNode pBranch) throws StructuringException {
    if (pBranch instanceof CodeNode && ((CodeNode) pBranch).getNode() instanceof WorkingSequence) {
      SequenceNode sequence = makeConditionNodes((WorkingSequence) ((CodeNode) pBranch).getNode());
      if (sequence.getNodes().size() == 1) {
        return sequence.getNodes().get(0);
      }
      return new CodeNode(sequence, null);
    }
    return makeConditionNode(pBranch);
  }

  private static RegionNode unwrap(RegionNode pNode) {
    if (pNode instanceof CodeNode && ((CodeNode) pNode).getReachingCondition() == null) {
      return ((CodeNode) pNode).getNode();
    }
    return pNode;
  }

  private static RegionNode rewrap(RegionNode pOriginal, RegionNode pReplacement) {
    if (pOriginal instanceof CodeNode && ((CodeNode) pOriginal).getReachingCondition() == null) {
      return new CodeNode(pReplacement, null);
    }
    return pReplacement;
  }

  /** Replaces adjacent conditional breaks to the same target by one break on the disjunction. */
  private SequenceNode mergeConditionalBreaks(SequenceNode pSequence)
      throws StructuringException {
    List<RegionNode> result = new ArrayList<>();
    for (RegionNode child : pSequence.getNodes()) {
      result.add(mergeConditionalBreaks(child, result));
    }
    return new SequenceNode(result);
  }

  private RegionNode mergeConditionalBreaks(RegionNode pChild, List<RegionNode> pPrevious)
      throws StructuringException {
    RegionNode node = unwrap(pChild);
    if (node instanceof SequenceNode) {
      return rewrap(pChild, mergeConditionalBreaks((SequenceNode) node));

    } else if (node instanceof ConditionNode) {
      ConditionNode conditionNode = (ConditionNode) node;
      RegionNode falseNode = conditionNode.getFalseNode();
      return rewrap(
          pChild,
          new ConditionNode(
              conditionNode.getAddress(),
              conditionNode.getCondition(),
              mergeConditionalBreaksIn(conditionNode.getTrueNode()),
              falseNode == null ? null : mergeConditionalBreaksIn(falseNode)));

    } else if (node instanceof ConditionalBreakNode && !pPrevious.isEmpty()) {
      ConditionalBreakNode breakNode = (ConditionalBreakNode) node;
      RegionNode previous = unwrap(pPrevious.get(pPrevious.size() - 1));
      if (previous instanceof ConditionalBreakNode
          && ((ConditionalBreakNode) previous).getTarget() == breakNode.getTarget()) {
        pPrevious.remove(pPrevious.size() - 1);
        BooleanFormula condition =
            simplifier.simplify(
                Formulas.or(
                    translator.toFormula(breakNode.getCondition()),
                    translator.toFormula(((ConditionalBreakNode) previous).getCondition())));
        return rewrap(
            pChild,
            new ConditionalBreakNode(breakNode.getAddress(), condition, breakNode.getTarget()));
      }
    }
    return pChild;
  }

  private RegionNode mergeConditionalBreaksIn(RegionNode pBranch) throws StructuringException {
    RegionNode node = unwrap(pBranch);
    if (node instanceof SequenceNode) {
      return rewrap(pBranch, mergeConditionalBreaks((SequenceNode) node));
    }
    return pBranch;
  }
}
