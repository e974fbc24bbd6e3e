// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.graph.MutableGraph;
import com.google.common.graph.Traverser;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.decompiler.ir.ConditionalJump;
import org.sosy_lab.decompiler.ir.Expression;
import org.sosy_lab.decompiler.ir.Guard;
import org.sosy_lab.decompiler.ir.Jump;
import org.sosy_lab.decompiler.ir.Statement;
import org.sosy_lab.decompiler.ir.UnaryOperation;
import org.sosy_lab.decompiler.ir.UnaryOperation.UnaryOperator;
import org.sosy_lab.decompiler.logic.BooleanFormula;
import org.sosy_lab.decompiler.logic.Formulas;
import org.sosy_lab.decompiler.region.Block;
import org.sosy_lab.decompiler.region.GraphRegion;
import org.sosy_lab.decompiler.region.RegionGraphs;
import org.sosy_lab.decompiler.region.RegionNode;
import org.sosy_lab.decompiler.structuring.nodes.BreakNode;
import org.sosy_lab.decompiler.structuring.nodes.CodeNode;
import org.sosy_lab.decompiler.structuring.nodes.ConditionNode;
import org.sosy_lab.decompiler.structuring.nodes.ConditionalBreakNode;
import org.sosy_lab.decompiler.structuring.nodes.LoopKind;
import org.sosy_lab.decompiler.structuring.nodes.LoopNode;
import org.sosy_lab.decompiler.structuring.nodes.SequenceNode;

/**
 * Structures a cyclic region whose head is the loop header.
 *
 * <p>The loop consists of the strongly connected component of the head, grown by every node that
 * is only entered from the loop. Its successors are the nodes outside the loop that it jumps to. A
 * loop with several successors is given a single one: a chain of condition nodes that dispatches
 * to the original successors, which all exits are redirected to. Inside the body, jumps to the
 * successor become breaks, and the body is structured as an acyclic region. Finally a leading or
 * trailing conditional break turns the endless loop into a while or do-while loop.
 */
final class LoopStructurer {

  /** Address of the condition node chain that replaces several loop successors. */
  static final long SUCCESSOR_CHAIN_ADDRESS = -1;

  private static final class LoopPartition {
    private final ImmutableSet<RegionNode> loopNodes;
    private final ImmutableSet<RegionNode> successors;

    private LoopPartition(Set<RegionNode> pLoopNodes, Set<RegionNode> pSuccessors) {
      loopNodes = ImmutableSet.copyOf(pLoopNodes);
      successors = ImmutableSet.copyOf(pSuccessors);
    }
  }

  private final Structurer structurer;
  private final GraphRegion region;
  private final RegionNode head;
  private final ConditionTranslator translator;
  private final ConditionSimplifier simplifier;
  private final StructurerStatistics stats;

  private MutableGraph<RegionNode> graph;
  private @Nullable ConditionNode successorChain = null;

  LoopStructurer(Structurer pStructurer, GraphRegion pRegion) {
    structurer = pStructurer;
    region = pRegion;
    head = pRegion.getHead();
    translator = pStructurer.getTranslator();
    simplifier = pStructurer.getSimplifier();
    stats = pStructurer.getStatistics();
    graph = RegionGraphs.copyOf(pRegion.getGraph());
  }

  SequenceNode structure() throws StructuringException {
    LoopPartition loop = partition();
    if (loop.successors.size() > 1) {
      refineSuccessors(loop);
      loop = partition();
    }
    if (loop.successors.size() > 1) {
      throw new StructuringException(
          String.format(
              "Loop at 0x%x still has %d successors after refinement: %s",
              head.getAddress(), loop.successors.size(), loop.successors));
    }

    SequenceNode body = makeBody(loop);
    LoopNode loopNode = refine(new LoopNode(LoopKind.ENDLESS, null, body, head.getAddress()));
    stats.loopCreated(loopNode.getKind());

    List<RegionNode> result = new ArrayList<>();
    result.add(loopNode);
    for (RegionNode successor : loop.successors) {
      if (graph.nodes().contains(successor)) {
        result.add(successor);
      }
    }
    return new SequenceNode(result);
  }

  private LoopPartition partition() {
    Set<RegionNode> loopNodes = new LinkedHashSet<>(RegionGraphs.componentOf(graph, head));
    boolean grown = true;
    while (grown) {
      grown = false;
      for (RegionNode node : ImmutableList.copyOf(loopNodes)) {
        for (RegionNode successor : graph.successors(node)) {
          if (!loopNodes.contains(successor)
              && successor != successorChain
              && loopNodes.containsAll(graph.predecessors(successor))) {
            loopNodes.add(successor);
            grown = true;
          }
        }
      }
    }

    Set<RegionNode> successors = new LinkedHashSet<>();
    for (RegionNode node : Traverser.forGraph(graph).breadthFirst(head)) {
      if (loopNodes.contains(node)) {
        for (RegionNode successor : graph.successors(node)) {
          if (!loopNodes.contains(successor)) {
            successors.add(successor);
          }
        }
      }
    }

    // the loop may leave the region, then its successor follows the region in an enclosing one
    GraphRegion current = region;
    GraphRegion parent = structurer.getParentRegion(current);
    while (successors.isEmpty() && parent != null) {
      if (parent.getGraph().nodes().contains(current)) {
        for (RegionNode successor : parent.getGraph().successors(current)) {
          if (successor != current) {
            successors.add(successor);
          }
        }
      }
      current = parent;
      parent = structurer.getParentRegion(current);
    }
    return new LoopPartition(loopNodes, successors);
  }

  /** Redirects every exit of the loop to one chain of condition nodes. */
  private void refineSuccessors(LoopPartition pLoop) throws StructuringException {
    ReachingConditions reachingConditions =
        ReachingConditions.recover(graph, head, translator, simplifier);

    ConditionNode chain = null;
    for (RegionNode successor : pLoop.successors) {
      BooleanFormula condition = reachingConditions.getReachingCondition(successor);
      chain =
          new ConditionNode(
              SUCCESSOR_CHAIN_ADDRESS,
              condition == null ? Formulas.makeTrue() : condition,
              successor,
              chain);
    }

    MutableGraph<RegionNode> refined = RegionGraphs.newGraph();
    for (RegionNode node : graph.nodes()) {
      refined.addNode(node);
    }
    for (RegionNode node : graph.nodes()) {
      for (RegionNode successor : graph.successors(node)) {
        if (pLoop.loopNodes.contains(node) && pLoop.successors.contains(successor)) {
          retarget(node, successor.getAddress());
          refined.putEdge(node, chain);
        } else {
          refined.putEdge(node, successor);
        }
      }
    }
    graph = refined;
    successorChain = chain;
    stats.successorsRefined();
  }

  private void retarget(RegionNode pNode, long pOldTarget) throws StructuringException {
    Statement last = NodeStatements.getLastStatementOrNull(pNode);
    Statement replacement;
    if (last instanceof ConditionalJump) {
      ConditionalJump jump = (ConditionalJump) last;
      if (jump.getTrueTarget() == pOldTarget) {
        replacement = jump.withTrueTarget(SUCCESSOR_CHAIN_ADDRESS);
      } else if (jump.getFalseTarget() == pOldTarget) {
        replacement = jump.withFalseTarget(SUCCESSOR_CHAIN_ADDRESS);
      } else {
        throw new StructuringException(
            String.format("No branch of %s leads to the loop successor 0x%x", jump, pOldTarget));
      }
    } else if (last instanceof Jump && ((Jump) last).getTarget() == pOldTarget) {
      replacement = ((Jump) last).withTarget(SUCCESSOR_CHAIN_ADDRESS);
    } else {
      throw new StructuringException(
          String.format(
              "Cannot redirect the exit of %s to the loop successor 0x%x, last statement is %s",
              pNode, pOldTarget, last));
    }
    NodeStatements.removeLastStatement(pNode);
    NodeStatements.appendStatement(pNode, replacement);
  }

  private SequenceNode makeBody(LoopPartition pLoop) throws StructuringException {
    Set<Long> successorAddresses = new HashSet<>();
    pLoop.successors.forEach(n -> successorAddresses.add(n.getAddress()));
    Set<Long> regionAddresses = new HashSet<>();
    graph.nodes().forEach(n -> regionAddresses.add(n.getAddress()));

    MutableGraph<RegionNode> body = RegionGraphs.newGraph();
    Map<RegionNode, RegionNode> replaced = new HashMap<>();
    RegionNode bodyHead = head;

    Deque<RegionNode> waitlist = new ArrayDeque<>();
    Set<RegionNode> reached = new HashSet<>();
    waitlist.add(head);
    reached.add(head);
    while (!waitlist.isEmpty()) {
      RegionNode node = waitlist.poll();
      body.addNode(node);
      RegionNode current = node;

      Statement last = NodeStatements.getLastStatementOrNull(node);
      boolean exits = false;
      for (long target : NodeStatements.extractJumpTargets(last)) {
        exits |= successorAddresses.contains(target);
      }
      if (exits) {
        BreakNode breakNode = makeBreak(node, last, successorAddresses, regionAddresses);
        stats.breakCreated();
        if (NodeStatements.isEmptyNode(node)) {
          ImmutableList<RegionNode> predecessors = ImmutableList.copyOf(body.predecessors(node));
          body.removeNode(node);
          body.addNode(breakNode);
          for (RegionNode predecessor : predecessors) {
            if (predecessor != node) {
              body.putEdge(predecessor, breakNode);
            }
          }
          replaced.put(node, breakNode);
          if (node == bodyHead) {
            bodyHead = breakNode;
          }
        } else {
          body.putEdge(node, breakNode);
        }
        current = breakNode;
      }

      for (RegionNode successor : graph.successors(node)) {
        if (pLoop.successors.contains(successor)) {
          continue;
        }
        if (!pLoop.loopNodes.contains(successor)) {
          structurer
              .getLogger()
              .log(
                  Level.WARNING,
                  "Node",
                  successor,
                  "belongs neither to the loop at",
                  String.format("0x%x", head.getAddress()),
                  "nor to its successors, ignoring it");
          continue;
        }
        if (successor != head) {
          body.putEdge(current, replaced.getOrDefault(successor, successor));
        }
        if (reached.add(successor)) {
          waitlist.add(successor);
        }
      }
    }

    SequenceNode structuredBody = structurer.structure(new GraphRegion(bodyHead, body));

    Statement last = NodeStatements.getLastStatementOrNull(structuredBody);
    if (last instanceof Jump) {
      if (((Jump) last).getTarget() != head.getAddress()) {
        throw new StructuringException(
            String.format(
                "Body of loop at 0x%x ends with %s instead of a jump back to the loop head",
                head.getAddress(), last));
      }
      NodeStatements.removeLastStatement(structuredBody);
    }
    return removeEmptyNodes(structuredBody);
  }

  /** Turns the transfer of a node that leaves the loop into a (conditional) break. */
  private BreakNode makeBreak(
      RegionNode pNode,
      @Nullable Statement pLast,
      Set<Long> pSuccessorAddresses,
      Set<Long> pRegionAddresses)
      throws StructuringException {
    BreakNode result;
    if (pLast instanceof Jump) {
      Jump jump = (Jump) pLast;
      result = new BreakNode(jump.getInstructionAddress(), jump.getTarget());

    } else if (pLast instanceof ConditionalJump) {
      ConditionalJump jump = (ConditionalJump) pLast;
      boolean trueExits = pSuccessorAddresses.contains(jump.getTrueTarget());
      boolean falseExits = pSuccessorAddresses.contains(jump.getFalseTarget());
      BooleanFormula condition = translator.toFormula(jump.getCondition());
      if (trueExits && falseExits) {
        result = new BreakNode(jump.getInstructionAddress(), jump.getTrueTarget());
      } else if (trueExits && pRegionAddresses.contains(jump.getFalseTarget())) {
        result =
            new ConditionalBreakNode(
                jump.getInstructionAddress(), simplifier.simplify(condition), jump.getTrueTarget());
      } else if (falseExits && pRegionAddresses.contains(jump.getTrueTarget())) {
        result =
            new ConditionalBreakNode(
                jump.getInstructionAddress(),
                simplifier.simplify(Formulas.not(condition)),
                jump.getFalseTarget());
      } else {
        throw new StructuringException(
            String.format(
                "Cannot tell which branch of %s leaves the loop at 0x%x",
                jump, head.getAddress()));
      }

    } else {
      throw new StructuringException("Node " + pNode + " does not end with a jump out of the loop");
    }
    NodeStatements.removeLastStatement(pNode);
    return result;
  }

  private static SequenceNode removeEmptyNodes(SequenceNode pSequence) {
    List<RegionNode> nodes = new ArrayList<>();
    for (RegionNode node : pSequence.getNodes()) {
      if (!isEmpty(node)) {
        nodes.add(node);
      }
    }
    return nodes.size() == pSequence.getNodes().size() ? pSequence : new SequenceNode(nodes);
  }

  /** Blocks without statements or with nothing but a conditional jump, and nodes made of them. */
  private static boolean isEmpty(RegionNode pNode) {
    if (pNode instanceof Block) {
      Block block = (Block) pNode;
      return block.isEmpty()
          || (block.getStatements().size() == 1
              && block.getLastStatement() instanceof ConditionalJump);
    } else if (pNode instanceof CodeNode) {
      return isEmpty(((CodeNode) pNode).getNode());
    } else if (pNode instanceof ConditionNode) {
      ConditionNode condition = (ConditionNode) pNode;
      RegionNode falseNode = condition.getFalseNode();
      return isEmpty(condition.getTrueNode()) && (falseNode == null || isEmpty(falseNode));
    }
    return false;
  }

  /** Derives while and do-while loops from conditional breaks at the start or end of the body. */
  private LoopNode refine(LoopNode pLoop) throws StructuringException {
    LoopNode loop = pLoop;
    while (loop.getKind() == LoopKind.ENDLESS) {
      List<RegionNode> body = flatten(loop.getBody());
      if (body.isEmpty()) {
        break;
      }
      RegionNode first = unwrap(body.get(0));
      RegionNode last = unwrap(body.get(body.size() - 1));
      if (first instanceof ConditionalBreakNode) {
        loop =
            new LoopNode(
                LoopKind.WHILE,
                negate(((ConditionalBreakNode) first).getCondition()),
                new SequenceNode(body.subList(1, body.size())),
                loop.getAddress());
      } else if (last instanceof ConditionalBreakNode) {
        loop =
            new LoopNode(
                LoopKind.DO_WHILE,
                negate(((ConditionalBreakNode) last).getCondition()),
                new SequenceNode(body.subList(0, body.size() - 1)),
                loop.getAddress());
      } else {
        break;
      }
    }
    return loop;
  }

  private static List<RegionNode> flatten(SequenceNode pSequence) {
    List<RegionNode> result = new ArrayList<>();
    for (RegionNode node : pSequence.getNodes()) {
      RegionNode inner = unwrap(node);
      if (inner instanceof SequenceNode) {
        result.addAll(flatten((SequenceNode) inner));
      } else {
        result.add(node);
      }
    }
    return result;
  }

  private static RegionNode unwrap(RegionNode pNode) {
    if (pNode instanceof CodeNode && ((CodeNode) pNode).getReachingCondition() == null) {
      return ((CodeNode) pNode).getNode();
    }
    return pNode;
  }

  private Guard negate(Guard pCondition) throws StructuringException {
    if (pCondition instanceof Expression) {
      Expression expression = (Expression) pCondition;
      if (expression instanceof UnaryOperation
          && ((UnaryOperation) expression).getOperator() == UnaryOperator.LOGICAL_NOT) {
        return ((UnaryOperation) expression).getOperand();
      }
      return UnaryOperation.not(expression);
    }
    return simplifier.simplify(Formulas.not(translator.toFormula(pCondition)));
  }
}
