// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.decompiler.ir.Expression;
import org.sosy_lab.decompiler.ir.Guard;
import org.sosy_lab.decompiler.logic.BooleanFormula;
import org.sosy_lab.decompiler.logic.Formulas;
import org.sosy_lab.decompiler.region.RegionNode;
import org.sosy_lab.decompiler.structuring.nodes.BreakNode;
import org.sosy_lab.decompiler.structuring.nodes.CodeNode;
import org.sosy_lab.decompiler.structuring.nodes.ConditionNode;
import org.sosy_lab.decompiler.structuring.nodes.ConditionalBreakNode;
import org.sosy_lab.decompiler.structuring.nodes.ControlNode;
import org.sosy_lab.decompiler.structuring.nodes.ControlNodeVisitor;
import org.sosy_lab.decompiler.structuring.nodes.LoopNode;
import org.sosy_lab.decompiler.structuring.nodes.SequenceNode;

/**
 * Rebuilds a structured tree with all conditions given as native expressions. Reaching conditions
 * that are trivially true are dropped.
 */
final class NodeConditionTranslator
    implements ControlNodeVisitor<ControlNode, StructuringException> {

  private final ConditionTranslator translator;

  NodeConditionTranslator(ConditionTranslator pTranslator) {
    translator = checkNotNull(pTranslator);
  }

  SequenceNode translate(SequenceNode pNode) throws StructuringException {
    return visit(pNode);
  }

  private RegionNode translate(RegionNode pNode) throws StructuringException {
    if (pNode instanceof ControlNode) {
      return ((ControlNode) pNode).accept(this);
    }
    return pNode;
  }

  private @Nullable Expression reachingCondition(@Nullable Guard pCondition)
      throws StructuringException {
    if (pCondition == null
        || (pCondition instanceof BooleanFormula && Formulas.isTrue((BooleanFormula) pCondition))) {
      return null;
    }
    return translator.toExpression(pCondition);
  }

  @Override
  public SequenceNode visit(SequenceNode pNode) throws StructuringException {
    List<RegionNode> nodes = new ArrayList<>(pNode.getNodes().size());
    for (RegionNode node : pNode.getNodes()) {
      nodes.add(translate(node));
    }
    return new SequenceNode(nodes);
  }

  @Override
  public ControlNode visit(CodeNode pNode) throws StructuringException {
    return new CodeNode(
        translate(pNode.getNode()), reachingCondition(pNode.getReachingCondition()));
  }

  @Override
  public ControlNode visit(ConditionNode pNode) throws StructuringException {
    RegionNode falseNode = pNode.getFalseNode();
    return new ConditionNode(
        pNode.getAddress(),
        translator.toExpression(pNode.getCondition()),
        translate(pNode.getTrueNode()),
        falseNode == null ? null : translate(falseNode));
  }

  @Override
  public ControlNode visit(LoopNode pNode) throws StructuringException {
    Guard condition = pNode.getCondition();
    return new LoopNode(
        pNode.getKind(),
        condition == null ? null : translator.toExpression(condition),
        visit(pNode.getBody()),
        pNode.getAddress());
  }

  @Override
  public ControlNode visit(BreakNode pNode) {
    return pNode;
  }

  @Override
  public ControlNode visit(ConditionalBreakNode pNode) throws StructuringException {
    return new ConditionalBreakNode(
        pNode.getAddress(), translator.toExpression(pNode.getCondition()), pNode.getTarget());
  }
}
