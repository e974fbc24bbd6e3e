// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring.nodes;

import com.google.common.base.Strings;
import org.sosy_lab.decompiler.ir.Guard;
import org.sosy_lab.decompiler.ir.Statement;
import org.sosy_lab.decompiler.region.Block;
import org.sosy_lab.decompiler.region.GraphRegion;
import org.sosy_lab.decompiler.region.MultiNode;
import org.sosy_lab.decompiler.region.RegionNode;

/** Renders a structured control tree as indented pseudo code. */
public final class ControlNodePrinter implements ControlNodeVisitor<Void, RuntimeException> {

  private static final int INDENT = 2;

  private final StringBuilder sb = new StringBuilder();
  private int indent = 0;

  private ControlNodePrinter() {}

  public static String print(RegionNode pNode) {
    ControlNodePrinter printer = new ControlNodePrinter();
    printer.append(pNode);
    return printer.sb.toString();
  }

  private void append(RegionNode pNode) {
    if (pNode instanceof ControlNode) {
      ((ControlNode) pNode).accept(this);
    } else if (pNode instanceof Block) {
      for (Statement statement : ((Block) pNode).getStatements()) {
        line(statement.toString());
      }
    } else if (pNode instanceof MultiNode) {
      ((MultiNode) pNode).getBlocks().forEach(this::append);
    } else if (pNode instanceof GraphRegion) {
      line("<" + pNode + ">");
    } else {
      line(pNode.toString());
    }
  }

  private void appendIndented(RegionNode pNode) {
    indent += INDENT;
    append(pNode);
    indent -= INDENT;
  }

  private void line(String pLine) {
    sb.append(Strings.repeat(" ", indent)).append(pLine).append('\n');
  }

  /** Render a condition without redundant outer parentheses. */
  private static String condition(Guard pCondition) {
    String text = pCondition.toString();
    if (text.startsWith("(") && text.endsWith(")")) {
      int depth = 0;
      for (int i = 0; i < text.length(); i++) {
        char c = text.charAt(i);
        if (c == '(') {
          depth++;
        } else if (c == ')') {
          depth--;
          if (depth == 0 && i < text.length() - 1) {
            // first parenthesis closes before the end
            return text;
          }
        }
      }
      return text.substring(1, text.length() - 1);
    }
    return text;
  }

  @Override
  public Void visit(SequenceNode pNode) {
    pNode.getNodes().forEach(this::append);
    return null;
  }

  @Override
  public Void visit(CodeNode pNode) {
    Guard reachingCondition = pNode.getReachingCondition();
    if (reachingCondition == null) {
      append(pNode.getNode());
    } else {
      line("if (" + condition(reachingCondition) + ") {");
      appendIndented(pNode.getNode());
      line("}");
    }
    return null;
  }

  @Override
  public Void visit(ConditionNode pNode) {
    line("if (" + condition(pNode.getCondition()) + ") {");
    appendIndented(pNode.getTrueNode());
    RegionNode falseNode = pNode.getFalseNode();
    if (falseNode != null) {
      line("} else {");
      appendIndented(falseNode);
    }
    line("}");
    return null;
  }

  @Override
  public Void visit(LoopNode pNode) {
    Guard loopCondition = pNode.getCondition();
    switch (pNode.getKind()) {
      case ENDLESS:
        line("while (true) {");
        appendIndented(pNode.getBody());
        line("}");
        break;
      case WHILE:
        line("while (" + condition(loopCondition) + ") {");
        appendIndented(pNode.getBody());
        line("}");
        break;
      case DO_WHILE:
        line("do {");
        appendIndented(pNode.getBody());
        line("} while (" + condition(loopCondition) + ");");
        break;
      default:
        throw new AssertionError("unhandled loop kind " + pNode.getKind());
    }
    return null;
  }

  @Override
  public Void visit(BreakNode pNode) {
    line("break;");
    return null;
  }

  @Override
  public Void visit(ConditionalBreakNode pNode) {
    line("if (" + condition(pNode.getCondition()) + ") break;");
    return null;
  }
}
