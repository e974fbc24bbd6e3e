// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.decompiler.ir.ConditionalJump;
import org.sosy_lab.decompiler.ir.Jump;
import org.sosy_lab.decompiler.ir.Statement;
import org.sosy_lab.decompiler.region.Block;
import org.sosy_lab.decompiler.region.MultiNode;
import org.sosy_lab.decompiler.region.RegionNode;
import org.sosy_lab.decompiler.structuring.nodes.CodeNode;
import org.sosy_lab.decompiler.structuring.nodes.LoopNode;
import org.sosy_lab.decompiler.structuring.nodes.SequenceNode;

/** Access to the trailing statement of blocks and of structured nodes that end in a block. */
final class NodeStatements {

  private NodeStatements() {}

  /**
   * Returns the statement that is executed last in the given node, or null if the node does not end
   * in straight-line code.
   *
   * @throws EmptyBlockException if the node ends in a block without statements
   */
  static @Nullable Statement getLastStatement(RegionNode pNode) throws EmptyBlockException {
    if (pNode instanceof Block) {
      Block block = (Block) pNode;
      if (block.isEmpty()) {
        throw new EmptyBlockException(block);
      }
      return block.getLastStatement();
    } else if (pNode instanceof MultiNode) {
      for (Block block : ((MultiNode) pNode).getBlocks().reverse()) {
        if (!block.isEmpty()) {
          return block.getLastStatement();
        }
      }
      return null;
    } else if (pNode instanceof SequenceNode) {
      List<RegionNode> nodes = ((SequenceNode) pNode).getNodes();
      return nodes.isEmpty() ? null : getLastStatement(nodes.get(nodes.size() - 1));
    } else if (pNode instanceof CodeNode) {
      return getLastStatement(((CodeNode) pNode).getNode());
    } else if (pNode instanceof LoopNode) {
      return getLastStatement(((LoopNode) pNode).getBody());
    }
    return null;
  }

  /** Like {@link #getLastStatement(RegionNode)}, but an empty trailing block yields null. */
  static @Nullable Statement getLastStatementOrNull(RegionNode pNode) {
    try {
      return getLastStatement(pNode);
    } catch (EmptyBlockException e) {
      return null;
    }
  }

  /** Removes and returns the statement that is executed last in the given node. */
  static @Nullable Statement removeLastStatement(RegionNode pNode) throws StructuringException {
    if (pNode instanceof Block) {
      return ((Block) pNode).removeLastStatement();
    } else if (pNode instanceof MultiNode) {
      for (Block block : ((MultiNode) pNode).getBlocks().reverse()) {
        if (!block.isEmpty()) {
          return block.removeLastStatement();
        }
      }
      return null;
    } else if (pNode instanceof SequenceNode) {
      List<RegionNode> nodes = ((SequenceNode) pNode).getNodes();
      return nodes.isEmpty() ? null : removeLastStatement(nodes.get(nodes.size() - 1));
    } else if (pNode instanceof CodeNode) {
      return removeLastStatement(((CodeNode) pNode).getNode());
    }
    throw new StructuringException("Cannot remove the last statement of " + pNode);
  }

  static void appendStatement(RegionNode pNode, Statement pStatement)
      throws StructuringException {
    if (pNode instanceof Block) {
      ((Block) pNode).appendStatement(pStatement);
      return;
    } else if (pNode instanceof MultiNode) {
      List<Block> blocks = ((MultiNode) pNode).getBlocks();
      if (!blocks.isEmpty()) {
        blocks.get(blocks.size() - 1).appendStatement(pStatement);
        return;
      }
    } else if (pNode instanceof SequenceNode) {
      List<RegionNode> nodes = ((SequenceNode) pNode).getNodes();
      if (!nodes.isEmpty()) {
        appendStatement(nodes.get(nodes.size() - 1), pStatement);
        return;
      }
    } else if (pNode instanceof CodeNode) {
      appendStatement(((CodeNode) pNode).getNode(), pStatement);
      return;
    }
    throw new StructuringException("Cannot append " + pStatement + " to " + pNode);
  }

  /** Constant targets of a jump or conditional jump, empty for any other statement. */
  static ImmutableList<Long> extractJumpTargets(@Nullable Statement pStatement) {
    if (pStatement instanceof Jump) {
      return ImmutableList.of(((Jump) pStatement).getTarget());
    } else if (pStatement instanceof ConditionalJump) {
      ConditionalJump jump = (ConditionalJump) pStatement;
      return ImmutableList.of(jump.getTrueTarget(), jump.getFalseTarget());
    }
    return ImmutableList.of();
  }

  /** Whether the node is a block or multi-node without any statement. */
  static boolean isEmptyNode(RegionNode pNode) {
    if (pNode instanceof Block) {
      return ((Block) pNode).isEmpty();
    } else if (pNode instanceof MultiNode) {
      return ((MultiNode) pNode).isEmpty();
    }
    return false;
  }
}
