// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring.nodes;

import static com.google.common.base.Preconditions.checkNotNull;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.decompiler.ir.Guard;
import org.sosy_lab.decompiler.region.RegionNode;

/**
 * Wraps one node together with the condition under which it is reached. Without a reaching
 * condition the node is executed unconditionally.
 */
public final class CodeNode extends ControlNode {

  private final RegionNode node;
  private final @Nullable Guard reachingCondition;

  public CodeNode(RegionNode pNode, @Nullable Guard pReachingCondition) {
    node = checkNotNull(pNode);
    reachingCondition = pReachingCondition;
  }

  public RegionNode getNode() {
    return node;
  }

  public @Nullable Guard getReachingCondition() {
    return reachingCondition;
  }

  @Override
  public long getAddress() {
    return node.getAddress();
  }

  @Override
  public <R, X extends Exception> R accept(ControlNodeVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public String toString() {
    return "Code(" + node + (reachingCondition == null ? "" : ", " + reachingCondition) + ")";
  }
}
