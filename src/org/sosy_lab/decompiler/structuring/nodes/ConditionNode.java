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

/** If-then with optional else. */
public final class ConditionNode extends ControlNode {

  private final long address;
  private final Guard condition;
  private final RegionNode trueNode;
  private final @Nullable RegionNode falseNode;

  public ConditionNode(
      long pAddress, Guard pCondition, RegionNode pTrueNode, @Nullable RegionNode pFalseNode) {
    address = pAddress;
    condition = checkNotNull(pCondition);
    trueNode = checkNotNull(pTrueNode);
    falseNode = pFalseNode;
  }

  @Override
  public long getAddress() {
    return address;
  }

  public Guard getCondition() {
    return condition;
  }

  public RegionNode getTrueNode() {
    return trueNode;
  }

  public @Nullable RegionNode getFalseNode() {
    return falseNode;
  }

  @Override
  public <R, X extends Exception> R accept(ControlNodeVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public String toString() {
    return "Condition 0x" + Long.toHexString(address) + " (" + condition + ")";
  }
}
