// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring.nodes;

import static com.google.common.base.Preconditions.checkNotNull;

import org.sosy_lab.decompiler.ir.Guard;

/** Leaves the innermost loop if the condition holds. */
public final class ConditionalBreakNode extends BreakNode {

  private final Guard condition;

  public ConditionalBreakNode(long pAddress, Guard pCondition, long pTarget) {
    super(pAddress, pTarget);
    condition = checkNotNull(pCondition);
  }

  public Guard getCondition() {
    return condition;
  }

  @Override
  public <R, X extends Exception> R accept(ControlNodeVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public String toString() {
    return "ConditionalBreak 0x"
        + Long.toHexString(getAddress())
        + " ("
        + condition
        + ") -> 0x"
        + Long.toHexString(getTarget());
  }
}
