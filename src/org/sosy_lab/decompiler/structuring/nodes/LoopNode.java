// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring.nodes;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.decompiler.ir.Guard;

/** Loop over a body sequence. Only endless loops come without a condition. */
public final class LoopNode extends ControlNode {

  private final LoopKind kind;
  private final @Nullable Guard condition;
  private final SequenceNode body;
  private final long address;

  public LoopNode(LoopKind pKind, @Nullable Guard pCondition, SequenceNode pBody, long pAddress) {
    checkArgument(
        (pKind == LoopKind.ENDLESS) == (pCondition == null),
        "%s loop with condition %s",
        pKind,
        pCondition);
    kind = pKind;
    condition = pCondition;
    body = checkNotNull(pBody);
    address = pAddress;
  }

  public LoopNode(LoopKind pKind, @Nullable Guard pCondition, SequenceNode pBody) {
    this(pKind, pCondition, pBody, pBody.getAddress());
  }

  public LoopKind getKind() {
    return kind;
  }

  public @Nullable Guard getCondition() {
    return condition;
  }

  public SequenceNode getBody() {
    return body;
  }

  @Override
  public long getAddress() {
    return address;
  }

  @Override
  public <R, X extends Exception> R accept(ControlNodeVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public String toString() {
    return "Loop 0x"
        + Long.toHexString(address)
        + " "
        + kind
        + (condition == null ? "" : " (" + condition + ")");
  }
}
