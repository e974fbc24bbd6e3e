// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring.nodes;

/** Leaves the innermost loop towards the given target. */
public class BreakNode extends ControlNode {

  private final long address;
  private final long target;

  public BreakNode(long pAddress, long pTarget) {
    address = pAddress;
    target = pTarget;
  }

  @Override
  public long getAddress() {
    return address;
  }

  public long getTarget() {
    return target;
  }

  @Override
  public <R, X extends Exception> R accept(ControlNodeVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public String toString() {
    return "Break 0x" + Long.toHexString(address) + " -> 0x" + Long.toHexString(target);
  }
}
