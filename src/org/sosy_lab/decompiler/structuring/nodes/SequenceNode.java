// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring.nodes;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.sosy_lab.decompiler.region.RegionNode;

/** Children executed one after the other. */
public final class SequenceNode extends ControlNode {

  private final ImmutableList<RegionNode> nodes;

  public SequenceNode(List<? extends RegionNode> pNodes) {
    nodes = ImmutableList.copyOf(pNodes);
  }

  public ImmutableList<RegionNode> getNodes() {
    return nodes;
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  /** The address of the first child. */
  @Override
  public long getAddress() {
    return nodes.isEmpty() ? NO_ADDRESS : nodes.get(0).getAddress();
  }

  @Override
  public <R, X extends Exception> R accept(ControlNodeVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public String toString() {
    return "Sequence 0x" + Long.toHexString(getAddress()) + " (" + nodes.size() + " nodes)";
  }
}
