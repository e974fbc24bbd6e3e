// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring.nodes;

import org.sosy_lab.decompiler.region.RegionNode;

/**
 * Node of a structured control tree. The set of node kinds is closed, use a {@link
 * ControlNodeVisitor} to handle all of them.
 *
 * <p>Control nodes are immutable, restructuring replaces them. They are compared by identity,
 * because the same node may appear as a node of a region graph.
 */
public abstract class ControlNode implements RegionNode {

  ControlNode() {}

  public abstract <R, X extends Exception> R accept(ControlNodeVisitor<R, X> pVisitor) throws X;
}
