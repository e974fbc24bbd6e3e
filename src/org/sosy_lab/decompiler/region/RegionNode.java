// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.region;

/**
 * Node of a region graph: a basic block, a run of blocks, a nested region, or an already structured
 * control node. Region nodes are compared by identity.
 */
public interface RegionNode {

  /** Address of a node that does not correspond to any code, e.g., an empty sequence. */
  long NO_ADDRESS = Long.MIN_VALUE;

  /** Address of the first instruction of this node. */
  long getAddress();
}
