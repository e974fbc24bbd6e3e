// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.region;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Straight-line run of blocks that the region identifier merged into one node. */
public final class MultiNode implements RegionNode {

  private final ImmutableList<Block> blocks;

  public MultiNode(List<Block> pBlocks) {
    checkArgument(!pBlocks.isEmpty(), "MultiNode without blocks");
    blocks = ImmutableList.copyOf(pBlocks);
  }

  public ImmutableList<Block> getBlocks() {
    return blocks;
  }

  @Override
  public long getAddress() {
    return blocks.get(0).getAddress();
  }

  public boolean isEmpty() {
    return blocks.stream().allMatch(Block::isEmpty);
  }

  public MultiNode copy() {
    return new MultiNode(ImmutableList.copyOf(blocks.stream().map(Block::copy).iterator()));
  }

  @Override
  public String toString() {
    return "MultiNode[" + Joiner.on(", ").join(blocks) + "]";
  }
}
