// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.region;

import static com.google.common.base.Verify.verify;

import com.google.common.base.Joiner;
import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Sets;
import com.google.common.graph.Graph;
import com.google.common.graph.Graphs;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.decompiler.ir.ConditionalJump;
import org.sosy_lab.decompiler.ir.Jump;
import org.sosy_lab.decompiler.ir.Statement;

/** Sanity checks for region trees handed to the structurer. */
public class RegionCheck {

  private RegionCheck() {}

  /**
   * Traverse the region tree and run a series of checks at each region
   *
   * @param pRegion root of the region tree
   * @return true if all checks succeed
   * @throws VerifyException if not all checks succeed
   */
  public static boolean check(GraphRegion pRegion) throws VerifyException {
    Set<GraphRegion> visitedRegions = Collections.newSetFromMap(new IdentityHashMap<>());
    Deque<GraphRegion> waitingRegions = new ArrayDeque<>();

    waitingRegions.add(pRegion);
    while (!waitingRegions.isEmpty()) {
      GraphRegion region = waitingRegions.poll();
      if (!visitedRegions.add(region)) {
        continue;
      }
      Graph<RegionNode> graph = region.getGraph();

      verify(
          graph.nodes().contains(region.getHead()),
          "Head %s of %s is not part of its graph",
          region.getHead(),
          region);

      Set<RegionNode> reachable = Graphs.reachableNodes(graph, region.getHead());
      verify(
          reachable.size() == graph.nodes().size(),
          "Nodes in %s but not reachable from its head: %s",
          region,
          Sets.difference(graph.nodes(), reachable));

      for (RegionNode node : graph.nodes()) {
        isConsistentTransfer(graph, node);
        if (node instanceof GraphRegion) {
          waitingRegions.add((GraphRegion) node);
        }
      }
    }
    return true;
  }

  /**
   * This method returns a lazy object where {@link Object#toString} can be called. In most cases we
   * do not need to build the String, thus we can avoid some overhead here.
   */
  private static Object debugFormat(Graph<RegionNode> pGraph, RegionNode pNode) {
    return new Object() {
      @Override
      public String toString() {
        return pNode
            + " with successors\n"
            + Joiner.on('\n').join(Iterables.transform(pGraph.successors(pNode), Object::toString));
      }
    };
  }

  /** Verify that every successor of a block is a target of the block's trailing transfer. */
  private static void isConsistentTransfer(Graph<RegionNode> pGraph, RegionNode pNode) {
    Statement transfer = getTransfer(pNode);
    ImmutableSet<Long> targets;
    if (transfer instanceof Jump) {
      targets = ImmutableSet.of(((Jump) transfer).getTarget());
    } else if (transfer instanceof ConditionalJump) {
      ConditionalJump jump = (ConditionalJump) transfer;
      targets = ImmutableSet.of(jump.getTrueTarget(), jump.getFalseTarget());
    } else {
      // fall-through or a transfer without known targets
      return;
    }

    for (RegionNode successor : pGraph.successors(pNode)) {
      verify(
          targets.contains(successor.getAddress()),
          "Successor 0x%s is not a target of the transfer '%s' of %s",
          Long.toHexString(successor.getAddress()),
          transfer,
          debugFormat(pGraph, pNode));
    }
  }

  private static @Nullable Statement getTransfer(RegionNode pNode) {
    if (pNode instanceof Block) {
      return ((Block) pNode).getLastStatement();
    } else if (pNode instanceof MultiNode) {
      for (Block block : ((MultiNode) pNode).getBlocks().reverse()) {
        if (!block.isEmpty()) {
          return block.getLastStatement();
        }
      }
    }
    return null;
  }
}
