// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.VerifyException;
import com.google.common.graph.Traverser;
import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.decompiler.region.GraphRegion;
import org.sosy_lab.decompiler.region.RegionCheck;
import org.sosy_lab.decompiler.region.RegionNode;
import org.sosy_lab.decompiler.structuring.nodes.SequenceNode;

/**
 * Structures a tree of regions bottom-up: every region is structured after all regions nested in
 * it, and its structured form then takes its place in the enclosing region.
 *
 * <p>The given region tree is not modified, structuring works on a copy of it.
 */
public class RecursiveStructurer {

  private final StructuringOptions options;
  private final LogManager logger;
  private final StructurerStatistics stats = new StructurerStatistics();

  public RecursiveStructurer(Configuration pConfig, LogManager pLogger)
      throws InvalidConfigurationException {
    options = new StructuringOptions(pConfig);
    logger = checkNotNull(pLogger);
  }

  public SequenceNode structure(GraphRegion pRegion) throws StructuringException {
    stats.totalTimer.start();
    try {
      if (options.checkRegions()) {
        try {
          RegionCheck.check(pRegion);
        } catch (VerifyException e) {
          throw new StructuringException("Inconsistent region tree: " + e.getMessage(), e);
        }
      }
      GraphRegion root = pRegion.recursiveCopy();

      Map<GraphRegion, GraphRegion> parentRegions = new HashMap<>();
      Structurer structurer =
          new Structurer(options, logger, stats, new ConditionVariableMapping(), parentRegions);

      Deque<GraphRegion> stack = new ArrayDeque<>();
      stack.push(root);
      while (!stack.isEmpty()) {
        GraphRegion current = stack.peek();

        boolean hasNestedRegions = false;
        for (RegionNode node :
            Traverser.forGraph(current.getGraph()).depthFirstPostOrder(current.getHead())) {
          if (node instanceof GraphRegion) {
            stack.push((GraphRegion) node);
            parentRegions.put((GraphRegion) node, current);
            hasNestedRegions = true;
          }
        }
        if (hasNestedRegions) {
          continue;
        }

        stack.pop();
        logger.log(Level.FINE, "Structuring", current);
        SequenceNode result = structurer.structure(current);
        GraphRegion parent = parentRegions.get(current);
        if (parent == null) {
          return result;
        }
        parent.replaceRegion(current, result);
      }
      throw new AssertionError("region tree without root");

    } finally {
      stats.totalTimer.stop();
    }
  }

  public StructurerStatistics getStatistics() {
    return stats;
  }

  public void printStatistics(PrintStream pOut) {
    stats.printStatistics(pOut);
  }
}
