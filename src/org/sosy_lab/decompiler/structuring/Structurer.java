// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Map;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.decompiler.region.GraphRegion;
import org.sosy_lab.decompiler.region.RegionGraphs;
import org.sosy_lab.decompiler.structuring.nodes.ControlNodePrinter;
import org.sosy_lab.decompiler.structuring.nodes.SequenceNode;

/**
 * Structures a single region whose graph contains no nested regions. Cyclic regions are handed to
 * the {@link LoopStructurer}, acyclic ones to the {@link AcyclicStructurer}.
 *
 * <p>The instance holds everything that is shared between the regions of one structuring run, in
 * particular the mapping of condition variables and the parent of every region.
 */
final class Structurer {

  private final StructuringOptions options;
  private final LogManager logger;
  private final StructurerStatistics stats;
  private final ConditionTranslator translator;
  private final ConditionSimplifier simplifier;
  private final Map<GraphRegion, GraphRegion> parentRegions;

  Structurer(
      StructuringOptions pOptions,
      LogManager pLogger,
      StructurerStatistics pStats,
      ConditionVariableMapping pMapping,
      Map<GraphRegion, GraphRegion> pParentRegions) {
    options = checkNotNull(pOptions);
    logger = checkNotNull(pLogger);
    stats = checkNotNull(pStats);
    translator = new ConditionTranslator(pMapping, pLogger);
    simplifier = new ConditionSimplifier(pOptions.revertShortCircuitConditions());
    parentRegions = checkNotNull(pParentRegions);
  }

  /** Structures the region; all conditions of the result are native expressions. */
  SequenceNode structure(GraphRegion pRegion) throws StructuringException {
    boolean cyclic = RegionGraphs.hasCycle(pRegion.getGraph());
    SequenceNode result;
    if (cyclic) {
      result = new LoopStructurer(this, pRegion).structure();
    } else {
      result = new AcyclicStructurer(this, pRegion).structure();
    }
    stats.regionStructured(cyclic);
    result = new NodeConditionTranslator(translator).translate(result);

    if (logger.wouldBeLogged(options.getResultLogLevel())) {
      logger.log(
          options.getResultLogLevel(),
          "Structured region at",
          String.format("0x%x", pRegion.getAddress()),
          "into\n" + ControlNodePrinter.print(result));
    }
    return result;
  }

  /** The region that contains the given one as a node, null for the root and for loop bodies. */
  @Nullable GraphRegion getParentRegion(GraphRegion pRegion) {
    return parentRegions.get(pRegion);
  }

  StructuringOptions getOptions() {
    return options;
  }

  LogManager getLogger() {
    return logger;
  }

  StructurerStatistics getStatistics() {
    return stats;
  }

  ConditionTranslator getTranslator() {
    return translator;
  }

  ConditionSimplifier getSimplifier() {
    return simplifier;
  }
}
