// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import com.google.common.base.Strings;
import com.google.common.collect.EnumMultiset;
import com.google.common.collect.Multiset;
import java.io.PrintStream;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.sosy_lab.common.time.Timer;
import org.sosy_lab.decompiler.structuring.nodes.LoopKind;

/** Counters and timers of one {@link RecursiveStructurer}, accumulated over all its runs. */
public class StructurerStatistics {

  final Timer totalTimer = new Timer();

  private int acyclicRegions = 0;
  private int cyclicRegions = 0;
  private int breaks = 0;
  private int refinedSuccessors = 0;
  private final Multiset<LoopKind> loops = EnumMultiset.create(LoopKind.class);

  void regionStructured(boolean pCyclic) {
    if (pCyclic) {
      cyclicRegions++;
    } else {
      acyclicRegions++;
    }
  }

  void loopCreated(LoopKind pKind) {
    loops.add(pKind);
  }

  void breakCreated() {
    breaks++;
  }

  void successorsRefined() {
    refinedSuccessors++;
  }

  public int getAcyclicRegions() {
    return acyclicRegions;
  }

  public int getCyclicRegions() {
    return cyclicRegions;
  }

  public int getLoops(LoopKind pKind) {
    return loops.count(pKind);
  }

  public int getBreaks() {
    return breaks;
  }

  public int getRefinedSuccessors() {
    return refinedSuccessors;
  }

  public void printStatistics(PrintStream pOut) {
    put(pOut, 0, "structured regions", acyclicRegions + cyclicRegions);
    put(pOut, 1, "acyclic regions", acyclicRegions);
    put(pOut, 1, "cyclic regions", cyclicRegions);
    put(pOut, 0, "loops", loops.size());
    for (LoopKind kind : LoopKind.values()) {
      put(pOut, 1, kind.toString().toLowerCase(Locale.ROOT) + " loops", loops.count(kind));
    }
    put(pOut, 1, "loops with refined successors", refinedSuccessors);
    put(pOut, 0, "breaks", breaks);
    put(pOut, 0, "structuring runs", totalTimer.getNumberOfIntervals());
    put(pOut, 0, "total time for structuring", totalTimer.getSumTime().formatAs(TimeUnit.SECONDS));
  }

  private static void put(PrintStream pOut, int pIndent, String pTitle, Object pValue) {
    String title = Strings.repeat("  ", pIndent) + pTitle + ":";
    pOut.println(Strings.padEnd(title, 50, ' ') + pValue);
  }
}
