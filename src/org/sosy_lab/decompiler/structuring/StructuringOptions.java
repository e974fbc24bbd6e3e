// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import java.util.logging.Level;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;

@Options(prefix = "structurer")
final class StructuringOptions {

  @Option(
      secure = true,
      name = "revertShortCircuitConditions",
      description =
          "Compilers evaluate 'A && B' with two branches, which yields reaching conditions "
              + "of the form '!A || (A && !B)'. Rewrite such conditions into '!(A && B)'.")
  private boolean revertShortCircuitConditions = true;

  @Option(
      secure = true,
      name = "mergeConditionalBreaks",
      description =
          "Merge adjacent conditional breaks out of a loop into one break "
              + "on the disjunction of their conditions.")
  private boolean mergeConditionalBreaks = true;

  @Option(
      secure = true,
      name = "checkRegions",
      description =
          "Check the region tree for consistency (reachability from the head, "
              + "edges matching jump targets) before structuring it.")
  private boolean checkRegions = false;

  @Option(
      secure = true,
      name = "resultLogLevel",
      description = "Log level for the structured form of every region.")
  private Level resultLogLevel = Level.FINEST;

  StructuringOptions(Configuration pConfig) throws InvalidConfigurationException {
    pConfig.inject(this, StructuringOptions.class);
  }

  boolean revertShortCircuitConditions() {
    return revertShortCircuitConditions;
  }

  boolean mergeConditionalBreaks() {
    return mergeConditionalBreaks;
  }

  boolean checkRegions() {
    return checkRegions;
  }

  Level getResultLogLevel() {
    return resultLogLevel;
  }
}
