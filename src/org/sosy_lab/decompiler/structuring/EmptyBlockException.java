// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import org.sosy_lab.decompiler.region.Block;

/**
 * Thrown when the last statement of a block without statements is requested. Callers that scan
 * compound nodes catch it and continue with the next block.
 */
public class EmptyBlockException extends Exception {

  private static final long serialVersionUID = 6203125472183307412L;

  public EmptyBlockException(Block pBlock) {
    super("No statements in " + pBlock);
  }
}
