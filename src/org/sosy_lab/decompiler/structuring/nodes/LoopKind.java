// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring.nodes;

public enum LoopKind {
  /** Loop without test, left only by breaks. */
  ENDLESS,
  /** Test before each iteration. */
  WHILE,
  /** Test after each iteration. */
  DO_WHILE,
}
