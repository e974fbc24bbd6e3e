// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.ir;

/** Statement of a basic block. */
public interface Statement {

  /** Address of the machine instruction this statement was lifted from. */
  long getInstructionAddress();
}
