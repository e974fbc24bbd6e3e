// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

/**
 * Signals that a region cannot be structured. Structuring of the whole region tree is aborted, no
 * partial result is produced.
 */
public class StructuringException extends Exception {

  private static final long serialVersionUID = -4218693157280344215L;

  public StructuringException(String pMsg) {
    super(pMsg);
  }

  public StructuringException(String pMsg, Throwable pCause) {
    super(pMsg, pCause);
  }
}
