// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.ir;

/** Expression of the lifted intermediate representation. Implementations are immutable. */
public interface Expression extends Guard {

  /** Width of the value in bits. Boolean values have width 1. */
  int getBits();

  <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X;
}
