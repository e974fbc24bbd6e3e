// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.logic;

import com.google.errorprone.annotations.Immutable;

/** Fixed-width bit-vector term used as operand of comparisons. */
@Immutable
public abstract class BitvectorFormula {

  BitvectorFormula() {}

  public abstract int getBits();

  public abstract <R, X extends Exception> R accept(BitvectorFormulaVisitor<R, X> pVisitor)
      throws X;
}
