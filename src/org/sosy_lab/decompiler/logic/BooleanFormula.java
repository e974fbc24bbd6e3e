// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.logic;

import com.google.errorprone.annotations.Immutable;
import org.sosy_lab.decompiler.ir.Guard;

/**
 * Formula of the propositional condition algebra. Atoms are boolean variables and comparisons of
 * bit-vector terms. Formulas are immutable and compared structurally.
 */
@Immutable
public abstract class BooleanFormula implements Guard {

  BooleanFormula() {}

  public abstract <R, X extends Exception> R accept(FormulaVisitor<R, X> pVisitor) throws X;
}
