// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.logic;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Disjunction of at least two operands. */
@Immutable
public final class OrFormula extends BooleanFormula {

  private final ImmutableList<BooleanFormula> operands;

  OrFormula(ImmutableList<BooleanFormula> pOperands) {
    checkArgument(pOperands.size() >= 2, "disjunction needs at least two operands");
    operands = pOperands;
  }

  public ImmutableList<BooleanFormula> getOperands() {
    return operands;
  }

  @Override
  public <R, X extends Exception> R accept(FormulaVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public boolean equals(@Nullable Object pObj) {
    return this == pObj
        || (pObj instanceof OrFormula && operands.equals(((OrFormula) pObj).operands));
  }

  @Override
  public int hashCode() {
    return operands.hashCode() * 19;
  }

  @Override
  public String toString() {
    return "(" + Joiner.on(" || ").join(operands) + ")";
  }
}
