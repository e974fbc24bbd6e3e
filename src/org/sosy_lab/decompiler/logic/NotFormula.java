// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.logic;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;
import org.checkerframework.checker.nullness.qual.Nullable;

@Immutable
public final class NotFormula extends BooleanFormula {

  private final BooleanFormula operand;

  NotFormula(BooleanFormula pOperand) {
    operand = checkNotNull(pOperand);
  }

  public BooleanFormula getOperand() {
    return operand;
  }

  @Override
  public <R, X extends Exception> R accept(FormulaVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public boolean equals(@Nullable Object pObj) {
    return this == pObj
        || (pObj instanceof NotFormula && operand.equals(((NotFormula) pObj).operand));
  }

  @Override
  public int hashCode() {
    return 31 * operand.hashCode() + 7;
  }

  @Override
  public String toString() {
    return "!" + operand;
  }
}
