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
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Comparison of two bit-vector terms. */
@Immutable
public final class ComparisonFormula extends BooleanFormula {

  private final ComparisonOperator operator;
  private final BitvectorFormula left;
  private final BitvectorFormula right;

  ComparisonFormula(ComparisonOperator pOperator, BitvectorFormula pLeft, BitvectorFormula pRight) {
    operator = checkNotNull(pOperator);
    left = checkNotNull(pLeft);
    right = checkNotNull(pRight);
  }

  public ComparisonOperator getOperator() {
    return operator;
  }

  public BitvectorFormula getLeft() {
    return left;
  }

  public BitvectorFormula getRight() {
    return right;
  }

  @Override
  public <R, X extends Exception> R accept(FormulaVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public boolean equals(@Nullable Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof ComparisonFormula)) {
      return false;
    }
    ComparisonFormula other = (ComparisonFormula) pObj;
    return operator == other.operator && left.equals(other.left) && right.equals(other.right);
  }

  @Override
  public int hashCode() {
    return Objects.hash(operator, left, right);
  }

  @Override
  public String toString() {
    return "(" + left + " " + operator.getOperator() + " " + right + ")";
  }
}
