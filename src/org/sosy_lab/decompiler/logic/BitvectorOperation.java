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

@Immutable
public final class BitvectorOperation extends BitvectorFormula {

  private final BitvectorOperator operator;
  private final BitvectorFormula left;
  private final BitvectorFormula right;

  BitvectorOperation(BitvectorOperator pOperator, BitvectorFormula pLeft, BitvectorFormula pRight) {
    operator = checkNotNull(pOperator);
    left = checkNotNull(pLeft);
    right = checkNotNull(pRight);
  }

  public BitvectorOperator getOperator() {
    return operator;
  }

  public BitvectorFormula getLeft() {
    return left;
  }

  public BitvectorFormula getRight() {
    return right;
  }

  @Override
  public int getBits() {
    return left.getBits();
  }

  @Override
  public <R, X extends Exception> R accept(BitvectorFormulaVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public boolean equals(@Nullable Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof BitvectorOperation)) {
      return false;
    }
    BitvectorOperation other = (BitvectorOperation) pObj;
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
