// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.ir;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

@Immutable
public final class UnaryOperation implements Expression {

  public enum UnaryOperator {
    LOGICAL_NOT("!"),
    BITWISE_NOT("~"),
    NEGATE("-"),
    ;

    private final String op;

    UnaryOperator(String pOp) {
      op = pOp;
    }

    public String getOperator() {
      return op;
    }
  }

  private final UnaryOperator operator;
  private final Expression operand;

  public UnaryOperation(UnaryOperator pOperator, Expression pOperand) {
    operator = checkNotNull(pOperator);
    operand = checkNotNull(pOperand);
  }

  public static UnaryOperation not(Expression pOperand) {
    return new UnaryOperation(UnaryOperator.LOGICAL_NOT, pOperand);
  }

  public UnaryOperator getOperator() {
    return operator;
  }

  public Expression getOperand() {
    return operand;
  }

  @Override
  public int getBits() {
    return operator == UnaryOperator.LOGICAL_NOT ? 1 : operand.getBits();
  }

  @Override
  public <R, X extends Exception> R accept(ExpressionVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  @Override
  public boolean equals(@Nullable Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof UnaryOperation)) {
      return false;
    }
    UnaryOperation other = (UnaryOperation) pObj;
    return operator == other.operator && operand.equals(other.operand);
  }

  @Override
  public int hashCode() {
    return Objects.hash(operator, operand);
  }

  @Override
  public String toString() {
    return operator.getOperator() + "(" + operand + ")";
  }
}
