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
public final class BinaryOperation implements Expression {

  public enum BinaryOperator {
    LOGICAL_AND("&&", true),
    LOGICAL_OR("||", true),
    EQUALS("==", true),
    NOT_EQUALS("!=", true),
    LESS_THAN("<s", true),
    LESS_EQUAL("<=s", true),
    GREATER_THAN(">s", true),
    GREATER_EQUAL(">=s", true),
    UNSIGNED_LESS_THAN("<u", true),
    UNSIGNED_LESS_EQUAL("<=u", true),
    UNSIGNED_GREATER_THAN(">u", true),
    UNSIGNED_GREATER_EQUAL(">=u", true),
    PLUS("+", false),
    MINUS("-", false),
    MULTIPLY("*", false),
    DIVIDE("/", false),
    MODULO("%", false),
    BINARY_AND("&", false),
    BINARY_OR("|", false),
    BINARY_XOR("^", false),
    SHIFT_LEFT("<<", false),
    SHIFT_RIGHT(">>", false),
    ;

    private final String op;
    private final boolean booleanResult;

    BinaryOperator(String pOp, boolean pBooleanResult) {
      op = pOp;
      booleanResult = pBooleanResult;
    }

    public String getOperator() {
      return op;
    }

    /** Whether the operation yields a boolean (logical connectives and comparisons). */
    public boolean hasBooleanResult() {
      return booleanResult;
    }
  }

  private final BinaryOperator operator;
  private final Expression operand1;
  private final Expression operand2;

  public BinaryOperation(BinaryOperator pOperator, Expression pOperand1, Expression pOperand2) {
    operator = checkNotNull(pOperator);
    operand1 = checkNotNull(pOperand1);
    operand2 = checkNotNull(pOperand2);
  }

  public BinaryOperator getOperator() {
    return operator;
  }

  public Expression getOperand1() {
    return operand1;
  }

  public Expression getOperand2() {
    return operand2;
  }

  @Override
  public int getBits() {
    return operator.hasBooleanResult() ? 1 : operand1.getBits();
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
    if (!(pObj instanceof BinaryOperation)) {
      return false;
    }
    BinaryOperation other = (BinaryOperation) pObj;
    return operator == other.operator
        && operand1.equals(other.operand1)
        && operand2.equals(other.operand2);
  }

  @Override
  public int hashCode() {
    return Objects.hash(operator, operand1, operand2);
  }

  @Override
  public String toString() {
    return "(" + operand1 + " " + operator.getOperator() + " " + operand2 + ")";
  }
}
