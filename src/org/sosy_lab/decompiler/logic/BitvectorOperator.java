// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.logic;

public enum BitvectorOperator {
  ADD("+"),
  SUBTRACT("-"),
  XOR("^"),
  AND("&"),
  LOGICAL_SHIFT_RIGHT(">>"),
  ;

  private final String op;

  BitvectorOperator(String pOp) {
    op = pOp;
  }

  public String getOperator() {
    return op;
  }

  long evaluate(long pLeft, long pRight, int pBits) {
    long left = BitvectorConstant.truncate(pLeft, pBits);
    long right = BitvectorConstant.truncate(pRight, pBits);
    switch (this) {
      case ADD:
        return BitvectorConstant.truncate(left + right, pBits);
      case SUBTRACT:
        return BitvectorConstant.truncate(left - right, pBits);
      case XOR:
        return left ^ right;
      case AND:
        return left & right;
      case LOGICAL_SHIFT_RIGHT:
        return Long.compareUnsigned(right, pBits) >= 0 ? 0 : left >>> right;
      default:
        throw new AssertionError("unhandled operator " + this);
    }
  }
}
