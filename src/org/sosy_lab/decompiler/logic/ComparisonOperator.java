// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.logic;

public enum ComparisonOperator {
  EQUAL("=="),
  NOT_EQUAL("!="),
  SIGNED_LESS_THAN("<s"),
  SIGNED_LESS_EQUAL("<=s"),
  SIGNED_GREATER_THAN(">s"),
  SIGNED_GREATER_EQUAL(">=s"),
  UNSIGNED_LESS_THAN("<u"),
  UNSIGNED_LESS_EQUAL("<=u"),
  UNSIGNED_GREATER_THAN(">u"),
  UNSIGNED_GREATER_EQUAL(">=u"),
  ;

  private final String op;

  ComparisonOperator(String pOp) {
    op = pOp;
  }

  public String getOperator() {
    return op;
  }

  /** The operator whose result is the negation of this one. */
  public ComparisonOperator negate() {
    switch (this) {
      case EQUAL:
        return NOT_EQUAL;
      case NOT_EQUAL:
        return EQUAL;
      case SIGNED_LESS_THAN:
        return SIGNED_GREATER_EQUAL;
      case SIGNED_LESS_EQUAL:
        return SIGNED_GREATER_THAN;
      case SIGNED_GREATER_THAN:
        return SIGNED_LESS_EQUAL;
      case SIGNED_GREATER_EQUAL:
        return SIGNED_LESS_THAN;
      case UNSIGNED_LESS_THAN:
        return UNSIGNED_GREATER_EQUAL;
      case UNSIGNED_LESS_EQUAL:
        return UNSIGNED_GREATER_THAN;
      case UNSIGNED_GREATER_THAN:
        return UNSIGNED_LESS_EQUAL;
      case UNSIGNED_GREATER_EQUAL:
        return UNSIGNED_LESS_THAN;
      default:
        throw new AssertionError("unhandled operator " + this);
    }
  }

  /** The operator that gives the same result with exchanged operands. */
  public ComparisonOperator swap() {
    switch (this) {
      case EQUAL:
      case NOT_EQUAL:
        return this;
      case SIGNED_LESS_THAN:
        return SIGNED_GREATER_THAN;
      case SIGNED_LESS_EQUAL:
        return SIGNED_GREATER_EQUAL;
      case SIGNED_GREATER_THAN:
        return SIGNED_LESS_THAN;
      case SIGNED_GREATER_EQUAL:
        return SIGNED_LESS_EQUAL;
      case UNSIGNED_LESS_THAN:
        return UNSIGNED_GREATER_THAN;
      case UNSIGNED_LESS_EQUAL:
        return UNSIGNED_GREATER_EQUAL;
      case UNSIGNED_GREATER_THAN:
        return UNSIGNED_LESS_THAN;
      case UNSIGNED_GREATER_EQUAL:
        return UNSIGNED_LESS_EQUAL;
      default:
        throw new AssertionError("unhandled operator " + this);
    }
  }

  /** Whether {@code x op x} holds for every x. */
  public boolean isReflexive() {
    switch (this) {
      case EQUAL:
      case SIGNED_LESS_EQUAL:
      case SIGNED_GREATER_EQUAL:
      case UNSIGNED_LESS_EQUAL:
      case UNSIGNED_GREATER_EQUAL:
        return true;
      default:
        return false;
    }
  }

  boolean evaluate(long pLeft, long pRight, int pBits) {
    long ul = BitvectorConstant.truncate(pLeft, pBits);
    long ur = BitvectorConstant.truncate(pRight, pBits);
    long sl = BitvectorConstant.signExtend(pLeft, pBits);
    long sr = BitvectorConstant.signExtend(pRight, pBits);
    switch (this) {
      case EQUAL:
        return ul == ur;
      case NOT_EQUAL:
        return ul != ur;
      case SIGNED_LESS_THAN:
        return sl < sr;
      case SIGNED_LESS_EQUAL:
        return sl <= sr;
      case SIGNED_GREATER_THAN:
        return sl > sr;
      case SIGNED_GREATER_EQUAL:
        return sl >= sr;
      case UNSIGNED_LESS_THAN:
        return Long.compareUnsigned(ul, ur) < 0;
      case UNSIGNED_LESS_EQUAL:
        return Long.compareUnsigned(ul, ur) <= 0;
      case UNSIGNED_GREATER_THAN:
        return Long.compareUnsigned(ul, ur) > 0;
      case UNSIGNED_GREATER_EQUAL:
        return Long.compareUnsigned(ul, ur) >= 0;
      default:
        throw new AssertionError("unhandled operator " + this);
    }
  }
}
