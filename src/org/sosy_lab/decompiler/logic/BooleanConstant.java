// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.logic;

import com.google.errorprone.annotations.Immutable;

@Immutable
public final class BooleanConstant extends BooleanFormula {

  static final BooleanConstant TRUE = new BooleanConstant(true);
  static final BooleanConstant FALSE = new BooleanConstant(false);

  private final boolean value;

  private BooleanConstant(boolean pValue) {
    value = pValue;
  }

  static BooleanConstant of(boolean pValue) {
    return pValue ? TRUE : FALSE;
  }

  public boolean getValue() {
    return value;
  }

  @Override
  public <R, X extends Exception> R accept(FormulaVisitor<R, X> pVisitor) throws X {
    return pVisitor.visit(this);
  }

  // only two instances exist, identity equality is sufficient

  @Override
  public String toString() {
    return Boolean.toString(value);
  }
}
