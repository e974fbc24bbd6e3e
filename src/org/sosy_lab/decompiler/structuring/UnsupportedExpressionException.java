// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import org.sosy_lab.decompiler.ir.Expression;

/** An expression of a branch condition uses an operator the condition algebra cannot represent. */
public class UnsupportedExpressionException extends StructuringException {

  private static final long serialVersionUID = 3377219561089043270L;

  private final Expression expression;

  public UnsupportedExpressionException(String pMsg, Expression pExpression) {
    super(pMsg + ": " + pExpression);
    expression = pExpression;
  }

  public Expression getExpression() {
    return expression;
  }
}
