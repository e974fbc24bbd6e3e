// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.logic;

public interface FormulaVisitor<R, X extends Exception> {

  R visit(BooleanConstant pConstant) throws X;

  R visit(BooleanVariable pVariable) throws X;

  R visit(NotFormula pNot) throws X;

  R visit(AndFormula pAnd) throws X;

  R visit(OrFormula pOr) throws X;

  R visit(ComparisonFormula pComparison) throws X;
}
