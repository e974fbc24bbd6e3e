// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.logic;

public interface BitvectorFormulaVisitor<R, X extends Exception> {

  R visit(BitvectorConstant pConstant) throws X;

  R visit(BitvectorVariable pVariable) throws X;

  R visit(BitvectorOperation pOperation) throws X;
}
