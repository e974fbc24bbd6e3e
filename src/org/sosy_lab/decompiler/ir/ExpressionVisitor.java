// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.ir;

public interface ExpressionVisitor<R, X extends Exception> {

  R visit(Constant pConstant) throws X;

  R visit(Register pRegister) throws X;

  R visit(Load pLoad) throws X;

  R visit(Temporary pTemporary) throws X;

  R visit(Convert pConvert) throws X;

  R visit(UnaryOperation pOperation) throws X;

  R visit(BinaryOperation pOperation) throws X;
}
