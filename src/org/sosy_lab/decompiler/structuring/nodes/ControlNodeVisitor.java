// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring.nodes;

public interface ControlNodeVisitor<R, X extends Exception> {

  R visit(SequenceNode pNode) throws X;

  R visit(CodeNode pNode) throws X;

  R visit(ConditionNode pNode) throws X;

  R visit(LoopNode pNode) throws X;

  R visit(BreakNode pNode) throws X;

  R visit(ConditionalBreakNode pNode) throws X;
}
