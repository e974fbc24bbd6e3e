// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring.nodes;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.sosy_lab.decompiler.ir.Assignment;
import org.sosy_lab.decompiler.ir.BinaryOperation;
import org.sosy_lab.decompiler.ir.BinaryOperation.BinaryOperator;
import org.sosy_lab.decompiler.ir.Constant;
import org.sosy_lab.decompiler.ir.Register;
import org.sosy_lab.decompiler.ir.Return;
import org.sosy_lab.decompiler.ir.UnaryOperation;
import org.sosy_lab.decompiler.region.Block;

public class ControlNodePrinterTest {

  private static final Register EAX = new Register("eax", 32);
  private static final Register ZF = new Register("zf", 1);
  private static final Register CF = new Register("cf", 1);

  private static Block assign(long pAddress, long pValue) {
    return new Block(
        pAddress, ImmutableList.of(new Assignment(pAddress, EAX, new Constant(pValue, 32))));
  }

  @Test
  public void printsNestedControlFlow() {
    SequenceNode tree =
        new SequenceNode(
            ImmutableList.of(
                assign(0x10, 1),
                new ConditionNode(
                    0x20,
                    new BinaryOperation(BinaryOperator.EQUALS, EAX, new Constant(0, 32)),
                    new CodeNode(assign(0x20, 2), null),
                    assign(0x30, 3)),
                new LoopNode(
                    LoopKind.DO_WHILE,
                    UnaryOperation.not(ZF),
                    new SequenceNode(
                        ImmutableList.of(
                            assign(0x40, 4), new ConditionalBreakNode(0x44, CF, 0x50))),
                    0x40),
                new Block(0x50, ImmutableList.of(new Return(0x50, null)))));

    assertThat(ControlNodePrinter.print(tree))
        .isEqualTo(
            Joiner.on('\n')
                .join(
                    "eax = 1",
                    "if (eax == 0) {",
                    "  eax = 2",
                    "} else {",
                    "  eax = 3",
                    "}",
                    "do {",
                    "  eax = 4",
                    "  if (cf) break;",
                    "} while (!(zf));",
                    "return",
                    ""));
  }

  @Test
  public void printsGuardedCodeAndLoops() {
    SequenceNode tree =
        new SequenceNode(
            ImmutableList.of(
                new CodeNode(assign(0x10, 1), ZF),
                new LoopNode(
                    LoopKind.ENDLESS,
                    null,
                    new SequenceNode(ImmutableList.of(new BreakNode(0x20, 0x30))),
                    0x20),
                new LoopNode(
                    LoopKind.WHILE,
                    CF,
                    new SequenceNode(ImmutableList.of(assign(0x30, 2))),
                    0x30)));

    assertThat(ControlNodePrinter.print(tree))
        .isEqualTo(
            Joiner.on('\n')
                .join(
                    "if (zf) {",
                    "  eax = 1",
                    "}",
                    "while (true) {",
                    "  break;",
                    "}",
                    "while (cf) {",
                    "  eax = 2",
                    "}",
                    ""));
  }

  @Test
  public void endlessLoopsHaveNoCondition() {
    SequenceNode body = new SequenceNode(ImmutableList.of(assign(0x10, 1)));
    assertThrows(
        IllegalArgumentException.class, () -> new LoopNode(LoopKind.ENDLESS, ZF, body, 0x10));
    assertThrows(IllegalArgumentException.class, () -> new LoopNode(LoopKind.WHILE, null, body));
  }
}
