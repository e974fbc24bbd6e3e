// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.region;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.sosy_lab.decompiler.ir.BinaryOperation;
import org.sosy_lab.decompiler.ir.BinaryOperation.BinaryOperator;
import org.sosy_lab.decompiler.ir.ConditionalJump;
import org.sosy_lab.decompiler.ir.Constant;
import org.sosy_lab.decompiler.ir.Jump;
import org.sosy_lab.decompiler.ir.Register;
import org.sosy_lab.decompiler.ir.Return;

public class RegionCheckTest {

  private static final Register EAX = new Register("eax", 32);

  private static ConditionalJump branch(long pAddress, long pTrueTarget, long pFalseTarget) {
    return new ConditionalJump(
        pAddress,
        new BinaryOperation(BinaryOperator.EQUALS, EAX, new Constant(0, 32)),
        pTrueTarget,
        pFalseTarget);
  }

  @Test
  public void consistentRegionTree() {
    Block a = new Block(0x10, ImmutableList.of(branch(0x10, 0x20, 0x30)));
    Block b = new Block(0x20, ImmutableList.of(new Jump(0x20, 0x30)));
    Block c = new Block(0x30, ImmutableList.of(new Return(0x30, null)));
    GraphRegion inner = GraphRegion.builder().addNode(c).build(c);
    GraphRegion outer =
        GraphRegion.builder().addEdge(a, b).addEdge(a, inner).addEdge(b, inner).build(a);

    assertThat(RegionCheck.check(outer)).isTrue();
  }

  @Test
  public void successorThatIsNoJumpTarget() {
    Block a = new Block(0x10, ImmutableList.of(new Jump(0x10, 0x30)));
    Block b = new Block(0x20, ImmutableList.of());
    GraphRegion region = GraphRegion.builder().addEdge(a, b).build(a);

    VerifyException e = assertThrows(VerifyException.class, () -> RegionCheck.check(region));
    assertThat(e).hasMessageThat().contains("0x20");
  }

  @Test
  public void unreachableNode() {
    Block a = new Block(0x10, ImmutableList.of());
    Block b = new Block(0x20, ImmutableList.of());
    GraphRegion region = GraphRegion.builder().addNode(a).addNode(b).build(a);

    assertThrows(VerifyException.class, () -> RegionCheck.check(region));
  }

  @Test
  public void nestedRegionsAreChecked() {
    Block a = new Block(0x10, ImmutableList.of());
    Block b = new Block(0x20, ImmutableList.of(new Jump(0x20, 0x40)));
    Block c = new Block(0x30, ImmutableList.of());
    GraphRegion inner = GraphRegion.builder().addEdge(b, c).build(b);
    GraphRegion outer = GraphRegion.builder().addEdge(a, inner).build(a);

    assertThrows(VerifyException.class, () -> RegionCheck.check(outer));
  }
}
