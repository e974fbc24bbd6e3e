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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import org.junit.Test;
import org.sosy_lab.decompiler.ir.Assignment;
import org.sosy_lab.decompiler.ir.Constant;
import org.sosy_lab.decompiler.ir.Jump;
import org.sosy_lab.decompiler.ir.Register;

public class GraphRegionTest {

  private static final Register EAX = new Register("eax", 32);

  private static Block block(long pAddress) {
    return new Block(
        pAddress, ImmutableList.of(new Assignment(pAddress, EAX, new Constant(pAddress, 32))));
  }

  @Test
  public void headMustBePartOfTheGraph() {
    Block a = block(0x10);
    Block b = block(0x20);
    GraphRegion.Builder builder = GraphRegion.builder().addEdge(a, a);
    assertThrows(IllegalArgumentException.class, () -> builder.build(b));
  }

  @Test
  public void recursiveCopyDoesNotShareBlocks() {
    Block a = block(0x10);
    Block b = block(0x20);
    GraphRegion inner = GraphRegion.builder().addNode(b).build(b);
    GraphRegion outer = GraphRegion.builder().addEdge(a, inner).build(a);

    GraphRegion copy = outer.recursiveCopy();

    assertThat(copy.getGraph().nodes()).hasSize(2);
    Block headCopy = (Block) copy.getHead();
    assertThat(headCopy).isNotSameInstanceAs(a);
    headCopy.appendStatement(new Jump(0x14, 0x20));
    assertThat(a.getStatements()).hasSize(1);

    GraphRegion innerCopy =
        (GraphRegion) Iterables.getOnlyElement(copy.getGraph().successors(headCopy));
    assertThat(innerCopy).isNotSameInstanceAs(inner);
    assertThat(innerCopy.getHead()).isNotSameInstanceAs(b);
    assertThat(innerCopy.getAddress()).isEqualTo(0x20L);
  }

  @Test
  public void replacedSubRegionKeepsItsEdges() {
    Block a = block(0x10);
    Block b = block(0x20);
    Block c = block(0x30);
    GraphRegion inner = GraphRegion.builder().addNode(b).build(b);
    GraphRegion outer = GraphRegion.builder().addEdge(a, inner).addEdge(inner, c).build(a);

    Block replacement = block(0x20);
    outer.replaceRegion(inner, replacement);

    assertThat(outer.getGraph().nodes()).containsExactly(a, replacement, c).inOrder();
    assertThat(outer.getGraph().successors(a)).containsExactly(replacement);
    assertThat(outer.getGraph().successors(replacement)).containsExactly(c);
  }

  @Test
  public void replacingTheHeadRegionMovesTheHead() {
    Block b = block(0x20);
    Block c = block(0x30);
    GraphRegion inner = GraphRegion.builder().addNode(b).build(b);
    GraphRegion outer = GraphRegion.builder().addEdge(inner, c).build(inner);

    outer.replaceRegion(inner, b);

    assertThat(outer.getHead()).isSameInstanceAs(b);
  }
}
