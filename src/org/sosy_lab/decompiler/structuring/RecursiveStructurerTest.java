// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.structuring;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.Test;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.decompiler.region.Block;
import org.sosy_lab.decompiler.region.GraphRegion;
import org.sosy_lab.decompiler.region.RegionNode;
import org.sosy_lab.decompiler.structuring.nodes.ConditionNode;
import org.sosy_lab.decompiler.structuring.nodes.LoopKind;
import org.sosy_lab.decompiler.structuring.nodes.LoopNode;

public class RecursiveStructurerTest extends AbstractStructurerTest {

  @Test
  public void nestedRegionIsStructuredInPlace() throws Exception {
    Block a = block(0x10, assign(0x10, 1), jump(0x14, 0x20));
    Block x = block(0x20, branch(0x20, ZF, 0x30, 0x40));
    Block y = block(0x30, assign(0x30, 2), jump(0x34, 0x50));
    Block z = block(0x40, assign(0x40, 3), jump(0x44, 0x50));
    Block d = block(0x50, ret(0x50));
    GraphRegion inner = GraphRegion.builder().addEdge(x, y).addEdge(x, z).build(x);
    GraphRegion outer = GraphRegion.builder().addEdge(a, inner).addEdge(inner, d).build(a);

    List<RegionNode> nodes = flatten(newStructurer().structure(outer));

    assertThat(nodes).hasSize(4);
    assertBlock(nodes.get(0), 0x10);
    assertBlock(nodes.get(1), 0x20);
    ConditionNode ifElse = (ConditionNode) nodes.get(2);
    assertThat(ifElse.getCondition()).isEqualTo(ZF);
    assertBlock(ifElse.getTrueNode(), 0x30);
    assertBlock(ifElse.getFalseNode(), 0x40);
    assertBlock(nodes.get(3), 0x50);
  }

  @Test
  public void givenRegionTreeIsNotModified() throws Exception {
    Block head = block(0x10, assign(0x10, 1));
    Block latch = block(0x20, assign(0x20, 2), branch(0x24, ZF, 0x30, 0x10));
    Block exit = block(0x30, ret(0x30));
    GraphRegion loop =
        GraphRegion.builder().addEdge(head, latch).addEdge(latch, head).build(head);
    GraphRegion region = GraphRegion.builder().addEdge(loop, exit).build(loop);

    newStructurer().structure(region);

    assertThat(region.getGraph().nodes()).containsExactly(loop, exit);
    assertThat(loop.getGraph().nodes()).containsExactly(head, latch);
    assertThat(latch.getStatements())
        .containsExactly(assign(0x20, 2), branch(0x24, ZF, 0x30, 0x10))
        .inOrder();
  }

  @Test
  public void loopInsideAcyclicRegion() throws Exception {
    Block entry = block(0x08, assign(0x08, 0));
    Block head = block(0x10, assign(0x10, 1));
    Block latch = block(0x20, assign(0x20, 2), branch(0x24, ZF, 0x30, 0x10));
    Block exit = block(0x30, ret(0x30));
    GraphRegion loop =
        GraphRegion.builder().addEdge(head, latch).addEdge(latch, head).build(head);
    GraphRegion region =
        GraphRegion.builder().addEdge(entry, loop).addEdge(loop, exit).build(entry);

    RecursiveStructurer structurer = newStructurer();
    List<RegionNode> nodes = flatten(structurer.structure(region));

    assertThat(nodes).hasSize(3);
    assertBlock(nodes.get(0), 0x08);
    assertThat(((LoopNode) nodes.get(1)).getKind()).isEqualTo(LoopKind.DO_WHILE);
    assertBlock(nodes.get(2), 0x30);
  }

  @Test
  public void inconsistentRegionIsRejectedWhenChecked() throws InvalidConfigurationException {
    Block a = block(0x10, ret(0x10));
    Block b = block(0x20, ret(0x20));
    GraphRegion region = GraphRegion.builder().addNode(a).addNode(b).build(a);

    RecursiveStructurer structurer = newStructurer("structurer.checkRegions", "true");
    StructuringException e =
        assertThrows(StructuringException.class, () -> structurer.structure(region));
    assertThat(e).hasMessageThat().startsWith("Inconsistent region tree");
  }

  @Test
  public void statisticsArePrinted() throws Exception {
    Block head = block(0x10, assign(0x10, 1));
    Block latch = block(0x20, assign(0x20, 2), branch(0x24, ZF, 0x30, 0x10));
    Block exit = block(0x30, ret(0x30));
    GraphRegion loop =
        GraphRegion.builder().addEdge(head, latch).addEdge(latch, head).build(head);
    GraphRegion region = GraphRegion.builder().addEdge(loop, exit).build(loop);

    RecursiveStructurer structurer = newStructurer();
    structurer.structure(region);
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (PrintStream stream = new PrintStream(out, true, StandardCharsets.UTF_8.name())) {
      structurer.printStatistics(stream);
    }

    String printed = out.toString(StandardCharsets.UTF_8.name());
    assertThat(printed).contains("structured regions");
    assertThat(printed).contains("do_while loops");
    assertThat(printed).contains("breaks");
    assertThat(structurer.getStatistics().totalTimer.getNumberOfIntervals()).isEqualTo(1);
  }
}
