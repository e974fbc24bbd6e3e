// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.region;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.decompiler.ir.ConditionalJump;
import org.sosy_lab.decompiler.ir.Register;
import org.sosy_lab.decompiler.ir.Return;

public class RegionToDotWriterTest {

  @Rule public final TemporaryFolder tempFolder = new TemporaryFolder();

  private static GraphRegion region() {
    Block a =
        new Block(
            0x10, ImmutableList.of(new ConditionalJump(0x10, new Register("zf", 1), 0x20, 0x30)));
    Block b = new Block(0x20, ImmutableList.of(new Return(0x20, null)));
    Block c = new Block(0x30, ImmutableList.of(new Return(0x30, null)));
    GraphRegion inner = GraphRegion.builder().addNode(c).build(c);
    return GraphRegion.builder().addEdge(a, b).addEdge(a, inner).build(a);
  }

  @Test
  public void nestedRegionsBecomeClusters() throws IOException {
    StringBuilder sb = new StringBuilder();
    new RegionToDotWriter(region()).dump(sb);
    String dot = sb.toString();

    assertThat(dot).startsWith("digraph region_10 {");
    assertThat(dot).contains("subgraph cluster_r0 {");
    assertThat(dot).contains("subgraph cluster_r1 {");
    assertThat(dot).contains("shape=doubleoctagon");
    assertThat(dot).contains("[label=\"T\"]");
    assertThat(dot).contains("[label=\"F\" style=\"dashed\"]");
    assertThat(dot.trim()).endsWith("}");
  }

  @Test
  public void dumpToFile() throws IOException {
    Path file = tempFolder.getRoot().toPath().resolve("regions").resolve("region.dot");

    new RegionToDotWriter(region()).dump(file, LogManager.createTestLogManager());

    assertThat(Files.exists(file)).isTrue();
    assertThat(new String(Files.readAllBytes(file), StandardCharsets.UTF_8))
        .contains("subgraph cluster_r1");
  }
}
