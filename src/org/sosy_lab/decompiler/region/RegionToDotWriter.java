// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.region;

import com.google.common.base.Preconditions;
import com.google.common.graph.EndpointPair;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.decompiler.ir.ConditionalJump;
import org.sosy_lab.decompiler.ir.Statement;

/** This Writer can dump a region tree into a file, nested regions are drawn as clusters. */
public class RegionToDotWriter {

  private final GraphRegion region;
  private final Map<RegionNode, String> nodeIds = new IdentityHashMap<>();
  private int regionIndex = 0;

  public RegionToDotWriter(GraphRegion pRegion) {
    region = Preconditions.checkNotNull(pRegion);
  }

  /** dump the region tree to the given file. */
  public void dump(final Path pFile, LogManager pLogger) {
    try {
      MoreFiles.createParentDirectories(pFile);
    } catch (IOException e) {
      pLogger.logUserException(
          Level.WARNING, e, "Could not create parent directories to write regions to dot file");
      return;
    }

    try (Writer w = Files.newBufferedWriter(pFile, StandardCharsets.UTF_8)) {
      dump(w);
    } catch (IOException e) {
      pLogger.logUserException(Level.WARNING, e, "Could not write regions to dot file");
    }
  }

  /** dump the region tree to the given appendable. */
  public void dump(final Appendable app) throws IOException {
    nodeIds.clear();
    regionIndex = 0;

    app.append("digraph region_" + Long.toHexString(region.getAddress()) + " {\n");
    final List<EndpointPair<RegionNode>> edges = new ArrayList<>();
    dumpRegion(app, region, edges, 0);

    // we have to dump edges after the nodes and sub-graphs,
    // because Dot generates wrong graphs for edges from an inner block to an outer block.
    for (EndpointPair<RegionNode> edge : edges) {
      app.append(formatEdge(edge));
    }
    app.append("}\n");
  }

  private static final String[] background = new String[] {"white", "lightgrey", "grey"};

  /** Dump the current region and all inner regions of it. */
  private void dumpRegion(
      final Appendable app,
      final GraphRegion pRegion,
      final List<EndpointPair<RegionNode>> edges,
      final int depth)
      throws IOException {
    app.append("subgraph cluster_r" + regionIndex++ + " {\n");
    app.append("style=filled\n");
    app.append("fillcolor=" + background[depth % background.length] + "\n");
    app.append("label=\"" + escape(pRegion.toString()) + "\"\n");

    for (RegionNode node : pRegion.getGraph().nodes()) {
      if (node instanceof GraphRegion) {
        dumpRegion(app, (GraphRegion) node, edges, depth + 1);
      } else {
        app.append(formatNode(node, node == pRegion.getHead()));
      }
    }
    edges.addAll(pRegion.getGraph().edges());

    app.append("}\n");
  }

  private String idOf(RegionNode pNode) {
    if (pNode instanceof GraphRegion) {
      // edges to a cluster are drawn to its head
      return idOf(((GraphRegion) pNode).getHead());
    }
    return nodeIds.computeIfAbsent(pNode, n -> "n" + nodeIds.size());
  }

  private String formatNode(RegionNode pNode, boolean pIsHead) {
    String shape = "shape=box ";
    if (pIsHead) {
      shape = "shape=doubleoctagon ";
    } else if (getTransfer(pNode) instanceof ConditionalJump) {
      shape = "shape=diamond ";
    }
    String label = "label=\"" + escape(pNode.toString()) + "\" ";
    return idOf(pNode) + " [" + shape + label + "]\n";
  }

  private String formatEdge(EndpointPair<RegionNode> pEdge) {
    StringBuilder sb = new StringBuilder();
    sb.append(idOf(pEdge.source()));
    sb.append(" -> ");
    sb.append(idOf(pEdge.target()));
    Statement transfer = getTransfer(pEdge.source());
    if (transfer instanceof ConditionalJump) {
      ConditionalJump jump = (ConditionalJump) transfer;
      long target = pEdge.target().getAddress();
      if (jump.getTrueTarget() == target) {
        sb.append(" [label=\"T\"]");
      } else if (jump.getFalseTarget() == target) {
        sb.append(" [label=\"F\" style=\"dashed\"]");
      }
    }
    sb.append("\n");
    return sb.toString();
  }

  private static @Nullable Statement getTransfer(RegionNode pNode) {
    return pNode instanceof Block ? ((Block) pNode).getLastStatement() : null;
  }

  private static String escape(String pLabel) {
    return pLabel.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}
