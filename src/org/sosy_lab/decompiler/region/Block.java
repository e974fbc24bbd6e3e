// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.region;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.decompiler.ir.Statement;

/**
 * Basic block of lifted statements. The last statement may be the transfer of control that leaves
 * the block.
 *
 * <p>The statement list is mutable, because structuring loops strips or retargets transfers.
 */
public final class Block implements RegionNode {

  private final long address;
  private final List<Statement> statements;

  public Block(long pAddress, List<? extends Statement> pStatements) {
    address = pAddress;
    statements = new ArrayList<>(checkNotNull(pStatements));
  }

  @Override
  public long getAddress() {
    return address;
  }

  public List<Statement> getStatements() {
    return Collections.unmodifiableList(statements);
  }

  public boolean isEmpty() {
    return statements.isEmpty();
  }

  public @Nullable Statement getLastStatement() {
    return statements.isEmpty() ? null : statements.get(statements.size() - 1);
  }

  public @Nullable Statement removeLastStatement() {
    return statements.isEmpty() ? null : statements.remove(statements.size() - 1);
  }

  public void appendStatement(Statement pStatement) {
    statements.add(checkNotNull(pStatement));
  }

  public Block copy() {
    return new Block(address, statements);
  }

  @Override
  public String toString() {
    return "Block 0x" + Long.toHexString(address) + " [" + Joiner.on("; ").join(statements) + "]";
  }
}
