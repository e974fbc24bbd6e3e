// This file is part of the Decompiler Structurer,
// a library for recovering structured control flow:
// https://www.sosy-lab.org
//
// SPDX-FileCopyrightText: 2024 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.decompiler.ir;

/**
 * A boolean condition that guards a structured node. While a region is being structured guards are
 * symbolic formulas, after structuring they are native {@link Expression}s.
 */
public interface Guard {}
