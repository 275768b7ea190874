/*
 * Copyright 2025 The Nestedgeom Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.nestedgeom.render;

import static org.nestedgeom.util.StringUtil.quoted;

import org.nestedgeom.unit.LatticeSpec;
import org.nestedgeom.unit.Unit;

/**
 * Renders units as human-readable text for the comment that accompanies a tally, e.g. {@code " (
 * cell 'A' in univ 'B')"}. Never consults a registry.
 */
public final class CommentRenderer extends UnitRenderer {
  public static final CommentRenderer INSTANCE = new CommentRenderer();

  private CommentRenderer() {}

  @Override
  protected String nestedIn() {
    return " in";
  }

  @Override
  public String visitSurface(Unit.Surface surface) {
    return " surf " + quoted(surface.name);
  }

  @Override
  public String visitCell(Unit.Cell cell) {
    return " cell " + quoted(cell.name);
  }

  @Override
  public String visitNestedCell(Unit.NestedCell cell) {
    return visitCell(cell) + cell.latticeSpec().map(LatticeSpec::comment).orElse("");
  }

  @Override
  public String visitUniverse(Unit.Universe universe) {
    return " univ " + quoted(universe.name);
  }

  @Override
  public String visitUnion(Unit.Union union) {
    return " union of (" + renderMembers(union.alternatives(), ",") + ")";
  }

  @Override
  public String visitVector(Unit.Vector vector) {
    return " over (" + renderMembers(vector.elements(), ",") + ")";
  }
}
