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

import com.google.common.base.Preconditions;
import org.nestedgeom.registry.NameNotFoundException;
import org.nestedgeom.registry.Registry;
import org.nestedgeom.unit.LatticeSpec;
import org.nestedgeom.unit.Unit;

/**
 * Renders units in the syntax of the simulation input format, e.g. {@code " ( 1 < U=2 < 3)"}.
 * Surfaces, cells and universes are replaced by their numbers from the registry.
 *
 * <p>Lookups that fail throw {@link NameNotFoundException} out of {@link #render}; no partial
 * string is returned.
 *
 * <p>A Vector's elements are concatenated without a separator; each one becomes a separate bin
 * at that position. A Union's alternatives are concatenated inside parentheses.
 */
public final class WireRenderer extends UnitRenderer {
  private final Registry registry;

  public WireRenderer(Registry registry) {
    this.registry = Preconditions.checkNotNull(registry);
  }

  @Override
  protected String nestedIn() {
    return " <";
  }

  @Override
  public String visitSurface(Unit.Surface surface) {
    return " " + registry.surfaceNumber(surface.name);
  }

  @Override
  public String visitCell(Unit.Cell cell) {
    return " " + registry.cellNumber(cell.name);
  }

  @Override
  public String visitNestedCell(Unit.NestedCell cell) {
    return visitCell(cell) + cell.latticeSpec().map(LatticeSpec::wire).orElse("");
  }

  @Override
  public String visitUniverse(Unit.Universe universe) {
    return " U=" + registry.universeNumber(universe.name);
  }

  @Override
  public String visitUnion(Unit.Union union) {
    return " (" + renderMembers(union.alternatives(), "") + ")";
  }

  @Override
  public String visitVector(Unit.Vector vector) {
    return renderMembers(vector.elements(), "");
  }
}
