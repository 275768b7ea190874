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
import com.google.common.flogger.FluentLogger;
import java.util.List;
import org.nestedgeom.unit.Unit;
import org.nestedgeom.util.StringUtil;

/**
 * Renders a chain of units as a single string. Subclasses supply the text for each level (by
 * implementing {@link Unit.Visitor}) and the separator between a level and the next one out;
 * UnitRenderer walks the chain and adds the parentheses.
 *
 * <p>Parentheses only appear at the ends of a chain: {@code " ("} before the innermost level and
 * {@code ")"} after the outermost one. A unit with no links gets neither.
 *
 * <p>Rendering never modifies the units, so rendering the same graph again gives the same string.
 */
public abstract class UnitRenderer implements Unit.Visitor<String> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** The text placed between a level and the level that contains it. */
  protected abstract String nestedIn();

  /**
   * Returns the rendering of the whole chain containing {@code unit}; it doesn't matter which unit
   * of the chain is passed.
   */
  public final String render(Unit unit) {
    Preconditions.checkNotNull(unit);
    StringBuilder sb = new StringBuilder();
    for (Unit level = unit.innermost(); level != null; level = level.up()) {
      boolean hasUp = !level.isOutermost();
      boolean hasDown = !level.isInnermost();
      if (hasUp && !hasDown) {
        sb.append(" (");
      }
      sb.append(level.accept(this));
      if (hasUp) {
        sb.append(nestedIn());
      } else if (hasDown) {
        sb.append(")");
      }
    }
    String result = sb.toString();
    logger.atFinest().log("%s:%s", getClass().getSimpleName(), result);
    return result;
  }

  /** Renders each member with {@link #render} and joins the results with {@code separator}. */
  protected final String renderMembers(List<Unit> members, String separator) {
    return StringUtil.joinElements(separator, "", "", members, this::render);
  }
}
