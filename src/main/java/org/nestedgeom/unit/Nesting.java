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

package org.nestedgeom.unit;

import static com.google.common.flogger.LazyArgs.lazy;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import org.nestedgeom.unit.Unit.Union;
import org.nestedgeom.unit.Unit.Vector;

/**
 * Static-only class with the operations that build unit graphs: nesting one unit in another
 * ({@link #join}) and merging siblings into a {@link Union} or {@link Vector}.
 *
 * <p>Typical use:
 *
 * <pre>{@code
 * Unit u = new Surface("A").union(new Surface("B"))
 *     .of(new NestedCell("C", Range.of(Bounds.of(0, 1))));
 * }</pre>
 */
public final class Nesting {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private Nesting() {}

  /**
   * Nests {@code inner} directly inside {@code outer}, setting {@code inner.up()} to {@code outer}
   * and {@code outer.down()} to {@code inner}, and returns the innermost unit of the resulting
   * chain. If {@code inner} is itself the outer end of an earlier join the chain continues below
   * it, so {@code join(b, c)} after {@code join(a, b)} returns {@code a}.
   *
   * @throws AlreadyNestedException if {@code inner} already has an outer level or {@code outer}
   *     already has an inner level
   * @throws IllegalArgumentException if {@code outer} is already part of {@code inner}'s chain
   */
  @CanIgnoreReturnValue
  public static Unit join(Unit inner, Unit outer) {
    Preconditions.checkNotNull(inner);
    Preconditions.checkNotNull(outer);
    if (inner.up() != null) {
      throw new AlreadyNestedException(
          inner, String.format("Unit is already nested:%s", inner));
    }
    if (outer.down() != null) {
      throw new AlreadyNestedException(
          outer, String.format("Unit already has an inner level:%s", outer));
    }
    // Linking connects the two units both ways, so any existing path between them becomes a cycle.
    Preconditions.checkArgument(
        !outer.reaches(inner) && !inner.reaches(outer),
        "Cannot nest a %s in a %s that it is already connected to",
        inner.getClass().getSimpleName(),
        outer.getClass().getSimpleName());
    Unit.link(inner, outer);
    logger.atFine().log("Nested %s", lazy(inner::toString));
    return inner.innermost();
  }

  /**
   * Builds the chain {@code units[0] in units[1] in ... in units[n-1]} and returns its innermost
   * unit. With a single argument, returns that unit unchanged.
   */
  @CanIgnoreReturnValue
  public static Unit chain(Unit... units) {
    Preconditions.checkArgument(units.length > 0, "At least one unit is required");
    for (int i = units.length - 2; i >= 0; i--) {
      join(units[i], units[i + 1]);
    }
    return units[0].innermost();
  }

  /**
   * If {@code left} is a Union, appends {@code right} to its alternatives and returns it; otherwise
   * returns a new Union of {@code left} and {@code right}. Member kinds are not checked.
   */
  @CanIgnoreReturnValue
  public static Union unionWith(Unit left, Unit right) {
    Preconditions.checkNotNull(left);
    Preconditions.checkNotNull(right);
    if (left instanceof Union union) {
      union.append(right);
      logger.atFine().log("Added alternative #%d to union", union.size());
      return union;
    }
    return new Union(ImmutableList.of(left, right));
  }

  /**
   * If {@code left} is a Vector, appends {@code right} to its elements and returns it; otherwise
   * returns a new Vector of {@code left} and {@code right}. Member kinds are not checked.
   */
  @CanIgnoreReturnValue
  public static Vector vectorWith(Unit left, Unit right) {
    Preconditions.checkNotNull(left);
    Preconditions.checkNotNull(right);
    if (left instanceof Vector vector) {
      vector.append(right);
      logger.atFine().log("Added element #%d to vector", vector.size());
      return vector;
    }
    return new Vector(ImmutableList.of(left, right));
  }

  /** Returns a new Union with the given alternatives, in order. */
  public static Union unionOf(Unit... alternatives) {
    return new Union(Arrays.asList(alternatives));
  }

  /** Returns a new Vector with the given elements, in order. */
  public static Vector vectorOf(Unit... elements) {
    return new Vector(Arrays.asList(elements));
  }

  /**
   * Returns the number of separate tally units that the chain containing {@code unit} expands
   * into. Each level contributes a factor of 1, except that a Vector contributes the sum of its
   * elements' counts.
   */
  public static int binCount(Unit unit) {
    int result = 1;
    for (Unit level = unit.innermost(); level != null; level = level.up()) {
      result = Math.multiplyExact(result, levelCount(level));
    }
    return result;
  }

  private static int levelCount(Unit level) {
    if (level instanceof Vector vector) {
      return vector.elements().stream().mapToInt(Nesting::binCount).sum();
    }
    return 1;
  }
}
