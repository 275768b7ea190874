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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.nestedgeom.registry.NameNotFoundException;
import org.nestedgeom.registry.Registry;
import org.nestedgeom.render.CommentRenderer;
import org.nestedgeom.render.WireRenderer;
import org.nestedgeom.util.StringUtil;

/**
 * One level of a nested-geometry tally unit. There are exactly six concrete subclasses, all defined
 * in this file: Surface, Cell, NestedCell, Universe, Union, and Vector.
 *
 * <p>Units form chains: {@link #up} is the next level outward (the unit this one is contained in)
 * and {@link #down} is the next level inward. The two links are always set together by {@link
 * Nesting#join}, so {@code a.up() == b} exactly when {@code b.down() == a}. A chain never revisits
 * a unit, and no unit can be reached from itself by following links and Union or Vector members,
 * so rendering always terminates.
 *
 * <p>Apart from the links (and the member lists of Union and Vector), units are immutable. Units
 * are compared by identity.
 */
public abstract sealed class Unit
    permits Unit.Surface, Unit.Cell, Unit.Universe, Unit.Combinator {

  private @Nullable Unit up;
  private @Nullable Unit down;

  Unit() {}

  /** The unit that this one is nested in, or null if this is the outermost level. */
  public final @Nullable Unit up() {
    return up;
  }

  /** The unit nested directly inside this one, or null if this is the innermost level. */
  public final @Nullable Unit down() {
    return down;
  }

  public final boolean isOutermost() {
    return up == null;
  }

  public final boolean isInnermost() {
    return down == null;
  }

  /** Returns the innermost unit of the chain containing this one (possibly this unit). */
  public final Unit innermost() {
    Unit result = this;
    while (result.down != null) {
      result = result.down;
    }
    return result;
  }

  /** Returns the outermost unit of the chain containing this one (possibly this unit). */
  public final Unit outermost() {
    Unit result = this;
    while (result.up != null) {
      result = result.up;
    }
    return result;
  }

  /** Sets both halves of the link; callers are responsible for checking it is legal. */
  static void link(Unit inner, Unit outer) {
    assert inner.up == null && outer.down == null;
    inner.up = outer;
    outer.down = inner;
  }

  /**
   * True if {@code target} is this unit or can be reached from it by following {@code up}, {@code
   * down}, and the members of any Union or Vector along the way.
   */
  final boolean reaches(Unit target) {
    Set<Unit> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    Deque<Unit> pending = new ArrayDeque<>();
    pending.add(this);
    while (!pending.isEmpty()) {
      Unit unit = pending.remove();
      if (unit == target) {
        return true;
      }
      if (!visited.add(unit)) {
        continue;
      }
      if (unit.up != null) {
        pending.add(unit.up);
      }
      if (unit.down != null) {
        pending.add(unit.down);
      }
      if (unit instanceof Combinator combinator) {
        pending.addAll(combinator.members);
      }
    }
    return false;
  }

  /**
   * Nests this unit in {@code outer} and returns the innermost unit of the resulting chain. See
   * {@link Nesting#join}.
   */
  @CanIgnoreReturnValue
  public final Unit of(Unit outer) {
    return Nesting.join(this, outer);
  }

  /** Equivalent to {@code Nesting.unionWith(this, right)}. */
  @CanIgnoreReturnValue
  public final Union union(Unit right) {
    return Nesting.unionWith(this, right);
  }

  /** Equivalent to {@code Nesting.vectorWith(this, right)}. */
  @CanIgnoreReturnValue
  public final Vector vector(Unit right) {
    return Nesting.vectorWith(this, right);
  }

  /**
   * Returns a copy of this unit that selects the given lattice elements. Only a {@link NestedCell}
   * can carry a lattice spec; every other unit throws {@link InvalidLatticeAttachmentException}.
   */
  public NestedCell lat(LatticeSpec latticeSpec) {
    throw new InvalidLatticeAttachmentException(this);
  }

  /** Calls the visitor method that corresponds to this unit's class. */
  public abstract <T> T accept(Visitor<T> visitor);

  /** Returns the human-readable rendering of the chain containing this unit. */
  public final String comment() {
    return CommentRenderer.INSTANCE.render(this);
  }

  /**
   * Returns the wire-format rendering of the chain containing this unit.
   *
   * @throws NameNotFoundException if a name used in the chain is not in {@code registry}
   */
  public final String wire(Registry registry) {
    return new WireRenderer(registry).render(this);
  }

  @Override
  public final String toString() {
    return comment();
  }

  /** One method for each of the six unit classes. */
  public interface Visitor<T> {
    T visitSurface(Surface surface);

    T visitCell(Cell cell);

    T visitNestedCell(NestedCell cell);

    T visitUniverse(Universe universe);

    T visitUnion(Union union);

    T visitVector(Vector vector);
  }

  private static String checkName(String name) {
    Preconditions.checkNotNull(name);
    Preconditions.checkArgument(StringUtil.isQuotable(name), "Invalid name: \"%s\"", name);
    return name;
  }

  /** A surface of the system, looked up by name when rendered. */
  public static final class Surface extends Unit {
    public final String name;

    public Surface(String name) {
      this.name = checkName(name);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitSurface(this);
    }
  }

  /**
   * A cell of the system. Plain Cells are meant for the innermost level; cells at higher levels
   * that may need to select lattice elements are {@link NestedCell}s.
   */
  public static sealed class Cell extends Unit permits NestedCell {
    public final String name;

    public Cell(String name) {
      this.name = checkName(name);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCell(this);
    }
  }

  /** A cell at a higher level of nesting, optionally restricted to some of its lattice elements. */
  public static final class NestedCell extends Cell {
    private final @Nullable LatticeSpec latticeSpec;

    public NestedCell(String name) {
      this(name, null);
    }

    public NestedCell(String name, @Nullable LatticeSpec latticeSpec) {
      super(name);
      this.latticeSpec = latticeSpec;
    }

    public Optional<LatticeSpec> latticeSpec() {
      return Optional.ofNullable(latticeSpec);
    }

    /**
     * Returns a new NestedCell with the same name and the given lattice spec. This unit must not
     * have been linked yet.
     */
    @Override
    public NestedCell lat(LatticeSpec latticeSpec) {
      Preconditions.checkNotNull(latticeSpec);
      Preconditions.checkState(
          isOutermost() && isInnermost(), "Cannot replace a linked cell: %s", this);
      return new NestedCell(name, latticeSpec);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitNestedCell(this);
    }
  }

  /** A universe of the system, looked up by name when rendered. */
  public static final class Universe extends Unit {
    public final String name;

    public Universe(String name) {
      this.name = checkName(name);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitUniverse(this);
    }
  }

  /**
   * Shared implementation of Union and Vector: a non-empty, ordered list of member units that can
   * only grow.
   */
  abstract static sealed class Combinator extends Unit permits Union, Vector {
    private final List<Unit> members;

    Combinator(List<Unit> members) {
      Preconditions.checkArgument(!members.isEmpty(), "At least one member is required");
      for (Unit member : members) {
        Preconditions.checkNotNull(member);
      }
      this.members = new ArrayList<>(members);
    }

    /** A snapshot of the current members, in the order they were added. */
    final ImmutableList<Unit> members() {
      return ImmutableList.copyOf(members);
    }

    final int size() {
      return members.size();
    }

    final void append(Unit member) {
      Preconditions.checkArgument(
          !member.reaches(this),
          "Cannot merge a %s into a %s that it already contains",
          member.getClass().getSimpleName(),
          getClass().getSimpleName());
      members.add(member);
    }
  }

  /** Any one of the alternatives satisfies this level. */
  public static final class Union extends Combinator {
    Union(List<Unit> alternatives) {
      super(alternatives);
    }

    public ImmutableList<Unit> alternatives() {
      return members();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitUnion(this);
    }
  }

  /**
   * Each element is a separate binding at this level, so that one expression expands into several
   * tally units ("multiple bin" form).
   */
  public static final class Vector extends Combinator {
    Vector(List<Unit> elements) {
      super(elements);
    }

    public ImmutableList<Unit> elements() {
      return members();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitVector(this);
    }
  }
}
