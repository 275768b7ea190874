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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import org.nestedgeom.util.StringUtil;

/**
 * Selects one or more elements of a lattice cell. There are exactly three implementations, all
 * defined in this file: {@link Index} (a single linear index), {@link Range} (an index range along
 * each axis), and {@link Coordinates} (an explicit list of element coordinates).
 *
 * <p>A LatticeSpec is a value; it has no links and may be shared by any number of {@link
 * Unit.NestedCell}s.
 */
public sealed interface LatticeSpec {

  /** The part of the comment that follows {@code "-lat "}. */
  String commentBody();

  /** The part of the wire text that goes between the square brackets. */
  String wireBody();

  /** Returns the human-readable form, e.g. {@code "-lat linear idx 4"}. */
  default String comment() {
    return "-lat " + commentBody();
  }

  /** Returns the wire form, e.g. {@code "[4]"}. */
  default String wire() {
    return "[" + wireBody() + "]";
  }

  /** A single linear (one-dimensional) index of a lattice element. */
  record Index(int index) implements LatticeSpec {
    public static Index of(int index) {
      return new Index(index);
    }

    @Override
    public String commentBody() {
      return "linear idx " + index;
    }

    @Override
    public String wireBody() {
      return String.valueOf(index);
    }

    @Override
    public String toString() {
      return comment();
    }
  }

  /**
   * The inclusive bounds of a range along one axis. {@code (0, 0)} conventionally means the axis is
   * not used; that convention is not checked.
   */
  record Bounds(int lo, int hi) {
    public static final Bounds UNUSED = new Bounds(0, 0);

    public static Bounds of(int lo, int hi) {
      return new Bounds(lo, hi);
    }

    @Override
    public String toString() {
      return lo + ":" + hi;
    }
  }

  /** A block of lattice elements given by an index range along each of x, y and z. */
  record Range(Bounds x, Bounds y, Bounds z) implements LatticeSpec {
    public Range {
      Preconditions.checkNotNull(x);
      Preconditions.checkNotNull(y);
      Preconditions.checkNotNull(z);
    }

    /** A range along x only; y and z are left as {@link Bounds#UNUSED}. */
    public static Range of(Bounds x) {
      return new Range(x, Bounds.UNUSED, Bounds.UNUSED);
    }

    /** A range along x and y; z is left as {@link Bounds#UNUSED}. */
    public static Range of(Bounds x, Bounds y) {
      return new Range(x, y, Bounds.UNUSED);
    }

    public static Range of(Bounds x, Bounds y, Bounds z) {
      return new Range(x, y, z);
    }

    /**
     * Builds a Range from three two-element arrays, e.g. {@code Range.of(new int[] {0, 1}, new
     * int[] {0, 0}, new int[] {0, 2})}.
     */
    public static Range of(int[] x, int[] y, int[] z) {
      return new Range(bounds(x), bounds(y), bounds(z));
    }

    private static Bounds bounds(int[] pair) {
      Preconditions.checkArgument(
          pair.length == 2, "Expected a pair of bounds, got %s", Arrays.toString(pair));
      return new Bounds(pair[0], pair[1]);
    }

    @Override
    public String commentBody() {
      return String.format("x range %s, y range %s, z range %s", x, y, z);
    }

    @Override
    public String wireBody() {
      return x + " " + y + " " + z;
    }

    @Override
    public String toString() {
      return comment();
    }
  }

  /** The (i, j, k) indices of a single lattice element. */
  record Point(int x, int y, int z) {
    public static final Point ORIGIN = new Point(0, 0, 0);

    public static Point of(int x, int y, int z) {
      return new Point(x, y, z);
    }

    @Override
    public String toString() {
      return "(" + x + ", " + y + ", " + z + ")";
    }
  }

  /** An explicit list of lattice elements, each given by its coordinates. */
  record Coordinates(ImmutableList<Point> points) implements LatticeSpec {
    public Coordinates {
      Preconditions.checkArgument(!points.isEmpty(), "Coordinates require at least one point");
    }

    /** The single element at the lattice origin. */
    public static Coordinates of() {
      return new Coordinates(ImmutableList.of(Point.ORIGIN));
    }

    /** A single element; stored as a one-element list. */
    public static Coordinates of(int x, int y, int z) {
      return new Coordinates(ImmutableList.of(new Point(x, y, z)));
    }

    public static Coordinates of(Point... points) {
      return new Coordinates(ImmutableList.copyOf(points));
    }

    public static Coordinates of(List<Point> points) {
      return new Coordinates(ImmutableList.copyOf(points));
    }

    /**
     * Builds Coordinates from rows of three ints each, e.g. {@code Coordinates.of(new int[][]
     * {{1, 2, 3}, {-1, 3, -2}})}.
     */
    public static Coordinates of(int[][] rows) {
      return new Coordinates(
          Arrays.stream(rows).map(Coordinates::point).collect(toImmutableList()));
    }

    private static Point point(int[] row) {
      Preconditions.checkArgument(
          row.length == 3, "Expected three coordinates, got %s", Arrays.toString(row));
      return new Point(row[0], row[1], row[2]);
    }

    @Override
    public String commentBody() {
      return StringUtil.joinElements(",", "coords", "", points, p -> " " + p);
    }

    @Override
    public String wireBody() {
      return StringUtil.joinElements(
          ",", "", "", points, p -> " " + p.x() + " " + p.y() + " " + p.z());
    }

    @Override
    public String toString() {
      return comment();
    }
  }
}
