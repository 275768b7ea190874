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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.nestedgeom.unit.LatticeSpec.Bounds;
import org.nestedgeom.unit.LatticeSpec.Coordinates;
import org.nestedgeom.unit.LatticeSpec.Index;
import org.nestedgeom.unit.LatticeSpec.Point;
import org.nestedgeom.unit.LatticeSpec.Range;

@RunWith(JUnit4.class)
public class LatticeSpecTest {

  @Test
  public void index() {
    LatticeSpec spec = Index.of(5);
    assertThat(spec.comment()).isEqualTo("-lat linear idx 5");
    assertThat(spec.wire()).isEqualTo("[5]");
  }

  @Test
  public void range() {
    LatticeSpec spec = Range.of(new int[] {0, 1}, new int[] {0, 0}, new int[] {0, 2});
    assertThat(spec.comment()).isEqualTo("-lat x range 0:1, y range 0:0, z range 0:2");
    assertThat(spec.wire()).isEqualTo("[0:1 0:0 0:2]");
  }

  @Test
  public void rangeDefaultsUnusedAxes() {
    assertThat(Range.of(Bounds.of(0, 5))).isEqualTo(Range.of(Bounds.of(0, 5), Bounds.UNUSED));
    assertThat(Range.of(Bounds.of(0, 5), Bounds.of(1, 2)).wire()).isEqualTo("[0:5 1:2 0:0]");
  }

  @Test
  public void rangeNegativeBounds() {
    LatticeSpec spec = Range.of(Bounds.of(-2, 2), Bounds.of(-1, 0), Bounds.UNUSED);
    assertThat(spec.wire()).isEqualTo("[-2:2 -1:0 0:0]");
  }

  @Test
  public void rangeRejectsWrongArity() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Range.of(new int[] {0, 1, 2}, new int[] {0, 0}, new int[] {0, 0}));
  }

  @Test
  public void singleCoordinateIsNormalizedToList() {
    Coordinates spec = Coordinates.of(1, 2, 3);
    assertThat(spec.points()).containsExactly(Point.of(1, 2, 3));
    assertThat(spec.comment()).isEqualTo("-lat coords (1, 2, 3)");
    assertThat(spec.wire()).isEqualTo("[ 1 2 3]");
  }

  @Test
  public void coordinateList() {
    Coordinates spec = Coordinates.of(new int[][] {{1, 2, 3}, {-1, 3, -2}});
    assertThat(spec.points()).containsExactly(Point.of(1, 2, 3), Point.of(-1, 3, -2)).inOrder();
    assertThat(spec.comment()).isEqualTo("-lat coords (1, 2, 3), (-1, 3, -2)");
    assertThat(spec.wire()).isEqualTo("[ 1 2 3, -1 3 -2]");
  }

  @Test
  public void defaultCoordinatesAreOrigin() {
    assertThat(Coordinates.of().wire()).isEqualTo("[ 0 0 0]");
  }

  @Test
  public void coordinatesRejectShortRow() {
    assertThrows(IllegalArgumentException.class, () -> Coordinates.of(new int[][] {{1, 2}}));
  }

  @Test
  public void toStringIsComment() {
    assertThat(Index.of(7).toString()).isEqualTo("-lat linear idx 7");
  }
}
