/*
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
package org.gbif.wcs.common.coords;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TransformMatrixTest {

  @Test
  public void testStepsAndRotation() {
    TransformMatrix m = TransformMatrix.fromStepsAndRotation(-2, 3, 0);
    assertEquals(-2, m.getM11(), 0);
    assertEquals(0, m.getM12(), 0);
    assertEquals(0, m.getM21(), 0);
    assertEquals(3, m.getM22(), 0);
    assertEquals(2, m.norm1(), 0);
    assertEquals(3, m.norm2(), 0);

    m = TransformMatrix.fromStepsAndRotation(2, 2, 90);
    assertEquals(0, m.getM11(), 1e-15);
    assertEquals(-2, m.getM12(), 1e-15);
    assertEquals(2, m.getM21(), 1e-15);
    assertEquals(0, m.getM22(), 1e-15);
    // rotation keeps the steps
    assertEquals(2, m.norm1(), 1e-15);
    assertEquals(2, m.norm2(), 1e-15);
  }

  @Test
  public void testInverse() {
    TransformMatrix m = new TransformMatrix(1, 2, 3, 4);
    assertEquals(-2, m.determinant(), 0);
    TransformMatrix product = m.multiply(m.inverse());
    assertEquals(1, product.getM11(), 1e-12);
    assertEquals(0, product.getM12(), 1e-12);
    assertEquals(0, product.getM21(), 1e-12);
    assertEquals(1, product.getM22(), 1e-12);

    assertArrayEquals(new double[] {5, 11}, m.apply(1, 2), 0);
    assertArrayEquals(new double[] {2, 9}, m.scaleRows(2, 3).apply(1, 0), 0);
  }

  @Test
  public void testRotationsCompose() {
    TransformMatrix r = TransformMatrix.rotation(30).multiply(TransformMatrix.rotation(60));
    TransformMatrix expected = TransformMatrix.rotation(90);
    assertEquals(expected.getM11(), r.getM11(), 1e-12);
    assertEquals(expected.getM12(), r.getM12(), 1e-12);
    assertEquals(expected.getM21(), r.getM21(), 1e-12);
    assertEquals(expected.getM22(), r.getM22(), 1e-12);
  }

  @Test
  public void testUsable() {
    assertTrue(TransformMatrix.IDENTITY.isUsable());
    assertFalse(new TransformMatrix(1, 1, 1, 1).isUsable());
    assertFalse(new TransformMatrix(Double.NaN, 0, 0, 1).isUsable());
  }

  @Test(expected = NoStandardCoordinateSystemException.class)
  public void testSingular() {
    new TransformMatrix(1, 2, 2, 4).inverse();
  }
}
