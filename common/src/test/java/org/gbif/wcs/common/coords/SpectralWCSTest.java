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

import java.util.List;

import org.gbif.wcs.common.geometry.IndexRange;
import org.gbif.wcs.common.header.WcsHeader;
import org.gbif.wcs.common.unit.AxisUnit;

import com.google.common.collect.Lists;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class SpectralWCSTest {

  private static SpectralWCS tenPixels() {
    return SpectralWCS.builder().crval(0d).cdelt(1d).shape(10).build();
  }

  @Test
  public void testDefaults() {
    SpectralWCS wave = SpectralWCS.builder().build();
    assertEquals(1, wave.getCrpix(), 0);
    assertEquals(1, wave.getCrval(), 0);
    assertEquals(1, wave.getStep(), 0);
    assertEquals(AxisUnit.ANGSTROM, wave.getUnit());
    assertEquals("LINEAR", wave.getCtype());
    assertNull(wave.getShape());
  }

  @Test
  public void testCopy() {
    SpectralWCS wave = tenPixels();
    SpectralWCS copy = wave.copy();
    assertNotSame(wave, copy);
    assertTrue(wave.isEqual(copy));

    copy.setCrval(100, null);
    assertEquals(0, wave.getCrval(), 0);
    assertFalse(wave.isEqual(copy));
  }

  @Test
  public void testCoord() {
    SpectralWCS wave = tenPixels();
    assertArrayEquals(new double[] {0, 1, 2, 3, 4, 5, 6, 7, 8, 9}, wave.coord(), 0);
    assertEquals(4.5, wave.coord(4.5), 0);
    assertEquals(9, wave.getEnd(), 0);
    assertArrayEquals(new double[] {0, 9}, wave.getRange(), 0);
    assertArrayEquals(new double[] {0.1, 0.3}, wave.coord(new double[] {1, 3}, AxisUnit.NANOMETER), 1e-12);
  }

  @Test
  public void testPixel() {
    SpectralWCS wave = tenPixels();
    assertEquals(3.4, wave.pixel(3.4), 1e-12);
    assertEquals(3, wave.pixel(3.4, true, null), 0);
    assertEquals(4, wave.pixel(3.5, true, null), 0);
    assertEquals(2, wave.pixel(0.2, true, AxisUnit.NANOMETER), 0);

    // nearest pixels are clamped into the axis
    assertEquals(0, wave.pixel(-5, true, null), 0);
    assertEquals(9, wave.pixel(100, true, null), 0);
    assertEquals(100, wave.pixel(100), 0);

    double[] lbda = {0.5, 2.25, 7};
    assertArrayEquals(lbda, wave.coord(wave.pixel(lbda, false, null), null), 1e-12);
  }

  /**
   * Every pixel is its own nearest pixel, on an axis whose reference pixel, value and step are all off the grid.
   */
  @Test
  public void testNearestPixelOfEveryCoordinate() {
    SpectralWCS wave = SpectralWCS.builder().crpix(3.5).crval(4750.25).cdelt(0.37).ctype("AWAV").shape(3681).build();
    for (int i = 0; i < wave.getShape(); i++) {
      assertEquals("pixel " + i, i, wave.pixel(wave.coord(i), true, null), 0);
    }
  }

  @Test(expected = MissingLengthException.class)
  public void testCoordWithoutLength() {
    SpectralWCS.builder().build().coord();
  }

  @Test(expected = MissingLengthException.class)
  public void testEndWithoutLength() {
    SpectralWCS.builder().build().getEnd();
  }

  @Test
  public void testSlice() {
    SpectralWCS wave = SpectralWCS.builder().crval(4000d).cdelt(2d).shape(10).build();
    assertEquals(4004, wave.slice(2), 0);
    assertEquals(4018, wave.slice(-1), 0);

    SpectralWCS sub = wave.slice(new IndexRange(2, 6));
    assertEquals(4004, sub.getStart(), 0);
    assertEquals(2, sub.getStep(), 0);
    assertEquals(Integer.valueOf(4), sub.getShape());
    assertEquals(4010, sub.getEnd(), 0);

    SpectralWCS strided = wave.slice(new IndexRange(0, 10, 3));
    assertEquals(6, strided.getStep(), 0);
    assertEquals(Integer.valueOf(4), strided.getShape());

    SpectralWCS tail = wave.slice(new IndexRange(-3, null));
    assertEquals(4014, tail.getStart(), 0);
    assertEquals(Integer.valueOf(3), tail.getShape());
  }

  @Test
  public void testReversedSlice() {
    SpectralWCS wave = SpectralWCS.builder().crval(4000d).cdelt(2d).shape(10).build();
    SpectralWCS reversed = wave.slice(new IndexRange(null, null, -1));
    assertEquals(4018, reversed.getStart(), 0);
    assertEquals(-2, reversed.getStep(), 0);
    assertEquals(Integer.valueOf(10), reversed.getShape());
    assertEquals(4000, reversed.getEnd(), 0);

    // 9, 7 and 5
    SpectralWCS strided = wave.slice(new IndexRange(null, 4, -2));
    assertEquals(4018, strided.getStart(), 0);
    assertEquals(-4, strided.getStep(), 0);
    assertEquals(Integer.valueOf(3), strided.getShape());
  }

  @Test(expected = InsufficientPointsException.class)
  public void testSliceOfOnePixel() {
    tenPixels().slice(IndexRange.of(3));
  }

  @Test
  public void testResample() {
    SpectralWCS wave = SpectralWCS.builder().crval(0d).cdelt(1d).unit(AxisUnit.NANOMETER).shape(10).build();
    SpectralWCS resampled = wave.resample(2.5, 20d, AxisUnit.ANGSTROM);
    assertEquals(0.25, resampled.getStep(), 1e-12);
    assertEquals(2.0, resampled.getStart(), 1e-12);
    assertEquals(Integer.valueOf(32), resampled.getShape());
    assertEquals(AxisUnit.NANOMETER, resampled.getUnit());

    // by default the first new pixel overlaps the first old one
    resampled = wave.resample(0.5, null, null);
    assertEquals(-0.25, resampled.getStart(), 1e-12);
    assertEquals(Integer.valueOf(21), resampled.getShape());
  }

  @Test
  public void testResampleFromBeyondTheAxis() {
    SpectralWCS resampled = tenPixels().resample(1, 100d, null);
    assertEquals(Integer.valueOf(0), resampled.getShape());
    assertEquals(100, resampled.getStart(), 0);
  }

  @Test
  public void testRebin() {
    SpectralWCS wave = tenPixels();
    wave.rebin(2);
    assertEquals(2, wave.getStep(), 0);
    assertEquals(0.5, wave.getStart(), 1e-12);
    assertEquals(4.5, wave.coord(2), 1e-12);
    assertEquals(Integer.valueOf(5), wave.getShape());
    // the reference pixel moves to the centre of the first bin
    assertEquals(0.75, wave.getAxis().getCrpix(), 1e-12);
  }

  @Test
  public void testRebinDropsPixels() {
    List<String> warnings = Lists.newArrayList();
    DiagnosticListener listener = (source, message) -> warnings.add(message);
    SpectralWCS wave = SpectralWCS.builder().crval(0d).shape(10).diagnostics(listener).build();
    wave.rebin(3);
    assertEquals(Integer.valueOf(3), wave.getShape());
    assertEquals(1, warnings.size());

    // derived axes report to the same listener
    assertSame(listener, wave.slice(new IndexRange(0, 2)).getDiagnostics());
    assertSame(listener, wave.resample(0.5, null, null).getDiagnostics());
    assertSame(listener, wave.copy().getDiagnostics());
  }

  @Test
  public void testEqualityAcrossUnits() {
    SpectralWCS nm = SpectralWCS.builder().crval(500d).cdelt(0.125).unit(AxisUnit.NANOMETER).shape(10).build();
    SpectralWCS angstrom = SpectralWCS.builder().crval(5000d).cdelt(1.25).shape(10).build();
    assertTrue(nm.isEqual(angstrom));
    assertTrue(angstrom.isEqual(nm));

    assertFalse(nm.isEqual(SpectralWCS.builder().crval(5000d).cdelt(1.25).shape(11).build()));
    assertFalse(nm.isEqual(SpectralWCS.builder().crval(5000d).cdelt(1.25).shape(10).ctype("AWAV").build()));
    assertFalse(nm.isEqual(SpectralWCS.builder().unit(AxisUnit.PIXEL).shape(10).build()));
    assertFalse(nm.isEqual(null));
  }

  @Test
  public void testFromCubeHeader() {
    WcsHeader header = new WcsHeader()
      .put("NAXIS", 3)
      .put("NAXIS1", 326)
      .put("NAXIS2", 331)
      .put("NAXIS3", 3681)
      .put("CRPIX3", 1.0)
      .put("CRVAL3", 4750.0)
      .put("CD3_3", 1.25)
      .put("CUNIT3", "Angstrom")
      .put("CTYPE3", "AWAV");
    SpectralWCS wave = SpectralWCS.fromMetadata(header);
    assertEquals(4750, wave.getStart(), 0);
    assertEquals(1.25, wave.getStep(), 0);
    assertEquals(Integer.valueOf(3681), wave.getShape());
    assertEquals(9350, wave.getEnd(), 1e-9);
    assertEquals("AWAV", wave.getCtype());
    assertEquals(AxisUnit.ANGSTROM, wave.getUnit());
    wave.info();
  }

  @Test
  public void testFromSpectrumHeader() {
    WcsHeader header = new WcsHeader()
      .put("NAXIS", 1)
      .put("NAXIS1", 100)
      .put("CRPIX1", 10.0)
      .put("CRVAL1", 500.0)
      .put("CDELT1", 0.5)
      .put("PC1_1", 2.0)
      .put("CUNIT1", "nm");
    SpectralWCS wave = SpectralWCS.fromMetadata(header);
    assertEquals(1, wave.getStep(), 0);
    assertEquals(491, wave.getStart(), 0);
    assertEquals(AxisUnit.NANOMETER, wave.getUnit());
    assertEquals(Integer.valueOf(100), wave.getShape());
  }

  @Test(expected = MalformedCoordinateMetadataException.class)
  public void testMissingReferenceValue() {
    SpectralWCS.fromMetadata(new WcsHeader().put("NAXIS", 1).put("CDELT1", 1.0));
  }

  @Test
  public void testHeaderRoundTrip() {
    SpectralWCS wave = SpectralWCS.builder().crpix(3d).crval(6000d).cdelt(-1.5).ctype("AWAV").shape(20).build();
    WcsHeader header = wave.toHeader();
    assertEquals(1, header.getInt("WCSAXES"));
    assertEquals(-1.5, header.getDouble("CDELT1"), 0);
    assertTrue(wave.isEqual(SpectralWCS.fromMetadata(header, 20, null)));

    WcsHeader cube = wave.toHeader(3, true);
    assertEquals(-1.5, cube.getDouble("CD3_3"), 0);
    assertFalse(cube.contains("CDELT3"));
    assertTrue(wave.isEqual(SpectralWCS.fromMetadata(cube, 20, null)));
  }
}
