/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pluscode;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PlusCodeEncoderTest {
  private static final double EPSILON = 1e-10;

  @Test
  public void testEncode() {
    assertThat(PlusCodeEncoder.encode(47.0000625, 8.0000625, 10)).isEqualTo("8FVC2222+22");
    assertThat(PlusCodeEncoder.encode(20.375, 2.775, 6)).isEqualTo("7FG49Q00+");
    assertThat(PlusCodeEncoder.encode(20.3700625, 2.7821875, 10)).isEqualTo("7FG49QCJ+2V");
    assertThat(PlusCodeEncoder.encode(20.3701125, 2.782234375, 11)).isEqualTo("7FG49QCJ+2VX");
    assertThat(PlusCodeEncoder.encode(20.3701135, 2.78223535156, 13)).isEqualTo("7FG49QCJ+2VXGJ");
    assertThat(PlusCodeEncoder.encode(-41.2730625, 174.7859375, 10)).isEqualTo("4VCPPQGP+Q9");
    assertThat(PlusCodeEncoder.encode(29.952062, -90.077188, 10)).isEqualTo("76XFXW2F+R4");
  }

  @Test
  public void testEncodeLengths() {
    double lat = 47.0000625;
    double lng = 8.0000625;
    assertThat(PlusCodeEncoder.encode(lat, lng, 2)).isEqualTo("8F000000+");
    assertThat(PlusCodeEncoder.encode(lat, lng, 4)).isEqualTo("8FVC0000+");
    assertThat(PlusCodeEncoder.encode(lat, lng, 8)).isEqualTo("8FVC2222+");
    assertThat(PlusCodeEncoder.encode(lat, lng, 11)).isEqualTo("8FVC2222+22G");
    assertThat(PlusCodeEncoder.encode(lat, lng, 15)).isEqualTo("8FVC2222+22GCCCC");
    // Clamped to the maximum length.
    assertThat(PlusCodeEncoder.encode(lat, lng, 16)).isEqualTo("8FVC2222+22GCCCC");
  }

  @Test
  public void testEncodeInvalidLengths() {
    for (int length : new int[] {-1, 0, 1, 3, 5, 7, 9}) {
      PlusCodeException e =
          assertThrows(PlusCodeException.class, () -> PlusCodeEncoder.encode(1, 1, length));
      assertThat(e.getError()).isEqualTo(PlusCodeError.INVALID_LENGTH);
      assertThat(e).hasMessageThat().contains(Integer.toString(length));
    }
  }

  @Test
  public void testEncodeNonFinite() {
    assertThrows(
        IllegalArgumentException.class, () -> PlusCodeEncoder.encode(Double.NaN, 1, 10));
    assertThrows(
        IllegalArgumentException.class,
        () -> PlusCodeEncoder.encode(1, Double.POSITIVE_INFINITY, 10));
  }

  @Test
  public void testEncodeClipsLatitude() {
    // The north pole is moved into the top row of cells at the requested precision.
    assertThat(PlusCodeEncoder.encode(90, 1, 4)).isEqualTo("CFX30000+");
    assertThat(PlusCodeEncoder.encode(92, 1, 4)).isEqualTo("CFX30000+");
    assertThat(PlusCodeEncoder.encode(90, 1, 10)).isEqualTo("CFX3X2X2+X2");
    assertThat(PlusCodeEncoder.encode(-90, 0, 10)).isEqualTo("2F222222+22");
    assertThat(PlusCodeEncoder.encode(-100, 0, 10)).isEqualTo("2F222222+22");
  }

  @Test
  public void testEncodeNormalizesLongitude() {
    assertThat(PlusCodeEncoder.encode(1, 180, 4)).isEqualTo("62H20000+");
    assertThat(PlusCodeEncoder.encode(1, 181, 4)).isEqualTo("62H30000+");
    assertThat(PlusCodeEncoder.encode(47.0000625, 368.0000625, 10)).isEqualTo("8FVC2222+22");
    assertThat(PlusCodeEncoder.encode(47.0000625, -711.9999375, 10)).isEqualTo("8FVC2222+22");
    assertThat(PlusCodeEncoder.normalizeLongitude(180)).isEqualTo(-180.0);
    assertThat(PlusCodeEncoder.normalizeLongitude(-180)).isEqualTo(-180.0);
    assertThat(PlusCodeEncoder.normalizeLongitude(-181)).isEqualTo(179.0);
  }

  @Test
  public void testEncodeHugeLongitude() {
    // 1e20 is 280 more than a multiple of 360.
    assertThat(PlusCodeEncoder.normalizeLongitude(1e20)).isEqualTo(-80.0);
    assertThat(PlusCodeEncoder.normalizeLongitude(-1e20)).isEqualTo(80.0);
    assertThat(PlusCodeEncoder.encode(10, 1e20, 10))
        .isEqualTo(PlusCodeEncoder.encode(10, -80, 10));
    assertThat(PlusCodeEncoder.encode(10, -1e20, 10))
        .isEqualTo(PlusCodeEncoder.encode(10, 80, 10));
    assertThat(PlusCodeEncoder.normalizeLongitude(Double.MAX_VALUE)).isAtLeast(-180.0);
    assertThat(PlusCodeEncoder.normalizeLongitude(Double.MAX_VALUE)).isLessThan(180.0);
  }

  @Test
  public void testDecode() {
    CodeArea area = PlusCodeEncoder.decode("8FVC2222+22");
    assertThat(area.getSouthLatitude()).isEqualTo(47.0);
    assertThat(area.getWestLongitude()).isEqualTo(8.0);
    assertThat(area.getLatitudeHeight()).isWithin(EPSILON).of(0.000125);
    assertThat(area.getLongitudeWidth()).isWithin(EPSILON).of(0.000125);
    assertThat(area.getLatitudeCenter()).isWithin(EPSILON).of(47.0000625);
    assertThat(area.getLongitudeCenter()).isWithin(EPSILON).of(8.0000625);
    assertThat(area.getCodeLength()).isEqualTo(10);
  }

  @Test
  public void testDecodePadded() {
    CodeArea area = PlusCodeEncoder.decode("8FVC0000+");
    assertThat(area.getSouthLatitude()).isEqualTo(47.0);
    assertThat(area.getWestLongitude()).isEqualTo(8.0);
    assertThat(area.getLatitudeHeight()).isEqualTo(1.0);
    assertThat(area.getLongitudeWidth()).isEqualTo(1.0);
    assertThat(area.getLatitudeCenter()).isEqualTo(47.5);
    assertThat(area.getCodeLength()).isEqualTo(4);
  }

  @Test
  public void testDecodeGridDigits() {
    CodeArea area = PlusCodeEncoder.decode("7fg49qcj+2vxgj");
    assertThat(area.getCodeLength()).isEqualTo(13);
    assertThat(area.getSouthLatitude()).isWithin(EPSILON).of(20.370113);
    assertThat(area.getWestLongitude()).isWithin(EPSILON).of(2.782234375);
    // Grid cells are 1/5th the height and 1/4 the width of their parent.
    assertThat(area.getLatitudeHeight()).isWithin(EPSILON).of(0.000125 / 125);
    assertThat(area.getLongitudeWidth()).isWithin(EPSILON).of(0.000125 / 64);
  }

  @Test
  public void testDecodeIgnoresExcessDigits() {
    CodeArea area = PlusCodeEncoder.decode("8FVC2222+223344556677");
    assertThat(area.getCodeLength()).isEqualTo(15);
    assertThat(area.getLatitudeHeight())
        .isWithin(EPSILON)
        .of(PlusCodeEncoder.precisionByLength(15));
  }

  @Test
  public void testDecodeNorthernmostCell() {
    CodeArea area = PlusCodeEncoder.decode("CFX3X2X2+X2");
    assertThat(area.getNorthLatitude()).isWithin(EPSILON).of(90.0);
    assertThat(area.getSouthLatitude()).isWithin(EPSILON).of(89.999875);
  }

  @Test
  public void testDecodeRejectsNonFullCodes() {
    for (String code : new String[] {"9G8F+6X", "8FVC2222+2", "", "8FVC2222", "8FVC2A22+22"}) {
      PlusCodeException e =
          assertThrows(PlusCodeException.class, () -> PlusCodeEncoder.decode(code));
      assertThat(e.getError()).isEqualTo(PlusCodeError.NOT_FULL_CODE);
    }
    assertThrows(NullPointerException.class, () -> PlusCodeEncoder.decode(null));
  }

  @Test
  public void testPrecisionByLength() {
    assertThat(PlusCodeEncoder.precisionByLength(2)).isEqualTo(20.0);
    assertThat(PlusCodeEncoder.precisionByLength(4)).isEqualTo(1.0);
    assertThat(PlusCodeEncoder.precisionByLength(6)).isEqualTo(0.05);
    assertThat(PlusCodeEncoder.precisionByLength(8)).isEqualTo(0.0025);
    assertThat(PlusCodeEncoder.precisionByLength(10)).isEqualTo(0.000125);
    assertThat(PlusCodeEncoder.precisionByLength(11)).isEqualTo(0.000025);
    assertThat(PlusCodeEncoder.precisionByLength(12)).isEqualTo(0.000005);
    assertThat(PlusCodeEncoder.precisionByLength(15)).isWithin(1e-20).of(4e-8);
  }

  @Test
  public void testRoundTrip() {
    Random random = new Random(0x0C0DE);
    for (int n = 0; n < 10000; n++) {
      double lat = -90 + 180 * random.nextDouble();
      double lng = -180 + 360 * random.nextDouble();
      CodeArea area = PlusCodeEncoder.decode(PlusCodeEncoder.encode(lat, lng, 10));
      assertThat(area.getLatitudeCenter()).isWithin(0.01).of(lat);
      assertThat(area.getLongitudeCenter()).isWithin(0.01).of(lng);
      assertThat(area.contains(lat, lng)).isTrue();
    }
  }

  @Test
  public void testRoundTripAllLengths() {
    Random random = new Random(0xBEEF);
    for (int length : new int[] {2, 4, 6, 8, 10, 11, 12, 13, 14, 15}) {
      for (int n = 0; n < 500; n++) {
        double lat = -89 + 178 * random.nextDouble();
        double lng = -179 + 358 * random.nextDouble();
        String code = PlusCodeEncoder.encode(lat, lng, length);
        CodeArea area = PlusCodeEncoder.decode(code);
        assertThat(area.getCodeLength()).isEqualTo(length);
        assertThat(area.getLatitudeHeight())
            .isWithin(1e-12)
            .of(PlusCodeEncoder.precisionByLength(length));
        // Re-encoding the center always gives the same code.
        assertThat(
                PlusCodeEncoder.encode(area.getLatitudeCenter(), area.getLongitudeCenter(), length))
            .isEqualTo(code);
      }
    }
  }
}
