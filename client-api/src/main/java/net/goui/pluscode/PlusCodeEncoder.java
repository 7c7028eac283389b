/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pluscode;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static net.goui.pluscode.CodeAlphabet.BASE;
import static net.goui.pluscode.CodeAlphabet.PADDING;
import static net.goui.pluscode.CodeAlphabet.SEPARATOR;
import static net.goui.pluscode.CodeAlphabet.digitValue;
import static net.goui.pluscode.CodeAlphabet.significantDigits;
import static net.goui.pluscode.CodeAlphabet.symbol;

import com.google.common.base.Strings;
import com.google.common.math.IntMath;

/**
 * Encodes coordinates to Plus Codes and decodes full codes back to the area they identify.
 *
 * <p>The first ten digits (the "pair" stage) encode latitude and longitude alternately in base 20.
 * Any further digits (the "grid" stage) each select one cell from a 5 row by 4 column subdivision
 * of the previous cell.
 *
 * <p>Encoding is done in fixed point, by scaling coordinates onto an integer grid fine enough for
 * the longest code, so that digit extraction is exact.
 */
final class PlusCodeEncoder {
  // Number of digits before the separator in a full code.
  static final int SEPARATOR_POSITION = 8;
  static final int MIN_CODE_LENGTH = 2;
  static final int MAX_CODE_LENGTH = 15;
  static final int PAIR_CODE_LENGTH = 10;
  // Inverse of the precision (in degrees) of the last pair digit.
  static final int PAIR_CODE_PRECISION = 8000;

  static final int GRID_ROWS = 5;
  static final int GRID_COLUMNS = 4;
  private static final int GRID_CODE_LENGTH = MAX_CODE_LENGTH - PAIR_CODE_LENGTH;
  static final int LAT_GRID_PRECISION = IntMath.pow(GRID_ROWS, GRID_CODE_LENGTH);
  static final int LNG_GRID_PRECISION = IntMath.pow(GRID_COLUMNS, GRID_CODE_LENGTH);

  static final double LATITUDE_MAX = 90;
  static final double LONGITUDE_MAX = 180;

  // Offsets which make fixed point values non-negative (these exceed Integer.MAX_VALUE).
  private static final long LAT_FIXED_POINT_OFFSET =
      90L * PAIR_CODE_PRECISION * LAT_GRID_PRECISION;
  private static final long LNG_FIXED_POINT_OFFSET =
      180L * PAIR_CODE_PRECISION * LNG_GRID_PRECISION;

  // Twice the first pair resolution, so the first division by BASE yields 20 degrees.
  private static final double INITIAL_DECODE_RESOLUTION = 400;

  static String encode(double latitude, double longitude, int codeLength) {
    checkArgument(Double.isFinite(latitude), "latitude must be finite: %s", latitude);
    checkArgument(Double.isFinite(longitude), "longitude must be finite: %s", longitude);
    if (codeLength < MIN_CODE_LENGTH
        || (codeLength < PAIR_CODE_LENGTH && codeLength % 2 == 1)) {
      throw PlusCodeException.invalidLength(codeLength);
    }
    codeLength = Math.min(codeLength, MAX_CODE_LENGTH);
    latitude = clipLatitude(latitude);
    longitude = normalizeLongitude(longitude);
    // The north pole is outside the grid, so move it into the top row of cells.
    if (latitude == LATITUDE_MAX) {
      latitude -= precisionByLength(codeLength);
    }

    long latVal =
        (long)
            Math.floor(
                LAT_FIXED_POINT_OFFSET + latitude * PAIR_CODE_PRECISION * LAT_GRID_PRECISION);
    long lngVal =
        (long)
            Math.floor(
                LNG_FIXED_POINT_OFFSET + longitude * PAIR_CODE_PRECISION * LNG_GRID_PRECISION);

    // Digits are produced least significant first.
    char[] digits = new char[MAX_CODE_LENGTH];
    if (codeLength > PAIR_CODE_LENGTH) {
      for (int n = MAX_CODE_LENGTH - 1; n >= PAIR_CODE_LENGTH; n--) {
        int row = (int) Math.floorMod(latVal, (long) GRID_ROWS);
        int column = (int) Math.floorMod(lngVal, (long) GRID_COLUMNS);
        digits[n] = symbol(row * GRID_COLUMNS + column);
        latVal = Math.floorDiv(latVal, (long) GRID_ROWS);
        lngVal = Math.floorDiv(lngVal, (long) GRID_COLUMNS);
      }
    } else {
      latVal = Math.floorDiv(latVal, (long) LAT_GRID_PRECISION);
      lngVal = Math.floorDiv(lngVal, (long) LNG_GRID_PRECISION);
    }
    for (int n = PAIR_CODE_LENGTH - 2; n >= 0; n -= 2) {
      digits[n] = symbol((int) Math.floorMod(latVal, (long) BASE));
      digits[n + 1] = symbol((int) Math.floorMod(lngVal, (long) BASE));
      latVal = Math.floorDiv(latVal, (long) BASE);
      lngVal = Math.floorDiv(lngVal, (long) BASE);
    }
    return format(digits, codeLength);
  }

  private static String format(char[] digits, int codeLength) {
    StringBuilder code = new StringBuilder(MAX_CODE_LENGTH + 1);
    if (codeLength < SEPARATOR_POSITION) {
      code.append(digits, 0, codeLength)
          .append(Strings.repeat(String.valueOf(PADDING), SEPARATOR_POSITION - codeLength))
          .append(SEPARATOR);
    } else {
      code.append(digits, 0, SEPARATOR_POSITION)
          .append(SEPARATOR)
          .append(digits, SEPARATOR_POSITION, codeLength - SEPARATOR_POSITION);
    }
    return code.toString();
  }

  static CodeArea decode(String code) {
    checkNotNull(code, "code must not be null");
    if (!CodeValidator.isFull(code)) {
      throw PlusCodeException.notFullCode(code);
    }
    String digits = significantDigits(code);
    int codeLength = Math.min(digits.length(), MAX_CODE_LENGTH);

    double southLatitude = -LATITUDE_MAX;
    double westLongitude = -LONGITUDE_MAX;
    double latResolution = INITIAL_DECODE_RESOLUTION;
    double lngResolution = INITIAL_DECODE_RESOLUTION;
    int n = 0;
    // Full codes always have an even number of digits in the pair stage.
    for (; n < Math.min(codeLength, PAIR_CODE_LENGTH); n += 2) {
      latResolution /= BASE;
      lngResolution /= BASE;
      southLatitude += latResolution * digitValue(digits.charAt(n));
      westLongitude += lngResolution * digitValue(digits.charAt(n + 1));
    }
    for (; n < codeLength; n++) {
      latResolution /= GRID_ROWS;
      lngResolution /= GRID_COLUMNS;
      int digit = digitValue(digits.charAt(n));
      southLatitude += latResolution * (digit / GRID_COLUMNS);
      westLongitude += lngResolution * (digit % GRID_COLUMNS);
    }
    return CodeArea.of(southLatitude, westLongitude, latResolution, lngResolution, n);
  }

  /**
   * Returns the height (and for lengths up to 10, also the width) in degrees of the cells
   * identified by codes with the given number of digits.
   */
  static double precisionByLength(int codeLength) {
    if (codeLength <= PAIR_CODE_LENGTH) {
      int exponent = Math.floorDiv(codeLength, -2) + 2;
      return exponent >= 0 ? IntMath.pow(BASE, exponent) : 1.0 / IntMath.pow(BASE, -exponent);
    }
    return 1.0 / (IntMath.pow(BASE, 3) * Math.pow(GRID_ROWS, codeLength - PAIR_CODE_LENGTH));
  }

  static double clipLatitude(double latitude) {
    return Math.min(LATITUDE_MAX, Math.max(-LATITUDE_MAX, latitude));
  }

  /** Normalizes a finite longitude into the range {@code [-180, 180)}. */
  static double normalizeLongitude(double longitude) {
    // Remainder is exact, so this works for arbitrarily large values (result is in (-360, 360)).
    longitude %= 2 * LONGITUDE_MAX;
    if (longitude < -LONGITUDE_MAX) {
      longitude += 2 * LONGITUDE_MAX;
    } else if (longitude >= LONGITUDE_MAX) {
      longitude -= 2 * LONGITUDE_MAX;
    }
    return longitude;
  }

  private PlusCodeEncoder() {}
}
