/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pluscode;

import com.google.auto.value.AutoValue;

/**
 * The rectangular area identified by a decoded Plus Code, given by its south-west corner, its
 * extent in degrees and its center.
 *
 * <p>Longitudes are not re-normalized after decoding, so the east edge of a cell in the last
 * column of the grid may be reported as exactly {@code 180}.
 */
@AutoValue
public abstract class CodeArea {

  static CodeArea of(
      double southLatitude,
      double westLongitude,
      double latitudeHeight,
      double longitudeWidth,
      int codeLength) {
    return new AutoValue_CodeArea(
        southLatitude,
        westLongitude,
        latitudeHeight,
        longitudeWidth,
        southLatitude + latitudeHeight / 2,
        westLongitude + longitudeWidth / 2,
        codeLength);
  }

  public abstract double getSouthLatitude();

  public abstract double getWestLongitude();

  public abstract double getLatitudeHeight();

  public abstract double getLongitudeWidth();

  public abstract double getLatitudeCenter();

  public abstract double getLongitudeCenter();

  /** Returns the number of significant digits decoded (excluding separator and padding). */
  public abstract int getCodeLength();

  public final double getNorthLatitude() {
    return getSouthLatitude() + getLatitudeHeight();
  }

  public final double getEastLongitude() {
    return getWestLongitude() + getLongitudeWidth();
  }

  /**
   * Returns whether the given point lies in this area. The south and west edges are inside the
   * area, the north and east edges are not.
   */
  public final boolean contains(double latitude, double longitude) {
    return getSouthLatitude() <= latitude
        && latitude < getNorthLatitude()
        && getWestLongitude() <= longitude
        && longitude < getEastLongitude();
  }
}
