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
import static net.goui.pluscode.CodeAlphabet.PADDING;
import static net.goui.pluscode.CodeAlphabet.SEPARATOR;
import static net.goui.pluscode.PlusCodeEncoder.LATITUDE_MAX;
import static net.goui.pluscode.PlusCodeEncoder.PAIR_CODE_LENGTH;
import static net.goui.pluscode.PlusCodeEncoder.SEPARATOR_POSITION;
import static net.goui.pluscode.PlusCodeEncoder.clipLatitude;
import static net.goui.pluscode.PlusCodeEncoder.normalizeLongitude;
import static net.goui.pluscode.PlusCodeEncoder.precisionByLength;

import com.google.common.base.Ascii;
import com.google.common.flogger.FluentLogger;

/**
 * Removes leading digits from full codes given a nearby reference location, and recovers full
 * codes from such short codes.
 */
final class PlusCodeShortener {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  // Number of leading digits which can be removed, most preferred first.
  private static final int[] REMOVAL_LENGTHS = {8, 6, 4};
  // A reference must be within this fraction of the removed cell size from the code's center.
  private static final double SAFETY_FACTOR = 0.3;

  static String shorten(String code, double latitude, double longitude) {
    checkNotNull(code, "code must not be null");
    if (!CodeValidator.isFull(code)) {
      throw PlusCodeException.notFullCode(code);
    }
    if (code.indexOf(PADDING) != -1) {
      throw PlusCodeException.paddedCode(code);
    }
    CodeArea area = PlusCodeEncoder.decode(code);
    double range =
        Math.max(
            Math.abs(latitude - area.getLatitudeCenter()),
            Math.abs(longitude - area.getLongitudeCenter()));
    for (int removalLength : REMOVAL_LENGTHS) {
      // At least one digit pair must remain before the separator.
      if (removalLength >= area.getCodeLength()) {
        continue;
      }
      if (range < precisionByLength(removalLength) * SAFETY_FACTOR) {
        logger.atFine().log("shorten %s by %d digits (range=%s)", code, removalLength, range);
        return Ascii.toUpperCase(code.substring(removalLength));
      }
    }
    logger.atFinest().log("reference too far to shorten %s (range=%s)", code, range);
    return Ascii.toUpperCase(code);
  }

  static String recoverNearest(String shortCode, double latitude, double longitude) {
    checkNotNull(shortCode, "short code must not be null");
    checkArgument(Double.isFinite(latitude), "latitude must be finite: %s", latitude);
    checkArgument(Double.isFinite(longitude), "longitude must be finite: %s", longitude);
    switch (CodeValidator.classify(shortCode)) {
      case FULL:
        return Ascii.toUpperCase(shortCode);
      case SHORT:
        break;
      default:
        throw PlusCodeException.notValidShortCode(shortCode);
    }
    double referenceLatitude = clipLatitude(latitude);
    double referenceLongitude = normalizeLongitude(longitude);

    int prefixLength = SEPARATOR_POSITION - shortCode.indexOf(SEPARATOR);
    double resolution = precisionByLength(prefixLength);
    String code = referencePrefix(referenceLatitude, referenceLongitude, prefixLength) + shortCode;
    CodeArea area = PlusCodeEncoder.decode(code);

    // The reference prefix gives the cell containing the reference, but the nearest match may be
    // in a neighboring cell. Only latitude is bounded, since longitude wraps.
    double halfResolution = resolution / 2;
    double recoveredLatitude = area.getLatitudeCenter();
    if (referenceLatitude + halfResolution < recoveredLatitude
        && recoveredLatitude - resolution >= -LATITUDE_MAX) {
      recoveredLatitude -= resolution;
    } else if (referenceLatitude - halfResolution > recoveredLatitude
        && recoveredLatitude + resolution <= LATITUDE_MAX) {
      recoveredLatitude += resolution;
    }
    double recoveredLongitude = area.getLongitudeCenter();
    if (referenceLongitude + halfResolution < recoveredLongitude) {
      recoveredLongitude -= resolution;
    } else if (referenceLongitude - halfResolution > recoveredLongitude) {
      recoveredLongitude += resolution;
    }
    if (recoveredLatitude != area.getLatitudeCenter()
        || recoveredLongitude != area.getLongitudeCenter()) {
      logger.atFine().log(
          "recovering %s: moved from %s to neighboring cell (%s, %s)",
          shortCode, code, recoveredLatitude, recoveredLongitude);
    }
    return PlusCodeEncoder.encode(recoveredLatitude, recoveredLongitude, code.length() - 1);
  }

  // Truncation rounds down in the encoder's fixed point grid, which doubles cannot do exactly.
  private static String referencePrefix(double latitude, double longitude, int prefixLength) {
    return PlusCodeEncoder.encode(latitude, longitude, PAIR_CODE_LENGTH).substring(0, prefixLength);
  }

  private PlusCodeShortener() {}
}
