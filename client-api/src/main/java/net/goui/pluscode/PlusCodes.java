/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pluscode;

import static com.google.common.base.Preconditions.checkNotNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Static entry point for encoding, decoding, validating and shortening Open Location Codes
 * (a.k.a. "Plus Codes").
 *
 * <p>See <a href="https://github.com/google/open-location-code">the Open Location Code
 * project</a>.
 *
 * <p>A full code such as {@code "8FVC9G8F+6X"} identifies a rectangular cell on a fixed grid of
 * latitude and longitude degrees. Longer codes identify smaller cells: a 10 digit code is roughly
 * 14 meters square at the equator. Codes shorter than 8 digits are padded with {@code '0'} so that
 * the {@code '+'} separator always follows the 8th character of a full code (e.g. {@code
 * "8FVC0000+"}).
 *
 * <p>Codes are case-insensitive on input, and are always returned in uppercase.
 *
 * <p>Encoding and decoding report invalid input via {@link ErrorOr} results, with {@code
 * ...OrThrow} variants for callers who prefer exceptions. Shortening and recovery throw {@link
 * PlusCodeException} directly, since they have no meaningful partial result.
 *
 * <p>All methods are pure and thread-safe.
 */
public final class PlusCodes {
  /** The code length used when none is given, identifying cells of 1/8000th of a degree. */
  public static final int DEFAULT_CODE_LENGTH = PlusCodeEncoder.PAIR_CODE_LENGTH;

  /** The longest code which can be produced. Longer requested lengths are clamped to this. */
  public static final int MAX_CODE_LENGTH = PlusCodeEncoder.MAX_CODE_LENGTH;

  /** Returns the code of {@link #DEFAULT_CODE_LENGTH} for the cell containing the given point. */
  public static ErrorOr<String> encode(double latitude, double longitude) {
    return encode(latitude, longitude, DEFAULT_CODE_LENGTH);
  }

  /**
   * Returns the code with the given number of digits for the cell containing the given point.
   *
   * <p>Latitude is clipped to {@code [-90, 90]} and longitude is normalized into {@code [-180,
   * 180)}. Valid lengths are 2, 4, 6, 8 and any length of 10 or more. Lengths above {@link
   * #MAX_CODE_LENGTH} are clamped, and any other length results in an {@link
   * PlusCodeError#INVALID_LENGTH} error.
   *
   * @throws IllegalArgumentException if either coordinate is not finite.
   */
  public static ErrorOr<String> encode(double latitude, double longitude, int codeLength) {
    return ErrorOr.capture(() -> PlusCodeEncoder.encode(latitude, longitude, codeLength));
  }

  /** As {@link #encode(double, double)}, but throws {@link PlusCodeException} on failure. */
  public static String encodeOrThrow(double latitude, double longitude) {
    return PlusCodeEncoder.encode(latitude, longitude, DEFAULT_CODE_LENGTH);
  }

  /** As {@link #encode(double, double, int)}, but throws {@link PlusCodeException} on failure. */
  public static String encodeOrThrow(double latitude, double longitude, int codeLength) {
    return PlusCodeEncoder.encode(latitude, longitude, codeLength);
  }

  /**
   * Returns the area identified by a full code. Digits beyond {@link #MAX_CODE_LENGTH} are
   * ignored. Any code which is not a valid full code results in a {@link
   * PlusCodeError#NOT_FULL_CODE} error (short codes must first be recovered with {@link
   * #recoverNearest(String, double, double)}).
   *
   * <p>Validation is purely syntactic, so a full code which no encoding can produce (e.g. {@code
   * "X2222222+"}, whose first digit lies beyond the north pole) still decodes, to an area whose
   * {@link CodeArea#getNorthLatitude() north latitude} exceeds 90 degrees.
   */
  public static ErrorOr<CodeArea> decode(String code) {
    checkNotNull(code, "code must not be null");
    return ErrorOr.capture(() -> PlusCodeEncoder.decode(code));
  }

  /** As {@link #decode(String)}, but throws {@link PlusCodeException} on failure. */
  public static CodeArea decodeOrThrow(String code) {
    return PlusCodeEncoder.decode(code);
  }

  /** Returns how the given string is classified by the Plus Code format rules. */
  public static CodeType classify(@Nullable String code) {
    return CodeValidator.classify(code);
  }

  /** Returns whether the given string is a valid full or short code. */
  public static boolean isValid(@Nullable String code) {
    return CodeValidator.isValid(code);
  }

  /** Returns whether the given string is a valid short code. */
  public static boolean isShort(@Nullable String code) {
    return CodeValidator.isShort(code);
  }

  /** Returns whether the given string is a valid full code. */
  public static boolean isFull(@Nullable String code) {
    return CodeValidator.isFull(code);
  }

  /**
   * Removes 8, 6 or 4 leading digits from a full code, as far as the given reference location
   * permits. The more digits are removed, the closer the reference must be to the center of the
   * code's area. If the reference is too far away, the code is returned unchanged (in uppercase).
   *
   * <p>The result can be turned back into the original code by {@link #recoverNearest(String,
   * double, double)} given a reference close to the one used here.
   *
   * @throws PlusCodeException if the code is not a full code ({@link
   *     PlusCodeError#NOT_FULL_CODE}) or is padded ({@link PlusCodeError#PADDED_CODE}).
   */
  public static String shorten(String code, double latitude, double longitude) {
    return PlusCodeShortener.shorten(code, latitude, longitude);
  }

  /**
   * Returns the full code nearest to the given reference location which ends with the given short
   * code. Full codes are returned unchanged (in uppercase).
   *
   * @throws PlusCodeException if the code is neither a full nor a short code ({@link
   *     PlusCodeError#NOT_VALID_SHORT_CODE}).
   * @throws IllegalArgumentException if either coordinate is not finite.
   */
  public static String recoverNearest(String shortCode, double latitude, double longitude) {
    return PlusCodeShortener.recoverNearest(shortCode, latitude, longitude);
  }

  /**
   * Returns the size in degrees of the cells identified by codes of the given length. For lengths
   * up to 10 this is both the height and width of a cell (e.g. 20 for 2, 0.000125 for 10). Beyond
   * 10 digits it is the cell height.
   */
  public static double precisionByLength(int codeLength) {
    return PlusCodeEncoder.precisionByLength(codeLength);
  }

  private PlusCodes() {}
}
