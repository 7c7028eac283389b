/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pluscode;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import java.util.Arrays;

/**
 * The fixed symbol table for Plus Codes. Maps the 20 code symbols (in either case) to their digit
 * values, and the padding and separator characters to a sentinel value.
 */
final class CodeAlphabet {
  static final String ALPHABET = "23456789CFGHJMPQRVWX";
  static final int BASE = ALPHABET.length();

  static final char PADDING = '0';
  static final char SEPARATOR = '+';

  // Digit value reported for padding and separator characters.
  static final int NOT_A_DIGIT = -1;
  // Lookup value for characters which can never appear in a code.
  private static final int NOT_A_CODE_CHAR = -2;

  static final CharMatcher CODE_DIGIT =
      CharMatcher.anyOf(ALPHABET).or(CharMatcher.anyOf(Ascii.toLowerCase(ALPHABET)));
  static final CharMatcher FORMAT_CHAR = CharMatcher.is(PADDING).or(CharMatcher.is(SEPARATOR));

  // Indexed by char value, large enough for every symbol in either case ('x' is the largest).
  private static final int[] LOOKUP = new int['x' + 1];

  static {
    Arrays.fill(LOOKUP, NOT_A_CODE_CHAR);
    for (int n = 0; n < BASE; n++) {
      char c = ALPHABET.charAt(n);
      LOOKUP[c] = n;
      LOOKUP[Character.toLowerCase(c)] = n;
    }
    LOOKUP[PADDING] = NOT_A_DIGIT;
    LOOKUP[SEPARATOR] = NOT_A_DIGIT;
  }

  /**
   * Returns the digit value (0-19) of a code symbol, or {@link #NOT_A_DIGIT} for the padding and
   * separator characters.
   *
   * @throws IllegalArgumentException if the character can never appear in a code.
   */
  static int digitValue(char c) {
    int value = c < LOOKUP.length ? LOOKUP[c] : NOT_A_CODE_CHAR;
    checkArgument(value != NOT_A_CODE_CHAR, "invalid code character: '%s'", c);
    return value;
  }

  /** Returns the (uppercase) symbol for a digit value in the range {@code [0, 20)}. */
  static char symbol(int value) {
    checkArgument(value >= 0 && value < BASE, "invalid digit value: %s", value);
    return ALPHABET.charAt(value);
  }

  /** Returns the code with separator and padding removed, in uppercase. */
  static String significantDigits(String code) {
    return Ascii.toUpperCase(FORMAT_CHAR.removeFrom(code));
  }

  private CodeAlphabet() {}
}
