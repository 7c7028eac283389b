/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pluscode;

import static net.goui.pluscode.CodeAlphabet.CODE_DIGIT;
import static net.goui.pluscode.CodeAlphabet.PADDING;
import static net.goui.pluscode.CodeAlphabet.SEPARATOR;
import static net.goui.pluscode.CodeAlphabet.significantDigits;
import static net.goui.pluscode.PlusCodeEncoder.SEPARATOR_POSITION;

import com.google.common.base.CharMatcher;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Classifies strings according to the Plus Code format rules. These are purely syntactic checks
 * and never decode the code.
 */
final class CodeValidator {
  private static final CharMatcher SEPARATOR_CHAR = CharMatcher.is(SEPARATOR);
  private static final CharMatcher PADDING_CHAR = CharMatcher.is(PADDING);
  // Shortest possible code is two digits and the separator (e.g. "22+").
  private static final int MIN_LENGTH = 3;
  // Padding must be preceded by at least one digit pair.
  private static final int MAX_PADDING_LENGTH = SEPARATOR_POSITION - 2;

  static CodeType classify(@Nullable String code) {
    if (!isValid(code)) {
      return CodeType.INVALID;
    }
    return code.indexOf(SEPARATOR) < SEPARATOR_POSITION ? CodeType.SHORT : CodeType.FULL;
  }

  static boolean isValid(@Nullable String code) {
    return code != null
        && hasValidLength(code)
        && hasValidSeparator(code)
        && hasValidPadding(code)
        && hasValidCharacters(code);
  }

  static boolean isShort(@Nullable String code) {
    return classify(code) == CodeType.SHORT;
  }

  static boolean isFull(@Nullable String code) {
    return classify(code) == CodeType.FULL;
  }

  private static boolean hasValidLength(String code) {
    if (code.length() < MIN_LENGTH) {
      return false;
    }
    // A single digit after the separator is never valid (only zero, or two or more).
    return code.length() - code.lastIndexOf(SEPARATOR) - 1 != 1;
  }

  private static boolean hasValidSeparator(String code) {
    int separatorIndex = code.indexOf(SEPARATOR);
    return SEPARATOR_CHAR.countIn(code) == 1
        && separatorIndex <= SEPARATOR_POSITION
        && separatorIndex % 2 == 0;
  }

  // Only called once the code is known to have exactly one separator.
  private static boolean hasValidPadding(String code) {
    int paddingStart = code.indexOf(PADDING);
    if (paddingStart == -1) {
      return true;
    }
    int separatorIndex = code.indexOf(SEPARATOR);
    // Padding only ever appears directly before the separator of a full code.
    if (separatorIndex != SEPARATOR_POSITION
        || paddingStart == 0
        || separatorIndex != code.length() - 1
        || code.charAt(separatorIndex - 1) != PADDING) {
      return false;
    }
    // A single, even length run of padding.
    int paddingLength = separatorIndex - paddingStart;
    return PADDING_CHAR.matchesAllOf(code.substring(paddingStart, separatorIndex))
        && paddingLength % 2 == 0
        && paddingLength <= MAX_PADDING_LENGTH;
  }

  private static boolean hasValidCharacters(String code) {
    return CODE_DIGIT.matchesAllOf(significantDigits(code));
  }

  private CodeValidator() {}
}
