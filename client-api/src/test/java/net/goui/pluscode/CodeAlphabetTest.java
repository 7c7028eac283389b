/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pluscode;

import static com.google.common.truth.Truth.assertThat;
import static net.goui.pluscode.CodeAlphabet.NOT_A_DIGIT;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CodeAlphabetTest {
  @Test
  public void testDigitValues() {
    for (int n = 0; n < CodeAlphabet.BASE; n++) {
      char c = CodeAlphabet.symbol(n);
      assertThat(CodeAlphabet.digitValue(c)).isEqualTo(n);
      assertThat(CodeAlphabet.digitValue(Character.toLowerCase(c))).isEqualTo(n);
    }
    assertThat(CodeAlphabet.digitValue('2')).isEqualTo(0);
    assertThat(CodeAlphabet.digitValue('C')).isEqualTo(8);
    assertThat(CodeAlphabet.digitValue('x')).isEqualTo(19);
  }

  @Test
  public void testFormatCharacters() {
    assertThat(CodeAlphabet.digitValue('0')).isEqualTo(NOT_A_DIGIT);
    assertThat(CodeAlphabet.digitValue('+')).isEqualTo(NOT_A_DIGIT);
  }

  @Test
  public void testInvalidCharacters() {
    assertThrows(IllegalArgumentException.class, () -> CodeAlphabet.digitValue('A'));
    assertThrows(IllegalArgumentException.class, () -> CodeAlphabet.digitValue('1'));
    assertThrows(IllegalArgumentException.class, () -> CodeAlphabet.digitValue('-'));
    assertThrows(IllegalArgumentException.class, () -> CodeAlphabet.digitValue('Δ'));
    assertThrows(IllegalArgumentException.class, () -> CodeAlphabet.symbol(-1));
    assertThrows(IllegalArgumentException.class, () -> CodeAlphabet.symbol(20));
  }

  @Test
  public void testSignificantDigits() {
    assertThat(CodeAlphabet.significantDigits("8fvc2222+22")).isEqualTo("8FVC222222");
    assertThat(CodeAlphabet.significantDigits("8FVC0000+")).isEqualTo("8FVC");
    assertThat(CodeAlphabet.significantDigits("+")).isEmpty();
  }
}
