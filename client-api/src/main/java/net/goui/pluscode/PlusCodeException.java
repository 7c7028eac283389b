/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pluscode;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Thrown when a Plus Code operation is given invalid input. The message names the offending
 * value, and {@link #getError()} identifies the kind of failure.
 */
public final class PlusCodeException extends IllegalArgumentException {
  private final PlusCodeError error;

  PlusCodeException(PlusCodeError error, String message) {
    super(message);
    this.error = checkNotNull(error);
  }

  static PlusCodeException invalidLength(int codeLength) {
    return new PlusCodeException(
        PlusCodeError.INVALID_LENGTH, "Invalid Open Location Code length: " + codeLength);
  }

  static PlusCodeException notFullCode(String code) {
    return new PlusCodeException(
        PlusCodeError.NOT_FULL_CODE, "Open Location Code is not a valid full code: " + code);
  }

  static PlusCodeException notValidShortCode(String code) {
    return new PlusCodeException(
        PlusCodeError.NOT_VALID_SHORT_CODE, "Open Location Code is not valid: " + code);
  }

  static PlusCodeException paddedCode(String code) {
    return new PlusCodeException(PlusCodeError.PADDED_CODE, "Cannot shorten padded codes: " + code);
  }

  public PlusCodeError getError() {
    return error;
  }
}
