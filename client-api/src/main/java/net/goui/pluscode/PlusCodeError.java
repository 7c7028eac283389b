/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pluscode;

/** The kinds of input error reported by Plus Code operations. */
public enum PlusCodeError {
  /** A requested code length was less than 2, or was odd and less than 10. */
  INVALID_LENGTH,
  /** A code given to an operation which needs a full code (e.g. decoding) was not one. */
  NOT_FULL_CODE,
  /** A code given for recovery was neither a full code nor a valid short code. */
  NOT_VALID_SHORT_CODE,
  /** A code given for shortening contained padding characters. */
  PADDED_CODE
}
