/*~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~
 Copyright (c) 2023, David Beaumont (https://github.com/hagbard).

 This program and the accompanying materials are made available under the terms of the
 Eclipse Public License v. 2.0 available at https://www.eclipse.org/legal/epl-2.0, or the
 Apache License, Version 2.0 available at https://www.apache.org/licenses/LICENSE-2.0.

 SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
 ~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~~*/

package net.goui.pluscode;

/** Classification of a string according to the Plus Code format rules. */
public enum CodeType {
  /**
   * A valid code with all its leading digits, which can be decoded without a reference location.
   * This includes padded codes such as {@code "8FVC0000+"}.
   */
  FULL,
  /**
   * A valid code with some leading digits removed (the separator appears before position 8). It
   * can only be decoded after recovering the missing digits from a nearby reference location.
   */
  SHORT,
  /** The string breaks at least one of the format rules and is not a Plus Code. */
  INVALID;

  public boolean isValid() {
    return this != INVALID;
  }
}
