/*
 * Copyright (c) 2024 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.octoline.internal;

import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Precondition checks that throw the standard exceptions. */
public final class Validate {
  private Validate() {}

  /** Throws an {@code IllegalArgumentException} with the given message if the check fails. */
  public static void requireArgument(boolean check, String message) {
    if (!check) {
      throw new IllegalArgumentException(message);
    }
  }

  /** Throws an {@code IllegalArgumentException} with a formatted message if the check fails. */
  @FormatMethod
  public static void requireArgument(
      boolean check, @FormatString String format, @Nullable Object... args) {
    if (!check) {
      throw new IllegalArgumentException(String.format(format, args));
    }
  }

  /** Throws an {@code IllegalStateException} with the given message if the check fails. */
  public static void requireState(boolean check, String message) {
    if (!check) {
      throw new IllegalStateException(message);
    }
  }
}
