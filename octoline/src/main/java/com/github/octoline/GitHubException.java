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

package com.github.octoline;

import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Thrown when GitHub responds with an error status, carrying the message and documentation link
 * from the error's body when present.
 */
public class GitHubException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int statusCode;
  private final @Nullable String documentationUrl;

  public GitHubException(int statusCode, String message, @Nullable String documentationUrl) {
    super(message);
    this.statusCode = statusCode;
    this.documentationUrl = documentationUrl;
  }

  public int statusCode() {
    return statusCode;
  }

  public Optional<String> documentationUrl() {
    return Optional.ofNullable(documentationUrl);
  }

  @Override
  public String toString() {
    return getClass().getName() + ": " + statusCode + " " + getMessage();
  }
}
