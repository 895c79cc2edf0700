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

package com.github.octoline.cache;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Accumulates a response body as it streams to the caller. Nothing written is visible to readers
 * of the {@link CacheStorage} until {@link #commit()} is called. A writer is used by one thread at
 * a time, but not necessarily the same thread.
 */
public interface CacheWriter {

  /** Appends the remaining bytes of the given buffer without changing its position. */
  void write(ByteBuffer buffer) throws IOException;

  /**
   * Publishes everything written so far, replacing any previous entry for the same URI. The writer
   * can't be used afterwards.
   */
  void commit() throws IOException;

  /** Drops everything written so far, leaving any previous entry intact. */
  void discard();
}
