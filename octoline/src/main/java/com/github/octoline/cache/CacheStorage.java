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
import java.net.URI;
import java.net.http.HttpHeaders;
import java.nio.ByteBuffer;
import java.util.Optional;

/**
 * A keyed store mapping a request {@code URI} to the validator and the snapshot of the last
 * successful response that carried one. There's at most one entry per {@code URI}. A new entry for
 * a {@code URI} is created by committing a {@link CacheWriter} opened with {@link #writer(URI,
 * CacheKey, HttpHeaders)}, replacing any previous one.
 *
 * <p>Implementations are thread-safe. Lookups and writes for different {@code URIs} must not
 * block each other. Whether and how entries are evicted is up to each implementation.
 */
public interface CacheStorage {

  /** Returns the validator stored for the given {@code URI}, if any. */
  Optional<CacheKey> tryHit(URI uri);

  /** Returns the response stored for the given {@code URI}, if any. */
  Optional<CachedResponse> load(URI uri);

  /**
   * Opens a writer that stores a new entry for the given {@code URI} with the given validator and
   * headers once committed.
   */
  CacheWriter writer(URI uri, CacheKey key, HttpHeaders headers);

  /** Returns a storage that never stores anything. */
  static CacheStorage disabled() {
    return DisabledCacheStorage.INSTANCE;
  }
}

enum DisabledCacheStorage implements CacheStorage, CacheWriter {
  INSTANCE;

  @Override
  public Optional<CacheKey> tryHit(URI uri) {
    return Optional.empty();
  }

  @Override
  public Optional<CachedResponse> load(URI uri) {
    return Optional.empty();
  }

  @Override
  public CacheWriter writer(URI uri, CacheKey key, HttpHeaders headers) {
    return this;
  }

  @Override
  public void write(ByteBuffer buffer) {}

  @Override
  public void commit() throws IOException {}

  @Override
  public void discard() {}
}
