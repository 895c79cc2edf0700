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

import static com.github.octoline.internal.Validate.requireState;
import static java.util.Objects.requireNonNull;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.nio.ByteBuffer;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** A {@link CacheStorage} that keeps entries in memory, without eviction. */
public final class MemoryCacheStorage implements CacheStorage {
  private final ConcurrentMap<URI, Entry> entries = new ConcurrentHashMap<>();

  public MemoryCacheStorage() {}

  @Override
  public Optional<CacheKey> tryHit(URI uri) {
    return Optional.ofNullable(entries.get(uri)).map(entry -> entry.key);
  }

  @Override
  public Optional<CachedResponse> load(URI uri) {
    return Optional.ofNullable(entries.get(uri)).map(entry -> entry.response);
  }

  @Override
  public CacheWriter writer(URI uri, CacheKey key, HttpHeaders headers) {
    return new MemoryWriter(requireNonNull(uri), requireNonNull(key), requireNonNull(headers));
  }

  /** Removes the entry stored for the given {@code URI}, returning {@code true} if one existed. */
  public boolean remove(URI uri) {
    return entries.remove(uri) != null;
  }

  public int size() {
    return entries.size();
  }

  private static final class Entry {
    final CacheKey key;
    final CachedResponse response;

    Entry(CacheKey key, CachedResponse response) {
      this.key = key;
      this.response = response;
    }
  }

  private final class MemoryWriter implements CacheWriter {
    private final URI uri;
    private final CacheKey key;
    private final HttpHeaders headers;
    private final ByteArrayOutputStream body = new ByteArrayOutputStream();
    private boolean done;

    MemoryWriter(URI uri, CacheKey key, HttpHeaders headers) {
      this.uri = uri;
      this.key = key;
      this.headers = headers;
    }

    @Override
    public void write(ByteBuffer buffer) {
      requireState(!done, "writer is done");
      var duplicate = buffer.duplicate();
      if (duplicate.hasArray()) {
        body.write(
            duplicate.array(),
            duplicate.arrayOffset() + duplicate.position(),
            duplicate.remaining());
      } else {
        var bytes = new byte[duplicate.remaining()];
        duplicate.get(bytes);
        body.writeBytes(bytes);
      }
    }

    @Override
    public void commit() {
      requireState(!done, "writer is done");
      done = true;
      entries.put(uri, new Entry(key, new CachedResponse(body.toByteArray(), headers)));
    }

    @Override
    public void discard() {
      done = true;
      body.reset();
    }
  }
}
