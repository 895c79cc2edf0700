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
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.util.Objects.requireNonNull;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.WritableByteChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A {@link CacheStorage} that keeps an entry file per {@code URI} in a directory. An entry file is
 * named after the hex SHA-256 of its {@code URI}, and is laid out as follows:
 *
 * <pre>{@code
 * long magic
 * int version
 * UTF uri
 * byte keyKind
 * UTF keyValue
 * int headerCount
 * (UTF name, int valueCount, UTF value * valueCount) * headerCount
 * byte[] body // Till EOF.
 * }</pre>
 *
 * <p>Writers write to a temporary file in the same directory that is atomically moved over the
 * entry file on commit, so readers either see the previous entry or the new one, never a partial
 * one. Unreadable entries are treated as absent.
 */
public final class DiskCacheStorage implements CacheStorage {
  private static final Logger logger = System.getLogger(DiskCacheStorage.class.getName());

  static final long ENTRY_MAGIC = 0x6f63746f6c696e65L;
  static final int ENTRY_VERSION = 1;

  static final String ENTRY_FILE_SUFFIX = ".entry";
  static final String TEMP_ENTRY_FILE_SUFFIX = ".tmp";

  private final Path directory;

  private DiskCacheStorage(Path directory) {
    this.directory = directory;
  }

  /** Creates a storage in the given directory, creating the directory if it doesn't exist. */
  public static DiskCacheStorage open(Path directory) throws IOException {
    Files.createDirectories(requireNonNull(directory));
    return new DiskCacheStorage(directory);
  }

  public Path directory() {
    return directory;
  }

  @Override
  public Optional<CacheKey> tryHit(URI uri) {
    return readEntry(uri, false).map(entry -> entry.key);
  }

  @Override
  public Optional<CachedResponse> load(URI uri) {
    return readEntry(uri, true).map(entry -> new CachedResponse(entry.body, entry.headers));
  }

  @Override
  public CacheWriter writer(URI uri, CacheKey key, HttpHeaders headers) {
    return new DiskWriter(requireNonNull(uri), requireNonNull(key), requireNonNull(headers));
  }

  /** Removes the entry stored for the given {@code URI}, returning {@code true} if one existed. */
  public boolean remove(URI uri) throws IOException {
    return Files.deleteIfExists(entryFile(uri));
  }

  Path entryFile(URI uri) {
    return directory.resolve(hash(uri) + ENTRY_FILE_SUFFIX);
  }

  private Optional<Entry> readEntry(URI uri, boolean readBody) {
    var entryFile = entryFile(uri);
    try (var in = new DataInputStream(new BufferedInputStream(Files.newInputStream(entryFile)))) {
      return Optional.ofNullable(readEntry(in, uri, readBody));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException | RuntimeException e) {
      logger.log(Level.WARNING, () -> "Unreadable cache entry for " + uri + ": " + entryFile, e);
      return Optional.empty();
    }
  }

  private static @Nullable Entry readEntry(DataInputStream in, URI uri, boolean readBody)
      throws IOException {
    long magic = in.readLong();
    if (magic != ENTRY_MAGIC) {
      throw new IOException("not in entry file format; magic: " + Long.toHexString(magic));
    }
    int version = in.readInt();
    if (version != ENTRY_VERSION) {
      throw new IOException("unrecognized entry file version: " + version);
    }

    var storedUri = in.readUTF();
    if (!storedUri.equals(uri.toString())) {
      return null; // Hash collision.
    }

    var kind = CacheKey.Kind.values()[in.readUnsignedByte()];
    var keyValue = in.readUTF();
    var key =
        kind == CacheKey.Kind.ETAG ? CacheKey.etag(keyValue) : CacheKey.lastModified(keyValue);

    int headerCount = in.readInt();
    var headers = new LinkedHashMap<String, List<String>>();
    for (int i = 0; i < headerCount; i++) {
      var name = in.readUTF();
      int valueCount = in.readInt();
      var values = new ArrayList<String>(valueCount);
      for (int j = 0; j < valueCount; j++) {
        values.add(in.readUTF());
      }
      headers.put(name, values);
    }

    byte[] body = readBody ? in.readAllBytes() : new byte[0];
    return new Entry(key, HttpHeaders.of(headers, (n, v) -> true), body);
  }

  private static void writeMetadata(
      DataOutputStream out, URI uri, CacheKey key, HttpHeaders headers) throws IOException {
    out.writeLong(ENTRY_MAGIC);
    out.writeInt(ENTRY_VERSION);
    out.writeUTF(uri.toString());
    out.writeByte(key.kind().ordinal());
    out.writeUTF(key.value());

    Map<String, List<String>> headerMap = headers.map();
    out.writeInt(headerMap.size());
    for (var header : headerMap.entrySet()) {
      out.writeUTF(header.getKey());
      out.writeInt(header.getValue().size());
      for (var value : header.getValue()) {
        out.writeUTF(value);
      }
    }
  }

  static String hash(URI uri) {
    MessageDigest digest;
    try {
      digest = MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new UnsupportedOperationException("SHA-256 not available!", e);
    }
    var hash = digest.digest(uri.toString().getBytes(UTF_8));
    var hex = new StringBuilder(2 * hash.length);
    for (byte b : hash) {
      hex.append(Character.forDigit((b >> 4) & 0xf, 16)).append(Character.forDigit(b & 0xf, 16));
    }
    return hex.toString();
  }

  private static void deleteIfExistsQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      logger.log(Level.WARNING, "Exception thrown when deleting: " + path, e);
    }
  }

  private static final class Entry {
    final CacheKey key;
    final HttpHeaders headers;
    final byte[] body;

    Entry(CacheKey key, HttpHeaders headers, byte[] body) {
      this.key = key;
      this.headers = headers;
      this.body = body;
    }
  }

  private final class DiskWriter implements CacheWriter {
    private final URI uri;
    private final CacheKey key;
    private final HttpHeaders headers;
    private @MonotonicNonNull Path tempFile;
    private @MonotonicNonNull DataOutputStream out;
    private @MonotonicNonNull WritableByteChannel channel;
    private boolean done;

    DiskWriter(URI uri, CacheKey key, HttpHeaders headers) {
      this.uri = uri;
      this.key = key;
      this.headers = headers;
    }

    /** Opens the temp file on first write, so an unused writer leaves nothing behind. */
    private void ensureOpen() throws IOException {
      requireState(!done, "writer is done");
      if (out == null) {
        tempFile = Files.createTempFile(directory, hash(uri), TEMP_ENTRY_FILE_SUFFIX);
        out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(tempFile)));
        channel = Channels.newChannel(out);
        writeMetadata(out, uri, key, headers);
      }
    }

    @Override
    public void write(ByteBuffer buffer) throws IOException {
      ensureOpen();
      var duplicate = buffer.duplicate();
      while (duplicate.hasRemaining()) {
        channel.write(duplicate);
      }
    }

    @Override
    public void commit() throws IOException {
      ensureOpen();
      done = true;
      try {
        out.close();
        Files.move(tempFile, entryFile(uri), ATOMIC_MOVE, REPLACE_EXISTING);
      } catch (IOException e) {
        deleteIfExistsQuietly(tempFile);
        throw e;
      }
    }

    @Override
    public void discard() {
      if (done) {
        return;
      }
      done = true;
      if (out != null) {
        try {
          out.close();
        } catch (IOException e) {
          logger.log(Level.WARNING, "Exception thrown when closing: " + tempFile, e);
        }
        deleteIfExistsQuietly(tempFile);
      }
    }
  }
}
