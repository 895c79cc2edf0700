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

package com.github.octoline.jackson;

import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.github.octoline.DecodingException;
import com.github.octoline.GitHubException;
import com.github.octoline.Page;
import java.io.IOException;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodySubscribers;
import java.net.http.HttpResponse.ResponseInfo;
import java.nio.charset.StandardCharsets;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * {@code BodyHandler} implementations that decode GitHub's JSON responses with Jackson.
 *
 * <p>Successful ({@code 2xx}) responses are decoded into the requested type, failing with a {@link
 * DecodingException} if that's not possible. Other responses fail with a {@link GitHubException}
 * carrying the error's message.
 */
public final class JacksonBodyHandlers {
  private static final ObjectMapper DEFAULT_MAPPER =
      JsonMapper.builder().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES).build();

  private final ObjectMapper mapper;
  private final JacksonPageDecoder pageDecoder;

  private JacksonBodyHandlers(ObjectMapper mapper, JacksonPageDecoder pageDecoder) {
    this.mapper = mapper;
    this.pageDecoder = pageDecoder;
  }

  /** Returns a handler of pages of items of the given type. */
  public <T> BodyHandler<Page<T>> ofPage(Class<T> itemType) {
    return ofPage(mapper.constructType(itemType));
  }

  /** Returns a handler of pages of items of the given type. */
  public <T> BodyHandler<Page<T>> ofPage(TypeReference<T> itemType) {
    return ofPage(mapper.constructType(itemType));
  }

  private <T> BodyHandler<Page<T>> ofPage(JavaType itemType) {
    return responseInfo ->
        BodySubscribers.mapping(
            BodySubscribers.ofByteArray(),
            body -> {
              requireSuccess(responseInfo, body);
              return pageDecoder.decode(body, responseInfo.headers(), itemType);
            });
  }

  /** Returns a handler of a single resource of the given type. */
  public <T> BodyHandler<T> ofObject(Class<T> type) {
    return ofObject(mapper.constructType(type));
  }

  /** Returns a handler of a single resource of the given type. */
  public <T> BodyHandler<T> ofObject(TypeReference<T> type) {
    return ofObject(mapper.constructType(type));
  }

  private <T> BodyHandler<T> ofObject(JavaType type) {
    return responseInfo ->
        BodySubscribers.mapping(
            BodySubscribers.ofByteArray(),
            body -> {
              requireSuccess(responseInfo, body);
              try {
                return mapper.readValue(body, type);
              } catch (IOException e) {
                throw new DecodingException("couldn't decode response as " + type, e);
              }
            });
  }

  private void requireSuccess(ResponseInfo responseInfo, byte[] body) {
    int statusCode = responseInfo.statusCode();
    if (statusCode >= 200 && statusCode < 300) {
      return;
    }

    String message = null;
    String documentationUrl = null;
    try {
      var error = mapper.readTree(body);
      if (error != null && error.isObject()) {
        message = textOrNull(error.get("message"));
        documentationUrl = textOrNull(error.get("documentation_url"));
      }
    } catch (IOException ignored) {
      // Not a JSON error, fall back to the raw body.
    }
    if (message == null) {
      message = body.length > 0 ? new String(body, StandardCharsets.UTF_8) : "HTTP " + statusCode;
    }
    throw new GitHubException(statusCode, message, documentationUrl);
  }

  private static @Nullable String textOrNull(@Nullable JsonNode node) {
    return node != null && node.isTextual() ? node.textValue() : null;
  }

  /** Returns handlers that use a default mapper and page decoder. */
  public static JacksonBodyHandlers create() {
    return new JacksonBodyHandlers(DEFAULT_MAPPER, JacksonPageDecoder.create());
  }

  /** Returns handlers that decode resources with the given mapper. */
  public static JacksonBodyHandlers create(ObjectMapper mapper) {
    return new JacksonBodyHandlers(
        requireNonNull(mapper), JacksonPageDecoder.newBuilder().mapper(mapper).build());
  }

  /** Returns handlers that decode pages with the given decoder and resources with its mapper. */
  public static JacksonBodyHandlers create(JacksonPageDecoder pageDecoder) {
    return new JacksonBodyHandlers(pageDecoder.mapper(), pageDecoder);
  }

  /** Returns a mapper that ignores properties unknown to the target type. */
  static ObjectMapper defaultMapper() {
    return DEFAULT_MAPPER;
  }
}
