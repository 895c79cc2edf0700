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

import static com.github.octoline.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.octoline.DecodingException;
import com.github.octoline.Page;
import com.github.octoline.PageLinks;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.net.http.HttpHeaders;
import java.util.ArrayList;
import java.util.List;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Decodes {@link Page pages} from JSON bodies and {@code Link} headers.
 *
 * <p>GitHub returns paginated items either as a bare JSON array, or as an array under a container
 * attribute of a JSON object, as in:
 *
 * <pre>{@code
 * {"total_count": 2, "incomplete_results": false, "items": [{...}, {...}]}
 * }</pre>
 *
 * <p>Container attributes are tried in the order they're added to the {@link Builder}, starting
 * with the {@link #DEFAULT_CONTAINER_ATTRIBUTES defaults}, and the first one present is used. An
 * object with none of the known container attributes, or whose first present one isn't an array,
 * fails with a {@link DecodingException}.
 */
public final class JacksonPageDecoder {
  /** The container attributes of GitHub's paginated endpoints. */
  public static final List<String> DEFAULT_CONTAINER_ATTRIBUTES =
      List.of(
          "items",
          "workflows",
          "workflow_runs",
          "jobs",
          "artifacts",
          "repositories",
          "installations",
          "runners",
          "secrets",
          "variables",
          "check_runs",
          "check_suites",
          "environments");

  private final ObjectMapper mapper;
  private final List<String> containerAttributes;

  private JacksonPageDecoder(Builder builder) {
    this.mapper = builder.mapper;
    this.containerAttributes = List.copyOf(builder.containerAttributes);
  }

  public ObjectMapper mapper() {
    return mapper;
  }

  /** Returns the container attributes tried, in order. */
  public List<String> containerAttributes() {
    return containerAttributes;
  }

  /** Decodes a page of items of the given type. */
  public <T> Page<T> decode(byte[] body, HttpHeaders headers, Class<T> itemType) {
    return decode(body, headers, mapper.constructType(itemType));
  }

  /** Decodes a page of items of the given type. */
  public <T> Page<T> decode(byte[] body, HttpHeaders headers, JavaType itemType) {
    requireNonNull(headers);
    JsonNode root;
    try {
      root = mapper.readTree(body);
    } catch (IOException e) {
      throw new DecodingException("malformed JSON page", e);
    }

    var links = PageLinks.from(headers);
    if (root == null || root.isMissingNode()) {
      throw new DecodingException("empty page body");
    } else if (root.isArray()) {
      return Page.of(readItems(root, itemType), links);
    } else if (!root.isObject()) {
      throw new DecodingException(
          "expected a JSON array or object, found: " + root.getNodeType());
    }

    for (var attribute : containerAttributes) {
      var container = root.get(attribute);
      if (container == null) {
        continue;
      } else if (!container.isArray()) {
        throw new DecodingException(
            "container attribute '" + attribute + "' isn't an array: " + container.getNodeType());
      }

      var totalCount = root.get("total_count");
      var incompleteResults = root.get("incomplete_results");
      return Page.of(
          readItems(container, itemType),
          totalCount != null && totalCount.canConvertToLong() ? totalCount.longValue() : null,
          incompleteResults != null && incompleteResults.isBoolean()
              ? incompleteResults.booleanValue()
              : null,
          links);
    }
    throw new DecodingException(
        "no known container attribute among: "
            + StreamSupport.stream(
                    Spliterators.spliteratorUnknownSize(root.fieldNames(), 0), false)
                .collect(Collectors.toList())
            + " (known: "
            + containerAttributes
            + ")");
  }

  private <T> List<T> readItems(JsonNode array, JavaType itemType) {
    var items = new ArrayList<T>(array.size());
    for (var element : array) {
      try {
        T item = mapper.treeToValue(element, itemType);
        items.add(item);
      } catch (JsonProcessingException | IllegalArgumentException e) {
        throw new DecodingException("couldn't decode page item as " + itemType, e);
      }
    }
    return items;
  }

  /** Returns a decoder with a default {@code JsonMapper} and the default container attributes. */
  public static JacksonPageDecoder create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** A builder of {@code JacksonPageDecoder} instances. */
  public static final class Builder {
    private final List<String> containerAttributes = new ArrayList<>(DEFAULT_CONTAINER_ATTRIBUTES);
    private ObjectMapper mapper = JacksonBodyHandlers.defaultMapper();

    Builder() {}

    @CanIgnoreReturnValue
    public Builder mapper(ObjectMapper mapper) {
      this.mapper = requireNonNull(mapper);
      return this;
    }

    /** Adds a container attribute, tried after those already added. */
    @CanIgnoreReturnValue
    public Builder containerAttribute(String attribute) {
      requireArgument(!attribute.isBlank(), "blank attribute");
      if (!containerAttributes.contains(attribute)) {
        containerAttributes.add(attribute);
      }
      return this;
    }

    public JacksonPageDecoder build() {
      return new JacksonPageDecoder(this);
    }
  }
}
