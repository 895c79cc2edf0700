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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.github.octoline.DecodingException;
import com.github.octoline.PageLinks;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JacksonPageDecoderTest {
  private static final HttpHeaders NO_HEADERS = HttpHeaders.of(Map.of(), (n, v) -> true);

  private static byte[] json(String json) {
    return json.getBytes(UTF_8);
  }

  @Test
  void bareArray() {
    var headers =
        HttpHeaders.of(
            Map.of(
                "Link",
                List.of(
                    "<https://api.github.com/repos/o/r/issues?page=2>; rel=\"next\", "
                        + "<https://api.github.com/repos/o/r/issues?page=3>; rel=\"last\"")),
            (n, v) -> true);
    var page =
        JacksonPageDecoder.create()
            .decode(
                json("[{\"number\":1,\"title\":\"a\",\"state\":\"open\"},{\"number\":2}]"),
                headers,
                Issue.class);

    assertThat(page.items()).containsExactly(new Issue(1, "a"), new Issue(2, null));
    assertThat(page.totalCount()).isEmpty();
    assertThat(page.incompleteResults()).isEmpty();
    assertThat(page.next())
        .hasValue(URI.create("https://api.github.com/repos/o/r/issues?page=2"));
    assertThat(page.numberOfPages()).hasValue(3);
  }

  @Test
  void searchResults() {
    var page =
        JacksonPageDecoder.create()
            .decode(
                json(
                    "{\"total_count\":40,\"incomplete_results\":false,"
                        + "\"items\":[{\"number\":7,\"title\":\"bug\"}]}"),
                NO_HEADERS,
                Issue.class);

    assertThat(page.items()).containsExactly(new Issue(7, "bug"));
    assertThat(page.totalCount()).hasValue(40);
    assertThat(page.incompleteResults()).hasValue(false);
    assertThat(page.links()).isEqualTo(PageLinks.empty());
  }

  @Test
  void knownContainerAttribute() {
    var page =
        JacksonPageDecoder.create()
            .decode(
                json("{\"total_count\":1,\"workflow_runs\":[{\"number\":3}]}"),
                NO_HEADERS,
                Issue.class);

    assertThat(page.items()).containsExactly(new Issue(3, null));
    assertThat(page.totalCount()).hasValue(1);
    assertThat(page.incompleteResults()).isEmpty();
  }

  @Test
  void emptyContainer() {
    var page =
        JacksonPageDecoder.create()
            .decode(json("{\"total_count\":0,\"items\":[]}"), NO_HEADERS, Issue.class);
    assertThat(page.isEmpty()).isTrue();
    assertThat(page.totalCount()).hasValue(0);
  }

  @Test
  void unknownContainerAttribute() {
    var decoder = JacksonPageDecoder.create();
    assertThatThrownBy(
            () ->
                decoder.decode(
                    json("{\"total_count\":1,\"gadgets\":[{\"number\":1}]}"),
                    NO_HEADERS,
                    Issue.class))
        .isInstanceOf(DecodingException.class)
        .hasMessageContaining("gadgets");
  }

  @Test
  void customContainerAttribute() {
    var decoder = JacksonPageDecoder.newBuilder().containerAttribute("gadgets").build();
    assertThat(decoder.containerAttributes()).endsWith("gadgets");

    var page =
        decoder.decode(json("{\"gadgets\":[{\"number\":1}]}"), NO_HEADERS, Issue.class);
    assertThat(page.items()).containsExactly(new Issue(1, null));
  }

  @Test
  void containerMustBeArray() {
    var decoder = JacksonPageDecoder.create();
    assertThatThrownBy(
            () -> decoder.decode(json("{\"items\":{\"number\":1}}"), NO_HEADERS, Issue.class))
        .isInstanceOf(DecodingException.class);
  }

  @Test
  void firstPresentContainerIsUsed() {
    var decoder = JacksonPageDecoder.create();
    assertThatThrownBy(
            () ->
                decoder.decode(
                    json("{\"items\":{\"number\":1},\"workflow_runs\":[{\"number\":2}]}"),
                    NO_HEADERS,
                    Issue.class))
        .isInstanceOf(DecodingException.class)
        .hasMessageContaining("items");
  }

  @Test
  void malformedJson() {
    var decoder = JacksonPageDecoder.create();
    assertThatThrownBy(() -> decoder.decode(json("[{\"number\":"), NO_HEADERS, Issue.class))
        .isInstanceOf(DecodingException.class);
    assertThatThrownBy(() -> decoder.decode(json(""), NO_HEADERS, Issue.class))
        .isInstanceOf(DecodingException.class);
    assertThatThrownBy(() -> decoder.decode(json("\"text\""), NO_HEADERS, Issue.class))
        .isInstanceOf(DecodingException.class);
  }

  @Test
  void undecodableItem() {
    var decoder = JacksonPageDecoder.create();
    assertThatThrownBy(
            () -> decoder.decode(json("[{\"number\":\"one\"}]"), NO_HEADERS, Issue.class))
        .isInstanceOf(DecodingException.class);
  }

  @Test
  void customMapper() {
    var strictMapper =
        JsonMapper.builder().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES).build();
    var decoder = JacksonPageDecoder.newBuilder().mapper(strictMapper).build();
    assertThat(decoder.mapper()).isSameAs(strictMapper);
    assertThatThrownBy(
            () -> decoder.decode(json("[{\"number\":1,\"state\":\"x\"}]"), NO_HEADERS, Issue.class))
        .isInstanceOf(DecodingException.class);
  }
}
