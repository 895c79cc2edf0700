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

import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpHeaders;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The navigation links of a page, as found in the {@code Link} response header (<a
 * href="https://www.rfc-editor.org/rfc/rfc8288">RFC 8288</a>). For instance, the header:
 *
 * <pre>{@code
 * Link: <https://api.github.com/repos/o/r/issues?page=2>; rel="next",
 *       <https://api.github.com/repos/o/r/issues?page=5>; rel="last"
 * }</pre>
 *
 * <p>has a {@code next} and a {@code last} link. Link relations other than {@code first}, {@code
 * prev}, {@code next} and {@code last} are ignored.
 */
public final class PageLinks {
  private static final Logger logger = System.getLogger(PageLinks.class.getName());

  private static final PageLinks EMPTY = new PageLinks(null, null, null, null);

  /** Matches a link value: a URI reference in angle brackets followed by parameters. */
  private static final Pattern LINK_VALUE = Pattern.compile("<([^>]*)>([^<]*)");

  private final @Nullable URI first;
  private final @Nullable URI prev;
  private final @Nullable URI next;
  private final @Nullable URI last;

  private PageLinks(
      @Nullable URI first, @Nullable URI prev, @Nullable URI next, @Nullable URI last) {
    this.first = first;
    this.prev = prev;
    this.next = next;
    this.last = last;
  }

  public Optional<URI> first() {
    return Optional.ofNullable(first);
  }

  public Optional<URI> prev() {
    return Optional.ofNullable(prev);
  }

  public Optional<URI> next() {
    return Optional.ofNullable(next);
  }

  public Optional<URI> last() {
    return Optional.ofNullable(last);
  }

  /**
   * Returns the number of pages as indicated by the {@code page} query parameter of the {@code
   * last} link. An empty optional is returned if there's no {@code last} link or it has no valid
   * {@code page} parameter.
   */
  public OptionalInt numberOfPages() {
    if (last == null) {
      return OptionalInt.empty();
    }
    var query = last.getRawQuery();
    if (query == null) {
      return OptionalInt.empty();
    }
    for (var param : query.split("&")) {
      int eq = param.indexOf('=');
      if (eq > 0 && param.substring(0, eq).equals("page")) {
        try {
          int pages = Integer.parseInt(param.substring(eq + 1));
          return pages >= 0 ? OptionalInt.of(pages) : OptionalInt.empty();
        } catch (NumberFormatException e) {
          return OptionalInt.empty();
        }
      }
    }
    return OptionalInt.empty();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof PageLinks)) {
      return false;
    }
    var other = (PageLinks) obj;
    return Objects.equals(first, other.first)
        && Objects.equals(prev, other.prev)
        && Objects.equals(next, other.next)
        && Objects.equals(last, other.last);
  }

  @Override
  public int hashCode() {
    return Objects.hash(first, prev, next, last);
  }

  @Override
  public String toString() {
    return "PageLinks[first=" + first + ", prev=" + prev + ", next=" + next + ", last=" + last
        + "]";
  }

  /** Returns links with none of the relations present. */
  public static PageLinks empty() {
    return EMPTY;
  }

  /** Creates links with the given relations, any of which can be {@code null}. */
  public static PageLinks of(
      @Nullable URI first, @Nullable URI prev, @Nullable URI next, @Nullable URI last) {
    return new PageLinks(first, prev, next, last);
  }

  /** Parses the links in all the {@code Link} headers among the given headers. */
  public static PageLinks from(HttpHeaders headers) {
    var values = headers.allValues("Link");
    return values.isEmpty() ? EMPTY : parse(String.join(",", values));
  }

  /**
   * Parses the given {@code Link} header value. Link values that aren't well-formed are ignored.
   * If a relation appears more than once, the first occurrence wins.
   */
  public static PageLinks parse(String linkHeader) {
    requireNonNull(linkHeader);
    URI first = null;
    URI prev = null;
    URI next = null;
    URI last = null;
    var matcher = LINK_VALUE.matcher(linkHeader);
    while (matcher.find()) {
      var target = matcher.group(1).trim();
      var rels = findRel(matcher.group(2));
      if (rels == null) {
        continue;
      }

      URI uri;
      try {
        uri = new URI(target);
      } catch (URISyntaxException e) {
        logger.log(Level.WARNING, () -> "Ignoring link with malformed URI: <" + target + ">", e);
        continue;
      }

      for (var rel : rels.trim().split("\\s+")) {
        switch (rel.toLowerCase(Locale.ROOT)) {
          case "first":
            first = first != null ? first : uri;
            break;
          case "prev":
          case "previous":
            prev = prev != null ? prev : uri;
            break;
          case "next":
            next = next != null ? next : uri;
            break;
          case "last":
            last = last != null ? last : uri;
            break;
          default:
            logger.log(Level.DEBUG, () -> "Ignoring unknown link relation: " + rel);
        }
      }
    }
    return new PageLinks(first, prev, next, last);
  }

  /** Returns the value of the {@code rel} parameter among the given link parameters. */
  private static @Nullable String findRel(String params) {
    for (var param : params.split(";")) {
      int eq = param.indexOf('=');
      if (eq > 0 && param.substring(0, eq).trim().equalsIgnoreCase("rel")) {
        var value = param.substring(eq + 1).trim();
        if (value.endsWith(",")) {
          value = value.substring(0, value.length() - 1).trim();
        }
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
          value = value.substring(1, value.length() - 1);
        }
        return value.isEmpty() ? null : value;
      }
    }
    return null;
  }
}
