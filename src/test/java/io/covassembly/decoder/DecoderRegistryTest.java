// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package io.covassembly.decoder;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import io.covassembly.errors.ReportExpiredException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link DecoderRegistry} and {@link DecoderContext}. */
@RunWith(JUnit4.class)
public class DecoderRegistryTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  /** Recognizes files whose first line is a given header. */
  private static final class HeaderDecoder implements LanguageDecoder {
    private final String header;

    HeaderDecoder(String header) {
      this.header = header;
    }

    @Override
    public String name() {
      return header;
    }

    @Override
    public boolean matches(String content, String firstLine, String filename) {
      return firstLine.equals(header);
    }

    @Override
    public ImmutableList<DecodedLine> decode(
        String content, String filename, DecoderContext context) {
      return ImmutableList.of();
    }
  }

  @Test
  public void testFirstMatchingDecoderWins() {
    LanguageDecoder first = new HeaderDecoder("mode: set");
    LanguageDecoder second = new HeaderDecoder("mode: set");
    DecoderRegistry registry = new DecoderRegistry(ImmutableList.of(first, second));

    assertThat(registry.find("\n  mode: set\nfoo.go:1.1,2.2 1 1\n", "c.out")).hasValue(first);
  }

  @Test
  public void testUnrecognizedContent() {
    assertThat(DecoderRegistry.withDefaults().find("<coverage/>", "coverage.xml")).isEmpty();
  }

  @Test
  public void testDefaultsDecodeLcov() {
    assertThat(DecoderRegistry.withDefaults().find("SF:a.c\nend_of_record\n", "lcov.info").get())
        .isInstanceOf(LcovDecoder.class);
  }

  @Test
  public void testReportsOlderThanMaximumAgeExpire() throws Exception {
    DecoderContext context =
        new DecoderContext(Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofHours(12));

    context.checkNotExpired(NOW.minus(Duration.ofHours(11)), "fresh.xml");
    ReportExpiredException e =
        assertThrows(
            ReportExpiredException.class,
            () -> context.checkNotExpired(NOW.minus(Duration.ofHours(13)), "old.xml"));
    assertThat(e.filename()).isEqualTo("old.xml");
  }

  @Test
  public void testNoMaximumAge() throws Exception {
    DecoderContext context = new DecoderContext(Clock.fixed(NOW, ZoneOffset.UTC), null);

    context.checkNotExpired(Instant.EPOCH, "ancient.xml");
  }
}
