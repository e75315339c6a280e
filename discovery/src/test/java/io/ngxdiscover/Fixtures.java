package io.ngxdiscover;

import io.ngxdiscover.parser.NginxParser;
import io.ngxdiscover.parser.ast.Config;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Test fixtures shared by the discovery tests. */
public final class Fixtures {
  private Fixtures() {}

  /** Text of {@code site.conf}: two servers, two upstreams and two log formats. */
  public static String siteText() {
    try (InputStream in = Fixtures.class.getResourceAsStream("/site.conf")) {
      if (in == null) {
        throw new IllegalStateException("site.conf not on the test classpath");
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static Config site() {
    return NginxParser.parse(siteText());
  }
}
