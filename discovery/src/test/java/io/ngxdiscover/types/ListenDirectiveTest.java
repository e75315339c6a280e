package io.ngxdiscover.types;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ListenDirectiveTest {

  private static ListenDirective listen(String... args) {
    return ListenDirective.fromArgs(List.of(args)).orElseThrow();
  }

  @Test
  void barePortListensOnAllAddresses() {
    ListenDirective l = listen("80");

    assertEquals("*", l.address());
    assertEquals(80, l.port());
    assertFalse(l.ssl());
    assertNull(l.backlog());
  }

  @Test
  void hostAndPort() {
    assertEquals(ListenDirective.of("0.0.0.0", 8080), listen("0.0.0.0:8080"));
    assertEquals(ListenDirective.of("localhost", 3000), listen("localhost:3000"));
  }

  @Test
  void bracketedIpv6() {
    ListenDirective l = listen("[::1]:8080");

    assertEquals("::1", l.address());
    assertEquals(8080, l.port());
    assertEquals("[::1]:8080", l.endpoint());
  }

  @Test
  void addressWithoutPortDefaultsTo80() {
    assertEquals(ListenDirective.of("example.com", 80), listen("example.com"));
  }

  @Test
  void unixSocketKeepsWholeAddress() {
    ListenDirective l = listen("unix:/var/run/nginx.sock");

    assertEquals("unix:/var/run/nginx.sock", l.address());
    assertEquals(80, l.port());
    assertEquals("unix:/var/run/nginx.sock:80", l.endpoint());
  }

  @Test
  void outOfRangePortIsPartOfAddress() {
    ListenDirective l = listen("70000");

    assertEquals("70000", l.address());
    assertEquals(80, l.port());
  }

  @Test
  void allOptions() {
    ListenDirective l =
        listen("443", "ssl", "http2", "http3", "default_server", "reuseport", "backlog=1024");

    assertEquals(443, l.port());
    assertTrue(l.ssl());
    assertTrue(l.http2());
    assertTrue(l.http3());
    assertTrue(l.defaultServer());
    assertTrue(l.reuseport());
    assertEquals(1024, l.backlog());
  }

  @Test
  void defaultIsAliasForDefaultServer() {
    assertTrue(listen("80", "default").defaultServer());
  }

  @Test
  void unknownOptionsAndBadBacklogAreIgnored() {
    ListenDirective l = listen("80", "proxy_protocol", "backlog=lots");

    assertEquals(ListenDirective.of("*", 80), l);
  }

  @Test
  void noArguments() {
    assertEquals(Optional.empty(), ListenDirective.fromArgs(List.of()));
  }

  @Test
  void parsePort() {
    assertEquals(443, ListenDirective.parsePort("443"));
    assertEquals(65535, ListenDirective.parsePort("65535"));
    assertNull(ListenDirective.parsePort("65536"));
    assertNull(ListenDirective.parsePort("-1"));
    assertNull(ListenDirective.parsePort("http"));
    assertNull(ListenDirective.parsePort(""));
  }
}
