package io.ngxdiscover.shell;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class OutputWriterTest {

  @Test
  void failuresGoToErrorChannelOnly() {
    OutputWriter out = mock(OutputWriter.class);

    int exitCode =
        Main.commandLine(new Main(out, List.of()))
            .execute("-c", "/nonexistent/dir/nginx.conf", "export", "json");

    assertEquals(1, exitCode);
    verify(out).error(contains("IO error: /nonexistent/dir/nginx.conf"));
    verifyNoMoreInteractions(out);
  }

  @Test
  void usageGoesToErrorChannel() {
    OutputWriter out = mock(OutputWriter.class);

    int exitCode = Main.commandLine(new Main(out, List.of())).execute();

    assertEquals(2, exitCode);
    verify(out).error(contains("parse"));
    verifyNoMoreInteractions(out);
  }

  @Test
  void verboseReportsConfigOnErrorChannel() {
    OutputWriter out = mock(OutputWriter.class);

    Main.commandLine(new Main(out, List.of()))
        .execute("-v", "-c", "/nonexistent/nginx.conf", "parse");

    verify(out).error("Reading config: /nonexistent/nginx.conf");
    verify(out).error(contains("IO error"));
    verifyNoMoreInteractions(out);
  }
}
