package io.xrdinfo.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void captureOutput() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void noArgumentsPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: xrdinfo"));
  }

  @Test
  void helpSucceeds() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("members"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"frobnicate"}));
    assertTrue(buffer.toString().contains("usage: xrdinfo"));
  }

  @Test
  void commandHelpIsDispatched() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"subsystems", "--help"}));
    assertTrue(buffer.toString().contains("--registered"));

    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"wsdl", "-h"}));
    assertTrue(buffer.toString().contains("--operations"));
  }
}
