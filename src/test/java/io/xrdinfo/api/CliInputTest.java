package io.xrdinfo.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesFlagsFromOptions() {
    CliInput input = CliInput.parse(new String[] {"anchor=a.xml", "--Registered", " ", "-v", "timeout=3"});

    assertArrayEquals(new String[] {"anchor=a.xml", "timeout=3"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--registered"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void recognisesHelp() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
  }

  @Test
  void nullArgumentsAreEmpty() {
    CliInput input = CliInput.parse(null);

    assertArrayEquals(new String[0], input.keyValueArgs());
    assertTrue(input.flags().isEmpty());
  }
}
