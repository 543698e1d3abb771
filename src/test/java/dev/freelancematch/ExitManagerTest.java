package dev.freelancematch;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class ExitManagerTest {

  @Test
  void testExitWhenDisabled() {
    ExitManager exitManager = new ExitManager(false);
    // Disabled, so this must not call System.exit()
    exitManager.exit(0);
    exitManager.exit(1);
    assertFalse(exitManager.isExitEnabled());
  }
}
