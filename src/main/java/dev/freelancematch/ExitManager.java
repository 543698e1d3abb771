package dev.freelancematch;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Terminates the process once the runner finishes.
 * Disabled with {@code matching.exit-enabled=false} so tests keep the JVM alive.
 */
@Component
public class ExitManager {

  private final boolean exitEnabled;

  public ExitManager(@Value("${matching.exit-enabled:true}") boolean exitEnabled) {
    this.exitEnabled = exitEnabled;
  }

  public void exit(int status) {
    if (exitEnabled) {
      System.exit(status);
    }
  }

  public boolean isExitEnabled() {
    return exitEnabled;
  }
}
