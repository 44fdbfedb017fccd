package ca.gc.cra.scribe.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogsTest {
  @Test
  void redactsHomeDirectory() {
    String home = System.getProperty("user.home");

    assertEquals("~/Library/Messages/chat.db", Logs.redactPath(home + "/Library/Messages/chat.db"));
    assertEquals("<null>", Logs.redactPath(null));
  }

  @Test
  void verboseLoggingRaisesRootToDebug() {
    Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    Level previous = root.getLevel();
    try {
      LoggingConfigurator.enableVerboseLogging();
      assertEquals(Level.DEBUG, root.getLevel());
    } finally {
      root.setLevel(previous);
    }
  }
}
