package exm.iet.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

import exm.iet.common.exceptions.InvalidOptionException;

public class LoggingTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void resetLogger() {
    Logger logger = Logging.getIETLogger();
    logger.removeAllAppenders();
    logger.setLevel(null);
  }

  @Test
  public void testNoLogFile() throws InvalidOptionException {
    Logger logger = Logging.setupLogging("", true);
    assertEquals("exm.iet", logger.getName());
    assertFalse(logger.getAllAppenders().hasMoreElements());
  }

  @Test
  public void testLogFile() throws Exception {
    File log = new File(tmp.getRoot(), "iet.log");
    Logger logger = Logging.setupLogging(log.getPath(), true);
    assertEquals(Level.TRACE, logger.getLevel());
    logger.debug("hello from the tree");
    String text = new String(Files.readAllBytes(log.toPath()),
                             StandardCharsets.UTF_8);
    assertTrue(text, text.contains("DEBUG iet - hello from the tree"));
  }

  @Test
  public void testUnwritableLogFile() throws Exception {
    // Parent path is a plain file, so the log can't be created
    File plain = tmp.newFile("plain");
    exception.expect(InvalidOptionException.class);
    Logging.setupLogging(new File(plain, "iet.log").getPath(), false);
  }

  @Test
  public void testUniqueWarn() {
    assertTrue(Logging.addEmitted(Level.INFO, "unique message 1"));
    assertFalse(Logging.addEmitted(Level.INFO, "unique message 1"));
    assertTrue(Logging.addEmitted(Level.WARN, "unique message 1"));
  }
}
