package test.alipsa.pddlls.pddl.preprocess;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import se.alipsa.pddlls.pddl.preprocess.CommandPreProcessor;
import se.alipsa.pddlls.pddl.preprocess.PreProcessingException;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class CommandPreProcessorTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(10);

  @Test
  void stdinToStdout() throws PreProcessingException {
    CommandPreProcessor cat = new CommandPreProcessor(List.of("cat"), 0);
    assertEquals("(define (problem p) (:domain d))\n", cat.transform("(define (problem p) (:domain d))\n", null, TIMEOUT));
  }

  @Test
  void argumentsArePassed() throws PreProcessingException {
    CommandPreProcessor sed = new CommandPreProcessor(List.of("sed", "s/TEMPLATE/p7/"), 0);
    assertEquals("(problem p7)\n", sed.transform("(problem TEMPLATE)\n", null, TIMEOUT));
  }

  @Test
  void nonZeroExit_isReported() {
    CommandPreProcessor failing = new CommandPreProcessor(List.of("sh", "-c", "echo broken >&2; exit 3"), 4);
    PreProcessingException e = assertThrows(PreProcessingException.class,
        () -> failing.transform("", null, TIMEOUT));
    assertTrue(e.getMessage().contains("exit code 3"), e.getMessage());
    assertTrue(e.getMessage().endsWith("broken"), e.getMessage());
    assertEquals(4, e.getLine());
  }

  @Test
  void timeout() {
    CommandPreProcessor slow = new CommandPreProcessor(List.of("sleep", "5"), 0);
    PreProcessingException e = assertThrows(PreProcessingException.class,
        () -> slow.transform("", null, Duration.ofMillis(200)));
    assertTrue(e.getMessage().contains("timed out after 200 ms"), e.getMessage());
  }

  @Test
  void missingExecutable() {
    CommandPreProcessor missing = new CommandPreProcessor(List.of("no-such-pddl-generator"), 2);
    PreProcessingException e = assertThrows(PreProcessingException.class,
        () -> missing.transform("", null, TIMEOUT));
    assertTrue(e.getMessage().startsWith("Cannot start pre-processor"), e.getMessage());
  }
}
