package test.alipsa.pddlls.core.server;

import org.junit.jupiter.api.Test;
import se.alipsa.pddlls.core.FileRemovalOptions;
import se.alipsa.pddlls.core.SimplePositionResolver;
import se.alipsa.pddlls.core.WorkspaceOptions;
import se.alipsa.pddlls.core.model.FileInfo;
import se.alipsa.pddlls.core.model.ParsingProblem;
import se.alipsa.pddlls.core.model.PddlLanguage;
import se.alipsa.pddlls.core.server.WorkspaceServer;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceServerTest {

  @Test
  void discoversPluginsAndPublishesDiagnostics() {
    Map<String, List<ParsingProblem>> published = new LinkedHashMap<>();
    WorkspaceOptions options = WorkspaceOptions.builder().parsingDelay(Duration.ofHours(1)).build();
    String uri = "file:///work/domain.pddl";
    String text = "(define (domain d1)))";

    try (WorkspaceServer server = WorkspaceServer.createDefault(options, published::put)) {
      FileInfo f = server.upsertFile(uri, PddlLanguage.PDDL, 1, text, new SimplePositionResolver(text));
      assertTrue(f.isDomain(), "test plugins should be discovered through ServiceLoader");
      assertEquals(1, published.get(uri).size());
      assertEquals("Unexpected token: )", published.get(uri).get(0).getMessage());

      assertTrue(server.removeFile(uri, FileRemovalOptions.DEFAULT));
      assertEquals(List.of(), published.get(uri));
      assertTrue(server.getAllFiles().isEmpty());
    }
  }

  @Test
  void openFile_printDiagnostics() {
    String uri = "file:///work/p1.pddl";
    String text = "(define (problem p1) (:domain d1)";
    try (WorkspaceServer server = WorkspaceServer.createDefault(WorkspaceServerTest::printDiagnostics)) {
      FileInfo f = server.upsertAndParseFile(uri, PddlLanguage.PDDL, 1, text, new SimplePositionResolver(text));
      assertTrue(f.isProblem());
      assertFalse(f.getParsingProblems().isEmpty());
    }
  }

  private static void printDiagnostics(String uri, List<ParsingProblem> problems) {
    System.out.println("=== Diagnostics for " + uri + " ===");
    if (problems.isEmpty()) {
      System.out.println("(none)");
      return;
    }
    for (ParsingProblem p : problems) {
      System.out.printf("[%s] %s:%d:%d %s%n", p.getSeverity(), uri, p.getLine(), p.getColumn(), p.getMessage());
    }
  }
}
