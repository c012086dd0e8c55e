package test.alipsa.pddlls.pddl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import se.alipsa.pddlls.core.WorkspaceOptions;
import se.alipsa.pddlls.core.model.FileInfo;
import se.alipsa.pddlls.core.model.PddlLanguage;
import se.alipsa.pddlls.core.model.ProblemInfo;
import se.alipsa.pddlls.pddl.DomainPlugin;
import se.alipsa.pddlls.pddl.ProblemPlugin;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static test.alipsa.pddlls.pddl.PddlFixtures.request;
import static test.alipsa.pddlls.pddl.PddlFixtures.resource;

class ProblemPluginTest {

  private static final String TEMPLATED = """
      ;;!pre-parsing:{"type": "command", "command": "sed", "args": ["s/TEMPLATE/generated/"]}
      (define (problem TEMPLATE) (:domain logistics)
        (:objects t1 - truck))
      """;

  private static ProblemPlugin plugin(boolean preprocessing) {
    ProblemPlugin plugin = new ProblemPlugin();
    WorkspaceOptions options = WorkspaceOptions.builder()
        .preprocessingEnabled(preprocessing)
        .preprocessingTimeout(Duration.ofSeconds(10))
        .build();
    plugin.configure(() -> options);
    return plugin;
  }

  @Test
  void claimsOnlyPddl() {
    ProblemPlugin plugin = new ProblemPlugin();
    assertEquals(0.8, plugin.claim("file:///p.pddl", PddlLanguage.PDDL, () -> ""));
    assertEquals(0.0, plugin.claim("file:///p.plan", PddlLanguage.PLAN, () -> ""));
    assertTrue(new DomainPlugin().claim("file:///d.pddl", PddlLanguage.PDDL, () -> "") > 0.8);
  }

  @Test
  void parsesProblem_andDeclinesDomain() {
    FileInfo info = plugin(false).parse(request("file:///work/p01.pddl", resource("/logistics/p01.pddl")))
        .orElseThrow();
    assertTrue(info.isProblem());
    assertEquals("p01", ((ProblemInfo) info).getName());
    assertTrue(plugin(false).parse(request("file:///work/domain.pddl", resource("/logistics/domain.pddl")))
        .isEmpty());
  }

  @Test
  void directiveIgnoredWhenPreprocessingIsDisabled() {
    ProblemInfo problem = (ProblemInfo) plugin(false).parse(request("file:///work/t.pddl", TEMPLATED)).orElseThrow();
    assertEquals("TEMPLATE", problem.getName());
    assertTrue(problem.getPreProcessor().isEmpty());
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void directiveRunsWhenPreprocessingIsEnabled() {
    ProblemInfo problem = (ProblemInfo) plugin(true).parse(request("file:///tmp/t.pddl", TEMPLATED)).orElseThrow();
    assertEquals("generated", problem.getName());
    assertEquals("logistics", problem.getDomainName());
    assertEquals("sed s/TEMPLATE/generated/", problem.getPreProcessor().orElseThrow());
    // the model keeps what the user wrote
    assertEquals(TEMPLATED, problem.getText());
    assertTrue(problem.getSyntaxTree().getText().contains("(problem generated)"));
  }

  @Test
  @EnabledOnOs({OS.LINUX, OS.MAC})
  void failingPreprocessor_yieldsUnknownProblem() {
    String text = "\n;;!pre-parsing:{\"command\": \"sh\", \"args\": [\"-c\", \"exit 2\"]}\n"
        + "(define (problem p) (:domain d))";
    ProblemInfo problem = (ProblemInfo) plugin(true).parse(request("file:///tmp/f.pddl", text)).orElseThrow();
    assertEquals("unknown", problem.getName());
    assertEquals("unknown", problem.getDomainName());
    assertEquals(1, problem.getParsingProblems().size());
    assertEquals(1, problem.getParsingProblems().get(0).getLine());
    assertTrue(problem.getParsingProblems().get(0).getMessage().contains("exit code 2"));
  }

  @Test
  void malformedDirective_yieldsUnknownProblem() {
    String text = ";;!pre-parsing:{broken}\n(define (problem p) (:domain d))";
    ProblemInfo problem = (ProblemInfo) plugin(true).parse(request("file:///tmp/m.pddl", text)).orElseThrow();
    assertEquals("unknown", problem.getName());
    assertTrue(problem.getParsingProblems().get(0).getMessage().startsWith("Malformed pre-parsing directive"));
  }
}
