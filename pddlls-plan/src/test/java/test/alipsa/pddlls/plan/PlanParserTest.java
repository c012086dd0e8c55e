package test.alipsa.pddlls.plan;

import org.junit.jupiter.api.Test;
import se.alipsa.pddlls.core.ParseRequest;
import se.alipsa.pddlls.core.SimplePositionResolver;
import se.alipsa.pddlls.core.WorkspaceOptions;
import se.alipsa.pddlls.core.model.ParsingProblem;
import se.alipsa.pddlls.core.model.PddlLanguage;
import se.alipsa.pddlls.core.model.PlanInfo;
import se.alipsa.pddlls.core.model.PlanStep;
import se.alipsa.pddlls.core.parser.SyntaxTreeBuilder;
import se.alipsa.pddlls.plan.PlanParser;
import se.alipsa.pddlls.plan.PlanPlugin;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanParserTest {

  static ParseRequest request(PddlLanguage language, String text) {
    return new ParseRequest("file:///work/p01.plan", language, 3, text, SyntaxTreeBuilder.build(text),
        new SimplePositionResolver(text));
  }

  @Test
  void timedDurativePlan() {
    PlanInfo plan = new PlanParser(0.001).parse(request(PddlLanguage.PLAN, """
        ;;!domain: logistics
        ;;!problem: p01
        0.000: (drive t1 depot market) [20.000]
        20.001: (refuel t1) ; at the market
        ; cost = 21.5 (general cost)
        """));
    assertEquals("logistics", plan.getDomainName());
    assertEquals("p01", plan.getProblemName());
    assertEquals(3, plan.getVersion());
    assertTrue(plan.getParsingProblems().isEmpty(), plan.getParsingProblems().toString());

    List<PlanStep> steps = plan.getSteps();
    assertEquals(2, steps.size());
    PlanStep drive = steps.get(0);
    assertEquals("drive", drive.getActionName());
    assertEquals(List.of("t1", "depot", "market"), drive.getObjects());
    assertEquals(20.0, drive.getDuration().getAsDouble());
    assertEquals(2, drive.getLine());
    assertFalse(steps.get(1).isDurative());
    assertEquals("refuel t1", steps.get(1).getFullActionName());

    assertEquals(21.5, plan.getMetric().getAsDouble());
    assertEquals(20.001, plan.getMakespan(), 1e-9);
  }

  @Test
  void untimedStepsFollowThePreviousEnd() {
    PlanInfo plan = new PlanParser(0.5).parse(request(PddlLanguage.PLAN, """
        (load c1 t1)
        (drive t1 a b) [3]
        (unload c1 t1)
        """));
    List<PlanStep> steps = plan.getSteps();
    assertEquals(0.0, steps.get(0).getStartTime());
    assertFalse(steps.get(0).isTimeSpecified());
    assertEquals(0.5, steps.get(1).getStartTime(), 1e-9);
    assertEquals(4.0, steps.get(2).getStartTime(), 1e-9);
    assertNull(plan.getDomainName());
  }

  @Test
  void badLinesAreReported() {
    PlanInfo plan = new PlanParser(0.001).parse(request(PddlLanguage.PLAN,
        "0: (a)\n  garbage here\n1: (b) [-2]\n"));
    assertEquals(2, plan.getSteps().size());
    List<ParsingProblem> problems = plan.getParsingProblems();
    assertEquals(2, problems.size());
    assertEquals(new ParsingProblem("Unexpected plan line: garbage here", 1, 2), problems.get(0));
    assertEquals(ParsingProblem.Severity.WARNING, problems.get(1).getSeverity());
    assertEquals(2, problems.get(1).getLine());
  }

  @Test
  void pluginUsesConfiguredEpsilon() {
    PlanPlugin plugin = new PlanPlugin();
    plugin.configure(() -> WorkspaceOptions.builder().planEpsilon(0.25).build());
    PlanInfo plan = (PlanInfo) plugin.parse(request(PddlLanguage.PLAN, "(a)\n(b)\n")).orElseThrow();
    assertEquals(0.25, plan.getSteps().get(1).getStartTime(), 1e-9);
    assertTrue(plugin.claim("file:///x.plan", PddlLanguage.PLAN, () -> "") > 0);
    assertEquals(0.0, plugin.claim("file:///x.pddl", PddlLanguage.PDDL, () -> ""));
  }
}
