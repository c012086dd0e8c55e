package test.alipsa.pddlls.plan;

import org.junit.jupiter.api.Test;
import se.alipsa.pddlls.core.model.Happening;
import se.alipsa.pddlls.core.model.HappeningType;
import se.alipsa.pddlls.core.model.HappeningsInfo;
import se.alipsa.pddlls.core.model.ParsingProblem;
import se.alipsa.pddlls.core.model.PddlLanguage;
import se.alipsa.pddlls.plan.HappeningsParser;
import se.alipsa.pddlls.plan.HappeningsPlugin;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static test.alipsa.pddlls.plan.PlanParserTest.request;

class HappeningsParserTest {

  private static HappeningsInfo parse(String text) {
    return new HappeningsParser().parse(request(PddlLanguage.HAPPENINGS, text));
  }

  @Test
  void startEndAndInstantaneous() {
    HappeningsInfo info = parse("""
        ;;!domain: logistics
        ;;!problem: p01
        0.001: start (drive t1 depot market) #1
        0.001: start (drive t1 depot market) #2
        5.001: end (drive t1 depot market) #1
        END (drive t1 depot market) #2
        5.002: (refuel t1)
        """);
    assertEquals("p01", info.getProblemName());
    assertTrue(info.getParsingProblems().isEmpty(), info.getParsingProblems().toString());

    List<Happening> happenings = info.getHappenings();
    assertEquals(5, happenings.size());
    assertEquals(HappeningType.START, happenings.get(0).getType());
    assertEquals(2, happenings.get(1).getCounter());
    assertEquals(HappeningType.END, happenings.get(3).getType());
    assertEquals(5.001, happenings.get(3).getTime());
    assertEquals(HappeningType.INSTANTANEOUS, happenings.get(4).getType());
    assertEquals(List.of("t1"), happenings.get(4).getObjects());
  }

  @Test
  void unmatchedAndOutOfOrder() {
    HappeningsInfo info = parse("""
        1: start (a x)
        2: end (b)
        1.5: (c)
        start (a x)
        oops
        """);
    List<String> messages = info.getParsingProblems().stream().map(ParsingProblem::getMessage).toList();
    assertEquals(List.of(
        "No matching start for (b) #0",
        "Time 1.5 is before the previous happening at 2.0",
        "(a x) #0 started again before it ended",
        "Unexpected happening line: oops",
        "(a x) #0 started but never ended"), messages);
    // an untimed happening keeps the latest time seen
    assertEquals(2.0, info.getHappenings().get(3).getTime());
  }

  @Test
  void oversizedCounterIsReportedOnItsLine() {
    HappeningsInfo info = parse("""
        0.001: start (drive t1) #99999999999
        0.002: (refuel t1)
        """);
    assertEquals(1, info.getHappenings().size());
    assertEquals("refuel", info.getHappenings().get(0).getActionName());
    assertEquals(1, info.getParsingProblems().size());
    ParsingProblem problem = info.getParsingProblems().get(0);
    assertEquals(0, problem.getLine());
    assertEquals("Happening counter #99999999999 is out of range", problem.getMessage());
  }

  @Test
  void pluginAcceptsOnlyHappenings() {
    HappeningsPlugin plugin = new HappeningsPlugin();
    assertTrue(plugin.claim("file:///t.happenings", PddlLanguage.HAPPENINGS, () -> "") > 0);
    assertEquals(0.0, plugin.claim("file:///t.plan", PddlLanguage.PLAN, () -> ""));
    assertTrue(plugin.parse(request(PddlLanguage.HAPPENINGS, "0: (a)")).orElseThrow().isHappenings());
  }
}
