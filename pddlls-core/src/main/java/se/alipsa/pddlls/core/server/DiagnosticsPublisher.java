package se.alipsa.pddlls.core.server;

import se.alipsa.pddlls.core.model.ParsingProblem;

import java.util.List;

/** Sink for parsing problems (e.g., log, UI, test capture). An empty list clears a file. */
@FunctionalInterface
public interface DiagnosticsPublisher {
  void publish(String uri, List<ParsingProblem> problems);

  DiagnosticsPublisher NO_OP = (uri, problems) -> {};
}
