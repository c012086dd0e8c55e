package se.alipsa.pddlls.pddl.preprocess;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The {@code ;;!pre-parsing:{json}} comment that asks for a problem file to be transformed before
 * parsing, e.g. {@code ;;!pre-parsing:{"type": "python", "command": "gen.py", "args": ["data.json"]}}.
 */
public final class PreProcessingDirective {

  private static final Pattern DIRECTIVE = Pattern.compile("^\\s*;;\\s*!pre-parsing\\s*:\\s*(\\{.*})\\s*$",
      Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final String type;
  private final String command;
  private final List<String> args;
  private final int line;

  private PreProcessingDirective(String type, String command, List<String> args, int line) {
    this.type = type;
    this.command = command;
    this.args = List.copyOf(args);
    this.line = line;
  }

  /**
   * Looks for the directive in the text.
   *
   * @throws PreProcessingException if a directive is present but its JSON is malformed
   */
  public static Optional<PreProcessingDirective> find(String text) throws PreProcessingException {
    Matcher m = DIRECTIVE.matcher(text);
    if (!m.find()) return Optional.empty();
    int line = lineOf(text, m.start(1));
    JsonNode json;
    try {
      json = MAPPER.readTree(m.group(1));
    } catch (JsonProcessingException e) {
      throw new PreProcessingException("Malformed pre-parsing directive: " + e.getOriginalMessage(), line,
          m.start(1) - lineStart(text, m.start(1)), e);
    }
    String type = text(json, "type").orElse("command").toLowerCase(Locale.ROOT);
    String command = text(json, "command")
        .orElseThrow(() -> new PreProcessingException("Pre-parsing directive has no \"command\"", line, 0));
    List<String> args = new ArrayList<>();
    JsonNode argsNode = json.get("args");
    if (argsNode != null && argsNode.isArray()) {
      argsNode.forEach(a -> args.add(a.asText()));
    }
    return Optional.of(new PreProcessingDirective(type, command, args, line));
  }

  public PreProcessor createPreProcessor() throws PreProcessingException {
    List<String> commandLine = new ArrayList<>();
    switch (type) {
      case "command":
        commandLine.add(command);
        break;
      case "python":
        commandLine.add("python");
        commandLine.add(command);
        break;
      default:
        throw new PreProcessingException("Unsupported pre-processor type: " + type, line, 0);
    }
    commandLine.addAll(args);
    return new CommandPreProcessor(commandLine, line);
  }

  public String getType() { return type; }

  public String getCommand() { return command; }

  public List<String> getArgs() { return args; }

  /** Zero-based line of the directive. */
  public int getLine() { return line; }

  private static Optional<String> text(JsonNode json, String field) {
    JsonNode n = json.get(field);
    return n == null || n.isNull() ? Optional.empty() : Optional.of(n.asText());
  }

  private static int lineOf(String text, int offset) {
    int line = 0;
    for (int i = 0; i < offset; i++) {
      if (text.charAt(i) == '\n') line++;
    }
    return line;
  }

  private static int lineStart(String text, int offset) {
    return text.lastIndexOf('\n', offset - 1) + 1;
  }
}
