package se.alipsa.pddlls.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Workspace and plugin settings. {@link #load()} starts from {@code pddlls.properties} on the class
 * path and lets system properties with the same keys override individual values.
 */
public final class WorkspaceOptions {
  private static final Logger logger = LoggerFactory.getLogger(WorkspaceOptions.class);

  public static final String RESOURCE = "/pddlls.properties";
  public static final String PARSING_DELAY_MS = "pddlls.parsing.delay.ms";
  public static final String PLAN_EPSILON = "pddlls.plan.epsilon";
  public static final String EXCLUDED_SCHEMES = "pddlls.excluded.schemes";
  public static final String PREPROCESSING_ENABLED = "pddlls.preprocessing.enabled";
  public static final String PREPROCESSING_TIMEOUT_MS = "pddlls.preprocessing.timeout.ms";

  private final Duration parsingDelay;
  private final double planEpsilon;
  private final Set<String> excludedSchemes;
  private final boolean preprocessingEnabled;
  private final Duration preprocessingTimeout;

  private WorkspaceOptions(Builder b) {
    this.parsingDelay = b.parsingDelay;
    this.planEpsilon = b.planEpsilon;
    this.excludedSchemes = Set.copyOf(b.excludedSchemes);
    this.preprocessingEnabled = b.preprocessingEnabled;
    this.preprocessingTimeout = b.preprocessingTimeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Built-in defaults, ignoring the class path and system properties. */
  public static WorkspaceOptions defaults() {
    return builder().build();
  }

  public static WorkspaceOptions load() {
    Properties props = new Properties();
    try (InputStream in = WorkspaceOptions.class.getResourceAsStream(RESOURCE)) {
      if (in != null) props.load(in);
    } catch (IOException e) {
      logger.warn("Could not read {}, using built-in defaults", RESOURCE, e);
    }
    for (String key : new String[]{PARSING_DELAY_MS, PLAN_EPSILON, EXCLUDED_SCHEMES,
        PREPROCESSING_ENABLED, PREPROCESSING_TIMEOUT_MS}) {
      String override = System.getProperty(key);
      if (override != null && !override.isBlank()) props.setProperty(key, override);
    }
    return fromProperties(props);
  }

  /** Missing keys keep their defaults; malformed values are rejected. */
  public static WorkspaceOptions fromProperties(Properties props) {
    Builder b = builder();
    String delay = props.getProperty(PARSING_DELAY_MS);
    if (delay != null) b.parsingDelay(Duration.ofMillis(parseLong(PARSING_DELAY_MS, delay)));
    String epsilon = props.getProperty(PLAN_EPSILON);
    if (epsilon != null) {
      try {
        b.planEpsilon(Double.parseDouble(epsilon.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(PLAN_EPSILON + " is not a number: " + epsilon, e);
      }
    }
    String schemes = props.getProperty(EXCLUDED_SCHEMES);
    if (schemes != null) {
      b.excludedSchemes(Arrays.stream(schemes.split(","))
          .map(String::trim)
          .filter(s -> !s.isEmpty())
          .collect(Collectors.toCollection(LinkedHashSet::new)));
    }
    String enabled = props.getProperty(PREPROCESSING_ENABLED);
    if (enabled != null) b.preprocessingEnabled(Boolean.parseBoolean(enabled.trim()));
    String timeout = props.getProperty(PREPROCESSING_TIMEOUT_MS);
    if (timeout != null) b.preprocessingTimeout(Duration.ofMillis(parseLong(PREPROCESSING_TIMEOUT_MS, timeout)));
    return b.build();
  }

  private static long parseLong(String key, String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " is not a whole number: " + value, e);
    }
  }

  /** Quiet period before a batch re-parse of dirty files. */
  public Duration getParsingDelay() { return parsingDelay; }

  /** Gap between consecutive untimed plan steps. */
  public double getPlanEpsilon() { return planEpsilon; }

  public Set<String> getExcludedSchemes() { return excludedSchemes; }

  public boolean isExcluded(String uri) {
    return excludedSchemes.contains(UriUtil.scheme(uri));
  }

  public boolean isPreprocessingEnabled() { return preprocessingEnabled; }

  public Duration getPreprocessingTimeout() { return preprocessingTimeout; }

  @Override
  public String toString() {
    return "WorkspaceOptions{parsingDelay=" + parsingDelay + ", planEpsilon=" + planEpsilon
        + ", excludedSchemes=" + excludedSchemes + ", preprocessingEnabled=" + preprocessingEnabled
        + ", preprocessingTimeout=" + preprocessingTimeout + '}';
  }

  public static final class Builder {
    private Duration parsingDelay = Duration.ofSeconds(1);
    private double planEpsilon = 1e-3;
    private Set<String> excludedSchemes = Set.of("git");
    private boolean preprocessingEnabled;
    private Duration preprocessingTimeout = Duration.ofSeconds(10);

    private Builder() {}

    public Builder parsingDelay(Duration delay) {
      Objects.requireNonNull(delay, "delay");
      if (delay.isNegative()) throw new IllegalArgumentException("Parsing delay cannot be negative: " + delay);
      this.parsingDelay = delay;
      return this;
    }

    public Builder planEpsilon(double epsilon) {
      if (!(epsilon > 0)) throw new IllegalArgumentException("Plan epsilon must be positive: " + epsilon);
      this.planEpsilon = epsilon;
      return this;
    }

    public Builder excludedSchemes(Set<String> schemes) {
      this.excludedSchemes = schemes.stream()
          .map(s -> s.toLowerCase(Locale.ROOT))
          .collect(Collectors.toCollection(LinkedHashSet::new));
      return this;
    }

    public Builder preprocessingEnabled(boolean enabled) {
      this.preprocessingEnabled = enabled;
      return this;
    }

    public Builder preprocessingTimeout(Duration timeout) {
      Objects.requireNonNull(timeout, "timeout");
      if (timeout.isNegative() || timeout.isZero()) {
        throw new IllegalArgumentException("Pre-processing timeout must be positive: " + timeout);
      }
      this.preprocessingTimeout = timeout;
      return this;
    }

    public WorkspaceOptions build() {
      return new WorkspaceOptions(this);
    }
  }
}
