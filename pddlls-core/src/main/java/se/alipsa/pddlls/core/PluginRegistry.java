package se.alipsa.pddlls.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.pddlls.core.model.PddlLanguage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

public final class PluginRegistry {
  private static final Logger logger = LoggerFactory.getLogger(PluginRegistry.class);

  private final Map<String, PddlFilePlugin> byId = new ConcurrentHashMap<>();
  private final List<PddlFilePlugin> all = Collections.synchronizedList(new ArrayList<>());
  private final PluginEnvironment env;

  private PluginRegistry(PluginEnvironment env) {
    this.env = Objects.requireNonNull(env);
  }

  /** A registry populated from {@link ServiceLoader} (class path or module path). */
  public static PluginRegistry discover(PluginEnvironment env) {
    PluginRegistry registry = new PluginRegistry(env);
    ServiceLoader<PddlFilePlugin> sl = ServiceLoader.load(PddlFilePlugin.class);
    for (PddlFilePlugin p : sl) registry.register(p);
    return registry;
  }

  /** A registry holding only the given plugins. */
  public static PluginRegistry of(PluginEnvironment env, PddlFilePlugin... plugins) {
    PluginRegistry registry = new PluginRegistry(env);
    for (PddlFilePlugin p : plugins) registry.register(p);
    return registry;
  }

  public void register(PddlFilePlugin plugin) {
    Objects.requireNonNull(plugin);
    if (byId.putIfAbsent(plugin.id(), plugin) != null) {
      logger.warn("Plugin with id={} already registered; ignoring duplicate.", plugin.id());
      return;
    }
    plugin.configure(env);
    all.add(plugin);
    logger.info("Registered plugin {} ({})", plugin.displayName(), plugin.id());
  }

  public Optional<PddlFilePlugin> byId(String id) { return Optional.ofNullable(byId.get(id)); }

  /**
   * Plugins that claim the file, best claim first. Plugins with equal claims keep their registration
   * order.
   */
  public List<PddlFilePlugin> candidates(String fileUri, PddlLanguage language, Supplier<CharSequence> preview) {
    Map<PddlFilePlugin, Double> scores = new IdentityHashMap<>();
    List<PddlFilePlugin> out = new ArrayList<>();
    synchronized (all) {
      for (PddlFilePlugin p : all) {
        double score = p.claim(fileUri, language, preview);
        if (score > 0.0) {
          scores.put(p, score);
          out.add(p);
        }
      }
    }
    out.sort(Comparator.comparingDouble((PddlFilePlugin p) -> scores.get(p)).reversed());
    return out;
  }

  public PluginEnvironment environment() { return env; }

  public List<PddlFilePlugin> all() { synchronized (all) { return List.copyOf(all); } }
}
