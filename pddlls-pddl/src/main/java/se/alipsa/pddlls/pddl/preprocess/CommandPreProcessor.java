package se.alipsa.pddlls.pddl.preprocess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/** Pipes the problem text through an external command: text on stdin, transformed text on stdout. */
public final class CommandPreProcessor implements PreProcessor {
  private static final Logger logger = LoggerFactory.getLogger(CommandPreProcessor.class);

  private final List<String> commandLine;
  private final int metaDataLine;

  public CommandPreProcessor(List<String> commandLine, int metaDataLine) {
    if (commandLine.isEmpty()) throw new IllegalArgumentException("Empty command line");
    this.commandLine = List.copyOf(commandLine);
    this.metaDataLine = metaDataLine;
  }

  @Override
  public String getLabel() {
    return String.join(" ", commandLine);
  }

  @Override
  public int getMetaDataLine() {
    return metaDataLine;
  }

  public List<String> getCommandLine() {
    return commandLine;
  }

  @Override
  public String transform(String input, Path workingDirectory, Duration timeout) throws PreProcessingException {
    ProcessBuilder pb = new ProcessBuilder(commandLine);
    if (workingDirectory != null) pb.directory(workingDirectory.toFile());
    logger.debug("Pre-processing with '{}' in {}", getLabel(), workingDirectory);

    Process p;
    try {
      p = pb.start();
    } catch (IOException e) {
      throw new PreProcessingException("Cannot start pre-processor '" + getLabel() + "': " + e.getMessage(),
          metaDataLine, 0, e);
    }

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ByteArrayOutputStream err = new ByteArrayOutputStream();
    Thread outReader = new Thread(() -> drain(p.getInputStream(), out), "pddlls-preprocess-out");
    Thread errReader = new Thread(() -> drain(p.getErrorStream(), err), "pddlls-preprocess-err");
    outReader.start();
    errReader.start();

    try {
      try (OutputStream stdin = p.getOutputStream()) {
        stdin.write(input.getBytes(StandardCharsets.UTF_8));
      } catch (IOException e) {
        // the command may exit without reading its input; its exit code tells the rest
        logger.debug("Pre-processor '{}' closed its input early", getLabel(), e);
      }
      boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!finished) {
        p.destroyForcibly();
        throw new PreProcessingException("Pre-processor '" + getLabel() + "' timed out after "
            + timeout.toMillis() + " ms", metaDataLine, 0);
      }
      outReader.join(3000);
      errReader.join(3000);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      p.destroyForcibly();
      throw new PreProcessingException("Pre-processing was interrupted", metaDataLine, 0, e);
    }

    int exit = p.exitValue();
    if (exit != 0) {
      String stderr = err.toString(StandardCharsets.UTF_8).trim();
      throw new PreProcessingException("Pre-processor '" + getLabel() + "' failed with exit code " + exit
          + (stderr.isEmpty() ? "" : ": " + stderr), metaDataLine, 0);
    }
    return out.toString(StandardCharsets.UTF_8);
  }

  private static void drain(InputStream in, ByteArrayOutputStream out) {
    try (in) {
      in.transferTo(out);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
