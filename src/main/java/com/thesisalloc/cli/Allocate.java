// Copyright 2010-2021 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.thesisalloc.cli;

import com.thesisalloc.config.AllocationConfig;
import com.thesisalloc.config.AllocationConfigLoader;
import com.thesisalloc.config.InvalidConfigException;
import com.thesisalloc.io.AllocationCsvWriter;
import com.thesisalloc.io.DataFormatException;
import com.thesisalloc.io.DataRepository;
import com.thesisalloc.io.SummaryWriter;
import com.thesisalloc.model.AllocationInput;
import com.thesisalloc.solver.AllocationEngine;
import com.thesisalloc.solver.AllocationResult;
import com.thesisalloc.validation.InputValidator;
import com.thesisalloc.validation.ValidationReport;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line entry point.
 *
 * <pre>
 * Allocate --students students.csv --capacities capacities.csv [--overrides overrides.csv]
 *          --out allocation.csv --summary summary.txt
 *          [--config allocation.properties] [--set key=value]... [--log-level LEVEL]
 *          [--validate-only] [--no-validate] [--save-config file]
 * </pre>
 */
public final class Allocate {
  private static final Logger logger = Logger.getLogger(Allocate.class.getName());

  /** Parsed command line. */
  static final class Options {
    Path students;
    Path capacities;
    Path overrides;
    Path out;
    Path summary;
    Path config;
    Path saveConfig;
    String logLevel;
    boolean validateOnly;
    boolean noValidate;
    final Properties settings = new Properties();
  }

  private Allocate() {}

  public static void main(String[] args) {
    System.exit(run(args));
  }

  /** Runs the allocator and returns the process exit code: 0 on success, 1 on any error. */
  static int run(String[] args) {
    configureLogging();
    Options options;
    try {
      options = parse(args);
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      System.err.println(usage());
      return 1;
    }
    if (options.logLevel != null) {
      try {
        setLogLevel(parseLevel(options.logLevel));
      } catch (IllegalArgumentException e) {
        System.err.println("Error: " + e.getMessage());
        return 1;
      }
    }

    try {
      AllocationConfig config =
          options.config != null
              ? AllocationConfigLoader.load(options.config)
              : AllocationConfig.defaults();
      config = AllocationConfigLoader.apply(config, options.settings);
      logger.info("Configuration: " + config);

      if (options.saveConfig != null) {
        try (OutputStream out = Files.newOutputStream(options.saveConfig)) {
          AllocationConfigLoader.save(config, out);
        }
        logger.info("Configuration saved to " + options.saveConfig);
        return 0;
      }

      List<String> missing = new ArrayList<>();
      if (options.students == null) {
        missing.add("--students");
      }
      if (options.capacities == null) {
        missing.add("--capacities");
      }
      if (!options.validateOnly) {
        if (options.out == null) {
          missing.add("--out");
        }
        if (options.summary == null) {
          missing.add("--summary");
        }
      }
      if (!missing.isEmpty()) {
        logger.severe("Missing required arguments: " + String.join(", ", missing));
        return 1;
      }

      AllocationInput input =
          new DataRepository(options.students, options.capacities, options.overrides).load();

      if (!options.noValidate) {
        ValidationReport report = new InputValidator().validate(input);
        if (!report.isValid()) {
          logger.severe("Input validation failed: " + report.getSummary());
          return 1;
        }
      }
      if (options.validateOnly) {
        logger.info("Validation successful");
        return 0;
      }

      AllocationResult result = new AllocationEngine(input, config).run();
      AllocationCsvWriter.write(options.out, result.getRows());
      SummaryWriter.write(options.summary, result, input);
      logger.info("Wrote " + options.out + " and " + options.summary);
      return 0;
    } catch (InvalidConfigException | DataFormatException e) {
      logger.severe(e.getMessage());
      return 1;
    } catch (IOException e) {
      logger.log(Level.SEVERE, "I/O error", e);
      return 1;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Allocation failed", e);
      return 1;
    }
  }

  static Options parse(String[] args) {
    Options options = new Options();
    for (int i = 0; i < args.length; ++i) {
      String arg = args[i];
      switch (arg) {
        case "--validate-only":
          options.validateOnly = true;
          continue;
        case "--no-validate":
          options.noValidate = true;
          continue;
        default:
          break;
      }
      if (i + 1 >= args.length) {
        throw new IllegalArgumentException("Missing value for " + arg);
      }
      String value = args[++i];
      switch (arg) {
        case "--students":
          options.students = Paths.get(value);
          break;
        case "--capacities":
          options.capacities = Paths.get(value);
          break;
        case "--overrides":
          options.overrides = Paths.get(value);
          break;
        case "--out":
          options.out = Paths.get(value);
          break;
        case "--summary":
          options.summary = Paths.get(value);
          break;
        case "--config":
          options.config = Paths.get(value);
          break;
        case "--save-config":
          options.saveConfig = Paths.get(value);
          break;
        case "--log-level":
          options.logLevel = value;
          break;
        case "--set":
          int eq = value.indexOf('=');
          if (eq <= 0) {
            throw new IllegalArgumentException("--set expects key=value, got " + value);
          }
          options.settings.setProperty(value.substring(0, eq).trim(), value.substring(eq + 1));
          break;
        default:
          throw new IllegalArgumentException("Unknown option " + arg);
      }
    }
    return options;
  }

  /** Accepts java.util.logging names as well as DEBUG, WARN/WARNING and ERROR. */
  static Level parseLevel(String name) {
    switch (name.toUpperCase(Locale.ROOT)) {
      case "DEBUG":
        return Level.FINE;
      case "WARN":
      case "WARNING":
        return Level.WARNING;
      case "ERROR":
        return Level.SEVERE;
      default:
        return Level.parse(name.toUpperCase(Locale.ROOT));
    }
  }

  private static void configureLogging() {
    try (InputStream in = Allocate.class.getResourceAsStream("/logging.properties")) {
      if (in != null) {
        LogManager.getLogManager().readConfiguration(in);
      }
    } catch (IOException e) {
      logger.log(Level.WARNING, "Could not read logging.properties", e);
    }
  }

  private static void setLogLevel(Level level) {
    Logger root = Logger.getLogger("");
    root.setLevel(level);
    for (Handler handler : root.getHandlers()) {
      handler.setLevel(level);
    }
  }

  private static String usage() {
    return "Usage: Allocate --students FILE --capacities FILE [--overrides FILE]"
        + " --out FILE --summary FILE [--config FILE] [--set key=value]..."
        + " [--log-level LEVEL] [--validate-only] [--no-validate] [--save-config FILE]";
  }
}
