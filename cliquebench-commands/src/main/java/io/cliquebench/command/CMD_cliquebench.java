package io.cliquebench.command;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Benchmark graph instances for maximum-clique solvers
///
/// This is the top level command. Its subcommands (`generate`, `convert`, `info`) are
/// registered as services and attached by [AddBundledCommands].
@CommandLine.Command(name = "cliquebench",
    mixinStandardHelpOptions = true,
    header = "Generate and convert benchmark graphs for maximum-clique solvers",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: warning", "2: error"},
    subcommands = {CommandLine.HelpCommand.class},
    modelTransformer = AddBundledCommands.class)
public class CMD_cliquebench implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(CMD_cliquebench.class);

  /// run a cliquebench command
  /// @param args
  ///     command line args
  public static void main(String[] args) {
    CMD_cliquebench command = new CMD_cliquebench();
    CommandLine commandLine = new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true)
        .setOptionsCaseInsensitive(true);
    int exitCode = commandLine.execute(args);
    logger.debug("Exiting main with code: {}", exitCode);
    System.exit(exitCode);
  }

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  @Override
  public Integer call() {
    spec.commandLine().usage(System.out);
    return 0;
  }
}
