package io.cliquebench.command.generate;

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

import io.cliquebench.api.services.BundledCommand;
import io.cliquebench.api.services.Selector;
import io.cliquebench.command.generate.subcommands.CMD_generate_reduce;
import io.cliquebench.command.generate.subcommands.CMD_generate_rmat;
import io.cliquebench.command.generate.subcommands.CMD_generate_sat3;
import io.cliquebench.command.generate.subcommands.CMD_generate_suite;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Generate benchmark graphs for maximum-clique solvers
///
/// - `rmat`: recursive-matrix random graphs with tunable skew
/// - `sat3`: literal-conflict graphs of hash-derived 3-SAT formulas
/// - `reduce`: the SAT-to-clique reduction of a CNF file or a generated SAT family
/// - `suite`: the standard synthetic benchmark set, written into a directory
///
/// Every generator takes an explicit seed; the same seed reproduces the same graph.
@Selector("generate")
@CommandLine.Command(name = "generate",
    headerHeading = "Usage:%n%n",
    synopsisHeading = "%n",
    descriptionHeading = "%nDescription%n%n",
    parameterListHeading = "%nParameters:%n%",
    optionListHeading = "%nOptions:%n",
    header = "Generate benchmark graphs for maximum-clique solvers",
    description = "Procedural generators for clique benchmark instances. R-MAT graphs (rmat),\n" +
        "hashed 3-SAT conflict graphs (sat3), SAT-to-clique reductions of CNF formulas\n" +
        "(reduce), and the standard synthetic suite (suite).",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: warning", "2: error"},
    subcommands = {CMD_generate_rmat.class, CMD_generate_sat3.class, CMD_generate_reduce.class,
        CMD_generate_suite.class, CommandLine.HelpCommand.class})
public class CMD_generate implements Callable<Integer>, BundledCommand {

  public CMD_generate() {
  }

  @CommandLine.Spec
  private CommandLine.Model.CommandSpec spec;

  @Override
  public Integer call() {
    spec.commandLine().usage(System.out);
    return 0;
  }
}
