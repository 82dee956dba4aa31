package io.cliquebench.command.convert;

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
import io.cliquebench.command.convert.subcommands.CMD_convert_dir;
import io.cliquebench.command.convert.subcommands.CMD_convert_file;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 # Graph Format Conversion Tool

 Converts edge-list graph files between the SNAP and DIMACS text formats.

 ## Subcommands
 - `file`: Convert one file, in either direction
 - `dir`: Convert every SNAP `*.txt` file of a directory to DIMACS in place

 # Basic Usage
 ```
 convert file --input facebook.txt --output facebook.clq --to dimacs
 convert dir datasets/real_world datasets/synthetic
 ```
 */
@Selector("convert")
@CommandLine.Command(name = "convert",
    header = "Convert graphs between SNAP and DIMACS formats",
    description = "This provides utilities for converting edge-list graphs between formats.\n" +
        "DIMACS output is always 1-based; 0-based SNAP ids are shifted by one.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0: success", "1: warning", "2: error"},
    subcommands = {
        CMD_convert_file.class,
        CMD_convert_dir.class,
        CommandLine.HelpCommand.class
    })
public class CMD_convert implements Callable<Integer>, BundledCommand {

    public CMD_convert() {
    }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(System.out);
        return 0;
    }
}
