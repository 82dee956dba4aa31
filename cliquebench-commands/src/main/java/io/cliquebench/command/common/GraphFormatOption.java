package io.cliquebench.command.common;

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

import io.cliquebench.api.services.GraphFormat;
import picocli.CommandLine;

/**
 * Shared output format option. Accepts the names known to {@link GraphFormat#fromName(String)}.
 */
public class GraphFormatOption {

    /**
     * Picocli type converter for {@link GraphFormat} names and aliases.
     */
    public static class GraphFormatConverter implements CommandLine.ITypeConverter<GraphFormat> {
        @Override
        public GraphFormat convert(String value) {
            try {
                return GraphFormat.fromName(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(
                    e.getMessage() + " (expected snap or dimacs)");
            }
        }
    }

    @CommandLine.Option(
        names = {"--format"},
        description = "Output graph format: snap or dimacs (default: ${DEFAULT-VALUE})",
        defaultValue = "snap",
        converter = GraphFormatConverter.class
    )
    private GraphFormat format = GraphFormat.snap;

    public GraphFormat getFormat() {
        return format;
    }

    @Override
    public String toString() {
        return format.name();
    }
}
