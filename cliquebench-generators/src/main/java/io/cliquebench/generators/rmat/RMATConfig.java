package io.cliquebench.generators.rmat;

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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.SerializedName;
import io.cliquebench.api.errors.GraphConfigurationException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON-serializable configuration for an R-MAT run.
 *
 * <h2>JSON Schema</h2>
 *
 * <p>With explicit probabilities:
 * <pre>{@code
 * {
 *   "vertex_count": 200,
 *   "edge_count": 2500,
 *   "a": 0.45, "b": 0.15, "c": 0.15, "d": 0.25,
 *   "seed": 44
 * }
 * }</pre>
 *
 * <p>With a preset (see {@link RMATPreset#fromName(String)}):
 * <pre>{@code
 * {
 *   "vertex_count": 500,
 *   "edge_count": 8000,
 *   "preset": "erdos-renyi"
 * }
 * }</pre>
 *
 * <p>{@code seed} is optional. {@code preset} and the probabilities are mutually exclusive.
 */
public class RMATConfig {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    @SerializedName("vertex_count")
    private Integer vertexCount;

    @SerializedName("edge_count")
    private Integer edgeCount;

    @SerializedName("preset")
    private String preset;

    @SerializedName("a")
    private Double a;

    @SerializedName("b")
    private Double b;

    @SerializedName("c")
    private Double c;

    @SerializedName("d")
    private Double d;

    @SerializedName("seed")
    private Long seed;

    public RMATConfig() {
    }

    public Integer getVertexCount() {
        return vertexCount;
    }

    public void setVertexCount(Integer vertexCount) {
        this.vertexCount = vertexCount;
    }

    public Integer getEdgeCount() {
        return edgeCount;
    }

    public void setEdgeCount(Integer edgeCount) {
        this.edgeCount = edgeCount;
    }

    public String getPreset() {
        return preset;
    }

    public void setPreset(String preset) {
        this.preset = preset;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public void setProbabilities(double a, double b, double c, double d) {
        this.a = a;
        this.b = b;
        this.c = c;
        this.d = d;
    }

    private boolean hasAnyProbability() {
        return a != null || b != null || c != null || d != null;
    }

    /**
     * Converts this configuration to validated parameters.
     *
     * @return the parameters
     * @throws GraphConfigurationException if fields are missing, conflicting or invalid
     */
    public RMATParams toParams() {
        if (vertexCount == null || edgeCount == null) {
            throw new GraphConfigurationException("vertex_count and edge_count are required");
        }
        if (preset != null) {
            if (hasAnyProbability()) {
                throw new GraphConfigurationException("specify either preset or a, b, c, d, not both");
            }
            RMATPreset named;
            try {
                named = RMATPreset.fromName(preset);
            } catch (IllegalArgumentException e) {
                throw new GraphConfigurationException(e.getMessage(), e);
            }
            return RMATParams.of(named, vertexCount, edgeCount, seed);
        }
        if (a == null || b == null || c == null || d == null) {
            throw new GraphConfigurationException("a, b, c and d are all required without a preset");
        }
        return new RMATParams(a, b, c, d, vertexCount, edgeCount, seed);
    }

    /**
     * Creates a configuration carrying explicit probabilities from parameters.
     *
     * @param params the source parameters
     * @return the corresponding configuration
     */
    public static RMATConfig fromParams(RMATParams params) {
        RMATConfig config = new RMATConfig();
        config.setVertexCount(params.vertexCount());
        config.setEdgeCount(params.edgeCount());
        config.setProbabilities(params.a(), params.b(), params.c(), params.d());
        config.setSeed(params.seed());
        return config;
    }

    public static RMATConfig fromJson(String json) {
        return GSON.fromJson(json, RMATConfig.class);
    }

    public static RMATConfig fromJson(Reader reader) {
        return GSON.fromJson(reader, RMATConfig.class);
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public void toJson(Writer writer) {
        GSON.toJson(this, writer);
    }

    /**
     * Loads and validates parameters from a JSON file.
     *
     * @param path the path to the JSON file
     * @return the parameters
     * @throws IOException if the file cannot be read
     * @throws GraphConfigurationException if the file is empty or its content is invalid
     */
    public static RMATParams loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            RMATConfig config = fromJson(reader);
            if (config == null) {
                throw new GraphConfigurationException("empty R-MAT configuration: " + path);
            }
            return config.toParams();
        }
    }

    /**
     * Saves parameters to a JSON file.
     *
     * @param params the parameters to save
     * @param path the target file path
     * @throws IOException if the file cannot be written
     */
    public static void saveToFile(RMATParams params, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            fromParams(params).toJson(writer);
        }
    }

    @Override
    public String toString() {
        return toJson();
    }
}
