package io.nosqlbench.signalmatrix.config;

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
import com.google.gson.JsonParseException;
import com.google.gson.annotations.JsonAdapter;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.signalmatrix.MatrixConfigurationException;
import io.nosqlbench.signalmatrix.model.MeanMode;
import io.nosqlbench.signalmatrix.process.TrimSpec;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON-serializable form of {@link NormalizeOptions}.
 *
 * <h2>JSON Schema</h2>
 *
 * <p>Every key is optional; absent keys take the same defaults as the builder.
 * <pre>{@code
 * {
 *   "extend": [3000, 2000],     // or a single number for both sides
 *   "w": 50,                    // bp, or a fraction in (0, 1)
 *   "value_column": "score",
 *   "mapping_column": "gene",
 *   "empty_value": 0.0,
 *   "mean_mode": "weighted",    // absolute | weighted | w0 | coverage
 *   "include_target": true,
 *   "target_ratio": 0.1,
 *   "k": 20,
 *   "smooth": false,
 *   "trim": [0.01, 0.01],       // or a single number for both tails
 *   "parallel": false,
 *   "signal_name": "H3K4me3",
 *   "target_name": "TSS"
 * }
 * }</pre>
 *
 * <p>The row smoother is code and has no JSON form; options built from a config
 * use the default smoother.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * NormalizeOptions options = NormalizeOptionsConfig.loadFromFile(Path.of("matrix.json"));
 *
 * NormalizeOptionsConfig config = NormalizeOptionsConfig.fromOptions(options);
 * String json = config.toJson();
 * }</pre>
 *
 * @see NormalizeOptions
 */
public class NormalizeOptionsConfig {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .create();

    /** Upstream and downstream extension, or one value for both */
    @SerializedName("extend")
    @JsonAdapter(ScalarOrPairAdapter.class)
    private double[] extend;

    @SerializedName("w")
    private Double w;

    @SerializedName("value_column")
    private String valueColumn;

    @SerializedName("mapping_column")
    private String mappingColumn;

    @SerializedName("empty_value")
    private Double emptyValue;

    @SerializedName("mean_mode")
    private String meanMode;

    @SerializedName("include_target")
    private Boolean includeTarget;

    @SerializedName("target_ratio")
    private Double targetRatio;

    @SerializedName("k")
    private Integer k;

    @SerializedName("smooth")
    private Boolean smooth;

    /** Lower and upper trim fractions, or one value for both */
    @SerializedName("trim")
    @JsonAdapter(ScalarOrPairAdapter.class)
    private double[] trim;

    @SerializedName("parallel")
    private Boolean parallel;

    @SerializedName("signal_name")
    private String signalName;

    @SerializedName("target_name")
    private String targetName;

    public NormalizeOptionsConfig() {
    }

    public double[] getExtend() {
        return extend;
    }

    public void setExtend(double[] extend) {
        this.extend = extend;
    }

    public Double getW() {
        return w;
    }

    public void setW(Double w) {
        this.w = w;
    }

    public String getValueColumn() {
        return valueColumn;
    }

    public void setValueColumn(String valueColumn) {
        this.valueColumn = valueColumn;
    }

    public String getMappingColumn() {
        return mappingColumn;
    }

    public void setMappingColumn(String mappingColumn) {
        this.mappingColumn = mappingColumn;
    }

    public Double getEmptyValue() {
        return emptyValue;
    }

    public void setEmptyValue(Double emptyValue) {
        this.emptyValue = emptyValue;
    }

    public String getMeanMode() {
        return meanMode;
    }

    public void setMeanMode(String meanMode) {
        this.meanMode = meanMode;
    }

    public Boolean getIncludeTarget() {
        return includeTarget;
    }

    public void setIncludeTarget(Boolean includeTarget) {
        this.includeTarget = includeTarget;
    }

    public Double getTargetRatio() {
        return targetRatio;
    }

    public void setTargetRatio(Double targetRatio) {
        this.targetRatio = targetRatio;
    }

    public Integer getK() {
        return k;
    }

    public void setK(Integer k) {
        this.k = k;
    }

    public Boolean getSmooth() {
        return smooth;
    }

    public void setSmooth(Boolean smooth) {
        this.smooth = smooth;
    }

    public double[] getTrim() {
        return trim;
    }

    public void setTrim(double[] trim) {
        this.trim = trim;
    }

    public Boolean getParallel() {
        return parallel;
    }

    public void setParallel(Boolean parallel) {
        this.parallel = parallel;
    }

    public String getSignalName() {
        return signalName;
    }

    public void setSignalName(String signalName) {
        this.signalName = signalName;
    }

    public String getTargetName() {
        return targetName;
    }

    public void setTargetName(String targetName) {
        this.targetName = targetName;
    }

    /**
     * Converts this configuration to {@link NormalizeOptions}.
     *
     * @return the corresponding options
     * @throws MatrixConfigurationException if a value is out of range or not integral where bases are expected
     */
    public NormalizeOptions toOptions() {
        NormalizeOptions.Builder builder = NormalizeOptions.builder();
        if (extend != null) {
            long up = toBases(extend[0]);
            long down = extend.length > 1 ? toBases(extend[1]) : up;
            builder.extend(up, down);
        }
        builder.windowWidth(w)
            .valueColumn(valueColumn)
            .mappingColumn(mappingColumn)
            .emptyValue(emptyValue)
            .includeTarget(includeTarget)
            .targetRatio(targetRatio)
            .k(k)
            .signalName(signalName)
            .targetName(targetName);
        if (meanMode != null) {
            try {
                builder.meanMode(MeanMode.fromName(meanMode));
            } catch (IllegalArgumentException e) {
                throw new MatrixConfigurationException(e.getMessage(), e);
            }
        }
        if (smooth != null) {
            builder.smooth(smooth);
        }
        if (trim != null) {
            builder.trim(trim.length > 1 ? TrimSpec.of(trim[0], trim[1]) : TrimSpec.of(trim[0]));
        }
        if (parallel != null) {
            builder.parallel(parallel);
        }
        return builder.build();
    }

    private static long toBases(double v) {
        if (!Double.isFinite(v) || v != Math.rint(v)) {
            throw new MatrixConfigurationException("`extend` must be a whole number of bases, got: " + v);
        }
        return (long) v;
    }

    /**
     * Creates a configuration from options. The smoother is not carried over.
     *
     * @param options the source options
     * @return the corresponding configuration
     */
    public static NormalizeOptionsConfig fromOptions(NormalizeOptions options) {
        NormalizeOptionsConfig config = new NormalizeOptionsConfig();
        if (options.upstreamExtend() == options.downstreamExtend()) {
            config.setExtend(new double[]{options.upstreamExtend()});
        } else {
            config.setExtend(new double[]{options.upstreamExtend(), options.downstreamExtend()});
        }
        config.setW(options.windowWidth());
        config.setValueColumn(options.valueColumn());
        config.setMappingColumn(options.mappingColumn());
        config.setEmptyValue(options.emptyValue());
        config.setMeanMode(options.meanMode().configName());
        config.setIncludeTarget(options.includeTarget());
        config.setTargetRatio(options.targetRatio());
        config.setK(options.k());
        config.setSmooth(options.smooth());
        TrimSpec t = options.trim();
        config.setTrim(t.low() == t.high() ? new double[]{t.low()} : new double[]{t.low(), t.high()});
        config.setParallel(options.parallel());
        config.setSignalName(options.signalName());
        config.setTargetName(options.targetName());
        return config;
    }

    /**
     * Loads a NormalizeOptionsConfig from JSON.
     *
     * @param json the JSON string
     * @return the parsed configuration
     * @throws MatrixConfigurationException if the JSON is malformed
     */
    public static NormalizeOptionsConfig fromJson(String json) {
        try {
            NormalizeOptionsConfig config = GSON.fromJson(json, NormalizeOptionsConfig.class);
            return config == null ? new NormalizeOptionsConfig() : config;
        } catch (JsonParseException e) {
            throw new MatrixConfigurationException("invalid options JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Loads a NormalizeOptionsConfig from a Reader.
     *
     * @param reader the reader providing JSON
     * @return the parsed configuration
     * @throws MatrixConfigurationException if the JSON is malformed
     */
    public static NormalizeOptionsConfig fromJson(Reader reader) {
        try {
            NormalizeOptionsConfig config = GSON.fromJson(reader, NormalizeOptionsConfig.class);
            return config == null ? new NormalizeOptionsConfig() : config;
        } catch (JsonParseException e) {
            throw new MatrixConfigurationException("invalid options JSON: " + e.getMessage(), e);
        }
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public void toJson(Writer writer) {
        GSON.toJson(this, writer);
    }

    /**
     * Loads options directly from a JSON file.
     *
     * @param path the path to the JSON file
     * @return the loaded options
     * @throws IOException if the file cannot be read
     */
    public static NormalizeOptions loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader).toOptions();
        }
    }

    /**
     * Saves options to a JSON file.
     *
     * @param options the options to save
     * @param path the target path
     * @throws IOException if the file cannot be written
     */
    public static void saveToFile(NormalizeOptions options, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            fromOptions(options).toJson(writer);
        }
    }
}
