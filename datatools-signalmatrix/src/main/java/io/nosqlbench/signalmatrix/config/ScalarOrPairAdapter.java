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

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/// Reads either a bare number or an array of one or two numbers as `double[]`.
///
/// ```
/// "extend": 5000          ──► [5000]
/// "extend": [3000, 2000]  ──► [3000, 2000]
/// ```
///
/// Single-element arrays are written back as bare numbers.
final class ScalarOrPairAdapter extends TypeAdapter<double[]> {

    @Override
    public void write(JsonWriter out, double[] value) throws IOException {
        if (value == null) {
            out.nullValue();
            return;
        }
        if (value.length == 1) {
            out.value(value[0]);
            return;
        }
        out.beginArray();
        for (double v : value) {
            out.value(v);
        }
        out.endArray();
    }

    @Override
    public double[] read(JsonReader in) throws IOException {
        JsonToken token = in.peek();
        if (token == JsonToken.NULL) {
            in.nextNull();
            return null;
        }
        if (token == JsonToken.NUMBER) {
            return new double[]{in.nextDouble()};
        }
        if (token != JsonToken.BEGIN_ARRAY) {
            throw new JsonParseException("expected a number or an array of numbers at " + in.getPath());
        }
        List<Double> values = new ArrayList<>(2);
        in.beginArray();
        while (in.hasNext()) {
            values.add(in.nextDouble());
        }
        in.endArray();
        if (values.isEmpty() || values.size() > 2) {
            throw new JsonParseException("expected one or two numbers, got " + values.size() + " at " + in.getPath());
        }
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i);
        }
        return out;
    }
}
