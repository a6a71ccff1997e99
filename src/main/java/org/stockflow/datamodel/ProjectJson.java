/*
 * Copyright 2025 The Stockflow Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.stockflow.datamodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.FormatMethod;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Reads and writes {@link Datamodel.Project}s as JSON. A project looks like
 *
 * <pre>
 * {"name": "growth",
 *  "simSpec": {"start": 0, "stop": 10, "dt": 1},
 *  "models": [
 *    {"name": "main",
 *     "variables": [
 *       {"kind": "stock", "name": "population", "equation": "100", "inflows": ["births"]},
 *       {"kind": "flow", "name": "births", "equation": "population * birth_rate"},
 *       {"kind": "aux", "name": "birth rate", "equation": "0.1"}]}]}
 * </pre>
 *
 * <p>A simSpec may also have {@code dtIsReciprocal}, {@code saveStep}, {@code method} and {@code
 * timeUnits}; a model may have its own simSpec. A variable may have {@code units}, {@code
 * outflows}, a graphical function {@code gf} ({@code {"xPoints": [...], "yPoints": [...]}} or
 * {@code {"yPoints": [...], "xScale": {"min": 0, "max": 1}}}), and a module may have a {@code
 * modelName} and {@code connections} ({@code [{"from": "x", "to": "input"}, ...]}).
 */
public final class ProjectJson {

  private static final ObjectMapper MAPPER =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private ProjectJson() {}

  /**
   * Reads a project from a JSON file.
   *
   * @throws JsonProcessingException if the file isn't valid JSON or doesn't describe a project
   */
  public static Datamodel.Project read(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path)) {
      return fromJson(MAPPER.readTree(reader));
    }
  }

  /** Reads a project from a JSON string. */
  public static Datamodel.Project parse(String json) throws JsonProcessingException {
    return fromJson(MAPPER.readTree(json));
  }

  /** Returns the JSON representation of a project; {@link #parse} will return an equal project. */
  public static String toJson(Datamodel.Project project) {
    try {
      return MAPPER.writeValueAsString(toTree(project));
    } catch (JsonProcessingException e) {
      // Writing a tree we built ourselves can't fail.
      throw new AssertionError(e);
    }
  }

  private static Datamodel.Project fromJson(@Nullable JsonNode root)
      throws JsonMappingException {
    if (root == null || !root.isObject()) {
      throw invalid("expected a project object");
    }
    Datamodel.SimSpec simSpec =
        root.has("simSpec") ? simSpec(root.get("simSpec")) : Datamodel.SimSpec.DEFAULT;
    ImmutableList.Builder<Datamodel.Model> models = ImmutableList.builder();
    for (JsonNode model : array(root, "models")) {
      models.add(model(model));
    }
    return new Datamodel.Project(root.path("name").asText(""), simSpec, models.build());
  }

  private static Datamodel.SimSpec simSpec(JsonNode node) throws JsonMappingException {
    Datamodel.SimSpec.Builder builder = Datamodel.SimSpec.builder();
    if (node.has("start")) {
      builder.start(number(node, "start"));
    }
    if (node.has("stop")) {
      builder.stop(number(node, "stop"));
    }
    if (node.has("dt")) {
      builder.dt(number(node, "dt"));
    }
    if (node.has("saveStep")) {
      builder.saveStep(number(node, "saveStep"));
    }
    builder.dtIsReciprocal(node.path("dtIsReciprocal").asBoolean(false));
    builder.method(node.path("method").asText("euler").toLowerCase(Locale.ROOT));
    builder.timeUnits(text(node, "timeUnits"));
    try {
      return builder.build();
    } catch (IllegalArgumentException e) {
      throw invalid("invalid simSpec: %s", e.getMessage());
    }
  }

  private static Datamodel.Model model(JsonNode node) throws JsonMappingException {
    ImmutableList.Builder<Datamodel.Variable> variables = ImmutableList.builder();
    for (JsonNode v : array(node, "variables")) {
      variables.add(variable(v));
    }
    Datamodel.@Nullable SimSpec simSpec =
        node.has("simSpec") ? simSpec(node.get("simSpec")) : null;
    return new Datamodel.Model(node.path("name").asText(""), variables.build(), simSpec);
  }

  private static Datamodel.Variable variable(JsonNode node) throws JsonMappingException {
    String name = text(node, "name");
    if (name == null) {
      throw invalid("variable has no name: %s", node);
    }
    try {
      Datamodel.Variable.Builder builder =
          Datamodel.Variable.builder(Datamodel.Kind.parse(node.path("kind").asText("aux")), name)
              .equation(text(node, "equation"))
              .units(text(node, "units"))
              .inflows(strings(node, "inflows"))
              .outflows(strings(node, "outflows"))
              .modelName(text(node, "modelName"));
      if (node.has("gf")) {
        builder.gf(graphicalFunction(node.get("gf")));
      }
      ImmutableList.Builder<Datamodel.Connection> connections = ImmutableList.builder();
      for (JsonNode c : array(node, "connections")) {
        connections.add(new Datamodel.Connection(c.path("from").asText(), c.path("to").asText()));
      }
      return builder.connections(connections.build()).build();
    } catch (IllegalArgumentException e) {
      throw invalid("invalid variable %s: %s", name, e.getMessage());
    }
  }

  private static Datamodel.GraphicalFunction graphicalFunction(JsonNode node)
      throws JsonMappingException {
    @Nullable ImmutableList<Double> xPoints = node.has("xPoints") ? numbers(node, "xPoints") : null;
    Datamodel.@Nullable Scale xScale = null;
    if (node.has("xScale")) {
      JsonNode scale = node.get("xScale");
      xScale = new Datamodel.Scale(number(scale, "min"), number(scale, "max"));
    }
    return new Datamodel.GraphicalFunction(xPoints, numbers(node, "yPoints"), xScale);
  }

  private static Iterable<JsonNode> array(JsonNode node, String field) throws JsonMappingException {
    JsonNode result = node.get(field);
    if (result == null || result.isNull()) {
      return ImmutableList.of();
    } else if (!result.isArray()) {
      throw invalid("%s should be an array", field);
    }
    return result;
  }

  private static double number(JsonNode node, String field) throws JsonMappingException {
    JsonNode result = node.get(field);
    if (result == null || !result.isNumber()) {
      throw invalid("%s should be a number", field);
    }
    return result.asDouble();
  }

  private static ImmutableList<Double> numbers(JsonNode node, String field)
      throws JsonMappingException {
    ImmutableList.Builder<Double> result = ImmutableList.builder();
    for (JsonNode element : array(node, field)) {
      if (!element.isNumber()) {
        throw invalid("%s should only contain numbers", field);
      }
      result.add(element.asDouble());
    }
    return result.build();
  }

  private static ImmutableList<String> strings(JsonNode node, String field)
      throws JsonMappingException {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (JsonNode element : array(node, field)) {
      result.add(element.asText());
    }
    return result.build();
  }

  private static @Nullable String text(JsonNode node, String field) {
    JsonNode result = node.get(field);
    return (result == null || result.isNull()) ? null : result.asText();
  }

  @FormatMethod
  private static JsonMappingException invalid(String format, Object... args) {
    return new JsonMappingException((Closeable) null, String.format(format, args));
  }

  private static ObjectNode toTree(Datamodel.Project project) {
    ObjectNode root = MAPPER.createObjectNode();
    root.put("name", project.name);
    root.set("simSpec", toTree(project.simSpec));
    ArrayNode models = root.putArray("models");
    for (Datamodel.Model model : project.models) {
      ObjectNode m = models.addObject();
      m.put("name", model.name);
      if (model.simSpec != null) {
        m.set("simSpec", toTree(model.simSpec));
      }
      ArrayNode variables = m.putArray("variables");
      for (Datamodel.Variable v : model.variables) {
        variables.add(toTree(v));
      }
    }
    return root;
  }

  private static ObjectNode toTree(Datamodel.SimSpec simSpec) {
    ObjectNode result = MAPPER.createObjectNode();
    result.put("start", simSpec.start);
    result.put("stop", simSpec.stop);
    result.put("dt", simSpec.dt);
    result.put("dtIsReciprocal", simSpec.dtIsReciprocal);
    result.put("saveStep", simSpec.saveStep);
    result.put("method", simSpec.method);
    if (simSpec.timeUnits != null) {
      result.put("timeUnits", simSpec.timeUnits);
    }
    return result;
  }

  private static ObjectNode toTree(Datamodel.Variable v) {
    ObjectNode result = MAPPER.createObjectNode();
    result.put("kind", v.kind.name().toLowerCase(Locale.ROOT));
    result.put("name", v.name);
    if (v.equation != null) {
      result.put("equation", v.equation);
    }
    if (v.units != null) {
      result.put("units", v.units);
    }
    if (!v.inflows.isEmpty()) {
      v.inflows.forEach(result.putArray("inflows")::add);
    }
    if (!v.outflows.isEmpty()) {
      v.outflows.forEach(result.putArray("outflows")::add);
    }
    if (v.gf != null) {
      ObjectNode gf = result.putObject("gf");
      if (v.gf.xPoints != null) {
        v.gf.xPoints.forEach(gf.putArray("xPoints")::add);
      }
      v.gf.yPoints.forEach(gf.putArray("yPoints")::add);
      if (v.gf.xScale != null) {
        gf.putObject("xScale").put("min", v.gf.xScale.min).put("max", v.gf.xScale.max);
      }
    }
    if (v.modelName != null) {
      result.put("modelName", v.modelName);
    }
    if (!v.connections.isEmpty()) {
      ArrayNode connections = result.putArray("connections");
      for (Datamodel.Connection c : v.connections) {
        connections.addObject().put("from", c.from).put("to", c.to);
      }
    }
    return result;
  }
}
