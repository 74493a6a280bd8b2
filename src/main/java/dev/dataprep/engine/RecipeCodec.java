package dev.dataprep.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.dataprep.model.Recipe;
import dev.dataprep.model.Step;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes recipes as JSON. A recipe is an array of {@code {id, type, label, params}}
 * objects; a project is an object mapping dataset names to such arrays.
 */
public final class RecipeCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> PARAMS = new TypeReference<>() {};

    private RecipeCodec() {}

    public static Recipe loadFromFile(Path path) throws IOException {
        return parseRecipe(MAPPER.readTree(path.toFile()));
    }

    public static Recipe loadFromString(String json) throws IOException {
        return parseRecipe(MAPPER.readTree(json));
    }

    public static Map<String, Recipe> loadProjectFromFile(Path path) throws IOException {
        return parseProject(MAPPER.readTree(path.toFile()));
    }

    public static Map<String, Recipe> loadProjectFromString(String json) throws IOException {
        return parseProject(MAPPER.readTree(json));
    }

    public static String toJson(Recipe recipe) throws IOException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(recipeNode(recipe));
    }

    public static String projectToJson(Map<String, Recipe> project) throws IOException {
        ObjectNode root = MAPPER.createObjectNode();
        project.forEach((name, recipe) -> root.set(name, recipeNode(recipe)));
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    }

    public static void save(Recipe recipe, Path path) throws IOException {
        write(path, toJson(recipe));
    }

    public static void saveProject(Map<String, Recipe> project, Path path) throws IOException {
        write(path, projectToJson(project));
    }

    private static void write(Path path, String json) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, json);
    }

    private static Map<String, Recipe> parseProject(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Project must be a JSON object of dataset name to recipe");
        }
        var project = new LinkedHashMap<String, Recipe>();
        for (var entry : root.properties()) {
            project.put(entry.getKey(), parseRecipe(entry.getValue()));
        }
        return project;
    }

    // Accepts a bare array or an object wrapping it under "steps".
    private static Recipe parseRecipe(JsonNode root) {
        JsonNode stepsNode = root != null && root.isObject() ? root.get("steps") : root;
        if (stepsNode == null || !stepsNode.isArray()) {
            throw new IllegalArgumentException("Recipe must be a JSON array of steps");
        }
        var steps = new ArrayList<Step>();
        int index = 0;
        for (JsonNode node : stepsNode) {
            steps.add(parseStep(node, index++));
        }
        return new Recipe(steps);
    }

    private static Step parseStep(JsonNode node, int index) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Step at index %d is not an object".formatted(index));
        }
        if (!node.hasNonNull("type")) {
            throw new IllegalArgumentException("Step at index %d has no type".formatted(index));
        }
        String type = node.get("type").asText();
        String id = node.hasNonNull("id") ? node.get("id").asText() : "step-" + (index + 1);
        String label = node.hasNonNull("label") ? node.get("label").asText() : type;
        Map<String, Object> params = node.hasNonNull("params")
            ? MAPPER.convertValue(node.get("params"), PARAMS)
            : Map.of();
        return new Step(id, type, label, params);
    }

    private static ArrayNode recipeNode(Recipe recipe) {
        ArrayNode array = MAPPER.createArrayNode();
        for (Step step : recipe.steps()) {
            ObjectNode node = array.addObject();
            node.put("id", step.id());
            node.put("type", step.type());
            node.put("label", step.label());
            node.set("params", MAPPER.valueToTree(step.params()));
        }
        return array;
    }
}
