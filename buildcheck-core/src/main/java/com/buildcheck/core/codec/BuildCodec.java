package com.buildcheck.core.codec;

import com.buildcheck.core.model.Build;
import com.buildcheck.core.model.Component;
import com.buildcheck.core.model.Slot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of builds, components and engine results.
 *
 * <p>Builds are encoded as an object keyed by slot ({@code "cpu"}, {@code "case"}, ...),
 * each value a component carrying its {@code component_type}. Empty slots are omitted on
 * write and may be absent or null on read.
 *
 * <p><b>Validation request format:</b>
 * <pre>{@code
 * {
 *   "components": {
 *     "cpu": { "component_type": "CPU", "socket": "AM5", ... },
 *     "gpu": null
 *   }
 * }
 * }</pre>
 *
 * <p>String-valued list fields such as {@code memory_type} accept either a single string or
 * an array. Integer fields (wattages, dimensions, counts) reject fractional values, and no
 * numeric field may be negative.
 */
public final class BuildCodec {

    private static final Logger log = LoggerFactory.getLogger(BuildCodec.class);

    private static final String COMPONENTS = "components";

    // Prices are read through the tree model; keep their decimal scale exact.
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
        .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false)
        .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true)
        .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true)
        .setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));

    private static final ObjectWriter SLOT_WRITER = MAPPER
        .writerFor(new TypeReference<Map<String, Component>>() {})
        .with(SerializationFeature.INDENT_OUTPUT);

    private static final ObjectWriter COMPACT_SLOT_WRITER = MAPPER
        .writerFor(new TypeReference<Map<String, Component>>() {});

    private static final ObjectWriter RESULT_WRITER = MAPPER.writer(SerializationFeature.INDENT_OUTPUT);

    private BuildCodec() {
        // Utility class
    }

    /**
     * Encodes a build as a slot-keyed object.
     *
     * @param build build to encode
     * @return JSON text
     */
    public static String writeBuild(Build build) {
        try {
            return SLOT_WRITER.writeValueAsString(slotMap(build));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode build: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Encodes a build as a slot-keyed object on a single line.
     *
     * @param build build to encode
     * @return compact JSON text
     */
    public static String writeBuildCompact(Build build) {
        try {
            return COMPACT_SLOT_WRITER.writeValueAsString(slotMap(build));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode build: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Encodes a build wrapped in an export document:
     * {@code {"components": {...}, "totalPrice": 123.45}}.
     *
     * @param build build to encode
     * @param totalPrice price to report alongside
     * @return indented JSON text
     */
    public static String writeExportDocument(Build build, BigDecimal totalPrice) {
        try {
            ObjectNode document = MAPPER.createObjectNode();
            document.set(COMPONENTS, MAPPER.readTree(COMPACT_SLOT_WRITER.writeValueAsString(slotMap(build))));
            document.put("totalPrice", totalPrice);
            return RESULT_WRITER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode build: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decodes a slot-keyed build object.
     *
     * @param json JSON text
     * @return decoded build
     * @throws InvalidBuildRequestException if the JSON is malformed, names an unknown slot,
     *                                      or places a component in the wrong slot
     */
    public static Build readBuild(String json) {
        return decodeSlots(parse(json));
    }

    /**
     * Decodes a single component. An unrecognized {@code component_type} yields an
     * {@link com.buildcheck.core.model.UnrecognizedComponent} rather than an error.
     *
     * @param json JSON text
     * @return decoded component
     * @throws InvalidBuildRequestException if the JSON is malformed or not an object
     */
    public static Component readComponent(String json) {
        JsonNode node = parse(json);
        if (!node.isObject()) {
            throw new InvalidBuildRequestException("Component must be a JSON object");
        }
        return decodeComponent(node, "component");
    }

    /**
     * Decodes one component or a JSON array of components.
     *
     * @param json JSON object or array
     * @return decoded components in input order
     * @throws InvalidBuildRequestException if the JSON is malformed or holds a non-object entry
     */
    public static List<Component> readComponents(String json) {
        JsonNode node = parse(json);
        if (node.isObject()) {
            return List.of(decodeComponent(node, "component"));
        }
        if (!node.isArray()) {
            throw new InvalidBuildRequestException("Expected a component object or an array of components");
        }
        List<Component> components = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode element = node.get(i);
            if (!element.isObject()) {
                throw new InvalidBuildRequestException("Component at index " + i + " must be a JSON object");
            }
            components.add(decodeComponent(element, "component at index " + i));
        }
        return List.copyOf(components);
    }

    /**
     * Decodes a validation request body.
     *
     * @param json request body
     * @return the build carried by the request
     * @throws InvalidBuildRequestException if the body is not exactly
     *                                      {@code {"components": {...}}} with valid slots
     */
    public static Build readValidationRequest(String json) {
        JsonNode root = parse(json);
        if (!root.isObject()) {
            throw new InvalidBuildRequestException("Request body must be a JSON object");
        }

        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!COMPONENTS.equals(name)) {
                throw new InvalidBuildRequestException("Unexpected request field: " + name);
            }
        }

        JsonNode components = root.get(COMPONENTS);
        if (components == null || components.isNull()) {
            throw new InvalidBuildRequestException("Request is missing 'components'");
        }
        return decodeSlots(components);
    }

    /**
     * Encodes any engine result (validation result, recommendation, filters, ...) as
     * indented JSON.
     *
     * @param result value to encode
     * @return JSON text
     */
    public static String writeResult(Object result) {
        try {
            return RESULT_WRITER.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode result: " + e.getOriginalMessage(), e);
        }
    }

    private static Map<String, Component> slotMap(Build build) {
        Map<String, Component> slots = new LinkedHashMap<>();
        for (Slot slot : build.selected()) {
            slots.put(slot.key(), build.get(slot));
        }
        return slots;
    }

    private static JsonNode parse(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidBuildRequestException("Input is empty");
        }
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidBuildRequestException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static Build decodeSlots(JsonNode components) {
        if (!components.isObject()) {
            throw new InvalidBuildRequestException("'components' must be a JSON object");
        }

        Build build = Build.empty();
        Iterator<Map.Entry<String, JsonNode>> fields = components.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Slot slot = Slot.forKey(field.getKey())
                .orElseThrow(() -> new InvalidBuildRequestException("Unknown slot: " + field.getKey()));

            JsonNode value = field.getValue();
            if (value.isNull()) {
                continue;
            }
            if (!value.isObject()) {
                throw new InvalidBuildRequestException("Slot '" + slot.key() + "' must hold a JSON object");
            }

            Component component = decodeComponent(value, slot.key());
            if (component.type() != slot.componentType()) {
                throw new InvalidBuildRequestException(String.format(
                    "Slot '%s' expects %s but got %s",
                    slot.key(), slot.componentType().label(), component.type().label()));
            }
            build = build.with(component);
        }

        log.debug("Decoded build with {} selected slots", build.selected().size());
        return build;
    }

    private static Component decodeComponent(JsonNode node, String where) {
        rejectNegativeNumbers(node, where);
        try {
            return MAPPER.treeToValue(node, Component.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidBuildRequestException("Invalid " + where + ": " + e.getMessage(), e);
        }
    }

    private static void rejectNegativeNumbers(JsonNode node, String where) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isNumber() && value.decimalValue().signum() < 0) {
                throw new InvalidBuildRequestException(String.format(
                    "Invalid %s: '%s' must not be negative (%s)", where, field.getKey(), value.asText()));
            }
        }
    }
}
