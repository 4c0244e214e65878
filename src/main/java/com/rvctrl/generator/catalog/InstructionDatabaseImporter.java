package com.rvctrl.generator.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rvctrl.generator.model.Instruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Imports the structured RISC-V instruction database ({@code instr_dict.json}).
 *
 * <pre>
 * {
 *   "add": {
 *     "encoding": "0000000----------000-----0110011",
 *     "variable_fields": ["rd", "rs1", "rs2"],
 *     "extension": ["rv_i"],
 *     "match": "0x33",
 *     "mask": "0xfe00707f"
 *   }
 * }
 * </pre>
 *
 * Each descriptor becomes one flat instruction with a normalized encoding. Descriptors that are
 * not objects, or that have no encoding, are skipped. {@code match} and {@code mask} are ignored.
 */
public class InstructionDatabaseImporter {
    private static final Logger log = LoggerFactory.getLogger(InstructionDatabaseImporter.class);

    private final ObjectMapper objectMapper;

    public InstructionDatabaseImporter() {
        this(new ObjectMapper());
    }

    public InstructionDatabaseImporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Instruction> importFile(Path databaseFile) throws IOException {
        String json = Files.readString(databaseFile, StandardCharsets.UTF_8);
        return importJson(json);
    }

    public List<Instruction> importJson(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidInstructionDatabaseException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidInstructionDatabaseException(
                    "Invalid instruction database: expected a JSON object mapping instruction names to descriptors");
        }
        return importTree(root);
    }

    List<Instruction> importTree(JsonNode root) {
        List<Instruction> instructions = new ArrayList<>();
        int skipped = 0;

        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String name = entry.getKey();
            JsonNode descriptor = entry.getValue();

            if (!descriptor.isObject()) {
                skipped++;
                continue;
            }

            String encoding = descriptor.path("encoding").asText("");
            if (encoding.isEmpty()) {
                log.debug("Skipping {}: no encoding", name);
                skipped++;
                continue;
            }

            instructions.add(Instruction.builder()
                    .name(name)
                    .extension(joinField(descriptor.get("extension")))
                    .encoding(EncodingNormalizer.normalize(encoding))
                    .args(splitField(descriptor.get("variable_fields")))
                    .build());
        }

        log.debug("Imported {} instructions, skipped {}", instructions.size(), skipped);
        return instructions;
    }

    /**
     * Arrays are space-joined; a scalar is taken as its text.
     */
    private static String joinField(JsonNode node) {
        return String.join(" ", splitField(node));
    }

    private static List<String> splitField(JsonNode node) {
        List<String> parts = new ArrayList<>();
        if (node == null || node.isNull()) {
            return parts;
        }
        if (node.isArray()) {
            node.forEach(element -> parts.add(element.asText()));
        } else if (!node.asText().isEmpty()) {
            parts.add(node.asText());
        }
        return parts;
    }
}
