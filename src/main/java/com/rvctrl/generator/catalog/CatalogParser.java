package com.rvctrl.generator.catalog;

import com.rvctrl.generator.model.Instruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parser for flat instruction catalog files.
 *
 * Format (one instruction per line, whitespace separated, no header):
 * <pre>
 * name extension encoding [arg...]
 * add rv_i 0000000??????????000?????0110011 rd rs1 rs2
 * </pre>
 * Blank lines are skipped. A row with fewer than three tokens aborts the parse.
 */
public class CatalogParser {
    private static final Logger log = LoggerFactory.getLogger(CatalogParser.class);

    private static final int MIN_TOKENS = 3;

    public List<Instruction> parse(Path catalogFile) throws IOException {
        List<String> lines = Files.readAllLines(catalogFile, StandardCharsets.UTF_8);
        return parse(lines);
    }

    public List<Instruction> parse(List<String> lines) {
        List<Instruction> instructions = new ArrayList<>();

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            Instruction instruction = parseLine(trimmed, lineNum);
            instructions.add(instruction);
            log.trace("Parsed instruction: {}", instruction);
        }

        log.debug("Parsed {} instructions from {} lines", instructions.size(), lineNum);
        return instructions;
    }

    private Instruction parseLine(String line, int lineNum) {
        String[] tokens = line.split("\\s+");
        if (tokens.length < MIN_TOKENS) {
            throw new MalformedCatalogRowException(lineNum, line);
        }

        return Instruction.builder()
                .name(tokens[0])
                .extension(tokens[1])
                .encoding(tokens[2])
                .args(Arrays.asList(tokens).subList(MIN_TOKENS, tokens.length))
                .build();
    }
}
