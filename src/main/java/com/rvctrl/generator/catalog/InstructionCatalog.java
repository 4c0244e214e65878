package com.rvctrl.generator.catalog;

import com.rvctrl.generator.model.Instruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * The in-memory set of instructions available for classification.
 *
 * A load replaces the previous content wholesale. Parsing happens into a fresh list before
 * the swap, so a failed load leaves the previous catalog untouched.
 */
public class InstructionCatalog {
    private static final Logger log = LoggerFactory.getLogger(InstructionCatalog.class);

    private final CatalogParser parser;

    private List<Instruction> instructions = List.of();

    public InstructionCatalog() {
        this(new CatalogParser());
    }

    public InstructionCatalog(CatalogParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public static InstructionCatalog of(Collection<Instruction> instructions) {
        InstructionCatalog catalog = new InstructionCatalog();
        catalog.replaceAll(instructions);
        return catalog;
    }

    /**
     * Loads a flat catalog file.
     */
    public void load(Path catalogFile) throws IOException {
        List<Instruction> loaded = parser.parse(catalogFile);
        replaceAll(loaded);
        log.info("Loaded {} instructions from {}", loaded.size(), catalogFile);
    }

    public void load(List<String> lines) {
        replaceAll(parser.parse(lines));
    }

    public void replaceAll(Collection<Instruction> loaded) {
        this.instructions = List.copyOf(loaded);
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public int size() {
        return instructions.size();
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    public Optional<Instruction> find(String name) {
        return instructions.stream()
                .filter(i -> i.getName().equals(name))
                .findFirst();
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    /**
     * All distinct extension tags, sorted. An instruction may contribute several tags.
     */
    public SortedSet<String> getExtensions() {
        SortedSet<String> all = new TreeSet<>();
        for (Instruction instruction : instructions) {
            all.addAll(instruction.getExtensionTags());
        }
        return Collections.unmodifiableSortedSet(all);
    }

    /**
     * Keeps instructions whose tag set intersects the requested tags. Unknown tags are dropped
     * from the request and reported in the result.
     *
     * @throws NoMatchingExtensionsException if no requested tag is known
     */
    public ExtensionFilterResult filterByExtensions(Collection<String> requested) {
        SortedSet<String> available = getExtensions();

        SortedSet<String> applied = new TreeSet<>();
        SortedSet<String> ignored = new TreeSet<>();
        for (String tag : requested) {
            String trimmed = tag.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (available.contains(trimmed)) {
                applied.add(trimmed);
            } else {
                ignored.add(trimmed);
            }
        }

        if (applied.isEmpty()) {
            throw new NoMatchingExtensionsException(ignored, available);
        }
        if (!ignored.isEmpty()) {
            log.warn("Ignoring unknown extensions: {}", String.join(", ", ignored));
        }

        List<Instruction> retained = instructions.stream()
                .filter(i -> !Collections.disjoint(i.getExtensionTags(), applied))
                .toList();

        return ExtensionFilterResult.builder()
                .appliedExtensions(applied)
                .ignoredExtensions(ignored)
                .instructions(retained)
                .originalCount(instructions.size())
                .build();
    }

    /**
     * Case-insensitive substring search over name, extension, encoding and arguments.
     */
    public List<Instruction> search(String text) {
        if (text == null || text.isBlank()) {
            return instructions;
        }
        String needle = text.trim().toLowerCase(Locale.ROOT);
        return instructions.stream()
                .filter(i -> searchableText(i).contains(needle))
                .collect(Collectors.toList());
    }

    private static String searchableText(Instruction instruction) {
        return (instruction.getName() + " " + instruction.getExtension() + " "
                + instruction.getEncoding() + " " + String.join(" ", instruction.getArgs()))
                .toLowerCase(Locale.ROOT);
    }
}
