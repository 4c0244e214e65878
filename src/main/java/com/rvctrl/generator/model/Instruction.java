package com.rvctrl.generator.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.LinkedHashSet;

/**
 * One instruction descriptor of the catalog.
 *
 * The extension is kept exactly as it appears in the catalog: a single token, or the
 * space-joined tag list produced by the database importer.
 */
@Value
@Builder(toBuilder = true)
public class Instruction {

    @NonNull
    String name;

    @NonNull
    String extension;

    /**
     * Canonical encoding over {0, 1, ?}, most significant bit first.
     */
    @NonNull
    String encoding;

    @NonNull
    @Singular
    List<String> args;

    /**
     * Individual extension tags; an instruction may belong to several extensions.
     */
    public Set<String> getExtensionTags() {
        Set<String> tags = new LinkedHashSet<>();
        Arrays.stream(extension.trim().split("\\s+"))
                .filter(tag -> !tag.isEmpty())
                .forEach(tags::add);
        return tags;
    }

    @Override
    public String toString() {
        return name + " (" + extension + "): " + encoding;
    }
}
