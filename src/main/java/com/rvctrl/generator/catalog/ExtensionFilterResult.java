package com.rvctrl.generator.catalog;

import com.rvctrl.generator.model.Instruction;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;
import java.util.SortedSet;

/**
 * Outcome of filtering a catalog by extension tags.
 */
@Value
@Builder
public class ExtensionFilterResult {

    /**
     * Requested tags that exist in the catalog.
     */
    @NonNull
    SortedSet<String> appliedExtensions;

    /**
     * Requested tags unknown to the catalog; they were dropped from the filter.
     */
    @NonNull
    SortedSet<String> ignoredExtensions;

    @NonNull
    List<Instruction> instructions;

    int originalCount;

    public int getRemovedCount() {
        return originalCount - instructions.size();
    }
}
