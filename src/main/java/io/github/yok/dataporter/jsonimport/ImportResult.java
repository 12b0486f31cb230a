package io.github.yok.dataporter.jsonimport;

import java.util.List;
import lombok.Value;

/**
 * Outcome of a {@code json-import} run.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ImportResult {
    long inserted;
    long errors;
    // Filled in analyze-only mode
    List<StructureSuggestion> suggestions;

    static ImportResult analyzed(List<StructureSuggestion> suggestions) {
        return new ImportResult(0L, 0L, suggestions);
    }

    static ImportResult imported(long inserted, long errors) {
        return new ImportResult(inserted, errors, List.of());
    }
}
