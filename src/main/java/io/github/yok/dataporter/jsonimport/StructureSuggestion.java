package io.github.yok.dataporter.jsonimport;

import java.util.List;
import lombok.Value;

/**
 * An array of objects found while analyzing a document; its elements are candidate rows.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class StructureSuggestion {
    // Slash separated path of the array, "/" for the document root
    String path;
    // Keys of the first element
    List<String> keys;
}
