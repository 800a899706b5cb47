package com.gt.recall.content;

import java.util.Collection;
import java.util.Map;

// Read-only view of the content store; items are created and edited elsewhere
public interface ContentDao {

    double DEFAULT_IMPORTANCE = 0.5;

    boolean itemExists(String itemId);

    // Importance of each existing item, DEFAULT_IMPORTANCE where none is recorded. Unknown or deleted items are left out.
    Map<String, Double> loadImportance(Collection<String> itemIds);
}
