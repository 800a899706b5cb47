package com.gt.recall.content.impl;

import com.gt.recall.content.ContentDao;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;

public class ContentDaoPG implements ContentDao {

    private static final String ITEM_EXISTS_SQL =
            "SELECT EXISTS (SELECT 1 FROM memory_item WHERE id = :itemId AND deleted IS NOT TRUE)";

    private static final String LOAD_IMPORTANCE_SQL =
            "SELECT id, COALESCE(importance_score, :defaultImportance) AS importance " +
            "FROM memory_item " +
            "WHERE id IN (:itemIds) AND deleted IS NOT TRUE";

    private final NamedParameterJdbcTemplate template;

    public ContentDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public boolean itemExists(String itemId) {
        return Boolean.TRUE.equals(template.queryForObject(ITEM_EXISTS_SQL, Map.of("itemId", itemId), Boolean.class));
    }

    @Override
    public Map<String, Double> loadImportance(Collection<String> itemIds) {
        if (itemIds.isEmpty()) {
            return Map.of();
        }

        return template.query(LOAD_IMPORTANCE_SQL, Map.of("itemIds", itemIds, "defaultImportance", DEFAULT_IMPORTANCE),
                        (rs, rowNum) -> Map.entry(rs.getString("id"), rs.getDouble("importance")))
                .stream()
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
    }
}
