package com.eainde.truckticket.repository.jdbc;

import com.eainde.truckticket.model.ReferenceCategory;
import com.eainde.truckticket.model.ReferenceEntity;
import com.eainde.truckticket.reference.ReferenceDataSource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Optional;

/**
 * Reference tables stored together in {@code reference_entities}, one row per entity.
 */
public class JdbcReferenceDataSource implements ReferenceDataSource {

    private static final RowMapper<ReferenceEntity> ROW_MAPPER = (rs, rowNum) -> new ReferenceEntity(
            rs.getLong("id"),
            ReferenceCategory.valueOf(rs.getString("category")),
            rs.getString("canonical_name"),
            rs.getBoolean("requires_manifest"));

    private final JdbcTemplate jdbcTemplate;

    public JdbcReferenceDataSource(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<ReferenceEntity> findByName(ReferenceCategory category, String canonicalName) {
        if (canonicalName == null) {
            return Optional.empty();
        }
        return jdbcTemplate.query("""
                SELECT id, category, canonical_name, requires_manifest
                FROM reference_entities
                WHERE category = ? AND UPPER(canonical_name) = UPPER(?)
                """, ROW_MAPPER, category.name(), canonicalName.trim()).stream().findFirst();
    }

    @Override
    public List<ReferenceEntity> findAll(ReferenceCategory category) {
        return jdbcTemplate.query("""
                SELECT id, category, canonical_name, requires_manifest
                FROM reference_entities
                WHERE category = ?
                ORDER BY id
                """, ROW_MAPPER, category.name());
    }
}
