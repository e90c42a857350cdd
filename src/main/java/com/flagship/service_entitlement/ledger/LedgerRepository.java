package com.flagship.service_entitlement.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JDBC access to the append-only service ledger and its archive partition.
 *
 * Callers never pick a table: {@link #query} routes to the live table or to
 * live plus archive, and {@link #sumTotals} always covers both. Rows are only
 * ever inserted; the database rejects updates and rejects deletes of rows that
 * have not been archived.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class LedgerRepository {

    static final String LIVE_TABLE = "service_ledgers";
    static final String ARCHIVE_TABLE = "service_ledgers_archive";

    private static final String COLUMNS = "id, student_id, service_type, quantity, type, source, balance_after, " +
            "related_booking_id, related_hold_id, metadata, reason, created_by, created_at";

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private static final Comparator<LedgerEntry> NEWEST_FIRST = Comparator
            .comparing(LedgerEntry::getCreatedAt)
            .thenComparing(entry -> entry.getId().toString())
            .reversed();

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Rows copied to the archive by one archive run, and how many of them were
     * then removed from the live table.
     */
    public record ArchiveResult(int archived, int deleted) {
    }

    public LedgerEntry insert(LedgerEntry entry) {
        jdbcTemplate.update(
            "INSERT INTO service_ledgers (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?)",
            entry.getId(),
            entry.getStudentId(),
            entry.getServiceType(),
            entry.getQuantity(),
            entry.getType().dbValue(),
            entry.getSource().dbValue(),
            entry.getBalanceAfter(),
            entry.getRelatedBookingId(),
            entry.getRelatedHoldId(),
            writeMetadata(entry.getMetadata()),
            entry.getReason(),
            entry.getCreatedBy(),
            Timestamp.from(entry.getCreatedAt())
        );
        return entry;
    }

    /**
     * Entries matching {@code filter}, newest first.
     *
     * Without the archive only the live table is read. With it, both partitions
     * are read up to offset + limit rows each, merged, deduplicated by id (the
     * live copy wins) and then paged.
     */
    public List<LedgerEntry> query(LedgerFilter filter, LedgerPage page) {
        if (!page.includeArchive()) {
            return select(LIVE_TABLE, filter, page.limit(), page.offset());
        }

        int window = page.offset() + page.limit();
        List<LedgerEntry> live = select(LIVE_TABLE, filter, window, 0);
        List<LedgerEntry> archived = select(ARCHIVE_TABLE, filter, window, 0);
        return merge(live, archived).stream()
                .skip(page.offset())
                .limit(page.limit())
                .toList();
    }

    /**
     * Consumption, refund and adjustment totals of a key over live and archived
     * rows. A row present in both partitions is counted once.
     */
    public LedgerTotals sumTotals(UUID studentId, String serviceType) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE WHEN type = 'consumption' THEN -quantity ELSE 0 END), 0) AS consumed, " +
            "       COALESCE(SUM(CASE WHEN type = 'refund' THEN quantity ELSE 0 END), 0) AS refunded, " +
            "       COALESCE(SUM(CASE WHEN type = 'adjustment' THEN quantity ELSE 0 END), 0) AS adjusted " +
            "FROM (SELECT id, type, quantity FROM service_ledgers WHERE student_id = ? AND service_type = ? " +
            "      UNION " +
            "      SELECT id, type, quantity FROM service_ledgers_archive WHERE student_id = ? AND service_type = ?) t",
            (rs, rowNum) -> new LedgerTotals(rs.getInt("consumed"), rs.getInt("refunded"), rs.getInt("adjusted")),
            studentId, serviceType, studentId, serviceType
        );
    }

    /**
     * Copies live rows created before {@code cutoff} into the archive, then
     * optionally deletes the copied rows from the live table.
     *
     * @param serviceType only this service type, or every type when null
     * @param excludedServiceTypes service types left alone (they have their own policy)
     */
    public ArchiveResult archiveBefore(Instant cutoff, String serviceType, Collection<String> excludedServiceTypes,
                                       boolean deleteAfterArchive, Instant archivedAt) {
        StringBuilder where = new StringBuilder(" WHERE l.created_at < ?");
        List<Object> params = new ArrayList<>();
        params.add(Timestamp.from(cutoff));
        if (serviceType != null) {
            where.append(" AND l.service_type = ?");
            params.add(serviceType);
        }
        if (excludedServiceTypes != null && !excludedServiceTypes.isEmpty()) {
            where.append(" AND l.service_type NOT IN (")
                 .append(String.join(", ", excludedServiceTypes.stream().map(t -> "?").toList()))
                 .append(")");
            params.addAll(excludedServiceTypes);
        }

        List<Object> insertParams = new ArrayList<>();
        insertParams.add(Timestamp.from(archivedAt));
        insertParams.addAll(params);
        int archived = jdbcTemplate.update(
            "INSERT INTO service_ledgers_archive (" + COLUMNS + ", archived_at) " +
            "SELECT " + prefixed("l") + ", ?::timestamptz FROM service_ledgers l" + where +
            " ON CONFLICT (id) DO NOTHING",
            insertParams.toArray()
        );

        int deleted = 0;
        if (deleteAfterArchive) {
            deleted = jdbcTemplate.update(
                "DELETE FROM service_ledgers l" + where +
                " AND EXISTS (SELECT 1 FROM service_ledgers_archive a WHERE a.id = l.id)",
                params.toArray()
            );
        }

        log.debug("Archived ledger rows before {} (serviceType={}): archived={}, deleted={}",
                cutoff, serviceType, archived, deleted);
        return new ArchiveResult(archived, deleted);
    }

    /**
     * Merges live and archived rows newest first, keeping the live copy of any
     * row that appears in both.
     */
    static List<LedgerEntry> merge(List<LedgerEntry> live, List<LedgerEntry> archived) {
        Map<UUID, LedgerEntry> byId = new LinkedHashMap<>();
        live.forEach(entry -> byId.putIfAbsent(entry.getId(), entry));
        archived.forEach(entry -> byId.putIfAbsent(entry.getId(), entry));

        List<LedgerEntry> merged = new ArrayList<>(byId.values());
        merged.sort(NEWEST_FIRST);
        return merged;
    }

    private List<LedgerEntry> select(String table, LedgerFilter filter, int limit, int offset) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM " + table + " WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (filter.studentId() != null) {
            sql.append(" AND student_id = ?");
            params.add(filter.studentId());
        }
        if (filter.serviceType() != null) {
            sql.append(" AND service_type = ?");
            params.add(filter.serviceType());
        }
        if (filter.from() != null) {
            sql.append(" AND created_at >= ?");
            params.add(Timestamp.from(filter.from()));
        }
        if (filter.to() != null) {
            sql.append(" AND created_at < ?");
            params.add(Timestamp.from(filter.to()));
        }
        sql.append(" ORDER BY created_at DESC, id DESC LIMIT ? OFFSET ?");
        params.add(limit);
        params.add(offset);

        return jdbcTemplate.query(sql.toString(), ledgerEntryRowMapper(ARCHIVE_TABLE.equals(table)), params.toArray());
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper(boolean archived) {
        return (rs, rowNum) -> LedgerEntry.builder()
            .id(rs.getObject("id", UUID.class))
            .studentId(rs.getObject("student_id", UUID.class))
            .serviceType(rs.getString("service_type"))
            .quantity(rs.getInt("quantity"))
            .type(LedgerEntryType.fromDbValue(rs.getString("type")))
            .source(LedgerSource.fromDbValue(rs.getString("source")))
            .balanceAfter(rs.getInt("balance_after"))
            .relatedBookingId(rs.getObject("related_booking_id", UUID.class))
            .relatedHoldId(rs.getObject("related_hold_id", UUID.class))
            .metadata(readMetadata(rs.getString("metadata")))
            .reason(rs.getString("reason"))
            .createdBy(rs.getString("created_by"))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .archived(archived)
            .build();
    }

    private static String prefixed(String alias) {
        return String.join(", ", List.of(COLUMNS.split(",\\s*")).stream().map(c -> alias + "." + c).toList());
    }

    private String writeMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize ledger metadata", e);
        }
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable ledger metadata: " + json, e);
        }
    }
}
