package com.libragraph.emlstore.core.index;

import com.libragraph.emlstore.core.dao.EmailMetadata;
import com.libragraph.emlstore.core.dao.HistoryItemDao;
import com.libragraph.emlstore.core.dao.HistoryRecord;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.mapper.reflect.ConstructorMapper;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * HistoryIndex over the {@code history_item} table, bound to one JDBI handle.
 * CRUD goes through {@link HistoryItemDao}; queries are assembled here because
 * their WHERE and ORDER BY clauses vary per call.
 */
public class JdbiHistoryIndex implements HistoryIndex {

    private static final String EFFECTIVE_DATE =
            "CASE WHEN email_date > 0 THEN email_date ELSE last_accessed END";
    private static final String DISPLAY_SENDER =
            "CASE WHEN sender_name = '' THEN sender_email ELSE sender_name END";
    private static final List<String> SEARCH_COLUMNS = List.of(
            "subject", "sender_email", "sender_name",
            "recipient_emails", "recipient_names", "body_preview");
    private static final char LIKE_ESCAPE = '!';

    private final Handle handle;
    private final HistoryItemDao dao;

    public JdbiHistoryIndex(Handle handle) {
        this.handle = handle;
        this.dao = handle.attach(HistoryItemDao.class);
    }

    @Override
    public HistoryRecord insert(NewHistoryItem item) {
        EmailMetadata meta = item.metadata();
        long id = dao.insert(item.blobHash(), item.displayName(), item.originalSourceRef(),
                item.lastAccessed(), meta.subject(), meta.senderEmail(), meta.senderName(),
                meta.recipientEmails(), meta.recipientNames(), meta.emailDate(),
                meta.hasAttachments(), meta.bodyPreview());
        return new HistoryRecord(id, item.blobHash(), item.displayName(), item.originalSourceRef(),
                item.lastAccessed(), meta.subject(), meta.senderEmail(), meta.senderName(),
                meta.recipientEmails(), meta.recipientNames(), meta.emailDate(),
                meta.hasAttachments(), meta.bodyPreview());
    }

    @Override
    public Optional<HistoryRecord> getById(long id) {
        return dao.findById(id);
    }

    @Override
    public List<HistoryRecord> findByBlobHash(String blobHash) {
        return dao.findByBlobHash(blobHash);
    }

    @Override
    public boolean updateLastAccessed(long id, long timestamp) {
        return dao.updateLastAccessed(id, timestamp) > 0;
    }

    @Override
    public boolean deleteById(long id) {
        return dao.deleteById(id) > 0;
    }

    @Override
    public int deleteAll() {
        return dao.deleteAll();
    }

    @Override
    public int countByBlobHash(String blobHash) {
        return dao.countByBlobHash(blobHash);
    }

    @Override
    public int count() {
        return dao.count();
    }

    @Override
    public List<HistoryRecord> oldest(int n) {
        if (n <= 0) {
            return List.of();
        }
        return dao.findOldest(n);
    }

    @Override
    public List<HistoryRecord> all() {
        return dao.findAllOrderedByAccess();
    }

    @Override
    public List<HistoryRecord> query(HistoryQuery query) {
        List<String> conditions = new ArrayList<>();
        Map<String, Object> binds = new HashMap<>();

        if (query.hasSearch()) {
            List<String> matches = new ArrayList<>();
            for (String column : SEARCH_COLUMNS) {
                matches.add("LOWER(" + column + ") LIKE :pattern ESCAPE '" + LIKE_ESCAPE + "'");
            }
            conditions.add("(" + String.join(" OR ", matches) + ")");
            binds.put("pattern", containsPattern(query.search()));
        }

        HistoryFilter filter = query.filter();
        if (filter.hasAttachments() != null) {
            conditions.add("has_attachments = :hasAttachments");
            binds.put("hasAttachments", filter.hasAttachments());
        }
        if (filter.dateFrom() != null) {
            conditions.add(EFFECTIVE_DATE + " >= :dateFrom");
            binds.put("dateFrom", filter.dateFrom());
        }
        if (filter.dateTo() != null) {
            conditions.add(":dateTo >= " + EFFECTIVE_DATE);
            binds.put("dateTo", filter.dateTo());
        }
        if (filter.senderContains() != null) {
            conditions.add("(LOWER(sender_email) LIKE :sender ESCAPE '" + LIKE_ESCAPE + "'"
                    + " OR LOWER(sender_name) LIKE :sender ESCAPE '" + LIKE_ESCAPE + "')");
            binds.put("sender", containsPattern(filter.senderContains()));
        }

        StringBuilder sql = new StringBuilder("SELECT * FROM history_item");
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        sql.append(" ORDER BY ").append(orderBy(query));

        return handle.createQuery(sql.toString())
                .bindMap(binds)
                .map(ConstructorMapper.of(HistoryRecord.class))
                .list();
    }

    private static String orderBy(HistoryQuery query) {
        if (query.sortField() == null) {
            return EFFECTIVE_DATE + " DESC, id DESC";
        }
        String key = switch (query.sortField()) {
            case DATE -> EFFECTIVE_DATE;
            case SUBJECT -> "LOWER(subject)";
            case SENDER -> "LOWER(" + DISPLAY_SENDER + ")";
        };
        String dir = query.direction() == SortDirection.DESCENDING ? "DESC" : "ASC";
        return key + " " + dir + ", id ASC";
    }

    static String containsPattern(String text) {
        String folded = HistoryOrdering.fold(text);
        StringBuilder pattern = new StringBuilder(folded.length() + 2).append('%');
        for (char c : folded.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                pattern.append(LIKE_ESCAPE);
            }
            pattern.append(c);
        }
        return pattern.append('%').toString();
    }
}
