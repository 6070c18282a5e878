package com.libragraph.emlstore.core.db;

import com.libragraph.emlstore.core.dao.BlobDao;
import com.libragraph.emlstore.core.index.JdbiHistoryIndex;
import com.libragraph.emlstore.core.ledger.JdbiBlobLedger;
import org.jdbi.v3.core.Jdbi;

/**
 * MetadataStore backed by a relational database through JDBI. Schema:
 * {@code db/migration/V1__history.sql}.
 */
public class JdbiMetadataStore implements MetadataStore {

    private final Jdbi jdbi;

    public JdbiMetadataStore(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    @Override
    public <T> T inTransaction(Work<T> work) {
        return jdbi.inTransaction(h -> work.apply(
                new JdbiBlobLedger(h.attach(BlobDao.class)),
                new JdbiHistoryIndex(h)));
    }
}
