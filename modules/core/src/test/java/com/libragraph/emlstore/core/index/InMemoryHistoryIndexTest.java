package com.libragraph.emlstore.core.index;

import com.libragraph.emlstore.core.dao.HistoryRecord;
import com.libragraph.emlstore.core.db.InMemoryMetadataStore;
import com.libragraph.emlstore.core.db.MetadataStore;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class InMemoryHistoryIndexTest extends AbstractHistoryIndexTest {

    @Override
    protected MetadataStore newStore() {
        return new InMemoryMetadataStore();
    }

    @Test
    void idsAreNotReusedAfterDeleteAll() {
        InMemoryHistoryIndex index = new InMemoryHistoryIndex();
        HistoryRecord first = index.insert(new NewHistoryItem("a".repeat(64), "one", null, 1, null));
        index.deleteAll();

        HistoryRecord next = index.insert(new NewHistoryItem("a".repeat(64), "two", null, 2, null));

        assertThat(next.id()).isGreaterThan(first.id());
    }
}
