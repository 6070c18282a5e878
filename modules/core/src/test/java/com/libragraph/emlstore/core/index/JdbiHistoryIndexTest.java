package com.libragraph.emlstore.core.index;

import com.libragraph.emlstore.core.db.JdbiMetadataStore;
import com.libragraph.emlstore.core.db.MetadataStore;
import com.libragraph.emlstore.core.db.TestDatabase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JdbiHistoryIndexTest extends AbstractHistoryIndexTest {

    @Override
    protected MetadataStore newStore() {
        return new JdbiMetadataStore(TestDatabase.create());
    }

    @Test
    void containsPatternEscapesWildcards() {
        assertThat(JdbiHistoryIndex.containsPattern("Budget")).isEqualTo("%budget%");
        assertThat(JdbiHistoryIndex.containsPattern("50%_off!")).isEqualTo("%50!%!_off!!%");
    }
}
