package com.libragraph.emlstore.core.index;

import com.libragraph.emlstore.core.dao.EmailMetadata;
import com.libragraph.emlstore.core.dao.HistoryRecord;
import com.libragraph.emlstore.core.db.MetadataStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

/**
 * CRUD and query behaviour every {@link HistoryIndex} must share.
 */
abstract class AbstractHistoryIndexTest {

    private MetadataStore store;

    protected abstract MetadataStore newStore();

    @BeforeEach
    void setUp() {
        store = newStore();
    }

    private <T> T withIndex(Function<HistoryIndex, T> work) {
        return store.inTransaction((ledger, index) -> work.apply(index));
    }

    private HistoryRecord add(String blob, String name, long lastAccessed, EmailMetadata meta) {
        String hash = blob.repeat(64 / blob.length());
        return store.inTransaction((ledger, index) -> {
            if (ledger.lookup(hash).isEmpty()) {
                ledger.create(hash, 1);
            } else {
                ledger.incrementRef(hash);
            }
            return index.insert(new NewHistoryItem(hash, name, "file:" + name, lastAccessed, meta));
        });
    }

    private HistoryRecord add(String blob, String name, long lastAccessed) {
        return add(blob, name, lastAccessed, EmailMetadata.empty());
    }

    private static EmailMetadata mail(String subject, String senderEmail, String senderName, long date) {
        return EmailMetadata.builder()
                .subject(subject)
                .sender(senderEmail, senderName)
                .emailDate(date)
                .build();
    }

    private static List<String> names(List<HistoryRecord> records) {
        return records.stream().map(HistoryRecord::displayName).toList();
    }

    // -- CRUD --

    @Test
    void insertAssignsIncreasingIds() {
        HistoryRecord first = add("a", "first", 100);
        HistoryRecord second = add("b", "second", 200);

        Optional<HistoryRecord> loaded = withIndex(i -> i.getById(first.id()));
        assertThat(second.id()).isGreaterThan(first.id());
        assertThat(loaded).contains(first);
        assertThat(first.originalSourceRef()).isEqualTo("file:first");
    }

    @Test
    void metadataRoundTripsThroughIndex() {
        EmailMetadata meta = EmailMetadata.builder()
                .subject("Quarterly report")
                .sender("alice@example.com", "Alice")
                .recipients("bob@example.com,carol@example.com", "Bob,Carol")
                .emailDate(1_700_000_000_000L)
                .hasAttachments(true)
                .bodyPreview("Numbers attached")
                .build();

        HistoryRecord inserted = add("a", "report.eml", 100, meta);
        HistoryRecord loaded = withIndex(i -> i.getById(inserted.id())).orElseThrow();

        assertThat(loaded).isEqualTo(inserted);
        assertThat(loaded.recipientNames()).isEqualTo("Bob,Carol");
        assertThat(loaded.hasAttachments()).isTrue();
    }

    @Test
    void updateAndDeleteReportUnknownIds() {
        HistoryRecord record = add("a", "one", 100);

        boolean touched = withIndex(i -> i.updateLastAccessed(record.id(), 500));
        Optional<HistoryRecord> afterTouch = withIndex(i -> i.getById(record.id()));
        boolean touchedUnknown = withIndex(i -> i.updateLastAccessed(9_999, 500));
        boolean deletedUnknown = withIndex(i -> i.deleteById(9_999));
        boolean deleted = withIndex(i -> i.deleteById(record.id()));
        Optional<HistoryRecord> afterDelete = withIndex(i -> i.getById(record.id()));

        assertThat(touched).isTrue();
        assertThat(afterTouch).map(HistoryRecord::lastAccessed).contains(500L);
        assertThat(touchedUnknown).isFalse();
        assertThat(deletedUnknown).isFalse();
        assertThat(deleted).isTrue();
        assertThat(afterDelete).isEmpty();
    }

    @Test
    void findByBlobHashListsOldestIdFirst() {
        HistoryRecord first = add("a", "first", 300);
        HistoryRecord second = add("a", "second", 100);
        add("b", "other", 200);

        List<HistoryRecord> sharing = withIndex(i -> i.findByBlobHash(first.blobHash()));
        int count = withIndex(i -> i.countByBlobHash(first.blobHash()));
        assertThat(sharing).extracting(HistoryRecord::id).containsExactly(first.id(), second.id());
        assertThat(count).isEqualTo(2);
    }

    @Test
    void allIsMostRecentlyAccessedFirst() {
        add("a", "old", 100);
        add("b", "new", 300);
        add("c", "mid", 200);

        assertThat(names(withIndex(HistoryIndex::all))).containsExactly("new", "mid", "old");
    }

    @Test
    void oldestBreaksTiesByInsertionOrder() {
        add("a", "first", 100);
        add("b", "second", 100);
        add("c", "recent", 500);

        assertThat(names(withIndex(i -> i.oldest(2)))).containsExactly("first", "second");
        List<HistoryRecord> none = withIndex(i -> i.oldest(0));
        assertThat(none).isEmpty();
    }

    @Test
    void deleteAllEmptiesIndex() {
        add("a", "one", 100);
        add("b", "two", 200);

        int deleted = withIndex(HistoryIndex::deleteAll);
        int count = withIndex(HistoryIndex::count);
        assertThat(deleted).isEqualTo(2);
        assertThat(count).isZero();
    }

    // -- search --

    @Test
    void searchMatchesAnyFieldIgnoringCase() {
        add("a", "by-subject", 100, mail("Budget Review", "x@example.com", "", 1000));
        add("b", "by-sender", 100, mail("Lunch", "budget-team@example.com", "", 2000));
        add("c", "by-name", 100, mail("Hello", "y@example.com", "The BUDGET office", 3000));
        add("d", "unrelated", 100, mail("Weekend", "z@example.com", "Zed", 4000));
        add("e", "by-body", 100, EmailMetadata.builder().bodyPreview("the budget is final").emailDate(500).build());
        add("f", "by-recipient", 100, EmailMetadata.builder().recipients("budget@example.com", "").emailDate(600).build());

        assertThat(names(withIndex(i -> i.search("budget"))))
                .containsExactly("by-name", "by-sender", "by-subject", "by-recipient", "by-body");
    }

    @Test
    void blankSearchReturnsEverything() {
        add("a", "one", 100);
        add("b", "two", 200);

        List<HistoryRecord> spaces = withIndex(i -> i.search("   "));
        List<HistoryRecord> empty = withIndex(i -> i.search(""));
        assertThat(spaces).hasSize(2);
        assertThat(empty).hasSize(2);
    }

    @Test
    void leadingSpaceInSearchIsSignificant() {
        add("a", "at-start", 100, mail("Weekly Report", "", "", 1000));
        add("b", "mid-subject", 100, mail("The Weekly Report", "", "", 2000));

        assertThat(names(withIndex(i -> i.search(" Weekly")))).containsExactly("mid-subject");
    }

    @Test
    void searchTreatsLikeWildcardsLiterally() {
        add("a", "percent", 100, mail("100% done", "", "", 1000));
        add("b", "plain", 100, mail("1000 done", "", "", 2000));
        add("c", "underscore", 100, mail("snake_case", "", "", 3000));
        add("d", "no-underscore", 100, mail("snakeXcase", "", "", 4000));

        assertThat(names(withIndex(i -> i.search("0%")))).containsExactly("percent");
        assertThat(names(withIndex(i -> i.search("e_c")))).containsExactly("underscore");
    }

    // -- sort --

    @Test
    void sortByDateFallsBackToLastAccessed() {
        add("a", "dated-old", 9_000, mail("", "", "", 1_000));
        add("b", "undated", 5_000, mail("", "", "", 0));
        add("c", "dated-new", 1_000, mail("", "", "", 8_000));

        assertThat(names(withIndex(i -> i.sortBy(SortField.DATE, SortDirection.ASCENDING))))
                .containsExactly("dated-old", "undated", "dated-new");
        assertThat(names(withIndex(i -> i.sortBy(SortField.DATE, SortDirection.DESCENDING))))
                .containsExactly("dated-new", "undated", "dated-old");
    }

    @Test
    void sortBySubjectIgnoresCase() {
        add("a", "b", 100, mail("banana", "", "", 0));
        add("b", "A", 100, mail("Apple", "", "", 0));
        add("c", "c", 100, mail("cherry", "", "", 0));

        assertThat(names(withIndex(i -> i.sortBy(SortField.SUBJECT, SortDirection.ASCENDING))))
                .containsExactly("A", "b", "c");
        assertThat(names(withIndex(i -> i.sortBy(SortField.SUBJECT, SortDirection.DESCENDING))))
                .containsExactly("c", "b", "A");
    }

    @Test
    void sortBySenderUsesNameThenAddress() {
        add("a", "named", 100, mail("", "zed@example.com", "Anna", 0));
        add("b", "address-only", 100, mail("", "bob@example.com", "", 0));
        add("c", "named-late", 100, mail("", "amy@example.com", "Carl", 0));

        assertThat(names(withIndex(i -> i.sortBy(SortField.SENDER, SortDirection.ASCENDING))))
                .containsExactly("named", "address-only", "named-late");
    }

    @Test
    void equalSortKeysKeepInsertionOrder() {
        add("a", "first", 100, mail("same", "", "", 0));
        add("b", "second", 300, mail("same", "", "", 0));
        add("c", "third", 200, mail("same", "", "", 0));

        assertThat(names(withIndex(i -> i.sortBy(SortField.SUBJECT, SortDirection.DESCENDING))))
                .containsExactly("first", "second", "third");
    }

    // -- filter --

    @Test
    void filterByAttachments() {
        add("a", "with", 100, EmailMetadata.builder().hasAttachments(true).build());
        add("b", "without", 100, EmailMetadata.builder().hasAttachments(false).build());

        assertThat(names(withIndex(i -> i.filter(HistoryFilter.withAttachments())))).containsExactly("with");
        assertThat(names(withIndex(i -> i.filter(new HistoryFilter(false, null, null, null)))))
                .containsExactly("without");
    }

    @Test
    void filterByInclusiveDateRange() {
        add("a", "before", 100, mail("", "", "", 999));
        add("b", "from-edge", 100, mail("", "", "", 1_000));
        add("c", "to-edge", 100, mail("", "", "", 2_000));
        add("d", "after", 100, mail("", "", "", 2_001));
        add("e", "undated-inside", 1_500, mail("", "", "", 0));

        assertThat(names(withIndex(i -> i.filter(HistoryFilter.dateBetween(1_000L, 2_000L)))))
                .containsExactlyInAnyOrder("from-edge", "to-edge", "undated-inside");
        assertThat(names(withIndex(i -> i.filter(HistoryFilter.dateBetween(2_000L, null)))))
                .containsExactlyInAnyOrder("to-edge", "after");
    }

    @Test
    void filterBySender() {
        add("a", "alice", 100, mail("", "alice@example.com", "Alice Smith", 0));
        add("b", "bob", 100, mail("", "bob@example.org", "Bob", 0));

        assertThat(names(withIndex(i -> i.filter(HistoryFilter.sender("SMITH"))))).containsExactly("alice");
        assertThat(names(withIndex(i -> i.filter(HistoryFilter.sender("example.org"))))).containsExactly("bob");
    }

    @Test
    void queryCombinesSearchFilterAndSort() {
        add("a", "match-1", 100, EmailMetadata.builder().subject("invoice A").hasAttachments(true).emailDate(1_000).build());
        add("b", "match-2", 100, EmailMetadata.builder().subject("Invoice B").hasAttachments(true).emailDate(2_000).build());
        add("c", "no-attachment", 100, EmailMetadata.builder().subject("invoice C").emailDate(3_000).build());
        add("d", "other", 100, EmailMetadata.builder().subject("hello").hasAttachments(true).emailDate(4_000).build());

        HistoryQuery query = HistoryQuery.forSearch("invoice")
                .withFilter(HistoryFilter.withAttachments())
                .sortedBy(SortField.DATE, SortDirection.ASCENDING);

        assertThat(names(withIndex(i -> i.query(query)))).containsExactly("match-1", "match-2");
    }
}
