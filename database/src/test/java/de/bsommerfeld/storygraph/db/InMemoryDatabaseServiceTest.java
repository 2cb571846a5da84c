package de.bsommerfeld.storygraph.db;

import de.bsommerfeld.storygraph.core.domain.Branch;
import de.bsommerfeld.storygraph.core.domain.Snippet;
import de.bsommerfeld.storygraph.core.domain.SnippetKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the in-memory store used in TEST mode. It must order and roll back
 * exactly like the SQLite store.
 */
class InMemoryDatabaseServiceTest {

    private InMemoryDatabaseService db;

    @BeforeEach
    void setUp() {
        db = new InMemoryDatabaseService();
    }

    @Test
    void getChildren_shouldBreakTiesByInsertionOrder() {
        db.insertSnippet(snippet("root", null, 1));
        db.insertSnippet(snippet("b", "root", 10));
        db.insertSnippet(snippet("a", "root", 10));

        assertEquals(List.of("b", "a"), db.getChildren("tale", "root").stream().map(Snippet::id).toList());
    }

    @Test
    void getRoots_shouldReturnNewestFirstWithLatestInsertWinningTies() {
        db.insertSnippet(snippet("r1", null, 5));
        db.insertSnippet(snippet("r2", null, 5));
        db.insertSnippet(snippet("r0", null, 1));

        assertEquals(List.of("r2", "r1", "r0"), db.getRoots("tale").stream().map(Snippet::id).toList());
    }

    @Test
    void updateParent_shouldKeepRowPosition() {
        db.insertSnippet(snippet("root", null, 1));
        db.insertSnippet(snippet("x", "root", 10));
        db.insertSnippet(snippet("y", "root", 10));

        db.updateParent("x", "root");

        assertEquals(List.of("x", "y"), db.getChildren("tale", "root").stream().map(Snippet::id).toList());
    }

    @Test
    void insertSnippet_shouldRejectDuplicateId() {
        db.insertSnippet(snippet("a", null, 1));
        assertThrows(StorageException.class, () -> db.insertSnippet(snippet("a", null, 2)));
    }

    @Test
    void upsertBranch_shouldKeepCreatedAt() {
        db.upsertBranch(new Branch("tale", "main", "a", 10));
        db.upsertBranch(new Branch("tale", "main", "b", 20));

        assertEquals(10, db.getBranch("tale", "main").createdAt());
        assertEquals("b", db.getBranch("tale", "main").headId());
    }

    @Test
    void inTransaction_shouldRestoreSnapshotOnFailure() {
        db.insertSnippet(snippet("a", null, 1));
        db.upsertBranch(new Branch("tale", "main", "a", 1));

        assertThrows(IllegalStateException.class, () -> db.runInTransaction(() -> {
            db.deleteSnippet("a");
            db.deleteBranch("tale", "main");
            throw new IllegalStateException("boom");
        }));

        assertNotNull(db.getSnippet("a"));
        assertNotNull(db.getBranch("tale", "main"));
    }

    @Test
    void inTransaction_shouldJoinOuterUnit() {
        assertThrows(IllegalStateException.class, () -> db.runInTransaction(() -> {
            db.runInTransaction(() -> db.insertSnippet(snippet("inner", null, 1)));
            throw new IllegalStateException("outer fails");
        }));

        assertNull(db.getSnippet("inner"));
    }

    @Test
    void listStories_shouldBeSortedAndDistinct() {
        db.insertSnippet(new Snippet("1", "zeta", null, null, SnippetKind.AI, "", 1));
        db.insertSnippet(new Snippet("2", "alpha", null, null, SnippetKind.AI, "", 1));
        db.insertSnippet(new Snippet("3", "alpha", "2", null, SnippetKind.AI, "", 2));

        assertEquals(List.of("alpha", "zeta"), db.listStories());
    }

    @Test
    void deleteAll_shouldReturnSnippetCount() {
        db.insertSnippet(snippet("a", null, 1));
        db.insertSnippet(snippet("b", "a", 2));

        assertEquals(2, db.deleteAll());
        assertTrue(db.getSnippetsForStory("tale").isEmpty());
    }

    private static Snippet snippet(String id, String parentId, long createdAt) {
        return new Snippet(id, "tale", parentId, null, SnippetKind.USER, "", createdAt);
    }
}
