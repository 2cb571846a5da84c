package de.bsommerfeld.storygraph.graph;

import de.bsommerfeld.storygraph.core.config.BranchConfig;
import de.bsommerfeld.storygraph.core.domain.Branch;
import de.bsommerfeld.storygraph.core.domain.Snippet;
import de.bsommerfeld.storygraph.core.domain.SnippetKind;
import de.bsommerfeld.storygraph.core.event.StoryEventBus;
import de.bsommerfeld.storygraph.core.event.StoryEvents.StoryDeletedEvent;
import de.bsommerfeld.storygraph.core.event.StoryEvents.StoryDuplicatedEvent;
import de.bsommerfeld.storygraph.db.InMemoryDatabaseService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StoryLifecycleServiceTest {

    private static final String SOURCE = "tale";
    private static final String TARGET = "copy";

    @Mock
    private StoryEventBus eventBus;

    private InMemoryDatabaseService db;
    private GraphStore graph;
    private StoryLifecycleService lifecycle;

    @BeforeEach
    void setUp() {
        db = new InMemoryDatabaseService();
        graph = new GraphStore(db, eventBus);
        lifecycle = new StoryLifecycleService(db, graph, new BranchConfig(), eventBus);
    }

    // -- Delete / truncate / purge --

    @Test
    void deleteStory_shouldRemoveSnippetsAndBranches() {
        Snippet root = append(SOURCE, null, "a");
        append(SOURCE, root, "b");
        db.upsertBranch(new Branch(SOURCE, "main", root.id(), 1));
        Snippet other = append("other", null, "x");

        assertEquals(2, lifecycle.deleteStory(SOURCE));

        assertTrue(db.getSnippetsForStory(SOURCE).isEmpty());
        assertTrue(db.getBranches(SOURCE).isEmpty());
        assertNotNull(db.getSnippet(other.id()));
        verify(eventBus).post(new StoryDeletedEvent(SOURCE, 2, 1));
    }

    @Test
    void deleteStory_unknownStoryShouldBeNoOp() {
        assertEquals(0, lifecycle.deleteStory("ghost"));
        verify(eventBus, never()).post(any());
    }

    @Test
    void truncateStory_shouldLeaveSingleEmptyRoot() {
        Snippet root = append(SOURCE, null, "a");
        append(SOURCE, root, "b");
        db.upsertBranch(new Branch(SOURCE, "main", root.id(), 1));

        Snippet fresh = lifecycle.truncateStory(SOURCE);

        List<Snippet> remaining = db.getSnippetsForStory(SOURCE);
        assertEquals(List.of(fresh), remaining);
        assertTrue(fresh.isRoot());
        assertEquals("", fresh.content());
        assertEquals(SnippetKind.USER, fresh.kind());
        assertTrue(db.getBranches(SOURCE).isEmpty());
    }

    @Test
    void truncateStory_shouldAnnounceRemovedContents() {
        Snippet root = append(SOURCE, null, "a");
        append(SOURCE, root, "b");
        db.upsertBranch(new Branch(SOURCE, "main", root.id(), 1));

        lifecycle.truncateStory(SOURCE);

        verify(eventBus).post(new StoryDeletedEvent(SOURCE, 2, 1));
    }

    @Test
    void truncateStory_emptyStoryShouldOnlyCreateRoot() {
        Snippet fresh = lifecycle.truncateStory("blank");

        assertEquals(List.of(fresh), db.getSnippetsForStory("blank"));
        verify(eventBus, never()).post(any(StoryDeletedEvent.class));
    }

    @Test
    void purgeAll_shouldRemoveEveryStory() {
        append(SOURCE, null, "a");
        append("other", null, "b");

        assertEquals(2, lifecycle.purgeAll());
        assertTrue(graph.listStories().isEmpty());
    }

    // -- Duplicate all --

    @Test
    void duplicateStoryAll_shouldCopyStructureWithFreshIds() {
        Snippet a = append(SOURCE, null, "a");
        Snippet b = append(SOURCE, a, "b");
        Snippet alt = append(SOURCE, a, "alt");
        db.upsertBranch(new Branch(SOURCE, "main", b.id(), 7));
        db.upsertBranch(new Branch(SOURCE, "side", alt.id(), 9));

        Map<String, String> ids = lifecycle.duplicateStoryAll(SOURCE, TARGET);

        assertEquals(3, ids.size());
        assertTrue(ids.values().stream().noneMatch(ids::containsKey));

        Snippet copiedA = db.getSnippet(ids.get(a.id()));
        Snippet copiedB = db.getSnippet(ids.get(b.id()));
        assertEquals(TARGET, copiedA.story());
        assertEquals(ids.get(b.id()), copiedA.childId());
        assertEquals(copiedA.id(), copiedB.parentId());
        assertEquals(a.createdAt(), copiedA.createdAt());

        Branch main = db.getBranch(TARGET, "main");
        assertEquals(ids.get(b.id()), main.headId());
        assertEquals(7, main.createdAt());
        assertEquals(ids.get(alt.id()), db.getBranch(TARGET, "side").headId());

        assertEquals("a\n\nb", GraphStore.buildText(graph.mainPath(TARGET)));
        assertEquals(3, db.getSnippetsForStory(SOURCE).size());
    }

    @Test
    void duplicateStoryAll_shouldSkipDetachedSnippets() {
        Snippet a = append(SOURCE, null, "a");
        Snippet b = append(SOURCE, a, "b");
        Snippet c = append(SOURCE, b, "c");
        db.updateParent(b.id(), "ghost");

        Map<String, String> ids = lifecycle.duplicateStoryAll(SOURCE, TARGET);

        assertEquals(Map.of(a.id(), ids.get(a.id())), ids);
        assertNull(db.getSnippet(ids.get(a.id())).childId());
        assertFalse(ids.containsKey(c.id()));
    }

    @Test
    void duplicateStoryAll_shouldPublishMapping() {
        append(SOURCE, null, "a");

        Map<String, String> ids = lifecycle.duplicateStoryAll(SOURCE, TARGET);

        ArgumentCaptor<StoryDuplicatedEvent> captor = ArgumentCaptor.forClass(StoryDuplicatedEvent.class);
        verify(eventBus).post(captor.capture());
        assertTrue(captor.getValue().fullGraph());
        assertEquals(ids, captor.getValue().idMapping());
    }

    @Test
    void duplicateStory_shouldRejectInvalidArguments() {
        append(SOURCE, null, "a");
        append(TARGET, null, "taken");

        assertThrows(NotFoundException.class, () -> lifecycle.duplicateStoryAll("ghost", "fresh"));
        assertThrows(StructuralViolationException.class, () -> lifecycle.duplicateStoryAll(SOURCE, SOURCE));
        assertThrows(StructuralViolationException.class, () -> lifecycle.duplicateStoryAll(SOURCE, TARGET));
        assertThrows(IllegalArgumentException.class, () -> lifecycle.duplicateStoryMain(SOURCE, " "));
        assertEquals(1, db.getSnippetsForStory(TARGET).size());
    }

    // -- Duplicate main --

    @Test
    void duplicateStoryMain_shouldCopyLinearMainPathOnly() {
        Snippet a = append(SOURCE, null, "a");
        Snippet b = append(SOURCE, a, "b");
        Snippet alt = append(SOURCE, a, "alt");
        Snippet c = append(SOURCE, b, "c");

        Map<String, String> ids = lifecycle.duplicateStoryMain(SOURCE, TARGET);

        assertEquals(3, ids.size());
        assertFalse(ids.containsKey(alt.id()));
        List<Snippet> copied = graph.mainPath(TARGET);
        assertEquals("a\n\nb\n\nc", GraphStore.buildText(copied));
        assertEquals(ids.get(c.id()), db.getBranch(TARGET, "main").headId());
        for (Snippet s : copied) {
            assertTrue(graph.listChildren(TARGET, s.id()).size() <= 1);
        }
    }

    @Test
    void duplicateStoryMain_shouldFollowActiveChoices() {
        Snippet a = append(SOURCE, null, "a");
        append(SOURCE, a, "b");
        Snippet alt = append(SOURCE, a, "alt");
        graph.chooseActiveChild(SOURCE, a.id(), alt.id());

        lifecycle.duplicateStoryMain(SOURCE, TARGET);

        assertEquals("a\n\nalt", GraphStore.buildText(graph.mainPath(TARGET)));
    }

    @Test
    void duplicates_shouldReproduceSourceMainPathText() {
        Snippet a = append(SOURCE, null, "Once");
        Snippet b = append(SOURCE, a, "upon");
        append(SOURCE, a, "beyond");
        append(SOURCE, b, "a time");
        String expected = GraphStore.buildText(graph.mainPath(SOURCE));

        lifecycle.duplicateStoryMain(SOURCE, "main-copy");
        lifecycle.duplicateStoryAll(SOURCE, "full-copy");

        assertEquals(expected, GraphStore.buildText(graph.mainPath("main-copy")));
        assertEquals(expected, GraphStore.buildText(graph.mainPath("full-copy")));
    }

    private Snippet append(String story, Snippet parent, String content) {
        return graph.createSnippet(story, content, SnippetKind.USER, parent != null ? parent.id() : null, null);
    }
}
