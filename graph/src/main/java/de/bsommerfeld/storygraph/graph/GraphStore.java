package de.bsommerfeld.storygraph.graph;

import com.google.common.base.Preconditions;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.storygraph.core.domain.Branch;
import de.bsommerfeld.storygraph.core.domain.Snippet;
import de.bsommerfeld.storygraph.core.domain.SnippetKind;
import de.bsommerfeld.storygraph.core.event.StoryEventBus;
import de.bsommerfeld.storygraph.core.event.StoryEvents.BranchRemovedEvent;
import de.bsommerfeld.storygraph.core.event.StoryEvents.SnippetDeletedEvent;
import de.bsommerfeld.storygraph.core.util.SnippetIds;
import de.bsommerfeld.storygraph.db.DatabaseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Structural operations on a story's snippet graph.
 *
 * <p>
 * Every multi-row edit runs inside one {@link DatabaseService#inTransaction}
 * unit, so a failure leaves the graph exactly as it was. Branch side effects
 * of a deletion are computed from the state before the edit and applied last.
 * Events are posted only after the unit has committed.
 *
 * <h3>Active path</h3>
 * A snippet's {@code childId} selects its active continuation. Following it
 * from the canonical root yields the {@link #mainPath main path}. When
 * {@code setActive} is {@code false} on a splice, the old parent keeps
 * pointing at the spliced-under snippet, so the main path bypasses the new
 * snippet until it is chosen with {@link #chooseActiveChild}.
 *
 * <h3>Roots</h3>
 * A story should have one root. Legacy data may carry several; the most
 * recently created root is canonical and a warning is logged.
 */
@Singleton
public class GraphStore {

    private static final Logger LOG = LoggerFactory.getLogger(GraphStore.class);

    private static final String PARAGRAPH_SEPARATOR = "\n\n";

    private final DatabaseService db;
    private final StoryEventBus eventBus;

    @Inject
    public GraphStore(DatabaseService db, StoryEventBus eventBus) {
        this.db = db;
        this.eventBus = eventBus;
    }

    // =====================================================================
    // Reads
    // =====================================================================

    /**
     * Returns the snippet with {@code id} in {@code story}.
     *
     * @throws NotFoundException if no such snippet exists in the story
     */
    public Snippet getSnippet(String story, String id) {
        Snippet snippet = id != null ? db.getSnippet(id) : null;
        if (snippet == null || !snippet.belongsTo(story)) {
            throw new NotFoundException("Snippet not found: " + id + " (story=" + story + ")");
        }
        return snippet;
    }

    public Optional<Snippet> findSnippet(String id) {
        return id != null ? Optional.ofNullable(db.getSnippet(id)) : Optional.empty();
    }

    /** All children of {@code parentId}, oldest first. */
    public List<Snippet> listChildren(String story, String parentId) {
        return db.getChildren(story, parentId);
    }

    public boolean hasSnippets(String story) {
        return !db.getSnippetsForStory(story).isEmpty();
    }

    public List<String> listStories() {
        return db.listStories();
    }

    /**
     * The most recently created parentless snippet of {@code story}.
     */
    public Optional<Snippet> canonicalRoot(String story) {
        List<Snippet> roots = db.getRoots(story);
        if (roots.isEmpty()) {
            return Optional.empty();
        }
        if (roots.size() > 1) {
            LOG.warn("Story '{}' has {} roots; using most recent {}", story, roots.size(), roots.get(0).id());
        }
        return Optional.of(roots.get(0));
    }

    /**
     * Follows active children from the canonical root until a snippet has no
     * active child. Stops early, with what it has, at a missing snippet, a
     * snippet of another story, or a snippet already on the path.
     *
     * @return the main path in reading order, empty for an empty story
     */
    public List<Snippet> mainPath(String story) {
        Optional<Snippet> root = canonicalRoot(story);
        if (root.isEmpty()) {
            return List.of();
        }

        List<Snippet> path = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Snippet cursor = root.get();
        path.add(cursor);
        visited.add(cursor.id());

        while (cursor.hasActiveChild()) {
            Snippet next = db.getSnippet(cursor.childId());
            if (next == null || !next.belongsTo(story)) {
                LOG.warn("Main path of '{}' stops at {}: active child {} is missing", story, cursor.id(),
                        cursor.childId());
                break;
            }
            if (!visited.add(next.id())) {
                LOG.warn("Main path of '{}' stops at {}: cycle through {}", story, cursor.id(), next.id());
                break;
            }
            path.add(next);
            cursor = next;
        }
        return path;
    }

    /**
     * Walks {@code parentId} from {@code headId} back to a root and returns
     * the chain in reading order. On a missing parent, a parent of another
     * story or a cycle, the chain walked so far is returned. An unknown head
     * yields an empty list.
     */
    public List<Snippet> pathFromHead(String story, String headId) {
        if (headId == null) {
            return List.of();
        }
        Snippet cursor = db.getSnippet(headId);
        if (cursor == null || !cursor.belongsTo(story)) {
            return List.of();
        }

        List<Snippet> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        while (cursor != null && visited.add(cursor.id())) {
            chain.add(cursor);
            if (cursor.isRoot()) {
                break;
            }
            Snippet parent = db.getSnippet(cursor.parentId());
            if (parent == null || !parent.belongsTo(story)) {
                LOG.debug("Path from {} breaks at {}: parent {} unavailable", headId, cursor.id(),
                        cursor.parentId());
                parent = null;
            }
            cursor = parent;
        }
        Collections.reverse(chain);
        return chain;
    }

    /**
     * Joins the non-empty contents of {@code path} with blank lines.
     */
    public static String buildText(List<Snippet> path) {
        return path.stream()
                .map(Snippet::content)
                .filter(content -> !content.isEmpty())
                .collect(Collectors.joining(PARAGRAPH_SEPARATOR));
    }

    // =====================================================================
    // Creation
    // =====================================================================

    /**
     * Creates a snippet under {@code parentId}, or a new root when the parent
     * is {@code null}.
     *
     * @param setActive {@code null} activates the snippet only when the
     *                  parent has no usable active child yet
     * @throws NotFoundException              if the parent does not exist
     * @throws StructuralViolationException if the parent belongs to another story
     */
    public Snippet createSnippet(String story, String content, SnippetKind kind, String parentId,
            Boolean setActive) {
        checkStory(story);
        Preconditions.checkNotNull(kind, "kind");

        return db.inTransaction(() -> {
            Snippet parent = parentId != null ? requireInStory(story, parentId, "Parent") : null;
            if (parent == null && !db.getRoots(story).isEmpty()) {
                LOG.warn("Story '{}' already has a root; the new root becomes canonical", story);
            }

            Snippet created = new Snippet(SnippetIds.newId(), story, parentId, null, kind, content, now());
            db.insertSnippet(created);

            if (parent != null) {
                boolean activate = setActive != null ? setActive : liveActiveChild(parent) == null;
                if (activate) {
                    db.updateActiveChild(parent.id(), created.id());
                }
            }
            LOG.debug("Created snippet {} in '{}' under {}", created.id(), story, parentId);
            return created;
        });
    }

    /**
     * Creates a sibling of {@code targetId}. Regenerating a root creates a
     * new root.
     */
    public Snippet regenerateSnippet(String story, String targetId, String content, SnippetKind kind,
            boolean setActive) {
        return db.inTransaction(() -> {
            Snippet target = requireInStory(story, targetId, "Target");
            return createSnippet(story, content, kind, target.parentId(), setActive);
        });
    }

    /**
     * Makes {@code childId} the active continuation of {@code parentId}.
     *
     * @throws StructuralViolationException if the child's parent is not {@code parentId}
     */
    public void chooseActiveChild(String story, String parentId, String childId) {
        db.runInTransaction(() -> {
            Snippet parent = requireInStory(story, parentId, "Parent");
            Snippet child = requireInStory(story, childId, "Child");
            if (!parent.id().equals(child.parentId())) {
                throw new StructuralViolationException(
                        "Snippet " + childId + " is not a child of " + parentId);
            }
            db.updateActiveChild(parent.id(), child.id());
        });
    }

    // =====================================================================
    // Splicing
    // =====================================================================

    /**
     * Inserts a new snippet between {@code targetId} and its parent. The new
     * snippet takes the target's place under the old parent and its active
     * child is the target. Inserting above a root makes the new snippet the
     * root.
     *
     * @param setActive repoint the old parent's active child to the new
     *                  snippet when it designated the target
     */
    public Snippet insertAbove(String story, String targetId, String content, SnippetKind kind,
            boolean setActive) {
        Preconditions.checkNotNull(kind, "kind");
        return db.inTransaction(() -> {
            Snippet target = requireInStory(story, targetId, "Target");
            String oldParentId = target.parentId();

            Snippet created = new Snippet(SnippetIds.newId(), story, oldParentId, target.id(), kind, content,
                    now());
            db.insertSnippet(created);
            db.updateParent(target.id(), created.id());

            if (setActive && oldParentId != null) {
                Snippet oldParent = db.getSnippet(oldParentId);
                if (oldParent != null && target.id().equals(oldParent.childId())) {
                    db.updateActiveChild(oldParentId, created.id());
                }
            }
            LOG.debug("Inserted {} above {} in '{}'", created.id(), targetId, story);
            return created;
        });
    }

    /**
     * Inserts a new snippet directly under {@code parentId}. If the parent has
     * an active child, that child is re-parented under the new snippet and
     * becomes its active child.
     *
     * @param setActive make the new snippet the parent's active child
     */
    public Snippet insertBelow(String story, String parentId, String content, SnippetKind kind,
            boolean setActive) {
        Preconditions.checkNotNull(kind, "kind");
        return db.inTransaction(() -> {
            Snippet parent = requireInStory(story, parentId, "Parent");
            Snippet formerActive = liveActiveChild(parent);
            String formerActiveId = formerActive != null ? formerActive.id() : null;

            Snippet created = new Snippet(SnippetIds.newId(), story, parent.id(), formerActiveId, kind, content,
                    now());
            db.insertSnippet(created);
            if (formerActiveId != null) {
                db.updateParent(formerActiveId, created.id());
            }
            if (setActive) {
                db.updateActiveChild(parent.id(), created.id());
            }
            LOG.debug("Inserted {} below {} in '{}'", created.id(), parentId, story);
            return created;
        });
    }

    // =====================================================================
    // Edits
    // =====================================================================

    /**
     * Replaces content and/or kind. {@code null} leaves a field unchanged;
     * with both {@code null} the current state is returned untouched.
     *
     * @throws NotFoundException if the snippet does not exist
     */
    public Snippet updateSnippet(String id, String content, SnippetKind kind) {
        return db.inTransaction(() -> {
            Snippet current = findSnippet(id).orElseThrow(() -> new NotFoundException("Snippet not found: " + id));
            if (content == null && kind == null) {
                return current;
            }
            db.updateSnippetFields(id, content, kind);
            return db.getSnippet(id);
        });
    }

    /**
     * Excises a non-root snippet. Its children move up to its parent; the
     * parent's active child becomes the deleted snippet's active child (or
     * oldest child). Branches headed at the deleted snippet move to that
     * replacement and are removed when the snippet had no children.
     *
     * @return {@code false} if the snippet does not exist in {@code story}
     * @throws StructuralViolationException if the snippet is a root
     */
    public boolean deleteSnippet(String story, String id) {
        Deletion deletion = db.inTransaction(() -> excise(story, id));
        if (!deletion.deleted()) {
            return false;
        }

        eventBus.post(new SnippetDeletedEvent(story, id, deletion.replacementId()));
        for (Branch removed : deletion.removedBranches()) {
            eventBus.post(new BranchRemovedEvent(story, removed.name(), id));
        }
        return true;
    }

    private record Deletion(boolean deleted, String replacementId, List<Branch> removedBranches) {

        static final Deletion NONE = new Deletion(false, null, List.of());
    }

    private Deletion excise(String story, String id) {
        Snippet target = id != null ? db.getSnippet(id) : null;
        if (target == null || !target.belongsTo(story)) {
            return Deletion.NONE;
        }
        if (target.isRoot()) {
            throw new StructuralViolationException("Cannot delete root snippet " + id);
        }

        List<Snippet> children = db.getChildren(story, id);
        String replacementId = chooseReplacement(target, children);
        String parentId = target.parentId();
        List<Branch> headed = db.getBranchesByHead(story, id);

        for (Snippet child : children) {
            db.updateParent(child.id(), parentId);
        }
        for (Snippet pointing : db.getSnippetsWithActiveChild(story, id)) {
            db.updateActiveChild(pointing.id(), pointing.id().equals(parentId) ? replacementId : null);
        }
        db.deleteSnippet(id);

        List<Branch> removed = new ArrayList<>();
        for (Branch branch : headed) {
            if (replacementId != null) {
                db.upsertBranch(branch.withHead(replacementId));
            } else {
                db.deleteBranch(story, branch.name());
                removed.add(branch);
            }
        }
        LOG.info("Deleted snippet {} from '{}' ({} children re-parented, {} branches moved, {} removed)",
                id, story, children.size(), headed.size() - removed.size(), removed.size());
        return new Deletion(true, replacementId, removed);
    }

    private static String chooseReplacement(Snippet target, List<Snippet> children) {
        if (children.isEmpty()) {
            return null;
        }
        for (Snippet child : children) {
            if (child.id().equals(target.childId())) {
                return child.id();
            }
        }
        return children.get(0).id();
    }

    // -- Helpers --

    /**
     * Resolves {@code id}, distinguishing a missing snippet from one that
     * belongs to another story.
     */
    private Snippet requireInStory(String story, String id, String role) {
        Snippet snippet = id != null ? db.getSnippet(id) : null;
        if (snippet == null) {
            throw new NotFoundException(role + " not found: " + id);
        }
        if (!snippet.belongsTo(story)) {
            throw new StructuralViolationException(
                    role + " " + id + " belongs to story '" + snippet.story() + "', not '" + story + "'");
        }
        return snippet;
    }

    /**
     * The parent's active child, or {@code null} when the pointer is unset or
     * does not designate an actual child.
     */
    private Snippet liveActiveChild(Snippet parent) {
        if (!parent.hasActiveChild()) {
            return null;
        }
        Snippet child = db.getSnippet(parent.childId());
        if (child == null || !child.belongsTo(parent.story()) || !parent.id().equals(child.parentId())) {
            return null;
        }
        return child;
    }

    private static void checkStory(String story) {
        Preconditions.checkArgument(story != null && !story.isBlank(), "story must not be blank");
    }

    private static long now() {
        return System.currentTimeMillis();
    }
}
