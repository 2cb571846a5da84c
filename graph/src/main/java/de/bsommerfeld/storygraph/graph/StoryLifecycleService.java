package de.bsommerfeld.storygraph.graph;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.storygraph.core.config.BranchConfig;
import de.bsommerfeld.storygraph.core.domain.Branch;
import de.bsommerfeld.storygraph.core.domain.Snippet;
import de.bsommerfeld.storygraph.core.domain.SnippetKind;
import de.bsommerfeld.storygraph.core.event.StoryEventBus;
import de.bsommerfeld.storygraph.core.event.StoryEvents.StoryDeletedEvent;
import de.bsommerfeld.storygraph.core.event.StoryEvents.StoryDuplicatedEvent;
import de.bsommerfeld.storygraph.core.util.SnippetIds;
import de.bsommerfeld.storygraph.db.DatabaseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Whole-story operations: delete, truncate, duplicate, purge.
 */
@Singleton
public class StoryLifecycleService {

    private static final Logger LOG = LoggerFactory.getLogger(StoryLifecycleService.class);

    private final DatabaseService db;
    private final GraphStore graphStore;
    private final BranchConfig branchConfig;
    private final StoryEventBus eventBus;

    @Inject
    public StoryLifecycleService(DatabaseService db, GraphStore graphStore, BranchConfig branchConfig,
            StoryEventBus eventBus) {
        this.db = db;
        this.graphStore = graphStore;
        this.branchConfig = branchConfig;
        this.eventBus = eventBus;
    }

    /**
     * Removes every snippet and branch of {@code story}. Deleting an unknown
     * story is a no-op.
     *
     * @return number of snippets removed
     */
    public int deleteStory(String story) {
        int[] counts = db.inTransaction(() -> {
            int branches = db.deleteBranchesForStory(story);
            int snippets = db.deleteSnippetsForStory(story);
            return new int[] { snippets, branches };
        });
        if (counts[0] > 0 || counts[1] > 0) {
            LOG.info("Deleted story '{}' ({} snippets, {} branches)", story, counts[0], counts[1]);
            eventBus.post(new StoryDeletedEvent(story, counts[0], counts[1]));
        }
        return counts[0];
    }

    /**
     * Replaces the story's contents with a single empty root. The removed
     * contents are announced with a {@link StoryDeletedEvent} once the new
     * root is committed.
     *
     * @return the new root
     */
    public Snippet truncateStory(String story) {
        Truncation truncation = db.inTransaction(() -> {
            int branches = db.deleteBranchesForStory(story);
            int snippets = db.deleteSnippetsForStory(story);
            Snippet root = graphStore.createSnippet(story, "", SnippetKind.USER, null, null);
            return new Truncation(root, snippets, branches);
        });
        Snippet root = truncation.root();
        LOG.info("Truncated story '{}' to root {} ({} snippets, {} branches removed)",
                story, root.id(), truncation.snippets(), truncation.branches());
        if (truncation.snippets() > 0 || truncation.branches() > 0) {
            eventBus.post(new StoryDeletedEvent(story, truncation.snippets(), truncation.branches()));
        }
        return root;
    }

    private record Truncation(Snippet root, int snippets, int branches) {
    }

    /**
     * Copies every snippet reachable from a root of {@code source} into the
     * empty story {@code target}, keeping creation times. Branches whose
     * heads were copied are copied as well.
     *
     * @return source id to target id for every copied snippet
     */
    public ImmutableMap<String, String> duplicateStoryAll(String source, String target) {
        ImmutableMap<String, String> mapping = db.inTransaction(() -> {
            checkDuplication(source, target);
            List<Snippet> reachable = reachableFromRoots(source);

            Map<String, String> ids = new LinkedHashMap<>();
            reachable.forEach(s -> ids.put(s.id(), SnippetIds.newId()));

            List<Snippet> copies = new ArrayList<>(reachable.size());
            for (Snippet s : reachable) {
                copies.add(s.copyInto(ids.get(s.id()), target, remap(ids, s.parentId()), remap(ids, s.childId())));
            }
            db.insertSnippetsBatch(copies);
            copyBranches(source, target, ids);
            return ImmutableMap.copyOf(ids);
        });
        return announce(source, target, true, mapping);
    }

    /**
     * Copies only the main path of {@code source} into the empty story
     * {@code target} as a linear chain and points the default branch at its
     * tip, unless a copied branch of that name already exists.
     */
    public ImmutableMap<String, String> duplicateStoryMain(String source, String target) {
        ImmutableMap<String, String> mapping = db.inTransaction(() -> {
            checkDuplication(source, target);
            List<Snippet> path = graphStore.mainPath(source);
            if (path.isEmpty()) {
                throw new NotFoundException("Story has no root: " + source);
            }

            Map<String, String> ids = new LinkedHashMap<>();
            path.forEach(s -> ids.put(s.id(), SnippetIds.newId()));

            List<Snippet> copies = new ArrayList<>(path.size());
            for (int i = 0; i < path.size(); i++) {
                Snippet s = path.get(i);
                String parent = i > 0 ? ids.get(path.get(i - 1).id()) : null;
                String child = i < path.size() - 1 ? ids.get(path.get(i + 1).id()) : null;
                copies.add(s.copyInto(ids.get(s.id()), target, parent, child));
            }
            db.insertSnippetsBatch(copies);
            copyBranches(source, target, ids);

            String defaultName = branchConfig.getDefaultName();
            if (db.getBranch(target, defaultName) == null) {
                String tip = copies.get(copies.size() - 1).id();
                db.upsertBranch(new Branch(target, defaultName, tip, System.currentTimeMillis()));
            }
            return ImmutableMap.copyOf(ids);
        });
        return announce(source, target, false, mapping);
    }

    /**
     * Deletes every story. Irreversible.
     */
    public int purgeAll() {
        int removed = db.deleteAll();
        LOG.warn("Purged all stories ({} snippets)", removed);
        return removed;
    }

    // -- Helpers --

    private void checkDuplication(String source, String target) {
        Preconditions.checkArgument(source != null && !source.isBlank(), "source must not be blank");
        Preconditions.checkArgument(target != null && !target.isBlank(), "target must not be blank");
        if (source.equals(target)) {
            throw new StructuralViolationException("Cannot duplicate story '" + source + "' onto itself");
        }
        if (db.getSnippetsForStory(source).isEmpty()) {
            throw new NotFoundException("Story not found: " + source);
        }
        if (!db.getSnippetsForStory(target).isEmpty()) {
            throw new StructuralViolationException("Target story already exists: " + target);
        }
    }

    /**
     * Snippets reachable from any root through parent links, oldest first.
     * Detached rows (dangling parent, cycles) are left behind.
     */
    private List<Snippet> reachableFromRoots(String story) {
        List<Snippet> all = db.getSnippetsForStory(story);
        Map<String, List<Snippet>> byParent = new HashMap<>();
        Deque<Snippet> queue = new ArrayDeque<>();
        for (Snippet s : all) {
            if (s.isRoot()) {
                queue.add(s);
            } else {
                byParent.computeIfAbsent(s.parentId(), k -> new ArrayList<>()).add(s);
            }
        }

        Set<String> reachable = new HashSet<>();
        while (!queue.isEmpty()) {
            Snippet next = queue.poll();
            if (reachable.add(next.id())) {
                queue.addAll(byParent.getOrDefault(next.id(), List.of()));
            }
        }

        List<Snippet> result = new ArrayList<>(reachable.size());
        for (Snippet s : all) {
            if (reachable.contains(s.id())) {
                result.add(s);
            }
        }
        if (result.size() < all.size()) {
            LOG.warn("Story '{}': {} detached snippets not copied", story, all.size() - result.size());
        }
        return result;
    }

    /** Copies branches oldest first so the target keeps their relative order. */
    private void copyBranches(String source, String target, Map<String, String> ids) {
        for (Branch branch : Lists.reverse(db.getBranches(source))) {
            String head = ids.get(branch.headId());
            if (head != null) {
                db.upsertBranch(new Branch(target, branch.name(), head, branch.createdAt()));
            }
        }
    }

    private static String remap(Map<String, String> ids, String id) {
        return id != null ? ids.get(id) : null;
    }

    private ImmutableMap<String, String> announce(String source, String target, boolean fullGraph,
            ImmutableMap<String, String> mapping) {
        LOG.info("Duplicated story '{}' -> '{}' ({} snippets, {})", source, target, mapping.size(),
                fullGraph ? "full graph" : "main path");
        eventBus.post(new StoryDuplicatedEvent(source, target, fullGraph, mapping));
        return mapping;
    }
}
