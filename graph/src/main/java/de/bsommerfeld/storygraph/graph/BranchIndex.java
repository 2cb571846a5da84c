package de.bsommerfeld.storygraph.graph;

import com.google.common.base.Preconditions;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.storygraph.core.domain.Branch;
import de.bsommerfeld.storygraph.core.domain.Snippet;
import de.bsommerfeld.storygraph.core.event.StoryEventBus;
import de.bsommerfeld.storygraph.core.event.StoryEvents.BranchRepairedEvent;
import de.bsommerfeld.storygraph.db.DatabaseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named pointers into a story's graph, plus the integrity checks that keep
 * them readable.
 *
 * <p>
 * Validation never throws for corruption: a head that cannot be walked back
 * to a root is reported through {@link BranchValidation}. Repair walks back
 * to the nearest snippet that does resolve and moves the branch there.
 */
@Singleton
public class BranchIndex {

    private static final Logger LOG = LoggerFactory.getLogger(BranchIndex.class);

    private final DatabaseService db;
    private final StoryEventBus eventBus;

    @Inject
    public BranchIndex(DatabaseService db, StoryEventBus eventBus) {
        this.db = db;
        this.eventBus = eventBus;
    }

    // -- CRUD --

    /**
     * Creates the branch or moves its head. The creation time of an existing
     * branch is kept.
     *
     * @throws NotFoundException if {@code headId} is not a snippet of {@code story}
     */
    public Branch upsertBranch(String story, String name, String headId) {
        Preconditions.checkArgument(name != null && !name.isBlank(), "branch name must not be blank");
        return db.inTransaction(() -> {
            Snippet head = headId != null ? db.getSnippet(headId) : null;
            if (head == null || !head.belongsTo(story)) {
                throw new NotFoundException("Head not found for story '" + story + "': " + headId);
            }
            db.upsertBranch(new Branch(story, name, headId, System.currentTimeMillis()));
            LOG.debug("Branch {}/{} -> {}", story, name, headId);
            return db.getBranch(story, name);
        });
    }

    public Optional<Branch> getBranch(String story, String name) {
        return Optional.ofNullable(db.getBranch(story, name));
    }

    /** Most recently created first. */
    public List<Branch> listBranches(String story) {
        return db.getBranches(story);
    }

    /**
     * @return {@code false} if the branch did not exist
     */
    public boolean deleteBranch(String story, String name) {
        return db.deleteBranch(story, name) > 0;
    }

    // -- Integrity --

    /**
     * Walks {@code parentId} from {@code headId}. Valid when a root is
     * reached without revisiting a snippet.
     */
    public BranchValidation validateBranchHead(String story, String headId) {
        Snippet cursor = headId != null ? db.getSnippet(headId) : null;
        if (cursor == null || !cursor.belongsTo(story)) {
            return BranchValidation.corrupted(CorruptionReason.HEAD_NOT_FOUND);
        }

        Set<String> visited = new HashSet<>();
        while (true) {
            if (!visited.add(cursor.id())) {
                return BranchValidation.corrupted(CorruptionReason.CYCLE_DETECTED);
            }
            if (cursor.isRoot()) {
                return BranchValidation.ok();
            }
            Snippet parent = db.getSnippet(cursor.parentId());
            if (parent == null || !parent.belongsTo(story)) {
                return BranchValidation.corrupted(CorruptionReason.DANGLING_PARENT);
            }
            cursor = parent;
        }
    }

    /**
     * Moves the branch to the nearest predecessor of its head that validates.
     * A predecessor is the parent, or, when the parent link is broken or
     * loops back, the snippet whose active child is the current one.
     *
     * @return the new head, the unchanged head if it was valid, or empty when
     *         the branch is unknown or nothing on the way back validates
     */
    public Optional<String> repairBranchHead(String story, String name) {
        Branch branch = db.getBranch(story, name);
        if (branch == null) {
            LOG.warn("Cannot repair unknown branch {}/{}", story, name);
            return Optional.empty();
        }

        Optional<String> repaired = db.inTransaction(() -> {
            Snippet cursor = db.getSnippet(branch.headId());
            if (cursor == null || !cursor.belongsTo(story)) {
                return Optional.empty();
            }
            Set<String> visited = new HashSet<>();
            while (cursor != null && visited.add(cursor.id())) {
                if (validateBranchHead(story, cursor.id()).valid()) {
                    if (!cursor.id().equals(branch.headId())) {
                        db.upsertBranch(branch.withHead(cursor.id()));
                    }
                    return Optional.of(cursor.id());
                }
                cursor = predecessor(story, cursor, visited);
            }
            return Optional.empty();
        });

        if (repaired.isEmpty()) {
            LOG.warn("Repair of {}/{} found no valid ancestor of {}", story, name, branch.headId());
        } else if (!repaired.get().equals(branch.headId())) {
            LOG.info("Repaired {}/{}: {} -> {}", story, name, branch.headId(), repaired.get());
            eventBus.post(new BranchRepairedEvent(story, name, branch.headId(), repaired.get()));
        }
        return repaired;
    }

    private Snippet predecessor(String story, Snippet node, Set<String> visited) {
        if (!node.isRoot()) {
            Snippet parent = db.getSnippet(node.parentId());
            if (parent != null && parent.belongsTo(story) && !visited.contains(parent.id())) {
                return parent;
            }
        }
        for (Snippet pointing : db.getSnippetsWithActiveChild(story, node.id())) {
            if (!visited.contains(pointing.id())) {
                return pointing;
            }
        }
        return null;
    }

    /**
     * Validates every branch of {@code story} and counts its roots.
     */
    public BranchHealthReport checkHealth(String story) {
        Map<String, BranchValidation> results = new LinkedHashMap<>();
        boolean healthy = true;
        for (Branch branch : db.getBranches(story)) {
            BranchValidation validation = validateBranchHead(story, branch.headId());
            results.put(branch.name(), validation);
            healthy &= validation.valid();
        }
        int roots = db.getRoots(story).size();
        if (roots > 1) {
            LOG.warn("Story '{}' has {} roots", story, roots);
        }
        return new BranchHealthReport(story, healthy && roots <= 1, roots, results);
    }
}
