package de.bsommerfeld.storygraph.graph;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.storygraph.core.config.BranchConfig;
import de.bsommerfeld.storygraph.core.domain.Branch;
import de.bsommerfeld.storygraph.core.domain.Snippet;
import de.bsommerfeld.storygraph.core.domain.SnippetKind;
import de.bsommerfeld.storygraph.db.DatabaseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Caller-facing flows that combine a structural edit with the branch update
 * that belongs to it, and the read path that resolves a branch into text.
 *
 * <p>
 * Each write flow is one transaction: a snippet is never created without
 * its branch moving along when it should.
 */
@Singleton
public class StoryService {

    private static final Logger LOG = LoggerFactory.getLogger(StoryService.class);

    private final DatabaseService db;
    private final GraphStore graph;
    private final BranchIndex branches;
    private final BranchConfig branchConfig;

    @Inject
    public StoryService(DatabaseService db, GraphStore graph, BranchIndex branches, BranchConfig branchConfig) {
        this.db = db;
        this.graph = graph;
        this.branches = branches;
        this.branchConfig = branchConfig;
    }

    // =====================================================================
    // Writes
    // =====================================================================

    /**
     * Appends a snippet and, unless {@code setActive} is {@code false}, moves
     * {@code branch} (default when blank) to it.
     */
    public Snippet append(String story, String content, SnippetKind kind, String parentId, Boolean setActive,
            String branch) {
        return db.inTransaction(() -> {
            Snippet created = graph.createSnippet(story, content, kind, parentId, setActive);
            if (!Boolean.FALSE.equals(setActive)) {
                branches.upsertBranch(story, branchConfig.normalize(branch), created.id());
            }
            return created;
        });
    }

    /**
     * Creates an alternate of {@code targetId}; when activated, the branch
     * moves to the alternate.
     */
    public Snippet regenerate(String story, String targetId, String content, SnippetKind kind, boolean setActive,
            String branch) {
        return db.inTransaction(() -> {
            Snippet created = graph.regenerateSnippet(story, targetId, content, kind, setActive);
            if (setActive) {
                branches.upsertBranch(story, branchConfig.normalize(branch), created.id());
            }
            return created;
        });
    }

    /**
     * Activates {@code childId} under {@code parentId} and points the branch
     * at the child.
     */
    public void chooseActive(String story, String parentId, String childId, String branch) {
        db.runInTransaction(() -> {
            graph.chooseActiveChild(story, parentId, childId);
            branches.upsertBranch(story, branchConfig.normalize(branch), childId);
        });
    }

    public Snippet insertAbove(String story, String targetId, String content, SnippetKind kind, boolean setActive) {
        return graph.insertAbove(story, targetId, content, kind, setActive);
    }

    /**
     * Inserts below {@code parentId} and activates the new snippet. A branch
     * headed at the parent advances to it.
     */
    public Snippet insertBelow(String story, String parentId, String content, SnippetKind kind, String branch) {
        String name = branchConfig.normalize(branch);
        return db.inTransaction(() -> {
            boolean parentWasHead = branches.getBranch(story, name)
                    .map(b -> b.headId().equals(parentId))
                    .orElse(false);
            Snippet created = graph.insertBelow(story, parentId, content, kind, true);
            if (parentWasHead) {
                branches.upsertBranch(story, name, created.id());
            }
            return created;
        });
    }

    /**
     * @throws NotFoundException if the snippet is not part of {@code story}
     */
    public Snippet edit(String story, String id, String content, SnippetKind kind) {
        return db.inTransaction(() -> {
            graph.getSnippet(story, id);
            return graph.updateSnippet(id, content, kind);
        });
    }

    /**
     * @throws NotFoundException if the snippet is not part of {@code story}
     */
    public void delete(String story, String id) {
        if (!graph.deleteSnippet(story, id)) {
            throw new NotFoundException("Snippet not found: " + id + " (story=" + story + ")");
        }
    }

    // =====================================================================
    // Reads
    // =====================================================================

    /**
     * Resolves the history to render. An explicit {@code headId} wins;
     * otherwise the named branch is used, with the main path standing in for
     * a missing default branch.
     *
     * <p>
     * A corrupted branch is repaired when repair-on-read is enabled; if that
     * fails the main path is returned. Corruption never fails the read.
     *
     * @throws NotFoundException if a non-default branch does not exist
     */
    public StoryPath resolvePath(String story, String branch, String headId) {
        if (headId != null && !headId.isBlank()) {
            return StoryPath.of(story, graph.pathFromHead(story, headId));
        }

        String name = branchConfig.normalize(branch);
        Optional<Branch> resolved = branches.getBranch(story, name);
        if (resolved.isEmpty()) {
            if (!branchConfig.isDefault(name)) {
                throw new NotFoundException("Branch not found: " + story + "/" + name);
            }
            return StoryPath.of(story, graph.mainPath(story));
        }
        return StoryPath.of(story, branchPath(story, resolved.get()));
    }

    private List<Snippet> branchPath(String story, Branch branch) {
        BranchValidation validation = branches.validateBranchHead(story, branch.headId());
        if (validation.valid()) {
            return graph.pathFromHead(story, branch.headId());
        }

        LOG.warn("Corrupted branch {}/{}: {}", story, branch.name(), validation.describe());
        if (branchConfig.isRepairOnRead()) {
            Optional<String> repaired = branches.repairBranchHead(story, branch.name());
            if (repaired.isPresent()) {
                return graph.pathFromHead(story, repaired.get());
            }
        }
        LOG.warn("Falling back to main path for {}/{}", story, branch.name());
        return graph.mainPath(story);
    }

    /**
     * Each main-path snippet with all of its children, for rendering the
     * alternates at every step.
     */
    public List<TreeRow> mainTree(String story) {
        List<TreeRow> rows = new ArrayList<>();
        for (Snippet node : graph.mainPath(story)) {
            rows.add(new TreeRow(node, graph.listChildren(story, node.id())));
        }
        return rows;
    }
}
