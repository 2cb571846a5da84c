package de.bsommerfeld.storygraph.db;

import de.bsommerfeld.storygraph.core.domain.Branch;
import de.bsommerfeld.storygraph.core.domain.Snippet;
import de.bsommerfeld.storygraph.core.domain.SnippetKind;

import java.util.List;
import java.util.function.Supplier;

/**
 * Row-level persistence contract for the two tables of the story graph,
 * {@code snippets} and {@code branches}. Implementations know nothing about
 * graph invariants: they select, insert, update, and delete rows by equality
 * filters and leave structure to the graph engine.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlDatabaseService}, SQLite on disk for production</li>
 * <li>{@link InMemoryDatabaseService}, insertion-ordered maps for TEST mode
 * and unit tests</li>
 * </ul>
 *
 * <p>
 * All implementations must be thread-safe. Single operations are atomic;
 * multi-step mutations are made atomic by wrapping them in
 * {@link #inTransaction(Supplier)}.
 *
 * <h3>Ordering</h3>
 * Wherever an order is specified, ties on {@code created_at} are broken by
 * insertion order so that rows created within the same millisecond still
 * sort deterministically.
 */
public interface DatabaseService {

    // -- Snippets --

    /**
     * Returns the snippet with the given id in any story, or {@code null}.
     */
    Snippet getSnippet(String id);

    /**
     * Returns every snippet of a story, oldest first.
     */
    List<Snippet> getSnippetsForStory(String story);

    /**
     * Returns the snippets whose {@code parent_id} is {@code parentId},
     * oldest first.
     */
    List<Snippet> getChildren(String story, String parentId);

    /**
     * Returns the parentless snippets of a story, newest first. A healthy
     * story has exactly one.
     */
    List<Snippet> getRoots(String story);

    /**
     * Returns the snippets whose active-child pointer designates
     * {@code childId}, oldest first. Used to recover lineage when a
     * {@code parent_id} reference is broken.
     */
    List<Snippet> getSnippetsWithActiveChild(String story, String childId);

    void insertSnippet(Snippet snippet);

    /**
     * Inserts all rows atomically. Semantics equal calling
     * {@link #insertSnippet} for each entry in order.
     */
    void insertSnippetsBatch(List<Snippet> snippets);

    /**
     * Overwrites {@code content} and/or {@code kind}; a {@code null} argument
     * leaves that column unchanged.
     *
     * @return number of affected rows (0 or 1)
     */
    int updateSnippetFields(String id, String content, SnippetKind kind);

    /**
     * @return number of affected rows (0 or 1)
     */
    int updateParent(String id, String parentId);

    /**
     * @return number of affected rows (0 or 1)
     */
    int updateActiveChild(String id, String childId);

    /**
     * @return number of deleted rows (0 or 1)
     */
    int deleteSnippet(String id);

    /**
     * @return number of deleted snippets
     */
    int deleteSnippetsForStory(String story);

    /**
     * Returns the distinct story names that own at least one snippet,
     * alphabetically.
     */
    List<String> listStories();

    // -- Branches --

    /**
     * Returns the branch {@code (story, name)} or {@code null}.
     */
    Branch getBranch(String story, String name);

    /**
     * Returns all branches of a story, most recently created first.
     */
    List<Branch> getBranches(String story);

    /**
     * Returns the branches of a story whose head is {@code headId}.
     */
    List<Branch> getBranchesByHead(String story, String headId);

    /**
     * Creates the branch or, when {@code (story, name)} already exists, moves
     * its head. The original {@code created_at} is preserved on conflict.
     */
    void upsertBranch(Branch branch);

    /**
     * @return number of deleted rows (0 or 1)
     */
    int deleteBranch(String story, String name);

    /**
     * @return number of deleted branches
     */
    int deleteBranchesForStory(String story);

    // -- Maintenance --

    /**
     * Removes every snippet and branch of every story.
     *
     * @return number of deleted snippets
     */
    int deleteAll();

    /**
     * Runs {@code work} as one atomic unit: either every write it performs
     * becomes visible or none does. A nested call joins the enclosing unit.
     * Any exception thrown by {@code work} rolls back and is rethrown.
     */
    <T> T inTransaction(Supplier<T> work);

    default void runInTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }
}
