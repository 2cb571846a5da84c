package de.bsommerfeld.storygraph.db;

import com.google.inject.Singleton;
import de.bsommerfeld.storygraph.core.domain.Branch;
import de.bsommerfeld.storygraph.core.domain.Snippet;
import de.bsommerfeld.storygraph.core.domain.SnippetKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * In-memory {@link DatabaseService} for TEST mode and unit tests. No disk
 * I/O, nothing survives the JVM.
 *
 * <p>
 * Rows are kept in insertion-ordered maps, which stands in for SQLite's
 * {@code rowid} when breaking ties on {@code created_at}. Replacing a row
 * keeps its position, the same way an SQL {@code UPDATE} keeps the rowid.
 *
 * <h3>Threading and transactions</h3>
 * Every method synchronizes on the instance. {@link #inTransaction} holds the
 * monitor for the whole unit, so other threads never observe a half-applied
 * mutation, and restores a snapshot of both tables if the unit throws.
 */
@Singleton
public class InMemoryDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryDatabaseService.class);

    private final Map<String, Snippet> snippets = new LinkedHashMap<>();
    private final Map<BranchKey, Branch> branches = new LinkedHashMap<>();
    private boolean transactionActive;

    private record BranchKey(String story, String name) {
    }

    public InMemoryDatabaseService() {
        LOG.debug("In-memory story store created; nothing will be persisted.");
    }

    // -- Transactions --

    @Override
    public synchronized <T> T inTransaction(Supplier<T> work) {
        if (transactionActive) {
            return work.get();
        }

        Map<String, Snippet> snippetSnapshot = new LinkedHashMap<>(snippets);
        Map<BranchKey, Branch> branchSnapshot = new LinkedHashMap<>(branches);
        transactionActive = true;
        try {
            return work.get();
        } catch (RuntimeException | Error e) {
            snippets.clear();
            snippets.putAll(snippetSnapshot);
            branches.clear();
            branches.putAll(branchSnapshot);
            LOG.debug("Transaction rolled back: {}", e.getMessage());
            throw e;
        } finally {
            transactionActive = false;
        }
    }

    // -- Snippets --

    @Override
    public synchronized Snippet getSnippet(String id) {
        return snippets.get(id);
    }

    @Override
    public synchronized List<Snippet> getSnippetsForStory(String story) {
        return oldestFirst(s -> s.story().equals(story));
    }

    @Override
    public synchronized List<Snippet> getChildren(String story, String parentId) {
        return oldestFirst(s -> s.story().equals(story) && parentId != null && parentId.equals(s.parentId()));
    }

    @Override
    public synchronized List<Snippet> getRoots(String story) {
        List<Snippet> roots = snippets.values().stream()
                .filter(s -> s.story().equals(story) && s.parentId() == null)
                .collect(Collectors.toCollection(ArrayList::new));
        Collections.reverse(roots);
        roots.sort(Comparator.comparingLong(Snippet::createdAt).reversed());
        return roots;
    }

    @Override
    public synchronized List<Snippet> getSnippetsWithActiveChild(String story, String childId) {
        return oldestFirst(s -> s.story().equals(story) && childId != null && childId.equals(s.childId()));
    }

    /** Filters rows and sorts them by creation time; the sort is stable. */
    private List<Snippet> oldestFirst(Predicate<Snippet> filter) {
        return snippets.values().stream()
                .filter(filter)
                .sorted(Comparator.comparingLong(Snippet::createdAt))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void insertSnippet(Snippet snippet) {
        if (snippets.containsKey(snippet.id())) {
            throw new StorageException("Duplicate snippet id: " + snippet.id());
        }
        snippets.put(snippet.id(), snippet);
    }

    @Override
    public synchronized void insertSnippetsBatch(List<Snippet> batch) {
        if (batch == null || batch.isEmpty())
            return;
        runInTransaction(() -> batch.forEach(this::insertSnippet));
    }

    @Override
    public synchronized int updateSnippetFields(String id, String content, SnippetKind kind) {
        Snippet s = snippets.get(id);
        if (s == null)
            return 0;
        snippets.put(id, new Snippet(s.id(), s.story(), s.parentId(), s.childId(),
                kind != null ? kind : s.kind(),
                content != null ? content : s.content(),
                s.createdAt()));
        return 1;
    }

    @Override
    public synchronized int updateParent(String id, String parentId) {
        Snippet s = snippets.get(id);
        if (s == null)
            return 0;
        snippets.put(id, s.withParentId(parentId));
        return 1;
    }

    @Override
    public synchronized int updateActiveChild(String id, String childId) {
        Snippet s = snippets.get(id);
        if (s == null)
            return 0;
        snippets.put(id, s.withChildId(childId));
        return 1;
    }

    @Override
    public synchronized int deleteSnippet(String id) {
        return snippets.remove(id) != null ? 1 : 0;
    }

    @Override
    public synchronized int deleteSnippetsForStory(String story) {
        return removeMatching(snippets.values().iterator(), s -> s.story().equals(story));
    }

    @Override
    public synchronized List<String> listStories() {
        TreeSet<String> stories = new TreeSet<>();
        snippets.values().forEach(s -> stories.add(s.story()));
        return new ArrayList<>(stories);
    }

    // -- Branches --

    @Override
    public synchronized Branch getBranch(String story, String name) {
        return branches.get(new BranchKey(story, name));
    }

    @Override
    public synchronized List<Branch> getBranches(String story) {
        return newestFirst(b -> b.story().equals(story));
    }

    @Override
    public synchronized List<Branch> getBranchesByHead(String story, String headId) {
        return newestFirst(b -> b.story().equals(story) && b.headId().equals(headId));
    }

    private List<Branch> newestFirst(Predicate<Branch> filter) {
        List<Branch> result = branches.values().stream()
                .filter(filter)
                .collect(Collectors.toCollection(ArrayList::new));
        Collections.reverse(result);
        result.sort(Comparator.comparingLong(Branch::createdAt).reversed());
        return result;
    }

    @Override
    public synchronized void upsertBranch(Branch branch) {
        BranchKey key = new BranchKey(branch.story(), branch.name());
        Branch existing = branches.get(key);
        branches.put(key, existing != null ? existing.withHead(branch.headId()) : branch);
    }

    @Override
    public synchronized int deleteBranch(String story, String name) {
        return branches.remove(new BranchKey(story, name)) != null ? 1 : 0;
    }

    @Override
    public synchronized int deleteBranchesForStory(String story) {
        return removeMatching(branches.values().iterator(), b -> b.story().equals(story));
    }

    // -- Maintenance --

    @Override
    public synchronized int deleteAll() {
        int count = snippets.size();
        snippets.clear();
        branches.clear();
        return count;
    }

    private static <T> int removeMatching(Iterator<T> it, Predicate<T> filter) {
        int removed = 0;
        while (it.hasNext()) {
            if (filter.test(it.next())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }
}
