package de.bsommerfeld.storygraph.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.storygraph.core.config.StorageConfig;
import de.bsommerfeld.storygraph.core.domain.Branch;
import de.bsommerfeld.storygraph.core.domain.Snippet;
import de.bsommerfeld.storygraph.core.domain.SnippetKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * SQLite-backed {@link DatabaseService} for production use.
 *
 * <p>
 * All SQL lives in external {@code .sql} files loaded via {@link SqlLoader}.
 * The schema is applied from {@code schema.sql} on every startup; every DDL
 * statement uses {@code IF NOT EXISTS} so it is safe to re-run.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. The exception is {@link #inTransaction}: it binds one connection to
 * the calling thread, and every operation issued by that thread until the
 * unit completes reuses it. This is what lets the graph engine compose
 * single-row operations into atomic structural edits.
 *
 * <p>
 * Transactions begin {@code IMMEDIATE}, so a second writer queues on the
 * busy timeout instead of failing when both have already read.
 *
 * <h3>Ordering</h3>
 * Ties on {@code created_at} are broken by SQLite's implicit {@code rowid},
 * which grows with insertion order. Upserts keep the original rowid.
 *
 * @see SqlLoader
 */
@Singleton
public class SqlDatabaseService implements DatabaseService {

    private static final Logger LOG = LoggerFactory.getLogger(SqlDatabaseService.class);

    /** How long a writer waits for a competing connection's lock. */
    private static final int BUSY_TIMEOUT_MS = 5_000;

    private final String dbUrl;
    private final ThreadLocal<Connection> transaction = new ThreadLocal<>();

    @Inject
    public SqlDatabaseService(StorageConfig config) {
        this(toJdbcUrl(config.resolveDatabaseFile()));
    }

    /**
     * Opens the database at an explicit JDBC URL, e.g. a temporary file in
     * tests.
     */
    public SqlDatabaseService(String dbUrl) {
        this.dbUrl = dbUrl;
        initialize();
    }

    private static String toJdbcUrl(Path file) {
        try {
            Path parent = file.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to create database directory for " + file, e);
        }
        return "jdbc:sqlite:" + file.toAbsolutePath();
    }

    Connection getConnection() throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        // Take the write lock at BEGIN; a deferred read-then-write upgrade fails without waiting.
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        return DriverManager.getConnection(dbUrl, config.toProperties());
    }

    private void initialize() {
        LOG.info("Initializing database at {}", dbUrl);
        try (Connection conn = getConnection()) {
            applySchema(conn);
        } catch (SQLException e) {
            throw new StorageException("Database initialization failed", e);
        }
    }

    private void applySchema(Connection conn) throws SQLException {
        conn.setAutoCommit(false);
        try (Statement stmt = conn.createStatement()) {
            for (String sql : SqlLoader.loadSchema()) {
                stmt.execute(sql);
            }
            conn.commit();
            LOG.info("Database schema applied.");
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        }
    }

    // =====================================================================
    // Transactions
    // =====================================================================

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        if (transaction.get() != null) {
            return work.get();
        }

        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            transaction.set(conn);
            try {
                T result = work.get();
                conn.commit();
                return result;
            } catch (RuntimeException e) {
                rollback(conn, e);
                throw e;
            } finally {
                transaction.remove();
            }
        } catch (SQLException e) {
            throw new StorageException("Transaction failed", e);
        }
    }

    private void rollback(Connection conn, RuntimeException cause) {
        try {
            conn.rollback();
            LOG.debug("Transaction rolled back: {}", cause.getMessage());
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    // =====================================================================
    // Snippet Operations
    // =====================================================================

    @Override
    public Snippet getSnippet(String id) {
        List<Snippet> rows = querySnippets("select-snippet", id);
        return rows.isEmpty() ? null : rows.get(0);
    }

    @Override
    public List<Snippet> getSnippetsForStory(String story) {
        return querySnippets("select-story-snippets", story);
    }

    @Override
    public List<Snippet> getChildren(String story, String parentId) {
        return querySnippets("select-children", story, parentId);
    }

    @Override
    public List<Snippet> getRoots(String story) {
        return querySnippets("select-roots", story);
    }

    @Override
    public List<Snippet> getSnippetsWithActiveChild(String story, String childId) {
        return querySnippets("select-active-parents", story, childId);
    }

    @Override
    public void insertSnippet(Snippet snippet) {
        withConnection("insert snippet " + snippet.id(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-snippet"))) {
                bindSnippet(ps, snippet);
                return ps.executeUpdate();
            }
        });
        LOG.debug("[DB] Inserted snippet {} (story={})", snippet.id(), snippet.story());
    }

    @Override
    public void insertSnippetsBatch(List<Snippet> snippets) {
        if (snippets == null || snippets.isEmpty())
            return;

        inTransaction(() -> withConnection("batch insert snippets", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-snippet"))) {
                for (Snippet s : snippets) {
                    bindSnippet(ps, s);
                    ps.addBatch();
                }
                return ps.executeBatch().length;
            }
        }));
        LOG.debug("[DB] Batch inserted {} snippets.", snippets.size());
    }

    /** Binds all 7 snippet columns in {@code insert-snippet.sql} order. */
    private void bindSnippet(PreparedStatement ps, Snippet s) throws SQLException {
        bind(ps, s.id(), s.story(), s.parentId(), s.childId(), s.kind().value(), s.content(), s.createdAt());
    }

    @Override
    public int updateSnippetFields(String id, String content, SnippetKind kind) {
        return update("update-snippet-fields", content, kind != null ? kind.value() : null, id);
    }

    @Override
    public int updateParent(String id, String parentId) {
        return update("update-snippet-parent", parentId, id);
    }

    @Override
    public int updateActiveChild(String id, String childId) {
        return update("update-snippet-child", childId, id);
    }

    @Override
    public int deleteSnippet(String id) {
        return update("delete-snippet", id);
    }

    @Override
    public int deleteSnippetsForStory(String story) {
        return update("delete-story-snippets", story);
    }

    @Override
    public List<String> listStories() {
        return withConnection("list stories", conn -> {
            List<String> stories = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-stories"));
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    stories.add(rs.getString("story"));
            }
            return stories;
        });
    }

    // =====================================================================
    // Branch Operations
    // =====================================================================

    @Override
    public Branch getBranch(String story, String name) {
        List<Branch> rows = queryBranches("select-branch", story, name);
        return rows.isEmpty() ? null : rows.get(0);
    }

    @Override
    public List<Branch> getBranches(String story) {
        return queryBranches("select-branches", story);
    }

    @Override
    public List<Branch> getBranchesByHead(String story, String headId) {
        return queryBranches("select-branches-by-head", story, headId);
    }

    @Override
    public void upsertBranch(Branch branch) {
        update("upsert-branch", branch.story(), branch.name(), branch.headId(), branch.createdAt());
        LOG.debug("[DB] Branch {}/{} -> {}", branch.story(), branch.name(), branch.headId());
    }

    @Override
    public int deleteBranch(String story, String name) {
        return update("delete-branch", story, name);
    }

    @Override
    public int deleteBranchesForStory(String story) {
        return update("delete-story-branches", story);
    }

    // =====================================================================
    // Maintenance
    // =====================================================================

    @Override
    public int deleteAll() {
        return inTransaction(() -> {
            int branches = update("delete-all-branches");
            int snippets = update("delete-all-snippets");
            LOG.info("[DB] Purged {} snippets and {} branches.", snippets, branches);
            return snippets;
        });
    }

    // =====================================================================
    // JDBC Plumbing
    // =====================================================================

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }

    /**
     * Runs {@code work} on the thread's transaction connection if one is
     * bound, otherwise on a fresh auto-commit connection.
     */
    private <T> T withConnection(String action, SqlWork<T> work) {
        Connection bound = transaction.get();
        if (bound != null) {
            try {
                return work.apply(bound);
            } catch (SQLException e) {
                throw new StorageException("Failed to " + action, e);
            }
        }
        try (Connection conn = getConnection()) {
            return work.apply(conn);
        } catch (SQLException e) {
            throw new StorageException("Failed to " + action, e);
        }
    }

    private int update(String sqlName, Object... params) {
        return withConnection("execute " + sqlName, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
                bind(ps, params);
                return ps.executeUpdate();
            }
        });
    }

    private List<Snippet> querySnippets(String sqlName, Object... params) {
        return withConnection("query " + sqlName, conn -> {
            List<Snippet> rows = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
                bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next())
                        rows.add(mapSnippet(rs));
                }
            }
            return rows;
        });
    }

    private List<Branch> queryBranches(String sqlName, Object... params) {
        return withConnection("query " + sqlName, conn -> {
            List<Branch> rows = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(sqlName))) {
                bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next())
                        rows.add(mapBranch(rs));
                }
            }
            return rows;
        });
    }

    /** Binds positional parameters. Only strings, longs, and nulls occur. */
    private void bind(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            Object value = params[i];
            if (value == null) {
                ps.setNull(i + 1, Types.VARCHAR);
            } else if (value instanceof Long l) {
                ps.setLong(i + 1, l);
            } else {
                ps.setString(i + 1, value.toString());
            }
        }
    }

    private Snippet mapSnippet(ResultSet rs) throws SQLException {
        return new Snippet(
                rs.getString("id"), rs.getString("story"),
                rs.getString("parent_id"), rs.getString("child_id"),
                SnippetKind.of(rs.getString("kind")), rs.getString("content"),
                rs.getLong("created_at"));
    }

    private Branch mapBranch(ResultSet rs) throws SQLException {
        return new Branch(
                rs.getString("story"), rs.getString("name"),
                rs.getString("head_id"), rs.getLong("created_at"));
    }
}
