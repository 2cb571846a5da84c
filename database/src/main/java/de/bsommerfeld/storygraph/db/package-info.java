/**
 * Row store for the story graph: SQLite-backed in production, in-memory in
 * TEST mode and unit tests.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [GraphStore / BranchIndex / StoryLifecycleService]
 *        │
 *        ▼
 *   DatabaseService    ← interface (PROD ↔ TEST swap via Guice)
 *    ┌───┴────────┐
 *    │            │
 *  SqlDB     InMemoryDB
 * </pre>
 *
 * The store knows rows, not graphs. It never checks that a
 * {@code parent_id} resolves or that a branch head is reachable; those rules
 * belong to the engine, which composes single-row operations inside
 * {@link de.bsommerfeld.storygraph.db.DatabaseService#inTransaction}.
 *
 * <h2>Tables</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ snippets                                                          │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK)         │ 32 hex chars, immutable                        │
 * │ story            │ owning story name                              │
 * │ parent_id        │ previous snippet, NULL for the root            │
 * │ child_id         │ active continuation, NULL when none            │
 * │ kind             │ "user", "ai", or any other producer tag        │
 * │ content          │ text payload, may be empty                     │
 * │ created_at       │ epoch millis, never updated                    │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ branches                                                          │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ story  (PK)      │ owning story name                              │
 * │ name   (PK)      │ branch name, e.g. "main"                       │
 * │ head_id          │ tip snippet of the branch                      │
 * │ created_at       │ epoch millis, preserved by upserts             │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * There are no foreign keys. A dangling {@code parent_id}, {@code child_id}
 * or {@code head_id} is representable on purpose: it is what a crash between
 * two writes leaves behind, and the engine detects and heals it on read.
 *
 * <h2>SQL File Inventory</h2>
 * All statements live in {@code sql/*.sql}, loaded via
 * {@link de.bsommerfeld.storygraph.db.SqlLoader}:
 * <ul>
 * <li>{@code insert-snippet}, {@code select-snippet},
 * {@code select-story-snippets}, {@code select-children},
 * {@code select-roots}, {@code select-active-parents}</li>
 * <li>{@code update-snippet-fields}, {@code update-snippet-parent},
 * {@code update-snippet-child}</li>
 * <li>{@code delete-snippet}, {@code delete-story-snippets},
 * {@code delete-all-snippets}, {@code select-stories}</li>
 * <li>{@code upsert-branch}, {@code select-branch}, {@code select-branches},
 * {@code select-branches-by-head}</li>
 * <li>{@code delete-branch}, {@code delete-story-branches},
 * {@code delete-all-branches}</li>
 * </ul>
 */
package de.bsommerfeld.storygraph.db;
