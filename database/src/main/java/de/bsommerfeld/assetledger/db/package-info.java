/**
 * SQLite persistence for the asset ledger.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [account / catalog services]
 *        │
 *        ▼
 *   RecordStore        ← generic CRUD per TableDescriptor, writes audit entries
 *        │         ╲
 *        ▼          ▼
 *   ConnectionManager   AuditLog
 *        │
 *        ▼
 *   SQLite file (WAL)  ← schema owned by MigrationRunner
 * </pre>
 *
 * <h2>Connections</h2>
 * {@link de.bsommerfeld.assetledger.db.ConnectionManager} keeps one JDBC
 * connection per thread. A connection is opened explicitly with
 * {@code open()}; using the manager from a thread that never opened one is an
 * error. Transactions nest by joining the outermost one, and a failure inside
 * any nested block rolls the whole unit back.
 *
 * <h2>Schema</h2>
 * Versioned migrations live in {@code sql/migration/NNN-name.sql} and are
 * recorded in the {@code migrations} table. Each migration runs in its own
 * transaction together with its ledger row.
 *
 * <h2>SQL File Inventory</h2>
 * Statements that are not generated from a
 * {@link de.bsommerfeld.assetledger.db.TableDescriptor} are externalized to
 * {@code sql/*.sql} and loaded via {@link de.bsommerfeld.assetledger.db.SqlLoader}:
 * <ul>
 * <li>{@code create-migration-ledger.sql} / {@code select-applied-versions.sql} /
 * {@code insert-migration.sql}: migration bookkeeping</li>
 * <li>{@code insert-audit-entry.sql}: append one audit row</li>
 * <li>{@code select-audit-for-record.sql}, {@code select-audit-by-actor.sql},
 * {@code select-audit-recent.sql}, {@code count-audit.sql}: audit reads</li>
 * <li>{@code select-principal-for-login.sql}: user joined with role flags</li>
 * <li>{@code select-active-users.sql}: active accounts for listings</li>
 * </ul>
 */
package de.bsommerfeld.assetledger.db;
