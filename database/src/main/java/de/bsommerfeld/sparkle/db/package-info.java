/**
 * SQLite persistence for themes and inspirations.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Application]
 *        │
 *        ├──────────────► DataValidator      (read-only audit)
 *        ▼
 *   IntegrityCoordinator   ← every cross-entity mutation, one unit each
 *    ┌───┴──────────┐
 *    ▼              ▼
 *  ThemeCatalog   InspirationStore
 *    └───┬──────────┘
 *        ▼
 *   NoteDatabase           ← writer thread, units, live-query events
 *        │
 *        ▼
 *   MigrationEngine        ← runs once inside NoteDatabase.open
 * </pre>
 *
 * Reads on the catalog and the store may be called directly. Mutations that
 * must keep the aggregates and the foreign key consistent go through the
 * coordinator.
 *
 * <h2>Database Schema (version 2)</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ themes                                                            │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ name  (PK)       │ 1–50 chars, unique                             │
 * │ icon             │ display glyph                                  │
 * │ color            │ ARGB                                           │
 * │ description      │ may be empty                                   │
 * │ createdAt        │ epoch millis                                   │
 * │ lastUsed         │ cached, epoch millis                           │
 * │ inspirationCount │ cached, = COUNT(inspirations) for this theme   │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ inspirations                                                      │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ AUTOINCREMENT, never reused                    │
 * │ content          │ 1–500 chars, indexed                           │
 * │ theme_name       │ FK → themes.name, indexed                      │
 * │ created_at       │ epoch millis                                   │
 * │ word_count       │ caller-supplied                                │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * The foreign key is declared {@code ON UPDATE CASCADE ON DELETE CASCADE}.
 * The coordinator never relies on the delete cascade: inspirations are
 * reassigned or deleted explicitly before their theme row goes away.
 *
 * <h3>Schema versions</h3>
 * {@code PRAGMA user_version} marks the layout: {@code 0} for a fresh file,
 * {@code 1} for the legacy single-table layout where the theme was a bare
 * string column and bare themes were stored as rows with the content
 * {@code __THEME_MARKER__}, {@code 2} for the layout above.
 *
 * <h2>SQL File Inventory</h2>
 * All SQL statements are externalized to {@code sql/*.sql}, loaded via
 * {@link de.bsommerfeld.sparkle.db.SqlLoader}. Theme statements are named
 * {@code *-theme*.sql}, inspiration statements {@code *-inspiration*.sql};
 * the migration steps live under {@code sql/migration/}.
 */
package de.bsommerfeld.sparkle.db;
