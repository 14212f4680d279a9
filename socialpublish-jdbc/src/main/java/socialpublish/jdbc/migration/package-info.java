/**
 * Forward-only schema migrations, detected as applied by introspecting the live schema.
 *
 * @see socialpublish.jdbc.migration.Migrations
 * @see socialpublish.jdbc.migration.MigrationRunner
 */
package socialpublish.jdbc.migration;
