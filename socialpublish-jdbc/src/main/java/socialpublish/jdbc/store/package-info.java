/**
 * JDBC implementation of the document store.
 */
package socialpublish.jdbc.store;
