/**
 * Built-in dialects and the {@link socialpublish.jdbc.dialect.Dialects} registry.
 */
package socialpublish.jdbc.dialect;
