/**
 * Service provider interfaces of the JDBC module.
 *
 * @see socialpublish.jdbc.spi.Dialect
 */
package socialpublish.jdbc.spi;
