/**
 * Service Provider Interfaces wiring the core to persistence and monitoring.
 *
 * @see socialpublish.spi.ConnectionProvider
 * @see socialpublish.spi.DocumentStore
 * @see socialpublish.spi.SiteWideDocumentReader
 * @see socialpublish.spi.PublishMetrics
 */
package socialpublish.spi;
