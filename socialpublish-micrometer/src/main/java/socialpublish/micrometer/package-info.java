/**
 * Micrometer bridge for broadcast metrics.
 *
 * @see socialpublish.micrometer.MicrometerPublishMetrics
 */
package socialpublish.micrometer;
