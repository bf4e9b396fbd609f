/**
 * Service Provider Interfaces (SPI) for extending diffstore.
 *
 * <p>These interfaces define the extension points that integrators implement
 * to plug in connection provisioning, region persistence, and metrics.
 *
 * @see diffstore.spi.ConnectionProvider
 * @see diffstore.spi.RegionStore
 * @see diffstore.spi.MetricsExporter
 */
package diffstore.spi;
