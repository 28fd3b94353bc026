/**
 * Service Provider Interfaces (SPI) for plugging the scheduler into its surroundings.
 *
 * <p>Integrators implement these to supply persistence, connections, the content
 * endpoint, content discovery, and metrics.
 *
 * @see slotpost.spi.ScheduleStore
 * @see slotpost.spi.ConnectionProvider
 * @see slotpost.spi.Publisher
 * @see slotpost.spi.ContentDiscovery
 * @see slotpost.spi.MetricsExporter
 */
package slotpost.spi;
