/**
 * Spring Boot auto-configuration for the scheduler.
 *
 * <p>Define a {@link slotpost.spi.Publisher} bean (and optionally a
 * {@link slotpost.spi.ContentDiscovery}) next to a {@code DataSource}, and a
 * {@link slotpost.SlotPost} bean is created from the {@code slotpost.*} properties.
 * Runs are triggered by the application, for example from a scheduled job or the command line.
 */
package slotpost.spring.boot;
