package slotpost.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import slotpost.spi.Publisher;

import java.time.Instant;
import java.util.UUID;

/**
 * Publisher that only logs. Replace it with a bean that talks to the real endpoint.
 */
public class DryRunPublisher implements Publisher {

  private static final Logger log = LoggerFactory.getLogger(DryRunPublisher.class);

  @Override
  public String publish(String payload, Instant scheduledTime) {
    String id = "dry-run-" + UUID.randomUUID();
    log.info("[DryRun] slot={} id={} payload={}", scheduledTime, id, payload);
    return id;
  }
}
