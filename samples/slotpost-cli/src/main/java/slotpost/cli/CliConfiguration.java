package slotpost.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import slotpost.spi.ContentDiscovery;
import slotpost.spi.Publisher;

import java.nio.file.Path;

@Configuration(proxyBeanMethods = false)
public class CliConfiguration {

  @Bean
  public Publisher publisher() {
    return new DryRunPublisher();
  }

  @Bean
  public ContentDiscovery contentDiscovery(@Value("${slotpost.cli.inbox:inbox.tsv}") String inbox) {
    return new TsvInboxDiscovery(Path.of(inbox));
  }
}
