package slotpost.cli;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Command-line front end for the scheduler, meant to be invoked from cron every cadence.
 *
 * <p>The starter wires the scheduler from {@code application.properties}; this module adds a
 * dry-run publisher, a TSV inbox as the discovery source and the command dispatch.
 *
 * <p>Run with: mvn install -DskipTests && java -jar samples/slotpost-cli/target/slotpost-cli-*.jar run
 *
 * <p>Commands:
 * run | status | catch-up [n] | recover | discover | failed | replay &lt;id&gt; | skip &lt;id&gt; | health | purge
 */
@SpringBootApplication
public class Application {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(Application.class, args)));
  }
}
