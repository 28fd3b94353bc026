package slotpost.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import slotpost.model.ContentItem;
import slotpost.spi.ContentDiscovery;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads content items from a tab-separated file: one {@code key<TAB>payload} per line.
 *
 * <p>Blank lines and lines starting with {@code #} are ignored. The whole file is returned
 * on every call; items already on the schedule are rejected as duplicates by the allocator.
 * A missing file yields no items.
 */
public class TsvInboxDiscovery implements ContentDiscovery {

  private static final Logger log = LoggerFactory.getLogger(TsvInboxDiscovery.class);

  private final Path inbox;

  public TsvInboxDiscovery(Path inbox) {
    this.inbox = Objects.requireNonNull(inbox, "inbox");
  }

  @Override
  public List<ContentItem> discover() {
    if (!Files.isRegularFile(inbox)) {
      log.debug("Inbox {} does not exist", inbox);
      return List.of();
    }
    List<String> lines;
    try {
      lines = Files.readAllLines(inbox, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read inbox " + inbox, e);
    }
    List<ContentItem> items = new ArrayList<>();
    int lineNo = 0;
    for (String line : lines) {
      lineNo++;
      if (line.isBlank() || line.startsWith("#")) {
        continue;
      }
      int tab = line.indexOf('\t');
      if (tab <= 0 || line.substring(0, tab).isBlank()) {
        log.warn("Ignoring malformed inbox line {}:{}", inbox, lineNo);
        continue;
      }
      items.add(new ContentItem(line.substring(0, tab).trim(), line.substring(tab + 1)));
    }
    return items;
  }
}
