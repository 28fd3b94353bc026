package slotpost.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import slotpost.model.ContentItem;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TsvInboxDiscoveryTest {

  @TempDir
  Path dir;

  @Test
  void readsKeyPayloadLinesInOrder() throws IOException {
    Path inbox = dir.resolve("inbox.tsv");
    Files.writeString(inbox, "# queued posts\n"
        + "post-1\tfirst post\n"
        + "\n"
        + "post-2\tsecond\twith tab\n", StandardCharsets.UTF_8);

    List<ContentItem> items = new TsvInboxDiscovery(inbox).discover();

    assertEquals(List.of(
        new ContentItem("post-1", "first post"),
        new ContentItem("post-2", "second\twith tab")), items);
  }

  @Test
  void skipsMalformedLines() throws IOException {
    Path inbox = dir.resolve("inbox.tsv");
    Files.writeString(inbox, "no-tab-here\n\tmissing key\npost-3\tok\n", StandardCharsets.UTF_8);

    List<ContentItem> items = new TsvInboxDiscovery(inbox).discover();

    assertEquals(List.of(new ContentItem("post-3", "ok")), items);
  }

  @Test
  void missingFileYieldsNothing() {
    assertTrue(new TsvInboxDiscovery(dir.resolve("absent.tsv")).discover().isEmpty());
  }
}
