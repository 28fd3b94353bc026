package slotpost.spi;

import slotpost.model.ContentItem;

import java.util.List;

/**
 * Source of newly ready content items.
 */
@FunctionalInterface
public interface ContentDiscovery {

    /**
     * Returns the items found since the last call, in discovery order. May be empty.
     */
    List<ContentItem> discover();
}
