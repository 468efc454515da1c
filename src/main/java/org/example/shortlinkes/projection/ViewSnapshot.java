package org.example.shortlinkes.projection;

import java.util.Map;
import org.example.shortlinkes.model.ShortLink;
import org.example.shortlinkes.model.Slug;

/**
 * Immutable copy of a {@link MaterializedView}. Two snapshots are equal when they hold the same
 * links and the same counters, which is how replay determinism is checked.
 *
 * @param links slug to current link
 * @param redirects slug to redirect count
 */
public record ViewSnapshot(Map<Slug, ShortLink> links, Map<Slug, Long> redirects) {}
