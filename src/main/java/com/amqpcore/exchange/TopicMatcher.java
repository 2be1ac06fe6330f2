package com.amqpcore.exchange;

import java.util.ArrayList;
import java.util.List;

/**
 * Topic pattern matching. Keys and patterns are dot separated words; {@code *} matches exactly one
 * word and {@code #} matches zero or more words. The whole key must be consumed by the whole pattern.
 */
public final class TopicMatcher {

    private TopicMatcher() {
    }

    public static boolean matches(String pattern, String routingKey) {
        if (pattern.equals("#")) {
            return true;
        }
        String[] bindingParts = collapseHashes(pattern.split("\\.", -1));
        String[] routingParts = routingKey.split("\\.", -1);
        return matchesParts(routingParts, bindingParts);
    }

    // "#.#" matches the same keys as "#"
    private static String[] collapseHashes(String[] parts) {
        List<String> collapsed = new ArrayList<>(parts.length);
        for (String part : parts) {
            if (part.equals("#") && !collapsed.isEmpty() && collapsed.get(collapsed.size() - 1).equals("#")) {
                continue;
            }
            collapsed.add(part);
        }
        return collapsed.toArray(new String[0]);
    }

    /**
     * Table-driven match: {@code reachable[b][r]} is true when the first {@code b} pattern words can
     * consume the first {@code r} key words. Runs in O(pattern words x key words).
     */
    private static boolean matchesParts(String[] routingParts, String[] bindingParts) {
        int keyLength = routingParts.length;
        boolean[] reachable = new boolean[keyLength + 1];
        reachable[0] = true;

        for (String bindingPart : bindingParts) {
            boolean[] next = new boolean[keyLength + 1];
            if (bindingPart.equals("#")) {
                // # swallows zero or more words
                boolean seen = false;
                for (int r = 0; r <= keyLength; r++) {
                    seen |= reachable[r];
                    next[r] = seen;
                }
            } else {
                for (int r = 0; r < keyLength; r++) {
                    if (reachable[r] && (bindingPart.equals("*") || bindingPart.equals(routingParts[r]))) {
                        next[r + 1] = true;
                    }
                }
            }
            reachable = next;
        }
        return reachable[keyLength];
    }
}
