package com.mediasync.mediaserver.client;

import java.util.List;

public record LibrarySection(
        String key,
        String title,
        List<String> locations
) {
    /**
     * True when {@code path} is one of the section's locations or lies beneath one.
     */
    public boolean contains(String path) {
        for (String location : locations) {
            String root = location.endsWith("/") ? location.substring(0, location.length() - 1) : location;
            if (path.equals(root) || path.startsWith(root + "/")) {
                return true;
            }
        }
        return false;
    }
}
