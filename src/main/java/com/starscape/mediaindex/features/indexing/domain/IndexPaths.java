package com.starscape.mediaindex.features.indexing.domain;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Joins a file root and a relative name into one snapshot key, like a POSIX path join:
 * repeated separators and {@code .} are dropped, {@code ..} removes the previous
 * segment, and a leading {@code /} is kept.
 */
public final class IndexPaths {
    
    private IndexPaths() {
    }
    
    public static String join(String root, String name) {
        String joined = concat(root, name);
        if (joined.isEmpty()) {
            return "";
        }
        
        boolean rooted = joined.startsWith("/");
        Deque<String> segments = new ArrayDeque<>();
        for (String part : joined.split("/")) {
            if (part.isEmpty() || part.equals(".")) {
                continue;
            }
            if (part.equals("..")) {
                if (!segments.isEmpty() && !segments.peekLast().equals("..")) {
                    segments.removeLast();
                } else if (!rooted) {
                    segments.addLast(part);
                }
                continue;
            }
            segments.addLast(part);
        }
        
        String path = String.join("/", segments);
        if (rooted) {
            return "/" + path;
        }
        return path.isEmpty() ? "." : path;
    }
    
    private static String concat(String root, String name) {
        boolean hasRoot = root != null && !root.isEmpty();
        boolean hasName = name != null && !name.isEmpty();
        if (hasRoot && hasName) {
            return root + "/" + name;
        }
        return hasRoot ? root : (hasName ? name : "");
    }
}
