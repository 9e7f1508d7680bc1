package com.declparser.ast;

import com.declparser.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * A path such as {@code std::collections::HashMap<K, V>} or {@code super}.
 */
public record Path(
    Token leadingColon, // Can be null; present for ::std::... paths
    Punctuated<PathSegment> segments
) implements Node {
    public static Path of(String... names) {
        List<PathSegment> segments = new ArrayList<>(names.length);
        for (String name : names) {
            segments.add(new PathSegment(Ident.of(name), null));
        }
        return new Path(null, PathSegment.joined(segments));
    }

    public static Path from(Ident ident) {
        return new Path(null, Punctuated.of(new PathSegment(ident, null)));
    }

    /**
     * True for a single-segment path without arguments naming {@code ident}.
     */
    public boolean isIdent(String ident) {
        return leadingColon == null
            && segments.size() == 1
            && segments.get(0).arguments() == null
            && segments.get(0).ident().name().equals(ident);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (leadingColon != null) {
            sb.append("::");
        }
        List<PathSegment> values = segments.values();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append("::");
            }
            sb.append(values.get(i).ident().name());
        }
        return sb.toString();
    }
}
