package com.quillkv.posts;

import java.util.Locale;

public final class Slugs {

    private static final int MAX_LENGTH = 140;

    private Slugs() {}

    public static String slugify(String input) {
        var slug = String.valueOf(input == null ? "" : input)
                .toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("['\"]", "")
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        return slug.length() > MAX_LENGTH ? slug.substring(0, MAX_LENGTH) : slug;
    }
}
