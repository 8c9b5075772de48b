package com.quillkv.posts;

import java.util.Locale;

public final class SiteResolver {

    public static final String DEFAULT_SITE = "default";

    private SiteResolver() {}

    /** Maps a request hostname to the site segment of post keys, e.g. {@code blog.example.com -> blog_example_com}. */
    public static String fromHost(String hostname) {
        if (hostname == null || hostname.isBlank()) return DEFAULT_SITE;
        var hn = hostname.toLowerCase(Locale.ROOT);
        if (hn.startsWith("localhost") || hn.startsWith("127.0.0.1")) return DEFAULT_SITE;
        var site = hn.replaceAll("[^a-z0-9.-]", "").replace('.', '_');
        return site.isEmpty() ? DEFAULT_SITE : site;
    }
}
