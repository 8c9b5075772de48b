package com.quillkv.posts;

import java.util.List;

/**
 * Renders a post body into an HTML fragment that inherits the site's stylesheet.
 * Implementations must not throw; they fall back internally instead.
 */
public interface ContentFormatter {

    String generate(String site, String title, String content, List<String> images);
}
