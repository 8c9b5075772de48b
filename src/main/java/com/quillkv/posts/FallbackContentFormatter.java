package com.quillkv.posts;

import java.util.List;

/** Deterministic formatter: title, one paragraph per blank-line separated block, then images. */
public class FallbackContentFormatter implements ContentFormatter {

    @Override
    public String generate(String site, String title, String content, List<String> images) {
        var sb = new StringBuilder("<article>\n");
        sb.append("  <h1>").append(escapeHtml(title)).append("</h1>\n");
        for (var block : String.valueOf(content == null ? "" : content).split("\\R\\s*\\R")) {
            var text = block.strip();
            if (text.isEmpty()) continue;
            sb.append("  <p>").append(escapeHtml(text).replaceAll("\\R", "<br>")).append("</p>\n");
        }
        if (images != null) {
            int n = 1;
            for (var url : images) {
                sb.append("  <figure><img src=\"").append(escapeHtml(url))
                  .append("\" alt=\"Image ").append(n++).append("\"></figure>\n");
            }
        }
        return sb.append("</article>").toString();
    }

    static String escapeHtml(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#039;");
    }
}
