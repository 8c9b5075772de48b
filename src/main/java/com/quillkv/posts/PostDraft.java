package com.quillkv.posts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Incoming create/update request. {@code slug} is optional and derived from the title when blank.
 * Over JSON, {@code images} is either an array of URLs or one comma-separated string.
 */
public record PostDraft(String title, String content, List<String> images, String slug) {

    @JsonCreator
    static PostDraft fromJson(@JsonProperty("title") String title,
                              @JsonProperty("content") String content,
                              @JsonProperty("images") JsonNode images,
                              @JsonProperty("slug") String slug) {
        return new PostDraft(title, content, imageList(images), slug);
    }

    static List<String> imageList(JsonNode images) {
        var urls = new ArrayList<String>();
        if (images == null || images.isNull() || images.isMissingNode()) return urls;
        if (images.isArray()) {
            for (var item : images) {
                if (!item.isNull()) urls.add(item.asText());
            }
            return urls;
        }
        for (var part : images.asText().split(",")) {
            var url = part.strip();
            if (!url.isEmpty()) urls.add(url);
        }
        return urls;
    }
}
