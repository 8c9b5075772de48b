package com.quillkv.posts;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Post(
    String site,
    String slug,
    String title,
    String content,
    List<String> images,
    String html,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("updated_at") String updatedAt
) {
    public Post {
        images = images == null ? List.of() : List.copyOf(images);
    }
}
