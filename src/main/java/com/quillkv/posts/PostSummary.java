package com.quillkv.posts;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PostSummary(
    String slug,
    String title,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("updated_at") String updatedAt
) {
    static PostSummary of(Post post) {
        return new PostSummary(post.slug(), post.title(), post.createdAt(), post.updatedAt());
    }
}
