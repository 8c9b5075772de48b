package com.quillkv.gateway.http;

import com.quillkv.observability.MetricsConfig;
import com.quillkv.posts.PostDraft;
import com.quillkv.posts.PostService;
import com.quillkv.posts.SiteResolver;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Map;

@RestController
public class PostController {

    private final PostService posts;
    private final MetricsConfig metrics;

    public PostController(PostService posts, MetricsConfig metrics) {
        this.posts = posts;
        this.metrics = metrics;
    }

    @GetMapping("/api/admin/posts")
    public Map<String, Object> list(HttpServletRequest request) {
        var site = SiteResolver.fromHost(request.getServerName());
        return Map.of("ok", true, "site", site, "posts", posts.list(site));
    }

    @GetMapping("/api/admin/posts/{slug}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String slug, HttpServletRequest request) {
        var site = SiteResolver.fromHost(request.getServerName());
        return posts.get(site, slug)
                .map(p -> ResponseEntity.ok(Map.<String, Object>of("ok", true, "site", site, "post", p)))
                .orElseGet(() -> ApiResponses.error(HttpStatus.NOT_FOUND, "NOT_FOUND", "Post not found"));
    }

    @PostMapping("/api/admin/posts")
    public Map<String, Object> save(@RequestBody PostDraft draft, HttpServletRequest request) {
        var site = SiteResolver.fromHost(request.getServerName());
        var post = posts.save(site, draft);
        metrics.postsSaved().increment();
        return Map.of("ok", true, "site", site, "slug", post.slug(), "message", "Post saved");
    }

    @DeleteMapping("/api/admin/posts/{slug}")
    public Map<String, Object> delete(@PathVariable String slug, HttpServletRequest request) {
        var site = SiteResolver.fromHost(request.getServerName());
        posts.delete(site, slug);
        metrics.postsDeleted().increment();
        return Map.of("ok", true, "site", site, "slug", slug.toLowerCase(Locale.ROOT), "message", "Post deleted");
    }
}
