package com.quillkv.posts;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quillkv.audit.EventLog;
import com.quillkv.store.BackendException;
import com.quillkv.store.KvStore;
import com.quillkv.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Posts of every site share one key space: {@code post:<site>:<slug>}. Storage failures are audited
 * as {@code admin_*_error} with the store's message, then rethrown.
 */
public class PostService {

    private static final Logger log = LoggerFactory.getLogger(PostService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final KvStore store;
    private final ContentFormatter formatter;
    private final ContentFormatter fallback = new FallbackContentFormatter();
    private final EventLog events;
    private final Clock clock;

    public PostService(KvStore store, ContentFormatter formatter, EventLog events) {
        this(store, formatter, events, Clock.systemUTC());
    }

    public PostService(KvStore store, ContentFormatter formatter, EventLog events, Clock clock) {
        this.store = store;
        this.formatter = formatter;
        this.events = events;
        this.clock = clock;
    }

    static String key(String site, String slug) {
        return "post:" + site + ":" + slug;
    }

    /** Newest key first; entries deleted between listing and reading are skipped. */
    public List<PostSummary> list(String site) {
        try {
            var posts = new ArrayList<PostSummary>();
            for (var key : store.listKeysWithPrefix("post:" + site + ":")) {
                read(key).map(PostSummary::of).ifPresent(posts::add);
            }
            return posts;
        } catch (StoreException e) {
            events.log("admin_list_error", Map.of("site", site,
                    "message", String.valueOf(e.getMessage())));
            throw e;
        }
    }

    public Optional<Post> get(String site, String slug) {
        var normalized = normalize(slug);
        try {
            return read(key(site, normalized));
        } catch (StoreException e) {
            events.log("admin_get_error", Map.of("site", site, "slug", normalized,
                    "message", String.valueOf(e.getMessage())));
            throw e;
        }
    }

    public Post save(String site, PostDraft draft) {
        if (draft == null || isBlank(draft.title()) || isBlank(draft.content())) {
            throw new IllegalArgumentException("Title and content are required");
        }
        var slug = Slugs.slugify(isBlank(draft.slug()) ? draft.title() : draft.slug());
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("Title does not produce a usable slug");
        }
        var images = cleanImages(draft.images());
        var html = render(site, draft.title(), draft.content(), images);
        var key = key(site, slug);
        var now = Instant.now(clock).toString();
        try {
            var createdAt = read(key).map(Post::createdAt).orElse(now);
            var post = new Post(site, slug, draft.title(), draft.content(), images, html, createdAt, now);
            store.put(key, MAPPER.valueToTree(post));
            events.log("admin_post_saved", Map.of("site", site, "slug", slug, "title", draft.title()));
            return post;
        } catch (StoreException e) {
            events.log("admin_save_error", Map.of("site", site, "slug", slug,
                    "message", String.valueOf(e.getMessage())));
            throw e;
        }
    }

    public void delete(String site, String slug) {
        var normalized = normalize(slug);
        try {
            store.delete(key(site, normalized));
        } catch (StoreException e) {
            events.log("admin_delete_error", Map.of("site", site, "slug", normalized,
                    "message", String.valueOf(e.getMessage())));
            throw e;
        }
        events.log("admin_post_deleted", Map.of("site", site, "slug", normalized));
    }

    private String render(String site, String title, String content, List<String> images) {
        try {
            var html = formatter.generate(site, title, content, images);
            if (html != null && !html.isBlank()) return html.strip();
        } catch (RuntimeException e) {
            log.warn("Content formatter failed for site {}, using fallback: {}", site, e.getMessage());
        }
        return fallback.generate(site, title, content, images);
    }

    private Optional<Post> read(String key) {
        var node = store.get(key);
        if (node.isEmpty()) return Optional.empty();
        try {
            return Optional.of(MAPPER.treeToValue(node.get(), Post.class));
        } catch (Exception e) {
            throw new BackendException("Stored post is unreadable: " + key, e);
        }
    }

    private static List<String> cleanImages(List<String> images) {
        if (images == null) return List.of();
        return images.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(String::strip)
                .toList();
    }

    private static String normalize(String slug) {
        return slug == null ? "" : slug.toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
