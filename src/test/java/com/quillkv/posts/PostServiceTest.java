package com.quillkv.posts;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quillkv.audit.EventLog;
import com.quillkv.store.BackendUnavailableException;
import com.quillkv.store.InMemoryKvStore;
import com.quillkv.store.KvStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLTransientConnectionException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PostServiceTest {

    private final List<String> audited = new ArrayList<>();
    private final EventLog events = (event, details) -> audited.add(event);
    private InMemoryKvStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryKvStore();
    }

    private PostService service(ContentFormatter formatter, String now) {
        return new PostService(store, formatter, events, Clock.fixed(Instant.parse(now), ZoneOffset.UTC));
    }

    @Test
    void saveStoresUnderSiteScopedKey() {
        var post = service(new FallbackContentFormatter(), "2026-01-01T00:00:00Z")
                .save("blog_example_com", new PostDraft("Hello World", "Body", List.of(" a.png ", ""), null));

        assertThat(post.slug()).isEqualTo("hello-world");
        assertThat(post.images()).containsExactly("a.png");
        assertThat(store.get("post:blog_example_com:hello-world")).isPresent();
        assertThat(audited).containsExactly("admin_post_saved");
    }

    @Test
    void resaveKeepsCreatedAt() {
        service(new FallbackContentFormatter(), "2026-01-01T00:00:00Z")
                .save("default", new PostDraft("Post", "v1", List.of(), "post"));
        var updated = service(new FallbackContentFormatter(), "2026-02-01T00:00:00Z")
                .save("default", new PostDraft("Post", "v2", List.of(), "post"));

        assertThat(updated.createdAt()).isEqualTo("2026-01-01T00:00:00Z");
        assertThat(updated.updatedAt()).isEqualTo("2026-02-01T00:00:00Z");
        assertThat(updated.content()).isEqualTo("v2");
        assertThat(store.listKeysWithPrefix("post:default:")).containsExactly("post:default:post");
    }

    @Test
    void formatterFailureFallsBackToPlainRendering() {
        ContentFormatter broken = (site, title, content, images) -> {
            throw new IllegalStateException("upstream timeout");
        };
        var post = service(broken, "2026-01-01T00:00:00Z")
                .save("default", new PostDraft("Title <b>", "Body", List.of(), null));

        assertThat(post.html()).startsWith("<article>").contains("Title &lt;b&gt;");
    }

    @Test
    void blankFormatterOutputFallsBack() {
        var post = service((site, title, content, images) -> "  ", "2026-01-01T00:00:00Z")
                .save("default", new PostDraft("T", "Body", List.of(), null));

        assertThat(post.html()).contains("<h1>T</h1>");
    }

    @Test
    void missingTitleOrContentIsRejected() {
        var service = service(new FallbackContentFormatter(), "2026-01-01T00:00:00Z");

        assertThatThrownBy(() -> service.save("default", new PostDraft("", "Body", List.of(), null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.save("default", new PostDraft("Title", null, List.of(), null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(audited).isEmpty();
    }

    @Test
    void listIsScopedToSiteAndNewestKeyFirst() {
        var service = service(new FallbackContentFormatter(), "2026-01-01T00:00:00Z");
        service.save("a", new PostDraft("T1", "c", List.of(), "2026-01-first"));
        service.save("a", new PostDraft("T2", "c", List.of(), "2026-02-second"));
        service.save("ab", new PostDraft("T3", "c", List.of(), "other-site"));

        var slugs = service.list("a").stream().map(PostSummary::slug).toList();

        assertThat(slugs).containsExactly("2026-02-second", "2026-01-first");
    }

    @Test
    void getAndDeleteNormalizeSlugCase() {
        var service = service(new FallbackContentFormatter(), "2026-01-01T00:00:00Z");
        service.save("default", new PostDraft("My Post", "c", List.of(), null));

        assertThat(service.get("default", "MY-POST")).isPresent();
        service.delete("default", "MY-POST");
        assertThat(service.get("default", "my-post")).isEmpty();
        assertThat(audited).containsExactly("admin_post_saved", "admin_post_deleted");
    }

    @Test
    void storageFailuresAreAuditedAndRethrown() {
        var broken = mock(KvStore.class);
        var failure = new BackendUnavailableException("Failed to load key: post:default:note",
                new SQLTransientConnectionException("connection refused"));
        when(broken.listKeysWithPrefix(anyString())).thenThrow(failure);
        when(broken.get(anyString())).thenThrow(failure);
        doThrow(failure).when(broken).delete(anyString());
        var recorded = new ArrayList<Map<String, ?>>();
        var service = new PostService(broken, new FallbackContentFormatter(), (event, details) -> {
            audited.add(event);
            recorded.add(details);
        });

        assertThatThrownBy(() -> service.list("default")).isSameAs(failure);
        assertThatThrownBy(() -> service.get("default", "Note")).isSameAs(failure);
        assertThatThrownBy(() -> service.save("default", new PostDraft("Note", "Body", List.of(), null)))
                .isSameAs(failure);
        assertThatThrownBy(() -> service.delete("default", "Note")).isSameAs(failure);

        assertThat(audited).containsExactly("admin_list_error", "admin_get_error", "admin_save_error",
                "admin_delete_error");
        assertThat(recorded.get(1).get("slug")).isEqualTo("note");
        assertThat(recorded.get(3).get("message")).isEqualTo("Failed to load key: post:default:note");
        assertThat(recorded.get(3).get("message").toString()).doesNotContain("connection refused");
    }

    @Test
    void imagesAcceptArrayOrCommaSeparatedText() throws Exception {
        var mapper = new ObjectMapper();

        var fromText = mapper.readValue("{\"title\":\"T\",\"content\":\"C\",\"images\":\" a.jpg, ,b.jpg \"}",
                PostDraft.class);
        var fromArray = mapper.readValue("{\"title\":\"T\",\"content\":\"C\",\"images\":[\"a.jpg\",\"b.jpg\"]}",
                PostDraft.class);
        var without = mapper.readValue("{\"title\":\"T\",\"content\":\"C\"}", PostDraft.class);

        assertThat(fromText.images()).containsExactly("a.jpg", "b.jpg");
        assertThat(fromArray.images()).containsExactly("a.jpg", "b.jpg");
        assertThat(without.images()).isEmpty();
    }

    @Test
    void slugsAndSitesNormalize() {
        assertThat(Slugs.slugify("  Don't Stop -- Believin'! ")).isEqualTo("dont-stop-believin");
        assertThat(Slugs.slugify(null)).isEmpty();
        var longTitle = new char[300];
        Arrays.fill(longTitle, 'a');
        assertThat(Slugs.slugify(new String(longTitle))).hasSize(140);

        assertThat(SiteResolver.fromHost("Blog.Example.COM")).isEqualTo("blog_example_com");
        assertThat(SiteResolver.fromHost("localhost")).isEqualTo("default");
        assertThat(SiteResolver.fromHost("127.0.0.1")).isEqualTo("default");
        assertThat(SiteResolver.fromHost(null)).isEqualTo("default");
        assertThat(SiteResolver.fromHost("my site!.io")).isEqualTo("mysite_io");
    }

    @Test
    void fallbackFormatterEscapesAndSplitsParagraphs() {
        var html = new FallbackContentFormatter().generate("s", "T", "one\n\ntwo <script>", List.of("x\".png"));

        assertThat(html).contains("<p>one</p>", "<p>two &lt;script&gt;</p>", "src=\"x&quot;.png\"")
                .doesNotContain("<script>");
    }
}
