package com.quillkv.gateway.http;

import com.quillkv.auth.SessionTokenService;
import com.quillkv.observability.MetricsConfig;
import com.quillkv.posts.FallbackContentFormatter;
import com.quillkv.posts.PostService;
import com.quillkv.store.BackendUnavailableException;
import com.quillkv.store.InMemoryKvStore;
import com.quillkv.store.KvStore;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PostControllerTest {

    private static final String HOST = "http://blog.example.com";

    private final List<String> audited = new ArrayList<>();
    private InMemoryKvStore store;
    private MetricsConfig metrics;
    private Cookie session;
    private SessionTokenService tokens;

    @BeforeEach
    void setUp() {
        store = new InMemoryKvStore();
        metrics = new MetricsConfig();
        tokens = new SessionTokenService(new InMemoryKvStore());
        session = new Cookie("auth", tokens.issue("admin@example.com", Duration.ofHours(1)));
    }

    private MockMvc mvc(KvStore posts) {
        var service = new PostService(posts, new FallbackContentFormatter(),
                (event, details) -> audited.add(event));
        return MockMvcBuilders.standaloneSetup(new PostController(service, metrics))
                .addMappedInterceptors(new String[]{"/api/admin/**"}, new AdminAuthInterceptor(tokens))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void adminRoutesRequireSession() throws Exception {
        var mvc = mvc(store);

        mvc.perform(get(HOST + "/api/admin/posts"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
        mvc.perform(get(HOST + "/api/admin/posts").cookie(new Cookie("auth", "not.a.token")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
        assertThat(store.listKeysWithPrefix("")).isEmpty();
    }

    @Test
    void savedPostIsListedForItsHostOnly() throws Exception {
        var mvc = mvc(store);

        mvc.perform(post(HOST + "/api/admin/posts").cookie(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"First Post\",\"content\":\"Hello\",\"images\":[]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.site").value("blog_example_com"))
                .andExpect(jsonPath("$.slug").value("first-post"));

        mvc.perform(get(HOST + "/api/admin/posts").cookie(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.posts[0].slug").value("first-post"))
                .andExpect(jsonPath("$.posts[0].created_at").exists());
        mvc.perform(get("http://other.example.com/api/admin/posts").cookie(session))
                .andExpect(jsonPath("$.posts").isEmpty());
        assertThat(store.get("post:blog_example_com:first-post")).isPresent();
        assertThat(metrics.postsSaved().count()).isEqualTo(1.0);
    }

    @Test
    void getAndDeleteBySlug() throws Exception {
        var mvc = mvc(store);
        mvc.perform(post(HOST + "/api/admin/posts").cookie(session)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Note\",\"content\":\"Body\"}"));

        mvc.perform(get(HOST + "/api/admin/posts/note").cookie(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.post.html").value(containsString("<h1>Note</h1>")));
        mvc.perform(delete(HOST + "/api/admin/posts/NOTE").cookie(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slug").value("note"));
        mvc.perform(get(HOST + "/api/admin/posts/note").cookie(session))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void missingContentIsBadRequest() throws Exception {
        mvc(store).perform(post(HOST + "/api/admin/posts").cookie(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Only title\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));
    }

    @Test
    void unreachableStorageIsServiceUnavailable() throws Exception {
        var broken = mock(KvStore.class);
        when(broken.listKeysWithPrefix(anyString())).thenThrow(new BackendUnavailableException(
                "Failed to list keys", new SQLTransientConnectionException("connection refused")));

        mvc(broken).perform(get(HOST + "/api/admin/posts").cookie(session))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("BACKEND_UNAVAILABLE"))
                .andExpect(jsonPath("$.message").value("Storage is unavailable"));
        assertThat(audited).containsExactly("admin_list_error");
    }

    @Test
    void imagesMayBeCommaSeparatedText() throws Exception {
        mvc(store).perform(post(HOST + "/api/admin/posts").cookie(session)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"T\",\"content\":\"C\",\"images\":\"a.jpg, b.jpg\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slug").value("t"));

        mvc(store).perform(get(HOST + "/api/admin/posts/t").cookie(session))
                .andExpect(jsonPath("$.post.images[0]").value("a.jpg"))
                .andExpect(jsonPath("$.post.images[1]").value("b.jpg"));
        assertThat(audited).containsExactly("admin_post_saved");
    }
}
