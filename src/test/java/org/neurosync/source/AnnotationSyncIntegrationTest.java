package org.neurosync.source;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.neurosync.annotation.Annotation;
import org.neurosync.annotation.Vec3;
import org.neurosync.api.AuthException;
import org.neurosync.http.CancellationToken;
import org.neurosync.junit.extensions.logging.AllowLog;
import org.neurosync.junit.extensions.logging.ExpectLog;
import org.neurosync.junit.extensions.logging.LogLevel;
import org.neurosync.junit.extensions.logging.LogWatchExtension;
import org.neurosync.test.utils.FakeAnnotationBackend;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * End-to-end tests against an in-process backend over real HTTP.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
@AllowLog(level = LogLevel.WARN, loggerPattern = "(io\\.javalin|org\\.eclipse\\.jetty).*")
class AnnotationSyncIntegrationTest {

    private FakeAnnotationBackend backend;
    private NeurosyncContext context;

    @BeforeEach
    void setUp() {
        backend = FakeAnnotationBackend.start();
        context = new NeurosyncContext(ConfigFactory.load());
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    private RemoteCollection open(String query) {
        return context.open(context.parse(backend.url("/v2/mito" + query)));
    }

    @Test
    @DisplayName("Written annotations come back through a fresh download")
    void addThenDownload() {
        // Given
        RemoteCollection collection = open("?user=alice");
        AnnotationSource source = context.annotationSource(collection);
        List<Annotation> added = new CopyOnWriteArrayList<>();
        collection.getListeners().add(added::add);

        // When
        source.add(Annotation.point(Vec3.of(1, 2, 3)).build().withComment("first"), CancellationToken.none()).join();
        source.add(Annotation.line(Vec3.of(0, 0, 0), Vec3.of(5, 5, 5)).build(), CancellationToken.none()).join();
        AnnotationGeometryChunk chunk = context.chunkSource(collection).download(true, CancellationToken.none()).join();

        // Then
        await().atMost(Duration.ofSeconds(5)).until(() -> added.size() == 2);
        assertThat(chunk.annotations()).extracting(Annotation::getId)
            .containsExactlyInAnyOrder("Pt1_2_3[user:alice]", "Ln0_0_0_5_5_5[user:alice]");
        assertThat(backend.entries()).containsOnlyKeys("Pt1_2_3", "Ln0_0_0_5_5_5");
    }

    @Test
    void deleteRemovesRemotely() {
        RemoteCollection collection = open("?user=alice");
        AnnotationSource source = context.annotationSource(collection);
        String id = source.add(Annotation.sphere(Vec3.of(0, 0, 0), Vec3.of(4, 0, 0)).build(), CancellationToken.none()).join();

        source.delete(id, CancellationToken.none()).join();

        assertThat(backend.entries()).isEmpty();
        assertThat(backend.requests()).containsExactly(
            "POST /v2/annotations/mito",
            "DELETE /v2/annotations/mito/Sp0_0_0_4_0_0");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*CredentialedHttpClient", messagePattern = "Gateway timeout for GET .*",
        occurrences = 2)
    void downloadSurvivesGatewayTimeouts() throws Exception {
        backend.put("Pt1_2_3", "{\"kind\":\"point\",\"pos\":[1,2,3],\"user\":\"alice\"}");
        backend.failNextWithGatewayTimeout(2);

        AnnotationGeometryChunk chunk = context.chunkSource(open("?user=alice"))
            .download(false, CancellationToken.none()).join();

        assertThat(chunk.annotations()).hasSize(1);
        assertThat(backend.requests()).hasSize(3);
    }

    @Test
    @DisplayName("A rejected token is refreshed from the auth URL and the request repeated")
    void refreshesTokenFromAuthUrl() {
        // Given
        backend.queueTokens("stale", "fresh");
        backend.requireToken("fresh");
        RemoteCollection collection = open("?user=alice&auth=" + backend.url("/token"));

        // When
        AnnotationGeometryChunk chunk = context.chunkSource(collection).download(false, CancellationToken.none()).join();

        // Then
        assertThat(chunk.annotations()).isEmpty();
        assertThat(backend.authorizations()).containsExactly("Bearer stale", "Bearer fresh");
    }

    @Test
    void literalTokenIsNotRefreshed() {
        backend.requireToken("other");
        RemoteCollection collection = open("?user=alice&token=wrong");

        CompletableFuture<AnnotationGeometryChunk> download =
            context.chunkSource(collection).download(false, CancellationToken.none());

        assertThatThrownBy(download::join).cause().isInstanceOf(AuthException.class);
        assertThat(backend.requests()).hasSize(1);
    }

    @Test
    void completeResolvesGrayscale() {
        SourceParameters parameters = context.complete(context.parse(backend.url("/v2/mito")), CancellationToken.none()).join();

        assertThat(parameters.getGrayscale()).isEqualTo("gs://bucket/mito");
    }
}
