package org.neurosync.source;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.neurosync.annotation.Vec3;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class AnnotationEndpointsTest {

    private static AnnotationEndpoints endpoints(String url) {
        return new AnnotationEndpoints(SourceParameters.parse(url, "Normal"));
    }

    @Test
    void v2Collection_postsToEntryAndDeletesByKey() {
        AnnotationEndpoints endpoints = endpoints("https://clio.example/v2/mito?groups=a,b");

        assertThat(endpoints.topLevelUrl()).isEqualTo("https://clio.example/v2");
        assertThat(endpoints.datasetsUrl()).isEqualTo("https://clio.example/v2/datasets");
        assertThat(endpoints.entryUrl()).isEqualTo("https://clio.example/v2/annotations/mito");
        assertThat(endpoints.listAllUrl()).isEqualTo("https://clio.example/v2/annotations/mito?groups=a%2Cb");
        assertThat(endpoints.hasPointQueryApi()).isFalse();
        assertThat(endpoints.postUrl(Vec3.of(1, 2, 3))).isEqualTo("https://clio.example/v2/annotations/mito");
        assertThat(endpoints.deleteUrl("Ln1_2_3_4_5_6")).isEqualTo("https://clio.example/v2/annotations/mito/Ln1_2_3_4_5_6");
    }

    @Test
    void missingApi_usesTopLevel() {
        AnnotationEndpoints endpoints = endpoints("https://clio.example/mito");

        assertThat(endpoints.entryUrl()).isEqualTo("https://clio.example/clio_toplevel/annotations/mito");
        assertThat(endpoints.hasPointQueryApi()).isFalse();
    }

    @Test
    void topLevelApi_addressesPointsByPosition() {
        AnnotationEndpoints endpoints = endpoints("https://clio.example/clio_toplevel/mito");

        assertThat(endpoints.hasPointQueryApi()).isTrue();
        assertThat(endpoints.postUrl(Vec3.of(1.4, -2.6, 3))).isEqualTo("https://clio.example/clio_toplevel/annotations/mito?x=1&y=-3&z=3");
        assertThat(endpoints.deleteUrl("1_-3_3")).isEqualTo("https://clio.example/clio_toplevel/annotations/mito?x=1&y=-3&z=3");
        assertThat(endpoints.deleteUrl("custom key")).isEqualTo("https://clio.example/clio_toplevel/annotations/mito/custom+key");
    }

    @Test
    void atlas_usesAtlasEntry() {
        AnnotationEndpoints endpoints = endpoints("https://clio.example/v2/mito?kind=atlas");

        assertThat(endpoints.entryUrl()).isEqualTo("https://clio.example/v2/atlas/mito");
        assertThat(endpoints.deleteUrl("Pt4_5_6")).isEqualTo("https://clio.example/v2/atlas/mito?x=4&y=5&z=6");
    }
}
