package org.neurosync.annotation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.neurosync.api.AnnotationValidationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AnnotationIdsTest {

    @ParameterizedTest
    @CsvSource({
        "10_20_30, POINT",
        "-1_0_7, POINT",
        "Pt10_20_30, POINT",
        "Pt10_20_30[user:alice], POINT",
        "1_2_3-4_5_6-Line, LINE",
        "Ln1_2_3_4_5_6, LINE",
        "Ln1_2_3_4_5_6[user:bob@example.org], LINE",
        "1_2_3-4_5_6-Sphere, SPHERE",
        "Sp1_2_3_4_5_-6, SPHERE"
    })
    void typeOf_classifiesStructuralPatterns(String id, AnnotationType expected) {
        assertThat(AnnotationIds.typeOf(id)).contains(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "abc", "1_2", "Pt1_2_3_4", "Xx1_2_3", "1_2_3-4_5_6-Cube", "Ln1_2_3", "1.5_2_3"})
    void typeOf_rejectsUnrecognizedIds(String id) {
        assertThat(AnnotationIds.typeOf(id)).isEmpty();
        assertThat(AnnotationIds.isValid(id)).isFalse();
    }

    @Test
    void requireType_failsWithValidationError() {
        assertThatThrownBy(() -> AnnotationIds.requireType("nonsense"))
            .isInstanceOf(AnnotationValidationException.class)
            .hasMessageContaining("nonsense");
    }

    @Test
    @DisplayName("Family B keys use prefixes and rounded coordinates")
    void deriveKey_familyB() {
        assertThat(AnnotationIds.deriveKey(Annotation.point(Vec3.of(10.4, 19.6, 30)).build(), BackendFamily.B))
            .isEqualTo("Pt10_20_30");
        assertThat(AnnotationIds.deriveKey(Annotation.line(Vec3.of(1, 2, 3), Vec3.of(4, 5, 6)).build(), BackendFamily.B))
            .isEqualTo("Ln1_2_3_4_5_6");
        assertThat(AnnotationIds.deriveKey(Annotation.sphere(Vec3.of(0, 0, 0), Vec3.of(4, 0, 0)).build(), BackendFamily.B))
            .isEqualTo("Sp0_0_0_4_0_0");
    }

    @Test
    void deriveKey_familyA() {
        assertThat(AnnotationIds.deriveKey(Annotation.point(Vec3.of(10, 20, 30)).build(), BackendFamily.A))
            .isEqualTo("10_20_30");
        assertThat(AnnotationIds.deriveKey(Annotation.line(Vec3.of(1, 2, 3), Vec3.of(4, 5, 6)).build(), BackendFamily.A))
            .isEqualTo("1_2_3-4_5_6-Line");
    }

    @Test
    void deriveKey_explicitKeyWins() {
        Annotation annotation = Annotation.point(Vec3.of(1, 2, 3)).key("server-assigned").build();

        assertThat(AnnotationIds.deriveKey(annotation, BackendFamily.B)).isEqualTo("server-assigned");
    }

    @Test
    void deriveId_embedsUserForFamilyBOnly() {
        Annotation annotation = Annotation.point(Vec3.of(1, 2, 3)).build().withUser("alice");

        assertThat(AnnotationIds.deriveId(annotation, BackendFamily.B)).isEqualTo("Pt1_2_3[user:alice]");
        assertThat(AnnotationIds.deriveId(annotation, BackendFamily.A)).isEqualTo("1_2_3");
    }

    @Test
    void deriveId_prefersServerEchoedUser() {
        Annotation annotation = Annotation.point(Vec3.of(1, 2, 3))
            .putProp(Annotation.PROP_USER, "local")
            .putExt(Annotation.EXT_USER, "server")
            .build();

        assertThat(AnnotationIds.deriveId(annotation, BackendFamily.B)).isEqualTo("Pt1_2_3[user:server]");
    }

    @Test
    void typeOfDerivedId_recoversGeometricType() {
        for (BackendFamily family : BackendFamily.values()) {
            Annotation point = Annotation.point(Vec3.of(-3, 2, 1)).build().withUser("u");
            Annotation line = Annotation.line(Vec3.of(1, 2, 3), Vec3.of(-4, 5, 6)).build().withUser("u");
            Annotation sphere = Annotation.sphere(Vec3.of(1, 2, 3), Vec3.of(4, 5, 6)).build().withUser("u");

            assertThat(AnnotationIds.typeOf(AnnotationIds.deriveId(point, family))).contains(AnnotationType.POINT);
            assertThat(AnnotationIds.typeOf(AnnotationIds.deriveId(line, family))).contains(AnnotationType.LINE);
            assertThat(AnnotationIds.typeOf(AnnotationIds.deriveId(sphere, family))).contains(AnnotationType.SPHERE);
        }
    }

    @Test
    void parseId_splitsKeyAndUser() {
        assertThat(AnnotationIds.parseId("Pt1_2_3[user:alice]"))
            .contains(new AnnotationIds.ParsedId("Pt1_2_3", "alice"));
        assertThat(AnnotationIds.parseId("1_2_3")).isEmpty();
        assertThat(AnnotationIds.keyOf("Ln1_2_3_4_5_6[user:bob]")).isEqualTo("Ln1_2_3_4_5_6");
        assertThat(AnnotationIds.keyOf("1_2_3")).isEqualTo("1_2_3");
    }

    @Test
    void positionOf_readsFirstTriple() {
        assertThat(AnnotationIds.positionOf("Pt-1_2_3")).hasValueSatisfying(p -> assertThat(p).containsExactly(-1, 2, 3));
        assertThat(AnnotationIds.positionOf("no position")).isEmpty();
    }
}
