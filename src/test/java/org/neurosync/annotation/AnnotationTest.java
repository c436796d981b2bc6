package org.neurosync.annotation;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AnnotationTest {

    @Test
    void withers_recomputeDescriptionAndProperties() {
        Annotation base = Annotation.point(Vec3.of(1, 2, 3)).kind("Note").build();

        Annotation titled = base.withTitle("Soma").withComment("check this");

        assertThat(titled.getDescription()).isEqualTo("Soma: check this");
        assertThat(titled.getProperties()).containsExactly(RenderingAttribute.DEFAULT);
        assertThat(base.getTitle()).isNull();
        assertThat(base.getDescription()).isNull();
    }

    @Test
    void presentation_withoutTitle_isComment() {
        Annotation annotation = Annotation.point(Vec3.of(1, 2, 3)).build().withComment("only comment");

        assertThat(annotation.getPresentation()).isEqualTo("only comment");
    }

    @Test
    void withChecked_updatesRenderingAttributeOfNotes() {
        Annotation note = Annotation.point(Vec3.of(1, 2, 3)).kind("Note").build();

        assertThat(note.withChecked(true).getProperties()).containsExactly(RenderingAttribute.CHECKED);
        assertThat(note.withChecked(false).getProperties()).containsExactly(RenderingAttribute.DEFAULT);
    }

    @Test
    void withProp_mergesShallowly() {
        Annotation annotation = Annotation.point(Vec3.of(1, 2, 3)).putProp("a", 1).build()
            .withProp(Map.of("b", 2, "comment", "merged"));

        assertThat(annotation.getProp()).containsEntry("a", 1).containsEntry("b", 2);
        assertThat(annotation.getDescription()).isEqualTo("merged");
    }

    @Test
    void getUser_prefersExt() {
        Annotation annotation = Annotation.point(Vec3.of(1, 2, 3))
            .putProp(Annotation.PROP_USER, "alice")
            .build();

        assertThat(annotation.getUser()).isEqualTo("alice");
        assertThat(annotation.toBuilder().putExt(Annotation.EXT_USER, "bob").build().getUser()).isEqualTo("bob");
    }

    @Test
    void isChecked_acceptsVerifiedOrChecked() {
        assertThat(Annotation.point(Vec3.of(0, 0, 0)).putExt(Annotation.EXT_VERIFIED, true).build().isChecked()).isTrue();
        assertThat(Annotation.point(Vec3.of(0, 0, 0)).putProp(Annotation.PROP_CHECKED, "true").build().isChecked()).isTrue();
        assertThat(Annotation.point(Vec3.of(0, 0, 0)).build().isChecked()).isFalse();
    }

    @Test
    void rounded_roundsBothEndpoints() {
        Annotation line = Annotation.line(Vec3.of(1.4, 2.6, 3), Vec3.of(4.5, -0.4, 6)).build().rounded();

        assertThat(line.getPointA()).isEqualTo(Vec3.of(1, 3, 3));
        assertThat(line.getPointB()).isEqualTo(Vec3.of(5, 0, 6));
    }

    @Test
    void linesRequireSecondEndpoint() {
        assertThatThrownBy(() -> Annotation.builder(AnnotationType.LINE).pointA(Vec3.of(0, 0, 0)).build())
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("pointB");
    }

    @Test
    void timestamp_isStoredInProp() {
        Annotation annotation = Annotation.point(Vec3.of(0, 0, 0)).build().withTimestamp(1234L);

        assertThat(annotation.getTimestamp()).isEqualTo(1234L);
        assertThat(annotation.getProp()).containsEntry(Annotation.PROP_TIMESTAMP, "1234");
    }
}
