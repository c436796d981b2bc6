package org.neurosync.annotation;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class RenderingAttributeTest {

    private static Annotation point(String kind) {
        return Annotation.point(Vec3.of(0, 0, 0)).kind(kind).build();
    }

    @Test
    void atlas_dependsOnTitleAndCheck() {
        assertThat(RenderingAttribute.of(point("Atlas"))).isEqualTo(-1);
        assertThat(RenderingAttribute.of(point("Atlas").withTitle("T1"))).isEqualTo(0);
        assertThat(RenderingAttribute.of(point("Atlas").withTitle("T1").withChecked(true))).isEqualTo(1);
    }

    @Test
    void synapses_haveFixedAttributes() {
        assertThat(RenderingAttribute.of(point("PreSyn"))).isEqualTo(4);
        assertThat(RenderingAttribute.of(point("PostSyn"))).isEqualTo(5);
    }

    @Test
    void bookmarkType_isDerivedFromTypeTag() {
        Annotation split = point("Normal").withProp(Map.of("type", "Split"));
        Annotation merge = point("Normal").withProp(Map.of("type", "Merge"));

        assertThat(split.getBookmarkType()).isEqualTo(BookmarkType.FALSE_MERGE);
        assertThat(RenderingAttribute.of(split)).isEqualTo(RenderingAttribute.FALSE_MERGE);
        assertThat(merge.getBookmarkType()).isEqualTo(BookmarkType.FALSE_SPLIT);
        assertThat(RenderingAttribute.of(merge)).isEqualTo(RenderingAttribute.FALSE_SPLIT);
        assertThat(RenderingAttribute.of(point("Normal"))).isEqualTo(RenderingAttribute.DEFAULT);
    }

    @Test
    void checkedNote_isHighlighted() {
        assertThat(RenderingAttribute.of(point("Note").withChecked(true))).isEqualTo(1);
    }
}
