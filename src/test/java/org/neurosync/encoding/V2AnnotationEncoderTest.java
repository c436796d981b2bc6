package org.neurosync.encoding;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.neurosync.annotation.Annotation;
import org.neurosync.annotation.AnnotationIds;
import org.neurosync.annotation.BackendFamily;
import org.neurosync.annotation.Vec3;
import org.neurosync.junit.extensions.logging.ExpectLog;
import org.neurosync.junit.extensions.logging.LogLevel;
import org.neurosync.junit.extensions.logging.LogWatchExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class V2AnnotationEncoderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final V2PointAnnotationEncoder points = new V2PointAnnotationEncoder(mapper, true);
    private final V2LineAnnotationEncoder lines = new V2LineAnnotationEncoder(mapper, true);
    private final V2SphereAnnotationEncoder spheres = new V2SphereAnnotationEncoder(mapper, true);
    private final V2AtlasAnnotationEncoder atlas = new V2AtlasAnnotationEncoder(mapper, true);

    private ObjectNode json(String text) throws Exception {
        return (ObjectNode) mapper.readTree(text);
    }

    @Test
    void encode_sphere() {
        Annotation sphere = Annotation.sphere(Vec3.of(0, 0, 0), Vec3.of(4, 0, 0)).build().withUser("alice");

        ObjectNode encoded = spheres.encode(sphere).orElseThrow();

        assertThat(encoded.get("kind").asText()).isEqualTo("sphere");
        assertThat(mapper.convertValue(encoded.get("pos"), long[].class)).containsExactly(0, 0, 0, 4, 0, 0);
        assertThat(encoded.get("user").asText()).isEqualTo("alice");
        assertThat(encoded.get("verified").asBoolean()).isFalse();
        assertThat(encoded.get("tags").isArray()).isTrue();
    }

    @Test
    void encode_withoutUser_isEmpty() {
        assertThat(points.encode(Annotation.point(Vec3.of(1, 2, 3)).build())).isEmpty();
    }

    @Test
    void encode_roundsPositions() {
        Annotation line = Annotation.line(Vec3.of(1.2, 2.7, 3), Vec3.of(4, 5, 6.5)).build().withUser("bob");

        ObjectNode encoded = lines.encode(line).orElseThrow();

        assertThat(mapper.convertValue(encoded.get("pos"), long[].class)).containsExactly(1, 3, 3, 4, 5, 7);
        assertThat(encoded.get("kind").asText()).isEqualTo("lineseg");
    }

    @Test
    void decode_point() throws Exception {
        Annotation annotation = points.decode("Pt1_2_3", json(
            "{\"kind\":\"point\",\"pos\":[1,2,3],\"user\":\"alice\",\"verified\":true,\"title\":\"T\","
                + "\"description\":\"hello\",\"tags\":[\"a\"],\"prop\":{\"type\":\"Split\"}}")).orElseThrow();

        assertThat(annotation.getId()).isEqualTo("Pt1_2_3[user:alice]");
        assertThat(annotation.getKey()).isEqualTo("Pt1_2_3");
        assertThat(annotation.getKind()).isEqualTo("Normal");
        assertThat(annotation.getComment()).isEqualTo("hello");
        assertThat(annotation.getTitle()).isEqualTo("T");
        assertThat(annotation.isChecked()).isTrue();
        assertThat(annotation.getExt()).containsEntry("tags", List.of("a"));
        assertThat(annotation.getDescription()).isEqualTo("T: hello");
        assertThat(annotation.getProperties()).containsExactly(3);
    }

    @Test
    void decode_sentinelDescriptionMergesIntoProp() throws Exception {
        Annotation annotation = points.decode("Pt1_2_3", json(
            "{\"kind\":\"point\",\"pos\":[1,2,3],\"user\":\"alice\","
                + "\"description\":\"${{\\\"type\\\":\\\"Merge\\\",\\\"comment\\\":\\\"c\\\"}:JSON}\"}")).orElseThrow();

        assertThat(annotation.getProp()).containsEntry("type", "Merge");
        assertThat(annotation.getComment()).isEqualTo("c");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Skipping undecodable POINT entry 'Pt1_2_3'.*Invalid kind.*")
    void decode_wrongDiscriminantIsSkipped() throws Exception {
        assertThat(points.decode("Pt1_2_3", json("{\"kind\":\"sphere\",\"pos\":[1,2,3,4,5,6]}"))).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Skipping undecodable SPHERE entry.*")
    void decode_shortPositionIsSkipped() throws Exception {
        assertThat(spheres.decode("Sp1_2_3_4_5_6", json("{\"kind\":\"sphere\",\"pos\":[1,2,3]}"))).isEmpty();
    }

    @Test
    void withDefaultDiscriminant_injectsWireKind() throws Exception {
        assertThat(lines.withDefaultDiscriminant(json("{\"pos\":[1,2,3,4,5,6]}"), "Normal").get("kind").asText())
            .isEqualTo("lineseg");
    }

    @Test
    void roundTrip_allTypes() {
        List<Annotation> annotations = List.of(
            Annotation.point(Vec3.of(1, 2, 3)).build().withUser("u").withComment("c"),
            Annotation.line(Vec3.of(1, 2, 3), Vec3.of(4, 5, 6)).build().withUser("u"),
            Annotation.sphere(Vec3.of(0, 0, 0), Vec3.of(4, 0, 0)).build().withUser("u").withTitle("ball"));
        List<AbstractV2AnnotationEncoder> encoders = List.of(points, lines, spheres);

        for (int i = 0; i < annotations.size(); i++) {
            Annotation annotation = annotations.get(i);
            AbstractV2AnnotationEncoder encoder = encoders.get(i);
            String key = AnnotationIds.deriveKey(annotation, BackendFamily.B);

            Annotation decoded = encoder.decode(key, encoder.encode(annotation).orElseThrow()).orElseThrow();

            assertThat(decoded.getId()).isEqualTo(AnnotationIds.deriveId(annotation, BackendFamily.B));
            assertThat(decoded.getPointA()).isEqualTo(annotation.getPointA());
            assertThat(decoded.getPointB()).isEqualTo(annotation.getPointB());
        }
    }

    @Test
    void atlas_uploadableOnlyWithTitle() {
        Annotation untitled = Annotation.point(Vec3.of(1, 2, 3)).kind("Atlas").build().withUser("u");

        assertThat(atlas.encode(untitled)).isPresent();
        assertThat(atlas.uploadable(untitled)).isFalse();
        assertThat(atlas.uploadable(untitled.withTitle("landmark"))).isTrue();
        assertThat(atlas.uploadableById("Pt1_2_3[user:u]")).isFalse();
        assertThat(points.uploadable(untitled)).isTrue();
    }

    @Test
    void notSendingToServer_isNeverUploadable() {
        V2PointAnnotationEncoder local = new V2PointAnnotationEncoder(mapper, false);

        assertThat(local.uploadable(Annotation.point(Vec3.of(1, 2, 3)).build().withUser("u"))).isFalse();
        assertThat(local.uploadableById("Pt1_2_3[user:u]")).isFalse();
    }
}
