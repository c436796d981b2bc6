package org.neurosync.encoding;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.neurosync.annotation.AnnotationType;
import org.neurosync.annotation.BackendFamily;

import java.util.EnumMap;
import java.util.Map;

/**
 * Builds the {@link EncoderSet} for a collection from its API version and kind.
 * <p>
 * <ul>
 *   <li>API {@code v2}, {@code v3} or {@code test}, kind {@code Atlas}: family B atlas point encoder only</li>
 *   <li>API {@code v2}, {@code v3} or {@code test}, any other kind: family B point, line and sphere encoders</li>
 *   <li>any other API: family A (v1) point encoder only</li>
 * </ul>
 * <p>
 * <strong>Thread Safety:</strong> This factory is stateless and thread-safe.
 */
public final class AnnotationEncoderFactory {

    private AnnotationEncoderFactory() {
        // Private constructor to prevent instantiation
    }

    public static EncoderSet create(String api, String kind, ObjectMapper mapper) {
        return create(api, kind, mapper, true);
    }

    /**
     * @param api             API segment of the source URL, may be {@code null}
     * @param kind            kind of the collection, may be {@code null}
     * @param mapper          JSON mapper shared by the encoders
     * @param sendingToServer whether annotations of this collection are persisted remotely at all
     */
    public static EncoderSet create(String api, String kind, ObjectMapper mapper, boolean sendingToServer) {
        BackendFamily family = BackendFamily.forApi(api);
        Map<AnnotationType, IAnnotationEncoder> encoders = new EnumMap<>(AnnotationType.class);
        switch (family) {
            case B -> {
                if (V2AtlasAnnotationEncoder.ATLAS_KIND.equals(kind)) {
                    encoders.put(AnnotationType.POINT, new V2AtlasAnnotationEncoder(mapper, sendingToServer));
                } else {
                    encoders.put(AnnotationType.POINT, new V2PointAnnotationEncoder(mapper, sendingToServer));
                    encoders.put(AnnotationType.LINE, new V2LineAnnotationEncoder(mapper, sendingToServer));
                    encoders.put(AnnotationType.SPHERE, new V2SphereAnnotationEncoder(mapper, sendingToServer));
                }
            }
            case A -> encoders.put(AnnotationType.POINT, new V1PointAnnotationEncoder(mapper, sendingToServer));
        }
        return new EncoderSet(family, encoders);
    }
}
