package org.neurosync.encoding;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.neurosync.annotation.AnnotationType;

/**
 * Family B sphere encoder ({@code "kind": "sphere"}).
 */
public class V2SphereAnnotationEncoder extends AbstractV2AnnotationEncoder {

    public V2SphereAnnotationEncoder(ObjectMapper mapper, boolean sendingToServer) {
        super(mapper, AnnotationType.SPHERE, "sphere", sendingToServer);
    }

    @Override
    protected String getDefaultKind() {
        return null;
    }
}
