package org.neurosync.encoding;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.neurosync.annotation.AnnotationType;

/**
 * Family B point encoder ({@code "kind": "point"}).
 */
public class V2PointAnnotationEncoder extends AbstractV2AnnotationEncoder {

    public static final String DEFAULT_KIND = "Normal";

    public V2PointAnnotationEncoder(ObjectMapper mapper, boolean sendingToServer) {
        super(mapper, AnnotationType.POINT, "point", sendingToServer);
    }

    @Override
    protected String getDefaultKind() {
        return DEFAULT_KIND;
    }
}
