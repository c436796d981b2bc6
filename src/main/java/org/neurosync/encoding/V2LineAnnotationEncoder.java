package org.neurosync.encoding;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.neurosync.annotation.AnnotationType;

/**
 * Family B line segment encoder ({@code "kind": "lineseg"}).
 */
public class V2LineAnnotationEncoder extends AbstractV2AnnotationEncoder {

    public V2LineAnnotationEncoder(ObjectMapper mapper, boolean sendingToServer) {
        super(mapper, AnnotationType.LINE, "lineseg", sendingToServer);
    }

    @Override
    protected String getDefaultKind() {
        return null;
    }
}
