package org.neurosync.encoding;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.neurosync.annotation.Annotation;

/**
 * Family B point encoder for atlas collections. An atlas point is only persisted once it
 * carries a non-empty title; untitled atlas points stay local drafts.
 */
public class V2AtlasAnnotationEncoder extends V2PointAnnotationEncoder {

    public static final String ATLAS_KIND = "Atlas";

    public V2AtlasAnnotationEncoder(ObjectMapper mapper, boolean sendingToServer) {
        super(mapper, sendingToServer);
    }

    @Override
    protected String getDefaultKind() {
        return ATLAS_KIND;
    }

    @Override
    public boolean uploadable(Annotation annotation) {
        if (!super.uploadable(annotation) || annotation == null) {
            return false;
        }
        String title = annotation.getTitle();
        return title != null && !title.isEmpty();
    }

    @Override
    public boolean uploadableById(String id) {
        return false;
    }
}
