package org.neurosync.source;

import org.neurosync.annotation.Annotation;
import org.neurosync.api.IAnnotationListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans change notifications out to registered listeners. A failing listener is logged and
 * does not prevent delivery to the others.
 */
public final class AnnotationListeners implements IAnnotationListener {

    private static final Logger log = LoggerFactory.getLogger(AnnotationListeners.class);

    private final List<IAnnotationListener> listeners = new CopyOnWriteArrayList<>();

    public void add(IAnnotationListener listener) {
        listeners.add(listener);
    }

    public void remove(IAnnotationListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void childAdded(Annotation annotation) {
        dispatch("childAdded", l -> l.childAdded(annotation));
    }

    @Override
    public void childUpdated(Annotation annotation) {
        dispatch("childUpdated", l -> l.childUpdated(annotation));
    }

    @Override
    public void childDeleted(String annotationId) {
        dispatch("childDeleted", l -> l.childDeleted(annotationId));
    }

    private void dispatch(String event, Consumer<IAnnotationListener> call) {
        for (IAnnotationListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on {}", listener, event, e);
            }
        }
    }
}
