package org.neurosync.source;

import org.neurosync.annotation.AnnotationIds;
import org.neurosync.annotation.Vec3;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * URL layout of an annotation backend.
 * <pre>
 *   top level   &lt;baseUrl&gt;/&lt;api or clio_toplevel&gt;
 *   datasets    &lt;top&gt;/datasets
 *   entry       &lt;top&gt;/&lt;annotations|atlas&gt;/&lt;dataset&gt;
 *   list all    &lt;entry&gt;[?groups=..]
 * </pre>
 * Backends with a point query API (the top-level API, or any atlas collection) address single
 * annotations by {@code ?x=&y=&z=}; the others post to the entry URL and delete by key.
 */
public final class AnnotationEndpoints {

    public static final String TOP_LEVEL_API = "clio_toplevel";

    private final SourceParameters parameters;

    public AnnotationEndpoints(SourceParameters parameters) {
        this.parameters = parameters;
    }

    public String topLevelUrl() {
        String api = parameters.getApi();
        return parameters.getBaseUrl() + "/" + (api == null || api.isEmpty() ? TOP_LEVEL_API : api);
    }

    public String datasetsUrl() {
        return topLevelUrl() + "/datasets";
    }

    public String entryUrl() {
        return topLevelUrl() + "/" + (parameters.isAtlas() ? "atlas" : "annotations") + "/" + parameters.getDataset();
    }

    /**
     * @return the list-all URL, which also identifies the collection's cache
     */
    public String listAllUrl() {
        String groups = parameters.getGroups();
        if (groups == null || groups.isEmpty()) {
            return entryUrl();
        }
        return entryUrl() + "?groups=" + URLEncoder.encode(groups, StandardCharsets.UTF_8);
    }

    public boolean hasPointQueryApi() {
        return TOP_LEVEL_API.equals(parameters.getApi()) || parameters.isAtlas();
    }

    public String postUrl(Vec3 position) {
        if (hasPointQueryApi()) {
            return pointUrl(position.rounded().toLongs());
        }
        return entryUrl();
    }

    public String deleteUrl(String key) {
        if (hasPointQueryApi()) {
            return AnnotationIds.positionOf(key)
                .map(this::pointUrl)
                .orElseGet(() -> keyUrl(key));
        }
        return keyUrl(key);
    }

    private String keyUrl(String key) {
        return entryUrl() + "/" + URLEncoder.encode(key, StandardCharsets.UTF_8);
    }

    private String pointUrl(long[] position) {
        return entryUrl() + "?x=" + position[0] + "&y=" + position[1] + "&z=" + position[2];
    }
}
