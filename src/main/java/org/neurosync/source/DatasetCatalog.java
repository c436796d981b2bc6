package org.neurosync.source;

import com.fasterxml.jackson.databind.JsonNode;
import org.neurosync.api.AnnotationValidationException;
import org.neurosync.credentials.ICredentialsProvider;
import org.neurosync.http.CancellationToken;
import org.neurosync.http.CredentialedHttpClient;
import org.neurosync.http.HttpCall;

import java.util.concurrent.CompletableFuture;

/**
 * Resolves dataset details from the backend's dataset listing.
 */
public class DatasetCatalog {

    private final CredentialedHttpClient httpClient;

    public DatasetCatalog(CredentialedHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Fills in the grayscale location of the dataset: the dataset's {@code location}, or the
     * source of the layer named by {@code mainLayer} in {@code neuroglancer.layers}.
     *
     * @throws AnnotationValidationException (through the future) if the dataset is not listed
     */
    public CompletableFuture<SourceParameters> complete(SourceParameters parameters, ICredentialsProvider credentials,
                                                        CancellationToken cancellationToken) {
        AnnotationEndpoints endpoints = new AnnotationEndpoints(parameters);
        return httpClient.requestJson(credentials, parameters.isAuthRefreshable(),
                HttpCall.get(endpoints.datasetsUrl()), cancellationToken)
            .thenApply(datasets -> {
                JsonNode dataset = datasets.path(parameters.getDataset());
                if (!dataset.isObject()) {
                    throw new AnnotationValidationException("Dataset '" + parameters.getDataset() + "' is not listed");
                }
                String grayscale = grayscaleOf(dataset);
                return grayscale == null ? parameters : parameters.toBuilder().grayscale(grayscale).build();
            });
    }

    private static String grayscaleOf(JsonNode dataset) {
        if (dataset.has("location")) {
            return requireText(dataset.get("location"), "location");
        }
        if (!dataset.has("mainLayer")) {
            return null;
        }
        String mainLayer = requireText(dataset.get("mainLayer"), "mainLayer");
        for (JsonNode layer : dataset.path("neuroglancer").path("layers")) {
            if (mainLayer.equals(layer.path("name").asText(null))) {
                JsonNode source = layer.path("source");
                return source.isObject()
                    ? requireText(source.path("url"), "source.url")
                    : requireText(source, "source");
            }
        }
        throw new AnnotationValidationException("Main layer '" + mainLayer + "' is not defined");
    }

    private static String requireText(JsonNode node, String field) {
        if (!node.isTextual()) {
            throw new AnnotationValidationException("Expected a string in '" + field + "'");
        }
        return node.asText();
    }
}
