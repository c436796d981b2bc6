package org.neurosync.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.neurosync.cache.AnnotationCache;
import org.neurosync.credentials.ICredentialsProvider;
import org.neurosync.encoding.EncoderSet;
import org.neurosync.http.CredentialedHttpClient;

/**
 * State shared by the sources of one remote collection.
 * <p>
 * Created by {@link NeurosyncContext#open(SourceParameters)}.
 */
public final class RemoteCollection {

    private final SourceParameters parameters;
    private final AnnotationEndpoints endpoints;
    private final EncoderSet encoders;
    private final AnnotationCache cache;
    private final CredentialedHttpClient httpClient;
    private final ICredentialsProvider credentials;
    private final ObjectMapper mapper;
    private final AnnotationListeners listeners = new AnnotationListeners();

    public RemoteCollection(SourceParameters parameters, EncoderSet encoders, AnnotationCache cache,
                            CredentialedHttpClient httpClient, ICredentialsProvider credentials, ObjectMapper mapper) {
        this.parameters = parameters;
        this.endpoints = new AnnotationEndpoints(parameters);
        this.encoders = encoders;
        this.cache = cache;
        this.httpClient = httpClient;
        this.credentials = credentials;
        this.mapper = mapper;
    }

    public SourceParameters getParameters() {
        return parameters;
    }

    public AnnotationEndpoints getEndpoints() {
        return endpoints;
    }

    public EncoderSet getEncoders() {
        return encoders;
    }

    public AnnotationCache getCache() {
        return cache;
    }

    public CredentialedHttpClient getHttpClient() {
        return httpClient;
    }

    public ICredentialsProvider getCredentials() {
        return credentials;
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public AnnotationListeners getListeners() {
        return listeners;
    }
}
