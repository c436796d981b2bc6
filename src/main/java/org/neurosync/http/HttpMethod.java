package org.neurosync.http;

public enum HttpMethod {
    GET,
    POST,
    DELETE
}
