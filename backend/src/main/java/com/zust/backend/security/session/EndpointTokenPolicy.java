package com.zust.backend.security.session;

import com.zust.backend.security.token.TokenKind;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Which token kind an endpoint accepts: refresh tokens only on the refresh endpoint,
 * access tokens everywhere else.
 */
public final class EndpointTokenPolicy {

    public static final String REFRESH_ENDPOINT = "/auth/token/refresh";

    private EndpointTokenPolicy() {}

    public static TokenKind requiredKind(HttpServletRequest request) {
        return requiredKind(pathWithinApplication(request));
    }

    public static TokenKind requiredKind(String path) {
        return REFRESH_ENDPOINT.equals(path) ? TokenKind.REFRESH : TokenKind.ACCESS;
    }

    private static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            uri = uri.substring(contextPath.length());
        }
        // "/auth/token/refresh/" is the same endpoint
        if (uri.length() > 1 && uri.endsWith("/")) {
            uri = uri.substring(0, uri.length() - 1);
        }
        return uri;
    }
}
