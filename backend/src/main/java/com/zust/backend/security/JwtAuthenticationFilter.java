package com.zust.backend.security;

import java.io.IOException;
import java.util.List;

import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import com.zust.backend.global.ApiException;
import com.zust.backend.security.session.EndpointTokenPolicy;
import com.zust.backend.security.session.SessionAuthority;
import com.zust.backend.security.token.TokenException;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Authenticates requests that carry {@code Authorization: Bearer <jwt>}.
 *
 * <ul>
 *   <li>no bearer token: pass through, SecurityConfig and its entry point decide</li>
 *   <li>token accepted: AuthPrincipal goes into the SecurityContext</li>
 *   <li>token rejected: the request ends here with the reason's ApiError</li>
 *   <li>version store down: the request ends here with 503 + Retry-After</li>
 * </ul>
 *
 * The refresh endpoint accepts only refresh tokens, every other path only access tokens.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SessionAuthority sessionAuthority;
    private final SecurityErrorWriter errorWriter;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        if (SecurityContextHolder.getContext().getAuthentication() != null) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = resolveBearerToken(request);
        if (token == null) {
            filterChain.doFilter(request, response);
            return;
        }

        AuthPrincipal principal;
        try {
            principal = sessionAuthority.verify(token, EndpointTokenPolicy.requiredKind(request));
        } catch (TokenException ex) {
            log.debug("Bearer token rejected: reason={}, path={}, detail={}",
                    ex.getReason(), request.getRequestURI(), ex.getMessage());
            SecurityContextHolder.clearContext();
            errorWriter.write(response, ex.getReason().errorCode());
            return;
        } catch (ApiException ex) {
            // SESSION_STORE_UNAVAILABLE: the token was not judged, the client retries after Retry-After
            log.warn("Bearer token not verified: code={}, path={}", ex.getCode(), request.getRequestURI());
            SecurityContextHolder.clearContext();
            errorWriter.write(response, ex);
            return;
        }

        var authentication = new UsernamePasswordAuthenticationToken(
                principal,
                null,
                List.of(new SimpleGrantedAuthority(principal.authority()))
        );
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        filterChain.doFilter(request, response);
    }

    private String resolveBearerToken(HttpServletRequest request) {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || authHeader.isBlank()) return null;
        if (!authHeader.startsWith(BEARER_PREFIX)) return null;

        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isBlank() ? null : token;
    }
}
