package com.coursehub.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.coursehub.backend.global.error.ProblemResponse;
import com.coursehub.backend.modules.session.application.SessionService;
import com.coursehub.backend.modules.session.application.SessionStoreUnavailableException;
import com.coursehub.backend.modules.session.domain.SessionRecord;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the session cookie once per request: a live session is touched and published as a
 * {@link SessionPrincipal}; an expired one is destroyed and its cookie cleared. An unreachable
 * session store yields 503, not an anonymous request.
 */
@Component
public class SessionAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(SessionAuthenticationFilter.class);

    private static final List<SimpleGrantedAuthority> AUTHORITIES = List.of(new SimpleGrantedAuthority("ROLE_USER"));

    private final SessionService sessionService;
    private final SessionCookieManager cookieManager;
    private final ObjectMapper objectMapper;

    public SessionAuthenticationFilter(SessionService sessionService,
                                       SessionCookieManager cookieManager,
                                       ObjectMapper objectMapper) {
        this.sessionService = sessionService;
        this.cookieManager = cookieManager;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String handle = cookieManager.extract(request);
        if (handle != null) {
            try {
                Optional<SessionRecord> session = sessionService.resolve(handle);
                if (session.isPresent()) {
                    sessionService.touch(handle);
                    authenticate(request, handle, session.get());
                } else {
                    cookieManager.clear(response);
                }
            } catch (SessionStoreUnavailableException ex) {
                log.warn("Session store unavailable while handling {} {}", request.getMethod(), request.getRequestURI(), ex);
                SecurityContextHolder.clearContext();
                writeUnavailable(request, response, ex);
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getMethod().equalsIgnoreCase("OPTIONS");
    }

    private void authenticate(HttpServletRequest request, String handle, SessionRecord session) {
        SessionPrincipal principal = new SessionPrincipal(session.userId(), handle, session.loginTime());
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, null, AUTHORITIES);
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
    }

    private void writeUnavailable(HttpServletRequest request, HttpServletResponse response,
                                  SessionStoreUnavailableException ex) throws IOException {
        ProblemResponse body = ProblemResponse.of(ex.getHttpStatus(), ex.getCode(), ex.getDetailMessage(), request.getRequestURI())
                .withRetryAfter(ex.getRetryAfterSeconds());
        response.setStatus(ex.getHttpStatus().value());
        response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(ex.getRetryAfterSeconds()));
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
