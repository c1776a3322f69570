package com.coursehub.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Looks up the client address and user agent of the request bound to the current thread.
 * Outside a request (schedulers, tests) it reports {@link ClientContext#unknown()}.
 */
@Component
public class ClientContextResolver {

    public ClientContext current() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (!(attributes instanceof ServletRequestAttributes servletAttributes)) {
            return ClientContext.unknown();
        }
        return from(servletAttributes.getRequest());
    }

    public ClientContext from(HttpServletRequest request) {
        String ip = ClientIpResolver.resolve(request);
        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        return new ClientContext(
                ip != null ? ip : ClientContext.UNKNOWN,
                userAgent != null ? userAgent : ClientContext.UNKNOWN
        );
    }
}
