package com.coursehub.backend.global.web;

import java.util.List;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.lang.NonNull;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Runs a fixed chain of {@link RequestGate}s before the handler. A rejection is thrown as its
 * problem so the exception handler renders it like any other failure.
 */
public class RequestGateInterceptor implements HandlerInterceptor {

    private final List<RequestGate> gates;

    public RequestGateInterceptor(List<RequestGate> gates) {
        this.gates = List.copyOf(gates);
    }

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        String clientId = ClientIpResolver.resolve(request);
        for (RequestGate gate : gates) {
            GateDecision decision = gate.evaluate(request, clientId);
            if (!decision.allowed()) {
                throw decision.rejection();
            }
        }
        return true;
    }
}
