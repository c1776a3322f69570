package com.coursehub.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

/**
 * One stage in front of a route handler. Gates are evaluated in order and the first rejection
 * short-circuits the request.
 */
@FunctionalInterface
public interface RequestGate {

    GateDecision evaluate(HttpServletRequest request, String clientId);
}
