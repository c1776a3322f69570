package com.coursehub.backend.global.web;

import java.util.Objects;

import com.coursehub.backend.global.error.ProblemException;

public record GateDecision(boolean allowed, ProblemException rejection) {

    private static final GateDecision ALLOW = new GateDecision(true, null);

    public GateDecision {
        if (!allowed) {
            Objects.requireNonNull(rejection, "a rejected decision needs a rejection");
        }
    }

    public static GateDecision allow() {
        return ALLOW;
    }

    public static GateDecision reject(ProblemException rejection) {
        return new GateDecision(false, rejection);
    }
}
