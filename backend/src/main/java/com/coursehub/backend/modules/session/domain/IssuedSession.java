package com.coursehub.backend.modules.session.domain;

public record IssuedSession(String handle, SessionRecord session) {
}
