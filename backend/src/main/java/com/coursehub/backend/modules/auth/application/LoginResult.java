package com.coursehub.backend.modules.auth.application;

import com.coursehub.backend.modules.auth.presentation.dto.LoginResponse;
import com.coursehub.backend.modules.session.domain.IssuedSession;

public record LoginResult(IssuedSession session, LoginResponse response) {
}
