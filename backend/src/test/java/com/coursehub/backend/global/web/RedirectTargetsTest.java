package com.coursehub.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class RedirectTargetsTest {

    @ParameterizedTest
    @ValueSource(strings = {"/", "/courses/42", "/dashboard?tab=progress"})
    void relativePathsAreKept(String target) {
        assertThat(RedirectTargets.isSafe(target)).isTrue();
        assertThat(RedirectTargets.afterLogin(target)).isEqualTo(target);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"//evil.example", "/\\evil.example", "https://evil.example/", "courses/42"})
    void everythingElseFallsBackToDashboard(String target) {
        assertThat(RedirectTargets.isSafe(target)).isFalse();
        assertThat(RedirectTargets.afterLogin(target)).isEqualTo("/dashboard");
    }
}
