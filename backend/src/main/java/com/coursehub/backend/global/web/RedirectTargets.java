package com.coursehub.backend.global.web;

/**
 * Open-redirect guard for post-login navigation. Only same-site relative paths are accepted.
 */
public final class RedirectTargets {

    public static final String DEFAULT_AFTER_LOGIN = "/dashboard";

    private RedirectTargets() {
    }

    public static boolean isSafe(String url) {
        if (url == null || url.isEmpty()) {
            return false;
        }
        return url.startsWith("/") && !url.startsWith("//") && !url.startsWith("/\\");
    }

    public static String afterLogin(String requested) {
        return isSafe(requested) ? requested : DEFAULT_AFTER_LOGIN;
    }
}
