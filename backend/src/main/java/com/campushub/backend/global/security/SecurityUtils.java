package com.campushub.backend.global.security;

/**
 * {@code role.code}에 저장되는 역할 코드. Spring 권한에는 {@code ROLE_} 접두어가 붙는다.
 */
public final class SecurityUtils {

    public static final String ROLE_ADMIN = "ADMIN";
    public static final String ROLE_STUDENT = "STUDENT";

    private SecurityUtils() {
    }
}
