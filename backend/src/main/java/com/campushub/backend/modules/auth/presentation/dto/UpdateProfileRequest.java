package com.campushub.backend.modules.auth.presentation.dto;

/**
 * 프로필 부분 수정. 새 {@code password}는 {@code oldPassword}와 함께 보내야 한다.
 */
public record UpdateProfileRequest(
        String fullName,
        String phone,
        String password,
        String oldPassword
) {

    public boolean isEmpty() {
        return fullName == null && phone == null && password == null;
    }
}
