package com.authprobe.core.model;

import java.util.Objects;

/** 후보 자격증명 한 쌍. toString()은 비밀번호를 가린다. */
public record Credential(String username, String password) {

    public Credential {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
    }

    @Override
    public String toString() {
        return "Credential{" + username + ":***}";
    }
}
