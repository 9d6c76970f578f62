package com.example.atlas.server.store;

/**
 * 이미 등록된 사용자명으로 추가를 시도한 경우 발생합니다.
 */
public class UserAlreadyExistsException extends IllegalStateException {

    private final String username;

    public UserAlreadyExistsException(String username) {
        super("이미 존재하는 사용자입니다: " + username);
        this.username = username;
    }

    public String getUsername() {
        return username;
    }
}
