package com.example.atlas.server.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * WebDAV 접근 사용자 엔티티.
 * <p>
 * users.json 파일에 username을 키로 하는 JSON 객체로 저장됩니다.
 * 비밀번호 평문은 보관하지 않으며, bcrypt 해시만 저장합니다.
 * </p>
 *
 * <pre>
 * {
 *   "alice" : {
 *     "username" : "alice",
 *     "password_hash" : "$2a$10$..."
 *   }
 * }
 * </pre>
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    /** 사용자명 (users.json의 키와 동일, 고유값) */
    @JsonProperty("username")
    private String username;

    /** bcrypt 비밀번호 해시 (salt와 cost가 해시 문자열에 포함됨) */
    @JsonProperty("password_hash")
    private String passwordHash;
}
