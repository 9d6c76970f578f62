package com.example.atlas.server.store;

import com.example.atlas.server.entity.User;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 사용자 자격 증명 저장소 (users.json).
 * <p>
 * username → {@link User} 매핑을 메모리에 유지하고, 단일 JSON 파일과 명시적으로 동기화합니다.
 * 파일 → 메모리는 {@link #load()}, 메모리 → 파일은 {@link #save()}에서만 일어나며
 * {@link #add}/{@link #delete}는 자동 저장하지 않습니다.
 * </p>
 *
 * <h3>동시성:</h3>
 * <ul>
 *   <li>하나의 ReadWriteLock이 매핑 전체를 보호</li>
 *   <li>authenticate / list / size / save → 읽기 락 (인증 요청끼리는 서로 막지 않음)</li>
 *   <li>add / delete / load → 쓰기 락</li>
 * </ul>
 *
 * <p>
 * save()는 읽기 락만 잡고 임시 파일 없이 바로 덮어쓰므로, 별도 프로세스 두 개가 동시에
 * save()하면 파일 쓰기가 섞일 수 있습니다.
 * </p>
 */
@Slf4j
public class UserStore {

    /** bcrypt cost (고정값) */
    private static final int BCRYPT_STRENGTH = 10;

    /** bcrypt 입력 한도 */
    static final int MAX_PASSWORD_BYTES = 72;

    private final Path filePath;
    private final ObjectMapper objectMapper;
    private final BCryptPasswordEncoder passwordEncoder = new BCryptPasswordEncoder(BCRYPT_STRENGTH);
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, User> users = new LinkedHashMap<>();

    public UserStore(Path filePath, ObjectMapper objectMapper) {
        this.filePath = filePath;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public UserStore(Path filePath) {
        this(filePath, new ObjectMapper());
    }

    public Path getFilePath() {
        return filePath;
    }

    /**
     * 새 사용자를 추가합니다. 저장은 호출자가 {@link #save()}로 직접 수행해야 합니다.
     *
     * @throws UserAlreadyExistsException 이미 존재하는 사용자명인 경우
     * @throws IllegalArgumentException   비밀번호 해시 생성에 실패한 경우 (예: bcrypt 72바이트 초과)
     */
    public void add(String username, String password) {
        lock.writeLock().lock();
        try {
            if (users.containsKey(username)) {
                throw new UserAlreadyExistsException(username);
            }

            // bcrypt는 72바이트 이후를 잘라내므로 해시 생성 전에 거부
            if (exceedsLimit(password)) {
                throw new IllegalArgumentException(
                        "비밀번호는 " + MAX_PASSWORD_BYTES + "바이트를 넘을 수 없습니다: " + username);
            }
            String hash = passwordEncoder.encode(password);

            users.put(username, User.builder()
                    .username(username)
                    .passwordHash(hash)
                    .build());
            log.debug("=== [USER STORE] 사용자 추가: {} ===", username);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 사용자를 삭제합니다. 존재하지 않으면 아무 일도 하지 않습니다.
     */
    public void delete(String username) {
        lock.writeLock().lock();
        try {
            if (users.remove(username) != null) {
                log.debug("=== [USER STORE] 사용자 삭제: {} ===", username);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static boolean exceedsLimit(String password) {
        return password.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }

    /**
     * 사용자명/비밀번호를 검증합니다.
     * 존재하지 않는 사용자와 비밀번호 불일치를 구분하지 않고 모두 false를 반환합니다.
     */
    public boolean authenticate(String username, String password) {
        String hash;
        lock.readLock().lock();
        try {
            User user = users.get(username);
            if (user == null) {
                return false;
            }
            hash = user.getPasswordHash();
        } finally {
            lock.readLock().unlock();
        }

        if (hash == null || password == null) {
            return false;
        }
        // 한도를 넘는 입력은 앞 72바이트만 비교되어 잘못 일치할 수 있음
        if (exceedsLimit(password)) {
            return false;
        }
        try {
            return passwordEncoder.matches(password, hash);
        } catch (IllegalArgumentException e) {
            log.warn("=== [USER STORE] 비밀번호 비교 실패 user={}: {} ===", username, e.getMessage());
            return false;
        }
    }

    /**
     * 등록된 사용자명 목록 (순서 없음)
     */
    public Set<String> list() {
        lock.readLock().lock();
        try {
            return new HashSet<>(users.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return users.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 파일 전체를 읽어 메모리 매핑을 교체합니다.
     * 파일이 없으면 빈 저장소로 남습니다 (최초 설치).
     */
    public void load() throws IOException {
        lock.writeLock().lock();
        try {
            if (!Files.exists(filePath)) {
                log.info("=== [USER STORE] 사용자 파일 없음, 빈 저장소로 시작: {} ===", filePath);
                users.clear();
                return;
            }

            Map<String, User> loaded = objectMapper.readValue(
                    filePath.toFile(), new TypeReference<LinkedHashMap<String, User>>() { });

            users.clear();
            if (loaded != null) {
                users.putAll(loaded);
            }
            log.info("=== [USER STORE] 사용자 {}명 로드: {} ===", users.size(), filePath);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 메모리 매핑 전체를 JSON으로 직렬화해 파일을 덮어씁니다.
     * 상위 디렉토리가 없으면 생성합니다.
     */
    public void save() throws IOException {
        lock.readLock().lock();
        try {
            byte[] data = objectMapper.writeValueAsBytes(users);

            Path parent = filePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(filePath, data);
            log.debug("=== [USER STORE] 사용자 {}명 저장: {} ===", users.size(), filePath);
        } finally {
            lock.readLock().unlock();
        }
    }
}
