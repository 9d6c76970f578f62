package com.example.atlas.server.service;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * 디렉토리 단위 사용량.
 * <p>
 * 루트 아래 모든 일반 파일의 크기를 재귀적으로 합산합니다.
 * 디렉토리 엔트리 자체는 합산하지 않습니다.
 * 순회 중 사라지거나 읽을 수 없는 엔트리는 0으로 취급하며,
 * 루트 자체에 접근할 수 없는 경우에만 예외를 던집니다.
 * </p>
 */
@Slf4j
public class DirectoryUsageProvider {

    /**
     * @param root 합산할 루트 디렉토리
     * @return 일반 파일 크기 합계 (바이트)
     * @throws IOException 루트에 접근할 수 없는 경우
     */
    public long getUsedBytes(Path root) throws IOException {
        // 루트 접근 실패는 walkFileTree 이전에 드러나야 함
        Files.readAttributes(root, BasicFileAttributes.class);

        SizeVisitor visitor = new SizeVisitor(root);
        Files.walkFileTree(root, visitor);

        log.debug("=== [USAGE] 디렉토리 {} used={} (skipped={}) ===",
                root, visitor.getTotal(), visitor.getSkipped());
        return visitor.getTotal();
    }

    static final class SizeVisitor extends SimpleFileVisitor<Path> {

        private final Path root;
        private long total;
        private int skipped;

        SizeVisitor(Path root) {
            this.root = root;
        }

        long getTotal() {
            return total;
        }

        int getSkipped() {
            return skipped;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile()) {
                total += attrs.size();
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (file.equals(root)) {
                throw exc;
            }
            skipped++;
            log.debug("=== [USAGE] 엔트리 건너뜀 {}: {} ===", file, exc.toString());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
            if (exc != null) {
                if (dir.equals(root)) {
                    throw exc;
                }
                skipped++;
                log.debug("=== [USAGE] 디렉토리 순회 중단 {}: {} ===", dir, exc.toString());
            }
            return FileVisitResult.CONTINUE;
        }
    }
}
