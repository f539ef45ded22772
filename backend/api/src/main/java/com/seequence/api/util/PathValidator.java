package com.seequence.api.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * 외부 프로세스(ffmpeg, ffprobe)에 넘기는 경로 검증
 * - Path traversal, command injection 패턴 차단
 * - 허용 디렉토리(임시 디렉토리 + 등록된 출력 디렉토리) 밖의 절대경로 차단
 */
@Slf4j
public final class PathValidator {

    private static final Set<String> ALLOWED_DIRECTORIES = new CopyOnWriteArraySet<>(
            Set.of(Paths.get(System.getProperty("java.io.tmpdir")).toAbsolutePath().normalize().toString()));

    private static final String[] FORBIDDEN_PATTERNS = {
            "..", "\0", "\n", "\r", ";", "|", "&", "$(", "`"
    };

    private PathValidator() {
    }

    /**
     * 출력 디렉토리 등록 (기동 시 LocalStorageService가 호출)
     */
    public static void allowDirectory(Path dir) {
        ALLOWED_DIRECTORIES.add(dir.toAbsolutePath().normalize().toString());
    }

    public static boolean isSafe(String path) {
        if (path == null || path.trim().isEmpty()) {
            return false;
        }
        for (String pattern : FORBIDDEN_PATTERNS) {
            if (path.contains(pattern)) {
                log.warn("[PathValidator] Forbidden pattern '{}' in path: {}", pattern, truncate(path, 100));
                return false;
            }
        }
        return true;
    }

    /**
     * 심볼릭 링크는 실제 경로로 해석한 뒤 다시 검사
     */
    public static boolean isWithinAllowedDirectory(Path path) {
        if (path == null) {
            return false;
        }
        Path normalized = path.toAbsolutePath().normalize();
        if (!startsWithAllowed(normalized.toString())) {
            log.warn("[PathValidator] Path outside allowed directories: {}", truncate(normalized.toString(), 100));
            return false;
        }
        if (Files.exists(normalized)) {
            try {
                String real = normalized.toRealPath().toString();
                if (!startsWithAllowed(real) && !startsWithAllowedReal(real)) {
                    log.warn("[PathValidator] Symlink traversal detected! normalized: {}, real: {}",
                            truncate(normalized.toString(), 100), truncate(real, 100));
                    return false;
                }
            } catch (IOException e) {
                log.warn("[PathValidator] Failed to resolve real path: {}", truncate(normalized.toString(), 100));
                return false;
            }
        }
        return true;
    }

    public static Path validateAndGet(String pathStr) {
        if (!isSafe(pathStr)) {
            throw new SecurityException("Unsafe path detected: " + truncate(pathStr, 50));
        }
        Path path = Paths.get(pathStr).toAbsolutePath().normalize();
        if (!isWithinAllowedDirectory(path)) {
            throw new SecurityException("Path outside allowed directory: " + truncate(pathStr, 50));
        }
        return path;
    }

    /**
     * 명령어 인자 검증 (첫 번째 요소인 실행 파일은 제외)
     * - 옵션(-로 시작), 숫자, 포맷/코덱 이름은 통과
     * - ../ 포함 인자는 거부
     * - 절대경로는 허용 디렉토리 내인지 검증
     */
    public static void validateCommandArgs(List<String> command) {
        if (command == null || command.size() < 2) {
            return;
        }
        for (String arg : command.subList(1, command.size())) {
            if (arg == null || arg.isEmpty()) continue;
            if (arg.startsWith("-")) continue;
            if (arg.matches("^[0-9:x.]+$")) continue;
            if (arg.matches("^[a-z0-9_]+$")) continue;

            if (arg.contains("..")) {
                log.error("[PathValidator] Relative traversal blocked: {}", truncate(arg, 50));
                throw new SecurityException("Relative path rejected: " + truncate(arg, 50));
            }
            if (arg.startsWith("/") && !arg.equals("/dev/null")) {
                validateAndGet(arg);
            }
        }
    }

    private static boolean startsWithAllowed(String pathStr) {
        for (String allowed : ALLOWED_DIRECTORIES) {
            if (pathStr.startsWith(allowed)) {
                return true;
            }
        }
        return false;
    }

    // macOS의 /tmp → /private/tmp 처럼 허용 디렉토리 자체가 링크인 경우
    private static boolean startsWithAllowedReal(String realPath) {
        for (String allowed : ALLOWED_DIRECTORIES) {
            try {
                Path allowedPath = Paths.get(allowed);
                if (Files.exists(allowedPath) && realPath.startsWith(allowedPath.toRealPath().toString())) {
                    return true;
                }
            } catch (IOException e) {
                log.debug("[PathValidator] Cannot resolve allowed directory {}: {}", allowed, e.getMessage());
            }
        }
        return false;
    }

    private static String truncate(String str, int maxLength) {
        if (str == null) return "null";
        if (str.length() <= maxLength) return str;
        return str.substring(0, maxLength) + "...";
    }
}
