package com.aitimeline.api.util;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * 작업 파일 경로 보안 검증 유틸리티
 * - Path Traversal 방지
 * - 허용된 임시 디렉토리 내에서만 FFmpeg 입출력 허용
 */
@Slf4j
public class PathValidator {

    private static final String[] ALLOWED_DIRECTORIES = {
            "/tmp/aitimeline",
            System.getProperty("java.io.tmpdir")
    };

    private static final String[] FORBIDDEN_PATTERNS = {
            "..",
            "\0",
            "\n",
            "\r",
            ";",
            "|",
            "&",
            "$(",
            "`"
    };

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
     * 경로가 허용된 디렉토리 내에 있는지 검증 (심볼릭 링크 해석 포함)
     */
    public static boolean isWithinAllowedDirectory(Path path) {
        if (path == null) {
            return false;
        }

        Path normalizedPath = path.toAbsolutePath().normalize();
        Path checkedPath = normalizedPath;

        if (Files.exists(normalizedPath)) {
            try {
                checkedPath = normalizedPath.toRealPath();
            } catch (IOException e) {
                log.warn("[PathValidator] Failed to resolve real path: {}", truncate(normalizedPath.toString(), 100));
                return false;
            }
        }

        for (String allowedDir : ALLOWED_DIRECTORIES) {
            if (allowedDir != null && checkedPath.startsWith(Paths.get(allowedDir).toAbsolutePath().normalize())) {
                return true;
            }
        }

        log.warn("[PathValidator] Path outside allowed directories: {}", truncate(checkedPath.toString(), 100));
        return false;
    }

    /**
     * 경로 검증 후 Path 반환, 실패 시 SecurityException
     */
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
     * FFmpeg 명령어 인자 검증
     * - 옵션(-로 시작), 숫자, 코덱 이름은 통과
     * - ".." 포함 인자는 거부
     * - 절대경로는 허용 디렉토리 내인지 확인
     */
    public static void validateCommandArgs(List<String> args) {
        if (args == null) return;

        // 첫 인자는 설정된 실행 파일 경로
        for (String arg : args.subList(Math.min(1, args.size()), args.size())) {
            if (arg == null || arg.isEmpty()) continue;
            if (arg.startsWith("-")) continue;
            if (arg.matches("^[0-9:x.]+$")) continue;
            if (arg.matches("^[a-z0-9_]+$")) continue;

            if (arg.contains("..")) {
                log.error("[PathValidator] 상대경로 탐색 시도 차단: {}", truncate(arg, 50));
                throw new SecurityException("상대경로 접근 거부: " + truncate(arg, 50));
            }

            if (arg.startsWith("/") && !arg.equals("/dev/null")) {
                validateAndGet(arg);
            }
        }
    }

    private static String truncate(String str, int maxLength) {
        if (str == null) return "null";
        if (str.length() <= maxLength) return str;
        return str.substring(0, maxLength) + "...";
    }
}
