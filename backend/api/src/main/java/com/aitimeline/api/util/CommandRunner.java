package com.aitimeline.api.util;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * ffmpeg 같은 외부 명령 실행
 * stdout/stderr 는 logFile 로 보내고, 실패하면 마지막 몇 줄만 예외 메시지에 담는다.
 * 파이프를 읽지 않으므로 출력량과 관계없이 timeout 이 그대로 적용된다.
 */
@Slf4j
public final class CommandRunner {

    static final int TAIL_LINES = 5;

    private CommandRunner() {
    }

    /**
     * @param logFile 명령 출력이 기록될 파일 (덮어쓴다)
     * @throws IOException 시작 실패 또는 0 이 아닌 종료 코드
     * @throws TimeoutException timeout 초과 (프로세스는 강제 종료)
     */
    public static void run(List<String> command, Path logFile, String taskName, Duration timeout)
            throws IOException, InterruptedException, TimeoutException {
        PathValidator.validateCommandArgs(command);

        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(logFile.toFile())
                .start();
        log.debug("[Command] {} started (pid {})", taskName, process.pid());

        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            log.error("[Command] {} timed out after {}s", taskName, timeout.toSeconds());
            throw new TimeoutException(taskName + " timed out after " + timeout.toSeconds() + "s");
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            String tail = tail(logFile);
            log.warn("[Command] {} exited with {}: {}", taskName, exitCode, tail);
            throw new IOException(taskName + " exited with " + exitCode + ": " + tail);
        }
        log.debug("[Command] {} completed", taskName);
    }

    /**
     * ffmpeg 는 실패 원인을 출력 끝에 남긴다
     */
    static String tail(Path logFile) throws IOException {
        Deque<String> lines = new ArrayDeque<>(TAIL_LINES);
        try (BufferedReader reader = Files.newBufferedReader(logFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                if (lines.size() == TAIL_LINES) {
                    lines.removeFirst();
                }
                lines.addLast(line.strip());
            }
        }
        return String.join(" | ", lines);
    }
}
