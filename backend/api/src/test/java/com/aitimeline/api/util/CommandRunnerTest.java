package com.aitimeline.api.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs(OS.LINUX)
class CommandRunnerTest {

    @TempDir
    Path workDir;

    @Test
    void successfulCommandCompletesQuietly() {
        Path logFile = workDir.resolve("ok.log");

        assertDoesNotThrow(() -> CommandRunner.run(List.of("true"), logFile, "Noop", Duration.ofSeconds(10)));
        assertTrue(Files.exists(logFile));
    }

    @Test
    void failingCommandReportsExitCodeAndOutputTail() {
        // Given
        Path missing = workDir.resolve("missing-clip.mp4");

        // When
        IOException e = assertThrows(IOException.class, () -> CommandRunner.run(
                List.of("ls", missing.toString()), workDir.resolve("ls.log"), "ListClip", Duration.ofSeconds(10)));

        // Then
        assertTrue(e.getMessage().startsWith("ListClip exited with "));
        assertTrue(e.getMessage().contains("missing-clip.mp4"));
    }

    @Test
    void longRunningCommandIsKilledAtTimeout() {
        long start = System.currentTimeMillis();

        TimeoutException e = assertThrows(TimeoutException.class, () -> CommandRunner.run(
                List.of("sleep", "30"), workDir.resolve("sleep.log"), "Sleep", Duration.ofMillis(300)));

        assertTrue(e.getMessage().contains("Sleep"));
        assertTrue(System.currentTimeMillis() - start < 10_000);
    }

    @Test
    void tailKeepsOnlyTheLastNonBlankLines() throws IOException {
        // Given
        Path logFile = workDir.resolve("ffmpeg.log");
        Files.write(logFile, List.of("line 1", "line 2", "line 3", "", "line 4", "line 5", "line 6",
                "  line 7  ", "", "line 8"));

        // When
        String tail = CommandRunner.tail(logFile);

        // Then
        assertEquals(CommandRunner.TAIL_LINES, tail.split(" \\| ").length);
        assertEquals("line 4 | line 5 | line 6 | line 7 | line 8", tail);
    }

    @Test
    void traversalArgumentIsRejectedBeforeStart() {
        Path logFile = workDir.resolve("never.log");

        assertThrows(SecurityException.class, () -> CommandRunner.run(
                List.of("ls", "../../etc"), logFile, "Traversal", Duration.ofSeconds(10)));
        assertFalse(Files.exists(logFile));
    }
}
