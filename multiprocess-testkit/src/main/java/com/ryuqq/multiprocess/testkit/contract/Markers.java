package com.ryuqq.multiprocess.testkit.contract;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * File markers shared between a test and the workers it spawns.
 *
 * <p>Workers run in other JVMs, so they write plain files into a directory the test
 * owns and the test reads them back after the run. Methods are static and take the
 * directory as a {@code String} so worker lambdas can call them without capturing
 * anything that is not serializable.</p>
 *
 * <p>Each marker is written to a temporary file first and then moved into place,
 * so a reader never sees a partially written value.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Markers {

    public static final String PID_PREFIX = "pid-";
    private static final String TEMP_SUFFIX = ".tmp";

    private Markers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Writes a marker file.
     *
     * @param dir shared directory
     * @param name marker name
     * @param content marker content
     * @throws IOException if the file cannot be written
     */
    public static void write(String dir, String name, String content) throws IOException {
        Path target = Path.of(dir, name);
        Path temp = Path.of(dir, name + TEMP_SUFFIX);
        Files.writeString(temp, content, StandardCharsets.UTF_8);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
    }

    /**
     * Records the pid of the calling process under {@code pid-<name>}.
     */
    public static void writePid(String dir, String name) throws IOException {
        write(dir, PID_PREFIX + name, String.valueOf(ProcessHandle.current().pid()));
    }

    /**
     * Records the current wall-clock time in milliseconds.
     *
     * <p>Wall-clock time is comparable between processes on the same host.</p>
     */
    public static void writeTimestamp(String dir, String name) throws IOException {
        write(dir, name, String.valueOf(System.currentTimeMillis()));
    }

    public static boolean exists(String dir, String name) {
        return Files.exists(Path.of(dir, name));
    }

    public static String read(String dir, String name) throws IOException {
        return Files.readString(Path.of(dir, name), StandardCharsets.UTF_8).trim();
    }

    /**
     * Reads every marker whose name starts with the prefix, ordered by name.
     *
     * @param dir shared directory
     * @param prefix marker name prefix
     * @return numeric marker values
     */
    public static List<Long> readLongs(String dir, String prefix) {
        List<Long> values = new ArrayList<>();
        try (Stream<Path> files = Files.list(Path.of(dir))) {
            List<Path> matching = files
                .filter(path -> {
                    String fileName = path.getFileName().toString();
                    return fileName.startsWith(prefix) && !fileName.endsWith(TEMP_SUFFIX);
                })
                .sorted()
                .toList();
            for (Path path : matching) {
                values.add(Long.parseLong(Files.readString(path, StandardCharsets.UTF_8).trim()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read markers from " + dir, e);
        }
        return values;
    }
}
