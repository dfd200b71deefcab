package io.imagexform.magick;

/**
 * Immutable result of a {@link MagickRunner} invocation.
 *
 * @param exitCode process exit code (0 = success)
 * @param stdout captured standard output
 * @param stderr captured standard error
 * @param elapsedMs wall-clock milliseconds from process start to exit
 */
public record RunResult(int exitCode, String stdout, String stderr, long elapsedMs) {

    public RunResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    /** Returns {@code true} if the exit code is 0. */
    public boolean success() {
        return exitCode == 0;
    }

    /** The first non-blank line of stderr, or an empty string. */
    public String firstStderrLine() {
        return stderr.lines().filter(line -> !line.isBlank()).findFirst().orElse("");
    }
}
