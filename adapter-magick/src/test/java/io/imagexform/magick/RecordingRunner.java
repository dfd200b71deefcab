package io.imagexform.magick;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Records every command line and answers with a canned result instead of starting a process. */
final class RecordingRunner implements MagickRunner {

    final List<List<String>> commands = new ArrayList<>();
    final List<Duration> timeouts = new ArrayList<>();
    private RunResult result = new RunResult(0, "", "", 5);
    private IOException failure;

    RecordingRunner answering(RunResult canned) {
        this.result = canned;
        return this;
    }

    RecordingRunner failingWith(IOException e) {
        this.failure = e;
        return this;
    }

    List<String> lastCommand() {
        return commands.get(commands.size() - 1);
    }

    @Override
    public RunResult run(List<String> command, Duration timeout) throws IOException {
        commands.add(List.copyOf(command));
        timeouts.add(timeout);
        if (failure != null) {
            throw failure;
        }
        return result;
    }
}
