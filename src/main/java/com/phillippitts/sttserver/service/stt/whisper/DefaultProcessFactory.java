package com.phillippitts.sttserver.service.stt.whisper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link ProcessFactory} backed by {@link ProcessBuilder}. stdout and stderr stay separate
 * because the transcript is read from stdout only.
 */
final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command).redirectErrorStream(false);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        return pb.start();
    }
}
