package com.phillippitts.sttserver.service.stt.whisper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts OS processes. Production code uses {@link DefaultProcessFactory}; tests substitute a stub
 * returning a fake {@link Process} with scripted stdout, stderr and exit behavior.
 */
interface ProcessFactory {

    /**
     * @param command full command line, with the executable as the first element
     * @param workingDir working directory for the process (may be null)
     * @return started process
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
