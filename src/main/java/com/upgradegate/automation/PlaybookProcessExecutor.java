package com.upgradegate.automation;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

class PlaybookProcessExecutor {

    Process start(List<String> command, Path workingDirectory, Map<String, String> environment) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command).directory(workingDirectory.toFile());
        builder.environment().putAll(environment);
        return builder.start();
    }
}
