package com.umitunal.hybridq.worker;

import com.umitunal.hybridq.core.ErrorKind;
import com.umitunal.hybridq.core.HybridQueueException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a submitted command line into an argument vector.
 *
 * The line is split on runs of whitespace; there is no quoting, escaping or shell expansion.
 * When application keys are configured, the first token must be one of them and is replaced
 * by the executable it maps to.
 */
public class CommandResolver {
    private final Map<String, Path> appKeys;

    public CommandResolver() {
        this(Map.of());
    }

    public CommandResolver(Map<String, Path> appKeys) {
        this.appKeys = Map.copyOf(appKeys);
    }

    public static List<String> split(String cmdline) {
        if (cmdline == null || cmdline.isBlank()) {
            return List.of();
        }
        return Arrays.asList(cmdline.strip().split("\\s+"));
    }

    /**
     * @throws HybridQueueException PROCESS_ERROR if the line is empty or names an unknown application key
     */
    public List<String> resolve(String cmdline) throws HybridQueueException {
        List<String> tokens = split(cmdline);
        if (tokens.isEmpty()) {
            throw new HybridQueueException(ErrorKind.PROCESS_ERROR, "Empty command line");
        }
        if (appKeys.isEmpty()) {
            return tokens;
        }

        Path executable = appKeys.get(tokens.get(0));
        if (executable == null) {
            throw new HybridQueueException(ErrorKind.PROCESS_ERROR, "Invalid application key: " + tokens.get(0));
        }
        List<String> argv = new ArrayList<>(tokens.size());
        argv.add(executable.toString());
        argv.addAll(tokens.subList(1, tokens.size()));
        return argv;
    }

    public Set<String> getAppKeys() {
        return appKeys.keySet();
    }
}
