package com.zzf.workspace.core.sandbox;

import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Runs commands through the host shell with separate stdout/stderr capture. A command
 * that outlives its timeout, or whose caller cancels, is killed together with its
 * descendants.
 */
@Slf4j
public final class LocalCommandExecutor implements CommandExecutor {
    static final String TRUNCATED_SUFFIX = "\n...<truncated>";
    private static final long POLL_MS = 50L;
    private static final long READER_JOIN_MS = 3000L;

    @Override
    public CommandResult execute(CommandRequest request) {
        long t0 = System.nanoTime();
        ProcessBuilder pb = new ProcessBuilder(buildCommand(request.getCommand()));
        if (request.getCwd() != null) {
            pb.directory(request.getCwd().toFile());
        }
        pb.environment().putAll(request.getEnv());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.warn("sandbox.start.fail cmd={} err={}", request.getCommand(), e.toString());
            return CommandResult.builder()
                    .stdout("")
                    .stderr(String.valueOf(e.getMessage()))
                    .exitCode(1)
                    .durationMs(elapsedMs(t0))
                    .build();
        }
        closeQuietly(process);

        BoundedBuffer out = new BoundedBuffer(request.getMaxOutputBytes());
        BoundedBuffer err = new BoundedBuffer(request.getMaxOutputBytes());
        Thread outReader = startReader(process.getInputStream(), out, "sandbox-stdout");
        Thread errReader = startReader(process.getErrorStream(), err, "sandbox-stderr");

        boolean timedOut = false;
        boolean aborted = false;
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(1L, request.getTimeoutMs()));
        try {
            while (!process.waitFor(POLL_MS, TimeUnit.MILLISECONDS)) {
                if (request.getCancelled().getAsBoolean()) {
                    aborted = true;
                    break;
                }
                if (System.nanoTime() >= deadline) {
                    timedOut = true;
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            aborted = true;
        }
        if (timedOut || aborted) {
            kill(process);
        }
        join(outReader);
        join(errReader);

        return CommandResult.builder()
                .stdout(out.text())
                .stderr(err.text())
                .exitCode(timedOut || aborted ? null : process.exitValue())
                .durationMs(elapsedMs(t0))
                .timedOut(timedOut)
                .aborted(aborted)
                .stdoutTruncated(out.isTruncated())
                .stderrTruncated(err.isTruncated())
                .build();
    }

    static List<String> buildCommand(String command) {
        List<String> cmd = new ArrayList<>();
        if (System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win")) {
            cmd.add("powershell");
            cmd.add("-NoProfile");
            cmd.add("-ExecutionPolicy");
            cmd.add("Bypass");
            cmd.add("-Command");
        } else {
            cmd.add("sh");
            cmd.add("-c");
        }
        cmd.add(command);
        return cmd;
    }

    private static void closeQuietly(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("sandbox.stdin.close.fail err={}", e.toString());
        }
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(READER_JOIN_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Thread startReader(InputStream in, BoundedBuffer buffer, String name) {
        Thread reader = new Thread(() -> buffer.drain(in), name);
        reader.setDaemon(true);
        reader.start();
        return reader;
    }

    private static void join(Thread reader) {
        try {
            reader.join(READER_JOIN_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }

    /**
     * Keeps the first {@code limit} bytes and discards the rest, so a chatty process
     * never blocks on a full pipe.
     */
    static final class BoundedBuffer {
        private final int limit;
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        private volatile boolean truncated;

        BoundedBuffer(int limit) {
            this.limit = Math.max(0, limit);
        }

        void drain(InputStream in) {
            byte[] buf = new byte[4096];
            try (InputStream stream = in) {
                int read;
                while ((read = stream.read(buf)) >= 0) {
                    append(buf, read);
                }
            } catch (IOException e) {
                log.debug("sandbox.read.fail err={}", e.toString());
            }
        }

        synchronized void append(byte[] buf, int len) {
            int room = limit - bytes.size();
            if (len > room) {
                truncated = true;
            }
            if (room > 0) {
                bytes.write(buf, 0, Math.min(room, len));
            }
        }

        synchronized String text() {
            String text = bytes.toString(StandardCharsets.UTF_8);
            return truncated ? text + TRUNCATED_SUFFIX : text;
        }

        boolean isTruncated() {
            return truncated;
        }
    }
}
