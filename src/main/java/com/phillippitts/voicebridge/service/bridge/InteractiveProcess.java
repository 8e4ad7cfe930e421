package com.phillippitts.voicebridge.service.bridge;

import com.phillippitts.voicebridge.util.ProcessTimeouts;
import com.phillippitts.voicebridge.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A long-lived conversational subprocess with line-oriented input and streamed output.
 *
 * <p>Responsibilities:
 * - Write one line per turn to stdin
 * - Pump stdout into a buffer on a daemon thread so the child never blocks on a full pipe
 * - Capture a capped tail of stderr for diagnostics
 * - Wait for a reply according to a {@link ReplyCompletionPolicy}
 * - Terminate the child gracefully, then forcibly, in an idempotent {@link #close()}
 *
 * <p>Callers serialize turns; the pumps are the only other threads touching the buffers.
 */
public final class InteractiveProcess implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(InteractiveProcess.class);

    private final Process process;
    private final String name;
    private final Duration shutdownGrace;
    private final Runnable onClose;
    private final Writer stdin;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition outputArrived = lock.newCondition();
    private final StringBuilder output = new StringBuilder();
    private final StderrTail stderr;
    private long lastOutputNanos;
    private boolean stdoutClosed;

    private final Thread stdoutPump;
    private final Thread stderrPump;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Wraps an already started process and starts its pump threads.
     *
     * @param process started process
     * @param name short name used for thread names and logs (typically the session id)
     * @param maxStderrChars characters of stderr kept for diagnostics
     * @param shutdownGrace time the child gets to exit after stdin is closed and it is signalled
     * @param onClose run exactly once after the child is terminated (may be null)
     */
    public InteractiveProcess(Process process, String name, int maxStderrChars, Duration shutdownGrace,
                              Runnable onClose) {
        this.process = Objects.requireNonNull(process, "process");
        this.name = Objects.requireNonNull(name, "name");
        this.shutdownGrace = Objects.requireNonNull(shutdownGrace, "shutdownGrace");
        this.onClose = onClose;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        this.stderr = new StderrTail(maxStderrChars);
        this.lastOutputNanos = System.nanoTime();

        this.stdoutPump = startPump(this::pumpStdout, "bridge-out-" + name);
        this.stderrPump = startPump(this::pumpStderr, "bridge-err-" + name);
    }

    /**
     * Writes {@code text} followed by a newline. Embedded line breaks are flattened to spaces
     * so the child sees exactly one input line.
     *
     * @throws IOException if the child's stdin is closed (typically because it exited)
     */
    public void send(String text) throws IOException {
        String line = text.replace("\r\n", " ").replace('\r', ' ').replace('\n', ' ');
        lock.lock();
        try {
            // the quiet period of a reply counts from the moment the turn was written
            lastOutputNanos = System.nanoTime();
        } finally {
            lock.unlock();
        }
        stdin.write(line);
        stdin.write('\n');
        stdin.flush();
    }

    /**
     * Waits until {@code policy} reports a complete reply or {@code timeout} elapses.
     * The characters making up the reply are removed from the buffer; anything after them stays.
     *
     * @return the reply, or empty on timeout (the child keeps running)
     * @throws IOException if the child's output ended before a reply completed
     */
    public Optional<String> awaitReply(ReplyCompletionPolicy policy, Duration timeout) throws IOException {
        long deadline = TimeUtils.deadlineNanos(timeout);
        long pollNanos = ProcessTimeouts.OUTPUT_POLL_INTERVAL.toNanos();
        lock.lock();
        try {
            while (true) {
                Duration idle = Duration.ofNanos(System.nanoTime() - lastOutputNanos);
                Optional<ReplyCompletionPolicy.Completion> completion = policy.evaluate(output, idle);
                if (completion.isPresent()) {
                    output.delete(0, completion.get().consumed());
                    return Optional.of(completion.get().reply());
                }
                if (stdoutClosed) {
                    throw new IOException("Process '" + name + "' closed its output before replying");
                }
                long remaining = TimeUtils.remainingNanos(deadline);
                if (remaining <= 0) {
                    return Optional.empty();
                }
                outputArrived.awaitNanos(Math.min(remaining, pollNanos));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for a reply from '" + name + "'", e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns everything buffered so far.
     */
    public String drainOutput() {
        lock.lock();
        try {
            String pending = output.toString();
            output.setLength(0);
            return pending;
        } finally {
            lock.unlock();
        }
    }

    public boolean isAlive() {
        return !closed.get() && process.isAlive();
    }

    /**
     * @return exit code, or -1 while the process is still running
     */
    public int exitCode() {
        if (process.isAlive()) {
            return -1;
        }
        try {
            return process.exitValue();
        } catch (IllegalThreadStateException e) {
            return -1;
        }
    }

    /**
     * Last characters written to stderr, at most {@code maxChars}.
     */
    public String stderrTail(int maxChars) {
        return stderr.tail(maxChars);
    }

    public String name() {
        return name;
    }

    /**
     * Idempotent termination: close stdin, signal, wait for the grace period, then kill.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            try {
                stdin.close();
            } catch (IOException e) {
                LOG.debug("stdin of '{}' already closed: {}", name, e.toString());
            }
            if (process.isAlive()) {
                destroyProcess();
            }
            joinQuietly(stdoutPump, ProcessTimeouts.PUMP_CLEANUP_TIMEOUT);
            joinQuietly(stderrPump, ProcessTimeouts.PUMP_CLEANUP_TIMEOUT);
            LOG.debug("Process '{}' closed (exit={})", name, exitCode());
        } finally {
            if (onClose != null) {
                onClose.run();
            }
        }
    }

    private void destroyProcess() {
        try {
            process.destroy();
            boolean exited = process.waitFor(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                LOG.warn("Process '{}' ignored termination for {} ms; killing it", name, shutdownGrace.toMillis());
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process '{}' still alive after destroyForcibly", name);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process '{}'", name);
            process.destroyForcibly();
        }
    }

    private void pumpStdout() {
        char[] buf = new char[4096];
        try (Reader reader = new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)) {
            int n;
            while ((n = reader.read(buf)) != -1) {
                lock.lock();
                try {
                    output.append(buf, 0, n);
                    lastOutputNanos = System.nanoTime();
                    outputArrived.signalAll();
                } finally {
                    lock.unlock();
                }
            }
        } catch (IOException e) {
            LOG.debug("stdout pump of '{}' stopped: {}", name, e.toString());
        } finally {
            lock.lock();
            try {
                stdoutClosed = true;
                outputArrived.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }

    private void pumpStderr() {
        InputStream in = process.getErrorStream();
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                stderr.append(line);
            }
        } catch (IOException e) {
            LOG.debug("stderr pump of '{}' stopped: {}", name, e.toString());
        }
    }

    private static Thread startPump(Runnable body, String threadName) {
        Thread thread = new Thread(body, threadName);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Keeps the most recent stderr lines up to a character cap.
     */
    private static final class StderrTail {
        private final StringBuilder sink = new StringBuilder();
        private final int maxChars;

        StderrTail(int maxChars) {
            this.maxChars = maxChars;
        }

        synchronized void append(String line) {
            if (!sink.isEmpty()) {
                sink.append('\n');
            }
            sink.append(line);
            int excess = sink.length() - maxChars;
            if (excess > 0) {
                sink.delete(0, excess);
            }
        }

        synchronized String tail(int chars) {
            int from = Math.max(0, sink.length() - chars);
            return sink.substring(from);
        }
    }
}
