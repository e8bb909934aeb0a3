package com.catalog.cli.ui;

import java.io.PrintWriter;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.jline.terminal.Terminal;
import org.springframework.stereotype.Component;

/**
 * Shows a spinning cursor while an import or export runs in the background.
 */
@Component
public class Spinner {

    private static final char[] FRAMES = new char[]{'|', '/', '-', '\\'};

    private final Terminal terminal;

    public Spinner(Terminal terminal) {
        this.terminal = terminal;
    }

    /**
     * Runs {@code task} on a worker thread and animates the spinner until it finishes.
     *
     * @param label Text shown next to the spinner.
     * @param task  The work to run.
     * @param <T>   The result type.
     * @return The task's result.
     * @throws RuntimeException the task's own exception, unwrapped.
     */
    public <T> T spin(String label, Supplier<T> task) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<T> future = executor.submit(task::get);
        PrintWriter writer = terminal.writer();
        int frame = 0;
        String prefix = "\r\u001B[33m" + label + " ";

        try {
            while (true) {
                try {
                    T result = future.get(100, TimeUnit.MILLISECONDS);
                    clearLine(writer, prefix.length() + 2);
                    return result;
                } catch (TimeoutException e) {
                    writer.print(prefix + FRAMES[frame++ % FRAMES.length] + "\u001B[0m");
                    writer.flush();
                }
            }
        } catch (Exception e) {
            clearLine(writer, prefix.length() + 2);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new RuntimeException(cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private void clearLine(PrintWriter writer, int width) {
        writer.print("\r" + " ".repeat(width) + "\r");
        writer.flush();
    }
}
