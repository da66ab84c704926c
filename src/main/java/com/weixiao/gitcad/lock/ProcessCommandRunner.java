package com.weixiao.gitcad.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 基于 ProcessBuilder 的实现：stdout / stderr 各由一个线程读空，超时后强制结束进程。
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public CommandResult run(Path cwd, List<String> command, String stdin, Duration timeout) throws IOException {
        log.debug("run {} in {}", command, cwd);
        ProcessBuilder pb = new ProcessBuilder(command).directory(cwd.toFile());
        Process process = pb.start();
        CompletableFuture<String> out = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> err = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
        try (OutputStream in = process.getOutputStream()) {
            if (stdin != null) {
                in.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            // 子进程可能不读 stdin 就退出
            log.debug("stdin of {} closed early: {}", command, e.getMessage());
        }
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("command timed out after {} ms: {}", timeout.toMillis(), command);
                return CommandResult.timeout();
            }
            CommandResult result = new CommandResult(process.exitValue(), out.get(), err.get(), false);
            log.debug("command {} exited {}", command.get(command.size() > 1 ? 1 : 0), result.getExitCode());
            return result;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while running " + command);
        } catch (ExecutionException e) {
            throw new IOException("cannot read output of " + command, e.getCause());
        }
    }

    private static String drain(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
