/*
 * どこで: Gateway ツール実行
 * 何を: 設定されたバイナリを子プロセスとして起動し、標準出力の JSON を結果として返す
 * なぜ: 価格取得/分析/oracle feed の実処理をゲートウェイの外に置いたまま呼び出すため
 */
package com.oraclegate.gateway.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.oraclegate.gateway.config.GatewayConfig;
import com.oraclegate.gateway.config.ToolProperties;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

@Component
public class ProcessToolCommandRunner implements ToolCommandRunner {

  private static final Logger logger = LoggerFactory.getLogger(ProcessToolCommandRunner.class);
  private static final int MAX_STDERR_BYTES = 4096;
  private static final int MAX_ERROR_EXCERPT = 400;

  private final ToolProperties properties;
  private final ObjectMapper objectMapper;
  private final Executor ioExecutor;

  public ProcessToolCommandRunner(
      ToolProperties properties,
      ObjectMapper objectMapper,
      @Qualifier(GatewayConfig.TOOL_IO_EXECUTOR) Executor ioExecutor) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.ioExecutor = ioExecutor;
  }

  @Override
  public JsonNode run(String command, List<String> arguments) {
    final List<String> commandLine = new ArrayList<>();
    commandLine.add(properties.binary());
    commandLine.add(command);
    commandLine.addAll(arguments);

    final Process process;
    try {
      process = new ProcessBuilder(commandLine).redirectErrorStream(false).start();
    } catch (IOException ex) {
      throw new ToolCommandException(command + " could not be started", ex);
    }

    final CompletableFuture<byte[]> stdout;
    final CompletableFuture<byte[]> stderr;
    try {
      stdout =
          CompletableFuture.supplyAsync(
              () -> readCapped(process, process.getInputStream(), properties.maxOutputBytes()),
              ioExecutor);
      stderr =
          CompletableFuture.supplyAsync(
              () -> readCapped(process, process.getErrorStream(), MAX_STDERR_BYTES), ioExecutor);
    } catch (TaskRejectedException ex) {
      process.destroyForcibly();
      throw new ToolCommandException(command + " rejected: too many running commands", ex);
    }

    final int exitCode = awaitExit(process, command);
    final byte[] out = join(stdout, command);
    if (out == null) {
      throw new ToolCommandException(command + " output exceeded " + properties.maxOutputBytes() + " bytes");
    }
    if (exitCode != 0) {
      final byte[] err = join(stderr, command);
      final String message = excerpt(err != null && err.length > 0 ? err : out);
      logger.warn("tool command failed command={} exit_code={} stderr={}", command, exitCode, message);
      throw new ToolCommandException(command + " failed (code " + exitCode + "): " + message);
    }
    return parse(command, new String(out, StandardCharsets.UTF_8).trim());
  }

  private int awaitExit(Process process, String command) {
    try {
      if (!process.waitFor(properties.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        logger.warn("tool command timed out command={} timeout={}", command, properties.timeout());
        throw new ToolCommandException(command + " timed out");
      }
      return process.exitValue();
    } catch (InterruptedException ex) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new ToolCommandException(command + " interrupted", ex);
    }
  }

  private JsonNode parse(String command, String raw) {
    if (raw.isEmpty()) {
      throw new ToolCommandException(command + " returned empty stdout");
    }
    try {
      return objectMapper.readTree(raw);
    } catch (JsonProcessingException ex) {
      throw new ToolCommandException(command + " stdout is not JSON: " + excerpt(raw), ex);
    }
  }

  /** Returns null and kills the process when the stream exceeds {@code maxBytes}. */
  private static byte[] readCapped(Process process, InputStream stream, int maxBytes) {
    try (InputStream in = stream) {
      final byte[] bytes = in.readNBytes(maxBytes + 1);
      if (bytes.length > maxBytes) {
        process.destroyForcibly();
        return null;
      }
      return bytes;
    } catch (IOException ex) {
      throw new CompletionException(ex);
    }
  }

  private static byte[] join(CompletableFuture<byte[]> future, String command) {
    try {
      return future.join();
    } catch (CompletionException ex) {
      throw new ToolCommandException(command + " output could not be read", ex.getCause());
    }
  }

  private static String excerpt(byte[] bytes) {
    return excerpt(new String(bytes, StandardCharsets.UTF_8).trim());
  }

  private static String excerpt(String text) {
    return text.length() <= MAX_ERROR_EXCERPT ? text : text.substring(0, MAX_ERROR_EXCERPT);
  }
}
