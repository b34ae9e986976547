/*
 * Copyright (c) 2025 Moataz Hussein
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.kestrelsoft.relay.tests;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.github.kestrelsoft.relay.Evaluation;
import com.github.kestrelsoft.relay.Headers;
import com.github.kestrelsoft.relay.LoggingObserver;
import com.github.kestrelsoft.relay.MutableRequest;
import com.github.kestrelsoft.relay.RelayClient;
import com.github.kestrelsoft.relay.TransportResponse;
import com.github.kestrelsoft.relay.testing.MockDelayer;
import com.github.kestrelsoft.relay.testing.RecordingTransport;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.text.MessageFormat;
import java.util.List;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.concurrent.CopyOnWriteArrayList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

class LoggingObserverTest {
  @Test
  void logsAttemptsAndResponses() {
    var transport =
        new RecordingTransport()
            .respondInOrder(
                TransportResponse.of(503, Headers.empty(), new byte[0]),
                TransportResponse.of(200, Headers.empty(), new byte[0]));
    var logger = new RecordingLogger(Level.INFO);
    var client =
        RelayClient.newBuilder()
            .transport(transport)
            .delayer(new MockDelayer(true))
            .observer(LoggingObserver.create(logger, Level.INFO))
            .build();
    var result =
        client.send(
            MutableRequest.GET("https://example.com/pokemon").toImmutableRequest(),
            List.of(
                new RecordingInterceptor("retrying", new CopyOnWriteArrayList<>())
                    .onProcess(
                        (response, context) ->
                            response.statusCode() == 503
                                ? Evaluation.retry()
                                : Evaluation.proceed())),
            Map.of());
    assertThat(result.isSuccess()).isTrue();
    assertThat(logger.records)
        .extracting(record -> record.level)
        .containsExactly(Level.INFO, Level.INFO, Level.INFO, Level.INFO);
    assertThat(logger.records.get(0).message)
        .startsWith("Sending GET https://example.com/pokemon")
        .contains("retryCount=0");
    assertThat(logger.records.get(1).message).startsWith("Received 503").contains("retryCount=0");
    assertThat(logger.records.get(2).message).contains("retryCount=1");
    assertThat(logger.records.get(3).message).startsWith("Received 200").contains("retryCount=1");
  }

  @Test
  void skipsDisabledLevels() {
    var transport = new RecordingTransport().echo();
    var logger = new RecordingLogger(Level.WARNING);
    var client =
        RelayClient.newBuilder()
            .transport(transport)
            .observer(LoggingObserver.create(logger, Level.DEBUG))
            .build();
    var result = client.send(MutableRequest.GET("https://example.com").toImmutableRequest());
    assertThat(result.isSuccess()).isTrue();
    assertThat(logger.records).isEmpty();
  }

  @Test
  void logsTransportErrorsAsWarnings() {
    var error = new IOException("connection reset");
    var transport = new RecordingTransport().failWith(error);
    var logger = new RecordingLogger(Level.WARNING);
    var client =
        RelayClient.newBuilder()
            .transport(transport)
            .observer(LoggingObserver.create(logger, Level.DEBUG))
            .build();
    client.send(MutableRequest.GET("https://example.com").toImmutableRequest());
    assertThat(logger.records)
        .extracting(record -> record.level, record -> record.thrown)
        .containsExactly(tuple(Level.WARNING, error));
    assertThat(logger.records.get(0).message).startsWith("Transport failed for");
  }

  private static final class LogRecord {
    final Level level;
    final String message;
    final @Nullable Throwable thrown;

    LogRecord(Level level, String message, @Nullable Throwable thrown) {
      this.level = level;
      this.message = message;
      this.thrown = thrown;
    }
  }

  private static final class RecordingLogger implements Logger {
    final List<LogRecord> records = new CopyOnWriteArrayList<>();
    private final Level minLevel;

    RecordingLogger(Level minLevel) {
      this.minLevel = minLevel;
    }

    @Override
    public String getName() {
      return RecordingLogger.class.getName();
    }

    @Override
    public boolean isLoggable(Level level) {
      return level.getSeverity() >= minLevel.getSeverity();
    }

    @Override
    public void log(Level level, ResourceBundle bundle, String msg, Throwable thrown) {
      if (isLoggable(level)) {
        records.add(new LogRecord(level, msg, thrown));
      }
    }

    @Override
    public void log(Level level, ResourceBundle bundle, String format, Object... params) {
      if (isLoggable(level)) {
        var message =
            params == null || params.length == 0 ? format : MessageFormat.format(format, params);
        records.add(new LogRecord(level, message, null));
      }
    }
  }
}
