/*
 * Where: Notifier channels
 * What: Writes each notification as a JSON document into a directory
 * Why: Readers of the directory must never observe a half-written file
 */
package com.example.notifier.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;

public class FileDeliveryChannel implements DeliveryChannel {

  public static final String NAME = "file";

  private final Path directory;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public FileDeliveryChannel(Path directory, ObjectMapper objectMapper, Clock clock) {
    this.directory = directory;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public void deliver(DeliveryPayload payload) {
    final byte[] content;
    try {
      content = objectMapper.writeValueAsString(payload).getBytes(StandardCharsets.UTF_8);
    } catch (JsonProcessingException ex) {
      throw new DeliveryException(DeliveryFailure.permanent("payload serialization failed"), ex);
    }
    final Path target =
        directory.resolve(
            "notification-" + payload.notificationId() + "-" + clock.millis() + ".json");
    Path temp = null;
    try {
      // Same directory so the final move stays on one filesystem and can be atomic.
      temp = Files.createTempFile(directory, ".notification-", ".tmp");
      Files.write(temp, content);
      Files.move(
          temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException ex) {
      deleteQuietly(temp, ex);
      throw new UncheckedIOException("file delivery failed for " + target.getFileName(), ex);
    }
  }

  @Override
  public DeliveryFailure classify(Throwable error) {
    if (error instanceof UncheckedIOException unchecked) {
      final IOException cause = unchecked.getCause();
      if (cause instanceof NoSuchFileException
          || cause instanceof AccessDeniedException
          || cause instanceof NotDirectoryException) {
        return DeliveryFailure.permanent(
            "output directory unusable: " + cause.getClass().getSimpleName() + " " + cause.getMessage());
      }
      return DeliveryFailure.retryable(
          "file write failed: " + cause.getClass().getSimpleName() + " " + cause.getMessage());
    }
    return DeliveryChannel.super.classify(error);
  }

  private void deleteQuietly(Path temp, IOException original) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException cleanupFailure) {
      original.addSuppressed(cleanupFailure);
    }
  }
}
