/*
 * Where: Notifier data access
 * What: Versioned storage of notification requests
 * Why: Status writes are compare-and-set on resourceVersion so concurrent reconciles cannot lose updates
 */
package com.example.notifier.repository;

import com.example.notifier.model.NotificationRequest;
import com.example.notifier.model.NotificationRequestStatus;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface NotificationRequestStore {

  void insert(NotificationRequest request);

  Optional<NotificationRequest> findById(UUID id);

  /**
   * Writes the status only when the stored version still equals {@code expectedVersion}, bumping
   * the version by one.
   *
   * @return false when another writer got there first or the request no longer exists
   */
  boolean compareAndSetStatus(
      UUID id, long expectedVersion, NotificationRequestStatus status, Instant updatedAt);
}
