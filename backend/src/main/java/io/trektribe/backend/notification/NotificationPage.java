package io.trektribe.backend.notification;

import java.util.List;

/**
 * One page of a recipient's notifications. Navigation flags derive only from {@code page}, {@code
 * pageSize} and {@code totalCount}.
 */
public record NotificationPage(
    List<Notification> items, int page, int pageSize, long totalCount, long unreadCount) {

  public NotificationPage {
    items = List.copyOf(items);
  }

  public long totalPages() {
    return (totalCount + pageSize - 1) / pageSize;
  }

  public boolean hasNextPage() {
    return (long) page * pageSize < totalCount;
  }

  public boolean hasPrevPage() {
    return page > 1;
  }
}
