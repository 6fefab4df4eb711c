package io.trektribe.backend.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.trektribe.backend.exception.ResourceNotFoundException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationStoreIntegrationTest {

  @Autowired private NotificationStore store;
  @Autowired private NotificationService notificationService;

  @Test
  void unreadCountEqualsNumberCreated() {
    String recipient = newRecipient();
    createMany(recipient, 7);

    assertThat(store.countUnread(recipient)).isEqualTo(7);
  }

  @Test
  void paginatesFortyFiveRecords() {
    String recipient = newRecipient();
    createMany(recipient, 45);

    var second = notificationService.list(recipient, 2, 20, false);
    assertThat(second.items()).hasSize(20);
    assertThat(second.totalCount()).isEqualTo(45);
    assertThat(second.totalPages()).isEqualTo(3);
    assertThat(second.hasNextPage()).isTrue();
    assertThat(second.hasPrevPage()).isTrue();

    var third = notificationService.list(recipient, 3, 20, false);
    assertThat(third.items()).hasSize(5);
    assertThat(third.hasNextPage()).isFalse();
    assertThat(third.hasPrevPage()).isTrue();

    var first = notificationService.list(recipient, 1, 20, false);
    assertThat(first.hasPrevPage()).isFalse();
    assertThat(first.unreadCount()).isEqualTo(45);
  }

  @Test
  void listIsNewestFirstInCreationOrder() {
    String recipient = newRecipient();
    var created = createMany(recipient, 5);

    var page = notificationService.list(recipient, 1, 20, false);

    var expected = new ArrayList<UUID>();
    for (int i = created.size() - 1; i >= 0; i--) {
      expected.add(created.get(i).getId());
    }
    assertThat(page.items()).extracting(Notification::getId).containsExactlyElementsOf(expected);
  }

  @Test
  void markReadCountsOnlyPreviouslyUnread() {
    String recipient = newRecipient();
    var created = createMany(recipient, 8);
    store.markRead(
        recipient, Set.of(created.get(5).getId(), created.get(6).getId(), created.get(7).getId()));
    assertThat(store.countUnread(recipient)).isEqualTo(5);

    int updated =
        notificationService.markRead(
            recipient,
            List.of(created.get(0).getId(), created.get(1).getId(), created.get(5).getId()));

    assertThat(updated).isEqualTo(2);
    assertThat(store.countUnread(recipient)).isEqualTo(3);
  }

  @Test
  void markingAlreadyReadIdsChangesNothing() {
    String recipient = newRecipient();
    var created = createMany(recipient, 2);
    var ids = Set.of(created.get(0).getId(), created.get(1).getId());

    assertThat(store.markRead(recipient, ids)).isEqualTo(2);
    assertThat(store.markRead(recipient, ids)).isZero();
    assertThat(store.countUnread(recipient)).isZero();
  }

  @Test
  void markReadWithForeignIdFailsAndChangesNothing() {
    String alice = newRecipient();
    String bob = newRecipient();
    var own = createMany(alice, 1).get(0);
    var foreign = createMany(bob, 1).get(0);

    assertThatThrownBy(() -> store.markRead(alice, Set.of(own.getId(), foreign.getId())))
        .isInstanceOf(ResourceNotFoundException.class);

    assertThat(store.countUnread(alice)).isEqualTo(1);
    assertThat(store.countUnread(bob)).isEqualTo(1);
  }

  @Test
  void foreignAndMissingIdsAreIndistinguishable() {
    String alice = newRecipient();
    String bob = newRecipient();
    var foreign = createMany(bob, 1).get(0);

    var foreignFailure = catchThrowable(() -> store.markRead(alice, Set.of(foreign.getId())));
    var missingFailure = catchThrowable(() -> store.markRead(alice, Set.of(UUID.randomUUID())));

    assertThat(foreignFailure).isInstanceOf(ResourceNotFoundException.class);
    assertThat(missingFailure).isInstanceOf(ResourceNotFoundException.class);
    assertThat(((ResourceNotFoundException) foreignFailure).getBody())
        .isEqualTo(((ResourceNotFoundException) missingFailure).getBody());
  }

  @Test
  void markAllReadOnlyAffectsCaller() {
    String alice = newRecipient();
    String bob = newRecipient();
    createMany(alice, 3);
    createMany(bob, 4);

    assertThat(store.markAllRead(alice)).isEqualTo(3);

    assertThat(store.countUnread(alice)).isZero();
    assertThat(store.countUnread(bob)).isEqualTo(4);
  }

  @Test
  void otherRecipientCannotFindOrDelete() {
    String alice = newRecipient();
    String bob = newRecipient();
    var notification = createMany(alice, 1).get(0);

    assertThat(store.findOwned(bob, notification.getId())).isEmpty();
    assertThat(store.deleteOwned(bob, notification.getId())).isFalse();
    assertThat(store.findOwned(alice, notification.getId())).isPresent();
  }

  @Test
  void ownerDeleteRemovesRecord() {
    String alice = newRecipient();
    var notification = createMany(alice, 1).get(0);

    assertThat(store.deleteOwned(alice, notification.getId())).isTrue();
    assertThat(store.findOwned(alice, notification.getId())).isEmpty();
    assertThat(store.deleteOwned(alice, notification.getId())).isFalse();
  }

  @Test
  void readAndMirrorFlagsAreIndependent() {
    String alice = newRecipient();
    var notification = createMany(alice, 1).get(0);

    var mirrored = store.markEmailMirrored(notification.getId()).orElseThrow();
    assertThat(mirrored.isEmailMirrored()).isTrue();
    assertThat(mirrored.isRead()).isFalse();
    assertThat(mirrored.getUpdatedAt()).isAfterOrEqualTo(notification.getUpdatedAt());

    store.markRead(alice, Set.of(notification.getId()));
    var read = store.findOwned(alice, notification.getId()).orElseThrow();
    assertThat(read.isRead()).isTrue();
    assertThat(read.isEmailMirrored()).isTrue();
  }

  @Test
  void storedRecordMatchesInsertedRecord() {
    String alice = newRecipient();
    var context =
        new TripContext("trip-77", "Fjords", "org-1", "Olga", List.of("price", "itinerary"));
    var inserted =
        store.insert(alice, NotificationKind.TRIP_UPDATE, "Trip Updated", "Changed", context);

    var fetched = store.findOwned(alice, inserted.getId()).orElseThrow();

    assertThat(NotificationPayload.from(fetched)).isEqualTo(NotificationPayload.from(inserted));
    assertThat(fetched.isRead()).isFalse();
    assertThat(fetched.isEmailMirrored()).isFalse();
  }

  @Test
  void unreadOnlyFilter() {
    String alice = newRecipient();
    var created = createMany(alice, 4);
    store.markRead(alice, Set.of(created.get(0).getId()));

    var unread = notificationService.list(alice, 1, 20, true);

    assertThat(unread.totalCount()).isEqualTo(3);
    assertThat(unread.items()).noneMatch(Notification::isRead);
  }

  private List<Notification> createMany(String recipient, int count) {
    var created = new ArrayList<Notification>();
    for (int i = 0; i < count; i++) {
      created.add(
          store.insert(
              recipient,
              NotificationKind.TRIP_JOIN,
              "New Traveler Joined Your Trip",
              "Traveler " + i + " has joined your trip \"Alps\".",
              new TripContext("trip-" + recipient, "Alps", "traveler-" + i, "Traveler " + i)));
    }
    return created;
  }

  private static String newRecipient() {
    return "user_" + UUID.randomUUID();
  }
}
