package io.trektribe.backend.notification.realtime;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory map of recipient to live connections. Updates for one recipient go through {@code
 * compute} on that recipient's key only, so unrelated recipients never contend and an emptied entry
 * is removed atomically.
 */
@Component
public class RecipientChannelRegistry {

  private static final Logger log = LoggerFactory.getLogger(RecipientChannelRegistry.class);

  private final Map<String, Set<RealtimeConnection>> connectionsByRecipient =
      new ConcurrentHashMap<>();
  private final Map<RealtimeConnection, String> recipientByConnection = new ConcurrentHashMap<>();

  public void register(String recipientId, RealtimeConnection connection) {
    String previous = recipientByConnection.putIfAbsent(connection, recipientId);
    if (previous != null) {
      throw new IllegalStateException(
          "Connection " + connection.connectionId() + " is already registered");
    }
    connectionsByRecipient.compute(
        recipientId,
        (key, connections) -> {
          Set<RealtimeConnection> target =
              connections != null ? connections : ConcurrentHashMap.newKeySet();
          target.add(connection);
          return target;
        });
    log.debug("Registered connection {} for recipient {}", connection.connectionId(), recipientId);
  }

  /**
   * @return true if the connection was registered and has now been removed
   */
  public boolean unregister(RealtimeConnection connection) {
    String recipientId = recipientByConnection.remove(connection);
    if (recipientId == null) {
      return false;
    }
    connectionsByRecipient.computeIfPresent(
        recipientId,
        (key, connections) -> {
          connections.remove(connection);
          return connections.isEmpty() ? null : connections;
        });
    log.debug(
        "Unregistered connection {} for recipient {}", connection.connectionId(), recipientId);
    return true;
  }

  /** Snapshot of the recipient's live connections, possibly empty. */
  public Set<RealtimeConnection> activeConnections(String recipientId) {
    Set<RealtimeConnection> connections = connectionsByRecipient.get(recipientId);
    return connections == null ? Set.of() : Set.copyOf(connections);
  }

  public List<RealtimeConnection> allConnections() {
    return List.copyOf(recipientByConnection.keySet());
  }

  public int connectionCount() {
    return recipientByConnection.size();
  }

  public int recipientCount() {
    return connectionsByRecipient.size();
  }
}
