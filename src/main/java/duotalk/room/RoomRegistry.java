package duotalk.room;

import duotalk.transport.ClientChannel;
import duotalk.transport.ConnectionDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks room membership and enforces the per-room capacity.
 * <p>
 * A room exists exactly while it has members: it is created by the first
 * successful join and its record is dropped when the last member leaves.
 * Membership changes are serialized on a single lock so that concurrent
 * joins to the same room can never exceed the capacity.
 */
public class RoomRegistry {
    private static final Logger logger = LoggerFactory.getLogger(RoomRegistry.class);

    public static final int DEFAULT_CAPACITY = 2;

    private final ConnectionDirectory directory;
    private final int capacity;
    private final Map<String, Set<String>> rooms = new HashMap<>();
    private final Object stateLock = new Object();

    public RoomRegistry(ConnectionDirectory directory) {
        this(directory, DEFAULT_CAPACITY);
    }

    public RoomRegistry(ConnectionDirectory directory, int capacity) {
        this.directory = Objects.requireNonNull(directory, "directory cannot be null");
        if (capacity < 1) {
            throw new IllegalArgumentException("Room capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * Admit a connection into a room.
     *
     * @param roomId       the room identifier supplied by the client
     * @param connectionId the joining connection
     * @return {@link JoinResult#FULL} without any change if the room is at capacity,
     * {@link JoinResult#ADMITTED} otherwise
     */
    public JoinResult join(String roomId, String connectionId) {
        Objects.requireNonNull(roomId, "roomId cannot be null");
        Objects.requireNonNull(connectionId, "connectionId cannot be null");

        synchronized (stateLock) {
            Set<String> members = rooms.get(roomId);
            if (members != null && members.contains(connectionId)) {
                return JoinResult.ADMITTED;
            }
            if (members != null && members.size() >= capacity) {
                logger.info("Room {} is full, rejecting {}", roomId, connectionId);
                return JoinResult.FULL;
            }
            rooms.computeIfAbsent(roomId, k -> new LinkedHashSet<>()).add(connectionId);
            logger.info("Connection {} joined room {} ({}/{})",
                    connectionId, roomId, rooms.get(roomId).size(), capacity);
            return JoinResult.ADMITTED;
        }
    }

    /**
     * Remove a connection from a room. Leaving a room twice, or a room the
     * connection never joined, is a no-op.
     */
    public void leave(String roomId, String connectionId) {
        if (roomId == null || connectionId == null) {
            return;
        }
        synchronized (stateLock) {
            Set<String> members = rooms.get(roomId);
            if (members == null || !members.remove(connectionId)) {
                return;
            }
            if (members.isEmpty()) {
                rooms.remove(roomId);
                logger.info("Connection {} left room {}, room is now empty", connectionId, roomId);
            } else {
                logger.info("Connection {} left room {} ({}/{})",
                        connectionId, roomId, members.size(), capacity);
            }
        }
    }

    /**
     * Deliver an event to every member of a room.
     *
     * @param roomId     the target room
     * @param excludedId member to skip, usually the sender; may be null
     * @param event      event name
     * @param payload    event arguments
     * @return number of members the event was delivered to
     */
    public int broadcastToRoom(String roomId, String excludedId, String event, Object... payload) {
        int delivered = 0;
        for (String memberId : members(roomId)) {
            if (memberId.equals(excludedId)) {
                continue;
            }
            if (deliver(memberId, event, payload)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Announce a connection's arrival or departure to the other members of its room.
     */
    public int notifyPeers(String roomId, String connectionId, String event) {
        return broadcastToRoom(roomId, connectionId, event, connectionId);
    }

    /**
     * Snapshot of a room's current members, empty if the room does not exist.
     */
    public List<String> members(String roomId) {
        synchronized (stateLock) {
            Set<String> members = rooms.get(roomId);
            return members == null ? List.of() : List.copyOf(members);
        }
    }

    public boolean exists(String roomId) {
        synchronized (stateLock) {
            return rooms.containsKey(roomId);
        }
    }

    public int roomCount() {
        synchronized (stateLock) {
            return rooms.size();
        }
    }

    public int capacity() {
        return capacity;
    }

    private boolean deliver(String memberId, String event, Object[] payload) {
        Optional<ClientChannel> channel = directory.find(memberId);
        if (channel.isEmpty()) {
            logger.debug("Member {} is no longer connected, skipping {}", memberId, event);
            return false;
        }
        try {
            channel.get().send(event, payload);
            return true;
        } catch (Exception e) {
            logger.warn("Failed to deliver {} to {}", event, memberId, e);
            return false;
        }
    }
}
