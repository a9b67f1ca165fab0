package com.tablecast.hub.topic;

import com.tablecast.core.topic.Namespace;
import com.tablecast.core.topic.TopicKey;
import com.tablecast.hub.connection.HubConnection;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Topic key → subscribed connections, across every namespace.
 * <p>
 * Groups are created on first join and removed inside the same atomic map operation
 * that removes their last member, so no reader ever sees an empty group. The index
 * never owns connections; it only points at them.
 * </p>
 */
public class TopicGroupIndex {

    private final Map<TopicKey, Set<HubConnection>> groups = new ConcurrentHashMap<>();

    /**
     * Adds a connection to a group. Idempotent.
     */
    public void join(TopicKey key, HubConnection connection) {
        groups.compute(key, (k, members) -> {
            Set<HubConnection> group = members != null ? members : ConcurrentHashMap.newKeySet();
            group.add(connection);
            return group;
        });
    }

    public void join(Namespace namespace, String key, HubConnection connection) {
        join(TopicKey.of(namespace, key), connection);
    }

    /**
     * Removes a connection from a group; deletes the group if it became empty.
     * No-op for non-members and unknown keys.
     */
    public void leave(TopicKey key, HubConnection connection) {
        groups.computeIfPresent(key, (k, members) -> {
            members.remove(connection);
            return members.isEmpty() ? null : members;
        });
    }

    public void leave(Namespace namespace, String key, HubConnection connection) {
        leave(TopicKey.of(namespace, key), connection);
    }

    /**
     * Snapshot of a group's members at call time, in group iteration order.
     *
     * @return members, or an empty set when the key has no group
     */
    public Set<HubConnection> membersOf(TopicKey key) {
        Set<HubConnection> members = groups.get(key);
        if (members == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(members));
    }

    public Set<HubConnection> membersOf(Namespace namespace, String key) {
        return membersOf(TopicKey.of(namespace, key));
    }

    public boolean contains(TopicKey key) {
        return groups.containsKey(key);
    }

    public int groupCount() {
        return groups.size();
    }

    public int groupCount(Namespace namespace) {
        return (int) groups.keySet().stream()
            .filter(key -> key.namespace() == namespace)
            .count();
    }
}
