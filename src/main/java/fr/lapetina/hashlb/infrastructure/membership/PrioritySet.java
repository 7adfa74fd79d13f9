package fr.lapetina.hashlb.infrastructure.membership;

import fr.lapetina.hashlb.domain.balancer.CrossPriorityHostMap;
import fr.lapetina.hashlb.domain.model.Host;
import fr.lapetina.hashlb.domain.model.HostHealth;
import fr.lapetina.hashlb.domain.model.HostSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Registry of hosts grouped by priority level.
 *
 * Mutations are serialized and listeners are notified synchronously on the mutating
 * thread, so a listener never runs concurrently with itself. Insertion order is kept
 * within each level.
 */
public final class PrioritySet {

    private static final Logger log = LoggerFactory.getLogger(PrioritySet.class);

    private final Map<String, Host> hosts = new LinkedHashMap<>();
    private final List<Consumer<MembershipChangeEvent>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Adds a host or replaces the one registered under the same address.
     */
    public synchronized void addHost(Host host) {
        Host previous = hosts.put(host.getAddress(), host);
        if (previous == null) {
            log.info("Host added: {}", host);
            notifyListeners(MembershipChangeEvent.of(MembershipChangeEvent.Type.ADDED, host));
        } else {
            log.info("Host updated: {}", host);
            notifyListeners(MembershipChangeEvent.of(MembershipChangeEvent.Type.UPDATED, host));
        }
    }

    /**
     * Removes a host by address.
     */
    public synchronized Optional<Host> removeHost(String address) {
        Host removed = hosts.remove(address);
        if (removed != null) {
            log.info("Host removed: {}", removed);
            notifyListeners(MembershipChangeEvent.of(MembershipChangeEvent.Type.REMOVED, removed));
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Updates the health of a host. Listeners are only notified on an actual change.
     */
    public synchronized void updateHostHealth(String address, HostHealth health) {
        Host host = hosts.get(address);
        if (host == null) {
            log.debug("Ignoring health update for unknown host {}", address);
            return;
        }
        HostHealth previous = host.setHealth(health);
        if (previous != health) {
            log.info("Host health changed: address={}, {} -> {}", address, previous, health);
            notifyListeners(MembershipChangeEvent.of(MembershipChangeEvent.Type.HEALTH_CHANGED, host));
        }
    }

    /**
     * Replaces all hosts with a new set, notifying listeners once.
     * Used for configuration reload.
     *
     * <p>A registered host whose definition is unchanged is kept as is, so its health and
     * active request counter carry over; the incoming instance is dropped.
     */
    public synchronized void replaceAll(Collection<Host> newHosts) {
        Map<String, Host> previous = new LinkedHashMap<>(hosts);
        hosts.clear();
        for (Host host : newHosts) {
            Host existing = previous.get(host.getAddress());
            Host kept = existing != null && existing.hasSameDefinition(host) ? existing : host;
            if (hosts.put(host.getAddress(), kept) != null) {
                log.warn("Duplicate host address {} in replacement set, keeping the last one", host.getAddress());
            }
        }
        long retained = hosts.values().stream()
                .filter(host -> host == previous.get(host.getAddress()))
                .count();
        log.info("Priority set replaced: {} hosts across {} priorities, {} unchanged",
                hosts.size(), priorityCount(), retained);
        notifyListeners(new MembershipChangeEvent(MembershipChangeEvent.Type.REPLACED, new ArrayList<>(hosts.values())));
    }

    public synchronized Optional<Host> getHost(String address) {
        return Optional.ofNullable(hosts.get(address));
    }

    public synchronized List<Host> getAllHosts() {
        return List.copyOf(hosts.values());
    }

    /**
     * Returns one host set per priority level from 0 to the highest priority in use.
     * Levels without hosts are present and empty.
     */
    public synchronized List<HostSet> hostSetsPerPriority() {
        int levels = priorityCount();
        List<List<Host>> grouped = new ArrayList<>(levels);
        for (int i = 0; i < levels; i++) {
            grouped.add(new ArrayList<>());
        }
        for (Host host : hosts.values()) {
            grouped.get(host.getPriority()).add(host);
        }
        List<HostSet> hostSets = new ArrayList<>(levels);
        for (int i = 0; i < levels; i++) {
            hostSets.add(HostSet.of(i, grouped.get(i)));
        }
        return List.copyOf(hostSets);
    }

    public synchronized CrossPriorityHostMap crossPriorityHostMap() {
        return CrossPriorityHostMap.of(hosts.values());
    }

    public void addListener(Consumer<MembershipChangeEvent> listener) {
        listeners.add(listener);
    }

    /**
     * Registers a listener and runs {@code initialSync} while holding the set's lock, so no
     * mutation can land between the listener's first read and its first notification.
     * If {@code initialSync} fails the listener is unregistered again.
     */
    public synchronized void subscribe(Consumer<MembershipChangeEvent> listener, Runnable initialSync) {
        listeners.add(listener);
        try {
            initialSync.run();
        } catch (RuntimeException e) {
            listeners.remove(listener);
            throw e;
        }
    }

    public void removeListener(Consumer<MembershipChangeEvent> listener) {
        listeners.remove(listener);
    }

    public synchronized int size() {
        return hosts.size();
    }

    private int priorityCount() {
        int maxPriority = -1;
        for (Host host : hosts.values()) {
            maxPriority = Math.max(maxPriority, host.getPriority());
        }
        return maxPriority + 1;
    }

    private void notifyListeners(MembershipChangeEvent event) {
        for (Consumer<MembershipChangeEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying listener", e);
            }
        }
    }
}
