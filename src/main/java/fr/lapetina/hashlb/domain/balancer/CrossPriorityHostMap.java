package fr.lapetina.hashlb.domain.balancer;

import fr.lapetina.hashlb.domain.model.Host;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable address to host lookup spanning every priority level.
 *
 * Rebuilt wholesale on each membership change, independently of the hashing snapshot.
 */
public final class CrossPriorityHostMap {

    private static final CrossPriorityHostMap EMPTY = new CrossPriorityHostMap(Map.of());

    private final Map<String, Host> hostsByAddress;

    private CrossPriorityHostMap(Map<String, Host> hostsByAddress) {
        this.hostsByAddress = hostsByAddress;
    }

    public static CrossPriorityHostMap empty() {
        return EMPTY;
    }

    public static CrossPriorityHostMap of(Collection<Host> hosts) {
        Map<String, Host> map = new HashMap<>();
        for (Host host : hosts) {
            map.put(host.getAddress(), host);
        }
        return new CrossPriorityHostMap(Collections.unmodifiableMap(map));
    }

    public Optional<Host> find(String address) {
        if (address == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(hostsByAddress.get(address));
    }

    public int size() {
        return hostsByAddress.size();
    }

    public boolean isEmpty() {
        return hostsByAddress.isEmpty();
    }

    @Override
    public String toString() {
        return "CrossPriorityHostMap{hosts=" + hostsByAddress.keySet() + '}';
    }
}
