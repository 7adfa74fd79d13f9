package fr.lapetina.hashlb.infrastructure.membership;

import fr.lapetina.hashlb.domain.model.Host;

import java.util.List;

/**
 * Event for priority set changes.
 *
 * @param type  Kind of change
 * @param hosts Hosts the change applies to; for {@link Type#REPLACED} the full new membership
 */
public record MembershipChangeEvent(Type type, List<Host> hosts) {

    public MembershipChangeEvent {
        hosts = List.copyOf(hosts);
    }

    public static MembershipChangeEvent of(Type type, Host host) {
        return new MembershipChangeEvent(type, List.of(host));
    }

    public enum Type {
        ADDED,
        REMOVED,
        UPDATED,
        HEALTH_CHANGED,
        REPLACED
    }
}
