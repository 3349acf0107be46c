package com.questrail.chatmail.protocol.idle;

import com.questrail.chatmail.api.Transport;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The set of coordinators, exactly one per {@link Transport}.
 */
public final class TransportCoordinators {

    private final Map<Transport, InterruptCoordinator> coordinators;

    public TransportCoordinators() {
        EnumMap<Transport, InterruptCoordinator> map = new EnumMap<>(Transport.class);
        for (Transport t : Transport.values()) {
            map.put(t, new InterruptCoordinator(t));
        }
        this.coordinators = Collections.unmodifiableMap(map);
    }

    public InterruptCoordinator get(Transport transport) {
        return coordinators.get(Objects.requireNonNull(transport, "transport"));
    }

    public void interrupt(Transport transport) {
        get(transport).interrupt();
    }

    public void interruptAll() {
        coordinators.values().forEach(InterruptCoordinator::interrupt);
    }

    public void shutdownAll() {
        coordinators.values().forEach(InterruptCoordinator::shutdown);
    }
}
