package com.wgbot.application.ports;

import com.wgbot.domain.model.Server;

import java.util.List;

public interface ServerStorePort {

    Server getServerById(long id);

    List<Server> getAllServers();

    void updateServer(Server server);

    /**
     * Atomically takes one client slot on an active server if occupancy is below capacity.
     *
     * @return true if a slot was reserved
     */
    boolean tryReserveSlot(long serverId);

    /**
     * Gives one slot back. Occupancy never drops below zero.
     */
    void releaseSlot(long serverId);
}
