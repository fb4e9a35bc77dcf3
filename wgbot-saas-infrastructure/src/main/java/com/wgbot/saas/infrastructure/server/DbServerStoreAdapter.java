package com.wgbot.saas.infrastructure.server;

import com.wgbot.application.ports.RecordNotFoundException;
import com.wgbot.application.ports.ServerStorePort;
import com.wgbot.domain.model.Server;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
public class DbServerStoreAdapter implements ServerStorePort {

  private final ServerRepository servers;

  public DbServerStoreAdapter(ServerRepository servers) {
    this.servers = servers;
  }

  @Override
  @Transactional(readOnly = true)
  public Server getServerById(long id) {
    return servers.findById(id)
        .map(DbServerStoreAdapter::toDomain)
        .orElseThrow(() -> new RecordNotFoundException("Server", id));
  }

  @Override
  @Transactional(readOnly = true)
  public List<Server> getAllServers() {
    return servers.findAllByOrderByIdAsc().stream()
        .map(DbServerStoreAdapter::toDomain)
        .toList();
  }

  @Override
  @Transactional
  public void updateServer(Server server) {
    ServerEntity e = servers.findById(server.id())
        .orElseThrow(() -> new RecordNotFoundException("Server", server.id()));
    e.setAddress(server.address());
    e.setSshPort(server.sshPort());
    e.setSshUser(server.sshUser());
    e.setSshPassword(server.sshPassword());
    e.setMaxClients(server.maxClients());
    e.setCurrentClients(server.currentClients());
    e.setActive(server.active());
    servers.save(e);
  }

  @Override
  @Transactional
  public boolean tryReserveSlot(long serverId) {
    return servers.reserveSlot(serverId) == 1;
  }

  @Override
  @Transactional
  public void releaseSlot(long serverId) {
    servers.releaseSlot(serverId);
  }

  static Server toDomain(ServerEntity e) {
    return new Server(
        e.getId(),
        e.getAddress(),
        e.getSshPort(),
        e.getSshUser(),
        e.getSshPassword(),
        e.getMaxClients(),
        e.getCurrentClients(),
        e.isActive()
    );
  }
}
