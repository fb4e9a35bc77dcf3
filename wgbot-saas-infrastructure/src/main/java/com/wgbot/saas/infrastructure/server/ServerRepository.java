package com.wgbot.saas.infrastructure.server;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ServerRepository extends JpaRepository<ServerEntity, Long> {

  List<ServerEntity> findAllByOrderByIdAsc();

  /**
   * Conditional increment; the row is only touched while below capacity, so concurrent callers cannot overbook.
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("update ServerEntity s set s.currentClients = s.currentClients + 1 " +
      "where s.id = :id and s.active = true and s.currentClients < s.maxClients")
  int reserveSlot(@Param("id") long id);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("update ServerEntity s set s.currentClients = s.currentClients - 1 " +
      "where s.id = :id and s.currentClients > 0")
  int releaseSlot(@Param("id") long id);
}
