package com.wgbot.saas.infrastructure.user;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface UserRepository extends JpaRepository<UserEntity, Long> {

  Optional<UserEntity> findByTelegramId(long telegramId);

  List<UserEntity> findAllByAdminTrueOrderByIdAsc();
}
