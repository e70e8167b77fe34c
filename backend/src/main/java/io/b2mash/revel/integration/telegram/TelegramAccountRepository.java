package io.b2mash.revel.integration.telegram;

import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TelegramAccountRepository extends JpaRepository<TelegramAccount, UUID> {}
