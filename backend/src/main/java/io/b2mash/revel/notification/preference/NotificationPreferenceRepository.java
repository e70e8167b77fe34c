package io.b2mash.revel.notification.preference;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface NotificationPreferenceRepository
    extends JpaRepository<NotificationPreference, UUID> {

  Optional<NotificationPreference> findByUserId(UUID userId);

  List<NotificationPreference> findByDigestFrequencyNot(DigestFrequency digestFrequency);
}
