package quest.gekko.rankboard.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import quest.gekko.rankboard.domain.Channel;

public interface ChannelRepository extends JpaRepository<Channel, String> {

    // Keeps the original created_at, refreshes the mutable fields only when new values are supplied
    @Modifying
    @Query(value = """
        INSERT INTO channel (login, display_name, linked_viewer_id, created_at)
        VALUES (:login, :displayName, :linkedViewerId, now())
        ON CONFLICT (login) DO UPDATE SET
          display_name = COALESCE(excluded.display_name, channel.display_name),
          linked_viewer_id = COALESCE(excluded.linked_viewer_id, channel.linked_viewer_id)
        """, nativeQuery = true)
    int upsert(@Param("login") final String login,
               @Param("displayName") final String displayName,
               @Param("linkedViewerId") final String linkedViewerId);
}
