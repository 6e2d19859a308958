package quest.gekko.rankboard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "channel")
@Getter @Setter
public class Channel {
    /** Lower-case streaming login, also the key of every stats row. */
    @Id
    @Column(name = "login", nullable = false)
    String login;

    String displayName;

    /** Rank identity (PUUID) the streamer linked for their own account, excluded from their own stats. */
    @Column(name = "linked_viewer_id")
    String linkedViewerId;

    @Column(nullable = false)
    Instant createdAt = Instant.now();
}
