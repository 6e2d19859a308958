package quest.gekko.rankboard.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One qualified viewer of a channel within one daily window. Rows are written upstream once the
 * minimum watch time is reached, so the set per (channel, day) is already distinct.
 */
@Entity
@Table(name = "channel_viewer_daily", indexes = {
        @Index(name = "idx_cvd_channel_date", columnList = "channel_login, stat_date"),
        @Index(name = "idx_cvd_viewer_date", columnList = "viewer_id, stat_date")
})
@Getter @Setter
public class ChannelViewerDaily {

    @EmbeddedId
    Key id;

    @Column(nullable = false)
    Instant createdAt = Instant.now();

    @Embeddable
    @Getter
    @NoArgsConstructor @AllArgsConstructor
    @EqualsAndHashCode
    public static class Key implements Serializable {
        @Column(name = "stat_date", nullable = false)
        LocalDate statDate;

        @Column(name = "channel_login", nullable = false)
        String channelLogin;

        @Column(name = "viewer_id", nullable = false)
        String viewerId;
    }
}
