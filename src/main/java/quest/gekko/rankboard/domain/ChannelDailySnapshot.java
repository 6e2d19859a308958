package quest.gekko.rankboard.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.io.Serializable;
import java.time.LocalDate;

/**
 * Statistics of the viewers seen on one channel during one daily window, plus the all-time figures
 * computed in the same pass so trend charts can plot both lines.
 */
@Entity
@Table(name = "channel_daily_snapshot", indexes = @Index(name = "idx_daily_channel", columnList = "channel_login, stat_date"))
@Getter @Setter
public class ChannelDailySnapshot {

    @EmbeddedId
    Key id;

    @Embedded
    RankAggregate aggregate = new RankAggregate();

    Integer alltimeViewerCount;
    Double alltimeMeanScore;
    Double alltimeMedianScore;

    @Embeddable
    @Getter
    @NoArgsConstructor @AllArgsConstructor
    @EqualsAndHashCode
    public static class Key implements Serializable {
        @Column(name = "stat_date", nullable = false)
        LocalDate statDate;

        @Column(name = "channel_login", nullable = false)
        String channelLogin;
    }
}
