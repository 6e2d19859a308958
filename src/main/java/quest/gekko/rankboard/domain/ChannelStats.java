package quest.gekko.rankboard.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

/**
 * All-time statistics of one channel. Fully replaced on every aggregation cycle.
 */
@Entity
@Table(name = "channel_stats", indexes = @Index(name = "idx_stats_mean_score", columnList = "eligible, mean_score"))
@Getter @Setter
public class ChannelStats {
    @Id
    @Column(name = "channel_login", nullable = false)
    String channelLogin;

    String displayName;

    @Embedded
    RankAggregate aggregate = new RankAggregate();

    /** Window date of the cycle that produced this row. */
    LocalDate lastComputedStatDate;
}
