package quest.gekko.rankboard.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.rankboard.domain.RankObservation;
import quest.gekko.rankboard.domain.ViewerRank;
import quest.gekko.rankboard.repository.ViewerRankRepository;
import quest.gekko.rankboard.web.dto.RankWriteRequest;
import quest.gekko.rankboard.web.dto.ViewerRankDTO;

import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Write path for viewer ranks. Every reading goes through {@link PeakTracker} before it is stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RankService {

    private final ViewerRankRepository rankRepository;
    private final PeakTracker peakTracker;
    private final WindowClock windowClock;

    @Transactional
    public PeakUpdate storeRank(RankWriteRequest request) {
        if (request.viewerId() == null || request.viewerId().isBlank()) {
            throw new IllegalArgumentException("viewerId is required");
        }
        if (request.displayName() == null || request.displayName().isBlank()) {
            throw new IllegalArgumentException("displayName is required");
        }
        RankObservation current = RankObservation.parse(request.tier(), request.division(), request.lp())
                .orElseThrow(() -> new IllegalArgumentException("Unknown tier: " + request.tier()));
        RankObservation explicitPeak = null;
        if (request.hasExplicitPeak()) {
            explicitPeak = RankObservation.parse(request.peakTier(), request.peakDivision(), request.peakLp())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown peak tier: " + request.peakTier()));
        }

        ViewerRank row = rankRepository.findById(request.viewerId()).orElseGet(() -> {
            ViewerRank fresh = new ViewerRank();
            fresh.setViewerId(request.viewerId());
            return fresh;
        });
        row.setDisplayName(request.displayName().trim().toLowerCase(Locale.ROOT));
        row.setRiotId(request.riotId());
        row.setRegion(request.region());
        row.setPlusActive(request.plusActive());

        PeakUpdate update = write(row, current, explicitPeak);
        log.info("Stored rank {} for {} (peak: {})", current, row.getDisplayName(), update);
        return update;
    }

    /** Stores a fresh reading for an existing row, comparing it against the stored peak. */
    @Transactional
    public PeakUpdate recordReading(ViewerRank row, RankObservation current) {
        return write(row, current, null);
    }

    /** Overwrites the stored peak without comparison. Returns UNCHANGED when the viewer no longer exists. */
    @Transactional
    public PeakUpdate overridePeak(String viewerId, RankObservation peak) {
        int updated = rankRepository.updatePeak(viewerId, peak.tier().name(), peak.divisionName(), peak.points());
        return updated > 0 ? PeakUpdate.EXPLICIT_OVERRIDE : PeakUpdate.UNCHANGED;
    }

    @Transactional
    public void delete(String viewerId) {
        if (!rankRepository.existsById(viewerId)) {
            throw new NoSuchElementException("No rank stored for " + viewerId);
        }
        rankRepository.deleteById(viewerId);
        log.info("Deleted rank of {}", viewerId);
    }

    @Transactional
    public void setShowPeak(String viewerId, boolean showPeak) {
        ViewerRank row = rankRepository.findById(viewerId)
                .orElseThrow(() -> new NoSuchElementException("No rank stored for " + viewerId));
        row.setShowPeak(showPeak);
        rankRepository.save(row);
    }

    @Transactional(readOnly = true)
    public Optional<ViewerRankDTO> findEffectiveRank(String username) {
        if (username == null || username.isBlank()) return Optional.empty();
        return rankRepository.findFirstByDisplayNameOrderByLastUpdatedDesc(username.trim().toLowerCase(Locale.ROOT))
                .flatMap(row -> {
                    boolean showingPeak = row.isShowPeak() && row.peak().isPresent();
                    return EffectiveRank.of(row).map(rank -> ViewerRankDTO.of(row.getDisplayName(), rank, showingPeak));
                });
    }

    private PeakUpdate write(ViewerRank row, RankObservation current, RankObservation explicitPeak) {
        row.setCurrent(current);
        PeakUpdate update = peakTracker.apply(row, current, explicitPeak);
        row.setLastUpdated(windowClock.now());
        rankRepository.upsert(row);
        return update;
    }
}
