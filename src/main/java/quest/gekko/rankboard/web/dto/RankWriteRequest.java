package quest.gekko.rankboard.web.dto;

/**
 * A rank reading pushed by the account side. The peak fields are optional; when {@code peakTier} is set the
 * stored peak is overwritten with them instead of being compared.
 */
public record RankWriteRequest(String viewerId,
                               String displayName,
                               String riotId,
                               String region,
                               String tier,
                               String division,
                               Integer lp,
                               String peakTier,
                               String peakDivision,
                               Integer peakLp,
                               boolean plusActive) {

    public boolean hasExplicitPeak() {
        return peakTier != null && !peakTier.isBlank();
    }
}
