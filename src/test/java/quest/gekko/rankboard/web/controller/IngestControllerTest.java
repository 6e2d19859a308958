package quest.gekko.rankboard.web.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import quest.gekko.rankboard.service.core.ChannelService;
import quest.gekko.rankboard.service.core.PeakReconciliationService;
import quest.gekko.rankboard.service.core.PeakUpdate;
import quest.gekko.rankboard.service.core.RankRefreshService;
import quest.gekko.rankboard.service.core.RankService;
import quest.gekko.rankboard.service.core.ViewerSessionService;
import quest.gekko.rankboard.web.exception.GlobalExceptionHandler;

import java.util.NoSuchElementException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestController")
class IngestControllerTest {

    private MockMvc mockMvc;

    @Mock
    private RankService rankService;

    @Mock
    private PeakReconciliationService reconciliationService;

    @Mock
    private RankRefreshService refreshService;

    @Mock
    private ViewerSessionService viewerSessionService;

    @Mock
    private ChannelService channelService;

    @InjectMocks
    private IngestController ingestController;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(ingestController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("a plain rank write reports the peak path and starts reconciliation")
    void storeRank() throws Exception {
        when(rankService.storeRank(any())).thenReturn(PeakUpdate.RANK_COMPARISON);

        mockMvc.perform(post("/internal/ranks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"viewerId":"puuid-1","displayName":"someviewer","region":"euw1",
                                 "tier":"GOLD","division":"II","lp":30}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.peakUpdated").value("rank_comparison"));

        verify(reconciliationService).reconcileAsync("puuid-1");
    }

    @Test
    @DisplayName("an explicit peak skips reconciliation and an untouched peak reports false")
    void explicitPeak() throws Exception {
        when(rankService.storeRank(any())).thenReturn(PeakUpdate.UNCHANGED);

        mockMvc.perform(post("/internal/ranks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"viewerId":"puuid-1","displayName":"someviewer","tier":"GOLD","division":"II",
                                 "lp":30,"peakTier":"GOLD","peakDivision":"II","peakLp":30}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.peakUpdated").value(false));

        verifyNoInteractions(reconciliationService);
    }

    @Test
    @DisplayName("invalid rank data is 400")
    void invalidRank() throws Exception {
        when(rankService.storeRank(any())).thenThrow(new IllegalArgumentException("Unknown tier: WOOD"));

        mockMvc.perform(post("/internal/ranks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"viewerId\":\"p\",\"displayName\":\"n\",\"tier\":\"WOOD\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    @DisplayName("deleting an unknown viewer is 404")
    void deleteUnknown() throws Exception {
        doThrow(new NoSuchElementException("No rank stored for x")).when(rankService).delete("x");

        mockMvc.perform(delete("/internal/ranks/x"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /internal/viewers records a view")
    void recordView() throws Exception {
        when(viewerSessionService.recordView("somechannel", "puuid-1")).thenReturn(true);

        mockMvc.perform(post("/internal/viewers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channel\":\"somechannel\",\"viewerId\":\"puuid-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recorded").value(true));
    }
}
