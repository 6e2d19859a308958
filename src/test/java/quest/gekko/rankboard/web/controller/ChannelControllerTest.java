package quest.gekko.rankboard.web.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import quest.gekko.rankboard.service.core.LeaderboardService;
import quest.gekko.rankboard.web.dto.ChannelStatsDTO;
import quest.gekko.rankboard.web.dto.LeaderboardEntryDTO;
import quest.gekko.rankboard.web.dto.LeaderboardPageDTO;
import quest.gekko.rankboard.web.exception.GlobalExceptionHandler;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Read API")
class ChannelControllerTest {

    private MockMvc mockMvc;

    @Mock
    private LeaderboardService leaderboardService;

    @InjectMocks
    private ChannelController channelController;

    @InjectMocks
    private LeaderboardController leaderboardController;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(channelController, leaderboardController)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET /channel/{name}/stats lower-cases the name")
    void stats() throws Exception {
        ChannelStatsDTO dto = new ChannelStatsDTO("somechannel", "SomeChannel", 12, 1500.0, "GOLD", "I", 0,
                1400.0, "GOLD", "II", 0, List.of(), true, 3L, LocalDate.of(2024, 5, 1));
        when(leaderboardService.channelStats("somechannel")).thenReturn(Optional.of(dto));

        mockMvc.perform(get("/channel/SomeChannel/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.channel").value("somechannel"))
                .andExpect(jsonPath("$.leaderboardRank").value(3))
                .andExpect(jsonPath("$.eligible").value(true));
    }

    @Test
    @DisplayName("unknown channel is 404")
    void statsNotFound() throws Exception {
        when(leaderboardService.channelStats("nobody")).thenReturn(Optional.empty());

        mockMvc.perform(get("/channel/nobody/stats"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    @DisplayName("invalid channel name is 400")
    void invalidName() throws Exception {
        mockMvc.perform(get("/channel/a-b/stats"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(leaderboardService);
    }

    @Test
    @DisplayName("GET /leaderboard passes paging through")
    void leaderboard() throws Exception {
        LeaderboardPageDTO page = new LeaderboardPageDTO(
                List.of(new LeaderboardEntryDTO(1, "top", "Top", 40, 2900.0, "MASTER", null, 100)), 1, 10, 0, false);
        when(leaderboardService.leaderboard(10, 0)).thenReturn(page);

        mockMvc.perform(get("/leaderboard").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries[0].channel").value("top"))
                .andExpect(jsonPath("$.hasMore").value(false));
    }
}
