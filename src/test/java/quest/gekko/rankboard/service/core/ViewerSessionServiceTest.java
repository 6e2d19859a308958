package quest.gekko.rankboard.service.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.rankboard.repository.ChannelViewerDailyRepository;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ViewerSessionService")
class ViewerSessionServiceTest {

    @Mock
    private ChannelViewerDailyRepository viewerRepository;

    @Mock
    private WindowClock windowClock;

    @InjectMocks
    private ViewerSessionService service;

    @Test
    @DisplayName("records the view against the current window, normalising the channel")
    void recordsView() {
        LocalDate day = LocalDate.of(2024, 5, 1);
        when(windowClock.statDate()).thenReturn(day);
        when(viewerRepository.recordView(day, "somechannel", "puuid")).thenReturn(1);

        assertTrue(service.recordView(" SomeChannel ", "puuid"));
    }

    @Test
    @DisplayName("a repeat view in the same window is not new")
    void repeatView() {
        LocalDate day = LocalDate.of(2024, 5, 1);
        when(windowClock.statDate()).thenReturn(day);
        when(viewerRepository.recordView(day, "somechannel", "puuid")).thenReturn(0);

        assertFalse(service.recordView("somechannel", "puuid"));
    }

    @Test
    @DisplayName("rejects names that cannot be channel logins")
    void invalidChannel() {
        assertThrows(IllegalArgumentException.class, () -> service.recordView("no spaces!", "puuid"));
        assertThrows(IllegalArgumentException.class, () -> service.recordView("ab", "puuid"));
        verifyNoInteractions(viewerRepository);
    }
}
