package quest.gekko.rankboard.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import quest.gekko.rankboard.service.core.LeaderboardService;
import quest.gekko.rankboard.util.ChannelNames;
import quest.gekko.rankboard.web.dto.ChannelStatsDTO;
import quest.gekko.rankboard.web.dto.TrendPointDTO;

import java.util.List;

@RestController
@RequestMapping("/channel/{name}")
@RequiredArgsConstructor
public class ChannelController {
    private final LeaderboardService leaderboardService;

    @GetMapping("/stats")
    public ChannelStatsDTO stats(@PathVariable String name) {
        String login = login(name);
        return leaderboardService.channelStats(login)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No stats for channel " + login));
    }

    @GetMapping("/trend")
    public List<TrendPointDTO> trend(@PathVariable String name, @RequestParam(defaultValue = "30") int days) {
        return leaderboardService.trend(login(name), days);
    }

    private static String login(String name) {
        return ChannelNames.sanitize(name)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid channel name"));
    }
}
