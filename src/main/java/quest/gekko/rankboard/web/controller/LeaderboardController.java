package quest.gekko.rankboard.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.rankboard.service.core.LeaderboardService;
import quest.gekko.rankboard.web.dto.LeaderboardPageDTO;

@RestController
@RequiredArgsConstructor
public class LeaderboardController {
    private final LeaderboardService leaderboardService;

    @GetMapping("/leaderboard")
    public LeaderboardPageDTO leaderboard(@RequestParam(defaultValue = "50") int limit,
                                          @RequestParam(defaultValue = "0") int offset) {
        return leaderboardService.leaderboard(limit, offset);
    }
}
