package quest.gekko.rankboard.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import quest.gekko.rankboard.service.core.RankService;
import quest.gekko.rankboard.web.dto.ViewerRankDTO;

@RestController
@RequiredArgsConstructor
public class RankController {
    private final RankService rankService;

    @GetMapping("/api/ranks/{username}")
    public ViewerRankDTO rank(@PathVariable String username) {
        return rankService.findEffectiveRank(username)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No rank for " + username));
    }
}
