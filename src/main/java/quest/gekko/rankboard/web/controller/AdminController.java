package quest.gekko.rankboard.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.rankboard.service.core.RankRefreshService;
import quest.gekko.rankboard.service.core.StatsCycleService;

import java.time.LocalDate;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class AdminController {

    private final StatsCycleService statsCycleService;
    private final RankRefreshService refreshService;

    // Manual cycle, optionally re-running a past window
    @PostMapping("/stats/run")
    public StatsCycleService.CycleReport runStats(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return date == null ? statsCycleService.runCycle() : statsCycleService.runCycle(date);
    }

    @PostMapping("/ranks/refresh-stale")
    public RankRefreshService.RefreshReport refreshStale() {
        return refreshService.refreshStale();
    }
}
