package quest.gekko.rankboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RankBoardApplication {
    public static void main(String[] args) {
        SpringApplication.run(RankBoardApplication.class, args);
    }
}
