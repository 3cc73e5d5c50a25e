package dev.resumeranker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class ResumeRankerApplication implements CommandLineRunner {

    private final PipelineRunner pipelineRunner;
    private final ExitManager exitManager;

    public static void main(String[] args) {
        SpringApplication.run(ResumeRankerApplication.class, args);
    }

    @Override
    public void run(String... args) {
        try {
            int ranked = pipelineRunner.execute();
            log.info("Resume Ranker exiting ({} candidates ranked)...", ranked);
            exitManager.exit(0);
        } catch (Exception e) {
            log.error("Resume Ranker failed: {}", e.getMessage(), e);
            exitManager.exit(1);
        }
    }
}
