package dev.commentguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CommentGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommentGuardApplication.class, args);
    }
}
