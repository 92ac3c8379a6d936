package dev.aparikh.mailindex;

import dev.aparikh.mailindex.config.MailIndexProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MailIndexProperties.class)
public class MailIndexApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailIndexApplication.class, args);
    }
}
