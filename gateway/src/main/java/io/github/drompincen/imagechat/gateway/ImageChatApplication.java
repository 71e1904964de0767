package io.github.drompincen.imagechat.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.imagechat")
@EnableMongoRepositories(basePackages = "io.github.drompincen.imagechat.persistence.repository")
@ConfigurationPropertiesScan("io.github.drompincen.imagechat")
@EnableScheduling
public class ImageChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImageChatApplication.class, args);
    }
}
