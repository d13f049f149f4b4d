package com.phillippitts.speaktoavatar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        com.phillippitts.speaktoavatar.config.properties.TtsProperties.class,
        com.phillippitts.speaktoavatar.config.properties.SttProperties.class,
        com.phillippitts.speaktoavatar.config.properties.AvatarProperties.class,
        com.phillippitts.speaktoavatar.config.properties.CoordinatorProperties.class,
        com.phillippitts.speaktoavatar.config.properties.PipelineProperties.class,
        com.phillippitts.speaktoavatar.config.properties.LlmProperties.class
})
@EnableScheduling
public class SpeakToAvatarApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeakToAvatarApplication.class, args);
    }

}
