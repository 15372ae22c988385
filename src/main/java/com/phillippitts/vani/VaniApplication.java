package com.phillippitts.vani;

import com.phillippitts.vani.config.properties.AssistantProperties;
import com.phillippitts.vani.config.properties.ContextProperties;
import com.phillippitts.vani.config.properties.ResourceProperties;
import com.phillippitts.vani.config.properties.SpeechExecutorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AssistantProperties.class,
        ContextProperties.class,
        ResourceProperties.class,
        SpeechExecutorProperties.class
})
public class VaniApplication {

    public static void main(String[] args) {
        SpringApplication.run(VaniApplication.class, args);
    }

}
