package com.phillippitts.mathspeech;

import com.phillippitts.mathspeech.config.properties.CacheProperties;
import com.phillippitts.mathspeech.config.properties.ConversionProperties;
import com.phillippitts.mathspeech.config.properties.RuleProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ConversionProperties.class,
        CacheProperties.class,
        RuleProperties.class
})
@EnableScheduling
public class MathSpeechApplication {

    public static void main(String[] args) {
        SpringApplication.run(MathSpeechApplication.class, args);
    }

}
