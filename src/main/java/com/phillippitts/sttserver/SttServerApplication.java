package com.phillippitts.sttserver;

import com.phillippitts.sttserver.config.stt.SttServerProperties;
import com.phillippitts.sttserver.config.stt.VoskConfig;
import com.phillippitts.sttserver.config.stt.WhisperConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        SttServerProperties.class,
        VoskConfig.class,
        WhisperConfig.class
})
public class SttServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(SttServerApplication.class, args);
    }

}
