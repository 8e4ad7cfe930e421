package com.phillippitts.voicebridge;

import com.phillippitts.voicebridge.config.properties.AudioValidationProperties;
import com.phillippitts.voicebridge.config.properties.BridgeProperties;
import com.phillippitts.voicebridge.config.properties.BrokerProperties;
import com.phillippitts.voicebridge.config.properties.PiperEndpointConfig;
import com.phillippitts.voicebridge.config.properties.WhisperEndpointConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        BridgeProperties.class,
        BrokerProperties.class,
        WhisperEndpointConfig.class,
        PiperEndpointConfig.class,
        AudioValidationProperties.class
})
@EnableScheduling
public class VoiceBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceBridgeApplication.class, args);
    }

}
