package com.phillippitts.glasscast;

import com.phillippitts.glasscast.config.session.PreviewProperties;
import com.phillippitts.glasscast.config.session.SessionProperties;
import com.phillippitts.glasscast.config.source.SourceProperties;
import com.phillippitts.glasscast.config.transport.AudioGatewayProperties;
import com.phillippitts.glasscast.config.transport.RtmpProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        SessionProperties.class,
        PreviewProperties.class,
        SourceProperties.class,
        AudioGatewayProperties.class,
        RtmpProperties.class
})
@EnableScheduling
public class GlassCastApplication {

    public static void main(String[] args) {
        SpringApplication.run(GlassCastApplication.class, args);
    }

}
