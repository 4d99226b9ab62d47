package com.phillippitts.glasscast;

import com.phillippitts.glasscast.service.session.MediaSessionControllerFactory;
import com.phillippitts.glasscast.service.source.FrameSource;
import com.phillippitts.glasscast.service.source.MockDeviceFrameSource;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@ActiveProfiles("test")
@SpringBootTest
class GlassCastApplicationTests {

    @Autowired
    private FrameSource frameSource;

    @Autowired
    private MediaSessionControllerFactory controllerFactory;

    @Test
    void contextLoadsWithMockDevice() {
        assertThat(frameSource).isInstanceOf(MockDeviceFrameSource.class);
        assertThat(controllerFactory).isNotNull();
    }
}
