package com.phillippitts.glasscast.service.health;

import com.phillippitts.glasscast.domain.MediaSessionState.Phase;
import com.phillippitts.glasscast.service.session.MediaSessionController;
import com.phillippitts.glasscast.service.session.MediaSessionControllerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

/**
 * Health indicator for live media sessions.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: no controller is in ERROR (including when there are none)</li>
 *   <li>DEGRADED: some, but not all, controllers are in ERROR</li>
 *   <li>DOWN: every live controller is in ERROR</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class MediaSessionHealthIndicator implements HealthIndicator {

    private final MediaSessionControllerFactory factory;

    public MediaSessionHealthIndicator(MediaSessionControllerFactory factory) {
        this.factory = factory;
    }

    @Override
    public Health health() {
        Collection<MediaSessionController> controllers = factory.controllers();
        Map<String, String> sessions = new TreeMap<>();
        long failed = 0;
        for (MediaSessionController controller : controllers) {
            sessions.put(controller.getId(), controller.getMode() + " " + controller.getState());
            if (controller.getState().phase() == Phase.ERROR) {
                failed++;
            }
        }

        Health.Builder builder = new Health.Builder();
        if (failed == 0) {
            builder.up().withDetail("status", "No session in error");
        } else if (failed < controllers.size()) {
            builder.status("DEGRADED").withDetail("status", failed + " of " + controllers.size() + " sessions in error");
        } else {
            builder.down().withDetail("status", "All sessions in error");
        }
        return builder.withDetail("sessions", sessions).build();
    }
}
