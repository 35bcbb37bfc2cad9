package catalogwatch.scheduling;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Once a day at a fixed local time.
 */
public class DailyRunSchedule implements RunSchedule {
    private final LocalTime runTime;
    private final ZoneId zone;

    public DailyRunSchedule(LocalTime runTime, ZoneId zone) {
        this.runTime = runTime;
        this.zone = zone;
    }

    @Override
    public Instant nextRunAt(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        ZonedDateTime candidate = local.toLocalDate().atTime(runTime).atZone(zone);
        if (!candidate.isAfter(local)) {
            candidate = local.toLocalDate().plusDays(1).atTime(runTime).atZone(zone);
        }
        return candidate.toInstant();
    }

    @Override
    public String toString() {
        return "daily at " + runTime + " " + zone;
    }
}
