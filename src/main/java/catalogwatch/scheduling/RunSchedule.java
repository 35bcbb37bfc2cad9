package catalogwatch.scheduling;

import java.time.Instant;

/**
 * When the next change detection cycle is due.
 */
public interface RunSchedule {

    /**
     * @return the first run time strictly after {@code now}
     */
    Instant nextRunAt(Instant now);
}
