package villagecompute.pipelinecontrol.services;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.Optional;
import java.util.TimeZone;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;
import org.quartz.CronExpression;

import villagecompute.pipelinecontrol.exceptions.ValidationException;

/**
 * Cron arithmetic for pipeline definitions. Expressions use Quartz syntax (seconds first, {@code ?} for the unused
 * day field) and are evaluated in the definition's time zone.
 */
@ApplicationScoped
public class PipelineScheduleCalculator {

    private static final Logger LOG = Logger.getLogger(PipelineScheduleCalculator.class);

    /**
     * Upper bound on fire times walked when catching up a schedule that missed many ticks.
     */
    static final int MAX_CATCH_UP_STEPS = 10_000;

    /**
     * @return the first fire time strictly after {@code after}, or null if the expression never fires again
     * @throws ValidationException
     *             if the expression or the time zone is invalid
     */
    public Instant nextRunTime(String cronExpression, String timezone, Instant after) {
        Date next = parse(cronExpression, timezone).getNextValidTimeAfter(Date.from(after));
        return next != null ? next.toInstant() : null;
    }

    /**
     * Finds the most recent fire time in {@code (after, now]}. Missed ticks collapse into this one fire time.
     *
     * @return the latest due fire time, or empty if nothing fired since {@code after}
     */
    public Optional<Instant> latestDueFireTime(String cronExpression, String timezone, Instant after, Instant now) {
        CronExpression cron = parse(cronExpression, timezone);
        Date nowDate = Date.from(now);
        Date candidate = cron.getNextValidTimeAfter(Date.from(after));
        if (candidate == null || candidate.after(nowDate)) {
            return Optional.empty();
        }
        for (int step = 0; step < MAX_CATCH_UP_STEPS; step++) {
            Date following = cron.getNextValidTimeAfter(candidate);
            if (following == null || following.after(nowDate)) {
                return Optional.of(candidate.toInstant());
            }
            candidate = following;
        }
        LOG.warnf("Cron '%s' missed more than %d fire times since %s, using %s", cronExpression, MAX_CATCH_UP_STEPS,
                after, candidate.toInstant());
        return Optional.of(candidate.toInstant());
    }

    public boolean isValid(String cronExpression, String timezone) {
        try {
            parse(cronExpression, timezone);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    private static CronExpression parse(String cronExpression, String timezone) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new ValidationException("Cron expression is required");
        }
        CronExpression cron;
        try {
            cron = new CronExpression(cronExpression.trim());
        } catch (ParseException e) {
            throw new ValidationException("Invalid cron expression '" + cronExpression + "': " + e.getMessage(), e);
        }
        try {
            ZoneId zone = timezone == null || timezone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(timezone);
            cron.setTimeZone(TimeZone.getTimeZone(zone));
        } catch (DateTimeException e) {
            throw new ValidationException("Invalid time zone '" + timezone + "'", e);
        }
        return cron;
    }
}
