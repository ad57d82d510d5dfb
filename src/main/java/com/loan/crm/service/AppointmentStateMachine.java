package com.loan.crm.service;

import com.loan.crm.entity.AppointmentStatus;
import com.loan.crm.entity.TrackedAppointment;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.loan.crm.entity.AppointmentStatus.CANCELLED;
import static com.loan.crm.entity.AppointmentStatus.DONE;
import static com.loan.crm.entity.AppointmentStatus.MISSED;
import static com.loan.crm.entity.AppointmentStatus.UPCOMING;

/**
 * Appointment lifecycle. Every status write goes through here.
 */
@Component
public class AppointmentStateMachine {

    public enum Actor { ENGINE, AGENT }

    public record StatusTransition(AppointmentStatus from, AppointmentStatus to, boolean applied, String reason) {
    }

    private static final Map<Actor, Map<AppointmentStatus, Set<AppointmentStatus>>> TRANSITIONS = new EnumMap<>(Actor.class);

    static {
        Map<AppointmentStatus, Set<AppointmentStatus>> engine = new EnumMap<>(AppointmentStatus.class);
        engine.put(UPCOMING, EnumSet.of(DONE, MISSED, CANCELLED));
        engine.put(MISSED, EnumSet.of(UPCOMING));
        TRANSITIONS.put(Actor.ENGINE, engine);

        Map<AppointmentStatus, Set<AppointmentStatus>> agent = new EnumMap<>(engine);
        agent.put(MISSED, EnumSet.of(UPCOMING, CANCELLED));
        agent.put(DONE, EnumSet.of(UPCOMING));
        agent.put(CANCELLED, EnumSet.of(UPCOMING));
        TRANSITIONS.put(Actor.AGENT, agent);
    }

    public boolean canTransition(AppointmentStatus from, AppointmentStatus to, Actor actor) {
        return TRANSITIONS.get(actor).getOrDefault(from, Set.of()).contains(to);
    }

    public StatusTransition transition(TrackedAppointment appointment, AppointmentStatus target, Actor actor) {
        AppointmentStatus from = appointment.getStatus();
        if (from == target) {
            return new StatusTransition(from, target, false, "Already " + target.getValue());
        }
        if (!canTransition(from, target, actor)) {
            return new StatusTransition(from, from, false,
                    "Transition " + from.getValue() + " -> " + target.getValue() + " not allowed for " + actor);
        }
        appointment.applyStatus(target);
        return new StatusTransition(from, target, true, null);
    }

    /**
     * upcoming -> missed once {@code thresholdHours} have passed since the start.
     */
    public StatusTransition markMissedIfOverdue(TrackedAppointment appointment, Instant now, double thresholdHours) {
        AppointmentStatus from = appointment.getStatus();
        if (from != UPCOMING) {
            return new StatusTransition(from, from, false, "Not upcoming");
        }
        double hours = hoursBetween(appointment.getStartDatetime(), now);
        if (hours < thresholdHours) {
            return new StatusTransition(from, from, false,
                    String.format("Within threshold (%.2fh of %.2fh)", hours, thresholdHours));
        }
        return transition(appointment, MISSED, Actor.ENGINE);
    }

    /** missed -> upcoming, used when a later row shows the customer did attend. */
    public StatusTransition reopen(TrackedAppointment appointment) {
        return transition(appointment, UPCOMING, Actor.ENGINE);
    }

    public StatusTransition cancel(TrackedAppointment appointment, Actor actor) {
        return transition(appointment, CANCELLED, actor);
    }

    public static double hoursBetween(Instant start, Instant now) {
        return Duration.between(start, now).toMillis() / 3_600_000d;
    }
}
