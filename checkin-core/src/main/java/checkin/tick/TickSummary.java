package checkin.tick;

/**
 * What one tick did.
 *
 * @param eventsCreated      pending events created by the scheduler
 * @param eventsEscalated    events moved to alerted
 * @param level2Escalated    staged escalations raised to level 2
 * @param retriesSucceeded   failed SMS deliveries that went through on retry
 */
public record TickSummary(int eventsCreated, int eventsEscalated, int level2Escalated, int retriesSucceeded) {

    static final TickSummary EMPTY = new TickSummary(0, 0, 0, 0);
}
